/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.hierarchicalforecast.returntypes;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;

/**
 * The independent forecast of one node for one fold: point forecasts with
 * prediction intervals over the horizon, and the in-sample residuals of the
 * fitted model (one per training period, {@code NaN} where the model has no
 * fitted value).
 */
public class BaseForecast {

    private final RangeVector forecast;

    private final double[] residuals;

    @Getter
    private final BaseForecastMethod method;

    public BaseForecast(RangeVector forecast, double[] residuals, BaseForecastMethod method) {
        checkNotNull(forecast, "forecast must not be null");
        checkNotNull(residuals, "residuals must not be null");
        for (double value : forecast.values) {
            checkArgument(Double.isFinite(value), "point forecasts must be finite");
        }
        this.forecast = new RangeVector(forecast);
        this.residuals = Arrays.copyOf(residuals, residuals.length);
        this.method = method;
    }

    /**
     * A forecast without intervals or residuals, useful for externally produced
     * point forecasts.
     *
     * @param pointForecast the point forecasts
     * @return the base forecast
     */
    public static BaseForecast ofPoints(double... pointForecast) {
        return new BaseForecast(new RangeVector(pointForecast), new double[0], null);
    }

    /**
     * @return a copy of the point forecasts in {@code values} with the interval
     *         bounds in {@code upper} and {@code lower}
     */
    public RangeVector getForecast() {
        return new RangeVector(forecast);
    }

    public int getHorizon() {
        return forecast.values.length;
    }

    public double[] getPointForecast() {
        return Arrays.copyOf(forecast.values, forecast.values.length);
    }

    public double getPointForecast(int step) {
        return forecast.values[step];
    }

    public double[] getResiduals() {
        return Arrays.copyOf(residuals, residuals.length);
    }

    /**
     * @return the mean of the squared finite residuals, or {@code NaN} if there
     *         are none
     */
    public double getResidualVariance() {
        double sum = 0;
        int count = 0;
        for (double residual : residuals) {
            if (Double.isFinite(residual)) {
                sum += residual * residual;
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }
}
