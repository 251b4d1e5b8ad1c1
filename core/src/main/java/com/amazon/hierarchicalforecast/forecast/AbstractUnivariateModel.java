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

package com.amazon.hierarchicalforecast.forecast;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.RangeVector;

/**
 * Common handling of the univariate models: argument checks and normal
 * approximation prediction intervals from the in-sample residuals.
 */
public abstract class AbstractUnivariateModel implements IUnivariateModel {

    public static final double DEFAULT_INTERVAL_LEVEL = 0.95;

    protected final double intervalMultiplier;

    protected AbstractUnivariateModel(double intervalLevel) {
        checkArgument(intervalLevel > 0 && intervalLevel < 1, "interval level must be in (0, 1)");
        this.intervalMultiplier = new NormalDistribution().inverseCumulativeProbability(0.5 + intervalLevel / 2);
    }

    @Override
    public BaseForecast forecast(double[] series, int horizon) {
        checkNotNull(series, "series must not be null");
        checkArgument(series.length > 0, "series must not be empty");
        checkArgument(horizon > 0, "horizon must be positive");
        for (double value : series) {
            checkArgument(Double.isFinite(value), "series must be finite");
        }

        Fit fit = fit(series, horizon);
        RangeVector range = new RangeVector(fit.points);
        double sigma = residualStandardDeviation(fit.residuals);
        for (int step = 0; step < horizon; step++) {
            range.widen(step, intervalMultiplier * sigma * spread(step + 1));
        }
        return new BaseForecast(range, fit.residuals, getMethod());
    }

    /**
     * Growth of the forecast standard deviation with the lead time, relative to
     * the one step ahead value.
     *
     * @param leadTime steps ahead, starting at 1
     * @return the multiplier
     */
    protected double spread(int leadTime) {
        return Math.sqrt(leadTime);
    }

    protected abstract Fit fit(double[] series, int horizon);

    static double residualStandardDeviation(double[] residuals) {
        double sum = 0;
        int count = 0;
        for (double residual : residuals) {
            if (Double.isFinite(residual)) {
                sum += residual * residual;
                ++count;
            }
        }
        return (count == 0) ? 0 : Math.sqrt(sum / count);
    }

    static double sumOfSquares(double[] residuals) {
        double sum = 0;
        for (double residual : residuals) {
            if (Double.isFinite(residual)) {
                sum += residual * residual;
            }
        }
        return sum;
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    static double variance(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double mean = mean(values, 0, values.length);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / (values.length - 1);
    }

    /**
     * Point forecasts and in-sample residuals of a fitted model.
     */
    protected static class Fit {
        final double[] points;
        final double[] residuals;

        protected Fit(double[] points, double[] residuals) {
            this.points = points;
            this.residuals = residuals;
        }
    }
}
