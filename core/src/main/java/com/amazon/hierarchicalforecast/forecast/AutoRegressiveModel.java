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

import java.util.Arrays;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;

/**
 * ARIMA(p, d, 0) with a constant. The series is differenced once if that
 * reduces its variance, the autoregressive order is chosen by AIC up to
 * {@code maxOrder}, and the coefficients are estimated by ordinary least
 * squares on a common sample so that the candidate orders are comparable.
 */
public class AutoRegressiveModel extends AbstractUnivariateModel {

    private final int maxOrder;

    public AutoRegressiveModel(int maxOrder) {
        this(maxOrder, DEFAULT_INTERVAL_LEVEL);
    }

    public AutoRegressiveModel(int maxOrder, double intervalLevel) {
        super(intervalLevel);
        checkArgument(maxOrder >= 0, "maximum order must be non-negative");
        this.maxOrder = maxOrder;
    }

    @Override
    protected Fit fit(double[] series, int horizon) {
        int d = differencingOrder(series);
        double[] working = (d == 1) ? difference(series) : series;

        int limit = Math.max(0, Math.min(maxOrder, (working.length - 2) / 3));
        double[] bestCoefficients = { mean(working, limit, working.length) };
        int bestOrder = 0;
        double bestCriterion = criterion(working, bestCoefficients, 0, limit);
        for (int p = 1; p <= limit; p++) {
            double[] coefficients = estimate(working, p, limit);
            if (coefficients == null) {
                continue;
            }
            double value = criterion(working, coefficients, p, limit);
            if (value < bestCriterion) {
                bestCriterion = value;
                bestCoefficients = coefficients;
                bestOrder = p;
            }
        }
        if (bestOrder == 0) {
            // the constant of the mean model uses the whole sample
            bestCoefficients = new double[] { mean(working, 0, working.length) };
        }

        double[] residuals = new double[series.length];
        Arrays.fill(residuals, Double.NaN);
        for (int t = bestOrder; t < working.length; t++) {
            residuals[t + d] = working[t] - predict(working, bestCoefficients, bestOrder, t);
        }

        double[] extended = Arrays.copyOf(working, working.length + horizon);
        for (int k = 0; k < horizon; k++) {
            int t = working.length + k;
            extended[t] = predict(extended, bestCoefficients, bestOrder, t);
        }
        double[] points = new double[horizon];
        double last = series[series.length - 1];
        for (int k = 0; k < horizon; k++) {
            double step = extended[working.length + k];
            last = (d == 1) ? last + step : step;
            points[k] = last;
        }
        return new Fit(points, residuals);
    }

    static int differencingOrder(double[] series) {
        if (series.length < 3) {
            return 0;
        }
        return (variance(difference(series)) < variance(series)) ? 1 : 0;
    }

    static double[] difference(double[] series) {
        double[] result = new double[series.length - 1];
        for (int t = 1; t < series.length; t++) {
            result[t - 1] = series[t] - series[t - 1];
        }
        return result;
    }

    /**
     * @return the constant followed by the p lag coefficients, or null if the
     *         design is singular
     */
    static double[] estimate(double[] working, int p, int start) {
        int rows = working.length - start;
        double[] y = new double[rows];
        double[][] x = new double[rows][p];
        for (int r = 0; r < rows; r++) {
            int t = start + r;
            y[r] = working[t];
            for (int lag = 1; lag <= p; lag++) {
                x[r][lag - 1] = working[t - lag];
            }
        }
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        try {
            regression.newSampleData(y, x);
            double[] coefficients = regression.estimateRegressionParameters();
            for (double coefficient : coefficients) {
                if (!Double.isFinite(coefficient)) {
                    return null;
                }
            }
            return coefficients;
        } catch (MathIllegalArgumentException e) {
            // rank deficient lags, the order is not identifiable on this sample
            return null;
        }
    }

    static double predict(double[] values, double[] coefficients, int p, int t) {
        double result = coefficients[0];
        for (int lag = 1; lag <= p; lag++) {
            result += coefficients[lag] * values[t - lag];
        }
        return result;
    }

    static double criterion(double[] working, double[] coefficients, int p, int start) {
        int count = working.length - start;
        double sse = 0;
        for (int t = start; t < working.length; t++) {
            double error = working[t] - predict(working, coefficients, p, t);
            sse += error * error;
        }
        if (sse <= 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return count * Math.log(sse / count) + 2.0 * (p + 1);
    }

    @Override
    public BaseForecastMethod getMethod() {
        return BaseForecastMethod.ARIMA;
    }
}
