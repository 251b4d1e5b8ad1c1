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

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;

/**
 * Exponential smoothing with the richest form the data supports: additive
 * Holt-Winters when at least two full seasons are available, Holt's linear
 * trend when there are at least three observations, and simple exponential
 * smoothing otherwise. Smoothing coefficients are chosen from a fixed grid by
 * the in-sample sum of squared one step ahead errors.
 */
public class ExponentialSmoothingModel extends AbstractUnivariateModel {

    static final double[] GRID = { 0.1, 0.3, 0.5, 0.7, 0.9 };

    private final int period;

    public ExponentialSmoothingModel(int period) {
        this(period, DEFAULT_INTERVAL_LEVEL);
    }

    public ExponentialSmoothingModel(int period, double intervalLevel) {
        super(intervalLevel);
        checkArgument(period > 0, "period must be positive");
        this.period = period;
    }

    @Override
    protected Fit fit(double[] series, int horizon) {
        if (period > 1 && series.length >= 2 * period) {
            return search(series, horizon, true, true);
        } else if (series.length >= 3) {
            return search(series, horizon, true, false);
        }
        return search(series, horizon, false, false);
    }

    Fit search(double[] series, int horizon, boolean trend, boolean seasonal) {
        double[] betas = trend ? GRID : new double[] { 0 };
        double[] gammas = seasonal ? GRID : new double[] { 0 };
        Fit best = null;
        double bestError = Double.MAX_VALUE;
        for (double alpha : GRID) {
            for (double beta : betas) {
                for (double gamma : gammas) {
                    Fit candidate = seasonal ? holtWinters(series, horizon, alpha, beta, gamma)
                            : holt(series, horizon, alpha, beta, trend);
                    double error = sumOfSquares(candidate.residuals);
                    if (best == null || error < bestError) {
                        best = candidate;
                        bestError = error;
                    }
                }
            }
        }
        return best;
    }

    Fit holt(double[] series, int horizon, double alpha, double beta, boolean trend) {
        double[] residuals = new double[series.length];
        residuals[0] = Double.NaN;
        double level = series[0];
        double slope = (trend) ? series[1] - series[0] : 0;
        for (int t = 1; t < series.length; t++) {
            double predicted = level + slope;
            residuals[t] = series[t] - predicted;
            double previous = level;
            level = alpha * series[t] + (1 - alpha) * predicted;
            if (trend) {
                slope = beta * (level - previous) + (1 - beta) * slope;
            }
        }
        double[] points = new double[horizon];
        for (int k = 0; k < horizon; k++) {
            points[k] = level + (k + 1) * slope;
        }
        return new Fit(points, residuals);
    }

    Fit holtWinters(double[] series, int horizon, double alpha, double beta, double gamma) {
        int n = series.length;
        double[] residuals = new double[n];
        Arrays.fill(residuals, 0, period, Double.NaN);

        double level = mean(series, 0, period);
        double slope = (mean(series, period, 2 * period) - level) / period;
        double[] seasonals = new double[n];
        for (int i = 0; i < period; i++) {
            seasonals[i] = series[i] - level;
        }
        for (int t = period; t < n; t++) {
            double predicted = level + slope + seasonals[t - period];
            residuals[t] = series[t] - predicted;
            double previous = level;
            level = alpha * (series[t] - seasonals[t - period]) + (1 - alpha) * (level + slope);
            slope = beta * (level - previous) + (1 - beta) * slope;
            seasonals[t] = gamma * (series[t] - level) + (1 - gamma) * seasonals[t - period];
        }
        double[] points = new double[horizon];
        for (int k = 0; k < horizon; k++) {
            points[k] = level + (k + 1) * slope + seasonals[n - period + (k % period)];
        }
        return new Fit(points, residuals);
    }

    @Override
    public BaseForecastMethod getMethod() {
        return BaseForecastMethod.ETS;
    }
}
