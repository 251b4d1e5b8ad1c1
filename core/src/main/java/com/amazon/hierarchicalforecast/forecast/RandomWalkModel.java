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

import java.util.Arrays;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;

/**
 * The naive forecast: every future value equals the last observation.
 */
public class RandomWalkModel extends AbstractUnivariateModel {

    public RandomWalkModel() {
        this(DEFAULT_INTERVAL_LEVEL);
    }

    public RandomWalkModel(double intervalLevel) {
        super(intervalLevel);
    }

    @Override
    protected Fit fit(double[] series, int horizon) {
        double[] points = new double[horizon];
        Arrays.fill(points, series[series.length - 1]);
        double[] residuals = new double[series.length];
        residuals[0] = Double.NaN;
        for (int t = 1; t < series.length; t++) {
            residuals[t] = series[t] - series[t - 1];
        }
        return new Fit(points, residuals);
    }

    @Override
    public BaseForecastMethod getMethod() {
        return BaseForecastMethod.RANDOM_WALK;
    }
}
