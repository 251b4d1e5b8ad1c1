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

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

/**
 * The boundary to univariate forecasting. Implementations must not keep state
 * between calls so that nodes and folds can be forecast concurrently.
 */
@FunctionalInterface
public interface IBaseForecaster {

    /**
     * Forecasts a single series.
     *
     * @param series  the observed series, oldest first
     * @param horizon number of steps to forecast
     * @param method  the univariate method to use
     * @return point forecasts with intervals and the in-sample residuals
     * @throws com.amazon.hierarchicalforecast.errors.UnsupportedMethodException
     *         if the method is not available
     */
    BaseForecast forecastNode(double[] series, int horizon, BaseForecastMethod method);
}
