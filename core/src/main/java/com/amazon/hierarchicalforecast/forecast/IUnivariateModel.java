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
 * A univariate model that is fitted afresh on every call.
 */
public interface IUnivariateModel {

    BaseForecast forecast(double[] series, int horizon);

    BaseForecastMethod getMethod();
}
