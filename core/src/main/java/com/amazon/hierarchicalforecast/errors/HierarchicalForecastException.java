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

package com.amazon.hierarchicalforecast.errors;

/**
 * Root of the failures raised by hierarchy construction, base forecasting and
 * reconciliation. Only the cross-validation executors turn these into recorded
 * cell failures; every other layer lets them propagate.
 */
public abstract class HierarchicalForecastException extends RuntimeException {

    protected HierarchicalForecastException(String message) {
        super(message);
    }

    protected HierarchicalForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
