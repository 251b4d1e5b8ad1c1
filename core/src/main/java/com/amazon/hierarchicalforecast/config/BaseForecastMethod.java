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

package com.amazon.hierarchicalforecast.config;

import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.hierarchicalforecast.errors.UnsupportedMethodException;

/**
 * Univariate methods used to produce the independent (base) forecast of a
 * single node.
 */
public enum BaseForecastMethod {

    /**
     * autoregressive integrated moving average; the built-in model fits the
     * autoregressive part after differencing
     */
    ARIMA("arima"),

    /**
     * exponential smoothing, simple, with trend, or with additive seasonality
     * depending on the data available
     */
    ETS("ets"),

    /**
     * naive random walk, the last observation carried forward
     */
    RANDOM_WALK("rw");

    private final String code;

    BaseForecastMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @param code short name such as {@code arima}, or the enum name
     * @return the method
     * @throws UnsupportedMethodException if no method has that name
     */
    public static BaseForecastMethod fromCode(String code) {
        checkNotNull(code, "method code must not be null");
        return Arrays.stream(values())
                .filter(m -> m.code.equalsIgnoreCase(code.trim()) || m.name().equalsIgnoreCase(code.trim()))
                .findFirst().orElseThrow(() -> new UnsupportedMethodException("unsupported base method: " + code));
    }
}
