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
 * Ways of turning independent per-node forecasts into a coherent set.
 */
public enum ReconciliationMethod {

    /**
     * forecast the leaves and add them up
     */
    BOTTOM_UP("bu"),

    /**
     * forecast the total and split it by the average of the historical
     * proportions of every leaf
     */
    TOP_DOWN_GSA("tdgsa"),

    /**
     * forecast the total and split it by the proportions of the historical
     * averages
     */
    TOP_DOWN_GSF("tdgsf"),

    /**
     * forecast every node and split the total along the forecast proportions of
     * each level
     */
    TOP_DOWN_FP("tdfp"),

    /**
     * forecast every node and project onto the coherent subspace by ordinary
     * least squares
     */
    OPTIMAL_COMBINATION("comb"),

    /**
     * as above, weighting every node by the inverse of its in-sample residual
     * variance
     */
    WEIGHTED_COMBINATION("wls");

    private final String code;

    ReconciliationMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @param code short name such as {@code bu}, or the enum name
     * @return the method
     * @throws UnsupportedMethodException if no method has that name
     */
    public static ReconciliationMethod fromCode(String code) {
        checkNotNull(code, "method code must not be null");
        return Arrays.stream(values())
                .filter(m -> m.code.equalsIgnoreCase(code.trim()) || m.name().equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new UnsupportedMethodException("unsupported reconciliation method: " + code));
    }
}
