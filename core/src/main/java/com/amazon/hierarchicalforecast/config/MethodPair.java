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

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import lombok.Data;

/**
 * A (reconciliation method, base forecast method) combination, the unit that
 * cross-validation compares.
 */
@Data
public class MethodPair {

    public static final String SEPARATOR = "/";

    private final ReconciliationMethod reconciliationMethod;

    private final BaseForecastMethod baseMethod;

    public MethodPair(ReconciliationMethod reconciliationMethod, BaseForecastMethod baseMethod) {
        this.reconciliationMethod = checkNotNull(reconciliationMethod, "reconciliation method must not be null");
        this.baseMethod = checkNotNull(baseMethod, "base method must not be null");
    }

    public static MethodPair of(ReconciliationMethod reconciliationMethod, BaseForecastMethod baseMethod) {
        return new MethodPair(reconciliationMethod, baseMethod);
    }

    /**
     * @param code the form produced by {@link #getCode()}, such as
     *             {@code comb/arima}
     * @return the pair
     */
    public static MethodPair fromCode(String code) {
        checkNotNull(code, "code must not be null");
        String[] parts = code.split(SEPARATOR);
        checkArgument(parts.length == 2, "expected reconciliation" + SEPARATOR + "base, found " + code);
        return new MethodPair(ReconciliationMethod.fromCode(parts[0]), BaseForecastMethod.fromCode(parts[1]));
    }

    public String getCode() {
        return reconciliationMethod.getCode() + SEPARATOR + baseMethod.getCode();
    }

    @Override
    public String toString() {
        return getCode();
    }
}
