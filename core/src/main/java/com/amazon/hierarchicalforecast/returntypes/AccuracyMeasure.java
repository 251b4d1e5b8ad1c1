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

package com.amazon.hierarchicalforecast.returntypes;

import java.util.OptionalDouble;

import lombok.Getter;

/**
 * Accuracy of a set of forecasts over a group of observations, typically the
 * nodes of one level over the forecast horizon.
 */
@Getter
public class AccuracyMeasure {

    /**
     * observations compared
     */
    private final int count;

    /**
     * observations left out of the percentage error because the actual value
     * was zero
     */
    private final int excluded;

    private final double meanAbsoluteError;

    private final double rootMeanSquaredError;

    private final double percentageErrorSum;

    public AccuracyMeasure(int count, int excluded, double meanAbsoluteError, double rootMeanSquaredError,
            double percentageErrorSum) {
        this.count = count;
        this.excluded = excluded;
        this.meanAbsoluteError = meanAbsoluteError;
        this.rootMeanSquaredError = rootMeanSquaredError;
        this.percentageErrorSum = percentageErrorSum;
    }

    /**
     * @return mean absolute percentage error, in percent, over the observations
     *         with a non-zero actual value; empty if there are none
     */
    public OptionalDouble getMeanAbsolutePercentageError() {
        int defined = count - excluded;
        return (defined > 0) ? OptionalDouble.of(100.0 * percentageErrorSum / defined) : OptionalDouble.empty();
    }
}
