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

package com.amazon.hierarchicalforecast.crossvalidation;

import lombok.Data;

import com.amazon.hierarchicalforecast.config.MethodPair;

/**
 * Descriptor of one independent unit of work: a method pair evaluated on one
 * fold. Periods are inclusive indexes into the full hierarchy; training always
 * starts at period 0.
 */
@Data
public class CrossValidationTask {

    private final int pairIndex;

    private final MethodPair methodPair;

    /**
     * fold number, starting at 1
     */
    private final int fold;

    private final int trainingEnd;

    private final int testStart;

    private final int testEnd;

    public int getTestLength() {
        return testEnd - testStart + 1;
    }
}
