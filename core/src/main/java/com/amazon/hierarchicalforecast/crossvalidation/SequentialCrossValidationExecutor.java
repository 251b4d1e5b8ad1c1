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

import java.util.List;

/**
 * Runs the units one after the other on the calling thread. Timeouts are not
 * enforced.
 */
public class SequentialCrossValidationExecutor extends AbstractCrossValidationExecutor {

    public SequentialCrossValidationExecutor(FoldEvaluator foldEvaluator) {
        super(foldEvaluator);
    }

    @Override
    public void execute(List<CrossValidationTask> tasks, ResultTable table) {
        tasks.forEach(task -> runUnit(task, table));
    }
}
