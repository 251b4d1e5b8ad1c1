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

import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches cross-validation units and records their outcomes. This is the
 * only layer that turns a failure into a recorded cell: a unit that throws is
 * recorded as failed and its siblings carry on.
 */
@Slf4j
public abstract class AbstractCrossValidationExecutor {

    protected final FoldEvaluator foldEvaluator;

    protected AbstractCrossValidationExecutor(FoldEvaluator foldEvaluator) {
        this.foldEvaluator = checkNotNull(foldEvaluator, "fold evaluator must not be null");
    }

    /**
     * Runs every task and records one outcome per task in the table. Returns when
     * every cell is recorded.
     *
     * @param tasks the units of work
     * @param table the table to record into
     */
    public abstract void execute(List<CrossValidationTask> tasks, ResultTable table);

    /**
     * Evaluates a single unit and records the outcome.
     */
    protected void runUnit(CrossValidationTask task, ResultTable table) {
        FoldResult result;
        try {
            result = foldEvaluator.evaluate(task);
            log.debug("{} fold {} completed", task.getMethodPair(), task.getFold());
        } catch (RuntimeException e) {
            log.warn("{} fold {} failed: {}", task.getMethodPair(), task.getFold(), e.toString());
            result = FoldResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (!table.record(task.getPairIndex(), task.getFold(), result)) {
            log.debug("{} fold {} finished after its cell was recorded", task.getMethodPair(), task.getFold());
        }
    }
}
