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

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.hierarchicalforecast.accuracy.AccuracyEvaluator;
import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.errors.OutOfRangeException;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;

/**
 * Rolling-origin cross-validation. Fold {@code i}, for {@code i} in
 * {@code 1..foldCount}, trains on the periods {@code 0..origin + i} and tests
 * on the following {@code windowSize} periods, cut short at the end of the
 * data. Every (method pair, fold) unit runs the full pipeline independently;
 * units that fail are recorded as such in the result table and do not stop
 * the others.
 * <p>
 * How the units are dispatched is fixed by the {@link ExecutorContext} given
 * to the constructor.
 */
@Slf4j
public class CrossValidationScheduler {

    @Getter
    private final ExecutorContext executorContext;

    private final ReconciliationEngine engine;

    private final AccuracyEvaluator accuracyEvaluator;

    public CrossValidationScheduler(ExecutorContext executorContext, ReconciliationEngine engine) {
        this(executorContext, engine, new AccuracyEvaluator());
    }

    public CrossValidationScheduler(ExecutorContext executorContext, ReconciliationEngine engine,
            AccuracyEvaluator accuracyEvaluator) {
        checkNotNull(executorContext, "executor context must not be null");
        this.executorContext = executorContext.copy();
        this.executorContext.validate();
        this.engine = checkNotNull(engine, "engine must not be null");
        this.accuracyEvaluator = checkNotNull(accuracyEvaluator, "accuracy evaluator must not be null");
    }

    /**
     * Runs cross-validation from the default origin over every level.
     *
     * @see #defaultOrigin(int, int)
     */
    public ResultTable runCV(Hierarchy hierarchy, List<MethodPair> methodPairs, int foldCount, int windowSize,
            int horizon) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        return runCV(hierarchy, methodPairs, foldCount, windowSize, horizon,
                defaultOrigin(hierarchy.length(), foldCount));
    }

    public ResultTable runCV(Hierarchy hierarchy, ForecastConfig config) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        checkNotNull(config, "config must not be null");
        int origin = config.getOrigin().orElseGet(() -> defaultOrigin(hierarchy.length(), config.getFoldCount()));
        return runCV(hierarchy, config.getMethodPairs(), config.getFoldCount(), config.getWindowSize(),
                config.getHorizon(), origin, config.getLevelsToEvaluate().orElse(new int[0]));
    }

    /**
     * @param hierarchy   the full hierarchy
     * @param methodPairs the distinct method pairs to compare
     * @param foldCount   number of folds
     * @param windowSize  number of test periods per fold
     * @param horizon     number of forecast steps
     * @param origin      last training period before the first fold
     * @param levels      levels to evaluate; none means every level
     * @return the frozen result table
     * @throws OutOfRangeException if the folds do not fit in the data
     */
    public ResultTable runCV(Hierarchy hierarchy, List<MethodPair> methodPairs, int foldCount, int windowSize,
            int horizon, int origin, int... levels) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        checkNotNull(methodPairs, "method pairs must not be null");
        checkArgument(foldCount > 0, "fold count must be positive");
        checkArgument(windowSize > 0, "window size must be positive");
        checkArgument(horizon > 0, "horizon must be positive");
        checkFolds(hierarchy.length(), foldCount, origin);

        FoldEvaluator foldEvaluator = new FoldEvaluator(hierarchy, engine, accuracyEvaluator, horizon, levels);
        ResultTable table = new ResultTable(methodPairs, foldCount, horizon, foldEvaluator.getLevels());
        List<CrossValidationTask> tasks = plan(methodPairs, hierarchy.length(), foldCount, windowSize, origin);

        log.info("cross-validation of {} method pairs over {} folds, {} units", methodPairs.size(), foldCount,
                tasks.size());
        long start = System.currentTimeMillis();
        createExecutor(foldEvaluator).execute(tasks, table);
        table.freeze();
        log.info("cross-validation finished in {} ms, {} failed, {} timed out", System.currentTimeMillis() - start,
                table.count(CellStatus.FAILED), table.count(CellStatus.TIMED_OUT));
        return table;
    }

    /**
     * @return the latest origin at which every fold keeps at least one test
     *         period
     */
    public static int defaultOrigin(int length, int foldCount) {
        return length - 2 - foldCount;
    }

    static void checkFolds(int length, int foldCount, int origin) {
        if (origin < 0 || origin + foldCount > length - 2) {
            throw new OutOfRangeException("origin " + origin + " with " + foldCount + " folds does not fit in "
                    + length + " periods; the last fold must leave at least one test period");
        }
    }

    /**
     * @return one task per (method pair, fold), method pairs varying slowest
     */
    static List<CrossValidationTask> plan(List<MethodPair> methodPairs, int length, int foldCount, int windowSize,
            int origin) {
        List<CrossValidationTask> tasks = new ArrayList<>(methodPairs.size() * foldCount);
        for (int p = 0; p < methodPairs.size(); p++) {
            for (int fold = 1; fold <= foldCount; fold++) {
                int trainingEnd = origin + fold;
                int testEnd = Math.min(trainingEnd + windowSize, length - 1);
                tasks.add(new CrossValidationTask(p, methodPairs.get(p), fold, trainingEnd, trainingEnd + 1, testEnd));
            }
        }
        return tasks;
    }

    AbstractCrossValidationExecutor createExecutor(FoldEvaluator foldEvaluator) {
        if (executorContext.isParallelExecutionEnabled()) {
            return new ParallelCrossValidationExecutor(foldEvaluator, executorContext.getThreadPoolSize(),
                    executorContext.getUnitTimeoutMillis());
        }
        return new SequentialCrossValidationExecutor(foldEvaluator);
    }
}
