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

import java.util.Arrays;
import java.util.OptionalDouble;

import lombok.Getter;

import com.amazon.hierarchicalforecast.accuracy.AccuracyEvaluator;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Runs the whole pipeline for one unit of work: slices the training and test
 * windows out of the shared hierarchy, forecasts and reconciles the training
 * window, and scores the result against the test window. Only reads shared
 * state, so any number of units may be evaluated concurrently.
 */
public class FoldEvaluator {

    private final Hierarchy hierarchy;

    private final ReconciliationEngine engine;

    private final AccuracyEvaluator accuracyEvaluator;

    @Getter
    private final int horizon;

    private final int[] levels;

    public FoldEvaluator(Hierarchy hierarchy, ReconciliationEngine engine, AccuracyEvaluator accuracyEvaluator,
            int horizon, int[] levels) {
        this.hierarchy = checkNotNull(hierarchy, "hierarchy must not be null");
        this.engine = checkNotNull(engine, "engine must not be null");
        this.accuracyEvaluator = checkNotNull(accuracyEvaluator, "accuracy evaluator must not be null");
        this.horizon = horizon;
        this.levels = AccuracyEvaluator.resolveLevels(hierarchy, levels);
    }

    public int[] getLevels() {
        return Arrays.copyOf(levels, levels.length);
    }

    /**
     * @param task the unit of work
     * @return the completed result
     * @throws RuntimeException whatever base forecasting or reconciliation
     *                          raises
     */
    public FoldResult evaluate(CrossValidationTask task) {
        Hierarchy training = hierarchy.window(0, task.getTrainingEnd());
        Hierarchy test = hierarchy.window(task.getTestStart(), task.getTestEnd());
        MethodPair pair = task.getMethodPair();
        CoherentForecastSet forecast = engine.forecast(training, horizon, pair);

        double[] pooled = new double[horizon];
        Arrays.fill(pooled, Double.NaN);
        copyInto(accuracyEvaluator.mapeByHorizon(forecast, test, levels), pooled);

        OptionalDouble[][] perLevel = accuracyEvaluator.mapeByLevelAndHorizon(forecast, test, levels);
        double[][] byLevel = new double[levels.length][horizon];
        for (int k = 0; k < levels.length; k++) {
            Arrays.fill(byLevel[k], Double.NaN);
            copyInto(perLevel[k], byLevel[k]);
        }
        return FoldResult.completed(levels, pooled, byLevel);
    }

    private static void copyInto(OptionalDouble[] values, double[] target) {
        for (int h = 0; h < values.length; h++) {
            target[h] = values[h].orElse(Double.NaN);
        }
    }
}
