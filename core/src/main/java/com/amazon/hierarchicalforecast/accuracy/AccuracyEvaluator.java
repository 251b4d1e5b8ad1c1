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

package com.amazon.hierarchicalforecast.accuracy;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.AccuracyMeasure;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Compares a coherent forecast set with the held-out actuals of a test
 * hierarchy, level by level. Only the first {@code min(horizon, test length)}
 * steps are compared. Observations with a zero actual value cannot contribute
 * a percentage error; they are left out of the mean and counted as excluded.
 */
public class AccuracyEvaluator {

    /**
     * @param forecast the coherent forecast
     * @param actual   the test hierarchy, starting at the first forecast period
     * @param levels   depths to evaluate; none means every level
     * @return MAPE in percent by level, for the levels where it is defined
     */
    public Map<Integer, Double> accuracy(CoherentForecastSet forecast, Hierarchy actual, int... levels) {
        Map<Integer, Double> result = new TreeMap<>();
        measure(forecast, actual, levels).forEach((level, measure) -> measure.getMeanAbsolutePercentageError()
                .ifPresent(value -> result.put(level, value)));
        return result;
    }

    /**
     * @return every accuracy measure by level
     */
    public Map<Integer, AccuracyMeasure> measure(CoherentForecastSet forecast, Hierarchy actual, int... levels) {
        int steps = comparableSteps(forecast, actual);
        Map<Integer, AccuracyMeasure> result = new TreeMap<>();
        for (int level : resolveLevels(actual, levels)) {
            result.put(level, accumulate(forecast, actual, actual.nodesAtLevel(level), 0, steps));
        }
        return result;
    }

    /**
     * @return MAPE of every comparable step, pooled over the nodes of the
     *         requested levels; empty where no actual value is non-zero
     */
    public OptionalDouble[] mapeByHorizon(CoherentForecastSet forecast, Hierarchy actual, int... levels) {
        int steps = comparableSteps(forecast, actual);
        int[] resolved = resolveLevels(actual, levels);
        OptionalDouble[] result = new OptionalDouble[steps];
        for (int h = 0; h < steps; h++) {
            int count = 0;
            int excluded = 0;
            double sum = 0;
            for (int level : resolved) {
                AccuracyMeasure measure = accumulate(forecast, actual, actual.nodesAtLevel(level), h, h + 1);
                count += measure.getCount();
                excluded += measure.getExcluded();
                sum += measure.getPercentageErrorSum();
            }
            result[h] = (count > excluded) ? OptionalDouble.of(100.0 * sum / (count - excluded))
                    : OptionalDouble.empty();
        }
        return result;
    }

    /**
     * @return MAPE by level and comparable step, level x step, for the
     *         requested levels in the given order
     */
    public OptionalDouble[][] mapeByLevelAndHorizon(CoherentForecastSet forecast, Hierarchy actual, int... levels) {
        int steps = comparableSteps(forecast, actual);
        int[] resolved = resolveLevels(actual, levels);
        OptionalDouble[][] result = new OptionalDouble[resolved.length][steps];
        for (int k = 0; k < resolved.length; k++) {
            int[] nodes = actual.nodesAtLevel(resolved[k]);
            for (int h = 0; h < steps; h++) {
                result[k][h] = accumulate(forecast, actual, nodes, h, h + 1).getMeanAbsolutePercentageError();
            }
        }
        return result;
    }

    static int comparableSteps(CoherentForecastSet forecast, Hierarchy actual) {
        checkNotNull(forecast, "forecast must not be null");
        checkNotNull(actual, "actuals must not be null");
        checkArgument(forecast.getSummingMatrix().equals(actual.getSummingMatrix()),
                "forecast and actuals have different structures");
        return Math.min(forecast.getHorizon(), actual.length());
    }

    /**
     * @param actual a hierarchy
     * @param levels requested depths, possibly none
     * @return the requested depths, or every depth of the hierarchy
     */
    public static int[] resolveLevels(Hierarchy actual, int... levels) {
        if (levels == null || levels.length == 0) {
            int[] all = new int[actual.getDepth()];
            for (int k = 0; k < all.length; k++) {
                all[k] = k;
            }
            return all;
        }
        for (int level : levels) {
            checkArgument(level >= 0 && level < actual.getDepth(),
                    "level " + level + " is not in a hierarchy of depth " + actual.getDepth());
        }
        return levels.clone();
    }

    static AccuracyMeasure accumulate(CoherentForecastSet forecast, Hierarchy actual, int[] nodes, int fromStep,
            int toStep) {
        int count = 0;
        int excluded = 0;
        double absolute = 0;
        double squared = 0;
        double percentage = 0;
        for (int node : nodes) {
            for (int h = fromStep; h < toStep; h++) {
                double observed = actual.getValue(node, h);
                double error = Math.abs(observed - forecast.get(node, h));
                ++count;
                absolute += error;
                squared += error * error;
                if (observed == 0) {
                    ++excluded;
                } else {
                    percentage += error / Math.abs(observed);
                }
            }
        }
        double mae = (count == 0) ? Double.NaN : absolute / count;
        double rmse = (count == 0) ? Double.NaN : Math.sqrt(squared / count);
        return new AccuracyMeasure(count, excluded, mae, rmse, percentage);
    }
}
