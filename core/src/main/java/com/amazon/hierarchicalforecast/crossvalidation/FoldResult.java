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

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;

import lombok.Getter;

/**
 * The recorded outcome of one (method pair, fold) cell. A completed cell holds
 * the MAPE of every forecast step, pooled over the evaluated levels, and the
 * MAPE of every (level, step); values that could not be computed, such as the
 * steps beyond a short test window, are unset. Failed and timed out cells hold
 * only the reason.
 */
public class FoldResult {

    @Getter
    private final CellStatus status;

    private final String failureReason;

    private final int[] levels;

    // step, NaN where unset
    private final double[] pooled;

    // level x step, NaN where unset
    private final double[][] byLevel;

    private FoldResult(CellStatus status, String failureReason, int[] levels, double[] pooled, double[][] byLevel) {
        this.status = status;
        this.failureReason = failureReason;
        this.levels = levels;
        this.pooled = pooled;
        this.byLevel = byLevel;
    }

    /**
     * @param levels  the evaluated levels
     * @param pooled  MAPE by step pooled over the levels, one entry per step of
     *                the horizon, NaN where unset
     * @param byLevel MAPE by level (in the order of {@code levels}) and step, NaN
     *                where unset
     * @return a completed result
     */
    public static FoldResult completed(int[] levels, double[] pooled, double[][] byLevel) {
        checkNotNull(levels, "levels must not be null");
        checkNotNull(pooled, "values must not be null");
        checkArgument(byLevel.length == levels.length, "one row per level is required");
        double[][] copy = new double[byLevel.length][];
        for (int k = 0; k < byLevel.length; k++) {
            checkArgument(byLevel[k].length == pooled.length, "incorrect number of steps");
            copy[k] = Arrays.copyOf(byLevel[k], byLevel[k].length);
        }
        return new FoldResult(CellStatus.COMPLETED, null, Arrays.copyOf(levels, levels.length),
                Arrays.copyOf(pooled, pooled.length), copy);
    }

    public static FoldResult failed(String reason) {
        return new FoldResult(CellStatus.FAILED, reason, new int[0], new double[0], new double[0][]);
    }

    public static FoldResult timedOut(String reason) {
        return new FoldResult(CellStatus.TIMED_OUT, reason, new int[0], new double[0], new double[0][]);
    }

    public boolean isCompleted() {
        return status == CellStatus.COMPLETED;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public int[] getLevels() {
        return Arrays.copyOf(levels, levels.length);
    }

    /**
     * @return number of steps held, zero unless completed
     */
    public int getStepCount() {
        return pooled.length;
    }

    /**
     * @param step forecast step, starting at 1
     * @return the pooled MAPE of that step, if set
     */
    public OptionalDouble get(int step) {
        if (step < 1 || step > pooled.length || Double.isNaN(pooled[step - 1])) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(pooled[step - 1]);
    }

    /**
     * @param level an evaluated level
     * @param step  forecast step, starting at 1
     * @return the MAPE of that level and step, if set
     */
    public OptionalDouble get(int level, int step) {
        for (int k = 0; k < levels.length; k++) {
            if (levels[k] == level) {
                double value = (step < 1 || step > byLevel[k].length) ? Double.NaN : byLevel[k][step - 1];
                return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * @return the pooled values by step, NaN where unset; a copy
     */
    public double[] getValues() {
        return Arrays.copyOf(pooled, pooled.length);
    }

    /**
     * @return values by level and step, NaN where unset; a copy
     */
    public double[][] getLevelValues() {
        double[][] copy = new double[byLevel.length][];
        for (int k = 0; k < byLevel.length; k++) {
            copy[k] = Arrays.copyOf(byLevel[k], byLevel[k].length);
        }
        return copy;
    }
}
