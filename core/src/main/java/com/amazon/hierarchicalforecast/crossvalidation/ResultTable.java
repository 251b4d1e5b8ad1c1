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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReferenceArray;

import lombok.Getter;

import com.amazon.hierarchicalforecast.config.MethodPair;

/**
 * Accuracy of every (method pair, fold, forecast step) of a cross-validation
 * run. Folds and steps are numbered from 1.
 * <p>
 * Every (method pair, fold) cell is written at most once, through a
 * compare-and-set on its own slot, so concurrent units never contend and a
 * late write cannot overwrite an outcome that was already recorded, such as a
 * timeout. The table is frozen when the run ends; writes are then refused.
 */
public class ResultTable {

    @Getter
    private final List<MethodPair> methodPairs;

    private final Map<MethodPair, Integer> pairIndex;

    @Getter
    private final int foldCount;

    @Getter
    private final int horizon;

    private final int[] levels;

    private final AtomicReferenceArray<FoldResult> cells;

    private volatile boolean frozen;

    public ResultTable(List<MethodPair> methodPairs, int foldCount, int horizon, int[] levels) {
        checkNotNull(methodPairs, "method pairs must not be null");
        checkArgument(!methodPairs.isEmpty(), "at least one method pair is required");
        checkArgument(foldCount > 0, "fold count must be positive");
        checkArgument(horizon > 0, "horizon must be positive");
        checkNotNull(levels, "levels must not be null");
        this.methodPairs = Collections.unmodifiableList(new ArrayList<>(methodPairs));
        this.pairIndex = new HashMap<>();
        for (int i = 0; i < methodPairs.size(); i++) {
            checkArgument(pairIndex.put(methodPairs.get(i), i) == null, "duplicate method pair " + methodPairs.get(i));
        }
        this.foldCount = foldCount;
        this.horizon = horizon;
        this.levels = Arrays.copyOf(levels, levels.length);
        this.cells = new AtomicReferenceArray<>(methodPairs.size() * foldCount);
    }

    public int[] getLevels() {
        return Arrays.copyOf(levels, levels.length);
    }

    /**
     * Records the outcome of a cell if none was recorded yet.
     *
     * @param pairIndex position of the method pair
     * @param fold      fold number, starting at 1
     * @param result    the outcome
     * @return true if this call recorded the outcome, false if the cell was
     *         already set or the table is frozen
     */
    public boolean record(int pairIndex, int fold, FoldResult result) {
        checkNotNull(result, "result must not be null");
        if (frozen) {
            return false;
        }
        return cells.compareAndSet(slot(pairIndex, fold), null, result);
    }

    public boolean record(MethodPair pair, int fold, FoldResult result) {
        return record(indexOf(pair), fold, result);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<FoldResult> getFoldResult(MethodPair pair, int fold) {
        return Optional.ofNullable(cells.get(slot(indexOf(pair), fold)));
    }

    public Optional<CellStatus> getStatus(MethodPair pair, int fold) {
        return getFoldResult(pair, fold).map(FoldResult::getStatus);
    }

    /**
     * @return true if the cell was recorded as failed or timed out
     */
    public boolean isFailed(MethodPair pair, int fold) {
        return getFoldResult(pair, fold).map(r -> !r.isCompleted()).orElse(false);
    }

    public Optional<String> getFailureReason(MethodPair pair, int fold) {
        return getFoldResult(pair, fold).flatMap(FoldResult::getFailureReason);
    }

    /**
     * @return the MAPE of the step pooled over the evaluated levels, if set
     */
    public OptionalDouble get(MethodPair pair, int fold, int step) {
        checkStep(step);
        return getFoldResult(pair, fold).map(r -> r.get(step)).orElse(OptionalDouble.empty());
    }

    /**
     * @return the MAPE of one level at the step, if set
     */
    public OptionalDouble get(MethodPair pair, int fold, int level, int step) {
        checkStep(step);
        return getFoldResult(pair, fold).map(r -> r.get(level, step)).orElse(OptionalDouble.empty());
    }

    /**
     * @return number of cells with the given status
     */
    public int count(CellStatus status) {
        int count = 0;
        for (int i = 0; i < cells.length(); i++) {
            FoldResult result = cells.get(i);
            if (result != null && result.getStatus() == status) {
                ++count;
            }
        }
        return count;
    }

    /**
     * @param pair a method pair
     * @return for every step, the mean over the folds where the value is set
     */
    public OptionalDouble[] averageByHorizon(MethodPair pair) {
        OptionalDouble[] result = new OptionalDouble[horizon];
        for (int step = 1; step <= horizon; step++) {
            double sum = 0;
            int count = 0;
            for (int fold = 1; fold <= foldCount; fold++) {
                OptionalDouble value = get(pair, fold, step);
                if (value.isPresent()) {
                    sum += value.getAsDouble();
                    ++count;
                }
            }
            result[step - 1] = (count > 0) ? OptionalDouble.of(sum / count) : OptionalDouble.empty();
        }
        return result;
    }

    /**
     * @return the mean of every set value of the pair
     */
    public OptionalDouble meanError(MethodPair pair) {
        double sum = 0;
        int count = 0;
        for (int fold = 1; fold <= foldCount; fold++) {
            for (int step = 1; step <= horizon; step++) {
                OptionalDouble value = get(pair, fold, step);
                if (value.isPresent()) {
                    sum += value.getAsDouble();
                    ++count;
                }
            }
        }
        return (count > 0) ? OptionalDouble.of(sum / count) : OptionalDouble.empty();
    }

    /**
     * @return the method pairs from the lowest to the highest mean error; pairs
     *         without any value come last, in their original order
     */
    public List<MethodPair> rankByMeanError() {
        List<MethodPair> ranked = new ArrayList<>(methodPairs);
        ranked.sort(Comparator.comparingDouble(p -> meanError(p).orElse(Double.POSITIVE_INFINITY)));
        return ranked;
    }

    public int indexOf(MethodPair pair) {
        Integer index = pairIndex.get(pair);
        checkArgument(index != null, "unknown method pair " + pair);
        return index;
    }

    private int slot(int pairIndex, int fold) {
        checkArgument(pairIndex >= 0 && pairIndex < methodPairs.size(), "incorrect method pair index " + pairIndex);
        checkArgument(fold >= 1 && fold <= foldCount, "fold must be between 1 and " + foldCount);
        return pairIndex * foldCount + fold - 1;
    }

    private void checkStep(int step) {
        checkArgument(step >= 1 && step <= horizon, "step must be between 1 and " + horizon);
    }
}
