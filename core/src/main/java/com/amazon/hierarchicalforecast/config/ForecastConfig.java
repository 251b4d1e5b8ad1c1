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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

/**
 * The recognized options of a forecasting or cross-validation request.
 */
@Getter
public class ForecastConfig {

    public static final int DEFAULT_FREQUENCY = 4;

    public static final int DEFAULT_START_CYCLE = 1;

    public static final int DEFAULT_HORIZON = 4;

    public static final int DEFAULT_FOLD_COUNT = 10;

    public static final int DEFAULT_WINDOW_SIZE = 4;

    public static final double DEFAULT_INTERVAL_LEVEL = 0.95;

    public static final Set<ReconciliationMethod> DEFAULT_RECONCILIATION_METHODS = Collections.unmodifiableSet(
            EnumSet.of(ReconciliationMethod.BOTTOM_UP, ReconciliationMethod.TOP_DOWN_GSA,
                    ReconciliationMethod.OPTIMAL_COMBINATION));

    public static final Set<BaseForecastMethod> DEFAULT_BASE_METHODS = Collections
            .unmodifiableSet(EnumSet.allOf(BaseForecastMethod.class));

    private final int frequency;

    private final int startYear;

    private final int startCycle;

    private final int horizon;

    private final Set<ReconciliationMethod> reconciliationMethods;

    private final Set<BaseForecastMethod> baseMethods;

    private final int foldCount;

    private final int windowSize;

    /**
     * last training period of the fold before the first one; empty means the
     * latest origin at which every fold still has a test period
     */
    private final Optional<Integer> origin;

    /**
     * depths of the tree to evaluate; empty means every level
     */
    private final Optional<int[]> levelsToEvaluate;

    private final double intervalLevel;

    protected ForecastConfig(Builder builder) {
        this.frequency = builder.frequency;
        this.startYear = builder.startYear;
        this.startCycle = builder.startCycle;
        this.horizon = builder.horizon;
        this.reconciliationMethods = Collections.unmodifiableSet(EnumSet.copyOf(builder.reconciliationMethods));
        this.baseMethods = Collections.unmodifiableSet(EnumSet.copyOf(builder.baseMethods));
        this.foldCount = builder.foldCount;
        this.windowSize = builder.windowSize;
        this.origin = builder.origin;
        this.levelsToEvaluate = builder.levelsToEvaluate.map(l -> Arrays.copyOf(l, l.length));
        this.intervalLevel = builder.intervalLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return every (reconciliation, base) combination, reconciliation methods
     *         varying slowest
     */
    public List<MethodPair> getMethodPairs() {
        List<MethodPair> pairs = new ArrayList<>();
        for (ReconciliationMethod reconciliationMethod : reconciliationMethods) {
            for (BaseForecastMethod baseMethod : baseMethods) {
                pairs.add(MethodPair.of(reconciliationMethod, baseMethod));
            }
        }
        return pairs;
    }

    public Optional<int[]> getLevelsToEvaluate() {
        return levelsToEvaluate.map(l -> Arrays.copyOf(l, l.length));
    }

    public static class Builder {

        private int frequency = DEFAULT_FREQUENCY;
        private int startYear = 1;
        private int startCycle = DEFAULT_START_CYCLE;
        private int horizon = DEFAULT_HORIZON;
        private Set<ReconciliationMethod> reconciliationMethods = EnumSet.copyOf(DEFAULT_RECONCILIATION_METHODS);
        private Set<BaseForecastMethod> baseMethods = EnumSet.copyOf(DEFAULT_BASE_METHODS);
        private int foldCount = DEFAULT_FOLD_COUNT;
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private Optional<Integer> origin = Optional.empty();
        private Optional<int[]> levelsToEvaluate = Optional.empty();
        private double intervalLevel = DEFAULT_INTERVAL_LEVEL;

        Builder() {
        }

        public Builder frequency(int frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder startYear(int startYear) {
            this.startYear = startYear;
            return this;
        }

        public Builder startCycle(int startCycle) {
            this.startCycle = startCycle;
            return this;
        }

        public Builder horizon(int horizon) {
            this.horizon = horizon;
            return this;
        }

        public Builder reconciliationMethods(ReconciliationMethod... methods) {
            checkNotNull(methods, "methods must not be null");
            checkArgument(methods.length > 0, "at least one reconciliation method is required");
            this.reconciliationMethods = EnumSet.copyOf(Arrays.asList(methods));
            return this;
        }

        public Builder baseMethods(BaseForecastMethod... methods) {
            checkNotNull(methods, "methods must not be null");
            checkArgument(methods.length > 0, "at least one base method is required");
            this.baseMethods = EnumSet.copyOf(Arrays.asList(methods));
            return this;
        }

        public Builder foldCount(int foldCount) {
            this.foldCount = foldCount;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder origin(int origin) {
            this.origin = Optional.of(origin);
            return this;
        }

        public Builder levelsToEvaluate(int... levels) {
            checkNotNull(levels, "levels must not be null");
            this.levelsToEvaluate = (levels.length == 0) ? Optional.empty()
                    : Optional.of(Arrays.copyOf(levels, levels.length));
            return this;
        }

        public Builder intervalLevel(double intervalLevel) {
            this.intervalLevel = intervalLevel;
            return this;
        }

        public ForecastConfig build() {
            validate();
            return new ForecastConfig(this);
        }

        protected void validate() {
            checkArgument(frequency > 0, "frequency must be positive");
            checkArgument(startCycle >= 1 && startCycle <= frequency, "start cycle must be between 1 and frequency");
            checkArgument(horizon > 0, "horizon must be positive");
            checkArgument(foldCount > 0, "fold count must be positive");
            checkArgument(windowSize > 0, "window size must be positive");
            origin.ifPresent(o -> checkArgument(o >= 0, "origin must be non-negative"));
            levelsToEvaluate.ifPresent(
                    levels -> Arrays.stream(levels).forEach(l -> checkArgument(l >= 0, "levels must be non-negative")));
            checkArgument(intervalLevel > 0 && intervalLevel < 1, "interval level must be in (0, 1)");
        }
    }
}
