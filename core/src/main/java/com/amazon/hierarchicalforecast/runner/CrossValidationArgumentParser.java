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

package com.amazon.hierarchicalforecast.runner;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.ForecastConfig;

/**
 * Adds the rolling-origin options to the common arguments.
 */
public class CrossValidationArgumentParser extends ArgumentParser {

    public static final int DEFAULT_ORIGIN = -1;

    private final IntegerArgument foldCount;
    private final IntegerArgument windowSize;
    private final IntegerArgument origin;
    private final StringArgument levels;
    private final IntegerArgument unitTimeout;

    public CrossValidationArgumentParser(String runnerClass, String runnerDescription) {
        super(runnerClass, runnerDescription);

        foldCount = new IntegerArgument("-k", "--fold-count", "Number of rolling-origin folds.",
                ForecastConfig.DEFAULT_FOLD_COUNT, n -> checkArgument(n > 0, "fold count should be greater than 0"));

        addArgument(foldCount);

        windowSize = new IntegerArgument("-w", "--window-size", "Number of test periods per fold.",
                ForecastConfig.DEFAULT_WINDOW_SIZE, n -> checkArgument(n > 0, "window size should be greater than 0"));

        addArgument(windowSize);

        origin = new IntegerArgument(null, "--origin",
                "Last training period (0-based) before the first fold, or -1 for the latest origin that fits.",
                DEFAULT_ORIGIN, n -> checkArgument(n >= DEFAULT_ORIGIN, "origin should be -1 or non-negative"));

        addArgument(origin);

        levels = new StringArgument("-l", "--levels", "Comma separated levels to evaluate, empty for every level.",
                "", s -> parseLevels(s));

        addArgument(levels);

        unitTimeout = new IntegerArgument(null, "--unit-timeout",
                "Time budget of one (method pair, fold) unit in milliseconds when running on worker threads, "
                        + "0 for none.",
                0, n -> checkArgument(n >= 0, "unit timeout should be non-negative"));

        addArgument(unitTimeout);
    }

    public int getFoldCount() {
        return foldCount.getValue();
    }

    public int getWindowSize() {
        return windowSize.getValue();
    }

    public int getOrigin() {
        return origin.getValue();
    }

    public int[] getLevels() {
        return parseLevels(levels.getValue());
    }

    public long getUnitTimeoutMillis() {
        return unitTimeout.getValue();
    }

    @Override
    public ForecastConfig.Builder toConfigBuilder() {
        ForecastConfig.Builder builder = super.toConfigBuilder().foldCount(getFoldCount()).windowSize(getWindowSize())
                .levelsToEvaluate(getLevels());
        if (getOrigin() != DEFAULT_ORIGIN) {
            builder.origin(getOrigin());
        }
        return builder;
    }

    @Override
    public ExecutorContext getExecutorContext() {
        return super.getExecutorContext().withUnitTimeoutMillis(getUnitTimeoutMillis());
    }

    static int[] parseLevels(String value) {
        return Arrays.stream(value.split(LIST_SEPARATOR)).map(String::trim).filter(s -> !s.isEmpty())
                .mapToInt(Integer::parseInt).toArray();
    }
}
