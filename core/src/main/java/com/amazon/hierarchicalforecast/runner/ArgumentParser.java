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
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/hierarchicalforecast-core-1.0.jar";
    public static final String LIST_SEPARATOR = ",";

    public static final String TOTAL_GROUPING = "total";

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final BooleanArgument timeColumn;
    private final StringArgument grouping;
    private final IntegerArgument frequency;
    private final IntegerArgument startYear;
    private final IntegerArgument startCycle;
    private final IntegerArgument horizon;
    private final StringArgument reconciliationMethods;
    private final StringArgument baseMethods;
    private final DoubleArgument intervalLevel;
    private final IntegerArgument threads;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row",
                "Set to 'true' if the data contains a header row naming the bottom series.", false);

        addArgument(headerRow);

        timeColumn = new BooleanArgument(null, "--time-column",
                "Set to 'true' if the first column holds the period label rather than a series.", false);

        addArgument(timeColumn);

        grouping = new StringArgument("-g", "--grouping",
                "Child counts per level, levels separated by ';' and parents by ',', e.g. '2;2,6' or '[2, (2,6)]', "
                        + "'none' for no aggregation, or 'total' for a single total over every series.",
                TOTAL_GROUPING, s -> {
                    if (!TOTAL_GROUPING.equalsIgnoreCase(s)) {
                        GroupingSpec.parse(s);
                    }
                });

        addArgument(grouping);

        frequency = new IntegerArgument("-f", "--frequency", "Number of periods per cycle, e.g. 4 for quarterly data.",
                ForecastConfig.DEFAULT_FREQUENCY, n -> checkArgument(n > 0, "frequency should be greater than 0"));

        addArgument(frequency);

        startYear = new IntegerArgument(null, "--start-year", "Year of the first observation.", 1);

        addArgument(startYear);

        startCycle = new IntegerArgument(null, "--start-cycle", "Period within the year of the first observation.",
                ForecastConfig.DEFAULT_START_CYCLE, n -> checkArgument(n > 0, "start cycle should be greater than 0"));

        addArgument(startCycle);

        horizon = new IntegerArgument(null, "--horizon", "Number of periods to forecast.",
                ForecastConfig.DEFAULT_HORIZON, n -> checkArgument(n > 0, "horizon should be greater than 0"));

        addArgument(horizon);

        reconciliationMethods = new StringArgument("-r", "--reconciliation-methods",
                "Comma separated reconciliation methods among bu, tdgsa, tdgsf, tdfp, comb, wls.",
                String.join(LIST_SEPARATOR, codes(ForecastConfig.DEFAULT_RECONCILIATION_METHODS.stream()
                        .map(ReconciliationMethod::getCode).toArray(String[]::new))),
                s -> parseReconciliationMethods(s));

        addArgument(reconciliationMethods);

        baseMethods = new StringArgument("-b", "--base-methods", "Comma separated base methods among arima, ets, rw.",
                String.join(LIST_SEPARATOR, codes(ForecastConfig.DEFAULT_BASE_METHODS.stream()
                        .map(BaseForecastMethod::getCode).toArray(String[]::new))),
                s -> parseBaseMethods(s));

        addArgument(baseMethods);

        intervalLevel = new DoubleArgument(null, "--interval-level", "Coverage of the prediction intervals.",
                ForecastConfig.DEFAULT_INTERVAL_LEVEL,
                x -> checkArgument(x > 0 && x < 1, "interval level should be between 0 and 1"));

        addArgument(intervalLevel);

        threads = new IntegerArgument("-t", "--threads", "Number of worker threads, or 0 to run on the calling thread.",
                0, n -> checkArgument(n >= 0, "threads should be non-negative"));

        addArgument(threads);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    /**
     * @return the user-specified value of the time-column parameter
     */
    public boolean getTimeColumn() {
        return timeColumn.getValue();
    }

    /**
     * @param bottomCount number of series in the input
     * @return the parsed value of the grouping parameter, a single total over
     *         every series when the parameter is {@value #TOTAL_GROUPING}
     */
    public GroupingSpec getGroupingSpec(int bottomCount) {
        if (TOTAL_GROUPING.equalsIgnoreCase(grouping.getValue())) {
            return GroupingSpec.flat(bottomCount);
        }
        return GroupingSpec.parse(grouping.getValue());
    }

    public int getFrequency() {
        return frequency.getValue();
    }

    public int getStartYear() {
        return startYear.getValue();
    }

    public int getStartCycle() {
        return startCycle.getValue();
    }

    public int getHorizon() {
        return horizon.getValue();
    }

    public ReconciliationMethod[] getReconciliationMethods() {
        return parseReconciliationMethods(reconciliationMethods.getValue());
    }

    public BaseForecastMethod[] getBaseMethods() {
        return parseBaseMethods(baseMethods.getValue());
    }

    public double getIntervalLevel() {
        return intervalLevel.getValue();
    }

    /**
     * @return the user-specified number of worker threads, 0 for sequential
     *         execution
     */
    public int getThreads() {
        return threads.getValue();
    }

    /**
     * @return a configuration builder populated from the parsed arguments
     */
    public ForecastConfig.Builder toConfigBuilder() {
        return ForecastConfig.builder().frequency(getFrequency()).startYear(getStartYear())
                .startCycle(getStartCycle()).horizon(getHorizon()).reconciliationMethods(getReconciliationMethods())
                .baseMethods(getBaseMethods()).intervalLevel(getIntervalLevel());
    }

    public ForecastConfig getForecastConfig() {
        return toConfigBuilder().build();
    }

    public ExecutorContext getExecutorContext() {
        return (getThreads() > 0) ? ExecutorContext.parallel(getThreads()) : ExecutorContext.sequential();
    }

    static ReconciliationMethod[] parseReconciliationMethods(String value) {
        return Arrays.stream(codes(value.split(LIST_SEPARATOR))).map(ReconciliationMethod::fromCode)
                .toArray(ReconciliationMethod[]::new);
    }

    static BaseForecastMethod[] parseBaseMethods(String value) {
        return Arrays.stream(codes(value.split(LIST_SEPARATOR))).map(BaseForecastMethod::fromCode)
                .toArray(BaseForecastMethod[]::new);
    }

    private static String[] codes(String[] values) {
        String[] result = Arrays.stream(values).map(String::trim).filter(s -> !s.isEmpty()).toArray(String[]::new);
        checkArgument(result.length > 0, "at least one method is required");
        return result;
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
