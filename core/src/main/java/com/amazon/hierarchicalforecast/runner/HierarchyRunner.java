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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;

/**
 * Base of the command-line applications: parses command-line arguments, reads
 * a rectangular table of bottom-level observations from STDIN, builds the
 * hierarchy and writes results to STDOUT. Each line of input is one period;
 * each column is one bottom series, optionally preceded by a period column.
 */
public abstract class HierarchyRunner {

    protected final ArgumentParser argumentParser;
    protected String[] columnNames;
    protected int lineNumber;

    protected HierarchyRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read the observations from an input stream, run the application and write
     * the result to an output stream.
     *
     * @param in  An input stream where observations will be read.
     * @param out An output stream where the results will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        Hierarchy hierarchy = readHierarchy(in);
        process(hierarchy, out);
        out.flush();
    }

    /**
     * Build the hierarchy described by the command-line arguments over the
     * observations of the input stream.
     */
    protected Hierarchy readHierarchy(BufferedReader in) throws IOException {
        int offset = argumentParser.getTimeColumn() ? 1 : 0;
        List<double[]> rows = new ArrayList<>();
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(argumentParser.getDelimiter());

            if (argumentParser.getHeaderRow() && columnNames == null) {
                columnNames = Arrays.stream(values).skip(offset).map(String::trim).toArray(String[]::new);
                continue;
            }

            int width = values.length - offset;
            if (!rows.isEmpty() && width != rows.get(0).length) {
                throw new IllegalArgumentException(String.format(
                        "Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                        rows.get(0).length + offset, values.length));
            }
            double[] row = new double[width];
            for (int j = 0; j < width; j++) {
                row[j] = Double.parseDouble(values[j + offset].trim());
            }
            rows.add(row);
        }

        int bottomCount = rows.isEmpty() ? 0 : rows.get(0).length;
        Hierarchy.Builder builder = Hierarchy.builder().observations(rows.toArray(new double[0][]))
                .groupingSpec(argumentParser.getGroupingSpec(bottomCount)).frequency(argumentParser.getFrequency())
                .startYear(argumentParser.getStartYear()).startCycle(argumentParser.getStartCycle());
        if (columnNames != null) {
            builder.bottomLabels(columnNames);
        }
        return builder.build();
    }

    /**
     * Run the application on the hierarchy and write the results.
     *
     * @param hierarchy The hierarchy built from the input stream.
     * @param out       The output stream where results will be written.
     */
    protected abstract void process(Hierarchy hierarchy, PrintWriter out);

    /**
     * Join values with the user-specified delimiter.
     */
    protected String join(Object... values) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).map(String::valueOf).forEach(joiner::add);
        return joiner.toString();
    }
}
