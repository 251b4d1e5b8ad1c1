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

package com.amazon.hierarchicalforecast.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates tables of bottom-level observations, one row per period and one
 * column per bottom series. Every series is a positive level with a linear
 * trend, an additive seasonal pattern and Gaussian noise; levels differ across
 * series so that the historical proportions are not uniform.
 */
public class HierarchicalTestData {

    private final double baseLevel;
    private final double trend;
    private final double seasonalAmplitude;
    private final double noiseSigma;
    private final int period;

    public HierarchicalTestData(double baseLevel, double trend, double seasonalAmplitude, double noiseSigma,
            int period) {
        this.baseLevel = baseLevel;
        this.trend = trend;
        this.seasonalAmplitude = seasonalAmplitude;
        this.noiseSigma = noiseSigma;
        this.period = period;
    }

    /**
     * Quarterly series around 100 with a mild trend and seasonality.
     */
    public HierarchicalTestData() {
        this(100.0, 0.5, 10.0, 2.0, 4);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns) {
        return generateTestData(numberOfRows, numberOfColumns, 0);
    }

    /**
     * @param numberOfRows    periods
     * @param numberOfColumns bottom series
     * @param seed            random seed, 0 for an unseeded generator
     * @return periods x bottom series
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        Random random = (seed != 0) ? new Random(seed) : new Random();
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (int j = 0; j < numberOfColumns; j++) {
            double level = baseLevel * (1 + 0.25 * j);
            double phase = 2 * Math.PI * j / Math.max(1, numberOfColumns);
            for (int t = 0; t < numberOfRows; t++) {
                double seasonal = seasonalAmplitude * Math.sin(2 * Math.PI * t / period + phase);
                double value = level + trend * t + seasonal + noiseSigma * random.nextGaussian();
                // keep observations strictly positive so that percentage errors are defined
                result[t][j] = Math.max(value, 1.0);
            }
        }
        return result;
    }

    /**
     * @return a table in which every observation equals {@code value}
     */
    public static double[][] constant(int numberOfRows, int numberOfColumns, double value) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (double[] row : result) {
            Arrays.fill(row, value);
        }
        return result;
    }

    /**
     * @return a table in which column {@code j} equals {@code j + 1} at every
     *         period
     */
    public static double[][] columnIndexed(int numberOfRows, int numberOfColumns) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (double[] row : result) {
            for (int j = 0; j < numberOfColumns; j++) {
                row[j] = j + 1;
            }
        }
        return result;
    }
}
