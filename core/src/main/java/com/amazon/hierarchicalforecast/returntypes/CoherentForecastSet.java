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

package com.amazon.hierarchicalforecast.returntypes;

import static com.amazon.hierarchicalforecast.CommonUtils.approximatelyEqual;
import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.hierarchy.AggregationMatrix;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;

/**
 * A node x horizon matrix of forecasts in which every aggregate equals the sum
 * of its children at every step. Instances are immutable.
 */
public class CoherentForecastSet {

    /**
     * tolerance of the summing invariant, relative to the magnitude of the
     * aggregate
     */
    public static final double COHERENCE_TOLERANCE = 1e-6;

    private final double[][] values;

    @Getter
    private final AggregationMatrix summingMatrix;

    private final int[] nodeLevels;

    private final String[] labels;

    @Getter
    private final ReconciliationMethod method;

    /**
     * Builds the set from bottom-level forecasts, aggregating them through the
     * summing matrix of the hierarchy. The result is coherent by construction.
     *
     * @param hierarchy      the (training) hierarchy
     * @param bottomForecast bottom series x horizon
     * @param method         the method that produced the bottom forecasts
     * @return the coherent set
     */
    public static CoherentForecastSet fromBottom(Hierarchy hierarchy, double[][] bottomForecast,
            ReconciliationMethod method) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        double[][] all = hierarchy.getSummingMatrix().multiply(bottomForecast);
        return new CoherentForecastSet(all, hierarchy.getSummingMatrix(), hierarchy.getNodeLevels(),
                hierarchy.getLabels(), method);
    }

    public CoherentForecastSet(double[][] values, AggregationMatrix summingMatrix, int[] nodeLevels, String[] labels,
            ReconciliationMethod method) {
        checkNotNull(values, "values must not be null");
        checkNotNull(summingMatrix, "summing matrix must not be null");
        checkArgument(values.length == summingMatrix.getNodeCount(), "one row per node is required");
        checkArgument(nodeLevels.length == values.length && labels.length == values.length, "incorrect lengths");
        checkArgument(values.length > 0 && values[0].length > 0, "empty forecast");
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == values[0].length, "ragged forecast");
            for (double value : values[i]) {
                checkArgument(Double.isFinite(value), "forecasts must be finite");
            }
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
        this.summingMatrix = summingMatrix;
        this.nodeLevels = Arrays.copyOf(nodeLevels, nodeLevels.length);
        this.labels = Arrays.copyOf(labels, labels.length);
        this.method = method;
    }

    public int getNodeCount() {
        return values.length;
    }

    public int getHorizon() {
        return values[0].length;
    }

    public double get(int node, int step) {
        return values[node][step];
    }

    public double[] getNodeForecast(int node) {
        return Arrays.copyOf(values[node], values[node].length);
    }

    /**
     * @return node x horizon, a copy
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return copy;
    }

    public int getLevel(int node) {
        return nodeLevels[node];
    }

    public String getLabel(int node) {
        return labels[node];
    }

    /**
     * @return forecasts of the bottom series, bottom series x horizon; the leaves
     *         are the last nodes
     */
    public double[][] getBottomForecast() {
        int bottomCount = summingMatrix.getBottomCount();
        int offset = values.length - bottomCount;
        double[][] bottom = new double[bottomCount][];
        for (int j = 0; j < bottomCount; j++) {
            bottom[j] = Arrays.copyOf(values[offset + j], values[offset + j].length);
        }
        return bottom;
    }

    /**
     * @param tolerance relative tolerance
     * @return true if every node equals the sum of the bottom series below it at
     *         every step
     */
    public boolean isCoherent(double tolerance) {
        double[][] rebuilt = summingMatrix.multiply(getBottomForecast());
        for (int i = 0; i < values.length; i++) {
            for (int h = 0; h < values[i].length; h++) {
                if (!approximatelyEqual(values[i][h], rebuilt[i][h], tolerance)) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isCoherent() {
        return isCoherent(COHERENCE_TOLERANCE);
    }
}
