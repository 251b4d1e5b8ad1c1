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

package com.amazon.hierarchicalforecast.hierarchy;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The summing matrix {@code S} of a hierarchy, of shape (number of nodes x
 * number of bottom series). Row {@code i} is the 0/1 indicator of the bottom
 * series that add up to node {@code i}; the row of a leaf is one-hot.
 * <p>
 * Because nodes are laid out breadth first, every row is a single contiguous
 * run of ones and the matrix is stored as a (start, length) pair per row. The
 * matrix is immutable and shared by every window of a hierarchy.
 */
public class AggregationMatrix {

    private final int bottomCount;

    private final int[] firstBottom;

    private final int[] span;

    AggregationMatrix(int[] firstBottom, int[] span, int bottomCount) {
        checkArgument(firstBottom.length == span.length, "incorrect lengths");
        for (int i = 0; i < firstBottom.length; i++) {
            checkArgument(span[i] > 0 && firstBottom[i] >= 0 && firstBottom[i] + span[i] <= bottomCount,
                    "incorrect row " + i);
        }
        this.firstBottom = firstBottom;
        this.span = span;
        this.bottomCount = bottomCount;
    }

    static AggregationMatrix fromNodes(HierarchyNode[] nodes, int bottomCount) {
        int[] first = new int[nodes.length];
        int[] length = new int[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            first[i] = nodes[i].getFirstBottom();
            length[i] = nodes[i].getBottomSpan();
        }
        return new AggregationMatrix(first, length, bottomCount);
    }

    public int getNodeCount() {
        return firstBottom.length;
    }

    public int getBottomCount() {
        return bottomCount;
    }

    /**
     * @param node a row of the matrix
     * @return the number of bottom series that add up to the node
     */
    public int getSpan(int node) {
        return span[node];
    }

    public double get(int node, int bottom) {
        checkArgument(bottom >= 0 && bottom < bottomCount, "incorrect bottom index");
        return (bottom >= firstBottom[node] && bottom < firstBottom[node] + span[node]) ? 1.0 : 0.0;
    }

    /**
     * @return a dense copy of the matrix
     */
    public double[][] toArray() {
        double[][] dense = new double[firstBottom.length][bottomCount];
        for (int i = 0; i < firstBottom.length; i++) {
            Arrays.fill(dense[i], firstBottom[i], firstBottom[i] + span[i], 1.0);
        }
        return dense;
    }

    public RealMatrix toRealMatrix() {
        return MatrixUtils.createRealMatrix(toArray());
    }

    /**
     * Computes {@code S b} for a single vector of bottom values.
     *
     * @param bottomValues one value per bottom series
     * @return one value per node
     */
    public double[] multiply(double[] bottomValues) {
        checkArgument(bottomValues.length == bottomCount, "incorrect length of bottom values");
        double[] result = new double[firstBottom.length];
        for (int i = 0; i < firstBottom.length; i++) {
            double sum = 0;
            for (int j = firstBottom[i]; j < firstBottom[i] + span[i]; j++) {
                sum += bottomValues[j];
            }
            result[i] = sum;
        }
        return result;
    }

    /**
     * Computes {@code S B} where every row of {@code B} is a bottom series.
     *
     * @param bottomSeries bottom series x time
     * @return node x time
     */
    public double[][] multiply(double[][] bottomSeries) {
        checkArgument(bottomSeries.length == bottomCount, "incorrect number of bottom series");
        int length = (bottomCount == 0) ? 0 : bottomSeries[0].length;
        double[][] result = new double[firstBottom.length][length];
        for (int i = 0; i < firstBottom.length; i++) {
            for (int j = firstBottom[i]; j < firstBottom[i] + span[i]; j++) {
                checkArgument(bottomSeries[j].length == length, "ragged bottom series");
                for (int t = 0; t < length; t++) {
                    result[i][t] += bottomSeries[j][t];
                }
            }
        }
        return result;
    }

    /**
     * Computes {@code S^T y}.
     *
     * @param nodeValues one value per node
     * @return one value per bottom series
     */
    public double[] transposeMultiply(double[] nodeValues) {
        checkArgument(nodeValues.length == firstBottom.length, "incorrect length of node values");
        double[] result = new double[bottomCount];
        for (int i = 0; i < firstBottom.length; i++) {
            for (int j = firstBottom[i]; j < firstBottom[i] + span[i]; j++) {
                result[j] += nodeValues[i];
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregationMatrix)) {
            return false;
        }
        AggregationMatrix other = (AggregationMatrix) o;
        return bottomCount == other.bottomCount && Arrays.equals(firstBottom, other.firstBottom)
                && Arrays.equals(span, other.span);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * bottomCount + Arrays.hashCode(firstBottom)) + Arrays.hashCode(span);
    }
}
