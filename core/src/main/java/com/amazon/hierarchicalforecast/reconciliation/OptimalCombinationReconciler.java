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

package com.amazon.hierarchicalforecast.reconciliation;

import java.util.Arrays;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.SingularAggregationException;
import com.amazon.hierarchicalforecast.hierarchy.AggregationMatrix;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Optimal combination by (weighted) least squares. The base forecasts of all
 * nodes are projected onto the coherent subspace spanned by the columns of the
 * summing matrix:
 *
 * <pre>
 * b = (S' W S)^-1 S' W y
 * </pre>
 *
 * and the coherent forecast is {@code S b}. With {@code W = I} this is the
 * ordinary least squares combination ({@code comb}). The weighted variant
 * ({@code wls}) uses the inverse in-sample residual variance of every node, or
 * the inverse number of bottom series below every node when some node has no
 * usable variance.
 * <p>
 * If {@code S' W S} cannot be inverted the Moore-Penrose pseudo-inverse is
 * used when allowed, otherwise the call fails.
 */
@Slf4j
public class OptimalCombinationReconciler implements IReconciler {

    @Getter
    private final boolean weighted;

    @Getter
    private final boolean pseudoInverseFallback;

    public OptimalCombinationReconciler() {
        this(false, true);
    }

    public OptimalCombinationReconciler(boolean weighted, boolean pseudoInverseFallback) {
        this.weighted = weighted;
        this.pseudoInverseFallback = pseudoInverseFallback;
    }

    @Override
    public ReconciliationMethod getMethod() {
        return weighted ? ReconciliationMethod.WEIGHTED_COMBINATION : ReconciliationMethod.OPTIMAL_COMBINATION;
    }

    @Override
    public boolean[] requiredNodes(Hierarchy hierarchy) {
        boolean[] required = new boolean[hierarchy.nodeCount()];
        Arrays.fill(required, true);
        return required;
    }

    @Override
    public CoherentForecastSet reconcile(Hierarchy hierarchy, BaseForecast[] baseForecasts) {
        AggregationMatrix summingMatrix = hierarchy.getSummingMatrix();
        int nodeCount = summingMatrix.getNodeCount();
        int horizon = baseForecasts[0].getHorizon();

        double[][] stacked = new double[nodeCount][];
        for (int i = 0; i < nodeCount; i++) {
            stacked[i] = baseForecasts[i].getPointForecast();
        }
        double[] weights = weights(summingMatrix, baseForecasts);

        RealMatrix s = summingMatrix.toRealMatrix();
        RealMatrix normal = s.transpose().multiply(MatrixUtils.createRealDiagonalMatrix(weights)).multiply(s);
        RealMatrix inverse = invert(normal);

        // b = (S'WS)^-1 S'W y, one step at a time
        double[][] bottom = new double[summingMatrix.getBottomCount()][horizon];
        double[] weightedStep = new double[nodeCount];
        for (int h = 0; h < horizon; h++) {
            for (int i = 0; i < nodeCount; i++) {
                weightedStep[i] = weights[i] * stacked[i][h];
            }
            double[] step = inverse.operate(summingMatrix.transposeMultiply(weightedStep));
            for (int j = 0; j < step.length; j++) {
                bottom[j][h] = step[j];
            }
        }

        for (double[] row : bottom) {
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    throw new SingularAggregationException(
                            "combination produced a non-finite forecast over " + horizon + " steps");
                }
            }
        }
        return CoherentForecastSet.fromBottom(hierarchy, bottom, getMethod());
    }

    /**
     * @return the diagonal of {@code W}
     */
    double[] weights(AggregationMatrix summingMatrix, BaseForecast[] baseForecasts) {
        int nodeCount = summingMatrix.getNodeCount();
        double[] weights = new double[nodeCount];
        if (!weighted) {
            Arrays.fill(weights, 1.0);
            return weights;
        }
        boolean usable = true;
        for (int i = 0; i < nodeCount && usable; i++) {
            double variance = baseForecasts[i].getResidualVariance();
            usable = Double.isFinite(variance) && variance > 0;
            weights[i] = usable ? 1.0 / variance : 0;
        }
        if (!usable) {
            for (int i = 0; i < nodeCount; i++) {
                weights[i] = 1.0 / summingMatrix.getSpan(i);
            }
        }
        return weights;
    }

    RealMatrix invert(RealMatrix normal) {
        DecompositionSolver solver = new LUDecomposition(normal).getSolver();
        if (solver.isNonSingular()) {
            return solver.getInverse();
        }
        if (!pseudoInverseFallback) {
            throw new SingularAggregationException(
                    "S'WS of dimension " + normal.getRowDimension() + " is singular");
        }
        log.warn("S'WS of dimension {} is singular, using the pseudo-inverse", normal.getRowDimension());
        return new SingularValueDecomposition(normal).getSolver().getInverse();
    }
}
