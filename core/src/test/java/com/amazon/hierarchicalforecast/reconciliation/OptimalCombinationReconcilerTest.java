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

import static com.amazon.hierarchicalforecast.TestUtils.EPSILON;
import static com.amazon.hierarchicalforecast.TestUtils.lastValueForecasts;
import static com.amazon.hierarchicalforecast.TestUtils.seasonalHierarchy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.SingularAggregationException;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;
import com.amazon.hierarchicalforecast.returntypes.RangeVector;
import com.amazon.hierarchicalforecast.testutils.HierarchicalTestData;

public class OptimalCombinationReconcilerTest {

    private static final Hierarchy PAIR = Hierarchy.build(HierarchicalTestData.columnIndexed(4, 2),
            GroupingSpec.flat(2));

    @Test
    public void testMethods() {
        assertEquals(ReconciliationMethod.OPTIMAL_COMBINATION, new OptimalCombinationReconciler().getMethod());
        assertEquals(ReconciliationMethod.WEIGHTED_COMBINATION,
                new OptimalCombinationReconciler(true, true).getMethod());
    }

    @Test
    public void testOrdinaryLeastSquares() {
        BaseForecast[] base = { BaseForecast.ofPoints(10), BaseForecast.ofPoints(3), BaseForecast.ofPoints(5) };
        CoherentForecastSet result = new OptimalCombinationReconciler().reconcile(PAIR, base);
        // the gap of 2 between the total and the sum of the leaves is split evenly
        assertEquals(28.0 / 3, result.get(0, 0), EPSILON);
        assertEquals(11.0 / 3, result.get(1, 0), EPSILON);
        assertEquals(17.0 / 3, result.get(2, 0), EPSILON);
    }

    @Test
    public void testStructuralWeightsWithoutResiduals() {
        BaseForecast[] base = { BaseForecast.ofPoints(10), BaseForecast.ofPoints(3), BaseForecast.ofPoints(5) };
        CoherentForecastSet result = new OptimalCombinationReconciler(true, true).reconcile(PAIR, base);
        assertEquals(9.0, result.get(0, 0), EPSILON);
        assertEquals(3.5, result.get(1, 0), EPSILON);
        assertEquals(5.5, result.get(2, 0), EPSILON);
    }

    @Test
    public void testResidualVarianceWeights() {
        // the total is known far better than the leaves, so it is nearly kept
        BaseForecast[] base = { withResiduals(10, 0.01), withResiduals(3, 10), withResiduals(5, 10) };
        OptimalCombinationReconciler reconciler = new OptimalCombinationReconciler(true, true);
        double[] weights = reconciler.weights(PAIR.getSummingMatrix(), base);
        assertArrayEquals(new double[] { 100, 0.1, 0.1 }, weights, 1e-6);

        CoherentForecastSet result = reconciler.reconcile(PAIR, base);
        assertEquals(10.0, result.get(0, 0), 1e-2);
        assertEquals(result.get(1, 0) + result.get(2, 0), result.get(0, 0), EPSILON);
        assertEquals(result.get(1, 0) + 2, result.get(2, 0), EPSILON);
    }

    @Test
    public void testCoherentInputIsUnchanged() {
        Hierarchy hierarchy = seasonalHierarchy(20, 17L);
        CoherentForecastSet bottomUp = new BottomUpReconciler().reconcile(hierarchy, lastValueForecasts(hierarchy, 3));
        BaseForecast[] coherent = new BaseForecast[hierarchy.nodeCount()];
        for (int i = 0; i < coherent.length; i++) {
            coherent[i] = BaseForecast.ofPoints(bottomUp.getNodeForecast(i));
        }
        for (OptimalCombinationReconciler reconciler : new OptimalCombinationReconciler[] {
                new OptimalCombinationReconciler(false, true), new OptimalCombinationReconciler(true, true) }) {
            CoherentForecastSet result = reconciler.reconcile(hierarchy, coherent);
            for (int i = 0; i < coherent.length; i++) {
                assertArrayEquals(bottomUp.getNodeForecast(i), result.getNodeForecast(i), 1e-6);
            }
        }
    }

    @Test
    public void testUngroupedIsIdentity() {
        Hierarchy ungrouped = Hierarchy.build(HierarchicalTestData.columnIndexed(6, 3), GroupingSpec.ungrouped());
        BaseForecast[] base = { BaseForecast.ofPoints(1, 2), BaseForecast.ofPoints(3, 4),
                BaseForecast.ofPoints(5, 6) };
        CoherentForecastSet result = new OptimalCombinationReconciler().reconcile(ungrouped, base);
        assertArrayEquals(new double[] { 3, 4 }, result.getNodeForecast(1), EPSILON);
    }

    @Test
    public void testIncoherentBaseForecasts() {
        Hierarchy hierarchy = seasonalHierarchy(24, 23L);
        BaseForecastAdapter adapter = new BaseForecastAdapter(4);
        BaseForecast[] base = new BaseForecast[hierarchy.nodeCount()];
        for (int i = 0; i < base.length; i++) {
            base[i] = adapter.forecastNode(hierarchy.getSeries(i), 4, BaseForecastMethod.ETS);
        }
        assertTrue(new OptimalCombinationReconciler(false, true).reconcile(hierarchy, base).isCoherent());
        assertTrue(new OptimalCombinationReconciler(true, true).reconcile(hierarchy, base).isCoherent());
    }

    @Test
    public void testSingularNormalMatrix() {
        RealMatrix singular = MatrixUtils.createRealMatrix(new double[][] { { 1, 1 }, { 1, 1 } });
        assertThrows(SingularAggregationException.class,
                () -> new OptimalCombinationReconciler(false, false).invert(singular));

        RealMatrix pseudoInverse = new OptimalCombinationReconciler(false, true).invert(singular);
        assertEquals(0.25, pseudoInverse.getEntry(0, 0), EPSILON);
        assertEquals(0.25, pseudoInverse.getEntry(1, 0), EPSILON);
    }

    private static BaseForecast withResiduals(double point, double variance) {
        double residual = Math.sqrt(variance);
        return new BaseForecast(new RangeVector(new double[] { point }), new double[] { residual, -residual },
                BaseForecastMethod.RANDOM_WALK);
    }
}
