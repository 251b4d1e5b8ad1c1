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
import static com.amazon.hierarchicalforecast.TestUtils.LAST_VALUE_FORECASTER;
import static com.amazon.hierarchicalforecast.TestUtils.constantHierarchy;
import static com.amazon.hierarchicalforecast.TestUtils.lastValueForecasts;
import static com.amazon.hierarchicalforecast.TestUtils.seasonalHierarchy;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.UnsupportedMethodException;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.forecast.IBaseForecaster;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

public class ReconciliationEngineTest {

    private IBaseForecaster forecaster;
    private ReconciliationEngine engine;

    @BeforeEach
    public void setUp() {
        forecaster = mock(IBaseForecaster.class);
        when(forecaster.forecastNode(any(), anyInt(), any())).thenAnswer(invocation -> LAST_VALUE_FORECASTER
                .forecastNode(invocation.getArgument(0), invocation.getArgument(1), null));
        engine = new ReconciliationEngine(forecaster);
    }

    @Test
    public void testSupportedMethods() {
        assertThat(engine.getSupportedMethods(), containsInAnyOrder(ReconciliationMethod.values()));
        assertSame(forecaster, engine.getBaseForecaster());
    }

    @Test
    public void testBottomUpForecastsLeavesOnly() {
        Hierarchy hierarchy = constantHierarchy();
        CoherentForecastSet result = engine.forecast(hierarchy, 2, ReconciliationMethod.BOTTOM_UP,
                BaseForecastMethod.RANDOM_WALK);
        assertArrayEquals(new double[] { 80, 80 }, result.getNodeForecast(0), EPSILON);
        verify(forecaster, times(8)).forecastNode(any(), eq(2), eq(BaseForecastMethod.RANDOM_WALK));
    }

    @Test
    public void testTopDownForecastsTotalOnly() {
        Hierarchy hierarchy = seasonalHierarchy(16, 5L);
        engine.forecast(hierarchy, 3, MethodPair.of(ReconciliationMethod.TOP_DOWN_GSA, BaseForecastMethod.ETS));
        verify(forecaster, times(1)).forecastNode(any(), anyInt(), any());
        verify(forecaster).forecastNode(aryEq(hierarchy.getSeries(0)), eq(3), eq(BaseForecastMethod.ETS));
    }

    @Test
    public void testCombinationForecastsAllNodes() {
        Hierarchy hierarchy = seasonalHierarchy(16, 5L);
        engine.forecast(hierarchy, 3, ReconciliationMethod.OPTIMAL_COMBINATION, BaseForecastMethod.ARIMA);
        verify(forecaster, times(hierarchy.nodeCount())).forecastNode(any(), eq(3), eq(BaseForecastMethod.ARIMA));
    }

    @ParameterizedTest
    @EnumSource(ReconciliationMethod.class)
    public void testEveryMethodIsCoherent(ReconciliationMethod method) {
        ReconciliationEngine real = new ReconciliationEngine(new BaseForecastAdapter(4));
        Hierarchy hierarchy = seasonalHierarchy(28, 29L);
        for (BaseForecastMethod base : BaseForecastMethod.values()) {
            CoherentForecastSet result = real.forecast(hierarchy, 4, method, base);
            assertEquals(4, result.getHorizon());
            assertEquals(hierarchy.nodeCount(), result.getNodeCount());
            assertTrue(result.isCoherent());
        }
    }

    @Test
    public void testUnsupportedMethod() {
        ReconciliationEngine bottomUpOnly = new ReconciliationEngine(forecaster, List.of(new BottomUpReconciler()));
        assertThrows(UnsupportedMethodException.class,
                () -> bottomUpOnly.getReconciler(ReconciliationMethod.TOP_DOWN_GSA));
        assertThrows(UnsupportedMethodException.class, () -> bottomUpOnly.forecast(constantHierarchy(), 2,
                ReconciliationMethod.OPTIMAL_COMBINATION, BaseForecastMethod.ETS));
        assertThrows(UnsupportedMethodException.class, () -> engine.getReconciler(null));
    }

    @Test
    public void testDuplicateReconcilers() {
        assertThrows(IllegalArgumentException.class, () -> new ReconciliationEngine(forecaster,
                List.of(new BottomUpReconciler(), new BottomUpReconciler())));
    }

    @Test
    public void testReconcileValidation() {
        Hierarchy hierarchy = constantHierarchy();
        BaseForecast[] base = lastValueForecasts(hierarchy, 2);
        assertThrows(IllegalArgumentException.class,
                () -> engine.reconcile(hierarchy, new BaseForecast[3], ReconciliationMethod.BOTTOM_UP));

        BaseForecast[] missingLeaf = base.clone();
        missingLeaf[5] = null;
        assertThrows(IllegalArgumentException.class,
                () -> engine.reconcile(hierarchy, missingLeaf, ReconciliationMethod.BOTTOM_UP));

        BaseForecast[] ragged = base.clone();
        ragged[4] = BaseForecast.ofPoints(1, 2, 3);
        assertThrows(IllegalArgumentException.class,
                () -> engine.reconcile(hierarchy, ragged, ReconciliationMethod.BOTTOM_UP));

        // aggregates are not read by bottom-up, so they may be missing
        BaseForecast[] leavesOnly = base.clone();
        leavesOnly[0] = null;
        assertEquals(80, engine.reconcile(hierarchy, leavesOnly, ReconciliationMethod.BOTTOM_UP).get(0, 1),
                EPSILON);
    }

    @Test
    public void testIncoherentReconciler() {
        IReconciler broken = mock(IReconciler.class);
        Hierarchy hierarchy = constantHierarchy();
        CoherentForecastSet incoherent = new CoherentForecastSet(new double[hierarchy.nodeCount()][1],
                hierarchy.getSummingMatrix(), hierarchy.getNodeLevels(), hierarchy.getLabels(), null);
        double[][] values = incoherent.toArray();
        values[0][0] = 1;
        CoherentForecastSet shifted = new CoherentForecastSet(values, hierarchy.getSummingMatrix(),
                hierarchy.getNodeLevels(), hierarchy.getLabels(), null);
        when(broken.getMethod()).thenReturn(ReconciliationMethod.BOTTOM_UP);
        boolean[] required = new boolean[hierarchy.nodeCount()];
        required[0] = true;
        when(broken.requiredNodes(hierarchy)).thenReturn(required);
        when(broken.reconcile(any(), any())).thenReturn(shifted);

        ReconciliationEngine brokenEngine = new ReconciliationEngine(forecaster, List.of(broken));
        BaseForecast[] base = new BaseForecast[hierarchy.nodeCount()];
        base[0] = BaseForecast.ofPoints(1);
        assertThrows(IllegalStateException.class,
                () -> brokenEngine.reconcile(hierarchy, base, ReconciliationMethod.BOTTOM_UP));
    }
}
