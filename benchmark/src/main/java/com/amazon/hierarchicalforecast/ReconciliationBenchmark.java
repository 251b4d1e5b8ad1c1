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

package com.amazon.hierarchicalforecast;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;
import com.amazon.hierarchicalforecast.testutils.HierarchicalTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ReconciliationBenchmark {

    public final static int DATA_SIZE = 48;
    public final static int HORIZON = 8;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "bu", "tdgsa", "tdfp", "comb", "wls" })
        String method;

        @Param({ "4;2,2,2,2", "10;10,10,10,10,10,10,10,10,10,10" })
        String grouping;

        Hierarchy hierarchy;
        ReconciliationEngine engine;
        BaseForecast[] baseForecasts;
        ReconciliationMethod reconciliationMethod;

        @Setup(Level.Trial)
        public void setUp() {
            GroupingSpec spec = GroupingSpec.parse(grouping);
            int bottomCount = 0;
            int[] leafLevel = spec.getBranching(spec.getDepth() - 2);
            for (int count : leafLevel) {
                bottomCount += count;
            }
            double[][] data = new HierarchicalTestData().generateTestData(DATA_SIZE, bottomCount, 17);
            hierarchy = Hierarchy.builder().observations(data).groupingSpec(spec).frequency(4).build();

            BaseForecastAdapter adapter = new BaseForecastAdapter(4);
            engine = new ReconciliationEngine(adapter);
            reconciliationMethod = ReconciliationMethod.fromCode(method);
            baseForecasts = new BaseForecast[hierarchy.nodeCount()];
            for (int i = 0; i < hierarchy.nodeCount(); i++) {
                baseForecasts[i] = adapter.forecastNode(hierarchy.getSeries(i), HORIZON, BaseForecastMethod.ETS);
            }
        }
    }

    @Benchmark
    public CoherentForecastSet reconcile(BenchmarkState state) {
        return state.engine.reconcile(state.hierarchy, state.baseForecasts, state.reconciliationMethod);
    }

    @Benchmark
    public CoherentForecastSet forecastAndReconcile(BenchmarkState state) {
        return state.engine.forecast(state.hierarchy, HORIZON, state.reconciliationMethod, BaseForecastMethod.ARIMA);
    }
}
