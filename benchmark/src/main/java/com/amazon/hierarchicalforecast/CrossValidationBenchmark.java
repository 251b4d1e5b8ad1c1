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

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.crossvalidation.CrossValidationScheduler;
import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;
import com.amazon.hierarchicalforecast.testutils.HierarchicalTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class CrossValidationBenchmark {

    public final static int DATA_SIZE = 60;
    public final static int FOLD_COUNT = 10;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        Hierarchy hierarchy;
        List<MethodPair> methodPairs;
        CrossValidationScheduler scheduler;

        @Setup(Level.Trial)
        public void setUp() {
            double[][] data = new HierarchicalTestData().generateTestData(DATA_SIZE, 8, 17);
            hierarchy = Hierarchy.builder().observations(data).groupingSpec(GroupingSpec.parse("2;2,6")).frequency(4)
                    .build();
            methodPairs = ForecastConfig.builder().build().getMethodPairs();
            int threadPoolSize = 4;
            ExecutorContext context = parallelExecutionEnabled ? ExecutorContext.parallel(threadPoolSize)
                    : ExecutorContext.sequential();
            scheduler = new CrossValidationScheduler(context, new ReconciliationEngine(new BaseForecastAdapter(4)));
        }
    }

    @Benchmark
    public ResultTable runCV(BenchmarkState state) {
        return state.scheduler.runCV(state.hierarchy, state.methodPairs, FOLD_COUNT, 4, 4);
    }
}
