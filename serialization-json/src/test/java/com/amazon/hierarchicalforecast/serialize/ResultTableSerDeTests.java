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

package com.amazon.hierarchicalforecast.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.crossvalidation.CellStatus;
import com.amazon.hierarchicalforecast.crossvalidation.CrossValidationScheduler;
import com.amazon.hierarchicalforecast.crossvalidation.FoldResult;
import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;
import com.amazon.hierarchicalforecast.testutils.HierarchicalTestData;

public class ResultTableSerDeTests {

    private final ResultTableSerDe serializer = new ResultTableSerDe();

    @ParameterizedTest(name = "{index} => grouping={0}, foldCount={1}, windowSize={2}, horizon={3}, threads={4}")
    @CsvSource({ "'2;2,6', 3, 4, 4, 0", "'2;2,6', 5, 2, 4, 2", "8, 4, 4, 2, 0", "'4;2,2,2,2', 6, 3, 3, 3" })
    public void toJsonString(String grouping, int foldCount, int windowSize, int horizon, int threads) {
        GroupingSpec spec = GroupingSpec.parse(grouping);
        Hierarchy hierarchy = Hierarchy.builder().observations(new HierarchicalTestData().generateTestData(28, 8, 0L))
                .groupingSpec(spec).frequency(4).build();
        List<MethodPair> pairs = List.of(MethodPair.fromCode("bu/ets"), MethodPair.fromCode("tdgsa/rw"),
                MethodPair.fromCode("comb/arima"), MethodPair.fromCode("wls/rw"));
        ExecutorContext context = (threads > 0) ? ExecutorContext.parallel(threads) : ExecutorContext.sequential();
        ResultTable table = new CrossValidationScheduler(context,
                new ReconciliationEngine(new BaseForecastAdapter(4))).runCV(hierarchy, pairs, foldCount, windowSize,
                        horizon);

        String json = serializer.toJson(table);
        ResultTable copy = serializer.fromJson(json);

        assertTrue(copy.isFrozen());
        assertEquals(table.getMethodPairs(), copy.getMethodPairs());
        for (MethodPair pair : pairs) {
            for (int fold = 1; fold <= foldCount; fold++) {
                assertEquals(table.getStatus(pair, fold), copy.getStatus(pair, fold));
                for (int step = 1; step <= horizon; step++) {
                    assertEquals(table.get(pair, fold, step), copy.get(pair, fold, step));
                    for (int level : table.getLevels()) {
                        assertEquals(table.get(pair, fold, level, step), copy.get(pair, fold, level, step));
                    }
                }
            }
            assertEquals(table.meanError(pair), copy.meanError(pair));
        }
        assertEquals(table.rankByMeanError(), copy.rankByMeanError());
    }

    @Test
    public void testUnsetAndFailedCells() {
        MethodPair pair = MethodPair.fromCode("tdfp/ets");
        ResultTable table = new ResultTable(List.of(pair), 3, 2, new int[] { 0 });
        table.record(pair, 1, FoldResult.completed(new int[] { 0 }, new double[] { 4.5, Double.NaN },
                new double[][] { { 4.5, Double.NaN } }));
        table.record(pair, 2, FoldResult.failed("DegenerateHierarchyException: zero total"));
        table.freeze();

        String json = serializer.toJson(table);
        assertTrue(json.contains("NaN"));
        ResultTable copy = serializer.fromJson(json);
        assertEquals(4.5, copy.get(pair, 1, 1).getAsDouble());
        assertFalse(copy.get(pair, 1, 2).isPresent());
        assertEquals(CellStatus.FAILED, copy.getStatus(pair, 2).get());
        assertEquals("DegenerateHierarchyException: zero total", copy.getFailureReason(pair, 2).get());
        assertFalse(copy.getStatus(pair, 3).isPresent());
    }
}
