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

package com.amazon.hierarchicalforecast.crossvalidation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.MethodPair;

public class ResultTableTest {

    private static final MethodPair BU_ETS = MethodPair.fromCode("bu/ets");
    private static final MethodPair COMB_RW = MethodPair.fromCode("comb/rw");
    private static final MethodPair TDGSA_ARIMA = MethodPair.fromCode("tdgsa/arima");

    private ResultTable table;

    @BeforeEach
    public void setUp() {
        table = new ResultTable(List.of(BU_ETS, COMB_RW, TDGSA_ARIMA), 3, 2, new int[] { 0, 1 });
    }

    private static FoldResult completed(double step1, double step2) {
        return FoldResult.completed(new int[] { 0, 1 }, new double[] { step1, step2 },
                new double[][] { { step1, step2 }, { step1, step2 } });
    }

    @Test
    public void testRecordOnce() {
        assertTrue(table.record(BU_ETS, 1, completed(10, 20)));
        assertFalse(table.record(BU_ETS, 1, FoldResult.failed("late")));
        assertEquals(OptionalDouble.of(10), table.get(BU_ETS, 1, 1));
        assertEquals(CellStatus.COMPLETED, table.getStatus(BU_ETS, 1).get());
        assertFalse(table.getStatus(BU_ETS, 2).isPresent());
        assertEquals(OptionalDouble.empty(), table.get(BU_ETS, 2, 1));
    }

    @Test
    public void testFrozenTableRefusesWrites() {
        table.freeze();
        assertTrue(table.isFrozen());
        assertFalse(table.record(COMB_RW, 2, completed(1, 1)));
        assertFalse(table.getFoldResult(COMB_RW, 2).isPresent());
    }

    @Test
    public void testFailures() {
        table.record(COMB_RW, 3, FoldResult.failed("IllegalStateException: boom"));
        table.record(TDGSA_ARIMA, 1, FoldResult.timedOut("exceeded 10 ms"));
        assertTrue(table.isFailed(COMB_RW, 3));
        assertTrue(table.isFailed(TDGSA_ARIMA, 1));
        assertFalse(table.isFailed(BU_ETS, 1));
        assertEquals("IllegalStateException: boom", table.getFailureReason(COMB_RW, 3).get());
        assertEquals(1, table.count(CellStatus.FAILED));
        assertEquals(1, table.count(CellStatus.TIMED_OUT));
        assertEquals(OptionalDouble.empty(), table.get(COMB_RW, 3, 1));
    }

    @Test
    public void testAggregates() {
        table.record(BU_ETS, 1, completed(10, 20));
        table.record(BU_ETS, 2, completed(30, Double.NaN));
        table.record(BU_ETS, 3, FoldResult.failed("x"));
        table.record(COMB_RW, 1, completed(1, 2));

        OptionalDouble[] average = table.averageByHorizon(BU_ETS);
        assertEquals(20.0, average[0].getAsDouble());
        assertEquals(20.0, average[1].getAsDouble());
        assertEquals(20.0, table.meanError(BU_ETS).getAsDouble());
        assertEquals(1.5, table.meanError(COMB_RW).getAsDouble());
        assertFalse(table.meanError(TDGSA_ARIMA).isPresent());

        assertEquals(List.of(COMB_RW, BU_ETS, TDGSA_ARIMA), table.rankByMeanError());
        assertEquals(OptionalDouble.of(30), table.get(BU_ETS, 2, 1, 1));
        assertEquals(OptionalDouble.empty(), table.get(BU_ETS, 2, 1, 2));
        assertEquals(OptionalDouble.empty(), table.get(BU_ETS, 2, 3, 1));
    }

    @Test
    public void testInvalidCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> table.get(BU_ETS, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> table.get(BU_ETS, 4, 1));
        assertThrows(IllegalArgumentException.class, () -> table.get(BU_ETS, 1, 3));
        assertThrows(IllegalArgumentException.class, () -> table.get(MethodPair.fromCode("wls/ets"), 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ResultTable(List.of(BU_ETS, BU_ETS), 1, 1, new int[] { 0 }));
        assertThrows(IllegalArgumentException.class, () -> new ResultTable(List.of(), 1, 1, new int[] { 0 }));
    }

    @Test
    public void testConcurrentWritersOfOneCell() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            double value = i;
            outcomes.add(pool.submit(() -> {
                start.await();
                return table.record(TDGSA_ARIMA, 2, completed(value, value));
            }));
        }
        start.countDown();
        int recorded = 0;
        for (Future<Boolean> outcome : outcomes) {
            if (outcome.get(10, TimeUnit.SECONDS)) {
                ++recorded;
            }
        }
        pool.shutdown();
        assertEquals(1, recorded);
        assertTrue(table.get(TDGSA_ARIMA, 2, 1).isPresent());
    }

    @Test
    public void testFoldResultCopiesInput() {
        double[] pooled = { 1, 2 };
        FoldResult result = FoldResult.completed(new int[] { 0 }, pooled, new double[][] { { 3, 4 } });
        pooled[0] = 100;
        assertEquals(OptionalDouble.of(1), result.get(1));
        assertEquals(OptionalDouble.of(4), result.get(0, 2));
        assertEquals(2, result.getStepCount());
        assertEquals(0, FoldResult.failed("x").getStepCount());
        assertEquals("x", FoldResult.timedOut("x").getFailureReason().get());
    }
}
