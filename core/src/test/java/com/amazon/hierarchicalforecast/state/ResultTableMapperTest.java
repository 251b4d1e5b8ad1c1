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

package com.amazon.hierarchicalforecast.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.crossvalidation.CellStatus;
import com.amazon.hierarchicalforecast.crossvalidation.FoldResult;
import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;

public class ResultTableMapperTest {

    private static final MethodPair BU_RW = MethodPair.fromCode("bu/rw");
    private static final MethodPair WLS_ETS = MethodPair.fromCode("wls/ets");

    private ResultTable table;
    private ResultTableMapper mapper;

    @BeforeEach
    public void setUp() {
        table = new ResultTable(List.of(BU_RW, WLS_ETS), 2, 3, new int[] { 0, 2 });
        table.record(BU_RW, 1, FoldResult.completed(new int[] { 0, 2 }, new double[] { 1.5, 2.5, Double.NaN },
                new double[][] { { 1, 2, Double.NaN }, { 2, 3, Double.NaN } }));
        table.record(BU_RW, 2, FoldResult.failed("SingularAggregationException: singular"));
        table.record(WLS_ETS, 1, FoldResult.timedOut("exceeded 100 ms"));
        table.freeze();
        mapper = new ResultTableMapper();
    }

    @Test
    public void testToState() {
        ResultTableState state = mapper.toState(table);
        assertEquals(Version.V1_0, state.getVersion());
        assertArrayEquals(new String[] { "bu/rw", "wls/ets" }, state.getMethodPairs());
        assertEquals(2, state.getFoldCount());
        assertEquals(3, state.getHorizon());
        assertArrayEquals(new int[] { 0, 2 }, state.getLevels());
        assertEquals(4, state.getCells().length);
        assertEquals("COMPLETED", state.getCells()[0].getStatus());
        assertEquals("FAILED", state.getCells()[1].getStatus());
        assertEquals("TIMED_OUT", state.getCells()[2].getStatus());
        assertNull(state.getCells()[3]);
    }

    @Test
    public void testRoundTripKeepsEveryCell() {
        ResultTable copy = mapper.toModel(mapper.toState(table));
        assertTrue(copy.isFrozen());
        assertEquals(table.getMethodPairs(), copy.getMethodPairs());
        for (MethodPair pair : table.getMethodPairs()) {
            for (int fold = 1; fold <= 2; fold++) {
                assertEquals(table.getStatus(pair, fold), copy.getStatus(pair, fold));
                assertEquals(table.getFailureReason(pair, fold), copy.getFailureReason(pair, fold));
                for (int step = 1; step <= 3; step++) {
                    assertEquals(table.get(pair, fold, step), copy.get(pair, fold, step));
                    assertEquals(table.get(pair, fold, 2, step), copy.get(pair, fold, 2, step));
                }
            }
        }
        assertFalse(copy.getStatus(WLS_ETS, 2).isPresent());
        assertEquals(CellStatus.TIMED_OUT, copy.getStatus(WLS_ETS, 1).get());
    }

    @Test
    public void testCellsAreMappedByFoldResultMapper() {
        FoldResultMapper foldResultMapper = spy(new FoldResultMapper());
        mapper.setFoldResultMapper(foldResultMapper);
        mapper.toModel(mapper.toState(table));
        verify(foldResultMapper, times(3)).toState(any());
        verify(foldResultMapper, times(3)).toModel(any());
    }

    @Test
    public void testInvalidState() {
        ResultTableState state = mapper.toState(table);
        state.setCells(new FoldResultState[3]);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        FoldResultState noStatus = new FoldResultState();
        assertThrows(IllegalArgumentException.class, () -> new FoldResultMapper().toModel(noStatus));
    }
}
