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

package com.amazon.hierarchicalforecast.runner;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.ExecutorContext;
import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.UnsupportedMethodException;
import com.amazon.hierarchicalforecast.hierarchy.GroupingSpec;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertFalse(parser.getTimeColumn());
        assertEquals(GroupingSpec.flat(5), parser.getGroupingSpec(5));
        assertEquals(4, parser.getFrequency());
        assertEquals(1, parser.getStartYear());
        assertEquals(1, parser.getStartCycle());
        assertEquals(4, parser.getHorizon());
        assertArrayEquals(new ReconciliationMethod[] { ReconciliationMethod.BOTTOM_UP,
                ReconciliationMethod.TOP_DOWN_GSA, ReconciliationMethod.OPTIMAL_COMBINATION },
                parser.getReconciliationMethods());
        assertArrayEquals(new BaseForecastMethod[] { BaseForecastMethod.ARIMA, BaseForecastMethod.ETS,
                BaseForecastMethod.RANDOM_WALK }, parser.getBaseMethods());
        assertEquals(0.95, parser.getIntervalLevel());
        assertEquals(0, parser.getThreads());
        assertFalse(parser.getExecutorContext().isParallelExecutionEnabled());
    }

    @Test
    public void testParse() {
        parser.parse("--delimiter", "\t", "--header-row", "true", "--time-column", "true", "--grouping", "2;2,6",
                "--frequency", "12", "--start-year", "1998", "--start-cycle", "3", "--horizon", "6",
                "--reconciliation-methods", "tdfp, wls", "--base-methods", "rw", "--interval-level", "0.8",
                "--threads", "3");

        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertTrue(parser.getTimeColumn());
        assertEquals(GroupingSpec.parse("2;2,6"), parser.getGroupingSpec(8));
        assertArrayEquals(new ReconciliationMethod[] { ReconciliationMethod.TOP_DOWN_FP,
                ReconciliationMethod.WEIGHTED_COMBINATION }, parser.getReconciliationMethods());
        assertArrayEquals(new BaseForecastMethod[] { BaseForecastMethod.RANDOM_WALK }, parser.getBaseMethods());

        ForecastConfig config = parser.getForecastConfig();
        assertEquals(12, config.getFrequency());
        assertEquals(1998, config.getStartYear());
        assertEquals(3, config.getStartCycle());
        assertEquals(6, config.getHorizon());
        assertEquals(0.8, config.getIntervalLevel());
        assertEquals(2, config.getMethodPairs().size());

        ExecutorContext context = parser.getExecutorContext();
        assertTrue(context.isParallelExecutionEnabled());
        assertEquals(3, context.getThreadPoolSize());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-d", ";", "-g", "3", "-f", "1", "-r", "bu", "-b", "ets,arima", "-t", "2");

        assertEquals(";", parser.getDelimiter());
        assertEquals(GroupingSpec.flat(3), parser.getGroupingSpec(3));
        assertEquals(1, parser.getFrequency());
        assertArrayEquals(new ReconciliationMethod[] { ReconciliationMethod.BOTTOM_UP },
                parser.getReconciliationMethods());
        assertEquals(2, parser.getBaseMethods().length);
        assertEquals(2, parser.getThreads());
    }

    @Test
    public void testMethodLists() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseReconciliationMethods(" , "));
        assertThrows(UnsupportedMethodException.class, () -> ArgumentParser.parseBaseMethods("ets,naive"));
    }

    @Test
    public void testGroupingForms() {
        parser.parse("-g", "none");
        assertEquals(GroupingSpec.ungrouped(), parser.getGroupingSpec(3));
        parser.parse("-g", "[2, (2,6)]");
        assertEquals(GroupingSpec.parse("2;2,6"), parser.getGroupingSpec(8));
        parser.parse("-g", "TOTAL");
        assertEquals(GroupingSpec.flat(4), parser.getGroupingSpec(4));
    }

    @Test
    public void testCrossValidationArguments() {
        CrossValidationArgumentParser cvParser = new CrossValidationArgumentParser("runner-class",
                "runner-description");
        assertEquals(10, cvParser.getFoldCount());
        assertEquals(4, cvParser.getWindowSize());
        assertEquals(CrossValidationArgumentParser.DEFAULT_ORIGIN, cvParser.getOrigin());
        assertEquals(0, cvParser.getLevels().length);
        assertFalse(cvParser.getForecastConfig().getOrigin().isPresent());

        cvParser.parse("-k", "5", "-w", "2", "--origin", "7", "-l", "0, 2", "-t", "4", "--unit-timeout", "500");
        ForecastConfig config = cvParser.getForecastConfig();
        assertEquals(5, config.getFoldCount());
        assertEquals(2, config.getWindowSize());
        assertEquals(7, config.getOrigin().get());
        assertArrayEquals(new int[] { 0, 2 }, config.getLevelsToEvaluate().get());
        assertEquals(500L, cvParser.getExecutorContext().getUnitTimeoutMillis());
        assertArrayEquals(new int[0], CrossValidationArgumentParser.parseLevels(""));
    }
}
