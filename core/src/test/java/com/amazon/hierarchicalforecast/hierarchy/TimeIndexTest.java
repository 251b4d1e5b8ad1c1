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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TimeIndexTest {

    @Test
    public void testQuarterlyLabels() {
        TimeIndex index = new TimeIndex(TimeIndex.QUARTERLY, 1998, 1);
        assertEquals("1998 Q1", index.label(0));
        assertEquals("1998 Q4", index.label(3));
        assertEquals("1999 Q1", index.label(4));
        assertEquals(2000, index.yearOf(9));
        assertEquals(2, index.cycleOf(9));
    }

    @Test
    public void testOtherFrequencies() {
        assertEquals("2002-03", new TimeIndex(TimeIndex.MONTHLY, 2000, 11).label(16));
        assertEquals("2005", new TimeIndex(1, 2000, 1).label(5));
        assertEquals("3:7", new TimeIndex(7, 2, 7).label(7));
    }

    @Test
    public void testShift() {
        TimeIndex index = new TimeIndex(TimeIndex.QUARTERLY, 1998, 3);
        TimeIndex shifted = index.shift(5);
        assertEquals(new TimeIndex(TimeIndex.QUARTERLY, 1999, 4), shifted);
        assertEquals(index.label(5), shifted.label(0));
        assertEquals(index, shifted.shift(-5));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TimeIndex(0, 2000, 1));
        assertThrows(IllegalArgumentException.class, () -> new TimeIndex(4, 2000, 5));
        assertThrows(IllegalArgumentException.class, () -> new TimeIndex(4, 2000, 0));
    }
}
