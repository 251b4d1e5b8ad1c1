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

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Calendar of a hierarchy: all series share the frequency (periods per year)
 * and the start period. Cycles are numbered from 1.
 */
@Getter
public class TimeIndex {

    public static final int QUARTERLY = 4;

    public static final int MONTHLY = 12;

    private final int frequency;

    private final int startYear;

    private final int startCycle;

    public TimeIndex(int frequency, int startYear, int startCycle) {
        checkArgument(frequency > 0, "frequency must be positive");
        checkArgument(startCycle >= 1 && startCycle <= frequency, "start cycle must be between 1 and frequency");
        this.frequency = frequency;
        this.startYear = startYear;
        this.startCycle = startCycle;
    }

    /**
     * @param periods number of periods to move the start by, may be negative
     * @return the calendar starting {@code periods} later
     */
    public TimeIndex shift(int periods) {
        long position = (long) startYear * frequency + (startCycle - 1) + periods;
        return new TimeIndex(frequency, (int) Math.floorDiv(position, frequency),
                (int) Math.floorMod(position, frequency) + 1);
    }

    public int yearOf(int t) {
        return Math.floorDiv(startYear * frequency + startCycle - 1 + t, frequency);
    }

    public int cycleOf(int t) {
        return Math.floorMod(startCycle - 1 + t, frequency) + 1;
    }

    /**
     * @param t a period, 0 being the start
     * @return a display label such as {@code 1998 Q1}, {@code 1998-01} or
     *         {@code 1998:3}
     */
    public String label(int t) {
        int year = yearOf(t);
        int cycle = cycleOf(t);
        if (frequency == 1) {
            return Integer.toString(year);
        } else if (frequency == QUARTERLY) {
            return year + " Q" + cycle;
        } else if (frequency == MONTHLY) {
            return String.format("%d-%02d", year, cycle);
        }
        return year + ":" + cycle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeIndex)) {
            return false;
        }
        TimeIndex other = (TimeIndex) o;
        return frequency == other.frequency && startYear == other.startYear && startCycle == other.startCycle;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * frequency + startYear) + startCycle;
    }

    @Override
    public String toString() {
        return label(0) + " (frequency " + frequency + ")";
    }
}
