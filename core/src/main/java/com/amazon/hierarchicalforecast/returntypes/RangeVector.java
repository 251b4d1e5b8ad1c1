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

package com.amazon.hierarchicalforecast.returntypes;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.Arrays;

/**
 * A RangeVector is used when we want to track a quantity and its upper and
 * lower bounds, here a point forecast per horizon step together with its
 * prediction interval.
 */
public class RangeVector {

    public final double[] values;

    /**
     * An array of values corresponding to the upper ranges in each dimension.
     */
    public final double[] upper;
    /**
     * An array of values corresponding to the lower ranges in each dimension
     */
    public final double[] lower;

    public RangeVector(double[] values) {
        checkArgument(values.length > 0, "dimensions must be > 0 ");
        this.values = Arrays.copyOf(values, values.length);
        this.upper = Arrays.copyOf(values, values.length);
        this.lower = Arrays.copyOf(values, values.length);
    }

    /**
     * Create a deep copy of the base RangeVector.
     *
     * @param base The RangeVector to copy.
     */
    public RangeVector(RangeVector base) {
        int dimensions = base.values.length;
        this.values = Arrays.copyOf(base.values, dimensions);
        this.upper = Arrays.copyOf(base.upper, dimensions);
        this.lower = Arrays.copyOf(base.lower, dimensions);
    }

    /**
     * Widens the range at position {@code i} symmetrically around the value.
     *
     * @param i     position
     * @param width half width of the range, non-negative
     */
    public void widen(int i, double width) {
        checkArgument(i >= 0 && i < values.length, "incorrect index");
        checkArgument(width >= 0, "negative width not permitted");
        upper[i] = max(upper[i], values[i] + width);
        lower[i] = min(lower[i], values[i] - width);
    }
}
