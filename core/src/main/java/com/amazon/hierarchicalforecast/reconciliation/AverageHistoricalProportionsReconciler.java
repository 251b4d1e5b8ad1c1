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

import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.DegenerateHierarchyException;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

/**
 * Top-down with the average of the historical proportions ({@code tdgsa}):
 * the share of leaf {@code j} is the mean over the training periods of
 * {@code y_j(t) / total(t)}. The shares are computed once per training window
 * and apply to every forecast step.
 */
public class AverageHistoricalProportionsReconciler extends AbstractTopDownReconciler {

    @Override
    public ReconciliationMethod getMethod() {
        return ReconciliationMethod.TOP_DOWN_GSA;
    }

    @Override
    protected double[][] proportions(Hierarchy hierarchy, BaseForecast[] baseForecasts, int horizon) {
        return constantOverHorizon(leafProportions(hierarchy), horizon);
    }

    /**
     * @param hierarchy the training hierarchy
     * @return the share of every bottom series, in bottom order
     * @throws DegenerateHierarchyException if the total is zero at any period
     */
    public double[] leafProportions(Hierarchy hierarchy) {
        int root = root(hierarchy);
        int[] leaves = hierarchy.leaves();
        int length = hierarchy.length();
        double[] proportions = new double[leaves.length];
        for (int t = 0; t < length; t++) {
            double total = hierarchy.getValue(root, t);
            if (total == 0) {
                throw new DegenerateHierarchyException("total volume is zero at period " + t
                        + " of the training window, historical proportions are undefined");
            }
            for (int j = 0; j < leaves.length; j++) {
                proportions[j] += hierarchy.getValue(leaves[j], t) / total;
            }
        }
        for (int j = 0; j < leaves.length; j++) {
            proportions[j] /= length;
        }
        return proportions;
    }
}
