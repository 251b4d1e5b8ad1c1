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
 * Top-down with the proportions of the historical averages ({@code tdgsf}):
 * the share of leaf {@code j} is its total volume over the training window
 * divided by the total volume of the hierarchy.
 */
public class ProportionsOfHistoricalAveragesReconciler extends AbstractTopDownReconciler {

    @Override
    public ReconciliationMethod getMethod() {
        return ReconciliationMethod.TOP_DOWN_GSF;
    }

    @Override
    protected double[][] proportions(Hierarchy hierarchy, BaseForecast[] baseForecasts, int horizon) {
        return constantOverHorizon(leafProportions(hierarchy), horizon);
    }

    public double[] leafProportions(Hierarchy hierarchy) {
        int root = root(hierarchy);
        int[] leaves = hierarchy.leaves();
        double total = 0;
        double[] proportions = new double[leaves.length];
        for (int t = 0; t < hierarchy.length(); t++) {
            total += hierarchy.getValue(root, t);
            for (int j = 0; j < leaves.length; j++) {
                proportions[j] += hierarchy.getValue(leaves[j], t);
            }
        }
        if (total == 0) {
            throw new DegenerateHierarchyException("total volume of the training window is zero");
        }
        for (int j = 0; j < leaves.length; j++) {
            proportions[j] /= total;
        }
        return proportions;
    }
}
