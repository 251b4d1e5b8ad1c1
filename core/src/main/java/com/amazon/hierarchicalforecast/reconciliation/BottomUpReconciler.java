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
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Keeps the forecasts of the leaves and sums them up the tree; the base
 * forecasts of aggregate nodes are never read.
 */
public class BottomUpReconciler implements IReconciler {

    @Override
    public ReconciliationMethod getMethod() {
        return ReconciliationMethod.BOTTOM_UP;
    }

    @Override
    public boolean[] requiredNodes(Hierarchy hierarchy) {
        boolean[] required = new boolean[hierarchy.nodeCount()];
        for (int leaf : hierarchy.leaves()) {
            required[leaf] = true;
        }
        return required;
    }

    @Override
    public CoherentForecastSet reconcile(Hierarchy hierarchy, BaseForecast[] baseForecasts) {
        int[] leaves = hierarchy.leaves();
        double[][] bottom = new double[leaves.length][];
        for (int j = 0; j < leaves.length; j++) {
            bottom[j] = baseForecasts[leaves[j]].getPointForecast();
        }
        return CoherentForecastSet.fromBottom(hierarchy, bottom, getMethod());
    }
}
