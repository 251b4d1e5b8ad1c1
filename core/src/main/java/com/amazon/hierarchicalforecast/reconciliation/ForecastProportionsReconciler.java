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

import java.util.Arrays;

import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.DegenerateHierarchyException;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.hierarchy.HierarchyNode;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

/**
 * Top-down with forecast proportions ({@code tdfp}): at every step, each node
 * receives the share of its parent's allocation given by its own base forecast
 * relative to the base forecasts of its siblings. The share of a leaf is the
 * product of these ratios along the path from the total.
 */
public class ForecastProportionsReconciler extends AbstractTopDownReconciler {

    @Override
    public ReconciliationMethod getMethod() {
        return ReconciliationMethod.TOP_DOWN_FP;
    }

    @Override
    public boolean[] requiredNodes(Hierarchy hierarchy) {
        root(hierarchy);
        boolean[] required = new boolean[hierarchy.nodeCount()];
        Arrays.fill(required, true);
        return required;
    }

    @Override
    protected double[][] proportions(Hierarchy hierarchy, BaseForecast[] baseForecasts, int horizon) {
        int root = root(hierarchy);
        double[][] share = new double[hierarchy.nodeCount()][horizon];
        Arrays.fill(share[root], 1.0);
        // parents precede their children in node order
        for (int i = 0; i < hierarchy.nodeCount(); i++) {
            HierarchyNode node = hierarchy.getNode(i);
            if (node.isLeaf()) {
                continue;
            }
            int[] children = node.getChildren();
            for (int h = 0; h < horizon; h++) {
                double sum = 0;
                for (int child : children) {
                    sum += baseForecasts[child].getPointForecast(h);
                }
                if (sum == 0) {
                    throw new DegenerateHierarchyException("base forecasts of the children of " + node.getLabel()
                            + " sum to zero at step " + h);
                }
                for (int child : children) {
                    share[child][h] = share[i][h] * baseForecasts[child].getPointForecast(h) / sum;
                }
            }
        }
        int[] leaves = hierarchy.leaves();
        double[][] result = new double[leaves.length][];
        for (int j = 0; j < leaves.length; j++) {
            result[j] = share[leaves[j]];
        }
        return result;
    }
}
