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

import com.amazon.hierarchicalforecast.errors.DegenerateHierarchyException;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Top-down reconciliation: the forecast of the total is split among the leaves
 * and the intermediate levels are rebuilt by summing the leaves. Subclasses
 * decide how the split is computed.
 */
public abstract class AbstractTopDownReconciler implements IReconciler {

    @Override
    public boolean[] requiredNodes(Hierarchy hierarchy) {
        boolean[] required = new boolean[hierarchy.nodeCount()];
        required[root(hierarchy)] = true;
        return required;
    }

    @Override
    public CoherentForecastSet reconcile(Hierarchy hierarchy, BaseForecast[] baseForecasts) {
        int root = root(hierarchy);
        double[] total = baseForecasts[root].getPointForecast();
        double[][] proportions = proportions(hierarchy, baseForecasts, total.length);
        double[][] bottom = new double[proportions.length][total.length];
        for (int j = 0; j < proportions.length; j++) {
            for (int h = 0; h < total.length; h++) {
                bottom[j][h] = total[h] * proportions[j][h];
            }
        }
        return CoherentForecastSet.fromBottom(hierarchy, bottom, getMethod());
    }

    /**
     * @param hierarchy     the training hierarchy
     * @param baseForecasts base forecasts, non-null for the required nodes
     * @param horizon       number of forecast steps
     * @return the share of every bottom series at every step, bottom series x
     *         horizon; every column sums to one
     */
    protected abstract double[][] proportions(Hierarchy hierarchy, BaseForecast[] baseForecasts, int horizon);

    static int root(Hierarchy hierarchy) {
        return hierarchy.getRoot().orElseThrow(() -> new DegenerateHierarchyException(
                "top-down reconciliation requires a single total, found " + hierarchy.nodesAtLevel(0).length
                        + " top level nodes"));
    }

    /**
     * Repeats a single proportion per bottom series over the horizon.
     */
    static double[][] constantOverHorizon(double[] proportions, int horizon) {
        double[][] result = new double[proportions.length][horizon];
        for (int j = 0; j < proportions.length; j++) {
            Arrays.fill(result[j], proportions[j]);
        }
        return result;
    }
}
