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
 * Turns independently produced node forecasts into a coherent forecast set.
 * Implementations are stateless and may be shared across threads.
 */
public interface IReconciler {

    ReconciliationMethod getMethod();

    /**
     * @param hierarchy the training hierarchy
     * @return for every node, whether the method reads its base forecast
     */
    boolean[] requiredNodes(Hierarchy hierarchy);

    /**
     * @param hierarchy     the training hierarchy, source of the summing matrix
     *                      and of any historical proportions
     * @param baseForecasts one entry per node; entries of nodes that are not
     *                      required may be null and are ignored
     * @return the coherent forecast set, node x horizon
     */
    CoherentForecastSet reconcile(Hierarchy hierarchy, BaseForecast[] baseForecasts);
}
