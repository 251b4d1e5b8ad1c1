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

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;
import static com.amazon.hierarchicalforecast.CommonUtils.validateInternalState;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.config.ReconciliationMethod;
import com.amazon.hierarchicalforecast.errors.UnsupportedMethodException;
import com.amazon.hierarchicalforecast.forecast.IBaseForecaster;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * Entry point of reconciliation. The engine owns one reconciler per method and
 * the base forecaster used by {@link #forecast}; it keeps no state between
 * calls and is safe to share across threads.
 */
public class ReconciliationEngine {

    @Getter
    private final IBaseForecaster baseForecaster;

    private final Map<ReconciliationMethod, IReconciler> reconcilers;

    public ReconciliationEngine(IBaseForecaster baseForecaster) {
        this(baseForecaster, defaultReconcilers());
    }

    public ReconciliationEngine(IBaseForecaster baseForecaster, Collection<? extends IReconciler> reconcilers) {
        this.baseForecaster = checkNotNull(baseForecaster, "base forecaster must not be null");
        checkNotNull(reconcilers, "reconcilers must not be null");
        this.reconcilers = new EnumMap<>(ReconciliationMethod.class);
        for (IReconciler reconciler : reconcilers) {
            checkArgument(this.reconcilers.put(reconciler.getMethod(), reconciler) == null,
                    "duplicate reconciler for " + reconciler.getMethod());
        }
    }

    static Collection<IReconciler> defaultReconcilers() {
        return List.of(new BottomUpReconciler(), new AverageHistoricalProportionsReconciler(),
                new ProportionsOfHistoricalAveragesReconciler(), new ForecastProportionsReconciler(),
                new OptimalCombinationReconciler(false, true), new OptimalCombinationReconciler(true, true));
    }

    public Set<ReconciliationMethod> getSupportedMethods() {
        return Collections.unmodifiableSet(reconcilers.keySet());
    }

    public IReconciler getReconciler(ReconciliationMethod method) {
        if (method == null || !reconcilers.containsKey(method)) {
            throw new UnsupportedMethodException("no reconciler is available for method " + method);
        }
        return reconcilers.get(method);
    }

    /**
     * Reconciles base forecasts that were produced elsewhere.
     *
     * @param hierarchy     the training hierarchy
     * @param baseForecasts one entry per node; entries the method does not read
     *                      may be null
     * @param method        the reconciliation method
     * @return a coherent forecast set
     */
    public CoherentForecastSet reconcile(Hierarchy hierarchy, BaseForecast[] baseForecasts,
            ReconciliationMethod method) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        checkNotNull(baseForecasts, "base forecasts must not be null");
        IReconciler reconciler = getReconciler(method);
        checkArgument(baseForecasts.length == hierarchy.nodeCount(),
                "expected " + hierarchy.nodeCount() + " base forecasts, found " + baseForecasts.length);

        boolean[] required = reconciler.requiredNodes(hierarchy);
        int horizon = -1;
        for (int i = 0; i < required.length; i++) {
            if (required[i]) {
                checkArgument(baseForecasts[i] != null, method.getCode() + " requires a base forecast for node "
                        + hierarchy.getNode(i).getLabel());
                if (horizon < 0) {
                    horizon = baseForecasts[i].getHorizon();
                }
                checkArgument(baseForecasts[i].getHorizon() == horizon, "base forecasts have different horizons");
            }
        }

        CoherentForecastSet result = reconciler.reconcile(hierarchy, baseForecasts);
        validateInternalState(result.getHorizon() == horizon, "incorrect horizon of the reconciled forecast");
        validateInternalState(result.isCoherent(), method.getCode() + " produced an incoherent forecast");
        return result;
    }

    /**
     * Runs base forecasting for every node the method reads, then reconciles.
     *
     * @param hierarchy            the training hierarchy
     * @param horizon              number of steps to forecast
     * @param reconciliationMethod the reconciliation method
     * @param baseMethod           the univariate method used for every node
     * @return a coherent forecast set
     */
    public CoherentForecastSet forecast(Hierarchy hierarchy, int horizon, ReconciliationMethod reconciliationMethod,
            BaseForecastMethod baseMethod) {
        checkNotNull(hierarchy, "hierarchy must not be null");
        checkArgument(horizon > 0, "horizon must be positive");
        IReconciler reconciler = getReconciler(reconciliationMethod);
        boolean[] required = reconciler.requiredNodes(hierarchy);
        BaseForecast[] baseForecasts = new BaseForecast[hierarchy.nodeCount()];
        for (int i = 0; i < required.length; i++) {
            if (required[i]) {
                baseForecasts[i] = baseForecaster.forecastNode(hierarchy.getSeries(i), horizon, baseMethod);
            }
        }
        return reconcile(hierarchy, baseForecasts, reconciliationMethod);
    }

    public CoherentForecastSet forecast(Hierarchy hierarchy, int horizon, MethodPair pair) {
        checkNotNull(pair, "method pair must not be null");
        return forecast(hierarchy, horizon, pair.getReconciliationMethod(), pair.getBaseMethod());
    }
}
