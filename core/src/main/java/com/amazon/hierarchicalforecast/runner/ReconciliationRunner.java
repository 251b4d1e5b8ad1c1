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

package com.amazon.hierarchicalforecast.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;

import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.hierarchy.TimeIndex;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;
import com.amazon.hierarchicalforecast.returntypes.CoherentForecastSet;

/**
 * A command-line application that forecasts every node of the hierarchy and
 * prints the coherent forecast of every requested method pair, one line per
 * (node, step).
 */
public class ReconciliationRunner extends HierarchyRunner {

    public static final String[] COLUMNS = { "reconciliation", "base", "node", "label", "level", "step", "period",
            "value" };

    public ReconciliationRunner() {
        super(new ArgumentParser(ReconciliationRunner.class.getName(),
                "Forecast a hierarchy of series and reconcile the forecasts so that every aggregate equals the "
                        + "sum of its children."));
    }

    public static void main(String... args) throws IOException {
        ReconciliationRunner runner = new ReconciliationRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, "UTF-8")), new PrintWriter(System.out, true));
        System.out.println("Done.");
    }

    @Override
    protected void process(Hierarchy hierarchy, PrintWriter out) {
        ForecastConfig config = argumentParser.getForecastConfig();
        ReconciliationEngine engine = new ReconciliationEngine(BaseForecastAdapter.fromConfig(config));
        TimeIndex timeIndex = hierarchy.getTimeIndex();

        out.println(join((Object[]) COLUMNS));
        for (MethodPair pair : config.getMethodPairs()) {
            CoherentForecastSet forecast = engine.forecast(hierarchy, config.getHorizon(), pair);
            for (int node = 0; node < forecast.getNodeCount(); node++) {
                for (int h = 0; h < forecast.getHorizon(); h++) {
                    out.println(join(pair.getReconciliationMethod().getCode(), pair.getBaseMethod().getCode(), node,
                            forecast.getLabel(node), forecast.getLevel(node), h + 1,
                            timeIndex.label(hierarchy.length() + h), forecast.get(node, h)));
                }
            }
        }
    }
}
