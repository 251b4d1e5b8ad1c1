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
import java.util.OptionalDouble;

import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.crossvalidation.CrossValidationScheduler;
import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;
import com.amazon.hierarchicalforecast.forecast.BaseForecastAdapter;
import com.amazon.hierarchicalforecast.hierarchy.Hierarchy;
import com.amazon.hierarchicalforecast.reconciliation.ReconciliationEngine;

/**
 * A command-line application that runs rolling-origin cross-validation over
 * every requested method pair and prints the result table, one line per
 * (method pair, fold, step), followed by the average of every step over the
 * folds.
 */
public class CrossValidationRunner extends HierarchyRunner {

    public static final String[] COLUMNS = { "reconciliation", "base", "fold", "step", "status", "mape" };

    public static final String[] AVERAGE_COLUMNS = { "reconciliation", "base", "step", "average_mape" };

    public static final String UNSET = "";

    public CrossValidationRunner() {
        super(new CrossValidationArgumentParser(CrossValidationRunner.class.getName(),
                "Compare reconciliation and base forecast methods by rolling-origin cross-validation; "
                        + "errors are mean absolute percentage errors."));
    }

    public static void main(String... args) throws IOException {
        CrossValidationRunner runner = new CrossValidationRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, "UTF-8")), new PrintWriter(System.out, true));
        System.out.println("Done.");
    }

    @Override
    protected void process(Hierarchy hierarchy, PrintWriter out) {
        ForecastConfig config = argumentParser.getForecastConfig();
        ReconciliationEngine engine = new ReconciliationEngine(BaseForecastAdapter.fromConfig(config));
        CrossValidationScheduler scheduler = new CrossValidationScheduler(argumentParser.getExecutorContext(),
                engine);
        ResultTable table = scheduler.runCV(hierarchy, config);

        out.println(join((Object[]) COLUMNS));
        for (MethodPair pair : table.getMethodPairs()) {
            for (int fold = 1; fold <= table.getFoldCount(); fold++) {
                String status = table.getStatus(pair, fold).map(Enum::name).orElse(UNSET);
                for (int step = 1; step <= table.getHorizon(); step++) {
                    out.println(join(pair.getReconciliationMethod().getCode(), pair.getBaseMethod().getCode(), fold,
                            step, status, format(table.get(pair, fold, step))));
                }
            }
        }

        out.println();
        out.println(join((Object[]) AVERAGE_COLUMNS));
        for (MethodPair pair : table.rankByMeanError()) {
            OptionalDouble[] averages = table.averageByHorizon(pair);
            for (int step = 1; step <= averages.length; step++) {
                out.println(join(pair.getReconciliationMethod().getCode(), pair.getBaseMethod().getCode(), step,
                        format(averages[step - 1])));
            }
        }
    }

    static String format(OptionalDouble value) {
        return value.isPresent() ? Double.toString(value.getAsDouble()) : UNSET;
    }
}
