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

package com.amazon.hierarchicalforecast.config;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;

import lombok.Data;

/**
 * Execution settings of a cross-validation run. The scheduler takes a copy
 * when it is created, so later changes to an instance do not affect it;
 * nothing about parallelism is process-wide.
 */
@Data
public class ExecutorContext {

    public static final long NO_TIMEOUT = 0L;

    /**
     * If true, the (fold, method pair) units of work run on a private pool of
     * worker threads, otherwise one after the other on the calling thread.
     */
    private boolean parallelExecutionEnabled;

    /**
     * Number of worker threads when parallel execution is enabled.
     */
    private int threadPoolSize;

    /**
     * Wall clock budget of a single unit of work, in milliseconds. Units that
     * exceed it are cancelled and recorded as timed out. Only enforced by the
     * parallel executor; {@value #NO_TIMEOUT} disables the limit.
     */
    private long unitTimeoutMillis = NO_TIMEOUT;

    public static ExecutorContext sequential() {
        ExecutorContext context = new ExecutorContext();
        context.setParallelExecutionEnabled(false);
        context.setThreadPoolSize(0);
        return context;
    }

    public static ExecutorContext parallel(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        ExecutorContext context = new ExecutorContext();
        context.setParallelExecutionEnabled(true);
        context.setThreadPoolSize(threadPoolSize);
        return context;
    }

    public ExecutorContext withUnitTimeoutMillis(long unitTimeoutMillis) {
        checkArgument(unitTimeoutMillis >= 0, "timeout must be non-negative");
        setUnitTimeoutMillis(unitTimeoutMillis);
        return this;
    }

    /**
     * @return an independent copy of these settings
     */
    public ExecutorContext copy() {
        ExecutorContext context = new ExecutorContext();
        context.setParallelExecutionEnabled(parallelExecutionEnabled);
        context.setThreadPoolSize(threadPoolSize);
        context.setUnitTimeoutMillis(unitTimeoutMillis);
        return context;
    }

    public void validate() {
        checkArgument(!parallelExecutionEnabled || threadPoolSize > 0,
                "threadPoolSize must be greater than 0. To disable the thread pool, set parallel execution to 'false'.");
        checkArgument(unitTimeoutMillis >= 0, "timeout must be non-negative");
    }
}
