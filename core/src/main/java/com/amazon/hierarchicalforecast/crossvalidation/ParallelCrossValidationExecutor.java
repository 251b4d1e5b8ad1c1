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

package com.amazon.hierarchicalforecast.crossvalidation;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.extern.slf4j.Slf4j;

import com.amazon.hierarchicalforecast.config.ExecutorContext;

/**
 * Runs the units on a private pool of worker threads that lives for one call
 * of {@link #execute}. Workers record their own cells. The calling thread
 * waits for every unit and, when a unit exceeds its time budget counted from
 * the moment it started, cancels it and records the cell as timed out; the
 * rest of the grid is not affected.
 */
@Slf4j
public class ParallelCrossValidationExecutor extends AbstractCrossValidationExecutor {

    public static final long DEFAULT_SHUTDOWN_GRACE_MILLIS = 1000;

    private final int threadPoolSize;

    private final long unitTimeoutMillis;

    private final long shutdownGraceMillis;

    public ParallelCrossValidationExecutor(FoldEvaluator foldEvaluator, int threadPoolSize, long unitTimeoutMillis) {
        this(foldEvaluator, threadPoolSize, unitTimeoutMillis, DEFAULT_SHUTDOWN_GRACE_MILLIS);
    }

    ParallelCrossValidationExecutor(FoldEvaluator foldEvaluator, int threadPoolSize, long unitTimeoutMillis,
            long shutdownGraceMillis) {
        super(foldEvaluator);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        checkArgument(unitTimeoutMillis >= 0, "timeout must be non-negative");
        checkArgument(shutdownGraceMillis >= 0, "shutdown grace period must be non-negative");
        this.threadPoolSize = threadPoolSize;
        this.unitTimeoutMillis = unitTimeoutMillis;
        this.shutdownGraceMillis = shutdownGraceMillis;
    }

    @Override
    public void execute(List<CrossValidationTask> tasks, ResultTable table) {
        ExecutorService pool = Executors.newFixedThreadPool(threadPoolSize);
        List<TimedUnit> units = new ArrayList<>(tasks.size());
        List<Future<?>> futures = new ArrayList<>(tasks.size());
        try {
            for (CrossValidationTask task : tasks) {
                TimedUnit unit = new TimedUnit(task, table);
                units.add(unit);
                futures.add(pool.submit(unit));
            }
            for (int i = 0; i < futures.size(); i++) {
                await(units.get(i), futures.get(i), table);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("interrupted while waiting for cross-validation units", e);
        } finally {
            shutdown(pool);
        }
    }

    /**
     * Interrupts the workers and waits a bounded time for them to stop.
     *
     * @return true if every worker stopped within the grace period
     */
    boolean shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (pool.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("cross-validation units still running {} ms after shutdown, they ignore interruption",
                    shutdownGraceMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void await(TimedUnit unit, Future<?> future, ResultTable table) throws InterruptedException {
        CrossValidationTask task = unit.task;
        try {
            if (unitTimeoutMillis == ExecutorContext.NO_TIMEOUT) {
                future.get();
                return;
            }
            while (true) {
                if (future.isDone()) {
                    future.get();
                    return;
                }
                long started = unit.startNanos;
                long waitNanos = TimeUnit.MILLISECONDS.toNanos(unitTimeoutMillis);
                if (started != TimedUnit.NOT_STARTED) {
                    waitNanos = started + waitNanos - System.nanoTime();
                    if (waitNanos <= 0) {
                        timeOut(task, future, table);
                        return;
                    }
                }
                try {
                    future.get(waitNanos, TimeUnit.NANOSECONDS);
                    return;
                } catch (TimeoutException e) {
                    // re-evaluate the deadline against the start time of the unit
                }
            }
        } catch (ExecutionException e) {
            // runUnit handles runtime exceptions, this is an Error thrown by the unit
            log.warn("{} fold {} failed: {}", task.getMethodPair(), task.getFold(), e.getCause().toString());
            table.record(task.getPairIndex(), task.getFold(), FoldResult.failed(e.getCause().toString()));
        }
    }

    private void timeOut(CrossValidationTask task, Future<?> future, ResultTable table) {
        if (table.record(task.getPairIndex(), task.getFold(),
                FoldResult.timedOut("exceeded " + unitTimeoutMillis + " ms"))) {
            log.warn("{} fold {} timed out after {} ms", task.getMethodPair(), task.getFold(), unitTimeoutMillis);
        }
        future.cancel(true);
    }

    private class TimedUnit implements Runnable {

        static final long NOT_STARTED = Long.MIN_VALUE;

        private final CrossValidationTask task;

        private final ResultTable table;

        private volatile long startNanos = NOT_STARTED;

        TimedUnit(CrossValidationTask task, ResultTable table) {
            this.task = task;
            this.table = table;
        }

        @Override
        public void run() {
            startNanos = System.nanoTime();
            runUnit(task, table);
        }
    }
}
