/* Copyright (C) 2013-2023 TU Dortmund
 * This file is part of LearnLib, http://www.learnlib.de/.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dpnlearn.oracle.solver;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wrapper around a {@link ConstraintSolver} that bounds the time spent on each query. Queries that do not finish
 * in time, fail with an exception or are interrupted are answered with {@link SolverResult#UNKNOWN}.
 * <p>
 * Instances own a thread pool and must be {@link #close() closed} after use. Closing also closes the wrapped solver.
 */
public class TimeLimitedConstraintSolver implements ConstraintSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeLimitedConstraintSolver.class);

    private final ConstraintSolver delegate;
    private final long timeoutMillis;
    private final ExecutorService executor;
    private final AtomicLong inconclusive;

    public TimeLimitedConstraintSolver(ConstraintSolver delegate, Duration timeout) {
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        this.delegate = delegate;
        this.timeoutMillis = timeout.toMillis();
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setDaemon(true)
                                                                                .setNameFormat("constraint-solver-%d")
                                                                                .build());
        this.inconclusive = new AtomicLong();
    }

    @Override
    public SolverResult check(Predicate predicate) {
        Future<SolverResult> future = executor.submit(() -> delegate.check(predicate));
        try {
            SolverResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == SolverResult.UNKNOWN) {
                inconclusive.incrementAndGet();
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("Solver timed out after {} ms on '{}'", timeoutMillis, predicate);
        } catch (ExecutionException e) {
            LOGGER.warn("Solver failed on '{}'", predicate, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the solver on '{}'", predicate);
        }
        inconclusive.incrementAndGet();
        return SolverResult.UNKNOWN;
    }

    /**
     * The number of queries answered with {@link SolverResult#UNKNOWN} so far.
     */
    public long getInconclusiveCount() {
        return inconclusive.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        delegate.close();
    }
}
