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

import de.dpnlearn.datastructure.predicate.Predicate;

/**
 * A decision procedure for the satisfiability of conjunctive predicates. Numeric attributes range over the reals,
 * categorical attributes over arbitrary strings.
 * <p>
 * Callers must treat {@link SolverResult#UNKNOWN} as "not established" and never as either answer.
 *
 * @see Z3ConstraintSolver
 * @see IntervalConstraintSolver
 */
public interface ConstraintSolver extends AutoCloseable {

    SolverResult check(Predicate predicate);

    /**
     * Releases the resources held by this solver. No further queries may be issued afterwards.
     */
    @Override
    default void close() {}
}
