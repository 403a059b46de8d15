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
package de.dpnlearn.algorithm.efsm;

import java.time.Duration;

import de.dpnlearn.oracle.solver.ConstraintSolver;
import de.dpnlearn.oracle.solver.IntervalConstraintSolver;
import de.dpnlearn.oracle.solver.Z3ConstraintSolver;

/**
 * The decision procedure that confirms candidate guards and detects overlapping guards.
 */
public enum SolverBackend {

    /**
     * The Z3 SMT solver, bounded by its own timeout.
     */
    Z3 {
        @Override
        ConstraintSolver create(Duration timeout) {
            return new Z3ConstraintSolver(timeout);
        }
    },

    /**
     * The built-in interval procedure for single-attribute conjunctions.
     */
    INTERVAL {
        @Override
        ConstraintSolver create(Duration timeout) {
            return new IntervalConstraintSolver();
        }
    };

    abstract ConstraintSolver create(Duration timeout);
}
