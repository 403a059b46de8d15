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

import java.util.HashMap;
import java.util.Map;

import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.CategoricalEquality;
import de.dpnlearn.datastructure.predicate.NumericComparison;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A complete decision procedure for conjunctions of atomic predicates. Since every atom constrains a single
 * attribute, a conjunction is satisfiable iff the atoms over each attribute are: numeric atoms are propagated into
 * an interval with strict or non-strict bounds, categorical atoms must agree on a single value.
 * <p>
 * This solver never answers {@link SolverResult#UNKNOWN}.
 */
public class IntervalConstraintSolver implements ConstraintSolver {

    @Override
    public SolverResult check(Predicate predicate) {
        Map<String, Domain> domains = new HashMap<>();
        for (AtomicPredicate atom : predicate.getConjuncts()) {
            Domain domain = domains.computeIfAbsent(atom.getAttribute(), k -> new Domain());
            if (!domain.restrict(atom)) {
                return SolverResult.UNSAT;
            }
        }
        for (Domain domain : domains.values()) {
            if (domain.isEmpty()) {
                return SolverResult.UNSAT;
            }
        }
        return SolverResult.SAT;
    }

    /**
     * The set of values an attribute may still take.
     */
    private static final class Domain {

        private boolean numeric;
        private boolean categorical;

        private double lower = Double.NEGATIVE_INFINITY;
        private boolean lowerStrict = true;
        private double upper = Double.POSITIVE_INFINITY;
        private boolean upperStrict = true;
        private @Nullable Double fixed;

        private @Nullable String category;

        /**
         * Restricts this domain by the given atom.
         *
         * @return {@code false} if the restriction is immediately contradictory
         */
        boolean restrict(AtomicPredicate atom) {
            if (atom instanceof NumericComparison) {
                numeric = true;
                return !categorical && restrict((NumericComparison) atom);
            }
            categorical = true;
            if (numeric) {
                return false;
            }
            String value = ((CategoricalEquality) atom).getValue();
            if (category != null && !category.equals(value)) {
                return false;
            }
            category = value;
            return true;
        }

        private boolean restrict(NumericComparison atom) {
            double c = atom.getThreshold();
            switch (atom.getOperator()) {
                case LE:
                    tightenUpper(c, false);
                    break;
                case LT:
                    tightenUpper(c, true);
                    break;
                case GE:
                    tightenLower(c, false);
                    break;
                case GT:
                    tightenLower(c, true);
                    break;
                case EQ:
                    if (fixed != null && Double.compare(fixed, c) != 0) {
                        return false;
                    }
                    fixed = c;
                    break;
                default:
                    throw new IllegalStateException("Unknown operator " + atom.getOperator());
            }
            return true;
        }

        private void tightenUpper(double c, boolean strict) {
            if (c < upper || (c == upper && strict)) {
                upper = c;
                upperStrict = strict;
            }
        }

        private void tightenLower(double c, boolean strict) {
            if (c > lower || (c == lower && strict)) {
                lower = c;
                lowerStrict = strict;
            }
        }

        boolean isEmpty() {
            if (!numeric) {
                return false;
            }
            if (fixed != null) {
                return !contains(fixed);
            }
            if (lower < upper) {
                return false;
            }
            return lower > upper || lowerStrict || upperStrict;
        }

        private boolean contains(double value) {
            boolean aboveLower = lowerStrict ? value > lower : value >= lower;
            boolean belowUpper = upperStrict ? value < upper : value <= upper;
            return aboveLower && belowUpper;
        }
    }
}
