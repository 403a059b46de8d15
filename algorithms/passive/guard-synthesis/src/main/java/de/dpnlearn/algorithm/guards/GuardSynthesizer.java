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
package de.dpnlearn.algorithm.guards;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import de.dpnlearn.api.diagnostic.DiagnosticKind;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import de.dpnlearn.datastructure.predicate.PredicatePool;
import de.dpnlearn.oracle.solver.ConstraintSolver;
import de.dpnlearn.oracle.solver.SolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches for a conjunctive guard that separates positive from negative example valuations.
 * <p>
 * Candidates are enumerated by increasing size {@code k = 1 .. maxConjuncts}; within one size, conjunctions are
 * enumerated as lexicographically ordered index combinations over the {@link PredicatePool atom pool}. For {@code k
 * >= 2} only atoms that hold on every positive example are combined. A candidate is accepted if it holds on every
 * positive and on no negative example and if the {@link ConstraintSolver} confirms it: the guard itself must be
 * satisfiable, the guard must be satisfiable together with each positive example and unsatisfiable together with
 * each negative example. A solver answer of {@link SolverResult#UNKNOWN} rejects the candidate.
 * <p>
 * If no candidate is accepted, the universal guard is returned and an {@link DiagnosticKind#UNCONSTRAINED_GUARD}
 * diagnostic is reported.
 */
public class GuardSynthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GuardSynthesizer.class);

    public static final int DEFAULT_MAX_SOLVER_EXAMPLES = 50;

    private final ConstraintSolver solver;
    private final PredicatePool pool;
    private final AttributeDomains domains;
    private final Diagnostics diagnostics;
    private final int maxConjuncts;
    private final int maxSolverExamples;

    public GuardSynthesizer(ConstraintSolver solver,
                            AttributeDomains domains,
                            Diagnostics diagnostics,
                            int maxConjuncts) {
        this(solver, new PredicatePool(), domains, diagnostics, maxConjuncts, DEFAULT_MAX_SOLVER_EXAMPLES);
    }

    public GuardSynthesizer(ConstraintSolver solver,
                            PredicatePool pool,
                            AttributeDomains domains,
                            Diagnostics diagnostics,
                            int maxConjuncts,
                            int maxSolverExamples) {
        Preconditions.checkArgument(maxConjuncts >= 1, "maxConjuncts must be positive: %s", maxConjuncts);
        Preconditions.checkArgument(maxSolverExamples >= 1, "maxSolverExamples must be positive: %s", maxSolverExamples);
        this.solver = solver;
        this.pool = pool;
        this.domains = domains;
        this.diagnostics = diagnostics;
        this.maxConjuncts = maxConjuncts;
        this.maxSolverExamples = maxSolverExamples;
    }

    /**
     * Synthesizes a guard for the given examples.
     *
     * @param subject
     *         a description of the transition the guard is synthesized for, used in diagnostics
     * @param positives
     *         the valuations the guard has to accept
     * @param negatives
     *         the valuations the guard has to reject
     *
     * @return the first accepted candidate, or {@link Predicate#TRUE}
     */
    public Predicate synthesize(String subject, List<Valuation> positives, List<Valuation> negatives) {
        if (positives.isEmpty() || negatives.isEmpty()) {
            return Predicate.TRUE;
        }

        List<AtomicPredicate> atoms = pool.generate(positives, negatives, domains);
        Search search = new Search(positives, negatives);

        for (AtomicPredicate atom : atoms) {
            Predicate candidate = Predicate.of(atom);
            if (search.accepts(candidate)) {
                return search.found(subject, candidate);
            }
        }

        if (maxConjuncts >= 2) {
            List<AtomicPredicate> filtered = new ArrayList<>();
            for (AtomicPredicate atom : atoms) {
                if (holdsOnAll(Predicate.of(atom), positives)) {
                    filtered.add(atom);
                }
            }
            for (int k = 2; k <= Math.min(maxConjuncts, filtered.size()); k++) {
                int[] indices = new int[k];
                for (int i = 0; i < k; i++) {
                    indices[i] = i;
                }
                do {
                    List<AtomicPredicate> conjuncts = new ArrayList<>(k);
                    for (int idx : indices) {
                        conjuncts.add(filtered.get(idx));
                    }
                    Predicate candidate = Predicate.of(conjuncts);
                    if (search.accepts(candidate)) {
                        return search.found(subject, candidate);
                    }
                } while (nextCombination(indices, filtered.size()));
            }
        }

        search.reportInconclusive(subject);
        LOGGER.warn("No separating guard found for {} ({} positive, {} negative examples)",
                    subject,
                    positives.size(),
                    negatives.size());
        diagnostics.report(DiagnosticKind.UNCONSTRAINED_GUARD,
                           subject,
                           "no conjunction of at most " + maxConjuncts + " atoms separates " + positives.size() +
                           " positive from " + negatives.size() + " negative examples");
        return Predicate.TRUE;
    }

    /**
     * Advances {@code indices} to the next {@code k}-combination of {@code 0 .. n-1} in lexicographic order.
     *
     * @return {@code false} if {@code indices} already was the last combination
     */
    static boolean nextCombination(int[] indices, int n) {
        int k = indices.length;
        int i = k - 1;
        while (i >= 0 && indices[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        indices[i]++;
        for (int j = i + 1; j < k; j++) {
            indices[j] = indices[j - 1] + 1;
        }
        return true;
    }

    static boolean holdsOnAll(Predicate predicate, Collection<Valuation> valuations) {
        for (Valuation v : valuations) {
            if (!predicate.evaluate(v)) {
                return false;
            }
        }
        return true;
    }

    static boolean holdsOnNone(Predicate predicate, Collection<Valuation> valuations) {
        for (Valuation v : valuations) {
            if (predicate.evaluate(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Encodes a concrete valuation as a conjunction of equalities.
     */
    static Predicate pointOf(Valuation point) {
        List<AtomicPredicate> atoms = new ArrayList<>(point.size());
        for (Map.Entry<String, AttributeValue> e : point.asMap().entrySet()) {
            AttributeValue value = e.getValue();
            if (value.getType() == AttributeType.NUMERIC) {
                atoms.add(AtomicPredicate.numeric(e.getKey(), ComparisonOperator.EQ, value.asNumber()));
            } else {
                atoms.add(AtomicPredicate.categorical(e.getKey(), value.asCategory()));
            }
        }
        return Predicate.of(atoms);
    }

    /**
     * The state of one synthesis run.
     */
    private final class Search {

        private final List<Valuation> positives;
        private final List<Valuation> negatives;
        private int inconclusive;

        Search(List<Valuation> positives, List<Valuation> negatives) {
            this.positives = positives;
            this.negatives = negatives;
        }

        boolean accepts(Predicate candidate) {
            return holdsOnAll(candidate, positives) && holdsOnNone(candidate, negatives) && confirm(candidate);
        }

        Predicate found(String subject, Predicate guard) {
            reportInconclusive(subject);
            LOGGER.debug("Synthesized guard '{}' for {}", guard, subject);
            return guard;
        }

        void reportInconclusive(String subject) {
            if (inconclusive > 0) {
                diagnostics.report(DiagnosticKind.SOLVER_INCONCLUSIVE,
                                   subject,
                                   inconclusive + " candidate guard(s) rejected on an inconclusive solver answer");
            }
        }

        private boolean confirm(Predicate guard) {
            SolverResult self = solver.check(guard);
            if (self != SolverResult.SAT) {
                return reject(self);
            }

            Set<String> variables = guard.getVariables();
            for (Valuation point : distinctPoints(positives, variables)) {
                SolverResult result = solver.check(guard.and(pointOf(point)));
                if (result != SolverResult.SAT) {
                    return reject(result);
                }
            }
            for (Valuation point : distinctPoints(negatives, variables)) {
                if (!point.getAttributes().containsAll(variables)) {
                    // a missing attribute already falsifies the guard
                    continue;
                }
                SolverResult result = solver.check(guard.and(pointOf(point)));
                if (result != SolverResult.UNSAT) {
                    return reject(result);
                }
            }
            return true;
        }

        private boolean reject(SolverResult result) {
            if (result == SolverResult.UNKNOWN) {
                inconclusive++;
            }
            return false;
        }

        private Set<Valuation> distinctPoints(List<Valuation> examples, Set<String> variables) {
            Set<Valuation> result = new LinkedHashSet<>();
            for (Valuation v : examples) {
                if (result.size() >= maxSolverExamples) {
                    break;
                }
                result.add(v.project(variables));
            }
            return result;
        }
    }
}
