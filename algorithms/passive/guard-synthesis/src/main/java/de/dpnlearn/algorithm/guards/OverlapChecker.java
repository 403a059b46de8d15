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
import java.util.List;

import de.dpnlearn.api.diagnostic.DiagnosticKind;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.oracle.solver.ConstraintSolver;
import de.dpnlearn.oracle.solver.SolverResult;
import net.automatalib.commons.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports pairs of transitions that leave the same state under the same label and whose guards can hold at the same
 * time, i.e. points of data nondeterminism.
 */
public class OverlapChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapChecker.class);

    private final ConstraintSolver solver;

    public OverlapChecker(ConstraintSolver solver) {
        this.solver = solver;
    }

    /**
     * Finds all overlapping pairs and reports each as {@link DiagnosticKind#OVERLAPPING_GUARDS}. Pairs for which the
     * solver is inconclusive are not reported.
     *
     * @return the overlapping pairs, ordered by transition id
     */
    public List<Pair<Transition, Transition>> check(EFSM efsm, Diagnostics diagnostics) {
        List<Pair<Transition, Transition>> result = new ArrayList<>();
        for (int s = 0; s < efsm.size(); s++) {
            List<Transition> outgoing = efsm.getOutgoing(s);
            for (int i = 0; i < outgoing.size(); i++) {
                for (int j = i + 1; j < outgoing.size(); j++) {
                    Transition a = outgoing.get(i);
                    Transition b = outgoing.get(j);
                    if (!a.getLabel().equals(b.getLabel())) {
                        continue;
                    }
                    if (solver.check(a.getGuard().and(b.getGuard())) == SolverResult.SAT) {
                        LOGGER.warn("Guards of transitions {} and {} overlap", a.getId(), b.getId());
                        diagnostics.report(DiagnosticKind.OVERLAPPING_GUARDS,
                                           efsm.getState(s).getName() + " -" + a.getLabel() + "->",
                                           "guards '" + a.getGuard() + "' (t" + a.getId() + ") and '" +
                                           b.getGuard() + "' (t" + b.getId() + ") are jointly satisfiable");
                        result.add(Pair.of(a, b));
                    }
                }
            }
        }
        return result;
    }
}
