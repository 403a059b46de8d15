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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import de.dpnlearn.api.diagnostic.DiagnosticKind;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.oracle.solver.IntervalConstraintSolver;
import net.automatalib.commons.util.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

public class EFSMAnnotatorTest {

    private static List<EdgeSample> samples(String attribute, double... values) {
        final List<EdgeSample> result = new ArrayList<>();
        for (double v : values) {
            result.add(new EdgeSample(Valuation.builder().put(attribute, v).build(), Valuation.empty()));
        }
        return result;
    }

    /**
     * s0 -A-> s1, s1 -B-> s2 (low), s1 -C-> s2 (high), s1 -D-> s2 (middle), s1 -D-> s0 (middle as well).
     */
    private static EFSM skeleton() {
        final List<State> states = Arrays.asList(new State("s0", false), new State("s1", false), new State("s2", true));
        final List<Transition> transitions =
                Arrays.asList(new Transition(0, 0, "A", 1, samples("amt", 1)),
                              new Transition(1, 1, "B", 2, samples("amt", 10, 20)),
                              new Transition(2, 1, "C", 2, samples("amt", 900, 1000)),
                              new Transition(3, 1, "D", 2, samples("amt", 400, 500)),
                              new Transition(4, 1, "D", 0, samples("amt", 450)));
        return EFSM.create(states, 0, Collections.emptyMap(), transitions);
    }

    private static EFSMAnnotator annotator(Diagnostics diagnostics, ExecutorService executor) {
        final GuardSynthesizer guards =
                new GuardSynthesizer(new IntervalConstraintSolver(), AttributeDomains.empty(), diagnostics, 2);
        return new EFSMAnnotator(guards, new UpdateInference(), executor);
    }

    @Test
    public void testGuardSeparation() {
        final Diagnostics diagnostics = new Diagnostics();
        final EFSM efsm = annotator(diagnostics, null).annotate(skeleton());

        Assert.assertTrue(efsm.getTransition(0).getGuard().isUniversal());
        for (Transition t : efsm.getTransitions()) {
            if (t.getGuard().isUniversal()) {
                continue;
            }
            final List<Valuation> positives = new ArrayList<>();
            for (EdgeSample s : t.getSamples()) {
                positives.add(s.getPreValuation());
            }
            final List<Valuation> negatives = new ArrayList<>();
            for (Transition sibling : efsm.getOutgoing(t.getSource())) {
                if (sibling.getId() != t.getId()) {
                    for (EdgeSample s : sibling.getSamples()) {
                        negatives.add(s.getPreValuation());
                    }
                }
            }
            GuardSynthesizerTest.assertSeparates(t.getGuard(), positives, negatives);
        }

        // 450 lies between the samples of the other D transition
        Assert.assertTrue(efsm.getTransition(3).getGuard().isUniversal());
        Assert.assertFalse(efsm.getTransition(4).getGuard().isUniversal());
        Assert.assertEquals(diagnostics.count(DiagnosticKind.UNCONSTRAINED_GUARD), 1);
    }

    @Test
    public void testParallelAnnotationMatchesSequential() {
        final EFSM sequential = annotator(new Diagnostics(), null).annotate(skeleton());

        final ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            final EFSM parallel = annotator(new Diagnostics(), executor).annotate(skeleton());
            for (int i = 0; i < sequential.getTransitions().size(); i++) {
                Assert.assertEquals(parallel.getTransition(i).getGuard(), sequential.getTransition(i).getGuard());
                Assert.assertEquals(parallel.getTransition(i).getUpdate(), sequential.getTransition(i).getUpdate());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testOverlapDetection() {
        final Diagnostics diagnostics = new Diagnostics();
        final EFSM efsm = annotator(new Diagnostics(), null).annotate(skeleton());

        final List<Pair<Transition, Transition>> overlaps =
                new OverlapChecker(new IntervalConstraintSolver()).check(efsm, diagnostics);

        // the universal guard of t3 overlaps with the guard of t4
        Assert.assertEquals(overlaps.size(), 1);
        Assert.assertEquals(overlaps.get(0).getFirst().getId(), 3);
        Assert.assertEquals(overlaps.get(0).getSecond().getId(), 4);
        Assert.assertEquals(diagnostics.count(DiagnosticKind.OVERLAPPING_GUARDS), 1);
    }
}
