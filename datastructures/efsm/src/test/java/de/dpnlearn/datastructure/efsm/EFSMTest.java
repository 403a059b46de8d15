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
package de.dpnlearn.datastructure.efsm;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.dpnlearn.api.exception.StructuralInvariantException;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class EFSMTest {

    private static Transition edge(int source, String label, int target) {
        return new Transition(0, source, label, target, Collections.emptyList());
    }

    @Test
    public void testUnreachableStatesArePruned() {
        final List<State> states = Arrays.asList(new State("s0", false),
                                                 new State("dead", false),
                                                 new State("s1", true));
        final EFSM efsm = EFSM.create(states,
                                      0,
                                      Collections.emptyMap(),
                                      Arrays.asList(edge(0, "A", 2), edge(1, "B", 2), edge(2, "C", 0)));

        Assert.assertEquals(efsm.size(), 2);
        Assert.assertEquals(efsm.indexOf("dead"), -1);
        Assert.assertEquals(efsm.getTransitions().size(), 2);
        Assert.assertEquals(efsm.getTransition(1).getLabel(), "C");
        Assert.assertEquals(efsm.getTransition(1).getId(), 1);
        Assert.assertEquals(efsm.getTransition(0).getTarget(), efsm.indexOf("s1"));
        Assert.assertEquals(efsm.reachableStates().size(), efsm.size());
        Assert.assertEquals(efsm.getInputAlphabet().size(), 2);
    }

    @Test
    public void testDanglingTransitionIsRejected() {
        final List<State> states = Collections.singletonList(new State("s0", true));
        Assert.assertThrows(StructuralInvariantException.class,
                            () -> EFSM.create(states, 0, Collections.emptyMap(), Arrays.asList(edge(0, "A", 3))));
        Assert.assertThrows(StructuralInvariantException.class,
                            () -> EFSM.create(states, 1, Collections.emptyMap(), Collections.emptyList()));
    }

    @Test
    public void testAdmitsIgnoresGuards() {
        final EFSM efsm = EFSM.create(Arrays.asList(new State("s0", false), new State("s1", true)),
                                      0,
                                      Collections.emptyMap(),
                                      Arrays.asList(edge(0, "A", 1), edge(1, "B", 1), edge(1, "C", 1)));

        Assert.assertTrue(efsm.admits(Word.fromSymbols("A", "B", "C", "B")));
        Assert.assertTrue(efsm.admits(Word.epsilon()));
        Assert.assertFalse(efsm.admits(Word.fromSymbols("B")));
        Assert.assertEquals(efsm.getOutgoing(1, "B").size(), 1);
    }

    @Test
    public void testAnnotations() {
        final EFSM efsm = EFSM.create(Arrays.asList(new State("s0", false), new State("s1", true)),
                                      0,
                                      Collections.emptyMap(),
                                      Arrays.asList(edge(0, "A", 1), edge(0, "B", 1)));

        final Predicate low = Predicate.of(AtomicPredicate.numeric("amt", ComparisonOperator.LE, 10));
        final ConstantAssignment ok = new ConstantAssignment(AttributeValue.categorical("ok"));
        final Update fixed = Update.of(Collections.singletonMap("status", ok));

        final EFSM annotated = efsm.withAnnotations(Arrays.asList(low, Predicate.TRUE),
                                                    Arrays.asList(fixed, Update.EMPTY));

        Assert.assertEquals(annotated.getTransition(0).getGuard(), low);
        Assert.assertEquals(annotated.getTransition(0).getUpdate(), fixed);
        Assert.assertTrue(annotated.getTransition(1).getGuard().isUniversal());
        Assert.assertTrue(efsm.getTransition(0).getGuard().isUniversal());
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> efsm.withAnnotations(Collections.singletonList(low), Arrays.asList(fixed, fixed)));
    }

    @Test
    public void testUpdateApplication() {
        final EventAssignment copy =
                new EventAssignment("amt", Arrays.asList(AttributeValue.numeric(1), AttributeValue.numeric(2)));
        final Update update = Update.of(Collections.singletonMap("amt", copy));
        final Valuation current = Valuation.builder().put("amt", 5).put("kind", "gold").build();

        final Valuation next = update.apply(current, Valuation.builder().put("amt", 2).build());
        Assert.assertEquals(next, Valuation.builder().put("amt", 2).put("kind", "gold").build());

        // an event without the attribute leaves the variable untouched
        Assert.assertEquals(update.apply(current, Valuation.empty()), current);
        Assert.assertSame(Update.EMPTY.apply(current, Valuation.empty()), current);
        Assert.assertEquals(update.getWrittenVariables().first(), "amt");
    }

    @Test
    public void testSkeletonEdgesKeepOrder() {
        final ControlFlowSkeleton.Builder builder = ControlFlowSkeleton.builder();
        final int s0 = builder.addState("s0");
        final int s1 = builder.addState("s1");
        final int s2 = builder.addState("s2");
        final ControlFlowSkeleton skeleton =
                builder.setInitial(s0).setAccepting(s2).addEdge(s0, "A", s2).addEdge(s0, "A", s1).build();

        Assert.assertEquals(skeleton.getEdges(s0, "A").get(0).getTarget(), s2);
        Assert.assertEquals(skeleton.getEdges(s0, "A").get(1).getTarget(), s1);
        Assert.assertTrue(skeleton.getEdges(s1, "A").isEmpty());
        Assert.assertTrue(skeleton.isAccepting(s2));
        Assert.assertThrows(IllegalArgumentException.class, () -> builder.addState("s0"));
    }
}
