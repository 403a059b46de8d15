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
package de.dpnlearn.datastructure.dpn;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DataPetriNetTest {

    private static DataPetriNet forkJoin() {
        final Predicate small = Predicate.of(AtomicPredicate.numeric("amt", ComparisonOperator.LT, 100));
        return DataPetriNet.builder()
                           .addPlace(new Place("start"))
                           .addPlace(new Place("left"))
                           .addPlace(new Place("right"))
                           .addPlace(new Place("end"))
                           .addTransition(new NetTransition("split", "A", Predicate.TRUE, Update.EMPTY))
                           .addTransition(new NetTransition("join", "B", small, Update.EMPTY))
                           .addTransition(new NetTransition("loop", "C", Predicate.TRUE, Update.EMPTY))
                           .addArc(Arc.input("start", "split"))
                           .addArc(Arc.output("split", "left"))
                           .addArc(Arc.output("split", "right"))
                           .addArc(Arc.input("left", "join"))
                           .addArc(Arc.input("right", "join"))
                           .addArc(Arc.output("join", "end"))
                           .addArc(Arc.input("end", "loop"))
                           .addArc(Arc.output("loop", "start"))
                           .setInitialMarking(Marking.of("start"))
                           .addFinalMarking(Marking.of("end"))
                           .addVariable("amt", AttributeType.NUMERIC)
                           .build();
    }

    @Test
    public void testFiringRule() {
        final DataPetriNet net = forkJoin();
        final NetTransition split = net.getTransition("split");
        final NetTransition join = net.getTransition("join");
        Assert.assertNotNull(split);
        Assert.assertNotNull(join);

        Marking m = net.getInitialMarking();
        Assert.assertEquals(net.enabledTransitions(m), Arrays.asList(split));
        Assert.assertFalse(net.isEnabled(m, join));
        Assert.assertThrows(IllegalStateException.class, () -> net.fire(net.getInitialMarking(), join));

        m = net.fire(m, split);
        final Map<String, Integer> expected = new HashMap<>();
        expected.put("left", 1);
        expected.put("right", 1);
        Assert.assertEquals(m, Marking.of(expected));
        Assert.assertEquals(m.getTokenCount(), 2);

        Assert.assertTrue(net.isEnabled(m, join, Valuation.builder().put("amt", 10).build()));
        Assert.assertFalse(net.isEnabled(m, join, Valuation.builder().put("amt", 500).build()));

        m = net.fire(m, join);
        Assert.assertEquals(m, net.getFinalMarkings().get(0));
    }

    @Test
    public void testStateMachineSkeleton() {
        final ControlFlowSkeleton skeleton = StateMachineNets.toSkeleton(forkJoin());

        Assert.assertEquals(skeleton.size(), 4);
        Assert.assertEquals(skeleton.getStateName(skeleton.getInitial()), "start");
        // split and join are not state-machine transitions
        Assert.assertEquals(skeleton.getEdges().size(), 1);
        Assert.assertEquals(skeleton.getEdges().get(0).getLabel(), "C");
        Assert.assertTrue(skeleton.isAccepting(3));
        Assert.assertFalse(skeleton.isAccepting(0));
    }

    @Test
    public void testMarkingNormalization() {
        final Map<String, Integer> tokens = new HashMap<>();
        tokens.put("p", 0);
        Assert.assertEquals(Marking.of(tokens), Marking.empty());
        Assert.assertEquals(Marking.of("p").get("q"), 0);
    }
}
