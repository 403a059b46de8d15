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
package de.dpnlearn.algorithm.mapping;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.dpnlearn.api.exception.StructuralInvariantException;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.PropagationMode;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.dpn.Arc;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.dpn.Marking;
import de.dpnlearn.datastructure.dpn.NetTransition;
import de.dpnlearn.datastructure.dpn.Place;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.efsm.Variable;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.testng.Assert;
import org.testng.annotations.Test;

public class EFSMToDPNMapperTest {

    private static final Predicate LOW = Predicate.of(AtomicPredicate.numeric("amt", ComparisonOperator.LE, 1040));
    private static final Predicate HIGH = Predicate.of(AtomicPredicate.numeric("amt", ComparisonOperator.GE, 1040));

    /**
     * s0 -A-> s1, s1 -B [amt <= 1040]-> s2, s1 -C [amt >= 1040] {status := "big"}-> s2, s2 -D-> s0.
     */
    private static EFSM approval() {
        final List<State> states =
                Arrays.asList(new State("s0", false), new State("s1", false), new State("s2", true));
        final ConstantAssignment status = new ConstantAssignment(AttributeValue.categorical("big"));
        final Update big = Update.of(Collections.singletonMap("status", status));
        final List<Transition> transitions =
                Arrays.asList(new Transition(0, 0, "A", 1, Collections.emptyList()),
                              new Transition(1, 1, "B", LOW, Update.EMPTY, 2, Collections.emptyList()),
                              new Transition(2, 1, "C", HIGH, big, 2, Collections.emptyList()),
                              new Transition(3, 2, "D", 0, Collections.emptyList()));
        return EFSM.create(states,
                           0,
                           Collections.singletonMap("amt",
                                                    new Variable("amt",
                                                                 AttributeType.NUMERIC,
                                                                 PropagationMode.PERSISTENT)),
                           transitions);
    }

    @Test
    public void testBijection() {
        final EFSM efsm = approval();
        final DataPetriNet net = new EFSMToDPNMapper().map(efsm);

        Assert.assertEquals(net.getPlaces().size(), efsm.size());
        Assert.assertEquals(net.getTransitions().size(), efsm.getTransitions().size());
        Assert.assertEquals(net.getArcs().size(), 2 * efsm.getTransitions().size());
        Assert.assertEquals(net.getInitialMarking(), Marking.of("p_s0"));
        Assert.assertEquals(net.getFinalMarkings(), Collections.singletonList(Marking.of("p_s2")));

        final NetTransition c = net.getTransition("t2_C");
        Assert.assertNotNull(c);
        Assert.assertEquals(c.getGuard(), HIGH);
        Assert.assertEquals(c.getReadVariables(), Collections.singleton("amt"));
        Assert.assertEquals(c.getWriteVariables(), Collections.singleton("status"));
        Assert.assertEquals(net.getPreset(c), Collections.singletonList("p_s1"));
        Assert.assertEquals(net.getPostset(c), Collections.singletonList("p_s2"));

        Assert.assertEquals(net.getVariables().get("amt"), AttributeType.NUMERIC);
        Assert.assertEquals(net.getVariables().get("status"), AttributeType.CATEGORICAL);
    }

    @Test
    public void testArcsReferenceExistingNodes() {
        final DataPetriNet net = new EFSMToDPNMapper().map(approval());
        for (Arc arc : net.getArcs()) {
            Assert.assertNotNull(net.getPlace(arc.getPlace()), arc.toString());
            Assert.assertNotNull(net.getTransition(arc.getTransition()), arc.toString());
        }
    }

    @Test
    public void testMappedNetIsPreserving() {
        final EFSM efsm = approval();
        new PreservationChecker().check(efsm, new EFSMToDPNMapper().map(efsm));
    }

    @Test
    public void testGuardsBehaveIdentically() {
        final EFSM efsm = approval();
        final DataPetriNet net = new EFSMToDPNMapper().map(efsm);
        final Marking atS1 = Marking.of("p_s1");
        final NetTransition b = net.getTransition("t1_B");
        Assert.assertNotNull(b);

        final Valuation small = Valuation.builder().put("amt", 50).build();
        final Valuation large = Valuation.builder().put("amt", 2000).build();
        Assert.assertTrue(net.isEnabled(atS1, b, small));
        Assert.assertFalse(net.isEnabled(atS1, b, large));
        Assert.assertEquals(efsm.getTransition(1).getGuard().evaluate(small), b.getGuard().evaluate(small));
    }

    @Test
    public void testRejectsDroppedGuard() {
        final EFSM efsm = approval();
        final DataPetriNet mapped = new EFSMToDPNMapper().map(efsm);

        final DataPetriNet.Builder tampered = DataPetriNet.builder();
        for (Place p : mapped.getPlaces()) {
            tampered.addPlace(p);
        }
        for (NetTransition t : mapped.getTransitions()) {
            if (t.getId().equals("t1_B")) {
                tampered.addTransition(new NetTransition(t.getId(), t.getLabel(), Predicate.TRUE, t.getUpdate()));
            } else {
                tampered.addTransition(t);
            }
        }
        for (Arc arc : mapped.getArcs()) {
            tampered.addArc(arc);
        }
        tampered.setInitialMarking(mapped.getInitialMarking());

        Assert.assertThrows(StructuralInvariantException.class,
                            () -> new PreservationChecker().check(efsm, tampered.build()));
    }

    @Test
    public void testRejectsRedirectedArc() {
        final EFSM efsm = approval();
        final DataPetriNet mapped = new EFSMToDPNMapper().map(efsm);

        final DataPetriNet.Builder tampered = DataPetriNet.builder();
        for (Place p : mapped.getPlaces()) {
            tampered.addPlace(p);
        }
        for (NetTransition t : mapped.getTransitions()) {
            tampered.addTransition(t);
        }
        for (Arc arc : mapped.getArcs()) {
            if (arc.getDirection() == Arc.Direction.OUTPUT && arc.getTransition().equals("t3_D")) {
                tampered.addArc(Arc.output("t3_D", "p_s1"));
            } else {
                tampered.addArc(arc);
            }
        }
        tampered.setInitialMarking(mapped.getInitialMarking());
        for (Marking m : mapped.getFinalMarkings()) {
            tampered.addFinalMarking(m);
        }

        Assert.assertThrows(StructuralInvariantException.class,
                            () -> new PreservationChecker().check(efsm, tampered.build()));
    }

    @Test
    public void testRejectsDanglingArc() {
        final EFSM efsm = approval();
        final DataPetriNet mapped = new EFSMToDPNMapper().map(efsm);

        final DataPetriNet.Builder tampered = DataPetriNet.builder();
        for (Place p : mapped.getPlaces()) {
            tampered.addPlace(p);
        }
        for (NetTransition t : mapped.getTransitions()) {
            tampered.addTransition(t);
        }
        for (Arc arc : mapped.getArcs()) {
            tampered.addArc(arc);
        }
        tampered.addArc(Arc.output("t0_A", "p_nowhere"));
        tampered.setInitialMarking(mapped.getInitialMarking());

        Assert.assertThrows(StructuralInvariantException.class,
                            () -> new PreservationChecker().check(efsm, tampered.build()));
    }

    @Test
    public void testRejectsWrongFinalMarking() {
        final EFSM efsm = approval();
        final DataPetriNet mapped = new EFSMToDPNMapper().map(efsm);

        final DataPetriNet.Builder tampered = DataPetriNet.builder();
        for (Place p : mapped.getPlaces()) {
            tampered.addPlace(p);
        }
        for (NetTransition t : mapped.getTransitions()) {
            tampered.addTransition(t);
        }
        for (Arc arc : mapped.getArcs()) {
            tampered.addArc(arc);
        }
        tampered.setInitialMarking(mapped.getInitialMarking());
        tampered.addFinalMarking(Marking.of("p_s1"));

        final StructuralInvariantException e =
                Assert.expectThrows(StructuralInvariantException.class,
                                    () -> new PreservationChecker().check(efsm, tampered.build()));
        Assert.assertTrue(e.getMessage().contains("terminal languages"), e.getMessage());
    }
}
