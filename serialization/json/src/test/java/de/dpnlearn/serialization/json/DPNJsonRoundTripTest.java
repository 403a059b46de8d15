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
package de.dpnlearn.serialization.json;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import de.dpnlearn.algorithm.efsm.EFSMLearner;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Event;
import de.dpnlearn.api.log.Trace;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.dpn.Arc;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.dpn.Marking;
import de.dpnlearn.datastructure.dpn.NetTransition;
import de.dpnlearn.datastructure.dpn.Place;
import de.dpnlearn.datastructure.efsm.Assignment;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EventAssignment;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DPNJsonRoundTripTest {

    private static void assertSameNet(DataPetriNet actual, DataPetriNet expected) {
        Assert.assertEquals(actual.getPlaces(), expected.getPlaces());
        Assert.assertEquals(actual.getTransitions(), expected.getTransitions());
        Assert.assertEquals(actual.getArcs(), expected.getArcs());
        Assert.assertEquals(actual.getInitialMarking(), expected.getInitialMarking());
        Assert.assertEquals(actual.getFinalMarkings(), expected.getFinalMarkings());
        Assert.assertEquals(actual.getVariables(), expected.getVariables());
    }

    /**
     * A net that is not a state machine, with categorical guards and both kinds of assignments.
     */
    private static DataPetriNet handcrafted() {
        final Predicate guard = Predicate.of(AtomicPredicate.numeric("amt", ComparisonOperator.GT, 12.5),
                                             AtomicPredicate.categorical("region", "north"));
        final Map<String, Assignment> assignments = new HashMap<>();
        assignments.put("status", new ConstantAssignment(AttributeValue.categorical("open")));
        assignments.put("amt",
                        new EventAssignment("amt",
                                            Arrays.asList(AttributeValue.numeric(1), AttributeValue.numeric(2))));

        final Map<String, Integer> twoTokens = new HashMap<>();
        twoTokens.put("left", 1);
        twoTokens.put("right", 2);

        return DataPetriNet.builder()
                           .addPlace(new Place("left"))
                           .addPlace(new Place("right"))
                           .addTransition(new NetTransition("t0", "A", guard, Update.of(assignments)))
                           .addTransition(new NetTransition("t1", "B", Predicate.TRUE, Update.EMPTY))
                           .addArc(Arc.input("left", "t0"))
                           .addArc(Arc.input("right", "t0"))
                           .addArc(Arc.output("t0", "right"))
                           .addArc(Arc.input("right", "t1"))
                           .setInitialMarking(Marking.of(twoTokens))
                           .addFinalMarking(Marking.empty())
                           .addFinalMarking(Marking.of("right"))
                           .addVariable("amt", AttributeType.NUMERIC)
                           .addVariable("region", AttributeType.CATEGORICAL)
                           .addVariable("status", AttributeType.CATEGORICAL)
                           .build();
    }

    @Test
    public void testLearnedNetRoundTrip() throws IOException {
        final DataPetriNet net = new EFSMLearner().learn(Arrays.asList(
                Trace.of("c1", new Event("A", Valuation.builder().put("amt", 50).build()), Event.of("B")),
                Trace.of("c2", new Event("A", Valuation.builder().put("amt", 2000).build()), Event.of("C")),
                Trace.of("c3", new Event("A", Valuation.builder().put("amt", 80).build()), Event.of("B"))))
                                                  .getDPN();

        assertSameNet(DPNJsonReader.read(DPNJsonWriter.write(net)), net);
    }

    @Test
    public void testHandcraftedNetRoundTrip() throws IOException {
        final DataPetriNet net = handcrafted();

        final StringWriter writer = new StringWriter();
        DPNJsonWriter.write(net, writer);
        final DataPetriNet read = DPNJsonReader.read(new StringReader(writer.toString()));

        assertSameNet(read, net);
        final NetTransition t0 = read.getTransition("t0");
        Assert.assertNotNull(t0);
        Assert.assertEquals(read.getPreset(t0), Arrays.asList("left", "right"));
        Assert.assertEquals(t0.getWriteVariables(), new TreeSet<>(Arrays.asList("amt", "status")));
    }

    @Test
    public void testEmptyNetRoundTrip() throws IOException {
        final DataPetriNet net = DataPetriNet.builder().build();
        assertSameNet(DPNJsonReader.read(DPNJsonWriter.write(net)), net);
        Assert.assertEquals(DPNJsonReader.read(DPNJsonWriter.write(net)).getFinalMarkings(), Collections.emptyList());
    }

    @Test
    public void testRejectsMalformedDocuments() {
        Assert.assertThrows(IOException.class, () -> DPNJsonReader.read("{\"places\": ["));
        Assert.assertThrows(IOException.class, () -> DPNJsonReader.read("[1, 2, 3]"));
        Assert.assertThrows(IOException.class, () -> DPNJsonReader.read("{\"places\": []}"));
        Assert.assertThrows(IOException.class,
                            () -> DPNJsonReader.read("{\"places\": [1], \"transitions\": [], \"arcs\": [], " +
                                                     "\"initialMarking\": {}, \"finalMarkings\": [], " +
                                                     "\"variables\": {}}"));
    }

    @Test
    public void testRejectsNonFiniteNumbers() {
        final String document = DPNJsonWriter.write(handcrafted());
        Assert.assertTrue(document.contains("12.5"));

        Assert.assertThrows(IOException.class, () -> DPNJsonReader.read(document.replace("12.5", "1e400")));
        Assert.assertThrows(IOException.class, () -> DPNJsonReader.read(document.replace("12.5", "-1e400")));
    }
}
