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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import de.dpnlearn.api.exception.StructuralInvariantException;
import de.dpnlearn.datastructure.dpn.Arc;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.dpn.Marking;
import de.dpnlearn.datastructure.dpn.NetTransition;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.util.automata.equivalence.DeterministicEquivalenceTest;
import net.automatalib.util.automata.fsa.DFAs;
import net.automatalib.util.automata.fsa.NFAs;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that a {@link DataPetriNet} produced by {@link EFSMToDPNMapper} preserves the structure and behavior of
 * its source {@link EFSM}:
 * <ul>
 * <li>places and states, as well as net transitions and EFSM transitions, are in bijection and every arc references
 * an existing place and transition,</li>
 * <li>the places reachable under the firing rule are exactly the places of the reachable states,</li>
 * <li>the net's reachability graph and the EFSM accept the same label sequences, both as prefix languages and as
 * terminal languages (final markings versus accepting states),</li>
 * <li>every net transition carries exactly the guard and update of its EFSM transition.</li>
 * </ul>
 * A violation is reported by a {@link StructuralInvariantException}.
 */
public class PreservationChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(PreservationChecker.class);

    public void check(EFSM efsm, DataPetriNet net) {
        checkBijection(efsm, net);
        checkArcs(net);
        checkAnnotations(efsm, net);

        ReachabilityGraph graph = explore(net);
        checkReachablePlaces(efsm, graph);
        checkLanguages(efsm, net, graph);

        LOGGER.debug("Net with {} places preserves EFSM with {} states ({} reachable markings)",
                     net.getPlaces().size(),
                     efsm.size(),
                     graph.markings.size());
    }

    private static void checkBijection(EFSM efsm, DataPetriNet net) {
        if (net.getPlaces().size() != efsm.size()) {
            throw violation("net has " + net.getPlaces().size() + " places but the EFSM has " + efsm.size() +
                            " states");
        }
        if (net.getTransitions().size() != efsm.getTransitions().size()) {
            throw violation("net has " + net.getTransitions().size() + " transitions but the EFSM has " +
                            efsm.getTransitions().size());
        }
        for (State state : efsm.getStates()) {
            if (net.getPlace(EFSMToDPNMapper.placeId(state)) == null) {
                throw violation("no place for state " + state.getName());
            }
        }
        if (!net.getInitialMarking().equals(Marking.of(EFSMToDPNMapper.placeId(efsm.getInitialState())))) {
            throw violation("initial marking " + net.getInitialMarking() + " does not mark the initial state only");
        }
    }

    private static void checkArcs(DataPetriNet net) {
        for (Arc arc : net.getArcs()) {
            if (net.getPlace(arc.getPlace()) == null) {
                throw violation("arc " + arc + " references unknown place " + arc.getPlace());
            }
            if (net.getTransition(arc.getTransition()) == null) {
                throw violation("arc " + arc + " references unknown transition " + arc.getTransition());
            }
        }
    }

    private static void checkAnnotations(EFSM efsm, DataPetriNet net) {
        for (Transition t : efsm.getTransitions()) {
            String id = EFSMToDPNMapper.transitionId(t);
            NetTransition nt = net.getTransition(id);
            if (nt == null) {
                throw violation("no net transition for EFSM transition " + t);
            }
            if (!nt.getLabel().equals(t.getLabel())) {
                throw violation(id + " is labelled " + nt.getLabel() + " instead of " + t.getLabel());
            }
            if (!nt.getGuard().equals(t.getGuard())) {
                throw violation(id + " carries guard " + nt.getGuard() + " instead of " + t.getGuard());
            }
            if (!nt.getUpdate().equals(t.getUpdate())) {
                throw violation(id + " carries update " + nt.getUpdate() + " instead of " + t.getUpdate());
            }

            List<String> expectedPre =
                    Collections.singletonList(EFSMToDPNMapper.placeId(efsm.getState(t.getSource())));
            List<String> expectedPost =
                    Collections.singletonList(EFSMToDPNMapper.placeId(efsm.getState(t.getTarget())));
            if (!net.getPreset(nt).equals(expectedPre) || !net.getPostset(nt).equals(expectedPost)) {
                throw violation(id + " is connected " + net.getPreset(nt) + " -> " + net.getPostset(nt) +
                                " instead of " + expectedPre + " -> " + expectedPost);
            }
        }
    }

    private static void checkReachablePlaces(EFSM efsm, ReachabilityGraph graph) {
        Set<String> expected = new HashSet<>();
        for (int s : efsm.reachableStates()) {
            expected.add(EFSMToDPNMapper.placeId(efsm.getState(s)));
        }
        Set<String> actual = new HashSet<>();
        for (Marking m : graph.markings) {
            actual.addAll(m.getMarkedPlaces());
        }
        if (!expected.equals(actual)) {
            throw violation("reachable places " + new TreeSet<>(actual) +
                            " differ from the places of reachable states " + new TreeSet<>(expected));
        }
    }

    private static void checkLanguages(EFSM efsm, DataPetriNet net, ReachabilityGraph graph) {
        SortedSet<String> labels = new TreeSet<>();
        labels.addAll(efsm.getInputAlphabet());
        for (NetTransition t : net.getTransitions()) {
            labels.add(t.getLabel());
        }
        Alphabet<String> alphabet = Alphabets.fromCollection(labels);
        Set<Marking> finals = new HashSet<>(net.getFinalMarkings());

        CompactDFA<String> efsmPrefixes = NFAs.determinize(efsmToNFA(efsm, alphabet, false), alphabet);
        CompactDFA<String> netPrefixes = NFAs.determinize(graph.toNFA(alphabet, null), alphabet);
        compare("prefix", efsmPrefixes, netPrefixes, alphabet);

        CompactDFA<String> efsmTerminal = NFAs.determinize(efsmToNFA(efsm, alphabet, true), alphabet);
        CompactDFA<String> netTerminal = NFAs.determinize(graph.toNFA(alphabet, finals), alphabet);
        compare("terminal", efsmTerminal, netTerminal, alphabet);
    }

    private static void compare(String kind,
                                CompactDFA<String> efsm,
                                CompactDFA<String> net,
                                Alphabet<String> alphabet) {
        if (!DFAs.acceptsEmptyLanguage(DFAs.xor(efsm, net, alphabet))) {
            Word<String> witness = DeterministicEquivalenceTest.findSeparatingWord(efsm, net, alphabet);
            throw violation("the " + kind + " languages of EFSM and net differ, e.g. on " + witness);
        }
    }

    private static CompactNFA<String> efsmToNFA(EFSM efsm, Alphabet<String> alphabet, boolean acceptingOnly) {
        CompactNFA<String> nfa = new CompactNFA<>(alphabet);
        for (State state : efsm.getStates()) {
            nfa.addIntState(!acceptingOnly || state.isAccepting());
        }
        nfa.setInitial(efsm.getInitialIndex(), true);
        for (Transition t : efsm.getTransitions()) {
            nfa.addTransition(t.getSource(), t.getLabel(), t.getTarget());
        }
        return nfa;
    }

    private static ReachabilityGraph explore(DataPetriNet net) {
        ReachabilityGraph graph = new ReachabilityGraph();
        Deque<Marking> queue = new ArrayDeque<>();
        graph.indexOf(net.getInitialMarking());
        queue.add(net.getInitialMarking());

        while (!queue.isEmpty()) {
            Marking current = queue.poll();
            if (current.getTokenCount() != 1) {
                throw violation("reachable marking " + current + " does not carry exactly one token");
            }
            int source = graph.indexOf(current);
            for (NetTransition t : net.enabledTransitions(current)) {
                Marking next = net.fire(current, t);
                boolean fresh = !graph.contains(next);
                int target = graph.indexOf(next);
                graph.edges.add(new Edge(source, t.getLabel(), target));
                if (fresh) {
                    queue.add(next);
                }
            }
        }
        return graph;
    }

    private static StructuralInvariantException violation(String message) {
        LOGGER.error("Mapping is not structure-preserving: {}", message);
        return new StructuralInvariantException(message);
    }

    /**
     * Markings reachable from the initial marking (index 0) and the labelled firings between them.
     */
    private static final class ReachabilityGraph {

        private final List<Marking> markings = new ArrayList<>();
        private final Map<Marking, Integer> index = new HashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        boolean contains(Marking marking) {
            return index.containsKey(marking);
        }

        int indexOf(Marking marking) {
            Integer idx = index.get(marking);
            if (idx == null) {
                idx = markings.size();
                markings.add(marking);
                index.put(marking, idx);
            }
            return idx;
        }

        /**
         * @param finals
         *         the accepting markings, or {@code null} to accept in every marking
         */
        CompactNFA<String> toNFA(Alphabet<String> alphabet, @Nullable Set<Marking> finals) {
            CompactNFA<String> nfa = new CompactNFA<>(alphabet);
            for (Marking m : markings) {
                nfa.addIntState(finals == null || finals.contains(m));
            }
            nfa.setInitial(0, true);
            for (Edge e : edges) {
                nfa.addTransition(e.source, e.label, e.target);
            }
            return nfa;
        }
    }

    private static final class Edge {

        private final int source;
        private final String label;
        private final int target;

        Edge(int source, String label, int target) {
            this.source = source;
            this.label = label;
            this.target = target;
        }
    }
}
