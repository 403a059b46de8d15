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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import de.dpnlearn.api.exception.StructuralInvariantException;
import de.dpnlearn.datastructure.predicate.Predicate;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An extended finite state machine: a (possibly nondeterministic) labelled transition system whose transitions carry
 * a {@link Predicate guard} over variables and an {@link Update update} of variables.
 * <p>
 * States and transitions are stored in index-addressed lists. The following invariants hold for every instance:
 * <ul>
 * <li>every transition's source and target is a valid state index,</li>
 * <li>every transition's id equals its index,</li>
 * <li>every state is reachable from the initial state.</li>
 * </ul>
 * {@link #create(List, int, Map, List)} establishes these invariants: states that are not reachable are pruned
 * (together with their transitions), references to non-existent states are rejected with a
 * {@link StructuralInvariantException}.
 */
public final class EFSM {

    private final ImmutableList<State> states;
    private final int initial;
    private final ImmutableSortedMap<String, Variable> variables;
    private final ImmutableList<Transition> transitions;
    private final Alphabet<String> alphabet;
    private final List<List<Transition>> outgoing;

    private EFSM(List<State> states,
                 int initial,
                 Map<String, Variable> variables,
                 List<Transition> transitions) {
        this.states = ImmutableList.copyOf(states);
        this.initial = initial;
        this.variables = ImmutableSortedMap.copyOf(variables);
        this.transitions = ImmutableList.copyOf(transitions);

        SortedSet<String> labels = new TreeSet<>();
        List<List<Transition>> out = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            out.add(new ArrayList<>());
        }
        for (Transition t : transitions) {
            labels.add(t.getLabel());
            out.get(t.getSource()).add(t);
        }
        this.alphabet = Alphabets.fromCollection(labels);
        this.outgoing = new ArrayList<>(states.size());
        for (List<Transition> list : out) {
            this.outgoing.add(Collections.unmodifiableList(list));
        }
    }

    /**
     * Creates a new EFSM. Transitions are re-numbered in the given order; states unreachable from {@code initial}
     * are dropped and the remaining states re-indexed, preserving their relative order.
     *
     * @throws StructuralInvariantException
     *         if the initial state or a transition endpoint does not exist
     */
    public static EFSM create(List<State> states,
                              int initial,
                              Map<String, Variable> variables,
                              List<Transition> transitions) {
        if (initial < 0 || initial >= states.size()) {
            throw new StructuralInvariantException("Initial state " + initial + " does not exist (" + states.size() +
                                                   " states)");
        }
        for (Transition t : transitions) {
            if (t.getSource() < 0 || t.getSource() >= states.size()) {
                throw new StructuralInvariantException("Transition " + t + " has non-existent source state");
            }
            if (t.getTarget() < 0 || t.getTarget() >= states.size()) {
                throw new StructuralInvariantException("Transition " + t + " has non-existent target state");
            }
        }

        BitSet reachable = reachable(states.size(), initial, transitions);

        int[] remap = new int[states.size()];
        List<State> keptStates = new ArrayList<>(reachable.cardinality());
        for (int i = 0; i < states.size(); i++) {
            if (reachable.get(i)) {
                remap[i] = keptStates.size();
                keptStates.add(states.get(i));
            } else {
                remap[i] = -1;
            }
        }

        List<Transition> keptTransitions = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            if (reachable.get(t.getSource())) {
                keptTransitions.add(t.relocate(keptTransitions.size(), remap[t.getSource()], remap[t.getTarget()]));
            }
        }

        return new EFSM(keptStates, remap[initial], variables, keptTransitions);
    }

    private static BitSet reachable(int size, int initial, Collection<Transition> transitions) {
        List<List<Integer>> successors = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            successors.add(new ArrayList<>());
        }
        for (Transition t : transitions) {
            successors.get(t.getSource()).add(t.getTarget());
        }

        BitSet visited = new BitSet(size);
        Deque<Integer> queue = new ArrayDeque<>();
        visited.set(initial);
        queue.add(initial);
        while (!queue.isEmpty()) {
            for (int succ : successors.get(queue.poll())) {
                if (!visited.get(succ)) {
                    visited.set(succ);
                    queue.add(succ);
                }
            }
        }
        return visited;
    }

    public List<State> getStates() {
        return states;
    }

    public State getState(int index) {
        return states.get(index);
    }

    public int size() {
        return states.size();
    }

    public int getInitialIndex() {
        return initial;
    }

    public State getInitialState() {
        return states.get(initial);
    }

    /**
     * Returns the index of the state with the given name, or {@code -1} if there is none.
     */
    public int indexOf(String stateName) {
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i).getName().equals(stateName)) {
                return i;
            }
        }
        return -1;
    }

    public SortedMap<String, Variable> getVariables() {
        return variables;
    }

    public @Nullable Variable getVariable(String name) {
        return variables.get(name);
    }

    public Alphabet<String> getInputAlphabet() {
        return alphabet;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public Transition getTransition(int id) {
        return transitions.get(id);
    }

    public List<Transition> getOutgoing(int state) {
        return outgoing.get(state);
    }

    public List<Transition> getOutgoing(int state, String label) {
        List<Transition> result = new ArrayList<>();
        for (Transition t : outgoing.get(state)) {
            if (t.getLabel().equals(label)) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * The indices of all states reachable from the initial state. By construction, this is every state.
     */
    public Set<Integer> reachableStates() {
        BitSet bits = reachable(states.size(), initial, transitions);
        Set<Integer> result = new HashSet<>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(i);
        }
        return result;
    }

    /**
     * Checks whether the given label sequence can be executed from the initial state when guards are ignored.
     */
    public boolean admits(Word<String> labels) {
        Set<Integer> current = Collections.singleton(initial);
        for (String label : labels) {
            Set<Integer> next = new HashSet<>();
            for (int s : current) {
                for (Transition t : getOutgoing(s, label)) {
                    next.add(t.getTarget());
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }
        return true;
    }

    /**
     * Returns a copy of this EFSM in which every transition carries the guard and update at its index in the given
     * lists.
     */
    public EFSM withAnnotations(List<Predicate> guards, List<Update> updates) {
        Preconditions.checkArgument(guards.size() == transitions.size(),
                                    "expected %s guards, got %s",
                                    transitions.size(),
                                    guards.size());
        Preconditions.checkArgument(updates.size() == transitions.size(),
                                    "expected %s updates, got %s",
                                    transitions.size(),
                                    updates.size());
        List<Transition> annotated = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            annotated.add(t.withAnnotations(guards.get(t.getId()), updates.get(t.getId())));
        }
        return new EFSM(states, initial, variables, annotated);
    }

    public EFSM withVariables(Map<String, Variable> variables) {
        return new EFSM(states, initial, variables, transitions);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("EFSM(initial=").append(getInitialState()).append(")\n");
        for (Transition t : transitions) {
            builder.append("  ")
                   .append(states.get(t.getSource()).getName())
                   .append(" -")
                   .append(t.getLabel())
                   .append(" [")
                   .append(t.getGuard())
                   .append("] ")
                   .append(t.getUpdate())
                   .append("-> ")
                   .append(states.get(t.getTarget()).getName())
                   .append('\n');
        }
        return builder.toString();
    }
}
