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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An externally supplied control-flow structure: states, an initial state, accepting states and labelled edges.
 * Unlike an {@link EFSM}, a skeleton carries no data annotations and may contain several edges with the same source
 * and label. Edges keep the order in which they were added.
 */
public final class ControlFlowSkeleton {

    private final ImmutableList<String> states;
    private final int initial;
    private final BitSet accepting;
    private final ImmutableList<Edge> edges;

    private ControlFlowSkeleton(List<String> states, int initial, BitSet accepting, List<Edge> edges) {
        this.states = ImmutableList.copyOf(states);
        this.initial = initial;
        this.accepting = (BitSet) accepting.clone();
        this.edges = ImmutableList.copyOf(edges);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public String getStateName(int state) {
        return states.get(state);
    }

    public int getInitial() {
        return initial;
    }

    public boolean isAccepting(int state) {
        return accepting.get(state);
    }

    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * The edges leaving {@code state} under {@code label}, in insertion order.
     */
    public List<Edge> getEdges(int state, String label) {
        List<Edge> result = new ArrayList<>();
        for (Edge e : edges) {
            if (e.getSource() == state && e.getLabel().equals(label)) {
                result.add(e);
            }
        }
        return result.isEmpty() ? Collections.emptyList() : result;
    }

    public static final class Edge {

        private final int source;
        private final String label;
        private final int target;

        Edge(int source, String label, int target) {
            this.source = source;
            this.label = label;
            this.target = target;
        }

        public int getSource() {
            return source;
        }

        public String getLabel() {
            return label;
        }

        public int getTarget() {
            return target;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge that = (Edge) o;
            return source == that.source && target == that.target && label.equals(that.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, label, target);
        }

        @Override
        public String toString() {
            return source + " -" + label + "-> " + target;
        }
    }

    public static final class Builder {

        private final List<String> states = new ArrayList<>();
        private final BitSet accepting = new BitSet();
        private final List<Edge> edges = new ArrayList<>();
        private int initial = -1;

        private Builder() {}

        /**
         * Adds a state and returns its index.
         */
        public int addState(String name) {
            Preconditions.checkArgument(!states.contains(name), "duplicate state '%s'", name);
            states.add(name);
            return states.size() - 1;
        }

        public Builder setInitial(int state) {
            checkState(state);
            this.initial = state;
            return this;
        }

        public Builder setAccepting(int state) {
            checkState(state);
            accepting.set(state);
            return this;
        }

        public Builder addEdge(int source, String label, int target) {
            checkState(source);
            checkState(target);
            edges.add(new Edge(source, Objects.requireNonNull(label), target));
            return this;
        }

        public ControlFlowSkeleton build() {
            Preconditions.checkState(initial >= 0, "no initial state set");
            return new ControlFlowSkeleton(states, initial, accepting, edges);
        }

        private void checkState(int state) {
            Preconditions.checkElementIndex(state, states.size(), "state");
        }
    }
}
