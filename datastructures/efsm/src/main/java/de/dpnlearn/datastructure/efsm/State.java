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

import java.util.Objects;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedSet;

/**
 * A control state of an {@link EFSM}. Besides its name and accepting flag, a state remembers the ids of the prefix
 * tree nodes that were folded into it (empty for states that did not originate from a prefix tree).
 */
public final class State {

    private final String name;
    private final boolean accepting;
    private final ImmutableSortedSet<Integer> foldedNodes;

    public State(String name, boolean accepting) {
        this(name, accepting, ImmutableSortedSet.of());
    }

    public State(String name, boolean accepting, SortedSet<Integer> foldedNodes) {
        this.name = Objects.requireNonNull(name);
        this.accepting = accepting;
        this.foldedNodes = ImmutableSortedSet.copyOfSorted(foldedNodes);
    }

    public String getName() {
        return name;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public SortedSet<Integer> getFoldedNodes() {
        return foldedNodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof State)) {
            return false;
        }
        State that = (State) o;
        return accepting == that.accepting && name.equals(that.name) && foldedNodes.equals(that.foldedNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, accepting, foldedNodes);
    }

    @Override
    public String toString() {
        return accepting ? name + "*" : name;
    }
}
