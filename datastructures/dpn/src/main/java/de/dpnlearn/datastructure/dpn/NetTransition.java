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

import java.util.Objects;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedSet;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.predicate.Predicate;

/**
 * A transition of a {@link DataPetriNet}. Besides its label, a net transition carries a guard, an update and the
 * sets of variables it reads (referenced by the guard) and writes (assigned by the update).
 */
public final class NetTransition {

    private final String id;
    private final String label;
    private final Predicate guard;
    private final Update update;
    private final ImmutableSortedSet<String> readVariables;
    private final ImmutableSortedSet<String> writeVariables;

    public NetTransition(String id, String label, Predicate guard, Update update) {
        this(id, label, guard, update, guard.getVariables(), update.getWrittenVariables());
    }

    public NetTransition(String id,
                         String label,
                         Predicate guard,
                         Update update,
                         SortedSet<String> readVariables,
                         SortedSet<String> writeVariables) {
        this.id = Objects.requireNonNull(id);
        this.label = Objects.requireNonNull(label);
        this.guard = Objects.requireNonNull(guard);
        this.update = Objects.requireNonNull(update);
        this.readVariables = ImmutableSortedSet.copyOfSorted(readVariables);
        this.writeVariables = ImmutableSortedSet.copyOfSorted(writeVariables);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public Predicate getGuard() {
        return guard;
    }

    public Update getUpdate() {
        return update;
    }

    public SortedSet<String> getReadVariables() {
        return readVariables;
    }

    public SortedSet<String> getWriteVariables() {
        return writeVariables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NetTransition)) {
            return false;
        }
        NetTransition that = (NetTransition) o;
        return id.equals(that.id) && label.equals(that.label) && guard.equals(that.guard) &&
               update.equals(that.update) && readVariables.equals(that.readVariables) &&
               writeVariables.equals(that.writeVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, guard, update);
    }

    @Override
    public String toString() {
        return id + '(' + label + ')';
    }
}
