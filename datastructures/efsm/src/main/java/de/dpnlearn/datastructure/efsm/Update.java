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

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedMap;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;

/**
 * The data effect of a transition: an immutable map from variable names to {@link Assignment assignments}. Variables
 * that do not appear in the map keep their current value.
 */
public final class Update {

    public static final Update EMPTY = new Update(ImmutableSortedMap.of());

    private final ImmutableSortedMap<String, Assignment> assignments;

    private Update(ImmutableSortedMap<String, Assignment> assignments) {
        this.assignments = assignments;
    }

    public static Update of(Map<String, ? extends Assignment> assignments) {
        if (assignments.isEmpty()) {
            return EMPTY;
        }
        return new Update(ImmutableSortedMap.copyOf(assignments));
    }

    public SortedMap<String, Assignment> getAssignments() {
        return assignments;
    }

    public SortedSet<String> getWrittenVariables() {
        return assignments.keySet();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * Applies this update to the current variable valuation, given the payload of the firing event.
     *
     * @param current
     *         the valuation before the transition fires
     * @param payload
     *         the attributes of the event
     *
     * @return the valuation after the transition fired
     */
    public Valuation apply(Valuation current, Valuation payload) {
        if (assignments.isEmpty()) {
            return current;
        }
        Valuation.Builder builder = Valuation.builder().putAll(current);
        for (Map.Entry<String, Assignment> e : assignments.entrySet()) {
            AttributeValue value = e.getValue().evaluate(payload);
            if (value != null) {
                builder.put(e.getKey(), value);
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Update)) {
            return false;
        }
        return assignments.equals(((Update) o).assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        if (assignments.isEmpty()) {
            return "{}";
        }
        StringBuilder builder = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Assignment> e : assignments.entrySet()) {
            if (!first) {
                builder.append("; ");
            }
            builder.append(e.getKey()).append(" := ").append(e.getValue());
            first = false;
        }
        return builder.append('}').toString();
    }
}
