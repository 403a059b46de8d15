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

import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedSet;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Copies the value of an event attribute into a variable. The (small) set of values the attribute took on the
 * recorded samples is kept as documentation of the observed behavior.
 */
public final class EventAssignment extends Assignment {

    private final String attribute;
    private final ImmutableSortedSet<AttributeValue> observedValues;

    public EventAssignment(String attribute, Collection<? extends AttributeValue> observedValues) {
        this.attribute = Objects.requireNonNull(attribute);
        this.observedValues = ImmutableSortedSet.copyOf(observedValues);
    }

    public String getAttribute() {
        return attribute;
    }

    public SortedSet<AttributeValue> getObservedValues() {
        return observedValues;
    }

    @Override
    public @Nullable AttributeValue evaluate(Valuation payload) {
        return payload.get(attribute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventAssignment)) {
            return false;
        }
        EventAssignment that = (EventAssignment) o;
        return attribute.equals(that.attribute) && observedValues.equals(that.observedValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, observedValues);
    }

    @Override
    public String toString() {
        return "event." + attribute + ' ' + observedValues;
    }
}
