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
package de.dpnlearn.api.log;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable assignment of attribute names to values. Attribute names are kept in lexicographic order so that
 * every iteration over a valuation is deterministic.
 */
public final class Valuation {

    private static final Valuation EMPTY = new Valuation(ImmutableSortedMap.of());

    private final ImmutableSortedMap<String, AttributeValue> values;

    private Valuation(ImmutableSortedMap<String, AttributeValue> values) {
        this.values = values;
    }

    public static Valuation empty() {
        return EMPTY;
    }

    public static Valuation of(Map<String, ? extends AttributeValue> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Valuation(ImmutableSortedMap.copyOf(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public @Nullable AttributeValue get(String attribute) {
        return values.get(attribute);
    }

    public boolean contains(String attribute) {
        return values.containsKey(attribute);
    }

    public Set<String> getAttributes() {
        return values.keySet();
    }

    public SortedMap<String, AttributeValue> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a valuation that contains all entries of this valuation, overwritten by the entries of {@code other}.
     */
    public Valuation overriddenBy(Valuation other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Builder builder = builder();
        builder.putAll(this);
        builder.putAll(other);
        return builder.build();
    }

    /**
     * Returns the restriction of this valuation to the given attribute names.
     */
    public Valuation project(Set<String> attributes) {
        Builder builder = builder();
        for (Map.Entry<String, AttributeValue> e : values.entrySet()) {
            if (attributes.contains(e.getKey())) {
                builder.put(e.getKey(), e.getValue());
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Valuation)) {
            return false;
        }
        return values.equals(((Valuation) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {

        private final Map<String, AttributeValue> entries = new TreeMap<>();

        private Builder() {}

        public Builder put(String attribute, AttributeValue value) {
            entries.put(attribute, value);
            return this;
        }

        public Builder put(String attribute, double value) {
            return put(attribute, AttributeValue.numeric(value));
        }

        public Builder put(String attribute, String value) {
            return put(attribute, AttributeValue.categorical(value));
        }

        public Builder putAll(Valuation valuation) {
            entries.putAll(valuation.values);
            return this;
        }

        public Valuation build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new Valuation(ImmutableSortedMap.copyOf(entries));
        }
    }
}
