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

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

/**
 * An immutable distribution of tokens over places. Places without tokens are not stored.
 */
public final class Marking {

    private static final Marking EMPTY = new Marking(ImmutableSortedMap.of());

    private final ImmutableSortedMap<String, Integer> tokens;

    private Marking(ImmutableSortedMap<String, Integer> tokens) {
        this.tokens = tokens;
    }

    public static Marking empty() {
        return EMPTY;
    }

    public static Marking of(String place) {
        return new Marking(ImmutableSortedMap.of(place, 1));
    }

    public static Marking of(Map<String, Integer> tokens) {
        TreeMap<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> e : tokens.entrySet()) {
            Preconditions.checkArgument(e.getValue() >= 0, "negative token count for %s", e.getKey());
            if (e.getValue() > 0) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        return copy.isEmpty() ? EMPTY : new Marking(ImmutableSortedMap.copyOf(copy));
    }

    public int get(String place) {
        Integer count = tokens.get(place);
        return count == null ? 0 : count;
    }

    public SortedSet<String> getMarkedPlaces() {
        return tokens.keySet();
    }

    public SortedMap<String, Integer> asMap() {
        return tokens;
    }

    public int getTokenCount() {
        int sum = 0;
        for (int c : tokens.values()) {
            sum += c;
        }
        return sum;
    }

    Marking add(String place, int count) {
        TreeMap<String, Integer> copy = new TreeMap<>(tokens);
        copy.merge(place, count, Integer::sum);
        return of(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Marking)) {
            return false;
        }
        return tokens.equals(((Marking) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
