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
package de.dpnlearn.datastructure.predicate;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import de.dpnlearn.api.log.Valuation;

/**
 * An immutable conjunction of {@link AtomicPredicate atomic predicates}. The conjunction of zero atoms is the
 * {@link #TRUE universal} predicate, which holds for every valuation.
 * <p>
 * Conjuncts keep the order in which they were given; two predicates are equal iff they list the same atoms in the
 * same order.
 */
public final class Predicate {

    public static final Predicate TRUE = new Predicate(ImmutableList.of());

    private final ImmutableList<AtomicPredicate> conjuncts;

    private Predicate(ImmutableList<AtomicPredicate> conjuncts) {
        this.conjuncts = conjuncts;
    }

    public static Predicate of(AtomicPredicate... conjuncts) {
        return of(Arrays.asList(conjuncts));
    }

    public static Predicate of(Collection<? extends AtomicPredicate> conjuncts) {
        if (conjuncts.isEmpty()) {
            return TRUE;
        }
        return new Predicate(ImmutableList.copyOf(conjuncts));
    }

    public List<AtomicPredicate> getConjuncts() {
        return conjuncts;
    }

    public boolean isUniversal() {
        return conjuncts.isEmpty();
    }

    public int size() {
        return conjuncts.size();
    }

    public boolean evaluate(Valuation valuation) {
        for (AtomicPredicate atom : conjuncts) {
            if (!atom.evaluate(valuation)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the conjunction of this predicate and {@code other}.
     */
    public Predicate and(Predicate other) {
        if (other.isUniversal()) {
            return this;
        }
        if (isUniversal()) {
            return other;
        }
        return new Predicate(ImmutableList.<AtomicPredicate>builder().addAll(conjuncts).addAll(other.conjuncts).build());
    }

    /**
     * The names of all attributes this predicate reads.
     */
    public SortedSet<String> getVariables() {
        ImmutableSortedSet.Builder<String> builder = ImmutableSortedSet.naturalOrder();
        for (AtomicPredicate atom : conjuncts) {
            builder.add(atom.getAttribute());
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Predicate)) {
            return false;
        }
        return conjuncts.equals(((Predicate) o).conjuncts);
    }

    @Override
    public int hashCode() {
        return conjuncts.hashCode();
    }

    @Override
    public String toString() {
        if (conjuncts.isEmpty()) {
            return "true";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < conjuncts.size(); i++) {
            if (i > 0) {
                builder.append(" && ");
            }
            builder.append(conjuncts.get(i));
        }
        return builder.toString();
    }
}
