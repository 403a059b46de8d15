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

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import de.dpnlearn.api.util.Quantiles;

/**
 * Per-attribute metadata: the attribute's type and its observed domain. For categorical attributes this is the finite
 * set of observed values, for numeric attributes the observed range together with the quartile boundaries.
 * <p>
 * Instances are immutable.
 */
public final class AttributeDomain {

    private static final double[] QUARTILES = {0.25, 0.5, 0.75};

    private final String name;
    private final AttributeType type;
    private final ImmutableSortedSet<String> values;
    private final double min;
    private final double max;
    private final ImmutableList<Double> quantiles;

    private AttributeDomain(String name,
                            AttributeType type,
                            ImmutableSortedSet<String> values,
                            double min,
                            double max,
                            ImmutableList<Double> quantiles) {
        this.name = name;
        this.type = type;
        this.values = values;
        this.min = min;
        this.max = max;
        this.quantiles = quantiles;
    }

    public static AttributeDomain numeric(String name, Collection<Double> observed) {
        Preconditions.checkArgument(!observed.isEmpty(), "No observations for numeric attribute '%s'", name);
        double[] sorted = Quantiles.sorted(observed);
        ImmutableList.Builder<Double> qs = ImmutableList.builder();
        for (double q : Quantiles.quantiles(sorted, QUARTILES)) {
            qs.add(q);
        }
        return new AttributeDomain(name,
                                   AttributeType.NUMERIC,
                                   ImmutableSortedSet.of(),
                                   sorted[0],
                                   sorted[sorted.length - 1],
                                   qs.build());
    }

    public static AttributeDomain categorical(String name, Collection<String> observed) {
        Preconditions.checkArgument(!observed.isEmpty(), "No observations for categorical attribute '%s'", name);
        return new AttributeDomain(name,
                                   AttributeType.CATEGORICAL,
                                   ImmutableSortedSet.copyOf(observed),
                                   Double.NaN,
                                   Double.NaN,
                                   ImmutableList.of());
    }

    public String getName() {
        return name;
    }

    public AttributeType getType() {
        return type;
    }

    public boolean isNumeric() {
        return type == AttributeType.NUMERIC;
    }

    /**
     * The observed values of a categorical attribute, empty for numeric attributes.
     */
    public SortedSet<String> getValues() {
        return values;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * The extent {@code max - min} of a numeric attribute's observed range.
     */
    public double getRange() {
        return max - min;
    }

    /**
     * The 25/50/75 % quantiles of a numeric attribute, empty for categorical attributes.
     */
    public List<Double> getQuantiles() {
        return quantiles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeDomain)) {
            return false;
        }
        AttributeDomain that = (AttributeDomain) o;
        return Double.compare(that.min, min) == 0 && Double.compare(that.max, max) == 0 && name.equals(that.name) &&
               type == that.type && values.equals(that.values) && quantiles.equals(that.quantiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, values, min, max, quantiles);
    }

    @Override
    public String toString() {
        if (isNumeric()) {
            return name + ": NUMERIC [" + min + ", " + max + "] q=" + quantiles;
        }
        return name + ": CATEGORICAL " + values;
    }
}
