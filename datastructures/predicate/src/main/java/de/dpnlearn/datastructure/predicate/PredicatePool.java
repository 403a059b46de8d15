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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.dpnlearn.api.log.AttributeDomain;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.api.util.Quantiles;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the candidate atoms a guard is assembled from. The pool is deterministic: attributes are visited numeric
 * first, then categorical, each group in lexicographic order of the attribute name.
 * <p>
 * For a numeric attribute the pool starts with the max-margin split between positive and negative examples (if their
 * ranges are disjoint), followed by comparisons against thresholds taken from the class extrema, the domain quartiles,
 * the per-class quartiles and, for attributes with few distinct values, every observed value. For a categorical
 * attribute the pool contains one equality per observed value.
 */
public final class PredicatePool {

    public static final int DEFAULT_MAX_THRESHOLDS = 20;
    public static final int DEFAULT_MAX_CATEGORICAL_VALUES = 10;

    /**
     * Attributes with at most this many distinct observed values also get equality atoms and use every observed
     * value as a threshold.
     */
    static final int FEW_DISTINCT_VALUES = 10;

    private static final double[] CLASS_PERCENTILES = {0.25, 0.5, 0.75};

    private final int maxThresholds;
    private final int maxCategoricalValues;

    public PredicatePool() {
        this(DEFAULT_MAX_THRESHOLDS, DEFAULT_MAX_CATEGORICAL_VALUES);
    }

    public PredicatePool(int maxThresholds, int maxCategoricalValues) {
        Preconditions.checkArgument(maxThresholds >= 2, "at least two thresholds required, got %s", maxThresholds);
        Preconditions.checkArgument(maxCategoricalValues >= 1,
                                    "at least one categorical value required, got %s",
                                    maxCategoricalValues);
        this.maxThresholds = maxThresholds;
        this.maxCategoricalValues = maxCategoricalValues;
    }

    public List<AtomicPredicate> generate(Collection<Valuation> positives,
                                          Collection<Valuation> negatives,
                                          AttributeDomains domains) {
        TreeMap<String, AttributeType> attributes = collectAttributes(positives, negatives, domains);

        Set<AtomicPredicate> pool = new LinkedHashSet<>();
        for (String attribute : attributes.keySet()) {
            if (attributes.get(attribute) == AttributeType.NUMERIC) {
                addNumericAtoms(pool, attribute, positives, negatives, domains.get(attribute));
            }
        }
        for (String attribute : attributes.keySet()) {
            if (attributes.get(attribute) == AttributeType.CATEGORICAL) {
                addCategoricalAtoms(pool, attribute, positives, negatives);
            }
        }
        return ImmutableList.copyOf(pool);
    }

    private static TreeMap<String, AttributeType> collectAttributes(Collection<Valuation> positives,
                                                                    Collection<Valuation> negatives,
                                                                    AttributeDomains domains) {
        TreeMap<String, AttributeType> result = new TreeMap<>();
        collectAttributes(result, positives, domains);
        collectAttributes(result, negatives, domains);
        return result;
    }

    private static void collectAttributes(TreeMap<String, AttributeType> result,
                                          Collection<Valuation> valuations,
                                          AttributeDomains domains) {
        for (Valuation valuation : valuations) {
            for (String attribute : valuation.getAttributes()) {
                AttributeType type = domains.getType(attribute);
                if (type == null) {
                    AttributeValue value = valuation.get(attribute);
                    type = value == null ? null : value.getType();
                }
                if (type != null) {
                    result.putIfAbsent(attribute, type);
                }
            }
        }
    }

    private void addNumericAtoms(Set<AtomicPredicate> pool,
                                 String attribute,
                                 Collection<Valuation> positives,
                                 Collection<Valuation> negatives,
                                 @Nullable AttributeDomain domain) {
        double[] pos = numericValues(attribute, positives);
        double[] neg = numericValues(attribute, negatives);

        if (pos.length > 0 && neg.length > 0) {
            double posMin = pos[0], posMax = pos[pos.length - 1];
            double negMin = neg[0], negMax = neg[neg.length - 1];
            if (posMax < negMin) {
                pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.LE, (posMax + negMin) / 2));
            } else if (posMin > negMax) {
                pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.GE, (posMin + negMax) / 2));
            }
        }

        SortedSet<Double> distinct = new TreeSet<>();
        addAll(distinct, pos);
        addAll(distinct, neg);
        boolean fewValues = distinct.size() <= FEW_DISTINCT_VALUES;

        SortedSet<Double> thresholds = new TreeSet<>();
        addExtrema(thresholds, pos);
        addExtrema(thresholds, neg);
        if (domain != null && domain.isNumeric()) {
            thresholds.addAll(domain.getQuantiles());
        }
        addPercentiles(thresholds, pos);
        addPercentiles(thresholds, neg);
        if (fewValues) {
            thresholds.addAll(distinct);
        }

        for (double threshold : cap(thresholds)) {
            pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.LE, threshold));
            pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.GE, threshold));
            pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.LT, threshold));
            pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.GT, threshold));
            if (fewValues) {
                pool.add(AtomicPredicate.numeric(attribute, ComparisonOperator.EQ, threshold));
            }
        }
    }

    private void addCategoricalAtoms(Set<AtomicPredicate> pool,
                                     String attribute,
                                     Collection<Valuation> positives,
                                     Collection<Valuation> negatives) {
        // values seen on positive examples take precedence when the value budget is exhausted
        Set<String> values = new LinkedHashSet<>(categoricalValues(attribute, positives));
        values.addAll(categoricalValues(attribute, negatives));

        int added = 0;
        for (String value : values) {
            if (added++ >= maxCategoricalValues) {
                break;
            }
            pool.add(AtomicPredicate.categorical(attribute, value));
        }
    }

    /**
     * Thins out the given thresholds to at most {@code maxThresholds} evenly spaced elements (always including the
     * smallest and largest one).
     */
    List<Double> cap(SortedSet<Double> thresholds) {
        List<Double> all = new ArrayList<>(thresholds);
        if (all.size() <= maxThresholds) {
            return all;
        }
        Set<Double> result = new LinkedHashSet<>();
        for (int i = 0; i < maxThresholds; i++) {
            int idx = (int) Math.round(i * (all.size() - 1) / (double) (maxThresholds - 1));
            result.add(all.get(idx));
        }
        return new ArrayList<>(result);
    }

    private static double[] numericValues(String attribute, Collection<Valuation> valuations) {
        List<Double> result = new ArrayList<>(valuations.size());
        for (Valuation valuation : valuations) {
            AttributeValue value = valuation.get(attribute);
            if (value != null && value.getType() == AttributeType.NUMERIC) {
                result.add(value.asNumber());
            }
        }
        return Quantiles.sorted(result);
    }

    private static SortedSet<String> categoricalValues(String attribute, Collection<Valuation> valuations) {
        SortedSet<String> result = new TreeSet<>();
        for (Valuation valuation : valuations) {
            AttributeValue value = valuation.get(attribute);
            if (value != null && value.getType() == AttributeType.CATEGORICAL) {
                result.add(value.asCategory());
            }
        }
        return result;
    }

    private static void addAll(SortedSet<Double> target, double[] values) {
        for (double v : values) {
            target.add(v);
        }
    }

    private static void addExtrema(SortedSet<Double> target, double[] sorted) {
        if (sorted.length > 0) {
            target.add(sorted[0]);
            target.add(sorted[sorted.length - 1]);
        }
    }

    private static void addPercentiles(SortedSet<Double> target, double[] sorted) {
        if (sorted.length > 0) {
            for (double q : Quantiles.quantiles(sorted, CLASS_PERCENTILES)) {
                target.add(q);
            }
        }
    }
}
