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
package de.dpnlearn.oracle.compatibility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import de.dpnlearn.api.automaton.SampledState;
import de.dpnlearn.api.log.AttributeDomain;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.util.Quantiles;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link CompatibilityOracle} that compares the empirical attribute distributions on the outgoing edges of two
 * states.
 * <p>
 * Two states are incompatible if their outgoing label sets differ. Otherwise, for every shared label and every
 * attribute recorded in the payloads of that label's samples, a divergence is computed:
 * <ul>
 * <li>categorical attributes: the Jensen-Shannon divergence (base 2) of the two value distributions,</li>
 * <li>numeric attributes: the absolute difference of the means, normalized by the attribute's global range (or the
 * pooled range of both sides if no global domain is known),</li>
 * <li>attributes recorded on one side only: {@code 1}.</li>
 * </ul>
 * The states are compatible iff no divergence exceeds the threshold.
 */
public class DistributionCompatibilityOracle implements CompatibilityOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(DistributionCompatibilityOracle.class);

    private static final double LN_2 = Math.log(2);

    private final AttributeDomains domains;

    public DistributionCompatibilityOracle() {
        this(AttributeDomains.empty());
    }

    public DistributionCompatibilityOracle(AttributeDomains domains) {
        this.domains = domains;
    }

    @Override
    public boolean isCompatible(SampledState a, SampledState b, double threshold) {
        Preconditions.checkArgument(threshold >= 0 && threshold <= 1, "threshold must lie in [0,1]: %s", threshold);
        if (!a.getOutgoingLabels().equals(b.getOutgoingLabels())) {
            LOGGER.debug("States {} and {} have different outgoing labels", a.getId(), b.getId());
            return false;
        }
        for (String label : a.getOutgoingLabels()) {
            List<EdgeSample> left = a.getSamples(label);
            List<EdgeSample> right = b.getSamples(label);
            for (String attribute : attributes(left, right)) {
                double d = divergence(attribute, left, right);
                if (d > threshold) {
                    LOGGER.debug("States {} and {} diverge on {}.{} ({} > {})",
                                 a.getId(),
                                 b.getId(),
                                 label,
                                 attribute,
                                 d,
                                 threshold);
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public double divergence(SampledState a, SampledState b) {
        if (!a.getOutgoingLabels().equals(b.getOutgoingLabels())) {
            return Double.POSITIVE_INFINITY;
        }
        double max = 0;
        for (String label : a.getOutgoingLabels()) {
            List<EdgeSample> left = a.getSamples(label);
            List<EdgeSample> right = b.getSamples(label);
            for (String attribute : attributes(left, right)) {
                max = Math.max(max, divergence(attribute, left, right));
            }
        }
        return max;
    }

    private static SortedSet<String> attributes(Collection<EdgeSample> left, Collection<EdgeSample> right) {
        SortedSet<String> result = new TreeSet<>();
        for (EdgeSample s : left) {
            result.addAll(s.getPayload().getAttributes());
        }
        for (EdgeSample s : right) {
            result.addAll(s.getPayload().getAttributes());
        }
        return result;
    }

    double divergence(String attribute, Collection<EdgeSample> left, Collection<EdgeSample> right) {
        List<AttributeValue> l = values(attribute, left);
        List<AttributeValue> r = values(attribute, right);
        if (l.isEmpty() || r.isEmpty()) {
            return 1;
        }
        AttributeType type = l.get(0).getType();
        if (!sameType(type, l) || !sameType(type, r)) {
            return 1;
        }
        if (type == AttributeType.NUMERIC) {
            return normalizedMeanDifference(attribute, numbers(l), numbers(r));
        }
        return jensenShannon(frequencies(l), frequencies(r));
    }

    private double normalizedMeanDifference(String attribute, double[] left, double[] right) {
        double range = 0;
        AttributeDomain domain = domains.get(attribute);
        if (domain != null && domain.isNumeric()) {
            range = domain.getRange();
        }
        if (range <= 0) {
            double min = Math.min(min(left), min(right));
            double max = Math.max(max(left), max(right));
            range = max - min;
        }
        if (range <= 0) {
            return 0;
        }
        double diff = Math.abs(Quantiles.mean(left) - Quantiles.mean(right)) / range;
        return Math.min(1, diff);
    }

    /**
     * The Jensen-Shannon divergence (base 2) of two empirical distributions given as absolute frequencies.
     */
    static double jensenShannon(Map<AttributeValue, Integer> left, Map<AttributeValue, Integer> right) {
        double leftTotal = total(left);
        double rightTotal = total(right);

        Map<AttributeValue, Double> mixture = new HashMap<>();
        for (Map.Entry<AttributeValue, Integer> e : left.entrySet()) {
            mixture.merge(e.getKey(), e.getValue() / leftTotal / 2, Double::sum);
        }
        for (Map.Entry<AttributeValue, Integer> e : right.entrySet()) {
            mixture.merge(e.getKey(), e.getValue() / rightTotal / 2, Double::sum);
        }

        double jsd = (kullbackLeibler(left, leftTotal, mixture) + kullbackLeibler(right, rightTotal, mixture)) / 2;
        // rounding may leave tiny negative values or values slightly above 1
        return Math.max(0, Math.min(1, jsd));
    }

    private static double kullbackLeibler(Map<AttributeValue, Integer> p, double total, Map<AttributeValue, Double> m) {
        double sum = 0;
        for (Map.Entry<AttributeValue, Integer> e : p.entrySet()) {
            double pi = e.getValue() / total;
            if (pi > 0) {
                sum += pi * Math.log(pi / m.get(e.getKey())) / LN_2;
            }
        }
        return sum;
    }

    private static List<AttributeValue> values(String attribute, Collection<EdgeSample> samples) {
        List<AttributeValue> result = new ArrayList<>(samples.size());
        for (EdgeSample s : samples) {
            @Nullable AttributeValue value = s.getPayload().get(attribute);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private static boolean sameType(AttributeType type, List<AttributeValue> values) {
        for (AttributeValue v : values) {
            if (v.getType() != type) {
                return false;
            }
        }
        return true;
    }

    private static double[] numbers(List<AttributeValue> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).asNumber();
        }
        return result;
    }

    private static Map<AttributeValue, Integer> frequencies(List<AttributeValue> values) {
        Map<AttributeValue, Integer> result = new HashMap<>();
        for (AttributeValue v : values) {
            result.merge(v, 1, Integer::sum);
        }
        return result;
    }

    private static int total(Map<AttributeValue, Integer> frequencies) {
        int sum = 0;
        for (int f : frequencies.values()) {
            sum += f;
        }
        return sum;
    }

    private static double min(double[] values) {
        double result = Double.POSITIVE_INFINITY;
        for (double v : values) {
            result = Math.min(result, v);
        }
        return result;
    }

    private static double max(double[] values) {
        double result = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            result = Math.max(result, v);
        }
        return result;
    }
}
