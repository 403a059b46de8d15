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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import de.dpnlearn.api.log.AttributeDomain;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class DistributionCompatibilityOracleTest {

    private static final double EPS = 1e-9;

    private final CompatibilityOracle oracle = new DistributionCompatibilityOracle();

    private static Valuation amt(double value) {
        return Valuation.builder().put("amt", value).build();
    }

    private static Valuation kind(String value) {
        return Valuation.builder().put("kind", value).build();
    }

    @Test
    public void testLabelSetVeto() {
        final MockedSampledState a = new MockedSampledState(0).with("A", Valuation.empty());
        final MockedSampledState b = new MockedSampledState(1).with("A", Valuation.empty()).with("B");

        Assert.assertFalse(oracle.isCompatible(a, b, 1.0));
        Assert.assertEquals(oracle.divergence(a, b), Double.POSITIVE_INFINITY);
    }

    @Test
    public void testThresholdEdges() {
        final MockedSampledState a = new MockedSampledState(0).with("A", amt(0), amt(10));
        final MockedSampledState b = new MockedSampledState(1).with("A", amt(0), amt(10));
        final MockedSampledState c = new MockedSampledState(2).with("A", amt(10), amt(10));

        Assert.assertTrue(oracle.isCompatible(a, b, 0.0));
        Assert.assertFalse(oracle.isCompatible(a, c, 0.0));
        Assert.assertTrue(oracle.isCompatible(a, c, 1.0));
        // means 5 and 10 over the pooled range [0, 10]
        Assert.assertEquals(oracle.divergence(a, c), 0.5, EPS);
        Assert.assertTrue(oracle.isCompatible(a, c, 0.5));
        Assert.assertFalse(oracle.isCompatible(a, c, 0.49));
    }

    @Test
    public void testGlobalRangeIsPreferred() {
        final AttributeDomains domains =
                AttributeDomains.of(Arrays.asList(AttributeDomain.numeric("amt", Arrays.asList(0.0, 100.0))));
        final CompatibilityOracle global = new DistributionCompatibilityOracle(domains);

        final MockedSampledState a = new MockedSampledState(0).with("A", amt(0), amt(10));
        final MockedSampledState c = new MockedSampledState(2).with("A", amt(10), amt(10));

        Assert.assertEquals(global.divergence(a, c), 0.05, EPS);
    }

    @Test
    public void testCategoricalDivergence() {
        final MockedSampledState a = new MockedSampledState(0).with("A", kind("x"), kind("x"));
        final MockedSampledState b = new MockedSampledState(1).with("A", kind("y"));
        final MockedSampledState c = new MockedSampledState(2).with("A", kind("x"), kind("y"));

        Assert.assertEquals(oracle.divergence(a, b), 1.0, EPS);
        Assert.assertEquals(oracle.divergence(a, a), 0.0, EPS);

        // P = (1, 0), Q = (1/2, 1/2), M = (3/4, 1/4)
        final double expected = 0.5 * log2(1 / 0.75) + 0.5 * (0.5 * log2(0.5 / 0.75) + 0.5 * log2(0.5 / 0.25));
        Assert.assertEquals(oracle.divergence(a, c), expected, EPS);
    }

    @Test
    public void testOneSidedAttribute() {
        final MockedSampledState a = new MockedSampledState(0).with("A", amt(1));
        final MockedSampledState b = new MockedSampledState(1).with("A", Valuation.empty());

        Assert.assertEquals(oracle.divergence(a, b), 1.0, EPS);
        Assert.assertFalse(oracle.isCompatible(a, b, 0.99));
        Assert.assertTrue(oracle.isCompatible(a, b, 1.0));
    }

    @Test
    public void testJensenShannonBounds() {
        final Map<AttributeValue, Integer> p = new HashMap<>();
        p.put(AttributeValue.categorical("a"), 3);
        final Map<AttributeValue, Integer> q = new HashMap<>();
        q.put(AttributeValue.categorical("b"), 5);

        Assert.assertEquals(DistributionCompatibilityOracle.jensenShannon(p, q), 1.0, EPS);
        Assert.assertEquals(DistributionCompatibilityOracle.jensenShannon(p, p), 0.0, EPS);
    }

    @DataProvider(name = "pairs")
    public Object[][] pairs() {
        final MockedSampledState a = new MockedSampledState(0).with("A", amt(1), amt(3), kind("x"));
        final MockedSampledState b = new MockedSampledState(1).with("A", amt(2), kind("y"), kind("x"));
        final MockedSampledState c = new MockedSampledState(2).with("A", amt(7)).with("B", amt(0));
        final MockedSampledState d = new MockedSampledState(3).with("A", kind("z"), amt(4));
        return new Object[][] {{a, b}, {a, c}, {b, d}, {a, d}, {c, d}};
    }

    @Test(dataProvider = "pairs")
    public void testSymmetry(MockedSampledState a, MockedSampledState b) {
        for (double t = 0; t <= 1.0; t += 0.125) {
            Assert.assertEquals(oracle.isCompatible(a, b, t), oracle.isCompatible(b, a, t));
        }
        Assert.assertEquals(oracle.divergence(a, b), oracle.divergence(b, a), EPS);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }
}
