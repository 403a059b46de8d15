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
import java.util.List;
import java.util.TreeSet;

import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.Valuation;
import org.testng.Assert;
import org.testng.annotations.Test;

public class PredicatePoolTest {

    private static Valuation amt(double value) {
        return Valuation.builder().put("amt", value).build();
    }

    @Test
    public void testMaxMarginSplitComesFirst() {
        final List<Valuation> pos = Arrays.asList(amt(50), amt(80));
        final List<Valuation> neg = Arrays.asList(amt(2000), amt(5000));

        final List<AtomicPredicate> pool = new PredicatePool().generate(pos, neg, AttributeDomains.empty());

        Assert.assertEquals(pool.get(0), AtomicPredicate.numeric("amt", ComparisonOperator.LE, 1040));
        Assert.assertTrue(pool.contains(AtomicPredicate.numeric("amt", ComparisonOperator.EQ, 80)));
        Assert.assertTrue(pool.contains(AtomicPredicate.numeric("amt", ComparisonOperator.GE, 2000)));
    }

    @Test
    public void testUpperSplit() {
        final List<AtomicPredicate> pool =
                new PredicatePool().generate(Arrays.asList(amt(10)), Arrays.asList(amt(2)), AttributeDomains.empty());
        Assert.assertEquals(pool.get(0), AtomicPredicate.numeric("amt", ComparisonOperator.GE, 6));
    }

    @Test
    public void testNumericBeforeCategorical() {
        final Valuation p = Valuation.builder().put("a", "x").put("z", 1).build();
        final Valuation n = Valuation.builder().put("a", "y").put("z", 1).build();

        final List<AtomicPredicate> pool = new PredicatePool().generate(Arrays.asList(p), Arrays.asList(n),
                                                                          AttributeDomains.empty());

        Assert.assertEquals(pool.get(0).getAttribute(), "z");
        final AtomicPredicate last = pool.get(pool.size() - 1);
        Assert.assertEquals(last, AtomicPredicate.categorical("a", "y"));
        Assert.assertEquals(pool.get(pool.size() - 2), AtomicPredicate.categorical("a", "x"));
    }

    @Test
    public void testCategoricalBudget() {
        final List<AtomicPredicate> pool = new PredicatePool(20, 2).generate(Arrays.asList(
                Valuation.builder().put("c", "a").build(),
                Valuation.builder().put("c", "b").build()), Arrays.asList(Valuation.builder().put("c", "c").build()),
                                                                             AttributeDomains.empty());
        Assert.assertEquals(pool.size(), 2);
        Assert.assertFalse(pool.contains(AtomicPredicate.categorical("c", "c")));
    }

    @Test
    public void testThresholdCap() {
        final TreeSet<Double> thresholds = new TreeSet<>();
        for (int i = 0; i < 100; i++) {
            thresholds.add((double) i);
        }
        final List<Double> capped = new PredicatePool(5, 10).cap(thresholds);
        Assert.assertEquals(capped, Arrays.asList(0.0, 25.0, 50.0, 74.0, 99.0));
    }
}
