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

import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;

import de.dpnlearn.api.exception.DomainConflictException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AttributeDomainsTest {

    private static Trace trace(String id, Event... events) {
        return Trace.of(id, events);
    }

    private static Event event(String label, Valuation valuation) {
        return new Event(label, valuation);
    }

    @Test
    public void infersTypesRangesAndQuartiles() {
        List<Trace> traces = Arrays.asList(
                trace("c1", event("A", Valuation.builder().put("amt", 10).put("kind", "gold").build())),
                trace("c2", event("A", Valuation.builder().put("amt", 20).put("kind", "silver").build())),
                trace("c3", event("A", Valuation.builder().put("amt", 30).build()),
                      event("B", Valuation.builder().put("amt", 40).put("kind", "gold").build())));

        AttributeDomains domains = AttributeDomains.infer(traces);

        Assert.assertEquals(domains.getNames().size(), 2);
        AttributeDomain amt = domains.get("amt");
        Assert.assertNotNull(amt);
        Assert.assertEquals(amt.getType(), AttributeType.NUMERIC);
        Assert.assertEquals(amt.getMin(), 10.0);
        Assert.assertEquals(amt.getMax(), 40.0);
        Assert.assertEquals(amt.getRange(), 30.0);
        Assert.assertEquals(amt.getQuantiles(), Arrays.asList(17.5, 25.0, 32.5));

        AttributeDomain kind = domains.get("kind");
        Assert.assertNotNull(kind);
        Assert.assertEquals(kind.getType(), AttributeType.CATEGORICAL);
        Assert.assertEquals(kind.getValues().first(), "gold");
        Assert.assertEquals(kind.getValues().size(), 2);
    }

    @Test(expectedExceptions = DomainConflictException.class)
    public void mixedTypesAreFatal() {
        AttributeDomains.infer(Arrays.asList(
                trace("c1", event("A", Valuation.builder().put("x", 1).build())),
                trace("c2", event("A", Valuation.builder().put("x", "one").build()))));
    }

    @Test
    public void checkRejectsContradictingValuation() {
        AttributeDomains domains =
                AttributeDomains.infer(Arrays.asList(trace("c1", event("A", Valuation.builder().put("x", 1).build()))));

        domains.check(Valuation.builder().put("x", 5).put("unknown", "y").build(), "c2");
        Assert.assertThrows(DomainConflictException.class,
                            () -> domains.check(Valuation.builder().put("x", "five").build(), "c3"));
    }

    @Test
    public void propagationModes() {
        Valuation one = Valuation.builder().put("p", 1).put("t", 1).build();
        Valuation other = Valuation.builder().put("p", 1).put("t", 2).build();
        List<Trace> traces = Arrays.asList(trace("c1", event("A", one), event("B", other), event("C", one)),
                                           trace("c2", event("A", one), event("B", other), event("C", one)));

        SortedMap<String, PropagationMode> modes = PropagationAnalysis.analyze(traces);

        // p repeats in 4 of 6 observations, t never
        Assert.assertEquals(modes.get("p"), PropagationMode.SOMETIMES);
        Assert.assertEquals(modes.get("t"), PropagationMode.TRANSIENT);
    }
}
