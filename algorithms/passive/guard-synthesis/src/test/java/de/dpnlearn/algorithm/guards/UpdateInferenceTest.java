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
package de.dpnlearn.algorithm.guards;

import java.util.Arrays;
import java.util.Collections;

import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.efsm.Assignment;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EventAssignment;
import de.dpnlearn.datastructure.efsm.Update;
import org.testng.Assert;
import org.testng.annotations.Test;

public class UpdateInferenceTest {

    private static EdgeSample sample(Valuation pre, Valuation payload) {
        return new EdgeSample(pre, payload);
    }

    private static Valuation v(String attribute, double value) {
        return Valuation.builder().put(attribute, value).build();
    }

    @Test
    public void testConstantAndEventAssignments() {
        final Update update = new UpdateInference().infer(Arrays.asList(
                sample(Valuation.empty(), Valuation.builder().put("status", "open").put("amt", 1).build()),
                sample(Valuation.empty(), Valuation.builder().put("status", "open").put("amt", 2).build()),
                sample(Valuation.empty(), Valuation.builder().put("status", "open").put("amt", 1).build())));

        final Assignment status = update.getAssignments().get("status");
        Assert.assertEquals(status, new ConstantAssignment(AttributeValue.categorical("open")));

        final Assignment amt = update.getAssignments().get("amt");
        Assert.assertTrue(amt instanceof EventAssignment);
        Assert.assertEquals(((EventAssignment) amt).getObservedValues().size(), 2);
    }

    @Test
    public void testPropagatedAttributesAreNotAssigned() {
        final Update update = new UpdateInference().infer(Arrays.asList(sample(v("x", 4), v("x", 4)),
                                                                        sample(v("x", 7), v("x", 7))));
        Assert.assertTrue(update.isEmpty());
    }

    @Test
    public void testUnconstrainedAttributes() {
        final UpdateInference inference = new UpdateInference(2);

        // too many distinct values
        Assert.assertTrue(inference.infer(Arrays.asList(sample(Valuation.empty(), v("x", 1)),
                                                        sample(Valuation.empty(), v("x", 2)),
                                                        sample(Valuation.empty(), v("x", 3)))).isEmpty());
        // not written by every event
        Assert.assertTrue(inference.infer(Arrays.asList(sample(Valuation.empty(), v("x", 1)),
                                                        sample(Valuation.empty(), v("y", 1)))).isEmpty());
        Assert.assertSame(inference.infer(Collections.emptyList()), Update.EMPTY);
    }
}
