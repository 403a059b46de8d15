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

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.datastructure.efsm.Assignment;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EventAssignment;
import de.dpnlearn.datastructure.efsm.Update;

/**
 * Infers the {@link Update} of a transition from the edge samples recorded on it. For every attribute written by
 * the transition's events:
 * <ul>
 * <li>if some sample lacks the attribute, it is left unconstrained (no assignment);</li>
 * <li>if every sample carries the attribute's previous value, the attribute is propagated (no assignment);</li>
 * <li>if the attribute always takes the same value, it becomes a {@link ConstantAssignment};</li>
 * <li>if it takes a small number of distinct values, it becomes an {@link EventAssignment};</li>
 * <li>otherwise it is left unconstrained.</li>
 * </ul>
 */
public class UpdateInference {

    public static final int DEFAULT_MAX_CONSTANTS = 3;

    private final int maxConstants;

    public UpdateInference() {
        this(DEFAULT_MAX_CONSTANTS);
    }

    public UpdateInference(int maxConstants) {
        Preconditions.checkArgument(maxConstants >= 1, "maxConstants must be positive: %s", maxConstants);
        this.maxConstants = maxConstants;
    }

    public Update infer(List<EdgeSample> samples) {
        if (samples.isEmpty()) {
            return Update.EMPTY;
        }

        SortedSet<String> attributes = new TreeSet<>();
        for (EdgeSample s : samples) {
            attributes.addAll(s.getPayload().getAttributes());
        }

        SortedMap<String, Assignment> assignments = new TreeMap<>();
        for (String attribute : attributes) {
            boolean presentEverywhere = true;
            boolean unchanged = true;
            SortedSet<AttributeValue> values = new TreeSet<>();

            for (EdgeSample s : samples) {
                AttributeValue value = s.getPayload().get(attribute);
                if (value == null) {
                    presentEverywhere = false;
                    break;
                }
                values.add(value);
                if (!value.equals(s.getPreValuation().get(attribute))) {
                    unchanged = false;
                }
            }

            if (!presentEverywhere || unchanged) {
                continue;
            }
            if (values.size() == 1) {
                assignments.put(attribute, new ConstantAssignment(values.first()));
            } else if (values.size() <= maxConstants) {
                assignments.put(attribute, new EventAssignment(attribute, values));
            }
        }
        return Update.of(assignments);
    }
}
