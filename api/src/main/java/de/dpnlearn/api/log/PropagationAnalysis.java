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
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classifies attributes by how often an observation repeats the value the attribute had at its previous
 * observation within the same case.
 */
public final class PropagationAnalysis {

    static final double PERSISTENT_RATE = 0.7;
    static final double SOMETIMES_RATE = 0.3;

    private PropagationAnalysis() {
        // prevent instantiation
    }

    public static SortedMap<String, PropagationMode> analyze(Collection<Trace> traces) {
        Map<String, Integer> repeated = new HashMap<>();
        Map<String, Integer> total = new HashMap<>();

        for (Trace trace : traces) {
            Map<String, AttributeValue> last = new HashMap<>();
            for (Event event : trace.getEvents()) {
                for (Map.Entry<String, AttributeValue> e : event.getAttributes().asMap().entrySet()) {
                    total.merge(e.getKey(), 1, Integer::sum);
                    if (e.getValue().equals(last.get(e.getKey()))) {
                        repeated.merge(e.getKey(), 1, Integer::sum);
                    }
                    last.put(e.getKey(), e.getValue());
                }
            }
        }

        SortedMap<String, PropagationMode> result = new TreeMap<>();
        for (Map.Entry<String, Integer> e : total.entrySet()) {
            double rate = (double) repeated.getOrDefault(e.getKey(), 0) / e.getValue();
            if (rate > PERSISTENT_RATE) {
                result.put(e.getKey(), PropagationMode.PERSISTENT);
            } else if (rate > SOMETIMES_RATE) {
                result.put(e.getKey(), PropagationMode.SOMETIMES);
            } else {
                result.put(e.getKey(), PropagationMode.TRANSIENT);
            }
        }
        return result;
    }
}
