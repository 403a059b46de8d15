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
package de.dpnlearn.api.automaton;

import java.util.List;
import java.util.SortedSet;

import de.dpnlearn.api.log.EdgeSample;

/**
 * An automaton state viewed through the evidence recorded on its outgoing edges. This is what statistical
 * compatibility tests operate on, independently of whether the state is a prefix tree node or a merged state.
 */
public interface SampledState {

    /**
     * A stable identifier of the state, used for deterministic ordering and reporting.
     */
    int getId();

    /**
     * The labels of all outgoing edges, in lexicographic order.
     */
    SortedSet<String> getOutgoingLabels();

    /**
     * The samples recorded on the outgoing edge with the given label, or an empty list if there is no such edge.
     */
    List<EdgeSample> getSamples(String label);

    boolean isAccepting();
}
