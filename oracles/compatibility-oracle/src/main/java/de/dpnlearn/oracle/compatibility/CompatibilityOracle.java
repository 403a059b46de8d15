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

import de.dpnlearn.api.automaton.SampledState;

/**
 * Decides whether two automaton states behave equivalently enough to be merged.
 * <p>
 * Implementations must be symmetric ({@code isCompatible(a, b, t) == isCompatible(b, a, t)}) and must not modify
 * the states they inspect, so that several checks may run concurrently.
 */
public interface CompatibilityOracle {

    /**
     * Checks whether the two states may be merged under the given divergence threshold.
     *
     * @param a
     *         the first state
     * @param b
     *         the second state
     * @param threshold
     *         the divergence threshold in {@code [0, 1]}; larger values permit more merges
     *
     * @return {@code true} iff the states are compatible
     */
    boolean isCompatible(SampledState a, SampledState b, double threshold);

    /**
     * Computes the divergence of two states: {@link Double#POSITIVE_INFINITY} if their outgoing label sets differ,
     * otherwise a value in {@code [0, 1]}.
     */
    double divergence(SampledState a, SampledState b);
}
