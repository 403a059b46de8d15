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
package de.dpnlearn.api.diagnostic;

/**
 * Kinds of non-fatal degradations. Each is recovered from locally and leaves a structurally complete model.
 */
public enum DiagnosticKind {
    /**
     * A trace without events was ignored.
     */
    SKIPPED_EMPTY_TRACE,
    /**
     * A trace could not be replayed completely on a supplied control-flow skeleton; only its replayable prefix was
     * used.
     */
    UNREPLAYABLE_TRACE,
    /**
     * No conjunction within the configured size separates a transition from its siblings; the guard was left
     * unconstrained.
     */
    UNCONSTRAINED_GUARD,
    /**
     * The constraint solver timed out, failed, or answered "unknown" for a candidate guard, which was rejected.
     */
    SOLVER_INCONCLUSIVE,
    /**
     * Two sibling transitions with the same label carry guards that can hold simultaneously.
     */
    OVERLAPPING_GUARDS
}
