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
package de.dpnlearn.algorithm.efsm;

/**
 * How the control structure of the learned EFSM is obtained.
 */
public enum LearningMode {

    /**
     * Build a prefix tree from the traces and generalize it by blue-fringe state merging.
     */
    PREFIX_TREE,

    /**
     * Replay the traces on a control-flow skeleton supplied by the caller.
     */
    BOOTSTRAP
}
