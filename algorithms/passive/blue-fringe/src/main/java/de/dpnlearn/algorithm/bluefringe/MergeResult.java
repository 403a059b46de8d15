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
package de.dpnlearn.algorithm.bluefringe;

import java.util.Map;

import com.google.common.collect.ImmutableSortedMap;
import de.dpnlearn.datastructure.efsm.EFSM;

/**
 * The outcome of a {@link BlueFringeMerger} run: the merged, not yet annotated automaton and the mapping from prefix
 * tree node ids to state indices of that automaton.
 */
public final class MergeResult {

    private final EFSM skeleton;
    private final ImmutableSortedMap<Integer, Integer> nodeToState;
    private final int merges;

    MergeResult(EFSM skeleton, Map<Integer, Integer> nodeToState, int merges) {
        this.skeleton = skeleton;
        this.nodeToState = ImmutableSortedMap.copyOf(nodeToState);
        this.merges = merges;
    }

    /**
     * The merged automaton. All guards are universal and all updates empty.
     */
    public EFSM getSkeleton() {
        return skeleton;
    }

    public Map<Integer, Integer> getNodeToState() {
        return nodeToState;
    }

    public int getStateOf(int ptaNode) {
        Integer state = nodeToState.get(ptaNode);
        if (state == null) {
            throw new IllegalArgumentException("Unknown prefix tree node " + ptaNode);
        }
        return state;
    }

    /**
     * The number of committed blue-to-red merges.
     */
    public int getMergeCount() {
        return merges;
    }
}
