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
package de.dpnlearn.datastructure.dpn;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;

/**
 * Conversions between Petri nets and automaton skeletons.
 */
public final class StateMachineNets {

    private StateMachineNets() {
        // prevent instantiation
    }

    /**
     * Extracts a {@link ControlFlowSkeleton} from the state-machine part of a net. Every place becomes a state and
     * every transition with exactly one input and one output place becomes an edge; other transitions are dropped.
     * The initial marking must mark exactly one place with one token, which becomes the initial state. Places that
     * carry the single token of some final marking become accepting.
     *
     * @throws IllegalArgumentException
     *         if the initial marking is not a single-token marking
     */
    public static ControlFlowSkeleton toSkeleton(DataPetriNet net) {
        Marking initial = net.getInitialMarking();
        Preconditions.checkArgument(initial.getTokenCount() == 1,
                                    "initial marking %s is not a single-token marking",
                                    initial);

        ControlFlowSkeleton.Builder builder = ControlFlowSkeleton.builder();
        Map<String, Integer> index = new HashMap<>();
        for (Place p : net.getPlaces()) {
            index.put(p.getId(), builder.addState(p.getId()));
        }

        Integer initialState = index.get(initial.getMarkedPlaces().first());
        Preconditions.checkArgument(initialState != null, "initial marking %s marks an unknown place", initial);
        builder.setInitial(initialState);

        for (Marking fin : net.getFinalMarkings()) {
            if (fin.getTokenCount() == 1) {
                Integer state = index.get(fin.getMarkedPlaces().first());
                if (state != null) {
                    builder.setAccepting(state);
                }
            }
        }

        for (NetTransition t : net.getTransitions()) {
            List<String> pre = net.getPreset(t);
            List<String> post = net.getPostset(t);
            if (pre.size() == 1 && post.size() == 1) {
                builder.addEdge(index.get(pre.get(0)), t.getLabel(), index.get(post.get(0)));
            }
        }
        return builder.build();
    }
}
