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
package de.dpnlearn.algorithm.mapping;

import java.util.Map;
import java.util.TreeMap;

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.datastructure.dpn.Arc;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.dpn.Marking;
import de.dpnlearn.datastructure.dpn.NetTransition;
import de.dpnlearn.datastructure.dpn.Place;
import de.dpnlearn.datastructure.efsm.Assignment;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.EventAssignment;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.datastructure.efsm.Variable;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates an {@link EFSM} into a {@link DataPetriNet} with the same control structure.
 * <p>
 * Every state {@code s} becomes a place {@code p_s}, every transition with index {@code i} and label {@code l}
 * becomes a net transition {@code ti_l} that consumes a token from the place of its source and produces one on the
 * place of its target. Guards and updates are carried over unchanged. The net starts with a single token on the
 * place of the initial state and has one final marking per accepting state.
 * <p>
 * The resulting net is a state machine: every reachable marking carries exactly one token.
 */
public class EFSMToDPNMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(EFSMToDPNMapper.class);

    private static final String PLACE_PREFIX = "p_";

    public static String placeId(State state) {
        return PLACE_PREFIX + state.getName();
    }

    public static String transitionId(Transition transition) {
        return "t" + transition.getId() + '_' + transition.getLabel();
    }

    public DataPetriNet map(EFSM efsm) {
        DataPetriNet.Builder builder = DataPetriNet.builder();

        for (State state : efsm.getStates()) {
            builder.addPlace(new Place(placeId(state)));
        }

        for (Transition t : efsm.getTransitions()) {
            NetTransition netTransition =
                    new NetTransition(transitionId(t), t.getLabel(), t.getGuard(), t.getUpdate());
            builder.addTransition(netTransition);
            builder.addArc(Arc.input(placeId(efsm.getState(t.getSource())), netTransition.getId()));
            builder.addArc(Arc.output(netTransition.getId(), placeId(efsm.getState(t.getTarget()))));
        }

        builder.setInitialMarking(Marking.of(placeId(efsm.getInitialState())));
        for (State state : efsm.getStates()) {
            if (state.isAccepting()) {
                builder.addFinalMarking(Marking.of(placeId(state)));
            }
        }

        for (Map.Entry<String, AttributeType> e : variableTypes(efsm).entrySet()) {
            builder.addVariable(e.getKey(), e.getValue());
        }

        DataPetriNet net = builder.build();
        LOGGER.info("Mapped EFSM with {} states and {} transitions to a net with {} places and {} transitions",
                    efsm.size(),
                    efsm.getTransitions().size(),
                    net.getPlaces().size(),
                    net.getTransitions().size());
        return net;
    }

    /**
     * The declared EFSM variables plus every attribute a guard or an update refers to.
     */
    private static Map<String, AttributeType> variableTypes(EFSM efsm) {
        Map<String, AttributeType> result = new TreeMap<>();
        for (Variable v : efsm.getVariables().values()) {
            result.put(v.getName(), v.getType());
        }
        for (Transition t : efsm.getTransitions()) {
            for (AtomicPredicate atom : t.getGuard().getConjuncts()) {
                result.putIfAbsent(atom.getAttribute(), atom.getType());
            }
            for (Map.Entry<String, Assignment> e : t.getUpdate().getAssignments().entrySet()) {
                Assignment assignment = e.getValue();
                if (assignment instanceof ConstantAssignment) {
                    result.putIfAbsent(e.getKey(), ((ConstantAssignment) assignment).getValue().getType());
                } else if (assignment instanceof EventAssignment) {
                    EventAssignment event = (EventAssignment) assignment;
                    if (!event.getObservedValues().isEmpty()) {
                        result.putIfAbsent(e.getKey(), event.getObservedValues().first().getType());
                    }
                }
            }
        }
        return result;
    }
}
