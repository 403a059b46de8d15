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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.Valuation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A data-aware Petri net. The control part is an ordinary place/transition net with arc weight one; every
 * transition additionally carries a guard over the net's variables and an update of them.
 * <p>
 * The firing rule: a transition is enabled in a marking if each of its input places holds a token; it is enabled
 * under a valuation if it is enabled and its guard holds. Firing consumes one token from each input place and
 * produces one token on each output place.
 * <p>
 * The net does not check that arcs reference existing nodes; arcs to unknown ids are ignored by the firing rule.
 */
public final class DataPetriNet {

    private final ImmutableList<Place> places;
    private final ImmutableList<NetTransition> transitions;
    private final ImmutableList<Arc> arcs;
    private final Marking initialMarking;
    private final ImmutableList<Marking> finalMarkings;
    private final ImmutableSortedMap<String, AttributeType> variables;

    private final Map<String, Place> placeIndex;
    private final Map<String, NetTransition> transitionIndex;
    private final Map<String, List<String>> presets;
    private final Map<String, List<String>> postsets;

    private DataPetriNet(Builder builder) {
        this.places = ImmutableList.copyOf(builder.places.values());
        this.transitions = ImmutableList.copyOf(builder.transitions.values());
        this.arcs = ImmutableList.copyOf(builder.arcs);
        this.initialMarking = builder.initialMarking;
        this.finalMarkings = ImmutableList.copyOf(builder.finalMarkings);
        this.variables = ImmutableSortedMap.copyOf(builder.variables);

        this.placeIndex = new HashMap<>(builder.places);
        this.transitionIndex = new HashMap<>(builder.transitions);
        this.presets = new HashMap<>();
        this.postsets = new HashMap<>();
        for (NetTransition t : transitions) {
            presets.put(t.getId(), new ArrayList<>());
            postsets.put(t.getId(), new ArrayList<>());
        }
        for (Arc arc : arcs) {
            Map<String, List<String>> target = arc.getDirection() == Arc.Direction.INPUT ? presets : postsets;
            List<String> list = target.get(arc.getTransition());
            if (list != null && placeIndex.containsKey(arc.getPlace())) {
                list.add(arc.getPlace());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Place> getPlaces() {
        return places;
    }

    public @Nullable Place getPlace(String id) {
        return placeIndex.get(id);
    }

    public List<NetTransition> getTransitions() {
        return transitions;
    }

    public @Nullable NetTransition getTransition(String id) {
        return transitionIndex.get(id);
    }

    public List<Arc> getArcs() {
        return arcs;
    }

    public Marking getInitialMarking() {
        return initialMarking;
    }

    public List<Marking> getFinalMarkings() {
        return finalMarkings;
    }

    public SortedMap<String, AttributeType> getVariables() {
        return variables;
    }

    /**
     * The ids of the input places of the given transition, in arc order.
     */
    public List<String> getPreset(NetTransition transition) {
        List<String> result = presets.get(transition.getId());
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    /**
     * The ids of the output places of the given transition, in arc order.
     */
    public List<String> getPostset(NetTransition transition) {
        List<String> result = postsets.get(transition.getId());
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    public boolean isEnabled(Marking marking, NetTransition transition) {
        Map<String, Integer> required = new HashMap<>();
        for (String place : getPreset(transition)) {
            required.merge(place, 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> e : required.entrySet()) {
            if (marking.get(e.getKey()) < e.getValue()) {
                return false;
            }
        }
        return true;
    }

    public boolean isEnabled(Marking marking, NetTransition transition, Valuation valuation) {
        return isEnabled(marking, transition) && transition.getGuard().evaluate(valuation);
    }

    /**
     * All transitions enabled in the given marking, in transition order.
     */
    public List<NetTransition> enabledTransitions(Marking marking) {
        List<NetTransition> result = new ArrayList<>();
        for (NetTransition t : transitions) {
            if (isEnabled(marking, t)) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Fires the given transition.
     *
     * @throws IllegalStateException
     *         if the transition is not enabled in the given marking
     */
    public Marking fire(Marking marking, NetTransition transition) {
        Preconditions.checkState(isEnabled(marking, transition),
                                 "transition %s is not enabled in %s",
                                 transition,
                                 marking);
        Marking result = marking;
        for (String place : getPreset(transition)) {
            result = result.add(place, -1);
        }
        for (String place : getPostset(transition)) {
            result = result.add(place, 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "DataPetriNet(places=" + places + ", transitions=" + transitions + ", arcs=" + arcs + ", initial=" +
               initialMarking + ')';
    }

    public static final class Builder {

        private final Map<String, Place> places = new LinkedHashMap<>();
        private final Map<String, NetTransition> transitions = new LinkedHashMap<>();
        private final List<Arc> arcs = new ArrayList<>();
        private final List<Marking> finalMarkings = new ArrayList<>();
        private final Map<String, AttributeType> variables = new TreeMap<>();
        private Marking initialMarking = Marking.empty();

        private Builder() {}

        public Builder addPlace(Place place) {
            Preconditions.checkArgument(!places.containsKey(place.getId()), "duplicate place '%s'", place);
            places.put(place.getId(), place);
            return this;
        }

        public Builder addTransition(NetTransition transition) {
            Preconditions.checkArgument(!transitions.containsKey(transition.getId()),
                                        "duplicate transition '%s'",
                                        transition.getId());
            transitions.put(transition.getId(), transition);
            return this;
        }

        public Builder addArc(Arc arc) {
            arcs.add(arc);
            return this;
        }

        public Builder setInitialMarking(Marking marking) {
            this.initialMarking = marking;
            return this;
        }

        public Builder addFinalMarking(Marking marking) {
            finalMarkings.add(marking);
            return this;
        }

        public Builder addVariable(String name, AttributeType type) {
            variables.put(name, type);
            return this;
        }

        public DataPetriNet build() {
            return new DataPetriNet(this);
        }
    }
}
