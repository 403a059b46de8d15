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
package de.dpnlearn.serialization.json;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.Map;

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.datastructure.dpn.Arc;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.dpn.Marking;
import de.dpnlearn.datastructure.dpn.NetTransition;
import de.dpnlearn.datastructure.dpn.Place;
import de.dpnlearn.datastructure.efsm.Assignment;
import de.dpnlearn.datastructure.efsm.ConstantAssignment;
import de.dpnlearn.datastructure.efsm.EventAssignment;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.CategoricalEquality;
import de.dpnlearn.datastructure.predicate.NumericComparison;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Renders a {@link DataPetriNet} as JSON. The output is read back by {@link DPNJsonReader}.
 * <p>
 * Attribute values are written as JSON numbers (numeric) or JSON strings (categorical), guards as arrays of atoms,
 * updates as arrays of assignments, markings as objects mapping place ids to token counts.
 */
public final class DPNJsonWriter {

    private DPNJsonWriter() {
        // prevent instantiation
    }

    public static String write(DataPetriNet net) {
        return toJson(net).toJSONString();
    }

    public static void write(DataPetriNet net, Writer writer) throws IOException {
        toJson(net).writeJSONString(writer);
        writer.flush();
    }

    @SuppressWarnings("unchecked")
    static JSONObject toJson(DataPetriNet net) {
        JSONObject json = new JSONObject();

        JSONArray places = new JSONArray();
        for (Place p : net.getPlaces()) {
            places.add(p.getId());
        }
        json.put(JsonKeys.PLACES, places);

        JSONArray transitions = new JSONArray();
        for (NetTransition t : net.getTransitions()) {
            transitions.add(transition(t));
        }
        json.put(JsonKeys.TRANSITIONS, transitions);

        JSONArray arcs = new JSONArray();
        for (Arc a : net.getArcs()) {
            JSONObject arc = new JSONObject();
            arc.put(JsonKeys.PLACE, a.getPlace());
            arc.put(JsonKeys.TRANSITION, a.getTransition());
            arc.put(JsonKeys.DIRECTION, a.getDirection().name());
            arcs.add(arc);
        }
        json.put(JsonKeys.ARCS, arcs);

        json.put(JsonKeys.INITIAL_MARKING, marking(net.getInitialMarking()));
        JSONArray finals = new JSONArray();
        for (Marking m : net.getFinalMarkings()) {
            finals.add(marking(m));
        }
        json.put(JsonKeys.FINAL_MARKINGS, finals);

        JSONObject variables = new JSONObject();
        for (Map.Entry<String, AttributeType> e : net.getVariables().entrySet()) {
            variables.put(e.getKey(), e.getValue().name());
        }
        json.put(JsonKeys.VARIABLES, variables);

        return json;
    }

    @SuppressWarnings("unchecked")
    private static JSONObject transition(NetTransition t) {
        JSONObject json = new JSONObject();
        json.put(JsonKeys.ID, t.getId());
        json.put(JsonKeys.LABEL, t.getLabel());
        json.put(JsonKeys.GUARD, guard(t.getGuard()));
        json.put(JsonKeys.UPDATE, update(t.getUpdate()));
        json.put(JsonKeys.READ, strings(t.getReadVariables()));
        json.put(JsonKeys.WRITE, strings(t.getWriteVariables()));
        return json;
    }

    @SuppressWarnings("unchecked")
    private static JSONArray guard(Predicate guard) {
        JSONArray atoms = new JSONArray();
        for (AtomicPredicate atom : guard.getConjuncts()) {
            JSONObject json = new JSONObject();
            json.put(JsonKeys.ATTRIBUTE, atom.getAttribute());
            json.put(JsonKeys.TYPE, atom.getType().name());
            if (atom.getType() == AttributeType.NUMERIC) {
                NumericComparison comparison = (NumericComparison) atom;
                json.put(JsonKeys.OPERATOR, comparison.getOperator().getSymbol());
                json.put(JsonKeys.THRESHOLD, comparison.getThreshold());
            } else {
                json.put(JsonKeys.VALUE, ((CategoricalEquality) atom).getValue());
            }
            atoms.add(json);
        }
        return atoms;
    }

    @SuppressWarnings("unchecked")
    private static JSONArray update(Update update) {
        JSONArray assignments = new JSONArray();
        for (Map.Entry<String, Assignment> e : update.getAssignments().entrySet()) {
            JSONObject json = new JSONObject();
            json.put(JsonKeys.VARIABLE, e.getKey());
            Assignment assignment = e.getValue();
            if (assignment instanceof ConstantAssignment) {
                json.put(JsonKeys.KIND, JsonKeys.KIND_CONSTANT);
                json.put(JsonKeys.VALUE, value(((ConstantAssignment) assignment).getValue()));
            } else {
                EventAssignment event = (EventAssignment) assignment;
                json.put(JsonKeys.KIND, JsonKeys.KIND_EVENT);
                json.put(JsonKeys.ATTRIBUTE, event.getAttribute());
                JSONArray observed = new JSONArray();
                for (AttributeValue v : event.getObservedValues()) {
                    observed.add(value(v));
                }
                json.put(JsonKeys.OBSERVED, observed);
            }
            assignments.add(json);
        }
        return assignments;
    }

    private static Object value(AttributeValue value) {
        if (value.getType() == AttributeType.NUMERIC) {
            return value.asNumber();
        }
        return value.asCategory();
    }

    @SuppressWarnings("unchecked")
    private static JSONObject marking(Marking marking) {
        JSONObject json = new JSONObject();
        for (Map.Entry<String, Integer> e : marking.asMap().entrySet()) {
            json.put(e.getKey(), e.getValue());
        }
        return json;
    }

    @SuppressWarnings("unchecked")
    private static JSONArray strings(Collection<String> values) {
        JSONArray array = new JSONArray();
        array.addAll(values);
        return array;
    }
}
