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
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

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
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Parses the JSON produced by {@link DPNJsonWriter}. Syntax errors and documents that do not describe a net are
 * reported as {@link IOException}s.
 */
public final class DPNJsonReader {

    private DPNJsonReader() {
        // prevent instantiation
    }

    public static DataPetriNet read(String json) throws IOException {
        try {
            return fromJson(new JSONParser().parse(json));
        } catch (ParseException e) {
            throw new IOException("Malformed DPN document: " + e, e);
        }
    }

    public static DataPetriNet read(Reader reader) throws IOException {
        try {
            return fromJson(new JSONParser().parse(reader));
        } catch (ParseException e) {
            throw new IOException("Malformed DPN document: " + e, e);
        }
    }

    static DataPetriNet fromJson(Object document) throws IOException {
        try {
            return net(object(document, "document"));
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new IOException("Invalid DPN document: " + e.getMessage(), e);
        }
    }

    private static DataPetriNet net(JSONObject json) throws IOException {
        DataPetriNet.Builder builder = DataPetriNet.builder();

        for (Object place : array(json, JsonKeys.PLACES)) {
            builder.addPlace(new Place((String) place));
        }
        for (Object transition : array(json, JsonKeys.TRANSITIONS)) {
            builder.addTransition(transition(object(transition, JsonKeys.TRANSITIONS)));
        }
        for (Object arc : array(json, JsonKeys.ARCS)) {
            JSONObject a = object(arc, JsonKeys.ARCS);
            String place = string(a, JsonKeys.PLACE);
            String transition = string(a, JsonKeys.TRANSITION);
            Arc.Direction direction = Arc.Direction.valueOf(string(a, JsonKeys.DIRECTION));
            builder.addArc(direction == Arc.Direction.INPUT ? Arc.input(place, transition) :
                                   Arc.output(transition, place));
        }

        builder.setInitialMarking(marking(object(member(json, JsonKeys.INITIAL_MARKING), JsonKeys.INITIAL_MARKING)));
        for (Object marking : array(json, JsonKeys.FINAL_MARKINGS)) {
            builder.addFinalMarking(marking(object(marking, JsonKeys.FINAL_MARKINGS)));
        }

        JSONObject variables = object(member(json, JsonKeys.VARIABLES), JsonKeys.VARIABLES);
        for (Object key : variables.keySet()) {
            builder.addVariable((String) key, AttributeType.valueOf((String) variables.get(key)));
        }

        return builder.build();
    }

    private static NetTransition transition(JSONObject json) throws IOException {
        return new NetTransition(string(json, JsonKeys.ID),
                                 string(json, JsonKeys.LABEL),
                                 guard(array(json, JsonKeys.GUARD)),
                                 update(array(json, JsonKeys.UPDATE)),
                                 strings(array(json, JsonKeys.READ)),
                                 strings(array(json, JsonKeys.WRITE)));
    }

    private static Predicate guard(JSONArray json) throws IOException {
        List<AtomicPredicate> atoms = new ArrayList<>(json.size());
        for (Object element : json) {
            JSONObject atom = object(element, JsonKeys.GUARD);
            String attribute = string(atom, JsonKeys.ATTRIBUTE);
            if (AttributeType.valueOf(string(atom, JsonKeys.TYPE)) == AttributeType.NUMERIC) {
                String symbol = string(atom, JsonKeys.OPERATOR);
                ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol);
                if (operator == null) {
                    throw new IOException("Unknown comparison operator '" + symbol + "'");
                }
                double threshold = ((Number) member(atom, JsonKeys.THRESHOLD)).doubleValue();
                atoms.add(AtomicPredicate.numeric(attribute, operator, threshold));
            } else {
                atoms.add(AtomicPredicate.categorical(attribute, string(atom, JsonKeys.VALUE)));
            }
        }
        return Predicate.of(atoms);
    }

    private static Update update(JSONArray json) throws IOException {
        Map<String, Assignment> assignments = new HashMap<>();
        for (Object element : json) {
            JSONObject assignment = object(element, JsonKeys.UPDATE);
            String variable = string(assignment, JsonKeys.VARIABLE);
            String kind = string(assignment, JsonKeys.KIND);
            if (JsonKeys.KIND_CONSTANT.equals(kind)) {
                assignments.put(variable, new ConstantAssignment(value(member(assignment, JsonKeys.VALUE))));
            } else if (JsonKeys.KIND_EVENT.equals(kind)) {
                List<AttributeValue> observed = new ArrayList<>();
                for (Object v : array(assignment, JsonKeys.OBSERVED)) {
                    observed.add(value(v));
                }
                assignments.put(variable, new EventAssignment(string(assignment, JsonKeys.ATTRIBUTE), observed));
            } else {
                throw new IOException("Unknown assignment kind '" + kind + "' for variable " + variable);
            }
        }
        return Update.of(assignments);
    }

    private static AttributeValue value(Object json) throws IOException {
        if (json instanceof Number) {
            return AttributeValue.numeric(((Number) json).doubleValue());
        }
        if (json instanceof String) {
            return AttributeValue.categorical((String) json);
        }
        throw new IOException("Not an attribute value: " + json);
    }

    private static Marking marking(JSONObject json) {
        Map<String, Integer> tokens = new TreeMap<>();
        for (Object key : json.keySet()) {
            tokens.put((String) key, ((Number) json.get(key)).intValue());
        }
        return Marking.of(tokens);
    }

    private static SortedSet<String> strings(JSONArray json) {
        SortedSet<String> result = new TreeSet<>();
        for (Object element : json) {
            result.add((String) element);
        }
        return result;
    }

    private static Object member(JSONObject json, String key) throws IOException {
        Object value = json.get(key);
        if (value == null) {
            throw new IOException("Missing member '" + key + "'");
        }
        return value;
    }

    private static String string(JSONObject json, String key) throws IOException {
        return (String) member(json, key);
    }

    private static JSONArray array(JSONObject json, String key) throws IOException {
        Object value = member(json, key);
        if (!(value instanceof JSONArray)) {
            throw new IOException("Member '" + key + "' is not an array");
        }
        return (JSONArray) value;
    }

    private static JSONObject object(Object value, String context) throws IOException {
        if (!(value instanceof JSONObject)) {
            throw new IOException("Expected an object in '" + context + "', got " + value);
        }
        return (JSONObject) value;
    }
}
