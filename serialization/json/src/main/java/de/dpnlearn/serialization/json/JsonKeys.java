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

/**
 * Member names of the DPN JSON format.
 */
final class JsonKeys {

    static final String PLACES = "places";
    static final String TRANSITIONS = "transitions";
    static final String ARCS = "arcs";
    static final String INITIAL_MARKING = "initialMarking";
    static final String FINAL_MARKINGS = "finalMarkings";
    static final String VARIABLES = "variables";

    static final String ID = "id";
    static final String LABEL = "label";
    static final String GUARD = "guard";
    static final String UPDATE = "update";
    static final String READ = "read";
    static final String WRITE = "write";

    static final String ATTRIBUTE = "attribute";
    static final String TYPE = "type";
    static final String OPERATOR = "operator";
    static final String THRESHOLD = "threshold";
    static final String VALUE = "value";

    static final String VARIABLE = "variable";
    static final String KIND = "kind";
    static final String OBSERVED = "observed";
    static final String KIND_CONSTANT = "constant";
    static final String KIND_EVENT = "event";

    static final String PLACE = "place";
    static final String TRANSITION = "transition";
    static final String DIRECTION = "direction";

    private JsonKeys() {
        // prevent instantiation
    }
}
