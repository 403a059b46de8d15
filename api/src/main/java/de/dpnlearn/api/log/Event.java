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
package de.dpnlearn.api.log;

import java.util.Objects;

/**
 * A single event of a trace: an event label together with the attributes recorded on it.
 */
public final class Event {

    private final String label;
    private final Valuation attributes;

    public Event(String label, Valuation attributes) {
        this.label = Objects.requireNonNull(label);
        this.attributes = Objects.requireNonNull(attributes);
    }

    public static Event of(String label) {
        return new Event(label, Valuation.empty());
    }

    public String getLabel() {
        return label;
    }

    public Valuation getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event that = (Event) o;
        return label.equals(that.label) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, attributes);
    }

    @Override
    public String toString() {
        return label + attributes;
    }
}
