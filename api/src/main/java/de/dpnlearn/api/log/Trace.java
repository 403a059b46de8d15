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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import net.automatalib.words.Word;

/**
 * The recorded events of one case, in execution order. Traces are produced by an external log loader and never
 * mutated afterwards.
 */
public final class Trace {

    private final String caseId;
    private final ImmutableList<Event> events;

    public Trace(String caseId, List<Event> events) {
        this.caseId = Objects.requireNonNull(caseId);
        this.events = ImmutableList.copyOf(events);
    }

    public static Trace of(String caseId, Event... events) {
        return new Trace(caseId, ImmutableList.copyOf(events));
    }

    public String getCaseId() {
        return caseId;
    }

    public List<Event> getEvents() {
        return events;
    }

    public int length() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public Word<String> labels() {
        List<String> labels = new ArrayList<>(events.size());
        for (Event e : events) {
            labels.add(e.getLabel());
        }
        return Word.fromList(labels);
    }

    /**
     * Computes the edge samples of this trace: for the {@code i}-th event, the pre-valuation accumulates the payloads
     * of events {@code 0 .. i-1}, and the payload is the attributes of event {@code i}.
     *
     * @return one sample per event, in trace order
     */
    public List<EdgeSample> toEdgeSamples() {
        List<EdgeSample> result = new ArrayList<>(events.size());
        Valuation current = Valuation.empty();
        for (Event e : events) {
            result.add(new EdgeSample(current, e.getAttributes()));
            current = current.overriddenBy(e.getAttributes());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Trace)) {
            return false;
        }
        Trace that = (Trace) o;
        return caseId.equals(that.caseId) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseId, events);
    }

    @Override
    public String toString() {
        return caseId + ": " + events;
    }
}
