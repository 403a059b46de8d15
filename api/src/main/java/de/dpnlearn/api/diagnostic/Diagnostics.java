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
package de.dpnlearn.api.diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the non-fatal degradations of a learning run. Instances are thread-safe, so that concurrently running
 * synthesis tasks may report into the same accumulator.
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public synchronized void report(DiagnosticKind kind, String subject, String message) {
        entries.add(new Diagnostic(kind, subject, message));
    }

    public synchronized void addAll(Diagnostics other) {
        entries.addAll(other.getEntries());
    }

    public synchronized List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized List<Diagnostic> getEntries(DiagnosticKind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.getKind() == kind) {
                result.add(d);
            }
        }
        return result;
    }

    public synchronized int count(DiagnosticKind kind) {
        int count = 0;
        for (Diagnostic d : entries) {
            if (d.getKind() == kind) {
                count++;
            }
        }
        return count;
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized Map<DiagnosticKind, Integer> counts() {
        Map<DiagnosticKind, Integer> result = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic d : entries) {
            result.merge(d.getKind(), 1, Integer::sum);
        }
        return result;
    }

    /**
     * A one-line overview of the reported degradations, e.g. {@code "2 diagnostic(s): UNCONSTRAINED_GUARD=2"}.
     */
    public synchronized String summary() {
        if (entries.isEmpty()) {
            return "no diagnostics";
        }
        StringBuilder builder = new StringBuilder();
        builder.append(entries.size()).append(" diagnostic(s): ");
        boolean first = true;
        for (Map.Entry<DiagnosticKind, Integer> e : counts().entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            builder.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return builder.toString();
    }

    @Override
    public synchronized String toString() {
        return entries.toString();
    }
}
