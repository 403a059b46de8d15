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

import java.util.Objects;

public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String subject;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String subject, String message) {
        this.kind = Objects.requireNonNull(kind);
        this.subject = Objects.requireNonNull(subject);
        this.message = Objects.requireNonNull(message);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /**
     * The affected element, e.g. a case id or a transition id.
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && subject.equals(that.subject) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }

    @Override
    public String toString() {
        return kind + "[" + subject + "]: " + message;
    }
}
