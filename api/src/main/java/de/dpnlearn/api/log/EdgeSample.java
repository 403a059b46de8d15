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
 * One observation of a case passing an automaton edge.
 * <p>
 * The <i>pre-valuation</i> holds, for every attribute seen so far in the case, its most recent value before the
 * event occurred; this is what a guard of the edge reads. The <i>payload</i> holds the attributes recorded on the
 * event itself; this is what an update of the edge writes.
 */
public final class EdgeSample {

    private final Valuation preValuation;
    private final Valuation payload;

    public EdgeSample(Valuation preValuation, Valuation payload) {
        this.preValuation = Objects.requireNonNull(preValuation);
        this.payload = Objects.requireNonNull(payload);
    }

    public Valuation getPreValuation() {
        return preValuation;
    }

    public Valuation getPayload() {
        return payload;
    }

    /**
     * The valuation in force after the event, i.e. the pre-valuation overwritten by the payload.
     */
    public Valuation getPostValuation() {
        return preValuation.overriddenBy(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EdgeSample)) {
            return false;
        }
        EdgeSample that = (EdgeSample) o;
        return preValuation.equals(that.preValuation) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(preValuation, payload);
    }

    @Override
    public String toString() {
        return preValuation + " / " + payload;
    }
}
