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
package de.dpnlearn.datastructure.predicate;

import java.util.Objects;

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;

public final class CategoricalEquality extends AtomicPredicate {

    private final String value;

    CategoricalEquality(String attribute, String value) {
        super(Objects.requireNonNull(attribute));
        this.value = Objects.requireNonNull(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public AttributeType getType() {
        return AttributeType.CATEGORICAL;
    }

    @Override
    public boolean evaluate(Valuation valuation) {
        AttributeValue actual = valuation.get(getAttribute());
        if (actual == null || actual.getType() != AttributeType.CATEGORICAL) {
            return false;
        }
        return value.equals(actual.asCategory());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoricalEquality)) {
            return false;
        }
        CategoricalEquality that = (CategoricalEquality) o;
        return getAttribute().equals(that.getAttribute()) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAttribute(), value);
    }

    @Override
    public String toString() {
        return getAttribute() + " == \"" + value + '"';
    }
}
