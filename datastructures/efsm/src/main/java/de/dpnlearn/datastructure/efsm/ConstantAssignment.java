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
package de.dpnlearn.datastructure.efsm;

import java.util.Objects;

import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;

public final class ConstantAssignment extends Assignment {

    private final AttributeValue value;

    public ConstantAssignment(AttributeValue value) {
        this.value = Objects.requireNonNull(value);
    }

    public AttributeValue getValue() {
        return value;
    }

    @Override
    public AttributeValue evaluate(Valuation payload) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstantAssignment)) {
            return false;
        }
        return value.equals(((ConstantAssignment) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
