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

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.PropagationMode;

public final class Variable {

    private final String name;
    private final AttributeType type;
    private final PropagationMode propagation;

    public Variable(String name, AttributeType type, PropagationMode propagation) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.propagation = Objects.requireNonNull(propagation);
    }

    public String getName() {
        return name;
    }

    public AttributeType getType() {
        return type;
    }

    public PropagationMode getPropagation() {
        return propagation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        Variable that = (Variable) o;
        return name.equals(that.name) && type == that.type && propagation == that.propagation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, propagation);
    }

    @Override
    public String toString() {
        return name + ':' + type;
    }
}
