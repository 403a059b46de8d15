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

import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.Valuation;

/**
 * A single comparison of one attribute against a constant. Atomic predicates are tagged by the
 * {@link AttributeType type} of the attribute they constrain; an atom over an attribute that is absent from a
 * valuation does not hold.
 */
public abstract class AtomicPredicate {

    private final String attribute;

    AtomicPredicate(String attribute) {
        this.attribute = attribute;
    }

    public static NumericComparison numeric(String attribute, ComparisonOperator operator, double threshold) {
        return new NumericComparison(attribute, operator, threshold);
    }

    public static CategoricalEquality categorical(String attribute, String value) {
        return new CategoricalEquality(attribute, value);
    }

    public String getAttribute() {
        return attribute;
    }

    public abstract AttributeType getType();

    public abstract boolean evaluate(Valuation valuation);
}
