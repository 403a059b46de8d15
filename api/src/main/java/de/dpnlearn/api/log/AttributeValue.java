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

/**
 * A typed attribute value. Values are tagged with their {@link AttributeType}, and consumers dispatch on
 * {@link #getType()} instead of inspecting runtime classes.
 */
public abstract class AttributeValue implements Comparable<AttributeValue> {

    AttributeValue() {
        // only the two variants below
    }

    /**
     * Creates a numeric value.
     *
     * @throws IllegalArgumentException
     *         if {@code value} is NaN or infinite
     */
    public static NumericValue numeric(double value) {
        return new NumericValue(value);
    }

    public static CategoricalValue categorical(String value) {
        return new CategoricalValue(value);
    }

    public abstract AttributeType getType();

    /**
     * Returns the numeric content of this value.
     *
     * @throws IllegalStateException
     *         if this is not a {@link AttributeType#NUMERIC numeric} value
     */
    public double asNumber() {
        throw new IllegalStateException("Not a numeric value: " + this);
    }

    /**
     * Returns the categorical content of this value.
     *
     * @throws IllegalStateException
     *         if this is not a {@link AttributeType#CATEGORICAL categorical} value
     */
    public String asCategory() {
        throw new IllegalStateException("Not a categorical value: " + this);
    }

    /**
     * Numeric values sort before categorical ones; values of the same type use their natural order.
     */
    @Override
    public int compareTo(AttributeValue o) {
        if (getType() != o.getType()) {
            return getType().compareTo(o.getType());
        }
        if (getType() == AttributeType.NUMERIC) {
            return Double.compare(asNumber(), o.asNumber());
        }
        return asCategory().compareTo(o.asCategory());
    }
}
