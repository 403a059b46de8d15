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

import com.google.common.base.Preconditions;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;

public final class NumericComparison extends AtomicPredicate {

    private final ComparisonOperator operator;
    private final double threshold;

    NumericComparison(String attribute, ComparisonOperator operator, double threshold) {
        super(Objects.requireNonNull(attribute));
        this.operator = Objects.requireNonNull(operator);
        Preconditions.checkArgument(Double.isFinite(threshold), "Not a finite threshold: %s", threshold);
        this.threshold = threshold;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public AttributeType getType() {
        return AttributeType.NUMERIC;
    }

    @Override
    public boolean evaluate(Valuation valuation) {
        AttributeValue value = valuation.get(getAttribute());
        if (value == null || value.getType() != AttributeType.NUMERIC) {
            return false;
        }
        return operator.test(value.asNumber(), threshold);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericComparison)) {
            return false;
        }
        NumericComparison that = (NumericComparison) o;
        return getAttribute().equals(that.getAttribute()) && operator == that.operator &&
               Double.compare(threshold, that.threshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAttribute(), operator, threshold);
    }

    @Override
    public String toString() {
        return getAttribute() + ' ' + operator.getSymbol() + ' ' + threshold;
    }
}
