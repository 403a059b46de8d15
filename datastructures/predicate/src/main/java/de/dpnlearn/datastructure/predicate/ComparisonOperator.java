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

import org.checkerframework.checker.nullness.qual.Nullable;

public enum ComparisonOperator {
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">"),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        switch (this) {
            case LE:
                return value <= threshold;
            case GE:
                return value >= threshold;
            case LT:
                return value < threshold;
            case GT:
                return value > threshold;
            case EQ:
                return Double.compare(value, threshold) == 0;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }

    public static @Nullable ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
