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
package de.dpnlearn.oracle.solver;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import de.dpnlearn.api.log.AttributeType;
import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.CategoricalEquality;
import de.dpnlearn.datastructure.predicate.NumericComparison;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConstraintSolver} backed by the Z3 SMT solver. Numeric attributes become real-valued constants and
 * categorical attributes string-valued constants; every atom of a predicate is asserted as one comparison over its
 * attribute's constant.
 * <p>
 * Queries are answered with Z3's own timeout, after which Z3 reports {@link SolverResult#UNKNOWN}. An attribute
 * constrained both numerically and categorically has no value and makes the predicate unsatisfiable.
 * <p>
 * All queries share one Z3 context. Queries are serialized on it, so instances may be used from several threads,
 * and must be {@link #close() closed} after use.
 */
public class Z3ConstraintSolver implements ConstraintSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(Z3ConstraintSolver.class);

    private final Context context;
    private final int timeoutMillis;
    private boolean closed;

    public Z3ConstraintSolver(Duration timeout) {
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        this.timeoutMillis = (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
        this.context = new Context();
    }

    @Override
    public synchronized SolverResult check(Predicate predicate) {
        Preconditions.checkState(!closed, "solver has been closed");
        if (hasTypeClash(predicate)) {
            return SolverResult.UNSAT;
        }

        try {
            final Solver solver = context.mkSolver();
            final Params params = context.mkParams();
            params.add("timeout", timeoutMillis);
            solver.setParameters(params);

            for (AtomicPredicate atom : predicate.getConjuncts()) {
                solver.add(encode(atom));
            }

            final Status status = solver.check();
            switch (status) {
                case SATISFIABLE:
                    return SolverResult.SAT;
                case UNSATISFIABLE:
                    return SolverResult.UNSAT;
                case UNKNOWN:
                    LOGGER.debug("Z3 could not decide '{}': {}", predicate, solver.getReasonUnknown());
                    return SolverResult.UNKNOWN;
                default:
                    throw new IllegalStateException("Unknown solver status " + status);
            }
        } catch (Z3Exception e) {
            LOGGER.warn("Z3 failed on '{}'", predicate, e);
            return SolverResult.UNKNOWN;
        }
    }

    private BoolExpr encode(AtomicPredicate atom) {
        if (atom.getType() == AttributeType.NUMERIC) {
            final NumericComparison comparison = (NumericComparison) atom;
            final RealExpr variable = context.mkRealConst(atom.getAttribute());
            final RatNum threshold = context.mkReal(BigDecimal.valueOf(comparison.getThreshold()).toPlainString());
            switch (comparison.getOperator()) {
                case LE:
                    return context.mkLe(variable, threshold);
                case LT:
                    return context.mkLt(variable, threshold);
                case GE:
                    return context.mkGe(variable, threshold);
                case GT:
                    return context.mkGt(variable, threshold);
                case EQ:
                    return context.mkEq(variable, threshold);
                default:
                    throw new IllegalStateException("Unknown operator " + comparison.getOperator());
            }
        }

        final Expr<SeqSort<CharSort>> variable = context.mkConst(atom.getAttribute(), context.getStringSort());
        return context.mkEq(variable, context.mkString(literal(((CategoricalEquality) atom).getValue())));
    }

    // Z3 decodes escape sequences in string literals, so a backslash is passed as the escape of itself.
    private static String literal(String value) {
        return value.replace("\\", "\\u{5c}");
    }

    private static boolean hasTypeClash(Predicate predicate) {
        final Map<String, AttributeType> types = new HashMap<>();
        for (AtomicPredicate atom : predicate.getConjuncts()) {
            final @Nullable AttributeType previous = types.putIfAbsent(atom.getAttribute(), atom.getType());
            if (previous != null && previous != atom.getType()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            context.close();
        }
    }
}
