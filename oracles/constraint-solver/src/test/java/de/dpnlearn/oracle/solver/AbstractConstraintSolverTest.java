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

import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Queries every {@link ConstraintSolver} backend has to answer exactly.
 */
public abstract class AbstractConstraintSolverTest {

    protected abstract ConstraintSolver solver();

    private static AtomicPredicate x(ComparisonOperator op, double c) {
        return AtomicPredicate.numeric("x", op, c);
    }

    @DataProvider(name = "queries")
    public Object[][] queries() {
        return new Object[][] {{Predicate.TRUE, SolverResult.SAT},
                               {Predicate.of(x(ComparisonOperator.LE, 5), x(ComparisonOperator.GE, 5)),
                                SolverResult.SAT},
                               {Predicate.of(x(ComparisonOperator.LT, 5), x(ComparisonOperator.GE, 5)),
                                SolverResult.UNSAT},
                               {Predicate.of(x(ComparisonOperator.GT, 4), x(ComparisonOperator.LT, 4.5)),
                                SolverResult.SAT},
                               {Predicate.of(x(ComparisonOperator.LE, 3), x(ComparisonOperator.GE, 4)),
                                SolverResult.UNSAT},
                               {Predicate.of(x(ComparisonOperator.EQ, 3), x(ComparisonOperator.LE, 3)),
                                SolverResult.SAT},
                               {Predicate.of(x(ComparisonOperator.EQ, 3), x(ComparisonOperator.LT, 3)),
                                SolverResult.UNSAT},
                               {Predicate.of(x(ComparisonOperator.EQ, 3), x(ComparisonOperator.EQ, 4)),
                                SolverResult.UNSAT},
                               {Predicate.of(x(ComparisonOperator.GT, 3), x(ComparisonOperator.LT, 3)),
                                SolverResult.UNSAT},
                               {Predicate.of(AtomicPredicate.categorical("c", "a"),
                                             AtomicPredicate.categorical("c", "a")), SolverResult.SAT},
                               {Predicate.of(AtomicPredicate.categorical("c", "a"),
                                             AtomicPredicate.categorical("c", "b")), SolverResult.UNSAT},
                               {Predicate.of(AtomicPredicate.categorical("x", "a"), x(ComparisonOperator.LE, 1)),
                                SolverResult.UNSAT},
                               {Predicate.of(x(ComparisonOperator.LE, 1), AtomicPredicate.categorical("c", "a"),
                                             AtomicPredicate.numeric("y", ComparisonOperator.GT, 1)),
                                SolverResult.SAT}};
    }

    @Test(dataProvider = "queries")
    public void testCheck(Predicate predicate, SolverResult expected) {
        Assert.assertEquals(solver().check(predicate), expected, predicate.toString());
    }
}
