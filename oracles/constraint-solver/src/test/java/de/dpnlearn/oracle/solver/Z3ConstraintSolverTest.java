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

import java.time.Duration;

import de.dpnlearn.datastructure.predicate.AtomicPredicate;
import de.dpnlearn.datastructure.predicate.ComparisonOperator;
import de.dpnlearn.datastructure.predicate.Predicate;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class Z3ConstraintSolverTest extends AbstractConstraintSolverTest {

    private Z3ConstraintSolver solver;

    @BeforeClass
    public void setUp() {
        solver = new Z3ConstraintSolver(Duration.ofSeconds(5));
    }

    @AfterClass
    public void tearDown() {
        solver.close();
    }

    @Override
    protected ConstraintSolver solver() {
        return solver;
    }

    @Test
    public void testFractionalAndNegativeThresholds() {
        final Predicate between = Predicate.of(AtomicPredicate.numeric("x", ComparisonOperator.GT, -0.25),
                                               AtomicPredicate.numeric("x", ComparisonOperator.LT, -0.125));
        Assert.assertEquals(solver.check(between), SolverResult.SAT);

        final Predicate point = Predicate.of(AtomicPredicate.numeric("x", ComparisonOperator.EQ, 1040.5),
                                             AtomicPredicate.numeric("x", ComparisonOperator.LE, 1040));
        Assert.assertEquals(solver.check(point), SolverResult.UNSAT);
    }

    @Test
    public void testCategoricalValuesAreTakenLiterally() {
        final Predicate escaped = Predicate.of(AtomicPredicate.categorical("c", "a\\u{62}"),
                                               AtomicPredicate.categorical("c", "ab"));
        Assert.assertEquals(solver.check(escaped), SolverResult.UNSAT);

        final Predicate unicode = Predicate.of(AtomicPredicate.categorical("c", "gr\u00fcn \\ blau"),
                                               AtomicPredicate.categorical("c", "gr\u00fcn \\ blau"));
        Assert.assertEquals(solver.check(unicode), SolverResult.SAT);
    }

    @Test
    public void testAgreesWithIntervalProcedure() {
        final ConstraintSolver reference = new IntervalConstraintSolver();
        final double[] thresholds = {-3, 0, 2.5, 7};
        for (ComparisonOperator first : ComparisonOperator.values()) {
            for (ComparisonOperator second : ComparisonOperator.values()) {
                for (double a : thresholds) {
                    for (double b : thresholds) {
                        final Predicate predicate = Predicate.of(AtomicPredicate.numeric("x", first, a),
                                                                 AtomicPredicate.numeric("x", second, b));
                        Assert.assertEquals(solver.check(predicate),
                                            reference.check(predicate),
                                            predicate.toString());
                    }
                }
            }
        }
    }

    @Test
    public void testClosedSolverRejectsQueries() {
        final Z3ConstraintSolver closed = new Z3ConstraintSolver(Duration.ofSeconds(1));
        closed.close();
        closed.close();
        Assert.assertThrows(IllegalStateException.class, () -> closed.check(Predicate.TRUE));
    }

    @Test
    public void testRejectsNonPositiveTimeout() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new Z3ConstraintSolver(Duration.ZERO));
    }
}
