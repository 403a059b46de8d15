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
package de.dpnlearn.algorithm.efsm;

import java.time.Duration;

import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;
import org.testng.Assert;
import org.testng.annotations.Test;

public class EFSMLearnerConfigTest {

    @Test
    public void testDefaults() {
        final EFSMLearnerConfig config = EFSMLearnerConfig.defaults();

        Assert.assertEquals(config.getDivergenceThreshold(), 0.3, 1e-9);
        Assert.assertEquals(config.getMaxConjuncts(), 2);
        Assert.assertEquals(config.getMode(), LearningMode.PREFIX_TREE);
        Assert.assertNull(config.getSkeleton());
        Assert.assertEquals(config.getSolverTimeout(), Duration.ofSeconds(5));
        Assert.assertEquals(config.getSolverBackend(), SolverBackend.Z3);
        Assert.assertEquals(config.getParallelism(), 1);
        Assert.assertEquals(EFSMLearnerConfig.builder().withSolverBackend(SolverBackend.INTERVAL).create()
                                             .getSolverBackend(), SolverBackend.INTERVAL);
    }

    @Test
    public void testSkeletonSelectsBootstrapMode() {
        final ControlFlowSkeleton.Builder builder = ControlFlowSkeleton.builder();
        builder.setInitial(builder.addState("start"));

        final EFSMLearnerConfig config = EFSMLearnerConfig.builder().withSkeleton(builder.build()).create();

        Assert.assertEquals(config.getMode(), LearningMode.BOOTSTRAP);
        Assert.assertNotNull(config.getSkeleton());
    }

    @Test
    public void testRejectsInvalidValues() {
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> EFSMLearnerConfig.builder().withDivergenceThreshold(1.5).create());
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> EFSMLearnerConfig.builder().withMaxConjuncts(0).create());
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> EFSMLearnerConfig.builder().withSolverTimeout(Duration.ZERO).create());
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> EFSMLearnerConfig.builder().withParallelism(0).create());
        Assert.assertThrows(IllegalStateException.class,
                            () -> EFSMLearnerConfig.builder().withMode(LearningMode.BOOTSTRAP).create());
    }
}
