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
import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.dpnlearn.algorithm.bluefringe.BlueFringeMerger;
import de.dpnlearn.algorithm.bluefringe.MergeResult;
import de.dpnlearn.algorithm.guards.EFSMAnnotator;
import de.dpnlearn.algorithm.guards.GuardSynthesizer;
import de.dpnlearn.algorithm.guards.OverlapChecker;
import de.dpnlearn.algorithm.guards.UpdateInference;
import de.dpnlearn.algorithm.mapping.EFSMToDPNMapper;
import de.dpnlearn.algorithm.mapping.PreservationChecker;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.api.exception.LearningStage;
import de.dpnlearn.api.exception.LearningStageException;
import de.dpnlearn.api.log.AttributeDomain;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.PropagationAnalysis;
import de.dpnlearn.api.log.PropagationMode;
import de.dpnlearn.api.log.Trace;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.Variable;
import de.dpnlearn.datastructure.predicate.PredicatePool;
import de.dpnlearn.datastructure.pta.PrefixTreeAcceptor;
import de.dpnlearn.datastructure.pta.PrefixTreeBuilder;
import de.dpnlearn.oracle.compatibility.DistributionCompatibilityOracle;
import de.dpnlearn.oracle.solver.TimeLimitedConstraintSolver;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Learns an EFSM and its data-aware Petri net from a log of traces.
 * <p>
 * The pipeline runs the following stages in order:
 * <ol>
 * <li>attribute domain inference (skipped when domains are supplied),</li>
 * <li>control structure: a prefix tree generalized by blue-fringe merging, or, in bootstrap mode, the replay of the
 * traces on the configured skeleton,</li>
 * <li>guard synthesis and update inference, followed by a check for overlapping sibling guards,</li>
 * <li>mapping to a data-aware Petri net and verification of the mapping.</li>
 * </ol>
 * A fatal error in any stage is rethrown as a {@link LearningStageException} naming the stage. Non-fatal
 * degradations are collected in the {@link Diagnostics} of the result.
 * <p>
 * The learner owns the worker pool (if {@link EFSMLearnerConfig#getParallelism() parallelism} exceeds one) and the
 * {@link EFSMLearnerConfig#getSolverBackend() solver} of a run and releases both before {@link #learn(Collection)}
 * returns.
 */
public class EFSMLearner {

    private static final Logger LOGGER = LoggerFactory.getLogger(EFSMLearner.class);

    private final EFSMLearnerConfig config;

    public EFSMLearner() {
        this(EFSMLearnerConfig.defaults());
    }

    public EFSMLearner(EFSMLearnerConfig config) {
        this.config = config;
    }

    public EFSMLearnerConfig getConfig() {
        return config;
    }

    public EFSMLearningResult learn(Collection<Trace> traces) {
        return learn(traces, null);
    }

    /**
     * Runs the pipeline.
     *
     * @param traces
     *         the log
     * @param knownDomains
     *         the attribute domains, or {@code null} to infer them from the traces
     *
     * @throws LearningStageException
     *         if a stage fails fatally
     */
    public EFSMLearningResult learn(Collection<Trace> traces, @Nullable AttributeDomains knownDomains) {
        LOGGER.info("Learning from {} traces with {}", traces.size(), config);
        final Diagnostics diagnostics = new Diagnostics();

        final AttributeDomains domains = stage(LearningStage.DOMAIN_INFERENCE,
                                               () -> knownDomains == null ? AttributeDomains.infer(traces) :
                                                       knownDomains);
        final Map<String, Variable> variables = variables(traces, domains);

        final @Nullable ExecutorService executor = config.getParallelism() > 1 ?
                Executors.newFixedThreadPool(config.getParallelism(),
                                             new ThreadFactoryBuilder().setDaemon(true)
                                                                       .setNameFormat("efsm-learner-%d")
                                                                       .build()) : null;
        final Duration timeout = config.getSolverTimeout();
        try (TimeLimitedConstraintSolver solver =
                     new TimeLimitedConstraintSolver(config.getSolverBackend().create(timeout), timeout)) {
            final EFSM skeleton = controlStructure(traces, domains, diagnostics, executor).withVariables(variables);

            final EFSM efsm = stage(LearningStage.GUARD_SYNTHESIS, () -> {
                PredicatePool pool =
                        new PredicatePool(config.getMaxThresholdsPerAttribute(), config.getMaxCategoricalValues());
                GuardSynthesizer guards = new GuardSynthesizer(solver,
                                                               pool,
                                                               domains,
                                                               diagnostics,
                                                               config.getMaxConjuncts(),
                                                               config.getMaxSolverExamples());
                UpdateInference updates = new UpdateInference(config.getMaxAssignmentConstants());
                EFSM annotated = new EFSMAnnotator(guards, updates, executor).annotate(skeleton);
                new OverlapChecker(solver).check(annotated, diagnostics);
                return annotated;
            });

            final DataPetriNet net = stage(LearningStage.MAPPING, () -> {
                DataPetriNet mapped = new EFSMToDPNMapper().map(efsm);
                new PreservationChecker().check(efsm, mapped);
                return mapped;
            });

            LOGGER.info("Learned EFSM with {} states and {} transitions; {}",
                        efsm.size(),
                        efsm.getTransitions().size(),
                        diagnostics.summary());
            return new EFSMLearningResult(efsm, net, diagnostics);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private EFSM controlStructure(Collection<Trace> traces,
                                  AttributeDomains domains,
                                  Diagnostics diagnostics,
                                  @Nullable ExecutorService executor) {
        if (config.getMode() == LearningMode.BOOTSTRAP) {
            final ControlFlowSkeleton skeleton = Preconditions.checkNotNull(config.getSkeleton());
            return stage(LearningStage.SKELETON_REPLAY,
                         () -> new SkeletonReplay(skeleton, domains, diagnostics).replay(traces));
        }

        final PrefixTreeAcceptor pta =
                stage(LearningStage.PREFIX_TREE, () -> new PrefixTreeBuilder(domains, diagnostics).build(traces));
        final MergeResult merged = stage(LearningStage.STATE_MERGING, () -> {
            DistributionCompatibilityOracle oracle = new DistributionCompatibilityOracle(domains);
            return new BlueFringeMerger(oracle, config.getDivergenceThreshold(), executor).merge(pta);
        });
        return merged.getSkeleton();
    }

    private static Map<String, Variable> variables(Collection<Trace> traces, AttributeDomains domains) {
        SortedMap<String, PropagationMode> propagation = PropagationAnalysis.analyze(traces);
        Map<String, Variable> result = new TreeMap<>();
        for (AttributeDomain domain : domains.getDomains()) {
            PropagationMode mode = propagation.getOrDefault(domain.getName(), PropagationMode.TRANSIENT);
            result.put(domain.getName(), new Variable(domain.getName(), domain.getType(), mode));
        }
        return result;
    }

    private static <T> T stage(LearningStage stage, Supplier<T> step) {
        try {
            return step.get();
        } catch (LearningStageException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.error("Learning failed in stage {}", stage, e);
            throw new LearningStageException(stage, e);
        }
    }
}
