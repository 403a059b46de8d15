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
import java.util.Objects;

import com.google.common.base.Preconditions;
import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable configuration of an {@link EFSMLearner}. Instances are obtained from a {@link Builder}, which starts from
 * the default values below.
 */
public final class EFSMLearnerConfig {

    public static final double DEFAULT_DIVERGENCE_THRESHOLD = 0.3;
    public static final int DEFAULT_MAX_CONJUNCTS = 2;
    public static final Duration DEFAULT_SOLVER_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_THRESHOLDS = 20;
    public static final int DEFAULT_MAX_CATEGORICAL_VALUES = 10;
    public static final int DEFAULT_MAX_ASSIGNMENT_CONSTANTS = 3;
    public static final int DEFAULT_MAX_SOLVER_EXAMPLES = 50;

    private final double divergenceThreshold;
    private final int maxConjuncts;
    private final LearningMode mode;
    private final @Nullable ControlFlowSkeleton skeleton;
    private final Duration solverTimeout;
    private final SolverBackend solverBackend;
    private final int parallelism;
    private final int maxThresholdsPerAttribute;
    private final int maxCategoricalValues;
    private final int maxAssignmentConstants;
    private final int maxSolverExamples;

    private EFSMLearnerConfig(Builder builder) {
        this.divergenceThreshold = builder.divergenceThreshold;
        this.maxConjuncts = builder.maxConjuncts;
        this.mode = builder.mode;
        this.skeleton = builder.skeleton;
        this.solverTimeout = builder.solverTimeout;
        this.solverBackend = builder.solverBackend;
        this.parallelism = builder.parallelism;
        this.maxThresholdsPerAttribute = builder.maxThresholdsPerAttribute;
        this.maxCategoricalValues = builder.maxCategoricalValues;
        this.maxAssignmentConstants = builder.maxAssignmentConstants;
        this.maxSolverExamples = builder.maxSolverExamples;
    }

    public static EFSMLearnerConfig defaults() {
        return builder().create();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The maximal divergence at which two states are still considered compatible, in {@code [0, 1]}.
     */
    public double getDivergenceThreshold() {
        return divergenceThreshold;
    }

    public int getMaxConjuncts() {
        return maxConjuncts;
    }

    public LearningMode getMode() {
        return mode;
    }

    /**
     * The skeleton replayed in {@link LearningMode#BOOTSTRAP bootstrap} mode, {@code null} otherwise.
     */
    public @Nullable ControlFlowSkeleton getSkeleton() {
        return skeleton;
    }

    public Duration getSolverTimeout() {
        return solverTimeout;
    }

    public SolverBackend getSolverBackend() {
        return solverBackend;
    }

    /**
     * The number of worker threads for compatibility checks and guard synthesis. A value of {@code 1} runs
     * everything on the calling thread.
     */
    public int getParallelism() {
        return parallelism;
    }

    public int getMaxThresholdsPerAttribute() {
        return maxThresholdsPerAttribute;
    }

    public int getMaxCategoricalValues() {
        return maxCategoricalValues;
    }

    public int getMaxAssignmentConstants() {
        return maxAssignmentConstants;
    }

    public int getMaxSolverExamples() {
        return maxSolverExamples;
    }

    @Override
    public String toString() {
        return "EFSMLearnerConfig(tau=" + divergenceThreshold + ", maxConjuncts=" + maxConjuncts + ", mode=" + mode +
               ", solver=" + solverBackend + ", solverTimeout=" + solverTimeout + ", parallelism=" + parallelism + ')';
    }

    public static final class Builder {

        private double divergenceThreshold = DEFAULT_DIVERGENCE_THRESHOLD;
        private int maxConjuncts = DEFAULT_MAX_CONJUNCTS;
        private LearningMode mode = LearningMode.PREFIX_TREE;
        private @Nullable ControlFlowSkeleton skeleton;
        private Duration solverTimeout = DEFAULT_SOLVER_TIMEOUT;
        private SolverBackend solverBackend = SolverBackend.Z3;
        private int parallelism = 1;
        private int maxThresholdsPerAttribute = DEFAULT_MAX_THRESHOLDS;
        private int maxCategoricalValues = DEFAULT_MAX_CATEGORICAL_VALUES;
        private int maxAssignmentConstants = DEFAULT_MAX_ASSIGNMENT_CONSTANTS;
        private int maxSolverExamples = DEFAULT_MAX_SOLVER_EXAMPLES;

        private Builder() {}

        public Builder withDivergenceThreshold(double divergenceThreshold) {
            this.divergenceThreshold = divergenceThreshold;
            return this;
        }

        public Builder withMaxConjuncts(int maxConjuncts) {
            this.maxConjuncts = maxConjuncts;
            return this;
        }

        /**
         * Switches to {@link LearningMode#BOOTSTRAP bootstrap} mode with the given skeleton.
         */
        public Builder withSkeleton(ControlFlowSkeleton skeleton) {
            this.mode = LearningMode.BOOTSTRAP;
            this.skeleton = Objects.requireNonNull(skeleton);
            return this;
        }

        public Builder withMode(LearningMode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder withSolverTimeout(Duration solverTimeout) {
            this.solverTimeout = Objects.requireNonNull(solverTimeout);
            return this;
        }

        public Builder withSolverBackend(SolverBackend solverBackend) {
            this.solverBackend = Objects.requireNonNull(solverBackend);
            return this;
        }

        public Builder withParallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder withMaxThresholdsPerAttribute(int maxThresholdsPerAttribute) {
            this.maxThresholdsPerAttribute = maxThresholdsPerAttribute;
            return this;
        }

        public Builder withMaxCategoricalValues(int maxCategoricalValues) {
            this.maxCategoricalValues = maxCategoricalValues;
            return this;
        }

        public Builder withMaxAssignmentConstants(int maxAssignmentConstants) {
            this.maxAssignmentConstants = maxAssignmentConstants;
            return this;
        }

        public Builder withMaxSolverExamples(int maxSolverExamples) {
            this.maxSolverExamples = maxSolverExamples;
            return this;
        }

        /**
         * @throws IllegalArgumentException
         *         if a value is out of range
         * @throws IllegalStateException
         *         if bootstrap mode is selected without a skeleton
         */
        public EFSMLearnerConfig create() {
            Preconditions.checkArgument(divergenceThreshold >= 0 && divergenceThreshold <= 1,
                                        "divergence threshold must lie in [0, 1]: %s",
                                        divergenceThreshold);
            Preconditions.checkArgument(maxConjuncts >= 1, "maxConjuncts must be positive: %s", maxConjuncts);
            Preconditions.checkArgument(!solverTimeout.isNegative() && !solverTimeout.isZero(),
                                        "solver timeout must be positive: %s",
                                        solverTimeout);
            Preconditions.checkArgument(parallelism >= 1, "parallelism must be positive: %s", parallelism);
            Preconditions.checkArgument(maxThresholdsPerAttribute >= 1,
                                        "maxThresholdsPerAttribute must be positive: %s",
                                        maxThresholdsPerAttribute);
            Preconditions.checkArgument(maxCategoricalValues >= 1,
                                        "maxCategoricalValues must be positive: %s",
                                        maxCategoricalValues);
            Preconditions.checkArgument(maxAssignmentConstants >= 1,
                                        "maxAssignmentConstants must be positive: %s",
                                        maxAssignmentConstants);
            Preconditions.checkArgument(maxSolverExamples >= 1,
                                        "maxSolverExamples must be positive: %s",
                                        maxSolverExamples);
            Preconditions.checkState(mode != LearningMode.BOOTSTRAP || skeleton != null,
                                     "bootstrap mode requires a control-flow skeleton");
            return new EFSMLearnerConfig(this);
        }
    }
}
