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
package de.dpnlearn.api.exception;

/**
 * Reports a fatal error together with the pipeline stage in which it occurred. The original error is available as
 * the {@link #getCause() cause}.
 */
public class LearningStageException extends RuntimeException {

    private final LearningStage stage;

    public LearningStageException(LearningStage stage, Throwable cause) {
        super("Learning failed in stage " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public LearningStage getStage() {
        return stage;
    }
}
