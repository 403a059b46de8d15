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
package de.dpnlearn.datastructure.efsm;

import de.dpnlearn.api.log.AttributeValue;
import de.dpnlearn.api.log.Valuation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The right-hand side of a variable assignment performed by an {@link Update}. An assignment either writes a
 * {@link ConstantAssignment constant} or copies an {@link EventAssignment event attribute}.
 */
public abstract class Assignment {

    Assignment() {
        // only the two variants of this package
    }

    /**
     * Computes the value written when a transition fires with the given event payload.
     *
     * @return the new value, or {@code null} if the payload does not determine one
     */
    public abstract @Nullable AttributeValue evaluate(Valuation payload);
}
