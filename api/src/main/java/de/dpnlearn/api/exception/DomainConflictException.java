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

// Thrown when an attribute value contradicts the type its attribute was inferred with.
public class DomainConflictException extends RuntimeException {

    /**
     * Default constructor.
     *
     * @see RuntimeException#RuntimeException()
     */
    public DomainConflictException() {
        super();
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public DomainConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public DomainConflictException(String s) {
        super(s);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(Throwable)
     */
    public DomainConflictException(Throwable cause) {
        super(cause);
    }

}
