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

import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.datastructure.dpn.DataPetriNet;
import de.dpnlearn.datastructure.efsm.EFSM;

/**
 * The outcome of a learning run: the guarded EFSM, the data-aware Petri net it maps to, and the non-fatal
 * degradations encountered on the way.
 */
public final class EFSMLearningResult {

    private final EFSM efsm;
    private final DataPetriNet net;
    private final Diagnostics diagnostics;

    EFSMLearningResult(EFSM efsm, DataPetriNet net, Diagnostics diagnostics) {
        this.efsm = efsm;
        this.net = net;
        this.diagnostics = diagnostics;
    }

    public EFSM getEFSM() {
        return efsm;
    }

    public DataPetriNet getDPN() {
        return net;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
