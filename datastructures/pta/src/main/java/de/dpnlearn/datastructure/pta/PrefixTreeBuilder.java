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
package de.dpnlearn.datastructure.pta;

import java.util.Collection;
import java.util.List;

import de.dpnlearn.api.diagnostic.DiagnosticKind;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.api.exception.DomainConflictException;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.log.Event;
import de.dpnlearn.api.log.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link PrefixTreeAcceptor} from a set of traces. Each trace is walked from the root label by label,
 * extending the tree where necessary and recording an {@link EdgeSample} on every edge it passes; the node reached
 * after the last event is marked accepting.
 * <p>
 * Empty traces are skipped and reported as {@link DiagnosticKind#SKIPPED_EMPTY_TRACE}. An event whose attributes
 * contradict the given domains aborts the build with a {@link DomainConflictException}.
 */
public class PrefixTreeBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrefixTreeBuilder.class);

    private final AttributeDomains domains;
    private final Diagnostics diagnostics;

    public PrefixTreeBuilder(AttributeDomains domains, Diagnostics diagnostics) {
        this.domains = domains;
        this.diagnostics = diagnostics;
    }

    public PrefixTreeAcceptor build(Collection<Trace> traces) {
        PrefixTreeAcceptor pta = new PrefixTreeAcceptor();
        int inserted = 0;

        for (Trace trace : traces) {
            if (trace.isEmpty()) {
                LOGGER.warn("Skipping empty trace '{}'", trace.getCaseId());
                diagnostics.report(DiagnosticKind.SKIPPED_EMPTY_TRACE, trace.getCaseId(), "trace has no events");
                continue;
            }
            insert(pta, trace);
            inserted++;
        }

        LOGGER.info("Built prefix tree with {} nodes from {} traces", pta.size(), inserted);
        return pta;
    }

    private void insert(PrefixTreeAcceptor pta, Trace trace) {
        List<Event> events = trace.getEvents();
        List<EdgeSample> samples = trace.toEdgeSamples();

        PTANode current = pta.getRoot();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            domains.check(event.getAttributes(), trace.getCaseId());

            current.addSample(event.getLabel(), samples.get(i));
            current = pta.getOrCreateChild(current, event.getLabel());
        }
        current.markAccepting();
    }
}
