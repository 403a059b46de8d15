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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import de.dpnlearn.api.diagnostic.DiagnosticKind;
import de.dpnlearn.api.diagnostic.Diagnostics;
import de.dpnlearn.api.log.AttributeDomains;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.log.Event;
import de.dpnlearn.api.log.Trace;
import de.dpnlearn.datastructure.efsm.ControlFlowSkeleton;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.datastructure.efsm.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects edge samples by replaying traces on a caller-supplied {@link ControlFlowSkeleton}.
 * <p>
 * Each skeleton edge becomes one EFSM transition (in edge order) carrying the samples of every trace that passed it.
 * If a state has several edges with the label of the current event, the first edge (in edge order) whose target has
 * an edge for the next label is taken; for the last event, the first edge into an accepting state. If there is no
 * such edge, the first candidate is taken. A trace whose next label has no edge at all is truncated at that point
 * and reported as {@link DiagnosticKind#UNREPLAYABLE_TRACE}.
 */
public class SkeletonReplay {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkeletonReplay.class);

    private final ControlFlowSkeleton skeleton;
    private final AttributeDomains domains;
    private final Diagnostics diagnostics;

    public SkeletonReplay(ControlFlowSkeleton skeleton, AttributeDomains domains, Diagnostics diagnostics) {
        this.skeleton = skeleton;
        this.domains = domains;
        this.diagnostics = diagnostics;
    }

    public EFSM replay(Collection<Trace> traces) {
        List<ControlFlowSkeleton.Edge> edges = skeleton.getEdges();
        Map<ControlFlowSkeleton.Edge, List<EdgeSample>> samples = new IdentityHashMap<>();
        for (ControlFlowSkeleton.Edge e : edges) {
            samples.put(e, new ArrayList<>());
        }

        int replayed = 0;
        for (Trace trace : traces) {
            if (trace.isEmpty()) {
                diagnostics.report(DiagnosticKind.SKIPPED_EMPTY_TRACE, trace.getCaseId(), "trace has no events");
                continue;
            }
            if (replay(trace, samples)) {
                replayed++;
            }
        }
        LOGGER.info("Replayed {} of {} traces completely on a skeleton with {} states and {} edges",
                    replayed,
                    traces.size(),
                    skeleton.size(),
                    edges.size());

        List<State> states = new ArrayList<>(skeleton.size());
        for (int s = 0; s < skeleton.size(); s++) {
            states.add(new State(skeleton.getStateName(s), skeleton.isAccepting(s)));
        }
        List<Transition> transitions = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            ControlFlowSkeleton.Edge e = edges.get(i);
            transitions.add(new Transition(i, e.getSource(), e.getLabel(), e.getTarget(), samples.get(e)));
        }
        return EFSM.create(states, skeleton.getInitial(), Collections.<String, Variable>emptyMap(), transitions);
    }

    private boolean replay(Trace trace, Map<ControlFlowSkeleton.Edge, List<EdgeSample>> samples) {
        List<Event> events = trace.getEvents();
        List<EdgeSample> traceSamples = trace.toEdgeSamples();
        int state = skeleton.getInitial();

        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            domains.check(event.getAttributes(), trace.getCaseId());

            List<ControlFlowSkeleton.Edge> candidates = skeleton.getEdges(state, event.getLabel());
            if (candidates.isEmpty()) {
                String message = "no edge for '" + event.getLabel() + "' in state " + skeleton.getStateName(state) +
                                 ", truncated after " + i + " of " + events.size() + " events";
                LOGGER.warn("Trace {}: {}", trace.getCaseId(), message);
                diagnostics.report(DiagnosticKind.UNREPLAYABLE_TRACE, trace.getCaseId(), message);
                return false;
            }

            @Nullable String next = i + 1 < events.size() ? events.get(i + 1).getLabel() : null;
            ControlFlowSkeleton.Edge chosen = choose(candidates, next);
            samples.get(chosen).add(traceSamples.get(i));
            state = chosen.getTarget();
        }
        return true;
    }

    private ControlFlowSkeleton.Edge choose(List<ControlFlowSkeleton.Edge> candidates, @Nullable String next) {
        for (ControlFlowSkeleton.Edge e : candidates) {
            boolean continues = next == null ? skeleton.isAccepting(e.getTarget()) :
                    !skeleton.getEdges(e.getTarget(), next).isEmpty();
            if (continues) {
                return e;
            }
        }
        return candidates.get(0);
    }
}
