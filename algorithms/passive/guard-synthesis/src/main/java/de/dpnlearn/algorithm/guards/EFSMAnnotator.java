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
package de.dpnlearn.algorithm.guards;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.api.log.Valuation;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.datastructure.efsm.Update;
import de.dpnlearn.datastructure.predicate.Predicate;
import net.automatalib.commons.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates every transition of an {@link EFSM} with a guard and an update.
 * <p>
 * The guard of a transition separates the pre-valuations recorded on it (positive examples) from those recorded on
 * all other transitions leaving the same state (negative examples). Transitions without siblings keep the universal
 * guard. Updates are inferred independently from each transition's own samples.
 * <p>
 * If an executor is given, transitions are annotated concurrently; the result does not depend on the executor.
 */
public class EFSMAnnotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(EFSMAnnotator.class);

    private final GuardSynthesizer guards;
    private final UpdateInference updates;
    private final @Nullable ExecutorService executor;

    public EFSMAnnotator(GuardSynthesizer guards, UpdateInference updates) {
        this(guards, updates, null);
    }

    public EFSMAnnotator(GuardSynthesizer guards, UpdateInference updates, @Nullable ExecutorService executor) {
        this.guards = guards;
        this.updates = updates;
        this.executor = executor;
    }

    public EFSM annotate(EFSM efsm) {
        List<Transition> transitions = efsm.getTransitions();
        List<Predicate> guardList = new ArrayList<>(transitions.size());
        List<Update> updateList = new ArrayList<>(transitions.size());

        if (executor == null) {
            for (Transition t : transitions) {
                Pair<Predicate, Update> annotation = annotate(efsm, t);
                guardList.add(annotation.getFirst());
                updateList.add(annotation.getSecond());
            }
        } else {
            List<Future<Pair<Predicate, Update>>> futures = new ArrayList<>(transitions.size());
            for (Transition t : transitions) {
                futures.add(executor.submit(() -> annotate(efsm, t)));
            }
            for (Future<Pair<Predicate, Update>> f : futures) {
                Pair<Predicate, Update> annotation = await(f);
                guardList.add(annotation.getFirst());
                updateList.add(annotation.getSecond());
            }
        }

        int constrained = 0;
        for (Predicate g : guardList) {
            if (!g.isUniversal()) {
                constrained++;
            }
        }
        LOGGER.info("Synthesized {} non-trivial guards for {} transitions", constrained, transitions.size());
        return efsm.withAnnotations(guardList, updateList);
    }

    private Pair<Predicate, Update> annotate(EFSM efsm, Transition t) {
        Update update = updates.infer(t.getSamples());

        List<Transition> siblings = efsm.getOutgoing(t.getSource());
        if (siblings.size() < 2) {
            return Pair.of(Predicate.TRUE, update);
        }

        List<Valuation> positives = preValuations(t.getSamples());
        List<Valuation> negatives = new ArrayList<>();
        for (Transition s : siblings) {
            if (s.getId() != t.getId()) {
                negatives.addAll(preValuations(s.getSamples()));
            }
        }

        String subject = efsm.getState(t.getSource()).getName() + " -" + t.getLabel() + "-> " +
                         efsm.getState(t.getTarget()).getName() + " (t" + t.getId() + ')';
        return Pair.of(guards.synthesize(subject, positives, negatives), update);
    }

    private static List<Valuation> preValuations(List<EdgeSample> samples) {
        List<Valuation> result = new ArrayList<>(samples.size());
        for (EdgeSample s : samples) {
            result.add(s.getPreValuation());
        }
        return result;
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during guard synthesis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Guard synthesis failed", cause);
        }
    }
}
