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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.datastructure.predicate.Predicate;

/**
 * A guarded transition of an {@link EFSM}. Source and target are state indices of the owning automaton; the id is
 * the transition's index in {@link EFSM#getTransitions()}.
 */
public final class Transition {

    private final int id;
    private final int source;
    private final String label;
    private final Predicate guard;
    private final Update update;
    private final int target;
    private final ImmutableList<EdgeSample> samples;

    public Transition(int id, int source, String label, int target, List<EdgeSample> samples) {
        this(id, source, label, Predicate.TRUE, Update.EMPTY, target, samples);
    }

    public Transition(int id,
                      int source,
                      String label,
                      Predicate guard,
                      Update update,
                      int target,
                      List<EdgeSample> samples) {
        this.id = id;
        this.source = source;
        this.label = Objects.requireNonNull(label);
        this.guard = Objects.requireNonNull(guard);
        this.update = Objects.requireNonNull(update);
        this.target = target;
        this.samples = ImmutableList.copyOf(samples);
    }

    public int getId() {
        return id;
    }

    public int getSource() {
        return source;
    }

    public String getLabel() {
        return label;
    }

    public Predicate getGuard() {
        return guard;
    }

    public Update getUpdate() {
        return update;
    }

    public int getTarget() {
        return target;
    }

    public List<EdgeSample> getSamples() {
        return samples;
    }

    public Transition withAnnotations(Predicate guard, Update update) {
        return new Transition(id, source, label, guard, update, target, samples);
    }

    Transition relocate(int id, int source, int target) {
        return new Transition(id, source, label, guard, update, target, samples);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transition)) {
            return false;
        }
        Transition that = (Transition) o;
        return id == that.id && source == that.source && target == that.target && label.equals(that.label) &&
               guard.equals(that.guard) && update.equals(that.update) && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, label, guard, update, target);
    }

    @Override
    public String toString() {
        return source + " -" + label + " [" + guard + "] " + update + "-> " + target;
    }
}
