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
package de.dpnlearn.algorithm.bluefringe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import de.dpnlearn.api.automaton.SampledState;
import de.dpnlearn.api.log.EdgeSample;
import de.dpnlearn.datastructure.pta.PTANode;

/**
 * A mutable copy of a prefix tree node inside the merger's arena. Folding a node into another moves its samples,
 * accepting flag and children; the folded node stays in the arena but is no longer referenced.
 */
final class WorkingNode implements SampledState {

    private final int id;
    private final SortedMap<String, Integer> children;
    private final Map<String, List<EdgeSample>> samples;
    private final SortedSet<Integer> folded;
    private boolean accepting;

    WorkingNode(PTANode node) {
        this.id = node.getId();
        this.children = new TreeMap<>(node.getChildren());
        this.samples = new HashMap<>();
        for (String label : node.getOutgoingLabels()) {
            samples.put(label, new ArrayList<>(node.getSamples(label)));
        }
        this.folded = new TreeSet<>();
        this.folded.add(id);
        this.accepting = node.isAccepting();
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public SortedSet<String> getOutgoingLabels() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(children.keySet()));
    }

    @Override
    public List<EdgeSample> getSamples(String label) {
        List<EdgeSample> result = samples.get(label);
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    @Override
    public boolean isAccepting() {
        return accepting;
    }

    SortedMap<String, Integer> getChildren() {
        return children;
    }

    SortedSet<Integer> getFolded() {
        return folded;
    }

    /**
     * Absorbs the local data of {@code other}: its samples, accepting flag and folded node ids. Children are
     * handled by the caller.
     */
    void absorb(WorkingNode other) {
        accepting |= other.accepting;
        folded.addAll(other.folded);
        for (Map.Entry<String, List<EdgeSample>> e : other.samples.entrySet()) {
            samples.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(e.getValue());
        }
    }

    @Override
    public String toString() {
        return "n" + id;
    }
}
