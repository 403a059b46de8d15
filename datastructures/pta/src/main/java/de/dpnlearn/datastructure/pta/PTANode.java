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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of a {@link PrefixTreeAcceptor}. Nodes are addressed by their index in the tree's arena; children are
 * referenced by index as well.
 */
public final class PTANode implements SampledState {

    private final int id;
    private final int depth;
    private final int parent;
    private final @Nullable String incomingLabel;
    private final SortedMap<String, Integer> children;
    private final Map<String, List<EdgeSample>> samples;
    private boolean accepting;

    PTANode(int id, int depth, int parent, @Nullable String incomingLabel) {
        this.id = id;
        this.depth = depth;
        this.parent = parent;
        this.incomingLabel = incomingLabel;
        this.children = new TreeMap<>();
        this.samples = new HashMap<>();
    }

    @Override
    public int getId() {
        return id;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * The id of the parent node, or {@code -1} for the root.
     */
    public int getParent() {
        return parent;
    }

    public @Nullable String getIncomingLabel() {
        return incomingLabel;
    }

    public boolean isRoot() {
        return parent < 0;
    }

    public SortedMap<String, Integer> getChildren() {
        return Collections.unmodifiableSortedMap(children);
    }

    public @Nullable Integer getChild(String label) {
        return children.get(label);
    }

    public boolean isLeaf() {
        return children.isEmpty();
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

    void addChild(String label, int child) {
        children.put(label, child);
    }

    void addSample(String label, EdgeSample sample) {
        samples.computeIfAbsent(label, k -> new ArrayList<>()).add(sample);
    }

    void markAccepting() {
        this.accepting = true;
    }

    @Override
    public String toString() {
        return "n" + id;
    }
}
