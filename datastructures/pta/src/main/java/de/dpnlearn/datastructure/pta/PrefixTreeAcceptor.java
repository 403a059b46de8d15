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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A prefix tree acceptor: a tree automaton whose accepted label sequences are exactly the label sequences it was
 * built from. Nodes live in an arena; node {@code 0} is the root and every node's id is its index.
 */
public final class PrefixTreeAcceptor {

    private final List<PTANode> nodes;

    PrefixTreeAcceptor() {
        this.nodes = new ArrayList<>();
        this.nodes.add(new PTANode(0, 0, -1, null));
    }

    public PTANode getRoot() {
        return nodes.get(0);
    }

    public PTANode getNode(int id) {
        return nodes.get(id);
    }

    public List<PTANode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Returns the node reached from the root by the given label sequence, or {@code null} if the tree has no such
     * path.
     */
    public @Nullable PTANode getNode(Word<String> word) {
        PTANode current = getRoot();
        for (String label : word) {
            Integer child = current.getChild(label);
            if (child == null) {
                return null;
            }
            current = nodes.get(child);
        }
        return current;
    }

    public boolean accepts(Word<String> word) {
        PTANode node = getNode(word);
        return node != null && node.isAccepting();
    }

    public Word<String> getAccessSequence(PTANode node) {
        List<String> labels = new ArrayList<>(node.getDepth());
        PTANode current = node;
        while (!current.isRoot()) {
            labels.add(current.getIncomingLabel());
            current = nodes.get(current.getParent());
        }
        Collections.reverse(labels);
        return Word.fromList(labels);
    }

    /**
     * All label sequences accepted by this tree, in breadth-first order.
     */
    public Set<Word<String>> acceptedWords() {
        Set<Word<String>> result = new LinkedHashSet<>();
        for (PTANode node : breadthFirst()) {
            if (node.isAccepting()) {
                result.add(getAccessSequence(node));
            }
        }
        return result;
    }

    /**
     * All label sequences that lead to some node of this tree (including the empty word), in breadth-first order.
     */
    public Set<Word<String>> prefixes() {
        Set<Word<String>> result = new LinkedHashSet<>();
        for (PTANode node : breadthFirst()) {
            result.add(getAccessSequence(node));
        }
        return result;
    }

    public List<PTANode> getLeaves() {
        List<PTANode> result = new ArrayList<>();
        for (PTANode node : nodes) {
            if (node.isLeaf()) {
                result.add(node);
            }
        }
        return result;
    }

    public SortedSet<String> getLabels() {
        SortedSet<String> result = new TreeSet<>();
        for (PTANode node : nodes) {
            result.addAll(node.getChildren().keySet());
        }
        return result;
    }

    List<PTANode> breadthFirst() {
        List<PTANode> result = new ArrayList<>(nodes.size());
        Deque<PTANode> queue = new ArrayDeque<>();
        queue.add(getRoot());
        while (!queue.isEmpty()) {
            PTANode node = queue.poll();
            result.add(node);
            for (Map.Entry<String, Integer> e : node.getChildren().entrySet()) {
                queue.add(nodes.get(e.getValue()));
            }
        }
        return result;
    }

    PTANode getOrCreateChild(PTANode node, String label) {
        Integer child = node.getChild(label);
        if (child != null) {
            return nodes.get(child);
        }
        PTANode created = new PTANode(nodes.size(), node.getDepth() + 1, node.getId(), label);
        nodes.add(created);
        node.addChild(label, created.getId());
        return created;
    }
}
