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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.google.common.base.Preconditions;
import de.dpnlearn.api.exception.StructuralInvariantException;
import de.dpnlearn.datastructure.efsm.EFSM;
import de.dpnlearn.datastructure.efsm.State;
import de.dpnlearn.datastructure.efsm.Transition;
import de.dpnlearn.datastructure.pta.PTANode;
import de.dpnlearn.datastructure.pta.PrefixTreeAcceptor;
import de.dpnlearn.oracle.compatibility.CompatibilityOracle;
import net.automatalib.commons.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generalizes a prefix tree by greedy blue-fringe state merging.
 * <p>
 * The merger maintains a set of <i>red</i> nodes (settled states, initially the root) and a set of <i>blue</i>
 * nodes (candidates, initially the root's children). In each step the blue node with the smallest id is compared
 * against all red nodes in ascending id order. If a compatible red node exists, the first one absorbs the blue node:
 * the edge leading to the blue node is redirected and the blue node's subtree is folded into the red node, merging
 * edge samples, accepting flags and children (children under a shared label are folded recursively, so the result
 * stays deterministic). Otherwise the blue node is promoted to red. Merges are never undone.
 * <p>
 * If an executor is given, the compatibility checks of one blue node against the red nodes run concurrently; the
 * commit is still performed for the first compatible red node in id order.
 */
public class BlueFringeMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlueFringeMerger.class);

    private final CompatibilityOracle oracle;
    private final double threshold;
    private final @Nullable ExecutorService executor;

    public BlueFringeMerger(CompatibilityOracle oracle, double threshold) {
        this(oracle, threshold, null);
    }

    public BlueFringeMerger(CompatibilityOracle oracle, double threshold, @Nullable ExecutorService executor) {
        Preconditions.checkArgument(threshold >= 0 && threshold <= 1, "threshold must lie in [0,1]: %s", threshold);
        this.oracle = oracle;
        this.threshold = threshold;
        this.executor = executor;
    }

    public MergeResult merge(PrefixTreeAcceptor pta) {
        List<WorkingNode> arena = new ArrayList<>(pta.size());
        for (PTANode node : pta.getNodes()) {
            arena.add(new WorkingNode(node));
        }
        int[] representative = new int[arena.size()];
        for (int i = 0; i < representative.length; i++) {
            representative[i] = i;
        }

        SortedSet<Integer> red = new TreeSet<>();
        SortedSet<Integer> blue = new TreeSet<>();
        red.add(0);
        blue.addAll(arena.get(0).getChildren().values());

        int merges = 0;
        while (!blue.isEmpty()) {
            int b = blue.first();
            blue.remove(b);
            WorkingNode blueNode = arena.get(b);

            WorkingNode target = findCompatible(blueNode, red, arena);
            if (target == null) {
                LOGGER.debug("Promoting {} to red", blueNode);
                red.add(b);
                for (int child : blueNode.getChildren().values()) {
                    if (!red.contains(child)) {
                        blue.add(child);
                    }
                }
                continue;
            }

            LOGGER.debug("Merging {} into {}", blueNode, target);
            Pair<WorkingNode, String> parentEdge = findParentEdge(b, red, arena);
            parentEdge.getFirst().getChildren().put(parentEdge.getSecond(), target.getId());
            fold(target, blueNode, arena, representative);
            merges++;

            // subtrees adopted by red nodes have to be examined as well
            for (int r : red) {
                for (int child : arena.get(r).getChildren().values()) {
                    if (!red.contains(child)) {
                        blue.add(child);
                    }
                }
            }
        }

        LOGGER.info("Merged prefix tree of {} nodes into {} states ({} merges, threshold {})",
                    arena.size(),
                    red.size(),
                    merges,
                    threshold);
        return buildResult(arena, red, representative, merges);
    }

    private @Nullable WorkingNode findCompatible(WorkingNode blueNode, SortedSet<Integer> red, List<WorkingNode> arena) {
        if (executor == null || red.size() < 2) {
            for (int r : red) {
                if (oracle.isCompatible(arena.get(r), blueNode, threshold)) {
                    return arena.get(r);
                }
            }
            return null;
        }

        List<Future<Boolean>> checks = new ArrayList<>(red.size());
        List<WorkingNode> candidates = new ArrayList<>(red.size());
        for (int r : red) {
            WorkingNode redNode = arena.get(r);
            candidates.add(redNode);
            checks.add(executor.submit(() -> oracle.isCompatible(redNode, blueNode, threshold)));
        }

        try {
            for (int i = 0; i < checks.size(); i++) {
                if (checks.get(i).get()) {
                    for (int j = i + 1; j < checks.size(); j++) {
                        checks.get(j).cancel(true);
                    }
                    return candidates.get(i);
                }
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during compatibility checks", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Compatibility check failed", e.getCause());
        }
    }

    private static Pair<WorkingNode, String> findParentEdge(int b, SortedSet<Integer> red, List<WorkingNode> arena) {
        for (int r : red) {
            WorkingNode node = arena.get(r);
            for (Map.Entry<String, Integer> e : node.getChildren().entrySet()) {
                if (e.getValue() == b) {
                    return Pair.of(node, e.getKey());
                }
            }
        }
        throw new StructuralInvariantException("Blue node " + b + " has no red parent");
    }

    /**
     * Folds {@code node} (and recursively its subtree) into {@code into}.
     */
    private static void fold(WorkingNode into, WorkingNode node, List<WorkingNode> arena, int[] representative) {
        into.absorb(node);
        representative[node.getId()] = into.getId();

        for (Map.Entry<String, Integer> e : node.getChildren().entrySet()) {
            Integer existing = into.getChildren().get(e.getKey());
            if (existing == null) {
                into.getChildren().put(e.getKey(), e.getValue());
            } else if (existing.intValue() != e.getValue().intValue()) {
                fold(arena.get(existing), arena.get(e.getValue()), arena, representative);
            }
        }
    }

    private static int find(int node, int[] representative) {
        int current = node;
        while (representative[current] != current) {
            current = representative[current];
        }
        return current;
    }

    private static MergeResult buildResult(List<WorkingNode> arena,
                                           SortedSet<Integer> red,
                                           int[] representative,
                                           int merges) {
        Map<Integer, Integer> stateIndex = new HashMap<>();
        List<State> states = new ArrayList<>(red.size());
        for (int r : red) {
            WorkingNode node = arena.get(r);
            stateIndex.put(r, states.size());
            states.add(new State("s" + states.size(), node.isAccepting(), node.getFolded()));
        }

        List<Transition> transitions = new ArrayList<>();
        for (int r : red) {
            WorkingNode node = arena.get(r);
            for (Map.Entry<String, Integer> e : node.getChildren().entrySet()) {
                Integer target = stateIndex.get(find(e.getValue(), representative));
                if (target == null) {
                    throw new StructuralInvariantException("Edge " + node + " -" + e.getKey() +
                                                           "-> does not lead to a state");
                }
                transitions.add(new Transition(transitions.size(),
                                               stateIndex.get(r),
                                               e.getKey(),
                                               target,
                                               node.getSamples(e.getKey())));
            }
        }

        Map<Integer, Integer> nodeToState = new HashMap<>();
        for (int i = 0; i < arena.size(); i++) {
            Integer state = stateIndex.get(find(i, representative));
            if (state != null) {
                nodeToState.put(i, state);
            }
        }

        EFSM skeleton = EFSM.create(states, 0, new HashMap<>(), transitions);
        return new MergeResult(skeleton, nodeToState, merges);
    }
}
