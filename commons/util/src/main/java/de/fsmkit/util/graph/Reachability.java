/* Copyright (C) 2026 – FSMKit contributors
 * This file is part of FSMKit.
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
package de.fsmkit.util.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.function.Function;

/**
 * Breadth-first reachability over directed graphs.
 *
 * Nodes are compared with {@link Object#equals(Object)}. Graphs are given
 * either by a successor function or by a list of edges.
 *
 * @author FSMKit contributors
 */
public final class Reachability {

    private Reachability() {
    }

    /**
     * Decides whether a target node can be reached from the start node.
     *
     * @param <N>        Node type
     * @param start      The start node
     * @param successors The successors of a node
     * @param targets    The target nodes
     * @return True iff some target is reachable from start (start included)
     */
    public static <N> boolean isReachable(N start, Function<? super N, ? extends Collection<? extends N>> successors,
            Set<? extends N> targets) {
        if (targets.isEmpty()) {
            return false;
        }
        Queue<N> queue = new ArrayDeque<>();
        Set<N> visited = new LinkedHashSet<>();
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            N current = queue.poll();
            if (targets.contains(current)) {
                return true;
            }
            for (N next : successors.apply(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    /**
     * Edge list variant of {@link #isReachable(Object, Function, Set)}.
     *
     * @param <N>     Node type
     * @param <E>     Edge type
     * @param start   The start node
     * @param edges   The edges of the graph
     * @param source  Extracts the source of an edge
     * @param target  Extracts the target of an edge
     * @param targets The target nodes
     * @return True iff some target is reachable from start
     */
    public static <N, E> boolean isReachable(N start, Collection<? extends E> edges,
            Function<? super E, ? extends N> source, Function<? super E, ? extends N> target,
            Set<? extends N> targets) {
        Map<N, List<N>> adjacency = new HashMap<>();
        for (E edge : edges) {
            adjacency.computeIfAbsent(source.apply(edge), k -> new ArrayList<>()).add(target.apply(edge));
        }
        return isReachable(start, n -> adjacency.getOrDefault(n, Collections.emptyList()), targets);
    }

    /**
     * Collects every node reachable from the start node.
     *
     * @param <N>        Node type
     * @param start      The start node
     * @param successors The successors of a node
     * @return The reachable nodes, in breadth-first order, start first
     */
    public static <N> List<N> reachableFrom(N start,
            Function<? super N, ? extends Collection<? extends N>> successors) {
        Queue<N> queue = new ArrayDeque<>();
        Set<N> visited = new LinkedHashSet<>();
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            N current = queue.poll();
            for (N next : successors.apply(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return new ArrayList<>(visited);
    }
}
