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
package de.fsmkit.algorithms.equivalence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.State;
import de.fsmkit.api.result.ProductState;
import de.fsmkit.util.automaton.TransitionIndex;
import net.automatalib.words.Alphabet;

/**
 * Breadth-first traversal of the synchronized product of two deterministic
 * automata.
 *
 * Each automaton is completed over the given alphabet with its own
 * non-accepting sink, represented by a {@code null} component of
 * {@link ProductState}. The product therefore has at most
 * {@code (|Q1| + 1) * (|Q2| + 1)} states, each expanded once.
 *
 * @author FSMKit contributors
 */
public class ProductExplorer {

    private final Automaton left;
    private final Automaton right;
    private final TransitionIndex leftIndex;
    private final TransitionIndex rightIndex;
    private final Alphabet<String> alphabet;

    /**
     * Constructor.
     *
     * @param left     The first automaton, deterministic and with a start state
     * @param right    The second automaton, deterministic and with a start state
     * @param alphabet The symbols to explore
     * @throws IllegalArgumentException if an automaton has no start state
     */
    public ProductExplorer(Automaton left, Automaton right, Alphabet<String> alphabet) {
        if (!left.hasStartState() || !right.hasStartState()) {
            throw new IllegalArgumentException("Both automata need a start state");
        }
        this.left = left;
        this.right = right;
        this.leftIndex = TransitionIndex.of(left);
        this.rightIndex = TransitionIndex.of(right);
        this.alphabet = alphabet;
    }

    /**
     * Explores the product from the pair of start states.
     *
     * @param stopAtFirstDisagreement Whether to stop as soon as a disagreement
     *                                state is visited. If false, every reachable
     *                                state is visited and every transition is
     *                                recorded.
     * @return The explored part of the product
     */
    public ProductGraph explore(boolean stopAtFirstDisagreement) {
        ProductState start = new ProductState(startOf(left), startOf(right));

        Queue<ProductState> queue = new ArrayDeque<>();
        Set<ProductState> visited = new HashSet<>();
        List<ProductState> explored = new ArrayList<>();
        List<ProductTransition> transitions = new ArrayList<>();
        List<ProductState> disagreements = new ArrayList<>();
        Map<ProductState, ProductTransition> discoveredBy = new HashMap<>();

        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            ProductState pair = queue.poll();
            explored.add(pair);

            if (isAccepting(left, pair.getLeft()) != isAccepting(right, pair.getRight())) {
                disagreements.add(pair);
                if (stopAtFirstDisagreement) {
                    return new ProductGraph(start, explored, transitions, disagreements, discoveredBy, false);
                }
            }

            for (String symbol : alphabet) {
                ProductState next = new ProductState(step(leftIndex, pair.getLeft(), symbol),
                        step(rightIndex, pair.getRight(), symbol));
                ProductTransition transition = new ProductTransition(pair, symbol, next);
                transitions.add(transition);

                if (visited.add(next)) {
                    discoveredBy.put(next, transition);
                    queue.add(next);
                }
            }
        }

        return new ProductGraph(start, explored, transitions, disagreements, discoveredBy, true);
    }

    private static String startOf(Automaton automaton) {
        State start = Objects.requireNonNull(automaton.getStartState());
        return start.getId();
    }

    private static @Nullable String step(TransitionIndex index, @Nullable String state, String symbol) {
        if (state == null) {
            return null;
        }
        return index.firstSuccessor(state, symbol);
    }

    private static boolean isAccepting(Automaton automaton, @Nullable String state) {
        return state != null && automaton.isAccepting(state);
    }
}
