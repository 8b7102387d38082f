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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import de.fsmkit.api.result.ProductState;
import de.fsmkit.util.graph.Reachability;
import net.automatalib.words.Word;

/**
 * The part of the synchronized product of two automata that a
 * {@link ProductExplorer} visited.
 *
 * States are listed in breadth-first order. Every visited state other than the
 * start state remembers the transition through which it was discovered, which
 * gives a shortest word leading to it.
 *
 * @author FSMKit contributors
 */
public final class ProductGraph {

    private final ProductState start;
    private final List<ProductState> states;
    private final List<ProductTransition> transitions;
    private final List<ProductState> disagreements;
    private final Map<ProductState, ProductTransition> discoveredBy;
    private final boolean complete;

    ProductGraph(ProductState start, List<ProductState> states, List<ProductTransition> transitions,
            List<ProductState> disagreements, Map<ProductState, ProductTransition> discoveredBy, boolean complete) {
        this.start = start;
        this.states = Collections.unmodifiableList(states);
        this.transitions = Collections.unmodifiableList(transitions);
        this.disagreements = Collections.unmodifiableList(disagreements);
        this.discoveredBy = discoveredBy;
        this.complete = complete;
    }

    public ProductState getStart() {
        return start;
    }

    /**
     * @return The visited states, in breadth-first order
     */
    public List<ProductState> getStates() {
        return states;
    }

    /**
     * @return Every transition leaving a visited state, or the transitions
     *         expanded so far if the exploration stopped early
     */
    public List<ProductTransition> getTransitions() {
        return transitions;
    }

    /**
     * @return The visited states whose components disagree on acceptance, in
     *         breadth-first order
     */
    public List<ProductState> getDisagreements() {
        return disagreements;
    }

    /**
     * @return True iff every reachable product state was visited
     */
    public boolean isComplete() {
        return complete;
    }

    /**
     * Decides, by a separate reachability search over the recorded transitions,
     * whether a disagreement state is reachable from the start state.
     *
     * @return True iff a disagreement state is reachable
     */
    public boolean hasReachableDisagreement() {
        return Reachability.isReachable(start, transitions, ProductTransition::getSource,
                ProductTransition::getTarget, new LinkedHashSet<>(disagreements));
    }

    /**
     * Gets a shortest word leading from the start state to a visited state.
     *
     * @param state A visited state
     * @return The word
     * @throws IllegalArgumentException if the state was not visited
     */
    public Word<String> wordTo(ProductState state) {
        if (!discoveredBy.containsKey(state) && !state.equals(start)) {
            throw new IllegalArgumentException("State " + state + " was not visited");
        }
        List<String> symbols = new ArrayList<>();
        ProductState current = state;
        while (!current.equals(start)) {
            ProductTransition t = discoveredBy.get(current);
            symbols.add(t.getSymbol());
            current = t.getSource();
        }
        Collections.reverse(symbols);
        return Word.fromList(symbols);
    }
}
