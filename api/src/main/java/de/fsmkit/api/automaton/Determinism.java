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
package de.fsmkit.api.automaton;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether an automaton must be evaluated as an NFA.
 *
 * An automaton is nondeterministic if it has an epsilon transition or if some
 * state has two transitions with the same symbol, whatever their targets are
 * (a duplicated transition counts as well).
 *
 * {@link Automaton#getKind()} caches the result computed once at
 * construction; the methods of this class always scan the transitions again.
 *
 * @author FSMKit contributors
 */
public final class Determinism {

    private Determinism() {
    }

    /**
     * Scans the transitions of the automaton.
     *
     * @param automaton The automaton
     * @return The kind of the automaton
     */
    public static AutomatonKind classify(Automaton automaton) {
        return classify(automaton.getTransitions());
    }

    /**
     * Classifies a collection of transitions.
     *
     * @param transitions The transitions
     * @return The kind of an automaton with these transitions
     */
    public static AutomatonKind classify(Collection<Transition> transitions) {
        Map<String, Set<String>> symbolsBySource = new HashMap<>();
        for (Transition t : transitions) {
            if (t.isEpsilon()) {
                return AutomatonKind.NONDETERMINISTIC;
            }
            Set<String> seen = symbolsBySource.computeIfAbsent(t.getSource(), k -> new HashSet<>());
            if (!seen.add(t.getSymbol())) {
                return AutomatonKind.NONDETERMINISTIC;
            }
        }
        return AutomatonKind.DETERMINISTIC;
    }

    public static boolean isNondeterministic(Automaton automaton) {
        return classify(automaton).isNondeterministic();
    }
}
