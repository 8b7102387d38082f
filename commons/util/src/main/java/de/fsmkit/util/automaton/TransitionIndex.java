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
package de.fsmkit.util.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.Symbols;
import de.fsmkit.api.automaton.Transition;

/**
 * Answers "which states are reached from state {@code s} on symbol {@code a}"
 * without scanning the transitions of the automaton.
 *
 * The index is built once per evaluation and is not cached across calls.
 * Targets are kept in the order in which their transitions were inserted, so
 * {@link #firstSuccessor(String, String)} returns the target of the first
 * matching transition.
 *
 * @author FSMKit contributors
 */
public final class TransitionIndex {

    private final Map<String, Map<String, Set<String>>> successors;

    private TransitionIndex(Map<String, Map<String, Set<String>>> successors) {
        this.successors = successors;
    }

    public static TransitionIndex of(Automaton automaton) {
        return of(automaton.getTransitions());
    }

    public static TransitionIndex of(Collection<Transition> transitions) {
        Map<String, Map<String, Set<String>>> successors = new HashMap<>();
        for (Transition t : transitions) {
            successors.computeIfAbsent(t.getSource(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(t.getSymbol(), k -> new LinkedHashSet<>())
                    .add(t.getTarget());
        }
        return new TransitionIndex(successors);
    }

    /**
     * Gets the targets of every transition leaving the state with the symbol.
     *
     * @param state  The source state
     * @param symbol The symbol, possibly {@link Symbols#EPSILON}
     * @return The targets, in insertion order; empty if there is none
     */
    public Set<String> successors(String state, String symbol) {
        Map<String, Set<String>> bySymbol = successors.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Set<String> targets = bySymbol.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    /**
     * Gets the target of the first transition leaving the state with the symbol.
     *
     * @param state  The source state
     * @param symbol The symbol
     * @return The target, or {@code null} if the transition is undefined
     */
    public @Nullable String firstSuccessor(String state, String symbol) {
        Set<String> targets = successors(state, symbol);
        return targets.isEmpty() ? null : targets.iterator().next();
    }

    public Set<String> epsilonSuccessors(String state) {
        return successors(state, Symbols.EPSILON);
    }

    /**
     * @param state The source state
     * @return The labels of the transitions leaving the state
     */
    public Set<String> symbolsOf(String state) {
        Map<String, Set<String>> bySymbol = successors.get(state);
        return bySymbol == null ? Collections.emptySet() : Collections.unmodifiableSet(bySymbol.keySet());
    }
}
