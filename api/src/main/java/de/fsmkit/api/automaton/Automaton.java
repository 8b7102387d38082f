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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable finite automaton: states, an alphabet and transitions.
 *
 * States keep their insertion order, which decides the start state when
 * several states are flagged as start. The alphabet never contains the epsilon
 * marker nor the empty symbol; such entries are dropped at construction.
 * Transitions are not checked against the alphabet or the states.
 *
 * The structural {@link AutomatonKind} is computed once at construction.
 *
 * @author FSMKit contributors
 * @see AutomatonBuilder
 */
public final class Automaton {

    private final Map<String, State> states;
    private final Set<String> alphabet;
    private final List<Transition> transitions;
    private final AutomatonKind kind;

    /**
     * Constructor.
     *
     * @param states      The states, with pairwise distinct identifiers
     * @param alphabet    The input symbols
     * @param transitions The transitions
     * @throws IllegalArgumentException if two states share an identifier
     */
    public Automaton(Collection<State> states, Collection<String> alphabet, Collection<Transition> transitions) {
        Map<String, State> stateMap = new LinkedHashMap<>();
        for (State state : states) {
            if (stateMap.putIfAbsent(state.getId(), state) != null) {
                throw new IllegalArgumentException("Duplicate state identifier: " + state.getId());
            }
        }

        Set<String> symbols = new LinkedHashSet<>();
        for (String symbol : alphabet) {
            if (Symbols.isAlphabetSymbol(symbol)) {
                symbols.add(symbol);
            }
        }

        List<Transition> transitionList = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            transitionList.add(Objects.requireNonNull(t, "transition"));
        }

        this.states = Collections.unmodifiableMap(stateMap);
        this.alphabet = Collections.unmodifiableSet(symbols);
        this.transitions = Collections.unmodifiableList(transitionList);
        this.kind = Determinism.classify(this.transitions);
    }

    public Collection<State> getStates() {
        return states.values();
    }

    public Set<String> getStateIds() {
        return states.keySet();
    }

    public @Nullable State getState(String id) {
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    public Set<String> getAlphabet() {
        return alphabet;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    /**
     * Gets the first state, in insertion order, that is flagged as start.
     *
     * @return The start state, or {@code null} if there is none
     */
    public @Nullable State getStartState() {
        for (State state : states.values()) {
            if (state.isStart()) {
                return state;
            }
        }
        return null;
    }

    public boolean hasStartState() {
        return getStartState() != null;
    }

    /**
     * Whether the given identifier denotes an accepting state. Unknown
     * identifiers are not accepting.
     *
     * @param stateId The identifier
     * @return True iff the state exists and is accepting
     */
    public boolean isAccepting(String stateId) {
        State state = states.get(stateId);
        return state != null && state.isAccepting();
    }

    public Set<String> getAcceptingStateIds() {
        Set<String> accepting = new LinkedHashSet<>();
        for (State state : states.values()) {
            if (state.isAccepting()) {
                accepting.add(state.getId());
            }
        }
        return accepting;
    }

    /**
     * @return The classification computed at construction
     */
    public AutomatonKind getKind() {
        return kind;
    }

    public boolean isNondeterministic() {
        return kind.isNondeterministic();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) obj;
        return new ArrayList<>(states.values()).equals(new ArrayList<>(other.states.values()))
                && alphabet.equals(other.alphabet) && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions);
    }

    @Override
    public String toString() {
        return kind.getAbbreviation() + "{states=" + states.values() + ", alphabet=" + alphabet + ", transitions="
                + transitions + "}";
    }
}
