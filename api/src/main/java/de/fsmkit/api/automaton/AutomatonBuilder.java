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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent construction of an {@link Automaton}.
 *
 * Adding a transition also adds its symbol to the alphabet, unless the symbol
 * is the epsilon marker or empty. An automaton whose transitions use symbols
 * outside of its alphabet can only be created through the constructor of
 * {@link Automaton}.
 *
 * @author FSMKit contributors
 */
public class AutomatonBuilder {

    private final List<State> states = new ArrayList<>();
    private final Set<String> alphabet = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();

    public AutomatonBuilder withState(State state) {
        states.add(state);
        return this;
    }

    public AutomatonBuilder withState(String id) {
        return withState(new State(id, false, false));
    }

    public AutomatonBuilder withState(String id, boolean accepting) {
        return withState(new State(id, false, accepting));
    }

    public AutomatonBuilder withInitialState(String id, boolean accepting) {
        return withState(new State(id, true, accepting));
    }

    public AutomatonBuilder withAcceptingState(String id) {
        return withState(new State(id, false, true));
    }

    public AutomatonBuilder withSymbol(String symbol) {
        if (Symbols.isAlphabetSymbol(symbol)) {
            alphabet.add(symbol);
        }
        return this;
    }

    public AutomatonBuilder withSymbols(String... symbols) {
        for (String symbol : symbols) {
            withSymbol(symbol);
        }
        return this;
    }

    public AutomatonBuilder withTransition(String source, String target, String symbol) {
        transitions.add(new Transition(source, target, symbol));
        return withSymbol(symbol);
    }

    /**
     * Adds one transition per label of a comma separated list, e.g.
     * {@code "0, 1, ε"}. Labels are trimmed and empty labels are skipped.
     *
     * @param source The source state
     * @param target The target state
     * @param labels The comma separated labels
     * @return This builder
     */
    public AutomatonBuilder withTransitions(String source, String target, String labels) {
        for (String label : labels.split(",")) {
            String symbol = label.trim();
            if (!symbol.isEmpty()) {
                withTransition(source, target, symbol);
            }
        }
        return this;
    }

    /**
     * Adds, for every given symbol, a transition from the state to itself.
     *
     * @param state   The state
     * @param symbols The symbols
     * @return This builder
     */
    public AutomatonBuilder withSelfLoop(String state, String... symbols) {
        for (String symbol : symbols) {
            withTransition(state, state, symbol);
        }
        return this;
    }

    public Automaton create() {
        return new Automaton(states, alphabet, transitions);
    }
}
