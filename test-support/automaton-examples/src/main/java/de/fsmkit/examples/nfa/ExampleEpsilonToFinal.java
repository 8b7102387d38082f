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
package de.fsmkit.examples.nfa;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonBuilder;
import de.fsmkit.api.automaton.Symbols;
import de.fsmkit.examples.DefaultAutomatonExample;

/**
 * A non-accepting start state with a single epsilon transition to an accepting
 * state. The alphabet is {@code {0, 1}} but no symbol is ever read, so the
 * automaton accepts exactly the empty word.
 *
 * @author FSMKit contributors
 */
public class ExampleEpsilonToFinal extends DefaultAutomatonExample {

    public ExampleEpsilonToFinal() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("q0", false)
                .withAcceptingState("q1")
                .withSymbols("0", "1")
                .withTransition("q0", "q1", Symbols.EPSILON)
                .create();
        // @formatter:on
    }

    public static ExampleEpsilonToFinal createExample() {
        return new ExampleEpsilonToFinal();
    }
}
