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
package de.fsmkit.examples.dfa;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonBuilder;
import de.fsmkit.examples.DefaultAutomatonExample;

/**
 * The parity automaton of {@link ExampleEvenLength} in which both states are
 * accepting. It therefore accepts every word over {@code {0, 1}}.
 *
 * @author FSMKit contributors
 */
public class ExampleTwoStateUniversal extends DefaultAutomatonExample {

    public ExampleTwoStateUniversal() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("even", true)
                .withState("odd", true)
                .withTransitions("even", "odd", "0, 1")
                .withTransitions("odd", "even", "0, 1")
                .create();
        // @formatter:on
    }

    public static ExampleTwoStateUniversal createExample() {
        return new ExampleTwoStateUniversal();
    }
}
