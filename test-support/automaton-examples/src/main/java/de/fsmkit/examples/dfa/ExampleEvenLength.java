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
 * A DFA over {@code {0, 1}} accepting the words of even length.
 *
 * @author FSMKit contributors
 */
public class ExampleEvenLength extends DefaultAutomatonExample {

    public ExampleEvenLength() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("even", true)
                .withState("odd")
                .withTransitions("even", "odd", "0, 1")
                .withTransitions("odd", "even", "0, 1")
                .create();
        // @formatter:on
    }

    public static ExampleEvenLength createExample() {
        return new ExampleEvenLength();
    }
}
