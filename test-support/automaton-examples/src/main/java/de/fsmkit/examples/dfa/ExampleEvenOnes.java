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
 * A complete DFA over {@code {0, 1}} accepting the words with an even number of
 * {@code 1}s.
 *
 * @author FSMKit contributors
 */
public class ExampleEvenOnes extends DefaultAutomatonExample {

    public ExampleEvenOnes() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("q0", true)
                .withState("q1")
                .withTransition("q0", "q1", "1")
                .withTransition("q1", "q0", "1")
                .withTransition("q0", "q0", "0")
                .withTransition("q1", "q1", "0")
                .create();
        // @formatter:on
    }

    public static ExampleEvenOnes createExample() {
        return new ExampleEvenOnes();
    }
}
