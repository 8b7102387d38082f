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
 * A non-minimal DFA with three states accepting the same language as
 * {@link ExampleEvenOnes}: the even state is split in two.
 *
 * @author FSMKit contributors
 */
public class ExampleEvenOnesRedundant extends DefaultAutomatonExample {

    public ExampleEvenOnesRedundant() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("p0", true)
                .withState("p1")
                .withState("p2", true)
                .withTransition("p0", "p1", "1")
                .withTransition("p1", "p2", "1")
                .withTransition("p2", "p1", "1")
                .withSelfLoop("p0", "0")
                .withSelfLoop("p1", "0")
                .withSelfLoop("p2", "0")
                .create();
        // @formatter:on
    }

    public static ExampleEvenOnesRedundant createExample() {
        return new ExampleEvenOnesRedundant();
    }
}
