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
 * A single accepting state with a self loop on every symbol of {@code {0, 1}}.
 *
 * @author FSMKit contributors
 */
public class ExampleUniversal extends DefaultAutomatonExample {

    public ExampleUniversal() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        return new AutomatonBuilder().withInitialState("u", true).withSelfLoop("u", "0", "1").create();
    }

    public static ExampleUniversal createExample() {
        return new ExampleUniversal();
    }
}
