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
 * An epsilon-NFA accepting {@code a*b*}: the {@code a} loop is followed by an
 * epsilon transition into the {@code b} loop, which leads to the accepting
 * state through a chain of two epsilon transitions.
 *
 * @author FSMKit contributors
 */
public class ExampleAStarBStar extends DefaultAutomatonExample {

    public ExampleAStarBStar() {
        super(constructMachine());
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return new AutomatonBuilder()
                .withInitialState("as", false)
                .withState("bs")
                .withState("mid")
                .withAcceptingState("acc")
                .withSelfLoop("as", "a")
                .withSelfLoop("bs", "b")
                .withTransition("as", "bs", Symbols.EPSILON)
                .withTransition("bs", "mid", Symbols.EPSILON)
                .withTransition("mid", "acc", Symbols.EPSILON)
                .create();
        // @formatter:on
    }

    public static ExampleAStarBStar createExample() {
        return new ExampleAStarBStar();
    }
}
