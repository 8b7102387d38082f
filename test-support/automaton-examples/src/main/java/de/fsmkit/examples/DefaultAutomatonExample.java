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
package de.fsmkit.examples;

import java.util.Set;

import de.fsmkit.api.automaton.Automaton;

/**
 * Default implementation of an example: a reference automaton.
 *
 * @author FSMKit contributors
 */
public class DefaultAutomatonExample {

    private final Automaton referenceAutomaton;

    public DefaultAutomatonExample(Automaton referenceAutomaton) {
        this.referenceAutomaton = referenceAutomaton;
    }

    public Automaton getReferenceAutomaton() {
        return referenceAutomaton;
    }

    public Set<String> getAlphabet() {
        return referenceAutomaton.getAlphabet();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
