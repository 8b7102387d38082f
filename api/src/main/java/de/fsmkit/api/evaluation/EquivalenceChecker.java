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
package de.fsmkit.api.evaluation;

import java.util.Collection;
import java.util.Collections;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.result.EquivalenceResult;

/**
 * Decides whether two automata accept the same language.
 *
 * @author FSMKit contributors
 */
public interface EquivalenceChecker {

    /**
     * Compares two automata over the union of their alphabets and the given
     * additional inputs.
     *
     * @param first       The first automaton
     * @param second      The second automaton
     * @param extraInputs Further symbols to explore
     * @return The outcome
     */
    EquivalenceResult checkEquivalence(Automaton first, Automaton second, Collection<? extends String> extraInputs);

    default EquivalenceResult checkEquivalence(Automaton first, Automaton second) {
        return checkEquivalence(first, second, Collections.emptySet());
    }
}
