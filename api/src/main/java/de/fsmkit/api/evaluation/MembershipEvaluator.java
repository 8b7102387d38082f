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

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.Symbols;
import de.fsmkit.api.result.MembershipResult;
import net.automatalib.words.Word;

/**
 * Decides whether an automaton accepts an input.
 *
 * Implementations are stateless: they neither modify the automaton nor keep a
 * reference to it after a call returns.
 *
 * @author FSMKit contributors
 */
public interface MembershipEvaluator {

    /**
     * Runs the automaton on the input.
     *
     * @param automaton The automaton
     * @param input     The input word
     * @return The outcome; an automaton without start state yields
     *         {@link MembershipResult#noStartState}
     */
    MembershipResult evaluate(Automaton automaton, Word<String> input);

    /**
     * Runs the automaton on the input, read one code point at a time.
     *
     * @param automaton The automaton
     * @param input     The input string
     * @return The outcome
     * @see Symbols#toWord(String)
     */
    default MembershipResult evaluate(Automaton automaton, String input) {
        return evaluate(automaton, Symbols.toWord(input));
    }
}
