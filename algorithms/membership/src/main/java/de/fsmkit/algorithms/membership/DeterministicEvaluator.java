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
package de.fsmkit.algorithms.membership;

import java.util.Set;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonKind;
import de.fsmkit.api.automaton.State;
import de.fsmkit.api.evaluation.MembershipEvaluator;
import de.fsmkit.api.result.MembershipResult;
import de.fsmkit.util.automaton.TransitionIndex;
import de.learnlib.api.logging.LearnLogger;
import net.automatalib.words.Word;

/**
 * Runs a single current-state walk over the input.
 *
 * The automaton is assumed to be deterministic; if it is not, the first
 * matching transition is taken. The transition function is partial: a symbol
 * outside of the alphabet, or a symbol for which the current state has no
 * transition, rejects the input immediately. The empty word is accepted iff
 * the start state is accepting.
 *
 * @author FSMKit contributors
 */
public class DeterministicEvaluator implements MembershipEvaluator {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(DeterministicEvaluator.class);

    @Override
    public MembershipResult evaluate(Automaton automaton, Word<String> input) {
        State start = automaton.getStartState();
        if (start == null) {
            LOGGER.warn("DFA has no start state");
            return MembershipResult.noStartState(AutomatonKind.DETERMINISTIC);
        }

        TransitionIndex index = TransitionIndex.of(automaton);
        Set<String> alphabet = automaton.getAlphabet();
        String current = start.getId();

        for (String symbol : input) {
            if (!alphabet.contains(symbol)) {
                return MembershipResult.rejected(AutomatonKind.DETERMINISTIC);
            }
            String next = index.firstSuccessor(current, symbol);
            if (next == null) {
                return MembershipResult.rejected(AutomatonKind.DETERMINISTIC);
            }
            current = next;
        }

        return MembershipResult.of(AutomatonKind.DETERMINISTIC, automaton.isAccepting(current));
    }
}
