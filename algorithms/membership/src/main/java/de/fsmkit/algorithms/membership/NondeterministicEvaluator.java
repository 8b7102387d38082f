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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonKind;
import de.fsmkit.api.automaton.State;
import de.fsmkit.api.evaluation.MembershipEvaluator;
import de.fsmkit.api.result.MembershipResult;
import de.fsmkit.util.automaton.EpsilonClosure;
import de.fsmkit.util.automaton.TransitionIndex;
import de.learnlib.api.logging.LearnLogger;
import net.automatalib.words.Word;

/**
 * Simulates an automaton on a set of current states, without building the
 * subset automaton.
 *
 * The set starts as the epsilon-closure of the start state. Each symbol maps
 * the set to the epsilon-closure of the targets of the transitions labelled
 * with that symbol. The input is rejected as soon as a symbol lies outside of
 * the alphabet or the set becomes empty. Otherwise it is accepted iff the final
 * set contains an accepting state.
 *
 * Deterministic automata are handled as well.
 *
 * @author FSMKit contributors
 */
public class NondeterministicEvaluator implements MembershipEvaluator {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(NondeterministicEvaluator.class);

    @Override
    public MembershipResult evaluate(Automaton automaton, Word<String> input) {
        State start = automaton.getStartState();
        if (start == null) {
            LOGGER.warn("NFA has no start state");
            return MembershipResult.noStartState(AutomatonKind.NONDETERMINISTIC);
        }

        TransitionIndex index = TransitionIndex.of(automaton);
        Set<String> alphabet = automaton.getAlphabet();
        Set<String> current = EpsilonClosure.of(index, Collections.singleton(start.getId()));

        for (String symbol : input) {
            if (!alphabet.contains(symbol)) {
                return MembershipResult.rejected(AutomatonKind.NONDETERMINISTIC);
            }

            Set<String> next = new LinkedHashSet<>();
            for (String state : current) {
                next.addAll(index.successors(state, symbol));
            }

            current = EpsilonClosure.of(index, next);
            if (current.isEmpty()) {
                return MembershipResult.rejected(AutomatonKind.NONDETERMINISTIC);
            }
        }

        for (String state : current) {
            if (automaton.isAccepting(state)) {
                return MembershipResult.accepted(AutomatonKind.NONDETERMINISTIC);
            }
        }
        return MembershipResult.rejected(AutomatonKind.NONDETERMINISTIC);
    }
}
