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

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.evaluation.MembershipEvaluator;
import de.fsmkit.api.result.MembershipResult;
import de.learnlib.api.logging.LearnLogger;
import net.automatalib.words.Word;

/**
 * Single entry point for membership tests: uses the classification cached in
 * the automaton to pick the deterministic or the nondeterministic evaluator.
 *
 * @author FSMKit contributors
 */
public class DispatchingEvaluator implements MembershipEvaluator {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(DispatchingEvaluator.class);

    private final MembershipEvaluator deterministic;
    private final MembershipEvaluator nondeterministic;

    public DispatchingEvaluator() {
        this(new DeterministicEvaluator(), new NondeterministicEvaluator());
    }

    public DispatchingEvaluator(MembershipEvaluator deterministic, MembershipEvaluator nondeterministic) {
        this.deterministic = deterministic;
        this.nondeterministic = nondeterministic;
    }

    @Override
    public MembershipResult evaluate(Automaton automaton, Word<String> input) {
        if (automaton.isNondeterministic()) {
            LOGGER.debug("Evaluating {} as NFA", input);
            return nondeterministic.evaluate(automaton, input);
        }
        LOGGER.debug("Evaluating {} as DFA", input);
        return deterministic.evaluate(automaton, input);
    }
}
