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
package de.fsmkit.oracle.membership;

import java.util.Objects;

import de.fsmkit.algorithms.membership.DispatchingEvaluator;
import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.evaluation.MembershipEvaluator;
import de.learnlib.api.oracle.SingleQueryOracle;
import net.automatalib.words.Word;

/**
 * A membership oracle answering queries by running them on a reference
 * automaton, deterministic or not.
 *
 * @author FSMKit contributors
 */
public class AutomatonSimulatorOracle implements SingleQueryOracle<String, Boolean> {

    private final Automaton reference;
    private final MembershipEvaluator evaluator;

    public AutomatonSimulatorOracle(Automaton reference) {
        this(reference, new DispatchingEvaluator());
    }

    /**
     * @param reference The automaton answering the queries
     * @param evaluator The evaluator used to run the queries
     * @throws IllegalArgumentException if the reference has no start state
     */
    public AutomatonSimulatorOracle(Automaton reference, MembershipEvaluator evaluator) {
        Objects.requireNonNull(reference);
        if (!reference.hasStartState()) {
            throw new IllegalArgumentException("The reference automaton has no start state");
        }
        this.reference = reference;
        this.evaluator = Objects.requireNonNull(evaluator);
    }

    public Automaton getReference() {
        return reference;
    }

    @Override
    public Boolean answerQuery(Word<String> prefix, Word<String> suffix) {
        return evaluator.evaluate(reference, prefix.concat(suffix)).isAccepted();
    }
}
