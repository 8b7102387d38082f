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
package de.fsmkit.oracle.equivalence;

import java.util.Collection;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.fsmkit.algorithms.equivalence.ProductEquivalenceChecker;
import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.evaluation.EquivalenceChecker;
import de.fsmkit.api.result.EquivalenceResult;
import de.fsmkit.api.result.ProductState;
import de.learnlib.api.oracle.EquivalenceOracle;
import de.learnlib.api.query.DefaultQuery;
import net.automatalib.words.Word;

/**
 * An equivalence oracle comparing hypotheses to a deterministic reference
 * automaton.
 *
 * The counterexample is a shortest word on which the reference and the
 * hypothesis disagree, labelled with the answer of the reference.
 *
 * @author FSMKit contributors
 */
public final class AutomatonSimulatorEQOracle implements EquivalenceOracle<Automaton, String, Boolean> {

    private final Automaton reference;
    private final EquivalenceChecker checker;

    public AutomatonSimulatorEQOracle(Automaton reference) {
        this(reference, new ProductEquivalenceChecker());
    }

    /**
     * @param reference The reference automaton
     * @param checker   The checker comparing the reference to the hypotheses
     * @throws IllegalArgumentException if the reference has no start state or
     *                                  is nondeterministic
     */
    public AutomatonSimulatorEQOracle(Automaton reference, EquivalenceChecker checker) {
        Objects.requireNonNull(reference);
        if (!reference.hasStartState()) {
            throw new IllegalArgumentException("The reference automaton has no start state");
        }
        if (reference.isNondeterministic()) {
            throw new IllegalArgumentException("The reference automaton must be deterministic");
        }
        this.reference = reference;
        this.checker = Objects.requireNonNull(checker);
    }

    public Automaton getReference() {
        return reference;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the hypothesis has no start state or
     *                                  is nondeterministic
     */
    @Override
    public @Nullable DefaultQuery<String, Boolean> findCounterExample(Automaton hypothesis,
            Collection<? extends String> inputs) {
        EquivalenceResult result = checker.checkEquivalence(reference, hypothesis, inputs);

        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Cannot compare the hypothesis: " + result);
        }
        if (result.isEquivalent()) {
            return null;
        }

        Word<String> separator = Objects.requireNonNull(result.getSeparatingWord());
        ProductState witness = result.getDisagreements().get(0);
        String referenceState = witness.getLeft();
        boolean accepted = referenceState != null && reference.isAccepting(referenceState);

        return new DefaultQuery<>(separator, accepted);
    }
}
