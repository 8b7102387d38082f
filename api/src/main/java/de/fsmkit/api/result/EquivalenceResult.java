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
package de.fsmkit.api.result;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.fsmkit.api.result.EquivalenceError.Operand;
import net.automatalib.words.Word;

/**
 * Outcome of an equivalence check between two automata.
 *
 * When the automata are not equivalent, the result holds a shortest word on
 * which they disagree together with the disagreement states that were
 * discovered. Depending on how the product was explored, the list contains
 * the first disagreement state only or every reachable one.
 *
 * @author FSMKit contributors
 */
public final class EquivalenceResult {

    private final boolean equivalent;
    private final @Nullable EquivalenceError error;
    private final @Nullable Operand operand;
    private final @Nullable Word<String> separatingWord;
    private final List<ProductState> disagreements;
    private final int exploredStates;

    private EquivalenceResult(boolean equivalent, @Nullable EquivalenceError error, @Nullable Operand operand,
            @Nullable Word<String> separatingWord, List<ProductState> disagreements, int exploredStates) {
        this.equivalent = equivalent;
        this.error = error;
        this.operand = operand;
        this.separatingWord = separatingWord;
        this.disagreements = disagreements;
        this.exploredStates = exploredStates;
    }

    public static EquivalenceResult equivalent(int exploredStates) {
        return new EquivalenceResult(true, null, null, null, Collections.emptyList(), exploredStates);
    }

    public static EquivalenceResult inequivalent(Word<String> separatingWord, List<ProductState> disagreements,
            int exploredStates) {
        Objects.requireNonNull(separatingWord, "separatingWord");
        if (disagreements.isEmpty()) {
            throw new IllegalArgumentException("An inequivalence needs at least one disagreement state");
        }
        return new EquivalenceResult(false, null, null, separatingWord,
                Collections.unmodifiableList(disagreements), exploredStates);
    }

    public static EquivalenceResult missingStartState(Operand operand) {
        return new EquivalenceResult(false, EquivalenceError.MISSING_START_STATE, operand, null,
                Collections.emptyList(), 0);
    }

    public static EquivalenceResult nondeterministicInput(Operand operand) {
        return new EquivalenceResult(false, EquivalenceError.NONDETERMINISTIC_INPUT_UNSUPPORTED, operand, null,
                Collections.emptyList(), 0);
    }

    /**
     * @return True iff both automata were compared and accept the same language
     */
    public boolean isEquivalent() {
        return equivalent;
    }

    /**
     * @return True iff the automata could be compared
     */
    public boolean isSuccess() {
        return error == null;
    }

    public @Nullable EquivalenceError getError() {
        return error;
    }

    /**
     * @return The automaton the error refers to, or {@code null} on success
     */
    public @Nullable Operand getOperand() {
        return operand;
    }

    /**
     * @return A shortest word accepted by exactly one of the automata, or
     *         {@code null} if there is none or the check failed
     */
    public @Nullable Word<String> getSeparatingWord() {
        return separatingWord;
    }

    public List<ProductState> getDisagreements() {
        return disagreements;
    }

    /**
     * @return The number of product states visited
     */
    public int getExploredStates() {
        return exploredStates;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "EquivalenceResult{error=" + error + ", operand=" + operand + "}";
        }
        if (equivalent) {
            return "EquivalenceResult{equivalent, explored=" + exploredStates + "}";
        }
        return "EquivalenceResult{inequivalent, separatingWord=" + separatingWord + ", disagreements="
                + disagreements + ", explored=" + exploredStates + "}";
    }
}
