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

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.fsmkit.api.automaton.AutomatonKind;

/**
 * Outcome of a membership test: the input is accepted, rejected, or could not
 * be evaluated.
 *
 * @author FSMKit contributors
 */
public final class MembershipResult {

    private final AutomatonKind evaluatedAs;
    private final boolean accepted;
    private final @Nullable EvaluationError error;

    private MembershipResult(AutomatonKind evaluatedAs, boolean accepted, @Nullable EvaluationError error) {
        this.evaluatedAs = Objects.requireNonNull(evaluatedAs, "evaluatedAs");
        this.accepted = accepted;
        this.error = error;
    }

    public static MembershipResult accepted(AutomatonKind evaluatedAs) {
        return new MembershipResult(evaluatedAs, true, null);
    }

    public static MembershipResult rejected(AutomatonKind evaluatedAs) {
        return new MembershipResult(evaluatedAs, false, null);
    }

    public static MembershipResult of(AutomatonKind evaluatedAs, boolean accepted) {
        return new MembershipResult(evaluatedAs, accepted, null);
    }

    public static MembershipResult noStartState(AutomatonKind evaluatedAs) {
        return new MembershipResult(evaluatedAs, false, EvaluationError.NO_START_STATE);
    }

    /**
     * @return True iff the input was evaluated and accepted
     */
    public boolean isAccepted() {
        return accepted;
    }

    /**
     * @return True iff the input could be evaluated
     */
    public boolean isSuccess() {
        return error == null;
    }

    public @Nullable EvaluationError getError() {
        return error;
    }

    /**
     * @return The evaluator that produced this result
     */
    public AutomatonKind getEvaluatedAs() {
        return evaluatedAs;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MembershipResult)) {
            return false;
        }
        MembershipResult other = (MembershipResult) obj;
        return evaluatedAs == other.evaluatedAs && accepted == other.accepted && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(evaluatedAs, accepted, error);
    }

    @Override
    public String toString() {
        String prefix = "[" + evaluatedAs.getAbbreviation() + "] ";
        if (error != null) {
            return prefix + error.getDescription();
        }
        return prefix + (accepted ? "ACCEPTED" : "REJECTED");
    }
}
