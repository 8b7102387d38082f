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

/**
 * Reasons why two automata could not be compared.
 *
 * @author FSMKit contributors
 */
public enum EquivalenceError {
    /**
     * At least one automaton has no start state.
     */
    MISSING_START_STATE,
    /**
     * At least one automaton is nondeterministic, and the product construction
     * is only defined for deterministic automata.
     */
    NONDETERMINISTIC_INPUT_UNSUPPORTED;

    /**
     * Identifies the automaton (or automata) an error refers to.
     */
    public enum Operand {
        FIRST,
        SECOND,
        BOTH;

        public static Operand of(boolean first, boolean second) {
            if (first && second) {
                return BOTH;
            }
            if (first) {
                return FIRST;
            }
            if (second) {
                return SECOND;
            }
            throw new IllegalArgumentException("Neither operand is concerned");
        }
    }
}
