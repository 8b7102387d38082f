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
package de.fsmkit.api.automaton;

/**
 * Structural classification of an automaton.
 *
 * @author FSMKit contributors
 * @see Determinism
 */
public enum AutomatonKind {
    /**
     * No epsilon transition and at most one transition per (state, symbol) pair.
     */
    DETERMINISTIC("DFA"),
    /**
     * At least one epsilon transition, or a (state, symbol) pair with several
     * transitions.
     */
    NONDETERMINISTIC("NFA");

    private final String abbreviation;

    AutomatonKind(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public boolean isNondeterministic() {
        return this == NONDETERMINISTIC;
    }
}
