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
 * Failures of a membership test.
 *
 * Symbols outside of the alphabet and undefined transitions are not failures:
 * the input is simply rejected.
 *
 * @author FSMKit contributors
 */
public enum EvaluationError {
    /**
     * No state of the automaton is flagged as start.
     */
    NO_START_STATE("No start state defined");

    private final String description;

    EvaluationError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
