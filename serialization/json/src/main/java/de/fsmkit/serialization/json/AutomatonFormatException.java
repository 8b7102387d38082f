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
package de.fsmkit.serialization.json;

import java.io.IOException;

/**
 * Signals a JSON document that does not describe an automaton.
 *
 * @author FSMKit contributors
 */
public class AutomatonFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public AutomatonFormatException(String message) {
        super(message);
    }

    public AutomatonFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
