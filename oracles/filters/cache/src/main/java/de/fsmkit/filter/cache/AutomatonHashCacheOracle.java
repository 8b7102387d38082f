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
package de.fsmkit.filter.cache;

import de.learnlib.api.oracle.MembershipOracle;

/**
 * A thread-safe cache in front of a membership oracle over automata inputs.
 *
 * @author FSMKit contributors
 */
public class AutomatonHashCacheOracle extends AbstractHashCacheOracle<String, Boolean> {

    public AutomatonHashCacheOracle(MembershipOracle<String, Boolean> delegate) {
        super(delegate);
    }
}
