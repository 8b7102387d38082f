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

import java.util.Objects;

/**
 * A labelled edge {@code source --symbol--> target}.
 *
 * The endpoints are plain state identifiers. They are not checked against the
 * states of the automaton: a transition whose source does not exist is never
 * taken, and one whose target does not exist leads to a state without any
 * outgoing transition that is not accepting.
 *
 * @author FSMKit contributors
 */
public final class Transition {

    private final String source;
    private final String target;
    private final String symbol;

    public Transition(String source, String target, String symbol) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isEpsilon() {
        return Symbols.isEpsilon(symbol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Transition)) {
            return false;
        }
        Transition other = (Transition) obj;
        return source.equals(other.source) && target.equals(other.target) && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, symbol);
    }

    @Override
    public String toString() {
        return source + " --" + symbol + "--> " + target;
    }
}
