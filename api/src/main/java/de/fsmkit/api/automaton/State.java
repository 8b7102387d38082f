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
 * A state of an {@link Automaton}.
 *
 * Besides the identifier and the two flags read by the evaluators, a state
 * carries the fields the editor stores with it (its position on the canvas and
 * the {@code hasLoopOnAllInputs} marker). Those fields are never read by any
 * evaluation algorithm; they only survive so that an automaton can be written
 * back in the form it was read.
 *
 * @author FSMKit contributors
 */
public final class State {

    private final String id;
    private final boolean start;
    private final boolean accepting;
    private final boolean loopOnAllInputs;
    private final double x;
    private final double y;

    public State(String id, boolean start, boolean accepting) {
        this(id, start, accepting, false, 0, 0);
    }

    public State(String id, boolean start, boolean accepting, boolean loopOnAllInputs, double x, double y) {
        this.id = Objects.requireNonNull(id, "id");
        this.start = start;
        this.accepting = accepting;
        this.loopOnAllInputs = loopOnAllInputs;
        this.x = x;
        this.y = y;
    }

    public String getId() {
        return id;
    }

    public boolean isStart() {
        return start;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Editor marker without evaluation semantics.
     *
     * @return the value stored by the editor
     */
    public boolean hasLoopOnAllInputs() {
        return loopOnAllInputs;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof State)) {
            return false;
        }
        State other = (State) obj;
        return id.equals(other.id) && start == other.start && accepting == other.accepting
                && loopOnAllInputs == other.loopOnAllInputs && Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, start, accepting, loopOnAllInputs, x, y);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(id);
        if (start) {
            builder.append("(start)");
        }
        if (accepting) {
            builder.append("(final)");
        }
        return builder.toString();
    }
}
