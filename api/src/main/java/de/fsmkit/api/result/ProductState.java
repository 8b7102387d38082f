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

/**
 * A state of the synchronized product of two automata.
 *
 * Each component is either the identifier of a state of the corresponding
 * automaton or {@code null}, which stands for the non-accepting sink that
 * absorbs every undefined transition of that automaton. Using {@code null}
 * keeps the sink apart from any identifier a user may choose.
 *
 * @author FSMKit contributors
 */
public final class ProductState {

    private final @Nullable String left;
    private final @Nullable String right;

    public ProductState(@Nullable String left, @Nullable String right) {
        this.left = left;
        this.right = right;
    }

    public @Nullable String getLeft() {
        return left;
    }

    public @Nullable String getRight() {
        return right;
    }

    public boolean isLeftSink() {
        return left == null;
    }

    public boolean isRightSink() {
        return right == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProductState)) {
            return false;
        }
        ProductState other = (ProductState) obj;
        return Objects.equals(left, other.left) && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "(" + (left == null ? "⊥" : left) + ", " + (right == null ? "⊥" : right) + ")";
    }
}
