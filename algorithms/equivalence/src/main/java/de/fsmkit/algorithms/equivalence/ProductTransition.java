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
package de.fsmkit.algorithms.equivalence;

import java.util.Objects;

import de.fsmkit.api.result.ProductState;

/**
 * An edge of the synchronized product.
 *
 * @author FSMKit contributors
 */
public final class ProductTransition {

    private final ProductState source;
    private final String symbol;
    private final ProductState target;

    ProductTransition(ProductState source, String symbol, ProductState target) {
        this.source = source;
        this.symbol = symbol;
        this.target = target;
    }

    public ProductState getSource() {
        return source;
    }

    public String getSymbol() {
        return symbol;
    }

    public ProductState getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProductTransition)) {
            return false;
        }
        ProductTransition other = (ProductTransition) obj;
        return source.equals(other.source) && symbol.equals(other.symbol) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, symbol, target);
    }

    @Override
    public String toString() {
        return source + " --" + symbol + "--> " + target;
    }
}
