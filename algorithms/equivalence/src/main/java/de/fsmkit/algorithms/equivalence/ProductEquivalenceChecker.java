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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.Symbols;
import de.fsmkit.api.evaluation.EquivalenceChecker;
import de.fsmkit.api.result.EquivalenceError.Operand;
import de.fsmkit.api.result.EquivalenceResult;
import de.fsmkit.api.result.ProductState;
import de.learnlib.api.logging.LearnLogger;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;

/**
 * Decides language equivalence of two deterministic automata with a
 * synchronized product.
 *
 * Both automata are completed over the union of their alphabets with a private
 * sink each. They are equivalent iff no product state in which exactly one
 * component is accepting is reachable from the pair of start states.
 *
 * By default, reachability is decided during the breadth-first traversal that
 * builds the product, which stops at the first disagreement state. In
 * exhaustive mode, the whole reachable product is built first, and a separate
 * reachability search then looks for a disagreement state; the result lists
 * every reachable disagreement state. Both modes report the same decision and
 * the same shortest separating word.
 *
 * An automaton without start state, or a nondeterministic one, is reported as
 * an error value and no product is built.
 *
 * @author FSMKit contributors
 */
public class ProductEquivalenceChecker implements EquivalenceChecker {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(ProductEquivalenceChecker.class);

    private final boolean exhaustive;

    public ProductEquivalenceChecker() {
        this(false);
    }

    /**
     * @param exhaustive Whether to build the whole reachable product before
     *                   deciding
     */
    public ProductEquivalenceChecker(boolean exhaustive) {
        this.exhaustive = exhaustive;
    }

    public boolean isExhaustive() {
        return exhaustive;
    }

    @Override
    public EquivalenceResult checkEquivalence(Automaton first, Automaton second,
            Collection<? extends String> extraInputs) {
        boolean firstWithoutStart = !first.hasStartState();
        boolean secondWithoutStart = !second.hasStartState();
        if (firstWithoutStart || secondWithoutStart) {
            Operand operand = Operand.of(firstWithoutStart, secondWithoutStart);
            LOGGER.warn("Cannot compare automata, missing start state in {}", operand);
            return EquivalenceResult.missingStartState(operand);
        }

        boolean firstNondeterministic = first.isNondeterministic();
        boolean secondNondeterministic = second.isNondeterministic();
        if (firstNondeterministic || secondNondeterministic) {
            Operand operand = Operand.of(firstNondeterministic, secondNondeterministic);
            LOGGER.warn("Cannot compare automata, nondeterministic input in {}", operand);
            return EquivalenceResult.nondeterministicInput(operand);
        }

        Alphabet<String> alphabet = combinedAlphabet(first, second, extraInputs);
        ProductExplorer explorer = new ProductExplorer(first, second, alphabet);

        LOGGER.logPhase("Exploring product over " + alphabet.size() + " symbols");
        ProductGraph product = explorer.explore(!exhaustive);

        boolean disagreementReachable =
                exhaustive ? product.hasReachableDisagreement() : !product.getDisagreements().isEmpty();
        int explored = product.getStates().size();

        if (!disagreementReachable) {
            LOGGER.debug("Automata are equivalent ({} product states)", explored);
            return EquivalenceResult.equivalent(explored);
        }

        ProductState witness = product.getDisagreements().get(0);
        Word<String> separator = product.wordTo(witness);
        LOGGER.logCounterexample(Symbols.toString(separator));
        return EquivalenceResult.inequivalent(separator, product.getDisagreements(), explored);
    }

    /**
     * Builds the alphabet explored by the product: the symbols of the first
     * automaton, then the new ones of the second, then the new extra inputs.
     *
     * @param first       The first automaton
     * @param second      The second automaton
     * @param extraInputs Further symbols
     * @return The combined alphabet
     */
    static Alphabet<String> combinedAlphabet(Automaton first, Automaton second,
            Collection<? extends String> extraInputs) {
        Set<String> symbols = new LinkedHashSet<>(first.getAlphabet());
        symbols.addAll(second.getAlphabet());
        for (String input : extraInputs) {
            if (Symbols.isAlphabetSymbol(input)) {
                symbols.add(input);
            }
        }
        return Alphabets.fromCollection(symbols);
    }
}
