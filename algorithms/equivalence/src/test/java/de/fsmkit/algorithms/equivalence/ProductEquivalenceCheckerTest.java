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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import de.fsmkit.algorithms.membership.DispatchingEvaluator;
import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonBuilder;
import de.fsmkit.api.result.EquivalenceError;
import de.fsmkit.api.result.EquivalenceError.Operand;
import de.fsmkit.api.result.EquivalenceResult;
import de.fsmkit.examples.WordEnumerator;
import de.fsmkit.examples.dfa.ExampleEmptyOrZero;
import de.fsmkit.examples.dfa.ExampleEvenLength;
import de.fsmkit.examples.dfa.ExampleEvenOnes;
import de.fsmkit.examples.dfa.ExampleEvenOnesRedundant;
import de.fsmkit.examples.dfa.ExampleOnlyEmpty;
import de.fsmkit.examples.dfa.ExampleRandomDFA;
import de.fsmkit.examples.dfa.ExampleTwoStateUniversal;
import de.fsmkit.examples.dfa.ExampleUniversal;
import de.fsmkit.examples.nfa.ExampleEndsWithOne;
import net.automatalib.words.Word;

public class ProductEquivalenceCheckerTest {

    private static final List<String> BINARY = Arrays.asList("0", "1");

    private final DispatchingEvaluator evaluator = new DispatchingEvaluator();

    @DataProvider(name = "checkers")
    public static Object[][] checkers() {
        return new Object[][] {{new ProductEquivalenceChecker()}, {new ProductEquivalenceChecker(true)}};
    }

    @DataProvider(name = "randomPairs")
    public static Object[][] randomPairs() {
        Random random = new Random(7);
        List<Object[]> pairs = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            Automaton first = ExampleRandomDFA.constructMachine(random, BINARY, 1 + random.nextInt(3), 0.5, 0.9);
            Automaton second = ExampleRandomDFA.constructMachine(random, BINARY, 1 + random.nextInt(3), 0.5, 0.9);
            pairs.add(new Object[] {first, second});
        }
        return pairs.toArray(new Object[0][]);
    }

    @Test(dataProvider = "checkers")
    public void testDifferentSizesSameLanguage(ProductEquivalenceChecker checker) {
        EquivalenceResult result = checker.checkEquivalence(ExampleTwoStateUniversal.constructMachine(),
                ExampleUniversal.constructMachine());

        Assert.assertTrue(result.isSuccess());
        Assert.assertTrue(result.isEquivalent());
        Assert.assertNull(result.getSeparatingWord());
        Assert.assertTrue(result.getDisagreements().isEmpty());
        Assert.assertEquals(result.getExploredStates(), 2);
    }

    @Test(dataProvider = "checkers")
    public void testEmptyWordAgainstEmptyWordOrZero(ProductEquivalenceChecker checker) {
        EquivalenceResult result = checker.checkEquivalence(ExampleOnlyEmpty.constructMachine(),
                ExampleEmptyOrZero.constructMachine());

        Assert.assertTrue(result.isSuccess());
        Assert.assertFalse(result.isEquivalent());
        Assert.assertEquals(result.getSeparatingWord(), Word.fromSymbols("0"));
        Assert.assertFalse(result.getDisagreements().isEmpty());
        Assert.assertTrue(result.getDisagreements().get(0).isLeftSink());
    }

    @Test(dataProvider = "checkers")
    public void testRedundantStates(ProductEquivalenceChecker checker) {
        EquivalenceResult result = checker.checkEquivalence(ExampleEvenOnes.constructMachine(),
                ExampleEvenOnesRedundant.constructMachine());

        Assert.assertTrue(result.isEquivalent());
        Assert.assertTrue(result.getExploredStates() <= (2 + 1) * (3 + 1));
    }

    @Test(dataProvider = "checkers")
    public void testShortestSeparatingWord(ProductEquivalenceChecker checker) {
        Automaton evenOnes = ExampleEvenOnes.constructMachine();
        Automaton evenLength = ExampleEvenLength.constructMachine();

        EquivalenceResult result = checker.checkEquivalence(evenOnes, evenLength);

        Assert.assertFalse(result.isEquivalent());
        Word<String> separator = result.getSeparatingWord();
        Assert.assertNotNull(separator);
        Assert.assertEquals(separator, Word.fromSymbols("0"));
        Assert.assertNotEquals(evaluator.evaluate(evenOnes, separator).isAccepted(),
                evaluator.evaluate(evenLength, separator).isAccepted());
    }

    @Test(dataProvider = "checkers")
    public void testAlphabetsAreCombined(ProductEquivalenceChecker checker) {
        Automaton onlyZeros = new AutomatonBuilder().withInitialState("z", true).withSelfLoop("z", "0").create();
        Automaton onlyZerosWithOne = new AutomatonBuilder().withInitialState("z", true).withSelfLoop("z", "0")
                .withSymbol("1").create();
        Automaton universal = ExampleUniversal.constructMachine();

        Assert.assertTrue(checker.checkEquivalence(onlyZeros, onlyZerosWithOne).isEquivalent());

        EquivalenceResult result = checker.checkEquivalence(onlyZeros, universal);
        Assert.assertFalse(result.isEquivalent());
        Assert.assertEquals(result.getSeparatingWord(), Word.fromSymbols("1"));
    }

    @Test(dataProvider = "checkers")
    public void testExtraInputsDoNotChangeTheDecision(ProductEquivalenceChecker checker) {
        EquivalenceResult result = checker.checkEquivalence(ExampleEvenOnes.constructMachine(),
                ExampleEvenOnesRedundant.constructMachine(), Arrays.asList("x", "y"));

        Assert.assertTrue(result.isEquivalent());
    }

    @Test(dataProvider = "checkers")
    public void testMissingStartState(ProductEquivalenceChecker checker) {
        Automaton withoutStart = new AutomatonBuilder().withAcceptingState("q").withSelfLoop("q", "0").create();
        Automaton valid = ExampleEvenOnes.constructMachine();

        EquivalenceResult result = checker.checkEquivalence(withoutStart, valid);
        Assert.assertFalse(result.isSuccess());
        Assert.assertFalse(result.isEquivalent());
        Assert.assertEquals(result.getError(), EquivalenceError.MISSING_START_STATE);
        Assert.assertEquals(result.getOperand(), Operand.FIRST);

        Assert.assertEquals(checker.checkEquivalence(valid, withoutStart).getOperand(), Operand.SECOND);
        Assert.assertEquals(checker.checkEquivalence(withoutStart, withoutStart).getOperand(), Operand.BOTH);

        // the missing start state is reported before the nondeterminism
        Assert.assertEquals(checker.checkEquivalence(ExampleEndsWithOne.constructMachine(), withoutStart).getError(),
                EquivalenceError.MISSING_START_STATE);
    }

    @Test(dataProvider = "checkers")
    public void testNondeterministicInput(ProductEquivalenceChecker checker) {
        Automaton nfa = ExampleEndsWithOne.constructMachine();
        Automaton dfa = ExampleEvenOnes.constructMachine();

        EquivalenceResult result = checker.checkEquivalence(dfa, nfa);
        Assert.assertFalse(result.isSuccess());
        Assert.assertEquals(result.getError(), EquivalenceError.NONDETERMINISTIC_INPUT_UNSUPPORTED);
        Assert.assertEquals(result.getOperand(), Operand.SECOND);
        Assert.assertEquals(checker.checkEquivalence(nfa, nfa).getOperand(), Operand.BOTH);
    }

    @Test(dataProvider = "randomPairs")
    public void testSelfEquivalence(Automaton first, Automaton second) {
        ProductEquivalenceChecker checker = new ProductEquivalenceChecker();
        Assert.assertTrue(checker.checkEquivalence(first, first).isEquivalent());
        Assert.assertTrue(checker.checkEquivalence(second, second).isEquivalent());
    }

    @Test(dataProvider = "randomPairs")
    public void testSymmetry(Automaton first, Automaton second) {
        ProductEquivalenceChecker checker = new ProductEquivalenceChecker();
        EquivalenceResult forward = checker.checkEquivalence(first, second);
        EquivalenceResult backward = checker.checkEquivalence(second, first);

        Assert.assertEquals(forward.isEquivalent(), backward.isEquivalent());
        if (!forward.isEquivalent()) {
            Assert.assertEquals(forward.getSeparatingWord().size(), backward.getSeparatingWord().size());
        }
    }

    @Test(dataProvider = "randomPairs")
    public void testDecisionMatchesMembership(Automaton first, Automaton second) {
        EquivalenceResult result = new ProductEquivalenceChecker().checkEquivalence(first, second);

        if (result.isEquivalent()) {
            for (Word<String> word : WordEnumerator.allWords(BINARY, 6)) {
                Assert.assertEquals(evaluator.evaluate(first, word).isAccepted(),
                        evaluator.evaluate(second, word).isAccepted(), "Disagreement on " + word);
            }
        } else {
            Word<String> separator = result.getSeparatingWord();
            Assert.assertNotEquals(evaluator.evaluate(first, separator).isAccepted(),
                    evaluator.evaluate(second, separator).isAccepted());
        }
    }

    @Test(dataProvider = "randomPairs")
    public void testExhaustiveAgreesWithEarlyExit(Automaton first, Automaton second) {
        EquivalenceResult fused = new ProductEquivalenceChecker(false).checkEquivalence(first, second);
        EquivalenceResult exhaustive = new ProductEquivalenceChecker(true).checkEquivalence(first, second);

        Assert.assertEquals(exhaustive.isEquivalent(), fused.isEquivalent());
        Assert.assertEquals(exhaustive.getSeparatingWord(), fused.getSeparatingWord());
        Assert.assertTrue(exhaustive.getDisagreements().containsAll(fused.getDisagreements()));
        Assert.assertTrue(exhaustive.getExploredStates() >= fused.getExploredStates());
        Assert.assertTrue(exhaustive.getExploredStates() <= (first.size() + 1) * (second.size() + 1));
    }

    @Test
    public void testCombinedAlphabetOrder() {
        Automaton first = new AutomatonBuilder().withInitialState("a", true).withSymbols("b", "a").create();
        Automaton second = new AutomatonBuilder().withInitialState("a", true).withSymbols("c", "a").create();

        Assert.assertEquals(new ArrayList<>(ProductEquivalenceChecker.combinedAlphabet(first, second,
                Arrays.asList("d", "b", ""))), Arrays.asList("b", "a", "c", "d"));
        Assert.assertEquals(new ArrayList<>(ProductEquivalenceChecker.combinedAlphabet(first, second,
                Collections.emptySet())), Arrays.asList("b", "a", "c"));
    }
}
