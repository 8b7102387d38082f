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

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.result.ProductState;
import de.fsmkit.examples.dfa.ExampleEmptyOrZero;
import de.fsmkit.examples.dfa.ExampleEvenLength;
import de.fsmkit.examples.dfa.ExampleEvenOnes;
import de.fsmkit.examples.dfa.ExampleOnlyEmpty;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;

public class ProductGraphTest {

    private static final Alphabet<String> BINARY = Alphabets.fromCollection(Arrays.asList("0", "1"));

    @Test
    public void testCompleteExploration() {
        Automaton evenOnes = ExampleEvenOnes.constructMachine();
        Automaton evenLength = ExampleEvenLength.constructMachine();

        ProductGraph product = new ProductExplorer(evenOnes, evenLength, BINARY).explore(false);

        Assert.assertTrue(product.isComplete());
        Assert.assertEquals(product.getStart(), new ProductState("q0", "even"));
        // both automata are complete: the sinks are never reached
        Assert.assertEquals(product.getStates().size(), 4);
        Assert.assertEquals(product.getTransitions().size(), 4 * BINARY.size());
        Assert.assertEquals(product.getDisagreements().size(), 2);
        Assert.assertTrue(product.getDisagreements().contains(new ProductState("q0", "odd")));
        Assert.assertTrue(product.getDisagreements().contains(new ProductState("q1", "even")));
        Assert.assertTrue(product.hasReachableDisagreement());
    }

    @Test
    public void testSinksArePaired() {
        ProductGraph product = new ProductExplorer(ExampleOnlyEmpty.constructMachine(),
                ExampleEmptyOrZero.constructMachine(), Alphabets.singleton("0")).explore(false);

        Assert.assertEquals(product.getStates(), Arrays.asList(new ProductState("a0", "b0"),
                new ProductState(null, "b1"), new ProductState(null, null)));
        Assert.assertEquals(product.getDisagreements(), Arrays.asList(new ProductState(null, "b1")));
        Assert.assertEquals(product.wordTo(new ProductState(null, null)), Word.fromSymbols("0", "0"));
    }

    @Test
    public void testEarlyExit() {
        ProductGraph product = new ProductExplorer(ExampleOnlyEmpty.constructMachine(),
                ExampleEmptyOrZero.constructMachine(), Alphabets.singleton("0")).explore(true);

        Assert.assertFalse(product.isComplete());
        Assert.assertEquals(product.getStates().size(), 2);
        Assert.assertEquals(product.getDisagreements(), Arrays.asList(new ProductState(null, "b1")));
    }

    @Test
    public void testWordToStartIsEmpty() {
        ProductGraph product = new ProductExplorer(ExampleEvenOnes.constructMachine(),
                ExampleEvenOnes.constructMachine(), BINARY).explore(false);

        Assert.assertEquals(product.wordTo(product.getStart()), Word.epsilon());
        Assert.assertFalse(product.hasReachableDisagreement());
        Assert.assertTrue(product.getDisagreements().isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWordToUnvisitedState() {
        ProductGraph product = new ProductExplorer(ExampleEvenOnes.constructMachine(),
                ExampleEvenOnes.constructMachine(), BINARY).explore(false);
        product.wordTo(new ProductState("q0", "q1"));
    }
}
