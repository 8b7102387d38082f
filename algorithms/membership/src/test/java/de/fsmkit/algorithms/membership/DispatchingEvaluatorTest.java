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
package de.fsmkit.algorithms.membership;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonKind;
import de.fsmkit.examples.WordEnumerator;
import de.fsmkit.examples.dfa.ExampleEmptyOrZero;
import de.fsmkit.examples.dfa.ExampleEvenLength;
import de.fsmkit.examples.dfa.ExampleEvenOnes;
import de.fsmkit.examples.dfa.ExampleEvenOnesRedundant;
import de.fsmkit.examples.dfa.ExampleOnlyEmpty;
import de.fsmkit.examples.dfa.ExampleRandomDFA;
import de.fsmkit.examples.nfa.ExampleEndsWithOne;
import de.fsmkit.examples.nfa.ExampleEpsilonToFinal;
import net.automatalib.words.Word;

public class DispatchingEvaluatorTest {

    private static final List<String> INPUTS = Arrays.asList("0", "1", "2");

    private final DispatchingEvaluator evaluator = new DispatchingEvaluator();

    @DataProvider(name = "deterministic")
    public static Object[][] deterministicAutomata() {
        List<Object[]> automata = new ArrayList<>();
        automata.add(new Object[] {ExampleEvenOnes.constructMachine()});
        automata.add(new Object[] {ExampleEvenOnesRedundant.constructMachine()});
        automata.add(new Object[] {ExampleEvenLength.constructMachine()});
        automata.add(new Object[] {ExampleOnlyEmpty.constructMachine()});
        automata.add(new Object[] {ExampleEmptyOrZero.constructMachine()});

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            automata.add(new Object[] {
                    ExampleRandomDFA.constructMachine(random, Arrays.asList("0", "1"), 1 + random.nextInt(6), 0.5, 0.8)});
        }
        return automata.toArray(new Object[0][]);
    }

    @Test(dataProvider = "deterministic")
    public void testEvaluatorsAgreeOnDeterministicAutomata(Automaton automaton) {
        Assert.assertEquals(automaton.getKind(), AutomatonKind.DETERMINISTIC);

        DeterministicEvaluator dfa = new DeterministicEvaluator();
        NondeterministicEvaluator nfa = new NondeterministicEvaluator();
        for (Word<String> word : WordEnumerator.allWords(INPUTS, 6)) {
            Assert.assertEquals(nfa.evaluate(automaton, word).isAccepted(),
                    dfa.evaluate(automaton, word).isAccepted(), "Disagreement on " + word);
        }
    }

    @Test
    public void testDispatchesOnCachedKind() {
        Assert.assertEquals(evaluator.evaluate(ExampleEvenOnes.constructMachine(), "11").getEvaluatedAs(),
                AutomatonKind.DETERMINISTIC);
        Assert.assertEquals(evaluator.evaluate(ExampleEndsWithOne.constructMachine(), "11").getEvaluatedAs(),
                AutomatonKind.NONDETERMINISTIC);
    }

    @Test
    public void testScenarios() {
        Automaton evenOnes = ExampleEvenOnes.constructMachine();
        Assert.assertTrue(evaluator.evaluate(evenOnes, "11").isAccepted());
        Assert.assertFalse(evaluator.evaluate(evenOnes, "1").isAccepted());
        Assert.assertTrue(evaluator.evaluate(evenOnes, "").isAccepted());

        Assert.assertTrue(evaluator.evaluate(ExampleEpsilonToFinal.constructMachine(), "").isAccepted());
    }

    @Test
    public void testCustomEvaluators() {
        NondeterministicEvaluator nfa = new NondeterministicEvaluator();
        DispatchingEvaluator alwaysNfa = new DispatchingEvaluator(nfa, nfa);

        Assert.assertEquals(alwaysNfa.evaluate(ExampleEvenOnes.constructMachine(), "11").getEvaluatedAs(),
                AutomatonKind.NONDETERMINISTIC);
    }
}
