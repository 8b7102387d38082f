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

import org.testng.Assert;
import org.testng.annotations.Test;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonBuilder;
import de.fsmkit.api.automaton.AutomatonKind;
import de.fsmkit.api.automaton.Symbols;
import de.fsmkit.api.result.EvaluationError;
import de.fsmkit.api.result.MembershipResult;
import de.fsmkit.examples.nfa.ExampleAStarBStar;
import de.fsmkit.examples.nfa.ExampleEndsWithOne;
import de.fsmkit.examples.nfa.ExampleEpsilonToFinal;

public class NondeterministicEvaluatorTest {

    private final NondeterministicEvaluator evaluator = new NondeterministicEvaluator();

    @Test
    public void testEpsilonTransitionToAcceptingState() {
        Automaton automaton = ExampleEpsilonToFinal.constructMachine();

        Assert.assertTrue(evaluator.evaluate(automaton, "").isAccepted());
        // the closure has no transition on 0, so the set of states becomes empty
        Assert.assertFalse(evaluator.evaluate(automaton, "0").isAccepted());
    }

    @Test
    public void testSeveralTransitionsOnTheSameSymbol() {
        Automaton automaton = ExampleEndsWithOne.constructMachine();

        Assert.assertTrue(evaluator.evaluate(automaton, "1").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "0101").isAccepted());
        Assert.assertFalse(evaluator.evaluate(automaton, "10").isAccepted());
        Assert.assertFalse(evaluator.evaluate(automaton, "").isAccepted());
    }

    @Test
    public void testClosureIsAppliedAfterEverySymbol() {
        Automaton automaton = ExampleAStarBStar.constructMachine();

        Assert.assertTrue(evaluator.evaluate(automaton, "").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "aab").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "bbb").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "aaa").isAccepted());
        Assert.assertFalse(evaluator.evaluate(automaton, "ba").isAccepted());
        Assert.assertFalse(evaluator.evaluate(automaton, "abab").isAccepted());
    }

    @Test
    public void testSymbolOutsideOfAlphabetRejects() {
        Automaton automaton = ExampleAStarBStar.constructMachine();

        Assert.assertFalse(evaluator.evaluate(automaton, "ac").isAccepted());
        Assert.assertFalse(evaluator.evaluate(automaton, Symbols.EPSILON).isAccepted());
    }

    @Test
    public void testEpsilonCycle() {
        // @formatter:off
        Automaton automaton = new AutomatonBuilder()
                .withInitialState("a", false)
                .withState("b")
                .withAcceptingState("c")
                .withTransition("a", "b", Symbols.EPSILON)
                .withTransition("b", "a", Symbols.EPSILON)
                .withTransition("b", "c", "x")
                .withTransition("c", "a", Symbols.EPSILON)
                .create();
        // @formatter:on

        Assert.assertFalse(evaluator.evaluate(automaton, "").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "x").isAccepted());
        Assert.assertTrue(evaluator.evaluate(automaton, "xxx").isAccepted());
    }

    @Test
    public void testNoStartState() {
        Automaton automaton = new AutomatonBuilder().withAcceptingState("q0")
                .withTransition("q0", "q0", Symbols.EPSILON).create();

        MembershipResult result = evaluator.evaluate(automaton, "");
        Assert.assertFalse(result.isAccepted());
        Assert.assertEquals(result.getError(), EvaluationError.NO_START_STATE);
        Assert.assertEquals(result.getEvaluatedAs(), AutomatonKind.NONDETERMINISTIC);
    }
}
