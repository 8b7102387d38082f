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
package de.fsmkit.examples.dfa;

import java.util.Collection;
import java.util.Random;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.AutomatonBuilder;
import de.fsmkit.examples.DefaultAutomatonExample;

/**
 * Generates a random, possibly partial, DFA.
 *
 * State {@code s0} is the start state. For every state and symbol, a transition
 * is defined with probability {@code definedProb}; its target is drawn
 * uniformly.
 *
 * @author FSMKit contributors
 */
public class ExampleRandomDFA extends DefaultAutomatonExample {

    public ExampleRandomDFA(Collection<String> alphabet, int size, double acceptanceProb, double definedProb) {
        this(new Random(), alphabet, size, acceptanceProb, definedProb);
    }

    public ExampleRandomDFA(Random rand, Collection<String> alphabet, int size, double acceptanceProb,
            double definedProb) {
        super(constructMachine(rand, alphabet, size, acceptanceProb, definedProb));
    }

    public static Automaton constructMachine(Random rand, Collection<String> alphabet, int size,
            double acceptanceProb, double definedProb) {
        if (size <= 0) {
            throw new IllegalArgumentException("A random DFA needs at least one state");
        }
        AutomatonBuilder builder = new AutomatonBuilder();
        for (int i = 0; i < size; i++) {
            boolean accepting = rand.nextDouble() < acceptanceProb;
            if (i == 0) {
                builder.withInitialState(stateName(i), accepting);
            } else {
                builder.withState(stateName(i), accepting);
            }
        }
        for (String symbol : alphabet) {
            builder.withSymbol(symbol);
        }
        for (int i = 0; i < size; i++) {
            for (String symbol : alphabet) {
                if (rand.nextDouble() < definedProb) {
                    builder.withTransition(stateName(i), stateName(rand.nextInt(size)), symbol);
                }
            }
        }
        return builder.create();
    }

    private static String stateName(int index) {
        return "s" + index;
    }
}
