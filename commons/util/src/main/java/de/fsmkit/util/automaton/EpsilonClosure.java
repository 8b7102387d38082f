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
package de.fsmkit.util.automaton;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import de.fsmkit.api.automaton.Transition;

/**
 * Computes the set of states reachable from a set of states using only epsilon
 * transitions.
 *
 * @author FSMKit contributors
 */
public final class EpsilonClosure {

    private EpsilonClosure() {
    }

    /**
     * Computes the epsilon-closure of the seeds.
     *
     * The result is the smallest set that contains the seeds and every target
     * of an epsilon transition leaving one of its members.
     *
     * @param index The transitions of the automaton
     * @param seeds The states to start from
     * @return A fresh, mutable set
     */
    public static Set<String> of(TransitionIndex index, Collection<String> seeds) {
        Set<String> closure = new LinkedHashSet<>(seeds);
        Deque<String> pending = new ArrayDeque<>(closure);

        while (!pending.isEmpty()) {
            String state = pending.pop();
            for (String target : index.epsilonSuccessors(state)) {
                if (closure.add(target)) {
                    pending.push(target);
                }
            }
        }
        return closure;
    }

    public static Set<String> of(Collection<Transition> transitions, Collection<String> seeds) {
        return of(TransitionIndex.of(transitions), seeds);
    }
}
