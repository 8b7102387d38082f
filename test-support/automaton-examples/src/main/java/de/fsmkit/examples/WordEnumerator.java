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
package de.fsmkit.examples;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import net.automatalib.words.Word;

/**
 * Enumerates every word up to a given length, shortest words first.
 *
 * @author FSMKit contributors
 */
public final class WordEnumerator {

    private WordEnumerator() {
    }

    public static List<Word<String>> allWords(Collection<String> alphabet, int maxLength) {
        List<Word<String>> words = new ArrayList<>();
        List<Word<String>> layer = Collections.singletonList(Word.epsilon());
        words.addAll(layer);
        for (int length = 1; length <= maxLength; length++) {
            List<Word<String>> next = new ArrayList<>(layer.size() * alphabet.size());
            for (Word<String> prefix : layer) {
                for (String symbol : alphabet) {
                    next.add(prefix.append(symbol));
                }
            }
            words.addAll(next);
            layer = next;
        }
        return words;
    }
}
