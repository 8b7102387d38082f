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
package de.fsmkit.api.automaton;

import java.util.ArrayList;
import java.util.List;

import net.automatalib.words.Word;

/**
 * Symbol conventions shared by every part of FSMKit.
 *
 * @author FSMKit contributors
 */
public final class Symbols {

    /**
     * The label of a transition that is taken without reading any input. It is
     * never a member of an alphabet.
     */
    public static final String EPSILON = "ε";

    private Symbols() {
    }

    public static boolean isEpsilon(String symbol) {
        return EPSILON.equals(symbol);
    }

    /**
     * Whether the symbol may appear in an alphabet, i.e., it is neither empty nor
     * the epsilon marker.
     *
     * @param symbol The symbol
     * @return True iff the symbol is a valid alphabet member
     */
    public static boolean isAlphabetSymbol(String symbol) {
        return symbol != null && !symbol.isEmpty() && !isEpsilon(symbol);
    }

    /**
     * Splits an input string into a word, one symbol per Unicode code point.
     *
     * @param input The input string
     * @return The word read by the evaluators
     */
    public static Word<String> toWord(String input) {
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return Word.fromList(symbols);
    }

    /**
     * Concatenates the symbols of a word back into a string.
     *
     * @param word The word
     * @return The string
     */
    public static String toString(Word<String> word) {
        StringBuilder builder = new StringBuilder();
        for (String symbol : word) {
            builder.append(symbol);
        }
        return builder.toString();
    }
}
