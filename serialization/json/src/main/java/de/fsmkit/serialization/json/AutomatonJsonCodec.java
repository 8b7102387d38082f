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
package de.fsmkit.serialization.json;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import de.fsmkit.api.automaton.Automaton;
import de.fsmkit.api.automaton.State;
import de.fsmkit.api.automaton.Transition;
import de.fsmkit.serialization.json.AutomatonDocument.StateEntry;
import de.fsmkit.serialization.json.AutomatonDocument.TransitionEntry;
import de.learnlib.api.logging.LearnLogger;

/**
 * Reads and writes automata in the JSON exchange format of the editor:
 *
 * <pre>
 * {
 *   "states": [{"id": "q0", "isStartState": true, "isFinalState": false,
 *               "x": 100, "y": 80, "hasLoopOnAllInputs": false}],
 *   "alphabet": ["0", "1"],
 *   "transitions": [{"from": "q0", "to": "q0", "symbol": "0"}]
 * }
 * </pre>
 *
 * Missing arrays are read as empty, a missing {@code hasLoopOnAllInputs} as
 * {@code false}, and unknown fields are ignored. Readers and writers passed in
 * are left open.
 *
 * @author FSMKit contributors
 */
public final class AutomatonJsonCodec {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(AutomatonJsonCodec.class);

    private final ObjectMapper mapper;

    public AutomatonJsonCodec() {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                                        .configure(SerializationFeature.INDENT_OUTPUT, true)
                                        .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                                        .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    /**
     * Reads an automaton.
     *
     * @param reader The source of the document
     * @return The automaton
     * @throws AutomatonFormatException if the document is not a valid automaton
     * @throws IOException              if reading fails
     */
    public Automaton read(Reader reader) throws IOException {
        AutomatonDocument document;
        try {
            document = mapper.readValue(Objects.requireNonNull(reader), AutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Invalid automaton document: " + e.getOriginalMessage(), e);
        }
        return toAutomaton(document);
    }

    /**
     * Reads an automaton from a string.
     *
     * @param json The document
     * @return The automaton
     * @throws AutomatonFormatException if the document is not a valid automaton
     */
    public Automaton read(String json) throws AutomatonFormatException {
        AutomatonDocument document;
        try {
            document = mapper.readValue(Objects.requireNonNull(json), AutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Invalid automaton document: " + e.getOriginalMessage(), e);
        }
        return toAutomaton(document);
    }

    public void write(Automaton automaton, Writer writer) throws IOException {
        mapper.writeValue(Objects.requireNonNull(writer), toDocument(automaton));
    }

    public String writeToString(Automaton automaton) {
        StringWriter writer = new StringWriter();
        try {
            write(automaton, writer);
        } catch (IOException e) {
            throw new IllegalStateException("Could not serialize automaton", e);
        }
        return writer.toString();
    }

    private static Automaton toAutomaton(@Nullable AutomatonDocument document) throws AutomatonFormatException {
        if (document == null) {
            throw new AutomatonFormatException("Empty automaton document");
        }

        List<State> states = new ArrayList<>();
        for (StateEntry entry : orEmpty(document.getStates())) {
            if (entry == null || entry.getId() == null) {
                throw new AutomatonFormatException("State without id");
            }
            states.add(new State(entry.getId(), entry.isStartState(), entry.isFinalState(),
                    entry.isLoopOnAllInputs(), entry.getX(), entry.getY()));
        }

        List<String> alphabet = new ArrayList<>();
        for (String symbol : orEmpty(document.getAlphabet())) {
            if (symbol == null) {
                throw new AutomatonFormatException("Null alphabet symbol");
            }
            alphabet.add(symbol);
        }

        List<Transition> transitions = new ArrayList<>();
        for (TransitionEntry entry : orEmpty(document.getTransitions())) {
            if (entry == null || entry.getFrom() == null || entry.getTo() == null || entry.getSymbol() == null) {
                throw new AutomatonFormatException("Transition needs from, to and symbol");
            }
            transitions.add(new Transition(entry.getFrom(), entry.getTo(), entry.getSymbol()));
        }

        try {
            Automaton automaton = new Automaton(states, alphabet, transitions);
            LOGGER.debug("Read {} with {} states and {} transitions", automaton.getKind(), automaton.size(),
                    transitions.size());
            return automaton;
        } catch (IllegalArgumentException e) {
            throw new AutomatonFormatException(e.getMessage(), e);
        }
    }

    private static AutomatonDocument toDocument(Automaton automaton) {
        List<StateEntry> states = new ArrayList<>(automaton.size());
        for (State state : automaton.getStates()) {
            StateEntry entry = new StateEntry();
            entry.setId(state.getId());
            entry.setStartState(state.isStart());
            entry.setFinalState(state.isAccepting());
            entry.setX(state.getX());
            entry.setY(state.getY());
            entry.setLoopOnAllInputs(state.hasLoopOnAllInputs());
            states.add(entry);
        }

        List<TransitionEntry> transitions = new ArrayList<>(automaton.getTransitions().size());
        for (Transition t : automaton.getTransitions()) {
            TransitionEntry entry = new TransitionEntry();
            entry.setFrom(t.getSource());
            entry.setTo(t.getTarget());
            entry.setSymbol(t.getSymbol());
            transitions.add(entry);
        }

        AutomatonDocument document = new AutomatonDocument();
        document.setStates(states);
        document.setAlphabet(new ArrayList<>(automaton.getAlphabet()));
        document.setTransitions(transitions);
        return document;
    }

    private static <T> List<T> orEmpty(@Nullable List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
