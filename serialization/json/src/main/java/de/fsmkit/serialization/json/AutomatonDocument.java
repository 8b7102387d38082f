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

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Jackson binding of the exchange format.
 *
 * @author FSMKit contributors
 */
@JsonPropertyOrder({"states", "alphabet", "transitions"})
final class AutomatonDocument {

    @JsonProperty("states")
    private @Nullable List<StateEntry> states = new ArrayList<>();

    @JsonProperty("alphabet")
    private @Nullable List<String> alphabet = new ArrayList<>();

    @JsonProperty("transitions")
    private @Nullable List<TransitionEntry> transitions = new ArrayList<>();

    public @Nullable List<StateEntry> getStates() {
        return states;
    }

    public void setStates(@Nullable List<StateEntry> states) {
        this.states = states;
    }

    public @Nullable List<String> getAlphabet() {
        return alphabet;
    }

    public void setAlphabet(@Nullable List<String> alphabet) {
        this.alphabet = alphabet;
    }

    public @Nullable List<TransitionEntry> getTransitions() {
        return transitions;
    }

    public void setTransitions(@Nullable List<TransitionEntry> transitions) {
        this.transitions = transitions;
    }

    @JsonPropertyOrder({"id", "isStartState", "isFinalState", "x", "y", "hasLoopOnAllInputs"})
    static final class StateEntry {

        @JsonProperty("id")
        private @Nullable String id;

        @JsonProperty("isStartState")
        private boolean startState;

        @JsonProperty("isFinalState")
        private boolean finalState;

        @JsonProperty("x")
        private double x;

        @JsonProperty("y")
        private double y;

        @JsonProperty("hasLoopOnAllInputs")
        private boolean loopOnAllInputs;

        public @Nullable String getId() {
            return id;
        }

        public void setId(@Nullable String id) {
            this.id = id;
        }

        public boolean isStartState() {
            return startState;
        }

        public void setStartState(boolean startState) {
            this.startState = startState;
        }

        public boolean isFinalState() {
            return finalState;
        }

        public void setFinalState(boolean finalState) {
            this.finalState = finalState;
        }

        public double getX() {
            return x;
        }

        public void setX(double x) {
            this.x = x;
        }

        public double getY() {
            return y;
        }

        public void setY(double y) {
            this.y = y;
        }

        public boolean isLoopOnAllInputs() {
            return loopOnAllInputs;
        }

        public void setLoopOnAllInputs(boolean loopOnAllInputs) {
            this.loopOnAllInputs = loopOnAllInputs;
        }
    }

    @JsonPropertyOrder({"from", "to", "symbol"})
    static final class TransitionEntry {

        @JsonProperty("from")
        private @Nullable String from;

        @JsonProperty("to")
        private @Nullable String to;

        @JsonProperty("symbol")
        private @Nullable String symbol;

        public @Nullable String getFrom() {
            return from;
        }

        public void setFrom(@Nullable String from) {
            this.from = from;
        }

        public @Nullable String getTo() {
            return to;
        }

        public void setTo(@Nullable String to) {
            this.to = to;
        }

        public @Nullable String getSymbol() {
            return symbol;
        }

        public void setSymbol(@Nullable String symbol) {
            this.symbol = symbol;
        }
    }
}
