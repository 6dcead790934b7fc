/*
 * Copyright (c) 2026, AnalogWright contributors.
 * All rights reserved.
 *
 * This file is part of AnalogWright.
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
 *
 */
package com.analogwright.grammar;

import com.analogwright.AnalogWrightException;
import com.analogwright.vocab.Token;

/**
 * Thrown when a token is not allowed by the grammar in the current state. Carries the position of
 * the offending token within its sequence.
 */
public class GrammarViolationException extends AnalogWrightException {

    private static final long serialVersionUID = -5521073993145806412L;

    private final int position;

    private final transient Token token;

    private final GrammarState state;

    public GrammarViolationException(String message, int position, Token token, GrammarState state) {
        super(message + " (at token " + position + ")");
        this.position = position;
        this.token = token;
        this.state = state;
    }

    public int getPosition() {
        return position;
    }

    /**
     * @return The rejected token, or null if the sequence ended where a token was required.
     */
    public Token getToken() {
        return token;
    }

    public GrammarState getState() {
        return state;
    }
}
