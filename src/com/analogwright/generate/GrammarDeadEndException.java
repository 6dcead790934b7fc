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
package com.analogwright.generate;

import com.analogwright.AnalogWrightException;
import com.analogwright.grammar.GrammarState;

/**
 * Thrown when the oracle assigns no probability to any token the grammar allows next. This points
 * at the model rather than at the grammar; callers typically retry with another seed.
 */
public class GrammarDeadEndException extends AnalogWrightException {

    private static final long serialVersionUID = 2270795521738620973L;

    private final int position;

    private final GrammarState state;

    public GrammarDeadEndException(String message, int position, GrammarState state) {
        super(message + " (at token " + position + ", state " + state + ")");
        this.position = position;
        this.state = state;
    }

    public int getPosition() {
        return position;
    }

    public GrammarState getState() {
        return state;
    }
}
