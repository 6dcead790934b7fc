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

/**
 * Selects how much circuit context the grammar takes into account beyond the token-kind
 * alternation. The default grammar is purely structural. The strict grammar also follows pin
 * bindings: it never offers a device, label or net that would bind a pin to a net conflicting with
 * its earlier bindings, and offers TRUNCATE only when every device seen so far is complete.
 */
public class GrammarOptions {

    private static final GrammarOptions DEFAULTS = new GrammarOptions(false, false);

    private static final GrammarOptions STRICT = new GrammarOptions(true, true);

    private final boolean checkPinBindings;

    private final boolean requireCompleteDevices;

    public GrammarOptions(boolean checkPinBindings, boolean requireCompleteDevices) {
        this.checkPinBindings = checkPinBindings;
        this.requireCompleteDevices = requireCompleteDevices;
    }

    public static GrammarOptions defaults() {
        return DEFAULTS;
    }

    public static GrammarOptions strict() {
        return STRICT;
    }

    public boolean isCheckingPinBindings() {
        return checkPinBindings;
    }

    public boolean isRequiringCompleteDevices() {
        return requireCompleteDevices;
    }

    /**
     * @return True if cursors have to follow device pin bindings.
     */
    public boolean isTrackingDevices() {
        return checkPinBindings || requireCompleteDevices;
    }

    @Override
    public String toString() {
        return "GrammarOptions[checkPinBindings=" + checkPinBindings
                + ", requireCompleteDevices=" + requireCompleteDevices + "]";
    }
}
