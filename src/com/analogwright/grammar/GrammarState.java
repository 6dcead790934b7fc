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
 * States of the circuit sequence grammar. The four middle states alternate between node roles
 * (net or device just emitted) and edge roles (pin-edge emitted after a net or after a device).
 */
public enum GrammarState {
    /** Nothing consumed yet */
    START,
    /** Only the circuit type token has been consumed */
    AFTER_CIRCUIT_TYPE,
    /** Last token was a net */
    AT_NET,
    /** Last token was a device */
    AT_DEVICE,
    /** Last token was a pin-edge following a net; a device of the label's family comes next */
    AT_PIN_EDGE_FROM_NET,
    /** Last token was a pin-edge following a device; a net comes next */
    AT_PIN_EDGE_FROM_DEVICE,
    /** TRUNCATE has been consumed */
    TERMINAL;

    public boolean isAccepting() {
        return this == TERMINAL;
    }

    /**
     * @return True in the two states where the sequence may end.
     */
    public boolean isAtNode() {
        return this == AT_NET || this == AT_DEVICE;
    }
}
