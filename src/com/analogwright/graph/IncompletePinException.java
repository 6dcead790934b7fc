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
package com.analogwright.graph;

import com.analogwright.AnalogWrightException;

/**
 * Thrown when a device still has pins that are not bound to any net (or to fewer nets than the
 * pin requires) at a point where the circuit must be complete.
 */
public class IncompletePinException extends AnalogWrightException {

    private static final long serialVersionUID = -4893115780152395001L;

    public IncompletePinException(String message) {
        super(message);
    }

    public IncompletePinException(String message, Throwable cause) {
        super(message, cause);
    }
}
