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
package com.analogwright.netlist;

import com.analogwright.AnalogWrightException;

/**
 * Thrown when a netlist cannot be turned into a circuit graph. The message names the file and the
 * line when they are known.
 */
public class NetlistParseException extends AnalogWrightException {

    private static final long serialVersionUID = -3470528815012987746L;

    public NetlistParseException(String message) {
        super(message);
    }

    public NetlistParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
