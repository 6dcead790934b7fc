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
package com.analogwright.augment;

import com.analogwright.AnalogWrightException;

/**
 * Thrown when a device type or net category has more instances than its index range can hold.
 */
public class RangeExhaustedException extends AnalogWrightException {

    private static final long serialVersionUID = -618150931727740924L;

    public RangeExhaustedException(String message) {
        super(message);
    }

    public RangeExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
