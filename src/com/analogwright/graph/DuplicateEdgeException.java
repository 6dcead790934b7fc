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
 * Thrown when a device pin would be bound to a net that conflicts with the nets it is already
 * bound to. When raised while decoding a sequence the exception carries the position of the
 * offending token, otherwise the position is -1.
 */
public class DuplicateEdgeException extends AnalogWrightException {

    private static final long serialVersionUID = 6021548309113447270L;

    private final int position;

    public DuplicateEdgeException(String message) {
        this(message, -1);
    }

    public DuplicateEdgeException(String message, int position) {
        super(position < 0 ? message : message + " (at token " + position + ")");
        this.position = position;
    }

    public DuplicateEdgeException(String message, int position, Throwable cause) {
        super(position < 0 ? message : message + " (at token " + position + ")", cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
