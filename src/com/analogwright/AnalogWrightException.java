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
package com.analogwright;

/**
 * Root of the unchecked exceptions raised by the circuit sequence codec. Callers that process
 * batches catch this type to record a per-item failure and carry on with the remaining items.
 */
public class AnalogWrightException extends RuntimeException {

    private static final long serialVersionUID = -1739403387613209482L;

    public AnalogWrightException(String message) {
        super(message);
    }

    public AnalogWrightException(String message, Throwable cause) {
        super(message, cause);
    }
}
