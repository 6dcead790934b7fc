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
package com.analogwright.vocab;

/**
 * The role a token plays in a circuit sequence.
 */
public enum TokenKind {
    DEVICE,
    NET,
    PIN_EDGE,
    CIRCUIT_TYPE,
    CONTROL;

    /**
     * @return True for the two node kinds (devices and nets) of the bipartite graph.
     */
    public boolean isNode() {
        return this == DEVICE || this == NET;
    }
}
