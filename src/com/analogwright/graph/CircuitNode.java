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

import com.analogwright.vocab.Token;
import com.analogwright.vocab.UnknownTokenException;
import com.analogwright.vocab.Vocabulary;

/**
 * A vertex of the bipartite circuit graph: either a {@link DeviceNode} or a {@link NetNode}. Nodes
 * are value objects; two nodes with the same type (or category) and index are the same node.
 */
public abstract class CircuitNode {

    protected final int index;

    protected CircuitNode(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return The display name, identical to the name of the node's vocabulary token.
     */
    public abstract String getName();

    public abstract boolean isDevice();

    public boolean isNet() {
        return !isDevice();
    }

    /**
     * Gets the name of the device type or net category, the part of the identity that renaming
     * preserves.
     * @return The type or category name.
     */
    public abstract String getKindName();

    public abstract Token toToken(Vocabulary vocab);

    /**
     * Creates the node named by a device or net token.
     * @param token A device or net token.
     * @return The corresponding node.
     */
    public static CircuitNode of(Token token) {
        if (token.isDevice()) {
            return new DeviceNode(token.getDeviceType(), token.getIndex());
        }
        if (token.isNet()) {
            return new NetNode(token.getNetCategory(), token.getIndex());
        }
        throw new UnknownTokenException("Token " + token + " does not name a device or a net");
    }

    @Override
    public String toString() {
        return getName();
    }
}
