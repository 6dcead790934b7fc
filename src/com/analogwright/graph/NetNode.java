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

import com.analogwright.vocab.NetCategory;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.UnknownTokenException;
import com.analogwright.vocab.Vocabulary;

/**
 * An electrical node. VDD and VSS are singleton nets with index 0; every other net carries an
 * index within its category's range (NET4, VOUT1, ...).
 */
public class NetNode extends CircuitNode {

    private final NetCategory category;

    public NetNode(NetCategory category, int index) {
        super(index);
        if (!category.isInRange(index)) {
            throw new UnknownTokenException("Index " + index + " of net category " + category
                    + " is outside its range");
        }
        this.category = category;
    }

    /**
     * Creates a singleton net (VDD or VSS).
     * @param category A singleton category.
     */
    public NetNode(NetCategory category) {
        this(category, 0);
    }

    public NetCategory getCategory() {
        return category;
    }

    public boolean isSingleton() {
        return category.isSingleton();
    }

    @Override
    public String getName() {
        return category.getTokenName(index);
    }

    @Override
    public boolean isDevice() {
        return false;
    }

    @Override
    public String getKindName() {
        return category.getName();
    }

    @Override
    public Token toToken(Vocabulary vocab) {
        return vocab.getNetToken(category, index);
    }

    @Override
    public int hashCode() {
        return category.hashCode() * 31 + index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        NetNode other = (NetNode) obj;
        return index == other.index && category == other.category;
    }
}
