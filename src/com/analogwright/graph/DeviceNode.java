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

import com.analogwright.vocab.DeviceFamily;
import com.analogwright.vocab.DeviceType;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.UnknownTokenException;
import com.analogwright.vocab.Vocabulary;

/**
 * A circuit component instance, identified by its device type and index (NM3, R12, ...).
 */
public class DeviceNode extends CircuitNode {

    private final DeviceType type;

    public DeviceNode(DeviceType type, int index) {
        super(index);
        if (!type.isInRange(index)) {
            throw new UnknownTokenException("Index " + index + " of device type " + type
                    + " is outside [" + type.getMinIndex() + "," + type.getMaxIndex() + "]");
        }
        this.type = type;
    }

    public DeviceType getType() {
        return type;
    }

    public DeviceFamily getFamily() {
        return type.getFamily();
    }

    @Override
    public String getName() {
        return type.getTokenName(index);
    }

    @Override
    public boolean isDevice() {
        return true;
    }

    @Override
    public String getKindName() {
        return type.getName();
    }

    @Override
    public Token toToken(Vocabulary vocab) {
        return vocab.getDeviceToken(type, index);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        DeviceNode other = (DeviceNode) obj;
        return index == other.index && type == other.type;
    }
}
