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
 * A device type of the catalog (NM, NPN, R, ...) with its family and the bounded range of
 * instance indices the vocabulary enumerates for it.
 */
public class DeviceType {

    private final String name;

    private final DeviceFamily family;

    private final int minIndex;

    private final int maxIndex;

    DeviceType(String name, DeviceFamily family, int minIndex, int maxIndex) {
        if (minIndex < 1 || maxIndex < minIndex) {
            throw new IllegalStateException("Invalid index range [" + minIndex + "," + maxIndex
                    + "] for device type " + name);
        }
        this.name = name;
        this.family = family;
        this.minIndex = minIndex;
        this.maxIndex = maxIndex;
    }

    public String getName() {
        return name;
    }

    public DeviceFamily getFamily() {
        return family;
    }

    public int getMinIndex() {
        return minIndex;
    }

    public int getMaxIndex() {
        return maxIndex;
    }

    /**
     * @return Number of distinct instances this type can hold.
     */
    public int getRangeSize() {
        return maxIndex - minIndex + 1;
    }

    public boolean isInRange(int index) {
        return index >= minIndex && index <= maxIndex;
    }

    public String getTokenName(int index) {
        return name + index;
    }

    @Override
    public String toString() {
        return name;
    }
}
