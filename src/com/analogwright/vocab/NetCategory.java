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
 * A category of net nodes. VDD and VSS are singletons whose token has no index; every other
 * category is indexed over a bounded range. Internal nets (NET1, NET2, ...) are distinguished from
 * the externally visible ports (VIN1, VOUT2, ...). A port category may also own a bare net named
 * like the category itself (VOUT), held at index 0. The bare net is a net of its own, distinct
 * from VOUT1.
 */
public class NetCategory {

    private final String name;

    private final boolean singleton;

    private final boolean internal;

    private final int minIndex;

    private final int maxIndex;

    private final boolean bareNet;

    /** Index of the bare net of a port category */
    public static final int BARE_INDEX = 0;

    private NetCategory(String name, boolean singleton, boolean internal, int minIndex, int maxIndex,
                        boolean bareNet) {
        this.name = name;
        this.singleton = singleton;
        this.internal = internal;
        this.minIndex = minIndex;
        this.maxIndex = maxIndex;
        this.bareNet = bareNet;
    }

    static NetCategory singleton(String name) {
        return new NetCategory(name, true, false, 0, 0, false);
    }

    static NetCategory internal(String name, int maxIndex) {
        return new NetCategory(name, false, true, 1, maxIndex, false);
    }

    static NetCategory port(String name, int maxIndex) {
        return new NetCategory(name, false, false, 1, maxIndex, false);
    }

    static NetCategory portWithBareNet(String name, int maxIndex) {
        return new NetCategory(name, false, false, 1, maxIndex, true);
    }

    public String getName() {
        return name;
    }

    public boolean isSingleton() {
        return singleton;
    }

    public boolean isInternal() {
        return internal;
    }

    /**
     * @return True if the category has a bare net (VOUT) next to its indexed ones.
     */
    public boolean hasBareNet() {
        return bareNet;
    }

    /**
     * @param index A net index of this category.
     * @return True if the index denotes the bare net.
     */
    public boolean isBareIndex(int index) {
        return bareNet && index == BARE_INDEX;
    }

    public int getMinIndex() {
        return minIndex;
    }

    public int getMaxIndex() {
        return maxIndex;
    }

    /**
     * @return Number of indexed nets, excluding any bare net.
     */
    public int getRangeSize() {
        return singleton ? 1 : maxIndex - minIndex + 1;
    }

    /**
     * @return Number of tokens of the category, the bare net included.
     */
    public int getTokenCount() {
        return bareNet ? getRangeSize() + 1 : getRangeSize();
    }

    /**
     * Checks an index against this category. Singleton nets only accept index 0, as does the bare
     * net of a port category.
     * @param index The net index.
     * @return True if a token exists for the index.
     */
    public boolean isInRange(int index) {
        if (singleton) return index == 0;
        return isBareIndex(index) || (index >= minIndex && index <= maxIndex);
    }

    public String getTokenName(int index) {
        return singleton || isBareIndex(index) ? name : name + index;
    }

    @Override
    public String toString() {
        return name;
    }
}
