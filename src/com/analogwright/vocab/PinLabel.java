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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A pin-edge label, naming which pin (or tied group of pins) of a device a single edge to a net
 * represents. Labels are declared per {@link DeviceFamily} in the {@link DeviceCatalog}.
 */
public class PinLabel {

    private final String name;

    private final Set<String> pins;

    private DeviceFamily family;

    PinLabel(String name, String... pins) {
        this.name = name;
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, pins);
        this.pins = Collections.unmodifiableSet(set);
    }

    void setFamily(DeviceFamily family) {
        this.family = family;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The device pins tied together by this label, never empty.
     */
    public Set<String> getPins() {
        return pins;
    }

    public DeviceFamily getFamily() {
        return family;
    }

    /**
     * @return True if this label ties more than one pin to the same net.
     */
    public boolean isCompound() {
        return pins.size() > 1;
    }

    @Override
    public String toString() {
        return name;
    }
}
