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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A group of device types sharing one pin set and one table of legal pin-edge labels (NM and PM
 * are both MOSFETs, for instance). The label table is explicit configuration: a label absent from
 * it is illegal for the family even if its pins exist.
 */
public class DeviceFamily {

    private final String name;

    /** Pin name to the number of distinct nets the pin must reach, in netlist order */
    private final Map<String, Integer> pinCapacities;

    private final List<PinLabel> labels;

    private final Map<String, PinLabel> labelsByName;

    private DeviceFamily(String name, Map<String, Integer> pinCapacities, List<PinLabel> labels) {
        this.name = name;
        this.pinCapacities = Collections.unmodifiableMap(pinCapacities);
        this.labels = Collections.unmodifiableList(labels);
        this.labelsByName = new LinkedHashMap<>();
        for (PinLabel label : labels) {
            label.setFamily(this);
            labelsByName.put(label.getName(), label);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return Pin names in the order the netlist lists them.
     */
    public List<String> getPins() {
        return new ArrayList<>(pinCapacities.keySet());
    }

    /**
     * Gets the number of distinct nets a pin must be bound to for a device to be complete.
     * Ordinary pins have a capacity of one; the interchangeable terminal of a two-terminal
     * passive has a capacity of two.
     * @param pin Name of the pin.
     * @return The capacity, or 0 if the family has no such pin.
     */
    public int getPinCapacity(String pin) {
        return pinCapacities.getOrDefault(pin, 0);
    }

    public List<PinLabel> getLabels() {
        return labels;
    }

    public PinLabel getLabel(String labelName) {
        return labelsByName.get(labelName);
    }

    public boolean hasLabel(PinLabel label) {
        return label != null && label.getFamily() == this;
    }

    /**
     * Finds the first declared label covering exactly the given pins. Aliases declared later in
     * the table (such as D_PN after D_NP) are never returned.
     * @param pins The set of pins tied to one net.
     * @return The canonical label, or null if the table has none for this pin group.
     */
    public PinLabel getLabelForPins(Set<String> pins) {
        for (PinLabel label : labels) {
            if (label.getPins().equals(pins)) {
                return label;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }

    static Builder builder(String name) {
        return new Builder(name);
    }

    static class Builder {
        private final String name;
        private final Map<String, Integer> pinCapacities = new LinkedHashMap<>();
        private final List<PinLabel> labels = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        Builder pins(String... pins) {
            for (String pin : pins) {
                pinCapacities.put(pin, 1);
            }
            return this;
        }

        Builder pin(String pin, int capacity) {
            pinCapacities.put(pin, capacity);
            return this;
        }

        Builder label(String labelName, String... pins) {
            for (String pin : pins) {
                if (!pinCapacities.containsKey(pin)) {
                    throw new IllegalStateException("Label " + labelName + " refers to undeclared pin "
                            + pin + " of family " + name);
                }
            }
            labels.add(new PinLabel(labelName, pins));
            return this;
        }

        DeviceFamily build() {
            return new DeviceFamily(name, pinCapacities, labels);
        }
    }
}
