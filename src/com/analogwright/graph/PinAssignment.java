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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.analogwright.vocab.DeviceFamily;
import com.analogwright.vocab.PinLabel;

/**
 * Tracks which nets each pin of one device is bound to. A pin may be bound to at most
 * {@link DeviceFamily#getPinCapacity(String)} distinct nets; once full it may only be bound again
 * to one of those nets.
 */
public class PinAssignment {

    private final DeviceFamily family;

    private final Map<String, Set<NetNode>> bindings;

    public PinAssignment(DeviceFamily family) {
        this.family = family;
        this.bindings = new LinkedHashMap<>();
        for (String pin : family.getPins()) {
            bindings.put(pin, new LinkedHashSet<>());
        }
    }

    public PinAssignment(PinAssignment other) {
        this.family = other.family;
        this.bindings = new LinkedHashMap<>();
        for (Map.Entry<String, Set<NetNode>> e : other.bindings.entrySet()) {
            bindings.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
        }
    }

    public DeviceFamily getFamily() {
        return family;
    }

    /**
     * Checks whether every pin of the label can be bound to the net.
     * @param label A label of this device's family.
     * @param net The net the label connects to.
     * @return The first pin that is already bound to its full capacity of other nets, or null if
     *         the binding is consistent.
     */
    public String getConflictingPin(PinLabel label, NetNode net) {
        for (String pin : label.getPins()) {
            Set<NetNode> nets = bindings.get(pin);
            if (!nets.contains(net) && nets.size() >= family.getPinCapacity(pin)) {
                return pin;
            }
        }
        return null;
    }

    public boolean canBind(PinLabel label, NetNode net) {
        return getConflictingPin(label, net) == null;
    }

    /**
     * Checks whether at least one net exists that the label could be bound to: every pin already
     * at capacity must share a net with all other full pins of the label.
     * @param label A label of this device's family.
     * @return True if some net (possibly a new one) would be accepted by {@link #canBind}.
     */
    public boolean canBindSomewhere(PinLabel label) {
        Set<NetNode> common = null;
        for (String pin : label.getPins()) {
            Set<NetNode> nets = bindings.get(pin);
            if (nets.size() < family.getPinCapacity(pin)) continue;
            if (common == null) {
                common = new LinkedHashSet<>(nets);
            } else {
                common.retainAll(nets);
            }
        }
        return common == null || !common.isEmpty();
    }

    /**
     * Binds every pin of the label to the net. Callers check {@link #canBind(PinLabel, NetNode)}
     * first.
     */
    public void bind(PinLabel label, NetNode net) {
        for (String pin : label.getPins()) {
            bindings.get(pin).add(net);
        }
    }

    public Set<NetNode> getNets(String pin) {
        return bindings.get(pin);
    }

    public boolean isComplete() {
        return getMissingPins().isEmpty();
    }

    /**
     * @return Pins bound to fewer nets than their capacity, in netlist pin order.
     */
    public List<String> getMissingPins() {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, Set<NetNode>> e : bindings.entrySet()) {
            if (e.getValue().size() < family.getPinCapacity(e.getKey())) {
                missing.add(e.getKey());
            }
        }
        return missing;
    }
}
