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

import org.jetbrains.annotations.NotNull;
import org.jgrapht.graph.DefaultEdge;

import com.analogwright.vocab.PinLabel;

/**
 * Edge within a {@link CircuitGraph} connecting exactly one device to exactly one net, labeled by
 * the device pin (or tied pin group) it represents.
 */
public class PinEdge extends DefaultEdge {

    private static final long serialVersionUID = -2301754476419860316L;

    private final DeviceNode device;

    private final NetNode net;

    private final PinLabel label;

    public PinEdge(@NotNull DeviceNode device, @NotNull NetNode net, @NotNull PinLabel label) {
        this.device = device;
        this.net = net;
        this.label = label;
    }

    public DeviceNode getDevice() {
        return device;
    }

    public NetNode getNet() {
        return net;
    }

    public PinLabel getLabel() {
        return label;
    }

    /**
     * Gets the endpoint opposite to the given one.
     * @param node One endpoint of this edge.
     * @return The other endpoint.
     */
    public CircuitNode getOpposite(CircuitNode node) {
        if (device.equals(node)) return net;
        if (net.equals(node)) return device;
        throw new IllegalArgumentException(node + " is not an endpoint of " + this);
    }

    /**
     * @return True if both edges join the same device and net under the same label.
     */
    public boolean isSameConnection(PinEdge other) {
        return device.equals(other.device) && net.equals(other.net) && label == other.label;
    }

    @Override
    public String toString() {
        return "(" + device + " " + label + " " + net + ")";
    }
}
