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
package com.analogwright.check;

import java.util.ArrayList;
import java.util.List;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitNode;
import com.analogwright.graph.DeviceNode;

/**
 * Checks the structural properties every circuit handed to downstream tools must have: at least
 * one device, every device pin bound, no isolated node and a single connected component. It does
 * not apply electrical rules.
 */
public class StructuralChecker implements CircuitChecker {

    @Override
    public CheckResult check(CircuitGraph graph) {
        List<String> violations = new ArrayList<>();
        if (graph.getDevices().isEmpty()) {
            violations.add("Circuit has no devices");
        }
        for (DeviceNode device : graph.getIncompleteDevices()) {
            violations.add(device + " has unassigned pins "
                    + graph.getPinAssignment(device).getMissingPins());
        }
        for (CircuitNode node : graph.getIsolatedNodes()) {
            violations.add(node + " is isolated");
        }
        if (graph.getNodeCount() > 0 && !graph.isConnected()) {
            violations.add("Circuit has " + graph.getComponents().size() + " connected components");
        }
        return CheckResult.of(violations);
    }
}
