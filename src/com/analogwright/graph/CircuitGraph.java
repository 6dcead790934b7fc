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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.Pseudograph;

import com.analogwright.vocab.PinLabel;

/**
 * In-memory bipartite circuit graph: device nodes, net nodes and labeled pin-edges between them.
 * Parallel edges are allowed (a digital device with two pins tied to one net), edges between two
 * devices or two nets are impossible by construction. Nodes and edges keep their insertion order,
 * which the encoder relies on for reproducible traversals.
 */
public class CircuitGraph {

    private final Pseudograph<CircuitNode, PinEdge> graph;

    private final Map<CircuitNode, List<PinEdge>> incidence;

    private final List<PinEdge> edges;

    private final Map<DeviceNode, PinAssignment> assignments;

    private String circuitType;

    public CircuitGraph() {
        this(null);
    }

    /**
     * @param circuitType Functional category without the CIRCUIT_ prefix (Opamp, LDO, ...), or
     *                    null if untagged.
     */
    public CircuitGraph(String circuitType) {
        this.graph = new Pseudograph<>(null, null, false);
        this.incidence = new LinkedHashMap<>();
        this.edges = new ArrayList<>();
        this.assignments = new LinkedHashMap<>();
        this.circuitType = circuitType;
    }

    public String getCircuitType() {
        return circuitType;
    }

    public void setCircuitType(String circuitType) {
        this.circuitType = circuitType;
    }

    /**
     * Adds a node if it is not already present.
     * @param node The device or net.
     * @return True if the node was added.
     */
    public boolean addNode(CircuitNode node) {
        if (incidence.containsKey(node)) {
            return false;
        }
        graph.addVertex(node);
        incidence.put(node, new ArrayList<>());
        if (node.isDevice()) {
            DeviceNode device = (DeviceNode) node;
            assignments.put(device, new PinAssignment(device.getFamily()));
        }
        return true;
    }

    public boolean containsNode(CircuitNode node) {
        return incidence.containsKey(node);
    }

    /**
     * Connects a device pin (or tied pin group) to a net, adding either node if needed. Adding a
     * connection identical to an existing one returns the existing edge and changes nothing.
     * @param device The device.
     * @param net The net.
     * @param label A label of the device's family.
     * @return The edge representing the connection.
     * @throws DuplicateEdgeException if a pin of the label is already bound to as many other nets
     *         as it can take.
     */
    public PinEdge addEdge(DeviceNode device, NetNode net, PinLabel label) {
        if (!device.getFamily().hasLabel(label)) {
            throw new IllegalArgumentException("Pin label " + label + " is not legal for "
                    + device + " of family " + device.getFamily());
        }
        PinEdge edge = new PinEdge(device, net, label);
        List<PinEdge> deviceEdges = incidence.get(device);
        if (deviceEdges != null) {
            for (PinEdge e : deviceEdges) {
                if (e.isSameConnection(edge)) {
                    return e;
                }
            }
        }
        PinAssignment assignment = assignments.get(device);
        if (assignment == null) {
            assignment = new PinAssignment(device.getFamily());
        }
        String conflict = assignment.getConflictingPin(label, net);
        if (conflict != null) {
            throw new DuplicateEdgeException("Pin " + conflict + " of " + device + " is already bound to "
                    + assignment.getNets(conflict) + ", cannot also bind it to " + net + " via " + label);
        }
        addNode(device);
        addNode(net);
        assignments.get(device).bind(label, net);
        graph.addEdge(device, net, edge);
        incidence.get(device).add(edge);
        incidence.get(net).add(edge);
        edges.add(edge);
        return edge;
    }

    /**
     * @return All nodes in insertion order.
     */
    public List<CircuitNode> getNodes() {
        return new ArrayList<>(incidence.keySet());
    }

    public List<DeviceNode> getDevices() {
        List<DeviceNode> devices = new ArrayList<>();
        for (CircuitNode node : incidence.keySet()) {
            if (node.isDevice()) devices.add((DeviceNode) node);
        }
        return devices;
    }

    public List<NetNode> getNets() {
        List<NetNode> nets = new ArrayList<>();
        for (CircuitNode node : incidence.keySet()) {
            if (node.isNet()) nets.add((NetNode) node);
        }
        return nets;
    }

    /**
     * @return All edges in insertion order.
     */
    public List<PinEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * @return Edges touching the node in insertion order, empty if the node is absent.
     */
    public List<PinEdge> edgesOf(CircuitNode node) {
        List<PinEdge> list = incidence.get(node);
        return list == null ? Collections.<PinEdge>emptyList() : Collections.unmodifiableList(list);
    }

    public int getNodeCount() {
        return incidence.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public PinAssignment getPinAssignment(DeviceNode device) {
        return assignments.get(device);
    }

    /**
     * @return True if every pin of every device is bound to its full complement of nets.
     */
    public boolean isComplete() {
        return getIncompleteDevices().isEmpty();
    }

    public List<DeviceNode> getIncompleteDevices() {
        List<DeviceNode> incomplete = new ArrayList<>();
        for (Map.Entry<DeviceNode, PinAssignment> e : assignments.entrySet()) {
            if (!e.getValue().isComplete()) {
                incomplete.add(e.getKey());
            }
        }
        return incomplete;
    }

    /**
     * Throws if any device has unbound pins.
     * @throws IncompletePinException naming the first incomplete device and its missing pins.
     */
    public void requireComplete() {
        for (Map.Entry<DeviceNode, PinAssignment> e : assignments.entrySet()) {
            List<String> missing = e.getValue().getMissingPins();
            if (!missing.isEmpty()) {
                throw new IncompletePinException("Device " + e.getKey() + " has unassigned pins "
                        + missing);
            }
        }
    }

    /**
     * @return True if the graph has at least one node and all nodes form one connected component.
     */
    public boolean isConnected() {
        return !incidence.isEmpty() && new ConnectivityInspector<>(graph).isConnected();
    }

    public List<CircuitNode> getIsolatedNodes() {
        List<CircuitNode> isolated = new ArrayList<>();
        for (Map.Entry<CircuitNode, List<PinEdge>> e : incidence.entrySet()) {
            if (e.getValue().isEmpty()) isolated.add(e.getKey());
        }
        return isolated;
    }

    /**
     * Gets the connected components, each as a list of nodes.
     */
    public List<List<CircuitNode>> getComponents() {
        List<List<CircuitNode>> components = new ArrayList<>();
        for (Set<CircuitNode> set : new ConnectivityInspector<>(graph).connectedSets()) {
            components.add(new ArrayList<>(set));
        }
        return components;
    }

    /**
     * @return A read-only JGraphT view of this graph for use with graph algorithms.
     */
    public Graph<CircuitNode, PinEdge> asGraph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    @Override
    public String toString() {
        return "CircuitGraph[" + (circuitType == null ? "" : circuitType + ", ")
                + getDevices().size() + " devices, " + getNets().size() + " nets, "
                + edges.size() + " edges]";
    }
}
