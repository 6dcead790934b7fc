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
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.jgrapht.Graph;
import org.jgrapht.alg.isomorphism.VF2GraphIsomorphismInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

/**
 * Comparisons between circuit graphs.
 */
public class CircuitGraphs {

    /**
     * Edge of the simple projection of a circuit graph: all pin-edges between one device and one
     * net merged into one edge carrying their sorted label names.
     */
    static class MergedEdge extends DefaultEdge {

        private static final long serialVersionUID = 7313204528830716254L;

        private final List<String> labels = new ArrayList<>();

        String getKey() {
            return String.join("+", labels);
        }
    }

    private static final Comparator<CircuitNode> NODE_KIND = new Comparator<CircuitNode>() {
        @Override
        public int compare(CircuitNode a, CircuitNode b) {
            if (a.isDevice() != b.isDevice()) {
                return a.isDevice() ? -1 : 1;
            }
            return a.getKindName().compareTo(b.getKindName());
        }
    };

    private static final Comparator<MergedEdge> EDGE_LABELS = new Comparator<MergedEdge>() {
        @Override
        public int compare(MergedEdge a, MergedEdge b) {
            return a.getKey().compareTo(b.getKey());
        }
    };

    static Graph<CircuitNode, MergedEdge> project(CircuitGraph circuit) {
        Graph<CircuitNode, MergedEdge> simple = new SimpleGraph<>(null, null, false);
        for (CircuitNode node : circuit.getNodes()) {
            simple.addVertex(node);
        }
        for (PinEdge e : circuit.getEdges()) {
            MergedEdge merged = simple.getEdge(e.getDevice(), e.getNet());
            if (merged == null) {
                merged = new MergedEdge();
                simple.addEdge(e.getDevice(), e.getNet(), merged);
            }
            merged.labels.add(e.getLabel().getName());
            Collections.sort(merged.labels);
        }
        return simple;
    }

    /**
     * Checks whether two circuits are the same up to a renaming of device and net indices that
     * preserves device types and net categories. Singleton nets (VDD, VSS) can only map to
     * themselves since their category holds a single net. The circuit type tag is not compared.
     * @param a First circuit.
     * @param b Second circuit.
     * @return True if an isomorphism preserving node kinds and edge labels exists.
     */
    public static boolean isIsomorphic(CircuitGraph a, CircuitGraph b) {
        if (a.getNodeCount() != b.getNodeCount() || a.getEdgeCount() != b.getEdgeCount()) {
            return false;
        }
        if (!kindHistogram(a).equals(kindHistogram(b))) {
            return false;
        }
        VF2GraphIsomorphismInspector<CircuitNode, MergedEdge> inspector =
                new VF2GraphIsomorphismInspector<>(project(a), project(b), NODE_KIND, EDGE_LABELS);
        return inspector.isomorphismExists();
    }

    /**
     * Checks whether two circuits have exactly the same nodes and the same multiset of
     * (device, label, net) connections, irrespective of insertion order.
     */
    public static boolean haveSameConnections(CircuitGraph a, CircuitGraph b) {
        if (a.getEdgeCount() != b.getEdgeCount()
                || !new HashSet<>(a.getNodes()).equals(new HashSet<>(b.getNodes()))) {
            return false;
        }
        return connectionHistogram(a).equals(connectionHistogram(b));
    }

    private static Map<String, Integer> kindHistogram(CircuitGraph g) {
        Map<String, Integer> counts = new HashMap<>();
        for (CircuitNode node : g.getNodes()) {
            counts.merge(node.getKindName(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Integer> connectionHistogram(CircuitGraph g) {
        Map<String, Integer> counts = new HashMap<>();
        for (PinEdge e : g.getEdges()) {
            counts.merge(e.toString(), 1, Integer::sum);
        }
        return counts;
    }
}
