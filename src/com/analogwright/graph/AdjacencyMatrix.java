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
import java.util.List;

import com.analogwright.util.FileTools;
import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.UnknownTokenException;
import com.analogwright.vocab.Vocabulary;

/**
 * Reads and writes the typed-edge adjacency matrix, a CSV persistence format for circuit graphs.
 * The header row lists every node name (devices and nets, in graph order) after a corner cell that
 * holds the circuit type token, if any. The matrix is symmetric; a cell joining a device and a net
 * holds the pin label, parallel edges are joined with {@value #PARALLEL_SEPARATOR}, and absent
 * connections are written as {@value #NO_EDGE}.
 */
public class AdjacencyMatrix {

    public static final String NO_EDGE = "0";

    public static final String PARALLEL_SEPARATOR = "+";

    public static final String CELL_SEPARATOR = ",";

    public static List<String> toLines(CircuitGraph graph) {
        List<CircuitNode> nodes = graph.getNodes();
        List<String> lines = new ArrayList<>(nodes.size() + 1);
        StringBuilder header = new StringBuilder();
        if (graph.getCircuitType() != null) {
            header.append(DeviceCatalog.CIRCUIT_TYPE_PREFIX).append(graph.getCircuitType());
        }
        for (CircuitNode node : nodes) {
            header.append(CELL_SEPARATOR).append(node.getName());
        }
        lines.add(header.toString());
        for (CircuitNode row : nodes) {
            StringBuilder sb = new StringBuilder(row.getName());
            for (CircuitNode col : nodes) {
                sb.append(CELL_SEPARATOR).append(getCell(graph, row, col));
            }
            lines.add(sb.toString());
        }
        return lines;
    }

    private static String getCell(CircuitGraph graph, CircuitNode row, CircuitNode col) {
        if (row.isDevice() == col.isDevice()) {
            return NO_EDGE;
        }
        StringBuilder sb = new StringBuilder();
        for (PinEdge e : graph.edgesOf(row)) {
            if (e.getOpposite(row).equals(col)) {
                if (sb.length() > 0) sb.append(PARALLEL_SEPARATOR);
                sb.append(e.getLabel().getName());
            }
        }
        return sb.length() == 0 ? NO_EDGE : sb.toString();
    }

    public static void write(CircuitGraph graph, String fileName) {
        FileTools.writeLinesToTextFile(toLines(graph), fileName);
    }

    public static CircuitGraph read(Vocabulary vocab, String fileName) {
        return fromLines(vocab, FileTools.getLinesFromTextFile(fileName));
    }

    /**
     * Rebuilds a circuit graph from matrix lines. Only device rows are read; the net rows are the
     * mirror image.
     * @param vocab Vocabulary used to resolve node and label names.
     * @param lines The CSV lines, header first.
     * @return The circuit graph with nodes in header order.
     * @throws UnknownTokenException if a name is not in the vocabulary or has the wrong kind.
     * @throws IllegalArgumentException if the matrix is not square.
     */
    public static CircuitGraph fromLines(Vocabulary vocab, List<String> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Adjacency matrix has no header row");
        }
        String[] header = lines.get(0).split(CELL_SEPARATOR, -1);
        CircuitGraph graph = new CircuitGraph();
        String corner = header[0].trim();
        if (!corner.isEmpty()) {
            Token type = vocab.getCircuitTypeToken(corner);
            graph.setCircuitType(type.getName().substring(DeviceCatalog.CIRCUIT_TYPE_PREFIX.length()));
        }
        List<CircuitNode> nodes = new ArrayList<>();
        for (int i = 1; i < header.length; i++) {
            CircuitNode node = CircuitNode.of(vocab.getToken(header[i].trim()));
            nodes.add(node);
            graph.addNode(node);
        }
        if (lines.size() - 1 != nodes.size()) {
            throw new IllegalArgumentException("Adjacency matrix has " + nodes.size() + " columns but "
                    + (lines.size() - 1) + " rows");
        }
        for (int r = 0; r < nodes.size(); r++) {
            String[] cells = lines.get(r + 1).split(CELL_SEPARATOR, -1);
            if (cells.length != nodes.size() + 1) {
                throw new IllegalArgumentException("Adjacency matrix row " + (r + 1) + " has "
                        + (cells.length - 1) + " cells, expected " + nodes.size());
            }
            if (!cells[0].trim().equals(nodes.get(r).getName())) {
                throw new IllegalArgumentException("Adjacency matrix row " + (r + 1) + " is labeled "
                        + cells[0] + " but column " + (r + 1) + " is " + nodes.get(r));
            }
            if (!nodes.get(r).isDevice()) continue;
            DeviceNode device = (DeviceNode) nodes.get(r);
            for (int c = 0; c < nodes.size(); c++) {
                String cell = cells[c + 1].trim();
                if (cell.isEmpty() || cell.equals(NO_EDGE)) continue;
                if (!nodes.get(c).isNet()) {
                    throw new IllegalArgumentException("Adjacency matrix connects device " + device
                            + " to device " + nodes.get(c));
                }
                for (String labelName : cell.split("\\" + PARALLEL_SEPARATOR)) {
                    Token label = vocab.getToken(labelName.trim());
                    if (!label.isPinEdge()) {
                        throw new UnknownTokenException("Adjacency matrix cell '" + labelName
                                + "' is not a pin label");
                    }
                    graph.addEdge(device, (NetNode) nodes.get(c), label.getPinLabel());
                }
            }
        }
        return graph;
    }
}
