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
package com.analogwright.augment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitNode;
import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.NetNode;
import com.analogwright.graph.PinEdge;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.vocab.DeviceType;
import com.analogwright.vocab.NetCategory;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Produces lexically different but isomorphic variants of circuits and sequences by drawing a
 * random type-preserving bijection over device indices (and, depending on the
 * {@link NetRenaming} policy, net indices) and rewriting every reference through it. New indices
 * are drawn from the whole catalogued range of each type.
 * <p>
 * Renamed graphs keep the node and edge order of the original, so a traversal with the same seed
 * visits the same edges in the same order before and after renaming.
 */
public class RenamingAugmentor {

    private final Vocabulary vocab;

    private final NetRenaming netRenaming;

    public RenamingAugmentor(Vocabulary vocab) {
        this(vocab, NetRenaming.ALL_INDEXED);
    }

    public RenamingAugmentor(Vocabulary vocab, NetRenaming netRenaming) {
        this.vocab = vocab;
        this.netRenaming = netRenaming;
    }

    public NetRenaming getNetRenaming() {
        return netRenaming;
    }

    /**
     * Draws the renaming bijection for a set of nodes. Groups are processed in order of their
     * first node, and nodes within a group in the given order.
     * @param nodes Distinct nodes, in a reproducible order.
     * @param random Source of the permutation.
     * @return Mapping from every given node to its new name; nodes that are not renamed map to
     *         themselves, as does a bare port net (VOUT).
     * @throws RangeExhaustedException if a type or category has more nodes than its range.
     */
    public Map<CircuitNode, CircuitNode> createMapping(Collection<? extends CircuitNode> nodes, Random random) {
        Map<Object, List<CircuitNode>> groups = new LinkedHashMap<>();
        Map<CircuitNode, CircuitNode> mapping = new HashMap<>();
        for (CircuitNode node : nodes) {
            Object key;
            if (node.isDevice()) {
                key = ((DeviceNode) node).getType();
            } else {
                NetNode net = (NetNode) node;
                NetCategory category = net.getCategory();
                if (!netRenaming.renames(category) || category.isBareIndex(net.getIndex())) {
                    mapping.put(node, node);
                    continue;
                }
                key = category;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(node);
        }
        for (Map.Entry<Object, List<CircuitNode>> e : groups.entrySet()) {
            List<CircuitNode> members = e.getValue();
            int min;
            int max;
            if (e.getKey() instanceof DeviceType) {
                DeviceType type = (DeviceType) e.getKey();
                min = type.getMinIndex();
                max = type.getMaxIndex();
            } else {
                NetCategory category = (NetCategory) e.getKey();
                min = category.getMinIndex();
                max = category.getMaxIndex();
            }
            int rangeSize = max - min + 1;
            if (members.size() > rangeSize) {
                throw new RangeExhaustedException(members.size() + " instances of " + e.getKey()
                        + " do not fit into the index range [" + min + "," + max + "]");
            }
            List<Integer> indices = new ArrayList<>(rangeSize);
            for (int i = min; i <= max; i++) {
                indices.add(i);
            }
            Collections.shuffle(indices, random);
            for (int i = 0; i < members.size(); i++) {
                CircuitNode node = members.get(i);
                CircuitNode renamed = node.isDevice()
                        ? new DeviceNode(((DeviceNode) node).getType(), indices.get(i))
                        : new NetNode(((NetNode) node).getCategory(), indices.get(i));
                mapping.put(node, renamed);
            }
        }
        return mapping;
    }

    public CircuitGraph rename(CircuitGraph graph, long seed) {
        return rename(graph, new Random(seed));
    }

    /**
     * Renames a circuit.
     * @param graph The circuit; left unchanged.
     * @param random Source of the bijection.
     * @return A new, isomorphic circuit with the same circuit type and the same node and edge
     *         order.
     */
    public CircuitGraph rename(CircuitGraph graph, Random random) {
        Map<CircuitNode, CircuitNode> mapping = createMapping(graph.getNodes(), random);
        CircuitGraph renamed = new CircuitGraph(graph.getCircuitType());
        for (CircuitNode node : graph.getNodes()) {
            renamed.addNode(mapping.get(node));
        }
        for (PinEdge e : graph.getEdges()) {
            renamed.addEdge((DeviceNode) mapping.get(e.getDevice()), (NetNode) mapping.get(e.getNet()),
                    e.getLabel());
        }
        return renamed;
    }

    public TokenSequence rename(TokenSequence sequence, long seed) {
        return rename(sequence, new Random(seed));
    }

    /**
     * Renames the device and net tokens of a sequence. Nodes are mapped in order of first
     * appearance; all other tokens are kept.
     * @param sequence Tokens of this augmentor's vocabulary.
     * @param random Source of the bijection.
     * @return The renamed sequence, of the same length and with the same pin-edge tokens.
     */
    public TokenSequence rename(TokenSequence sequence, Random random) {
        Set<CircuitNode> nodes = new LinkedHashSet<>();
        for (Token t : sequence.getTokens()) {
            if (t.isDevice() || t.isNet()) {
                nodes.add(CircuitNode.of(t));
            }
        }
        Map<CircuitNode, CircuitNode> mapping = createMapping(nodes, random);
        List<Token> tokens = new ArrayList<>(sequence.size());
        for (Token t : sequence.getTokens()) {
            if (t.isDevice() || t.isNet()) {
                tokens.add(mapping.get(CircuitNode.of(t)).toToken(vocab));
            } else {
                tokens.add(t);
            }
        }
        return new TokenSequence(tokens);
    }
}
