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
package com.analogwright.sequence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitNode;
import com.analogwright.graph.DisconnectedGraphException;
import com.analogwright.graph.NetNode;
import com.analogwright.graph.PinEdge;
import com.analogwright.util.Params;
import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Serializes a {@link CircuitGraph} into a {@link TokenSequence} with a randomized walk that
 * consumes every pin-edge once.
 * <p>
 * The walk starts at VSS (or the first node if the circuit has no VSS). At every step it picks one
 * of the current node's unvisited edges uniformly at random and emits the edge label followed by
 * the node at the other end. When the current node has no unvisited edge left, the walk moves to
 * the nearest node that still has one, retracing already emitted edges along a shortest path so
 * that the output remains a legal node/edge alternation. Optionally the walk finally retraces its
 * way back to the start node. The sequence ends with TRUNCATE.
 * <p>
 * The output depends only on the graph (including its insertion order) and the random source, so
 * identical seeds yield identical sequences.
 */
public class SequenceEncoder {

    private final Vocabulary vocab;

    private final boolean closeWalk;

    public SequenceEncoder(Vocabulary vocab) {
        this(vocab, true);
    }

    /**
     * @param vocab The shared vocabulary.
     * @param closeWalk If true, the walk returns to its start node before TRUNCATE.
     */
    public SequenceEncoder(Vocabulary vocab, boolean closeWalk) {
        this.vocab = vocab;
        this.closeWalk = closeWalk;
    }

    public Vocabulary getVocabulary() {
        return vocab;
    }

    public TokenSequence encode(CircuitGraph graph, long seed) {
        return encode(graph, new Random(seed));
    }

    /**
     * Encodes a circuit.
     * @param graph A complete, connected circuit.
     * @param random Source of the traversal choices.
     * @return The sequence, ending with TRUNCATE.
     * @throws com.analogwright.graph.IncompletePinException if a device has unbound pins.
     * @throws DisconnectedGraphException if the circuit has no edges, an isolated node or more
     *         than one connected component.
     */
    public TokenSequence encode(CircuitGraph graph, Random random) {
        graph.requireComplete();
        checkTraversable(graph);

        List<Token> tokens = new ArrayList<>(graph.getEdgeCount() * 2 + 3);
        if (graph.getCircuitType() != null) {
            tokens.add(vocab.getCircuitTypeToken(graph.getCircuitType()));
        }

        CircuitNode start = getStartNode(graph);
        Set<PinEdge> visited = Collections.newSetFromMap(new IdentityHashMap<PinEdge, Boolean>());
        Map<CircuitNode, List<PinEdge>> walked = new HashMap<>();
        int remaining = graph.getEdgeCount();

        CircuitNode current = start;
        tokens.add(current.toToken(vocab));
        while (remaining > 0) {
            List<PinEdge> candidates = new ArrayList<>();
            for (PinEdge e : graph.edgesOf(current)) {
                if (!visited.contains(e)) candidates.add(e);
            }
            if (candidates.isEmpty()) {
                current = retrace(graph, current, walked, visited, null, tokens);
                continue;
            }
            PinEdge edge = candidates.get(random.nextInt(candidates.size()));
            visited.add(edge);
            remaining--;
            walked.computeIfAbsent(edge.getDevice(), k -> new ArrayList<>()).add(edge);
            walked.computeIfAbsent(edge.getNet(), k -> new ArrayList<>()).add(edge);
            current = emit(edge, current, tokens);
        }
        if (closeWalk && !current.equals(start)) {
            retrace(graph, current, walked, visited, start, tokens);
        }
        tokens.add(vocab.getTruncateToken());
        return new TokenSequence(tokens);
    }

    private CircuitNode emit(PinEdge edge, CircuitNode from, List<Token> tokens) {
        CircuitNode to = edge.getOpposite(from);
        tokens.add(vocab.getLabelToken(edge.getLabel()));
        tokens.add(to.toToken(vocab));
        return to;
    }

    /**
     * Breadth-first search over already walked edges from the current node, either to the given
     * target or to the nearest node with unvisited edges, then emits the path found.
     * @return The node reached.
     */
    private CircuitNode retrace(CircuitGraph graph, CircuitNode from, Map<CircuitNode, List<PinEdge>> walked,
                                Set<PinEdge> visited, CircuitNode target, List<Token> tokens) {
        Map<CircuitNode, PinEdge> reachedBy = new HashMap<>();
        Deque<CircuitNode> queue = new ArrayDeque<>();
        queue.add(from);
        reachedBy.put(from, null);
        CircuitNode found = null;
        while (!queue.isEmpty()) {
            CircuitNode node = queue.poll();
            if (target != null ? node.equals(target) : hasUnvisitedEdge(graph, node, visited)) {
                found = node;
                break;
            }
            for (PinEdge e : walked.getOrDefault(node, Collections.<PinEdge>emptyList())) {
                CircuitNode next = e.getOpposite(node);
                if (!reachedBy.containsKey(next)) {
                    reachedBy.put(next, e);
                    queue.add(next);
                }
            }
        }
        if (found == null) {
            throw new DisconnectedGraphException("No walked path from " + from + " to "
                    + (target != null ? target.toString() : "a node with unvisited edges"));
        }
        List<PinEdge> path = new ArrayList<>();
        CircuitNode n = found;
        while (!n.equals(from)) {
            PinEdge e = reachedBy.get(n);
            path.add(e);
            n = e.getOpposite(n);
        }
        Collections.reverse(path);
        CircuitNode current = from;
        for (PinEdge e : path) {
            current = emit(e, current, tokens);
        }
        return current;
    }

    private static boolean hasUnvisitedEdge(CircuitGraph graph, CircuitNode node, Set<PinEdge> visited) {
        for (PinEdge e : graph.edgesOf(node)) {
            if (!visited.contains(e)) return true;
        }
        return false;
    }

    static CircuitNode getStartNode(CircuitGraph graph) {
        for (NetNode net : graph.getNets()) {
            if (net.isSingleton() && net.getCategory().getName().equals(DeviceCatalog.VSS)) {
                return net;
            }
        }
        return graph.getNodes().get(0);
    }

    static void checkTraversable(CircuitGraph graph) {
        if (graph.getEdgeCount() == 0) {
            throw new DisconnectedGraphException("Circuit has no pin-edges to traverse");
        }
        List<CircuitNode> isolated = graph.getIsolatedNodes();
        if (!isolated.isEmpty()) {
            throw new DisconnectedGraphException("Circuit has isolated nodes " + isolated);
        }
        if (!graph.isConnected()) {
            throw new DisconnectedGraphException("Circuit has " + graph.getComponents().size()
                    + " connected components");
        }
    }

    /**
     * Produces distinct traversals of one circuit for corpus augmentation, using the seeds
     * {@code seed, seed+1, ...}. Sequences longer than {@code maxLength} are dropped. At most
     * {@code 10 * count} traversals are attempted, so small circuits may yield fewer sequences.
     * @param graph The circuit.
     * @param seed First seed.
     * @param count Maximum number of sequences.
     * @param maxLength Maximum sequence length, TRUNCATE included.
     * @return Distinct sequences in the order found.
     */
    public List<TokenSequence> encodeMany(CircuitGraph graph, long seed, int count, int maxLength) {
        Set<TokenSequence> found = new LinkedHashSet<>();
        for (int attempt = 0; attempt < count * 10 && found.size() < count; attempt++) {
            TokenSequence s = encode(graph, seed + attempt);
            if (s.size() <= maxLength) {
                found.add(s);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Same as {@link #encodeMany(CircuitGraph, long, int, int)} with the count and length bound
     * taken from {@link Params}.
     */
    public List<TokenSequence> encodeMany(CircuitGraph graph, long seed) {
        return encodeMany(graph, seed, Params.ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH,
                Params.ANALOGWRIGHT_MAX_LENGTH);
    }
}
