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

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitNode;
import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.DuplicateEdgeException;
import com.analogwright.graph.NetNode;
import com.analogwright.grammar.Grammar;
import com.analogwright.grammar.GrammarCursor;
import com.analogwright.grammar.GrammarState;
import com.analogwright.grammar.GrammarViolationException;
import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.PinLabel;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Rebuilds a {@link CircuitGraph} from a {@link TokenSequence}. The sequence is replayed through a
 * {@link Grammar}, so sequences from untrusted sources are re-validated on the way. Every
 * {@code node, label, node} triple becomes a pin-edge; nodes are created on first mention and a
 * repeated identical triple (a retraced edge) adds nothing. TRUNCATE tokens after the terminating
 * one are treated as padding.
 * <p>
 * Decoding either returns a complete graph or throws; partially built graphs are never returned.
 */
public class SequenceDecoder {

    private final Vocabulary vocab;

    private final Grammar grammar;

    public SequenceDecoder(Vocabulary vocab) {
        this(new Grammar(vocab));
    }

    public SequenceDecoder(Grammar grammar) {
        this.vocab = grammar.getVocabulary();
        this.grammar = grammar;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public CircuitGraph decode(int[] ids) {
        return decode(TokenSequence.fromIds(vocab, ids));
    }

    /**
     * Decodes a sequence.
     * @param sequence Tokens of this decoder's vocabulary.
     * @return The circuit, with every device complete.
     * @throws GrammarViolationException at the first token the grammar rejects, at a token other
     *         than TRUNCATE following the end of the sequence, or at the end if the sequence
     *         stops in the middle of an edge or contains no node.
     * @throws DuplicateEdgeException if a pin is bound to a net conflicting with earlier bindings.
     * @throws com.analogwright.graph.IncompletePinException if a device still has unbound pins at
     *         the end.
     */
    public CircuitGraph decode(TokenSequence sequence) {
        GrammarCursor cursor = grammar.newCursor();
        CircuitGraph graph = new CircuitGraph();
        CircuitNode previous = null;
        PinLabel pending = null;
        for (int i = 0; i < sequence.size(); i++) {
            Token token = sequence.get(i);
            if (cursor.isTerminal()) {
                if (token.isTruncate()) continue;
                throw new GrammarViolationException("Token " + token + " follows the end of the sequence",
                        i, token, GrammarState.TERMINAL);
            }
            cursor.advance(token);
            if (token.isCircuitType()) {
                graph.setCircuitType(token.getName().substring(DeviceCatalog.CIRCUIT_TYPE_PREFIX.length()));
            } else if (token.isPinEdge()) {
                pending = token.getPinLabel();
            } else if (token.isDevice() || token.isNet()) {
                CircuitNode node = CircuitNode.of(token);
                if (pending == null) {
                    graph.addNode(node);
                } else {
                    connect(graph, previous, node, pending, i);
                    pending = null;
                }
                previous = node;
            }
        }
        GrammarState end = cursor.getState();
        if (end == GrammarState.AT_PIN_EDGE_FROM_NET || end == GrammarState.AT_PIN_EDGE_FROM_DEVICE) {
            throw new GrammarViolationException("Sequence ends after pin-edge " + pending
                    + " without the node at its other end", sequence.size(), null, end);
        }
        if (graph.getNodeCount() == 0) {
            throw new GrammarViolationException("Sequence contains no device or net", sequence.size(),
                    null, end);
        }
        graph.requireComplete();
        return graph;
    }

    private static void connect(CircuitGraph graph, CircuitNode a, CircuitNode b, PinLabel label, int position) {
        DeviceNode device = (DeviceNode) (a.isDevice() ? a : b);
        NetNode net = (NetNode) (a.isDevice() ? b : a);
        try {
            graph.addEdge(device, net, label);
        } catch (DuplicateEdgeException e) {
            throw new DuplicateEdgeException(e.getMessage(), position, e);
        }
    }
}
