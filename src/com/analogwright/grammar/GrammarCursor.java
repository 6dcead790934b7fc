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
package com.analogwright.grammar;

import java.util.LinkedHashMap;
import java.util.Map;

import com.analogwright.graph.CircuitNode;
import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.NetNode;
import com.analogwright.graph.PinAssignment;
import com.analogwright.vocab.DeviceFamily;
import com.analogwright.vocab.PinLabel;
import com.analogwright.vocab.Token;

/**
 * Position of one sequence within a {@link Grammar}: the current state, the tracked device family,
 * the last node and pin-edge consumed and, for grammars that follow pin bindings, the bindings
 * seen so far. A cursor is mutable and must only be used by one thread.
 */
public class GrammarCursor {

    private final Grammar grammar;

    private GrammarState state;

    private DeviceFamily family;

    private CircuitNode anchor;

    private PinLabel lastLabel;

    private int position;

    private final Map<DeviceNode, PinAssignment> assignments;

    GrammarCursor(Grammar grammar) {
        this.grammar = grammar;
        this.state = GrammarState.START;
        this.assignments = grammar.getOptions().isTrackingDevices() ? new LinkedHashMap<>() : null;
    }

    private GrammarCursor(GrammarCursor other) {
        this.grammar = other.grammar;
        this.state = other.state;
        this.family = other.family;
        this.anchor = other.anchor;
        this.lastLabel = other.lastLabel;
        this.position = other.position;
        if (other.assignments == null) {
            this.assignments = null;
        } else {
            this.assignments = new LinkedHashMap<>();
            for (Map.Entry<DeviceNode, PinAssignment> e : other.assignments.entrySet()) {
                assignments.put(e.getKey(), new PinAssignment(e.getValue()));
            }
        }
    }

    /**
     * @return An independent cursor at the same position.
     */
    public GrammarCursor copy() {
        return new GrammarCursor(this);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public GrammarState getState() {
        return state;
    }

    /**
     * Gets the family of the last device consumed, or of the last pin-edge consumed after a net.
     * @return The tracked family, or null before the first device or pin-edge.
     */
    public DeviceFamily getTrackedFamily() {
        return family;
    }

    /**
     * @return The last device or net consumed, or null if none yet.
     */
    public CircuitNode getAnchor() {
        return anchor;
    }

    /**
     * @return The last pin-edge label consumed, or null if none yet.
     */
    public PinLabel getLastLabel() {
        return lastLabel;
    }

    /**
     * @return Number of tokens consumed so far, which is also the position of the next token.
     */
    public int getPosition() {
        return position;
    }

    public boolean isTerminal() {
        return state.isAccepting();
    }

    public boolean canAdvance(Token token) {
        return grammar.isAllowed(this, token);
    }

    /**
     * Consumes a token.
     * @param token The next token.
     * @return The new state.
     * @throws GrammarViolationException if the token is not allowed here; the cursor is then left
     *         unchanged.
     */
    public GrammarState advance(Token token) {
        if (!grammar.isAllowed(this, token)) {
            throw new GrammarViolationException("Token " + token + " is not allowed in state " + state
                    + (family == null ? "" : " (tracked family " + family + ")"), position, token, state);
        }
        switch (state) {
            case START:
            case AFTER_CIRCUIT_TYPE:
                if (token.isCircuitType()) {
                    state = GrammarState.AFTER_CIRCUIT_TYPE;
                } else {
                    enterNode(CircuitNode.of(token));
                }
                break;
            case AT_NET:
            case AT_DEVICE:
                if (token.isTruncate()) {
                    state = GrammarState.TERMINAL;
                } else {
                    lastLabel = token.getPinLabel();
                    if (state == GrammarState.AT_NET) {
                        family = lastLabel.getFamily();
                        state = GrammarState.AT_PIN_EDGE_FROM_NET;
                    } else {
                        state = GrammarState.AT_PIN_EDGE_FROM_DEVICE;
                    }
                }
                break;
            case AT_PIN_EDGE_FROM_NET: {
                DeviceNode device = (DeviceNode) CircuitNode.of(token);
                bind(device, (NetNode) anchor);
                enterNode(device);
                break;
            }
            case AT_PIN_EDGE_FROM_DEVICE: {
                NetNode net = (NetNode) CircuitNode.of(token);
                bind((DeviceNode) anchor, net);
                enterNode(net);
                break;
            }
            default:
                throw new IllegalStateException("Unexpected state " + state);
        }
        position++;
        return state;
    }

    private void enterNode(CircuitNode node) {
        anchor = node;
        if (node.isDevice()) {
            DeviceNode device = (DeviceNode) node;
            family = device.getFamily();
            if (assignments != null && !assignments.containsKey(device)) {
                assignments.put(device, new PinAssignment(family));
            }
            state = GrammarState.AT_DEVICE;
        } else {
            state = GrammarState.AT_NET;
        }
    }

    private void bind(DeviceNode device, NetNode net) {
        if (assignments == null) return;
        PinAssignment a = assignments.get(device);
        if (a == null) {
            a = new PinAssignment(device.getFamily());
            assignments.put(device, a);
        }
        a.bind(lastLabel, net);
    }

    PinAssignment getAssignment(DeviceNode device) {
        return assignments == null ? null : assignments.get(device);
    }

    /**
     * @return True if every device consumed so far has all pins bound. Always true when the
     *         grammar does not follow pin bindings.
     */
    public boolean areAllDevicesComplete() {
        if (assignments == null) return true;
        for (PinAssignment a : assignments.values()) {
            if (!a.isComplete()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "GrammarCursor[" + state + " at " + position
                + (family == null ? "" : ", family=" + family)
                + (anchor == null ? "" : ", anchor=" + anchor) + "]";
    }
}
