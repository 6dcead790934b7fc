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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.NetNode;
import com.analogwright.graph.PinAssignment;
import com.analogwright.vocab.DeviceFamily;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.TokenKind;
import com.analogwright.vocab.Vocabulary;

/**
 * Finite-state acceptor over a {@link Vocabulary} defining which tokens may follow in every state
 * of a circuit sequence:
 * <pre>
 *   START                   : circuit type, net, device
 *   AFTER_CIRCUIT_TYPE      : net, device
 *   AT_NET                  : pin-edge of any family, TRUNCATE
 *   AT_DEVICE               : pin-edge of the device's family, TRUNCATE
 *   AT_PIN_EDGE_FROM_NET    : device of the pin-edge's family
 *   AT_PIN_EDGE_FROM_DEVICE : net
 *   TERMINAL                : nothing
 * </pre>
 * The token-kind masks are precomputed once per state and family. A grammar is immutable and can
 * be shared between threads; the mutable position within a sequence lives in a
 * {@link GrammarCursor} owned by one caller.
 */
public class Grammar {

    private final Vocabulary vocab;

    private final GrammarOptions options;

    private final Map<GrammarState, BitSet> stateMasks;

    private final Map<DeviceFamily, BitSet> deviceLabelMasks;

    private final Map<DeviceFamily, BitSet> familyDeviceMasks;

    private final BitSet empty = new BitSet();

    public Grammar(Vocabulary vocab) {
        this(vocab, GrammarOptions.defaults());
    }

    public Grammar(Vocabulary vocab, GrammarOptions options) {
        this.vocab = vocab;
        this.options = options;
        this.stateMasks = new EnumMap<>(GrammarState.class);
        this.deviceLabelMasks = new IdentityHashMap<>();
        this.familyDeviceMasks = new IdentityHashMap<>();

        BitSet nets = kindMask(TokenKind.NET);
        BitSet devices = kindMask(TokenKind.DEVICE);
        BitSet labels = kindMask(TokenKind.PIN_EDGE);
        BitSet truncate = new BitSet();
        truncate.set(vocab.getTruncateToken().getId());

        BitSet start = kindMask(TokenKind.CIRCUIT_TYPE);
        start.or(nets);
        start.or(devices);
        stateMasks.put(GrammarState.START, start);

        BitSet afterType = (BitSet) nets.clone();
        afterType.or(devices);
        stateMasks.put(GrammarState.AFTER_CIRCUIT_TYPE, afterType);

        BitSet atNet = (BitSet) labels.clone();
        atNet.or(truncate);
        stateMasks.put(GrammarState.AT_NET, atNet);

        stateMasks.put(GrammarState.AT_PIN_EDGE_FROM_DEVICE, nets);
        stateMasks.put(GrammarState.TERMINAL, empty);

        for (DeviceFamily family : vocab.getCatalog().getFamilies()) {
            BitSet atDevice = new BitSet();
            for (Token t : vocab.getLabelTokens(family)) {
                atDevice.set(t.getId());
            }
            atDevice.or(truncate);
            deviceLabelMasks.put(family, atDevice);

            BitSet familyDevices = new BitSet();
            for (Token t : vocab.getDeviceTokens(family)) {
                familyDevices.set(t.getId());
            }
            familyDeviceMasks.put(family, familyDevices);
        }
    }

    private BitSet kindMask(TokenKind kind) {
        BitSet mask = new BitSet(vocab.size());
        for (Token t : vocab.getTokens(kind)) {
            mask.set(t.getId());
        }
        return mask;
    }

    public Vocabulary getVocabulary() {
        return vocab;
    }

    public GrammarOptions getOptions() {
        return options;
    }

    /**
     * Creates a cursor positioned at {@link GrammarState#START}.
     * @return A new cursor for exclusive use by the caller.
     */
    public GrammarCursor newCursor() {
        return new GrammarCursor(this);
    }

    /**
     * Gets the token-kind mask of a state. This ignores any pin binding context, which only
     * {@link GrammarOptions#strict()} grammars consult.
     * @param state The state.
     * @param family The tracked device family, required in {@link GrammarState#AT_DEVICE} and
     *               {@link GrammarState#AT_PIN_EDGE_FROM_NET}, ignored otherwise.
     * @return The ids of the allowed tokens. The returned set must not be modified.
     */
    public BitSet getStructuralMask(GrammarState state, DeviceFamily family) {
        switch (state) {
            case AT_DEVICE:
                return family == null ? empty : deviceLabelMasks.getOrDefault(family, empty);
            case AT_PIN_EDGE_FROM_NET:
                return family == null ? empty : familyDeviceMasks.getOrDefault(family, empty);
            default:
                return stateMasks.get(state);
        }
    }

    /**
     * Decides whether the cursor may advance with the token. This is the single predicate behind
     * both {@link #allowedTokenIds(GrammarCursor)} and {@link GrammarCursor#advance(Token)}.
     * @param cursor Current position.
     * @param token Candidate next token.
     * @return True if the token is allowed.
     */
    public boolean isAllowed(GrammarCursor cursor, Token token) {
        BitSet mask = getStructuralMask(cursor.getState(), cursor.getTrackedFamily());
        if (!mask.get(token.getId())) {
            return false;
        }
        return !options.isTrackingDevices() || isAllowedInContext(cursor, token);
    }

    private boolean isAllowedInContext(GrammarCursor cursor, Token token) {
        if (token.isTruncate()) {
            return !options.isRequiringCompleteDevices() || cursor.areAllDevicesComplete();
        }
        if (!options.isCheckingPinBindings()) {
            return true;
        }
        switch (cursor.getState()) {
            case AT_DEVICE: {
                PinAssignment a = cursor.getAssignment((DeviceNode) cursor.getAnchor());
                return a.canBindSomewhere(token.getPinLabel());
            }
            case AT_PIN_EDGE_FROM_NET: {
                PinAssignment a = cursor.getAssignment(new DeviceNode(token.getDeviceType(), token.getIndex()));
                return a == null || a.canBind(cursor.getLastLabel(), (NetNode) cursor.getAnchor());
            }
            case AT_PIN_EDGE_FROM_DEVICE: {
                PinAssignment a = cursor.getAssignment((DeviceNode) cursor.getAnchor());
                return a.canBind(cursor.getLastLabel(), new NetNode(token.getNetCategory(), token.getIndex()));
            }
            default:
                return true;
        }
    }

    /**
     * Computes the allowed next tokens at the cursor as a set of vocabulary ids.
     * @param cursor Current position.
     * @return A fresh set the caller may modify.
     */
    public BitSet allowedTokenIds(GrammarCursor cursor) {
        BitSet mask = (BitSet) getStructuralMask(cursor.getState(), cursor.getTrackedFamily()).clone();
        if (options.isTrackingDevices()) {
            for (int id = mask.nextSetBit(0); id >= 0; id = mask.nextSetBit(id + 1)) {
                if (!isAllowedInContext(cursor, vocab.getToken(id))) {
                    mask.clear(id);
                }
            }
        }
        return mask;
    }

    /**
     * @return The allowed next tokens at the cursor, in id order.
     */
    public List<Token> allowedTokens(GrammarCursor cursor) {
        BitSet mask = allowedTokenIds(cursor);
        List<Token> tokens = new ArrayList<>(mask.cardinality());
        for (int id = mask.nextSetBit(0); id >= 0; id = mask.nextSetBit(id + 1)) {
            tokens.add(vocab.getToken(id));
        }
        return tokens;
    }

    /**
     * Checks a whole sequence of ids against this grammar.
     * @param ids The token ids.
     * @param requireTerminal If true, the sequence must end in the terminal state.
     * @throws GrammarViolationException at the first illegal token, or at the end of the sequence
     *         if it was required to be terminated and was not.
     */
    public void validate(int[] ids, boolean requireTerminal) {
        GrammarCursor cursor = newCursor();
        for (int id : ids) {
            if (cursor.getState().isAccepting() && vocab.getToken(id).isTruncate()) {
                continue;
            }
            cursor.advance(vocab.getToken(id));
        }
        if (requireTerminal && !cursor.getState().isAccepting()) {
            throw new GrammarViolationException("Sequence ends without TRUNCATE in state "
                    + cursor.getState(), ids.length, null, cursor.getState());
        }
    }
}
