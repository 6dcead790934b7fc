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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Immutable ordered list of tokens describing one circuit: an optional circuit type token, then
 * nodes joined by pin-edges, then TRUNCATE unless the sequence was cut at a length bound.
 */
public class TokenSequence {

    private final List<Token> tokens;

    public TokenSequence(List<Token> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public static TokenSequence fromIds(Vocabulary vocab, int[] ids) {
        return new TokenSequence(vocab.toTokens(ids));
    }

    /**
     * Parses whitespace separated token names, such as {@code "VSS M_S NM1 M_G VIN1 TRUNCATE"}.
     * @param vocab Vocabulary resolving the names.
     * @param text The token names.
     * @return The sequence.
     */
    public static TokenSequence parse(Vocabulary vocab, String text) {
        List<Token> list = new ArrayList<>();
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            for (String name : trimmed.split("\\s+")) {
                list.add(vocab.getToken(name));
            }
        }
        return new TokenSequence(list);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public Token get(int i) {
        return tokens.get(i);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * @return True if the sequence ends with TRUNCATE, false if it was cut short.
     */
    public boolean isComplete() {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).isTruncate();
    }

    /**
     * @return The circuit type without the CIRCUIT_ prefix, or null if the sequence is untagged.
     */
    public String getCircuitType() {
        if (tokens.isEmpty() || !tokens.get(0).isCircuitType()) {
            return null;
        }
        return tokens.get(0).getName().substring(DeviceCatalog.CIRCUIT_TYPE_PREFIX.length());
    }

    /**
     * @return Names of the pin-edge tokens in order.
     */
    public List<String> getLabelNames() {
        List<String> labels = new ArrayList<>();
        for (Token t : tokens) {
            if (t.isPinEdge()) labels.add(t.getName());
        }
        return labels;
    }

    public int[] toIds() {
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = tokens.get(i).getId();
        }
        return ids;
    }

    /**
     * Gets the ids padded with TRUNCATE up to a fixed length, the layout of stored corpora.
     * @param vocab Vocabulary supplying the TRUNCATE id.
     * @param length Target length.
     * @return The padded ids.
     * @throws IllegalArgumentException if the sequence is longer than the target length, or if it
     *         would need padding but has no closing TRUNCATE of its own. The padding would
     *         otherwise make a cut-off sequence read back as complete.
     */
    public int[] toPaddedIds(Vocabulary vocab, int length) {
        if (tokens.size() > length) {
            throw new IllegalArgumentException("Sequence of " + tokens.size()
                    + " tokens does not fit into " + length);
        }
        if (tokens.size() < length && !isComplete()) {
            throw new IllegalArgumentException("Incomplete sequence of " + tokens.size()
                    + " tokens cannot be padded to " + length);
        }
        int[] ids = new int[length];
        int truncate = vocab.getTruncateToken().getId();
        for (int i = 0; i < length; i++) {
            ids[i] = i < tokens.size() ? tokens.get(i).getId() : truncate;
        }
        return ids;
    }

    /**
     * @return This sequence without the repeated TRUNCATE tokens after the first one.
     */
    public TokenSequence withoutPadding() {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isTruncate()) {
                if (i == tokens.size() - 1) return this;
                for (int j = i + 1; j < tokens.size(); j++) {
                    if (!tokens.get(j).isTruncate()) return this;
                }
                return new TokenSequence(tokens.subList(0, i + 1));
            }
        }
        return this;
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return tokens.equals(((TokenSequence) obj).tokens);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t.getName());
        }
        return sb.toString();
    }
}
