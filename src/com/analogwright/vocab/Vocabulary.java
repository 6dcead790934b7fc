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
package com.analogwright.vocab;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * The closed, immutable set of tokens and the bidirectional mapping between tokens and integer
 * ids. A vocabulary is built once from a {@link DeviceCatalog} and then handed by reference to
 * every component that reads or writes sequences. Ids are assigned in this fixed order:
 * <ol>
 *   <li>pin-edge labels, family by family in catalog order</li>
 *   <li>singleton nets (VSS, VDD)</li>
 *   <li>circuit types</li>
 *   <li>devices, type by type in catalog order, ascending index</li>
 *   <li>indexed nets (internal nets, then ports), category by category, ascending index</li>
 *   <li>the TRUNCATE control token</li>
 * </ol>
 * Instances are safe to share between any number of threads.
 */
public class Vocabulary {

    private final DeviceCatalog catalog;

    private final List<Token> tokens;

    private final Map<String, Token> tokensByName;

    private final Map<TokenKind, List<Token>> tokensByKind;

    private final Map<DeviceType, Token[]> deviceTokens;

    private final Map<NetCategory, Token[]> netTokens;

    private final Map<PinLabel, Token> labelTokens;

    private final Map<DeviceFamily, List<Token>> familyLabelTokens;

    private final Map<DeviceFamily, List<Token>> familyDeviceTokens;

    private final Token truncate;

    private final long fingerprint;

    private Vocabulary(DeviceCatalog catalog, List<Token> tokens) {
        this.catalog = catalog;
        this.tokens = Collections.unmodifiableList(tokens);
        this.tokensByName = new HashMap<>();
        this.tokensByKind = new EnumMap<>(TokenKind.class);
        this.deviceTokens = new IdentityHashMap<>();
        this.netTokens = new IdentityHashMap<>();
        this.labelTokens = new IdentityHashMap<>();
        this.familyLabelTokens = new IdentityHashMap<>();
        this.familyDeviceTokens = new IdentityHashMap<>();
        for (TokenKind kind : TokenKind.values()) {
            tokensByKind.put(kind, new ArrayList<>());
        }
        for (DeviceType type : catalog.getDeviceTypes()) {
            deviceTokens.put(type, new Token[type.getMaxIndex() + 1]);
        }
        for (NetCategory category : catalog.getNetCategories()) {
            netTokens.put(category, new Token[category.getMaxIndex() + 1]);
        }
        for (DeviceFamily family : catalog.getFamilies()) {
            familyLabelTokens.put(family, new ArrayList<>());
            familyDeviceTokens.put(family, new ArrayList<>());
        }

        Token lastControl = null;
        CRC32 crc = new CRC32();
        for (Token t : tokens) {
            if (tokensByName.put(t.getName(), t) != null) {
                throw new IllegalStateException("Duplicate token name " + t.getName()
                        + " produced by the device catalog");
            }
            tokensByKind.get(t.getKind()).add(t);
            switch (t.getKind()) {
                case DEVICE:
                    deviceTokens.get(t.getDeviceType())[t.getIndex()] = t;
                    familyDeviceTokens.get(t.getFamily()).add(t);
                    break;
                case NET:
                    netTokens.get(t.getNetCategory())[t.getIndex()] = t;
                    break;
                case PIN_EDGE:
                    labelTokens.put(t.getPinLabel(), t);
                    familyLabelTokens.get(t.getFamily()).add(t);
                    break;
                case CONTROL:
                    lastControl = t;
                    break;
                default:
                    break;
            }
            crc.update(t.getName().getBytes(StandardCharsets.UTF_8));
            crc.update('\n');
        }
        for (TokenKind kind : TokenKind.values()) {
            tokensByKind.put(kind, Collections.unmodifiableList(tokensByKind.get(kind)));
        }
        this.truncate = lastControl;
        this.fingerprint = crc.getValue() ^ ((long) tokens.size() << 32);
    }

    /**
     * Enumerates every token described by the catalog and assigns stable ids. Building twice from
     * the same catalog always yields identical ids.
     * @param catalog The declarative catalog.
     * @return The new vocabulary.
     */
    public static Vocabulary build(DeviceCatalog catalog) {
        List<Token> tokens = new ArrayList<>();
        for (DeviceFamily family : catalog.getFamilies()) {
            for (PinLabel label : family.getLabels()) {
                tokens.add(Token.pinEdge(tokens.size(), label));
            }
        }
        for (NetCategory category : catalog.getNetCategories()) {
            if (category.isSingleton()) {
                tokens.add(Token.net(tokens.size(), category, 0));
            }
        }
        for (String circuitType : catalog.getCircuitTypes()) {
            tokens.add(Token.circuitType(tokens.size(), circuitType));
        }
        for (DeviceType type : catalog.getDeviceTypes()) {
            for (int i = type.getMinIndex(); i <= type.getMaxIndex(); i++) {
                tokens.add(Token.device(tokens.size(), type, i));
            }
        }
        for (NetCategory category : catalog.getNetCategories()) {
            if (category.isSingleton()) continue;
            if (category.hasBareNet()) {
                tokens.add(Token.net(tokens.size(), category, NetCategory.BARE_INDEX));
            }
            for (int i = category.getMinIndex(); i <= category.getMaxIndex(); i++) {
                tokens.add(Token.net(tokens.size(), category, i));
            }
        }
        tokens.add(Token.control(tokens.size(), DeviceCatalog.TRUNCATE));
        return new Vocabulary(catalog, tokens);
    }

    /**
     * Convenience for {@code build(DeviceCatalog.defaultCatalog())}.
     * @return A vocabulary over the default catalog.
     */
    public static Vocabulary buildDefault() {
        return build(DeviceCatalog.defaultCatalog());
    }

    public DeviceCatalog getCatalog() {
        return catalog;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * @return All tokens in id order.
     */
    public List<Token> getTokens() {
        return tokens;
    }

    public List<Token> getTokens(TokenKind kind) {
        return tokensByKind.get(kind);
    }

    public Token getToken(int id) {
        if (id < 0 || id >= tokens.size()) {
            throw new UnknownTokenException("Token id " + id + " is outside the vocabulary [0,"
                    + tokens.size() + ")");
        }
        return tokens.get(id);
    }

    public Token getToken(String name) {
        Token t = tokensByName.get(name);
        if (t == null) {
            throw new UnknownTokenException("Unknown token '" + name + "'");
        }
        return t;
    }

    public int getId(String name) {
        return getToken(name).getId();
    }

    public boolean contains(String name) {
        return tokensByName.containsKey(name);
    }

    public Token getDeviceToken(DeviceType type, int index) {
        Token[] byIndex = deviceTokens.get(type);
        if (byIndex == null || !type.isInRange(index)) {
            throw new UnknownTokenException("No token for device " + type + index);
        }
        return byIndex[index];
    }

    public Token getNetToken(NetCategory category, int index) {
        Token[] byIndex = netTokens.get(category);
        if (byIndex == null || !category.isInRange(index)) {
            throw new UnknownTokenException("No token for net " + category + " index " + index);
        }
        return byIndex[index];
    }

    public Token getLabelToken(PinLabel label) {
        Token t = labelTokens.get(label);
        if (t == null) {
            throw new UnknownTokenException("No token for pin label " + label);
        }
        return t;
    }

    /**
     * Looks up a circuit type token by its bare name (Opamp) or its token name (CIRCUIT_Opamp).
     * @param circuitType The circuit type.
     * @return The circuit type token.
     */
    public Token getCircuitTypeToken(String circuitType) {
        String name = circuitType.startsWith(DeviceCatalog.CIRCUIT_TYPE_PREFIX) ? circuitType
                : DeviceCatalog.CIRCUIT_TYPE_PREFIX + circuitType;
        Token t = getToken(name);
        if (!t.isCircuitType()) {
            throw new UnknownTokenException("'" + circuitType + "' is not a circuit type");
        }
        return t;
    }

    public Token getTruncateToken() {
        return truncate;
    }

    /**
     * @return The pin-edge tokens legal for devices of the family, in id order.
     */
    public List<Token> getLabelTokens(DeviceFamily family) {
        List<Token> list = familyLabelTokens.get(family);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * @return The device tokens of all types in the family, in id order.
     */
    public List<Token> getDeviceTokens(DeviceFamily family) {
        List<Token> list = familyDeviceTokens.get(family);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * Gets a value identifying the enumeration (names and order). Two vocabularies with equal
     * fingerprints map every id to the same token name.
     * @return The fingerprint.
     */
    public long getFingerprint() {
        return fingerprint;
    }

    public int[] toIds(List<Token> sequence) {
        int[] ids = new int[sequence.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = sequence.get(i).getId();
        }
        return ids;
    }

    public List<Token> toTokens(int[] ids) {
        List<Token> list = new ArrayList<>(ids.length);
        for (int id : ids) {
            list.add(getToken(id));
        }
        return list;
    }

    @Override
    public String toString() {
        return "Vocabulary[" + tokens.size() + " tokens, fingerprint=" + Long.toHexString(fingerprint) + "]";
    }
}
