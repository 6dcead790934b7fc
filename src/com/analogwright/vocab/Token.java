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

/**
 * An interned vocabulary symbol. Tokens are only created by {@link Vocabulary#build(DeviceCatalog)}
 * and are identified by their integer id; the name is the display form (NM12, VOUT3, M_DG,
 * CIRCUIT_Opamp, TRUNCATE). Depending on the kind, a token also references the catalog entry it
 * was enumerated from.
 */
public final class Token {

    private final int id;

    private final String name;

    private final TokenKind kind;

    private final DeviceType deviceType;

    private final NetCategory netCategory;

    private final int index;

    private final PinLabel label;

    private Token(int id, String name, TokenKind kind, DeviceType deviceType,
                  NetCategory netCategory, int index, PinLabel label) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.deviceType = deviceType;
        this.netCategory = netCategory;
        this.index = index;
        this.label = label;
    }

    static Token device(int id, DeviceType type, int index) {
        return new Token(id, type.getTokenName(index), TokenKind.DEVICE, type, null, index, null);
    }

    static Token net(int id, NetCategory category, int index) {
        return new Token(id, category.getTokenName(index), TokenKind.NET, null, category, index, null);
    }

    static Token pinEdge(int id, PinLabel label) {
        return new Token(id, label.getName(), TokenKind.PIN_EDGE, null, null, 0, label);
    }

    static Token circuitType(int id, String circuitType) {
        return new Token(id, DeviceCatalog.CIRCUIT_TYPE_PREFIX + circuitType, TokenKind.CIRCUIT_TYPE,
                null, null, 0, null);
    }

    static Token control(int id, String name) {
        return new Token(id, name, TokenKind.CONTROL, null, null, 0, null);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TokenKind getKind() {
        return kind;
    }

    public boolean isDevice() {
        return kind == TokenKind.DEVICE;
    }

    public boolean isNet() {
        return kind == TokenKind.NET;
    }

    public boolean isPinEdge() {
        return kind == TokenKind.PIN_EDGE;
    }

    public boolean isCircuitType() {
        return kind == TokenKind.CIRCUIT_TYPE;
    }

    public boolean isTruncate() {
        return kind == TokenKind.CONTROL && DeviceCatalog.TRUNCATE.equals(name);
    }

    /**
     * @return The device type of a device token, null otherwise.
     */
    public DeviceType getDeviceType() {
        return deviceType;
    }

    /**
     * @return The net category of a net token, null otherwise.
     */
    public NetCategory getNetCategory() {
        return netCategory;
    }

    /**
     * @return The instance index of a device or indexed net token; 0 for singleton nets and all
     *         other kinds.
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return The pin label of a pin-edge token, null otherwise.
     */
    public PinLabel getPinLabel() {
        return label;
    }

    /**
     * Gets the device family this token is tied to: the family of a device token's type, or the
     * family owning a pin-edge token's label.
     * @return The family, or null for nets, circuit types and control tokens.
     */
    public DeviceFamily getFamily() {
        if (deviceType != null) {
            return deviceType.getFamily();
        }
        if (label != null) {
            return label.getFamily();
        }
        return null;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Token other = (Token) obj;
        return id == other.id && name.equals(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
