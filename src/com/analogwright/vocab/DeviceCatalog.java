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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of everything the vocabulary enumerates: device families with their
 * pin-edge label tables, device types with index ranges, net categories, circuit types and the
 * control token. The {@link Vocabulary}, the encoder and the decoder all read the same catalog
 * instance, so they can never disagree about what a token means.
 */
public class DeviceCatalog {

    public static final String TRUNCATE = "TRUNCATE";

    public static final String CIRCUIT_TYPE_PREFIX = "CIRCUIT_";

    public static final String VSS = "VSS";

    public static final String VDD = "VDD";

    private final Map<String, DeviceFamily> families;

    private final Map<String, DeviceType> deviceTypes;

    private final Map<String, NetCategory> netCategories;

    private final List<String> circuitTypes;

    private DeviceCatalog(List<DeviceFamily> families, List<DeviceType> deviceTypes,
                          List<NetCategory> netCategories, List<String> circuitTypes) {
        this.families = new LinkedHashMap<>();
        for (DeviceFamily family : families) {
            this.families.put(family.getName(), family);
        }
        this.deviceTypes = new LinkedHashMap<>();
        for (DeviceType type : deviceTypes) {
            this.deviceTypes.put(type.getName(), type);
        }
        this.netCategories = new LinkedHashMap<>();
        for (NetCategory category : netCategories) {
            this.netCategories.put(category.getName(), category);
        }
        this.circuitTypes = Collections.unmodifiableList(new ArrayList<>(circuitTypes));
    }

    private static DeviceCatalog defaultCatalog;

    /**
     * Gets the catalog of analog and mixed-signal device types used to build the default
     * vocabulary. The instance is created once and shared; it is immutable.
     * @return The default catalog.
     */
    public static synchronized DeviceCatalog defaultCatalog() {
        if (defaultCatalog == null) {
            defaultCatalog = createDefaultCatalog();
        }
        return defaultCatalog;
    }

    private static DeviceCatalog createDefaultCatalog() {
        DeviceFamily mosfet = DeviceFamily.builder("MOSFET")
                .pins("D", "G", "S", "B")
                .label("M_B", "B")
                .label("M_D", "D")
                .label("M_G", "G")
                .label("M_S", "S")
                .label("M_BD", "B", "D")
                .label("M_BG", "B", "G")
                .label("M_BS", "B", "S")
                .label("M_DG", "D", "G")
                .label("M_DS", "D", "S")
                .label("M_GS", "G", "S")
                .label("M_BDG", "B", "D", "G")
                .label("M_BDS", "B", "D", "S")
                .label("M_BGS", "B", "G", "S")
                .label("M_DGS", "D", "G", "S")
                .label("M_BDGS", "B", "D", "G", "S")
                .build();
        DeviceFamily bjt = DeviceFamily.builder("BJT")
                .pins("C", "B", "E")
                .label("B_B", "B")
                .label("B_C", "C")
                .label("B_E", "E")
                .label("B_BC", "B", "C")
                .label("B_BE", "B", "E")
                .label("B_CE", "C", "E")
                .label("B_BCE", "B", "C", "E")
                .build();
        DeviceFamily resistor = DeviceFamily.builder("RESISTOR")
                .pin("C", 2)
                .label("R_C", "C")
                .build();
        DeviceFamily capacitor = DeviceFamily.builder("CAPACITOR")
                .pin("C", 2)
                .label("C_C", "C")
                .build();
        DeviceFamily inductor = DeviceFamily.builder("INDUCTOR")
                .pin("C", 2)
                .label("L_C", "C")
                .build();
        // D_PN is accepted on input but D_NP is what gets written
        DeviceFamily diode = DeviceFamily.builder("DIODE")
                .pins("P", "N")
                .label("D_P", "P")
                .label("D_N", "N")
                .label("D_NP", "N", "P")
                .label("D_PN", "N", "P")
                .build();
        DeviceFamily xor = DeviceFamily.builder("XOR")
                .pins("A", "B", "VDD", "VSS", "Y")
                .label("XOR_A", "A")
                .label("XOR_B", "B")
                .label("XOR_VDD", "VDD")
                .label("XOR_VSS", "VSS")
                .label("XOR_Y", "Y")
                .build();
        DeviceFamily pfd = DeviceFamily.builder("PFD")
                .pins("A", "B", "QA", "QB", "VDD", "VSS")
                .label("PFD_A", "A")
                .label("PFD_B", "B")
                .label("PFD_QA", "QA")
                .label("PFD_QB", "QB")
                .label("PFD_VDD", "VDD")
                .label("PFD_VSS", "VSS")
                .build();
        DeviceFamily inverter = DeviceFamily.builder("INVERTER")
                .pins("A", "Q", "VDD", "VSS")
                .label("INV_A", "A")
                .label("INV_Q", "Q")
                .label("INV_VDD", "VDD")
                .label("INV_VSS", "VSS")
                .build();
        DeviceFamily transmissionGate = DeviceFamily.builder("TRANSMISSION_GATE")
                .pins("A", "B", "C", "VDD", "VSS")
                .label("TG_A", "A")
                .label("TG_B", "B")
                .label("TG_C", "C")
                .label("TG_VDD", "VDD")
                .label("TG_VSS", "VSS")
                .build();

        List<DeviceFamily> families = new ArrayList<>();
        Collections.addAll(families, mosfet, bjt, resistor, capacitor, inductor, diode,
                xor, pfd, inverter, transmissionGate);

        List<DeviceType> types = new ArrayList<>();
        types.add(new DeviceType("NM", mosfet, 1, 34));
        types.add(new DeviceType("PM", mosfet, 1, 34));
        types.add(new DeviceType("NPN", bjt, 1, 26));
        types.add(new DeviceType("PNP", bjt, 1, 26));
        types.add(new DeviceType("R", resistor, 1, 27));
        types.add(new DeviceType("C", capacitor, 1, 15));
        types.add(new DeviceType("L", inductor, 1, 23));
        types.add(new DeviceType("DIO", diode, 1, 7));
        types.add(new DeviceType("XOR", xor, 1, 1));
        types.add(new DeviceType("PFD", pfd, 1, 1));
        types.add(new DeviceType("INVERTER", inverter, 1, 10));
        types.add(new DeviceType("TRANSMISSION_GATE", transmissionGate, 1, 12));

        List<NetCategory> nets = new ArrayList<>();
        nets.add(NetCategory.singleton(VSS));
        nets.add(NetCategory.singleton(VDD));
        nets.add(NetCategory.internal("NET", 50));
        nets.add(NetCategory.port("VIN", 20));
        nets.add(NetCategory.portWithBareNet("VOUT", 7));
        nets.add(NetCategory.port("IIN", 3));
        nets.add(NetCategory.port("IOUT", 5));
        nets.add(NetCategory.port("VB", 11));
        nets.add(NetCategory.port("IB", 7));
        nets.add(NetCategory.port("VCONT", 21));
        nets.add(NetCategory.port("VCM", 3));
        nets.add(NetCategory.port("VREF", 3));
        nets.add(NetCategory.port("IREF", 3));
        nets.add(NetCategory.port("VRF", 3));
        nets.add(NetCategory.port("VIF", 3));
        nets.add(NetCategory.port("VLO", 5));
        nets.add(NetCategory.port("VBB", 5));

        List<String> circuitTypes = new ArrayList<>();
        Collections.addAll(circuitTypes, "Opamp", "LDO", "Bandgap_Ref", "Power_converter",
                "Oscillator", "General", "Mirror", "Mixer", "Power_Amp", "PLL", "Filter",
                "Comparator", "Voltage_Regulator", "Switched_Cap", "ADC_DAC");

        return new DeviceCatalog(families, types, nets, circuitTypes);
    }

    public List<DeviceFamily> getFamilies() {
        return new ArrayList<>(families.values());
    }

    public DeviceFamily getFamily(String name) {
        return families.get(name);
    }

    public List<DeviceType> getDeviceTypes() {
        return new ArrayList<>(deviceTypes.values());
    }

    public DeviceType getDeviceType(String name) {
        return deviceTypes.get(name);
    }

    /**
     * @return Net categories; the singletons VSS and VDD come first.
     */
    public List<NetCategory> getNetCategories() {
        return new ArrayList<>(netCategories.values());
    }

    public NetCategory getNetCategory(String name) {
        return netCategories.get(name);
    }

    /**
     * @return Circuit type names without the {@value #CIRCUIT_TYPE_PREFIX} prefix.
     */
    public List<String> getCircuitTypes() {
        return circuitTypes;
    }
}
