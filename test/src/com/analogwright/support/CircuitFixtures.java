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
package com.analogwright.support;

import java.util.Arrays;
import java.util.List;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.NetNode;
import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.PinLabel;
import com.analogwright.vocab.Vocabulary;

/**
 * Small circuits shared by the tests.
 */
public class CircuitFixtures {

    public static final Vocabulary VOCAB = Vocabulary.buildDefault();

    /** Five-transistor OTA with a load capacitor, as written by a netlister */
    public static final List<String> OTA_NETLIST = Arrays.asList(
            "// Library name: analog",
            "* five transistor OTA",
            "MM1 (net5 net5 VDD VDD) pmos4 w=2u l=180n",
            "MM2 (VOUT1 net5 VDD VDD) pmos4 w=2u l=180n",
            "MM3 (net5 VIN1 net7 VSS) nmos4 w=1u l=180n",
            "MM4 (VOUT1 VIN2 net7 VSS) nmos4 w=1u l=180n",
            "MM5 (net7 VB1 VSS VSS) nmos4 w=4u l=360n",
            "C0 (VOUT1 VSS) capacitor c=1p",
            "V0 (VDD 0) vsource dc=1.8");

    public static DeviceNode device(String type, int index) {
        return new DeviceNode(VOCAB.getCatalog().getDeviceType(type), index);
    }

    public static NetNode net(String category, int index) {
        return new NetNode(VOCAB.getCatalog().getNetCategory(category), index);
    }

    public static NetNode vss() {
        return new NetNode(VOCAB.getCatalog().getNetCategory(DeviceCatalog.VSS));
    }

    public static NetNode vdd() {
        return new NetNode(VOCAB.getCatalog().getNetCategory(DeviceCatalog.VDD));
    }

    public static PinLabel label(String name) {
        return VOCAB.getToken(name).getPinLabel();
    }

    /**
     * NM1 with G to VIN1, D to VOUT1, and S and B to VSS on two separate edges.
     */
    public static CircuitGraph singleMosfet() {
        CircuitGraph g = new CircuitGraph();
        DeviceNode nm1 = device("NM", 1);
        g.addEdge(nm1, net("VIN", 1), label("M_G"));
        g.addEdge(nm1, net("VOUT", 1), label("M_D"));
        g.addEdge(nm1, vss(), label("M_S"));
        g.addEdge(nm1, vss(), label("M_B"));
        return g;
    }

    /**
     * Common-source stage with a resistive load.
     */
    public static CircuitGraph commonSource() {
        CircuitGraph g = new CircuitGraph("General");
        DeviceNode nm1 = device("NM", 1);
        DeviceNode r1 = device("R", 1);
        g.addEdge(nm1, net("VOUT", 1), label("M_D"));
        g.addEdge(nm1, net("VIN", 1), label("M_G"));
        g.addEdge(nm1, vss(), label("M_BS"));
        g.addEdge(r1, vdd(), label("R_C"));
        g.addEdge(r1, net("VOUT", 1), label("R_C"));
        return g;
    }

    /**
     * The circuit of {@link #OTA_NETLIST}, built by hand.
     */
    public static CircuitGraph ota() {
        CircuitGraph g = new CircuitGraph("Opamp");
        DeviceNode pm1 = device("PM", 1);
        DeviceNode pm2 = device("PM", 2);
        DeviceNode nm1 = device("NM", 1);
        DeviceNode nm2 = device("NM", 2);
        DeviceNode nm3 = device("NM", 3);
        DeviceNode c1 = device("C", 1);
        NetNode net1 = net("NET", 1);
        NetNode net2 = net("NET", 2);
        NetNode vout1 = net("VOUT", 1);

        g.addEdge(pm1, net1, label("M_DG"));
        g.addEdge(pm1, vdd(), label("M_BS"));
        g.addEdge(pm2, vout1, label("M_D"));
        g.addEdge(pm2, net1, label("M_G"));
        g.addEdge(pm2, vdd(), label("M_BS"));
        g.addEdge(nm1, net1, label("M_D"));
        g.addEdge(nm1, net("VIN", 1), label("M_G"));
        g.addEdge(nm1, net2, label("M_S"));
        g.addEdge(nm1, vss(), label("M_B"));
        g.addEdge(nm2, vout1, label("M_D"));
        g.addEdge(nm2, net("VIN", 2), label("M_G"));
        g.addEdge(nm2, net2, label("M_S"));
        g.addEdge(nm2, vss(), label("M_B"));
        g.addEdge(nm3, net2, label("M_D"));
        g.addEdge(nm3, net("VB", 1), label("M_G"));
        g.addEdge(nm3, vss(), label("M_BS"));
        g.addEdge(c1, vout1, label("C_C"));
        g.addEdge(c1, vss(), label("C_C"));
        return g;
    }
}
