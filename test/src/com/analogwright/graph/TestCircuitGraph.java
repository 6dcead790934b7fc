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
package com.analogwright.graph;

import static com.analogwright.support.CircuitFixtures.device;
import static com.analogwright.support.CircuitFixtures.label;
import static com.analogwright.support.CircuitFixtures.net;
import static com.analogwright.support.CircuitFixtures.vdd;
import static com.analogwright.support.CircuitFixtures.vss;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.analogwright.support.CircuitFixtures;
import com.analogwright.vocab.UnknownTokenException;

public class TestCircuitGraph {

    @Test
    public void testNodesAreValueObjects() {
        Assertions.assertEquals(device("NM", 3), device("NM", 3));
        Assertions.assertNotEquals(device("NM", 3), device("PM", 3));
        Assertions.assertEquals(vss(), CircuitNode.of(CircuitFixtures.VOCAB.getToken("VSS")));
        Assertions.assertEquals(net("VIN", 2), CircuitNode.of(CircuitFixtures.VOCAB.getToken("VIN2")));
        Assertions.assertEquals("NM3", device("NM", 3).getName());
        Assertions.assertEquals("NM", device("NM", 3).getKindName());
        Assertions.assertEquals("VIN", net("VIN", 2).getKindName());
        Assertions.assertSame(CircuitFixtures.VOCAB.getToken("C4"), device("C", 4).toToken(CircuitFixtures.VOCAB));
    }

    @Test
    public void testNodesOutsideCatalogRange() {
        Assertions.assertThrows(UnknownTokenException.class, () -> device("NM", 0));
        Assertions.assertThrows(UnknownTokenException.class, () -> device("DIO", 8));
        Assertions.assertThrows(UnknownTokenException.class, () -> net("NET", 51));
        Assertions.assertThrows(UnknownTokenException.class,
                () -> CircuitNode.of(CircuitFixtures.VOCAB.getToken("M_G")));
    }

    @Test
    public void testSingleMosfetStructure() {
        CircuitGraph g = CircuitFixtures.singleMosfet();
        Assertions.assertEquals(1, g.getDevices().size());
        Assertions.assertEquals(3, g.getNets().size());
        Assertions.assertEquals(4, g.getEdgeCount());
        Assertions.assertEquals(4, g.edgesOf(device("NM", 1)).size());
        Assertions.assertEquals(2, g.edgesOf(vss()).size());
        Assertions.assertEquals(Arrays.asList(device("NM", 1), net("VIN", 1), net("VOUT", 1), vss()), g.getNodes());
        Assertions.assertTrue(g.isComplete());
        Assertions.assertTrue(g.isConnected());
        Assertions.assertTrue(g.getIsolatedNodes().isEmpty());
        Assertions.assertEquals(2, g.asGraph().getAllEdges(device("NM", 1), vss()).size());
    }

    @Test
    public void testEdgeEndpoints() {
        CircuitGraph g = CircuitFixtures.singleMosfet();
        PinEdge e = g.getEdges().get(0);
        Assertions.assertEquals("(NM1 M_G VIN1)", e.toString());
        Assertions.assertEquals(net("VIN", 1), e.getOpposite(device("NM", 1)));
        Assertions.assertEquals(device("NM", 1), e.getOpposite(net("VIN", 1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> e.getOpposite(vss()));
    }

    @Test
    public void testIdenticalConnectionIsNotDuplicated() {
        CircuitGraph g = CircuitFixtures.singleMosfet();
        PinEdge first = g.getEdges().get(0);
        PinEdge again = g.addEdge(device("NM", 1), net("VIN", 1), label("M_G"));
        Assertions.assertSame(first, again);
        Assertions.assertEquals(4, g.getEdgeCount());
    }

    @Test
    public void testConflictingPinBinding() {
        CircuitGraph g = CircuitFixtures.singleMosfet();
        Assertions.assertThrows(DuplicateEdgeException.class,
                () -> g.addEdge(device("NM", 1), net("VIN", 2), label("M_G")));
        Assertions.assertThrows(DuplicateEdgeException.class,
                () -> g.addEdge(device("NM", 1), vdd(), label("M_BS")));
        Assertions.assertEquals(4, g.getEdgeCount());
        Assertions.assertFalse(g.containsNode(net("VIN", 2)));
        Assertions.assertFalse(g.containsNode(vdd()));
    }

    @Test
    public void testCompoundLabelOverlappingBoundPin() {
        CircuitGraph g = new CircuitGraph();
        g.addEdge(device("NM", 1), net("NET", 1), label("M_D"));
        Assertions.assertThrows(DuplicateEdgeException.class,
                () -> g.addEdge(device("NM", 1), net("NET", 2), label("M_DG")));
        g.addEdge(device("NM", 1), net("NET", 1), label("M_DG"));
        Assertions.assertEquals(Collections.singleton(net("NET", 1)),
                g.getPinAssignment(device("NM", 1)).getNets("G"));
    }

    @Test
    public void testPassiveTerminalTakesTwoNets() {
        CircuitGraph g = new CircuitGraph();
        g.addEdge(device("R", 1), net("NET", 1), label("R_C"));
        Assertions.assertFalse(g.isComplete());
        Assertions.assertEquals(Collections.singletonList("C"), g.getPinAssignment(device("R", 1)).getMissingPins());
        g.addEdge(device("R", 1), net("NET", 2), label("R_C"));
        Assertions.assertTrue(g.isComplete());
        Assertions.assertThrows(DuplicateEdgeException.class,
                () -> g.addEdge(device("R", 1), net("NET", 3), label("R_C")));
    }

    @Test
    public void testLabelOfWrongFamily() {
        CircuitGraph g = new CircuitGraph();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> g.addEdge(device("NPN", 1), net("NET", 1), label("M_G")));
        Assertions.assertEquals(0, g.getNodeCount());
    }

    @Test
    public void testIncompleteDevice() {
        CircuitGraph g = new CircuitGraph();
        g.addEdge(device("NM", 1), net("VIN", 1), label("M_G"));
        g.addEdge(device("NM", 1), vss(), label("M_BS"));
        Assertions.assertEquals(Collections.singletonList(device("NM", 1)), g.getIncompleteDevices());
        IncompletePinException e = Assertions.assertThrows(IncompletePinException.class, g::requireComplete);
        Assertions.assertTrue(e.getMessage().contains("NM1"));
        Assertions.assertTrue(e.getMessage().contains("[D]"));
    }

    @Test
    public void testComponents() {
        CircuitGraph g = CircuitFixtures.singleMosfet();
        g.addNode(net("NET", 9));
        Assertions.assertFalse(g.isConnected());
        Assertions.assertEquals(Collections.singletonList(net("NET", 9)), g.getIsolatedNodes());
        Assertions.assertEquals(2, g.getComponents().size());
        Assertions.assertFalse(new CircuitGraph().isConnected());
    }

    @Test
    public void testReadOnlyView() {
        CircuitGraph g = CircuitFixtures.commonSource();
        Assertions.assertThrows(UnsupportedOperationException.class, () -> g.asGraph().addVertex(net("NET", 1)));
        Assertions.assertEquals(g.getEdgeCount(), g.asGraph().edgeSet().size());
    }
}
