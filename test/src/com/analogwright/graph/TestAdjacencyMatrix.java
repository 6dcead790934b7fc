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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.analogwright.support.CircuitFixtures;
import com.analogwright.vocab.UnknownTokenException;

public class TestAdjacencyMatrix {

    @Test
    public void testLayout() {
        List<String> lines = AdjacencyMatrix.toLines(CircuitFixtures.singleMosfet());
        Assertions.assertEquals(5, lines.size());
        Assertions.assertEquals(",NM1,VIN1,VOUT1,VSS", lines.get(0));
        Assertions.assertEquals("NM1,0,M_G,M_D,M_S+M_B", lines.get(1));
        Assertions.assertEquals("VIN1,M_G,0,0,0", lines.get(2));
        Assertions.assertEquals("VSS,M_S+M_B,0,0,0", lines.get(4));
    }

    @Test
    public void testCircuitTypeInCorner() {
        List<String> lines = AdjacencyMatrix.toLines(CircuitFixtures.ota());
        Assertions.assertTrue(lines.get(0).startsWith("CIRCUIT_Opamp,PM1,"));
        CircuitGraph g = AdjacencyMatrix.fromLines(CircuitFixtures.VOCAB, lines);
        Assertions.assertEquals("Opamp", g.getCircuitType());
    }

    @Test
    public void testWriteAndRead(@TempDir Path tempDir) {
        CircuitGraph ota = CircuitFixtures.ota();
        String fileName = tempDir.resolve("ota.csv").toString();
        AdjacencyMatrix.write(ota, fileName);
        CircuitGraph read = AdjacencyMatrix.read(CircuitFixtures.VOCAB, fileName);
        Assertions.assertTrue(CircuitGraphs.haveSameConnections(ota, read));
        Assertions.assertEquals(ota.getNodes(), read.getNodes());
        Assertions.assertTrue(read.isComplete());
    }

    @Test
    public void testUnknownNodeName() {
        List<String> lines = new ArrayList<>(AdjacencyMatrix.toLines(CircuitFixtures.singleMosfet()));
        lines.set(0, ",NM1,VIN1,VOUT99,VSS");
        Assertions.assertThrows(UnknownTokenException.class,
                () -> AdjacencyMatrix.fromLines(CircuitFixtures.VOCAB, lines));
    }

    @Test
    public void testNonSquareMatrix() {
        List<String> lines = new ArrayList<>(AdjacencyMatrix.toLines(CircuitFixtures.singleMosfet()));
        lines.remove(lines.size() - 1);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> AdjacencyMatrix.fromLines(CircuitFixtures.VOCAB, lines));
    }

    @Test
    public void testCellHoldingNodeName() {
        List<String> lines = new ArrayList<>(AdjacencyMatrix.toLines(CircuitFixtures.singleMosfet()));
        lines.set(1, "NM1,0,VIN1,M_D,M_S+M_B");
        Assertions.assertThrows(UnknownTokenException.class,
                () -> AdjacencyMatrix.fromLines(CircuitFixtures.VOCAB, lines));
    }
}
