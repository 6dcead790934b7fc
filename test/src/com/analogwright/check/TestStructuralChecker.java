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
package com.analogwright.check;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.support.CircuitFixtures;

public class TestStructuralChecker {

    private final CircuitChecker checker = new StructuralChecker();

    @Test
    public void testValidCircuits() {
        Assertions.assertTrue(checker.check(CircuitFixtures.ota()).isValid());
        Assertions.assertSame(CheckResult.valid(), checker.check(CircuitFixtures.singleMosfet()));
        Assertions.assertEquals("VALID", CheckResult.valid().toString());
    }

    @Test
    public void testEmptyCircuit() {
        CheckResult r = checker.check(new CircuitGraph());
        Assertions.assertFalse(r.isValid());
        Assertions.assertEquals(1, r.getViolations().size());
        Assertions.assertEquals("Circuit has no devices", r.getViolations().get(0));
    }

    @Test
    public void testCollectsAllViolations() {
        CircuitGraph g = CircuitFixtures.commonSource();
        g.addEdge(CircuitFixtures.device("PM", 1), CircuitFixtures.net("VB", 1), CircuitFixtures.label("M_G"));
        g.addNode(CircuitFixtures.net("VREF", 2));
        CheckResult r = checker.check(g);
        Assertions.assertFalse(r.isValid());
        Assertions.assertEquals(3, r.getViolations().size());
        Assertions.assertTrue(r.getViolations().get(0).startsWith("PM1 has unassigned pins"));
        Assertions.assertEquals("VREF2 is isolated", r.getViolations().get(1));
        Assertions.assertEquals("Circuit has 3 connected components", r.getViolations().get(2));
        Assertions.assertTrue(r.toString().startsWith("INVALID"));
    }
}
