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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.TreeSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestDeviceCatalog {

    private static final DeviceCatalog catalog = DeviceCatalog.defaultCatalog();

    @Test
    public void testDefaultCatalogIsShared() {
        Assertions.assertSame(catalog, DeviceCatalog.defaultCatalog());
    }

    @Test
    public void testMosfetLabels() {
        DeviceFamily mosfet = catalog.getFamily("MOSFET");
        Assertions.assertEquals(Arrays.asList("D", "G", "S", "B"), mosfet.getPins());
        Assertions.assertEquals(15, mosfet.getLabels().size());
        PinLabel dg = mosfet.getLabel("M_DG");
        Assertions.assertTrue(dg.isCompound());
        Assertions.assertEquals(new HashSet<>(Arrays.asList("D", "G")), dg.getPins());
        Assertions.assertSame(dg, mosfet.getLabelForPins(new TreeSet<>(Arrays.asList("G", "D"))));
        Assertions.assertSame(mosfet.getLabel("M_BDGS"),
                mosfet.getLabelForPins(new HashSet<>(Arrays.asList("B", "D", "G", "S"))));
        Assertions.assertTrue(mosfet.hasLabel(dg));
        Assertions.assertFalse(catalog.getFamily("BJT").hasLabel(dg));
    }

    @Test
    public void testDiodeAliasIsNotCanonical() {
        DeviceFamily diode = catalog.getFamily("DIODE");
        PinLabel np = diode.getLabel("D_NP");
        PinLabel pn = diode.getLabel("D_PN");
        Assertions.assertEquals(np.getPins(), pn.getPins());
        Assertions.assertSame(np, diode.getLabelForPins(new HashSet<>(Arrays.asList("P", "N"))));
    }

    @Test
    public void testPassiveTerminalCapacity() {
        for (String name : Arrays.asList("RESISTOR", "CAPACITOR", "INDUCTOR")) {
            DeviceFamily family = catalog.getFamily(name);
            Assertions.assertEquals(Collections.singletonList("C"), family.getPins());
            Assertions.assertEquals(2, family.getPinCapacity("C"));
            Assertions.assertEquals(1, family.getLabels().size());
        }
        Assertions.assertEquals(1, catalog.getFamily("MOSFET").getPinCapacity("G"));
        Assertions.assertEquals(0, catalog.getFamily("MOSFET").getPinCapacity("Y"));
    }

    @Test
    public void testDeviceTypeRanges() {
        DeviceType nm = catalog.getDeviceType("NM");
        Assertions.assertEquals(1, nm.getMinIndex());
        Assertions.assertEquals(34, nm.getMaxIndex());
        Assertions.assertTrue(nm.isInRange(34));
        Assertions.assertFalse(nm.isInRange(0));
        Assertions.assertEquals("NM12", nm.getTokenName(12));
        Assertions.assertSame(catalog.getFamily("MOSFET"), catalog.getDeviceType("PM").getFamily());
        Assertions.assertEquals(1, catalog.getDeviceType("PFD").getRangeSize());
        Assertions.assertNull(catalog.getDeviceType("JFET"));
    }

    @Test
    public void testNetCategories() {
        NetCategory vss = catalog.getNetCategory(DeviceCatalog.VSS);
        Assertions.assertTrue(vss.isSingleton());
        Assertions.assertEquals("VSS", vss.getTokenName(0));
        Assertions.assertTrue(vss.isInRange(0));
        Assertions.assertFalse(vss.isInRange(1));
        Assertions.assertEquals(1, vss.getRangeSize());

        NetCategory net = catalog.getNetCategory("NET");
        Assertions.assertTrue(net.isInternal());
        Assertions.assertEquals(50, net.getRangeSize());
        Assertions.assertFalse(catalog.getNetCategory("VIN").isInternal());

        NetCategory vout = catalog.getNetCategory("VOUT");
        Assertions.assertTrue(vout.hasBareNet());
        Assertions.assertTrue(vout.isInRange(0));
        Assertions.assertEquals("VOUT", vout.getTokenName(0));
        Assertions.assertEquals("VOUT1", vout.getTokenName(1));
        Assertions.assertEquals(7, vout.getRangeSize());
        Assertions.assertEquals(8, vout.getTokenCount());
        NetCategory vin = catalog.getNetCategory("VIN");
        Assertions.assertFalse(vin.hasBareNet());
        Assertions.assertFalse(vin.isInRange(0));
        Assertions.assertEquals(20, vin.getTokenCount());
        Assertions.assertEquals(DeviceCatalog.VSS, catalog.getNetCategories().get(0).getName());
        Assertions.assertEquals(DeviceCatalog.VDD, catalog.getNetCategories().get(1).getName());
    }

    @Test
    public void testCircuitTypes() {
        Assertions.assertEquals(15, catalog.getCircuitTypes().size());
        Assertions.assertTrue(catalog.getCircuitTypes().contains("Opamp"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> catalog.getCircuitTypes().add("Toaster"));
    }
}
