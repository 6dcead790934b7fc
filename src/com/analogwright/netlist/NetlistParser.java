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
package com.analogwright.netlist;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.analogwright.AnalogWrightException;
import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.DeviceNode;
import com.analogwright.graph.NetNode;
import com.analogwright.util.FileTools;
import com.analogwright.vocab.DeviceCatalog;
import com.analogwright.vocab.DeviceFamily;
import com.analogwright.vocab.DeviceType;
import com.analogwright.vocab.NetCategory;
import com.analogwright.vocab.PinLabel;

/**
 * Reads the device lines of a SPICE-style netlist into a {@link CircuitGraph}. Each device line has
 * the form
 * <pre>
 *   MM9 (VOUT1 net12 VSS VSS) nmos4
 * </pre>
 * with the nets listed in the pin order of the device type (D G S B for MOSFETs, C B E for BJTs,
 * P N for diodes, two terminals for passives). Devices are renumbered per type in order of
 * appearance (NM1, NM2, ...). VDD, VSS and port nets (VIN1, VOUT2, and the bare VOUT) keep their
 * names, while an unnumbered port of any other category (VIN) is rejected; all
 * other nets are sorted by name and renamed NET1, NET2, .... Pins of one device tied to the same
 * net become one compound pin-edge (M_BS), except for digital devices whose tied pins become
 * parallel edges.
 * <p>
 * By default a netlist containing digital devices or digital control nets is rejected, and lines
 * naming other device types (sources, subcircuit instances) are ignored.
 */
public class NetlistParser {

    private static final Pattern DEVICE_LINE = Pattern.compile("(\\S+)\\s*\\((.*?)\\)\\s*(\\S+).*");

    /** Net names marking digital control signals */
    public static final List<String> DIGITAL_NETS = Collections.unmodifiableList(Arrays.asList(
            "VCLK", "LOGICA", "LOGICB", "LOGICD", "LOGICF", "LOGICG",
            "LOGICQ", "LOGICQA", "LOGICQB", "VLATCH", "VHOLD", "VTRACK"));

    private static final Map<String, String> DEVICE_TYPES = new HashMap<>();

    private static final Map<String, String[]> DEVICE_PINS = new HashMap<>();

    private static final Set<String> DIGITAL_TYPES = new LinkedHashSet<>();

    static {
        addType("nmos4", "NM", "D", "G", "S", "B");
        addType("nmos", "NM", "D", "G", "S", "B");
        addType("pmos4", "PM", "D", "G", "S", "B");
        addType("pmos", "PM", "D", "G", "S", "B");
        addType("npn", "NPN", "C", "B", "E");
        addType("pnp", "PNP", "C", "B", "E");
        addType("resistor", "R", "C", "C");
        addType("capacitor", "C", "C", "C");
        addType("inductor", "L", "C", "C");
        addType("diode", "DIO", "P", "N");
        addType("xor", "XOR", "A", "B", "VDD", "VSS", "Y");
        addType("pfd", "PFD", "A", "B", "QA", "QB", "VDD", "VSS");
        addType("inverter", "INVERTER", "A", "Q", "VDD", "VSS");
        addType("transmission_gate", "TRANSMISSION_GATE", "A", "B", "C", "VDD", "VSS");
        Collections.addAll(DIGITAL_TYPES, "xor", "pfd", "inverter", "transmission_gate");
    }

    private static void addType(String spiceType, String deviceType, String... pins) {
        DEVICE_TYPES.put(spiceType, deviceType);
        DEVICE_PINS.put(spiceType, pins);
    }

    private final DeviceCatalog catalog;

    private boolean excludeDigital = true;

    private boolean ignoreUnknownDevices = true;

    private final List<NetCategory> portsLongestFirst;

    public NetlistParser(DeviceCatalog catalog) {
        this.catalog = catalog;
        this.portsLongestFirst = new ArrayList<>();
        for (NetCategory category : catalog.getNetCategories()) {
            if (!category.isSingleton() && !category.isInternal()) {
                portsLongestFirst.add(category);
            }
        }
        portsLongestFirst.sort(new Comparator<NetCategory>() {
            @Override
            public int compare(NetCategory a, NetCategory b) {
                return Integer.compare(b.getName().length(), a.getName().length());
            }
        });
    }

    public NetlistParser setExcludeDigital(boolean excludeDigital) {
        this.excludeDigital = excludeDigital;
        return this;
    }

    public boolean isExcludingDigital() {
        return excludeDigital;
    }

    public NetlistParser setIgnoreUnknownDevices(boolean ignoreUnknownDevices) {
        this.ignoreUnknownDevices = ignoreUnknownDevices;
        return this;
    }

    public boolean isIgnoringUnknownDevices() {
        return ignoreUnknownDevices;
    }

    /**
     * Checks whether a net name is one of the digital control signals.
     */
    public static boolean isDigitalNet(String net) {
        String upper = net.toUpperCase(Locale.ROOT);
        for (String digital : DIGITAL_NETS) {
            if (upper.contains(digital)) return true;
        }
        return false;
    }

    public CircuitGraph parseFile(String fileName, String circuitType) {
        try {
            return parse(FileTools.getLinesFromTextFile(fileName), circuitType);
        } catch (NetlistParseException e) {
            throw new NetlistParseException(fileName + ": " + e.getMessage(), e);
        }
    }

    public CircuitGraph parse(List<String> lines) {
        return parse(lines, null);
    }

    /**
     * Parses netlist lines.
     * @param lines Netlist text, one statement per line.
     * @param circuitType Circuit type to tag the graph with (without the CIRCUIT_ prefix), or null.
     * @return The circuit, complete and with nets renamed.
     * @throws NetlistParseException if the netlist is digital (when excluded), has no devices,
     *         lists the wrong number of nets for a device, exceeds a catalog range or leaves a
     *         device pin unconnected.
     */
    public CircuitGraph parse(List<String> lines, String circuitType) {
        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        List<String[]> netLists = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("*")) continue;
            Matcher m = DEVICE_LINE.matcher(line);
            if (!m.matches()) continue;
            String spiceType = m.group(3).toLowerCase(Locale.ROOT);
            String netsText = m.group(2).trim();
            String[] nets = netsText.isEmpty() ? new String[0] : netsText.split("\\s+");
            if (excludeDigital) {
                if (DIGITAL_TYPES.contains(spiceType)) {
                    throw new NetlistParseException("Line " + (i + 1) + ": digital device " + m.group(1)
                            + " (" + spiceType + ")");
                }
                for (String net : nets) {
                    if (isDigitalNet(net)) {
                        throw new NetlistParseException("Line " + (i + 1) + ": digital control net " + net);
                    }
                }
            }
            if (!DEVICE_TYPES.containsKey(spiceType)) {
                if (ignoreUnknownDevices) continue;
                throw new NetlistParseException("Line " + (i + 1) + ": unknown device type " + spiceType);
            }
            if (nets.length != DEVICE_PINS.get(spiceType).length) {
                throw new NetlistParseException("Line " + (i + 1) + ": " + spiceType + " " + m.group(1)
                        + " lists " + nets.length + " nets, expected " + DEVICE_PINS.get(spiceType).length);
            }
            names.add(m.group(1));
            types.add(spiceType);
            netLists.add(nets);
            lineNumbers.add(i + 1);
        }
        if (names.isEmpty()) {
            throw new NetlistParseException("Netlist contains no supported devices");
        }

        Map<String, NetNode> netMap = mapNets(netLists);
        CircuitGraph graph = new CircuitGraph(circuitType);
        Map<String, Integer> counters = new HashMap<>();
        for (int d = 0; d < names.size(); d++) {
            String spiceType = types.get(d);
            DeviceType type = catalog.getDeviceType(DEVICE_TYPES.get(spiceType));
            int index = counters.merge(type.getName(), 1, Integer::sum);
            if (!type.isInRange(index)) {
                throw new NetlistParseException("Line " + lineNumbers.get(d) + ": more than "
                        + type.getMaxIndex() + " devices of type " + type);
            }
            DeviceNode device = new DeviceNode(type, index);
            try {
                addDevice(graph, device, DEVICE_PINS.get(spiceType), netLists.get(d), netMap,
                        DIGITAL_TYPES.contains(spiceType));
            } catch (AnalogWrightException e) {
                throw new NetlistParseException("Line " + lineNumbers.get(d) + ": " + e.getMessage(), e);
            }
        }
        try {
            graph.requireComplete();
        } catch (AnalogWrightException e) {
            throw new NetlistParseException(e.getMessage(), e);
        }
        return graph;
    }

    private void addDevice(CircuitGraph graph, DeviceNode device, String[] pins, String[] nets,
                           Map<String, NetNode> netMap, boolean digital) {
        DeviceFamily family = device.getFamily();
        graph.addNode(device);
        if (digital) {
            for (int p = 0; p < pins.length; p++) {
                PinLabel label = family.getLabelForPins(Collections.singleton(pins[p]));
                graph.addEdge(device, netMap.get(nets[p]), label);
            }
            return;
        }
        Map<NetNode, Set<String>> pinsByNet = new LinkedHashMap<>();
        for (int p = 0; p < pins.length; p++) {
            pinsByNet.computeIfAbsent(netMap.get(nets[p]), k -> new TreeSet<>()).add(pins[p]);
        }
        for (Map.Entry<NetNode, Set<String>> e : pinsByNet.entrySet()) {
            PinLabel label = family.getLabelForPins(e.getValue());
            if (label == null) {
                throw new NetlistParseException("No pin label of family " + family + " ties pins "
                        + e.getValue() + " of " + device);
            }
            graph.addEdge(device, e.getKey(), label);
        }
    }

    /**
     * Maps netlist net names to nodes: singletons and ports by name, everything else to NET1, NET2,
     * ... in sorted name order.
     */
    Map<String, NetNode> mapNets(List<String[]> netLists) {
        Map<String, NetNode> map = new HashMap<>();
        TreeSet<String> internal = new TreeSet<>();
        for (String[] nets : netLists) {
            for (String net : nets) {
                if (map.containsKey(net) || internal.contains(net)) continue;
                NetNode node = toExternalNet(net);
                if (node == null) {
                    internal.add(net);
                } else {
                    map.put(net, node);
                }
            }
        }
        NetCategory internalCategory = null;
        for (NetCategory category : catalog.getNetCategories()) {
            if (category.isInternal()) {
                internalCategory = category;
                break;
            }
        }
        if (internalCategory == null) {
            throw new IllegalStateException("Device catalog declares no internal net category");
        }
        if (internal.size() > internalCategory.getRangeSize()) {
            throw new NetlistParseException("Netlist has " + internal.size() + " internal nets, at most "
                    + internalCategory.getRangeSize() + " are supported");
        }
        int index = internalCategory.getMinIndex();
        for (String net : internal) {
            map.put(net, new NetNode(internalCategory, index++));
        }
        return map;
    }

    private NetNode toExternalNet(String net) {
        String upper = net.toUpperCase(Locale.ROOT);
        for (NetCategory category : catalog.getNetCategories()) {
            if (category.isSingleton() && category.getName().equals(upper)) {
                return new NetNode(category);
            }
        }
        for (NetCategory category : portsLongestFirst) {
            if (!upper.startsWith(category.getName())) continue;
            String suffix = upper.substring(category.getName().length());
            if (suffix.isEmpty()) {
                if (!category.hasBareNet()) {
                    throw new NetlistParseException("Port " + net + " has no index, " + category
                            + " ports are numbered [" + category.getMinIndex() + "," + category.getMaxIndex() + "]");
                }
                return new NetNode(category, NetCategory.BARE_INDEX);
            }
            if (suffix.length() <= 9 && suffix.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(suffix);
                if (index < category.getMinIndex() || index > category.getMaxIndex()) {
                    throw new NetlistParseException("Port " + net + " is outside the range of "
                            + category + " [" + category.getMinIndex() + "," + category.getMaxIndex() + "]");
                }
                return new NetNode(category, index);
            }
        }
        return null;
    }
}
