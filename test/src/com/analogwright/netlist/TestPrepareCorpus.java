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

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitGraphs;
import com.analogwright.sequence.DecodeCorpus;
import com.analogwright.sequence.SequenceCorpus;
import com.analogwright.sequence.SequenceDecoder;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.support.CircuitFixtures;
import com.analogwright.util.FileTools;
import com.analogwright.vocab.VocabularyTable;

public class TestPrepareCorpus {

    @Test
    public void testNetlistsToCorpusAndBack(@TempDir Path tempDir) {
        String ota = tempDir.resolve("ota.cir").toString();
        String broken = tempDir.resolve("broken.cir").toString();
        FileTools.writeLinesToTextFile(CircuitFixtures.OTA_NETLIST, ota);
        FileTools.writeLinesToTextFile(Arrays.asList("MM0 (VOUT1 VIN1) nmos4"), broken);
        String corpus = tempDir.resolve("ota.seq").toString();
        String csvDir = tempDir.resolve("csv").toString();
        String table = tempDir.resolve("vocab.txt").toString();

        PrepareCorpus.main(new String[]{"-o", corpus, "-t", "Opamp", "-n", "5", "-r", "1", "-s", "3",
                "--csv-dir", csvDir, "--vocab-table", table, "--pad", "-l", "200", ota, broken});

        List<TokenSequence> sequences = SequenceCorpus.read(CircuitFixtures.VOCAB, corpus);
        Assertions.assertEquals(10, sequences.size());
        Assertions.assertEquals(200, SequenceCorpus.readIds(CircuitFixtures.VOCAB, corpus).get(0).length);
        SequenceDecoder decoder = new SequenceDecoder(CircuitFixtures.VOCAB);
        for (TokenSequence s : sequences) {
            Assertions.assertEquals("Opamp", s.getCircuitType());
            CircuitGraph g = decoder.decode(s);
            Assertions.assertTrue(CircuitGraphs.isIsomorphic(CircuitFixtures.ota(), g));
        }
        Assertions.assertTrue(new File(csvDir, "ota.csv").isFile());
        Assertions.assertFalse(new File(csvDir, "broken.csv").exists());
        VocabularyTable.verify(CircuitFixtures.VOCAB, table);

        String decodedDir = tempDir.resolve("decoded").toString();
        DecodeCorpus.main(new String[]{"-c", corpus, "--csv-dir", decodedDir});
        Assertions.assertTrue(new File(decodedDir, "circuit_0.csv").isFile());
        Assertions.assertTrue(new File(decodedDir, "circuit_9.csv").isFile());
    }
}
