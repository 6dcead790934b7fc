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
package com.analogwright.generate;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.analogwright.grammar.Grammar;
import com.analogwright.sequence.SequenceCorpus;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.support.CircuitFixtures;

public class TestGenerateSequences {

    @Test
    public void testWritesCorpus(@TempDir Path tempDir) {
        String output = tempDir.resolve("generated.seq").toString();
        GenerateSequences.main(new String[]{"-n", "6", "-l", "60", "-s", "5", "-t", "Filter",
                "--truncate-weight", "30", "-o", output});
        List<TokenSequence> sequences = SequenceCorpus.read(CircuitFixtures.VOCAB, output);
        Assertions.assertEquals(6, sequences.size());
        Grammar grammar = new Grammar(CircuitFixtures.VOCAB);
        for (TokenSequence s : sequences) {
            Assertions.assertEquals("Filter", s.getCircuitType());
            Assertions.assertTrue(s.size() <= 60);
            grammar.validate(s.toIds(), s.isComplete());
        }
    }
}
