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

import java.util.List;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.analogwright.grammar.Grammar;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.support.CircuitFixtures;
import com.analogwright.util.BatchOutcome;
import com.analogwright.util.ParallelismTools;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

public class TestBatchGenerator {

    private static final Vocabulary vocab = CircuitFixtures.VOCAB;

    private static final Grammar grammar = new Grammar(vocab);

    private static BatchGenerator uniform() {
        int truncate = vocab.getTruncateToken().getId();
        return new BatchGenerator(grammar, () -> new UniformOracle(vocab.size(), truncate, 20.0));
    }

    @Test
    public void testGenerateAll() {
        Token type = vocab.getCircuitTypeToken("Mixer");
        List<BatchOutcome<TokenSequence>> outcomes = uniform().generateAll(100, 12, 80, type);
        Assertions.assertEquals(12, outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            BatchOutcome<TokenSequence> o = outcomes.get(i);
            Assertions.assertEquals(i, o.getIndex());
            Assertions.assertTrue(o.isSuccess());
            Assertions.assertEquals("Mixer", o.getValue().getCircuitType());
            Assertions.assertEquals(new DecodingController(grammar, new UniformOracle(vocab.size(),
                    vocab.getTruncateToken().getId(), 20.0)).generate(100 + i, 80, type), o.getValue());
        }
    }

    @Test
    public void testSerialMatchesParallel() {
        boolean previous = ParallelismTools.getParallel();
        try {
            ParallelismTools.setParallel(false);
            List<BatchOutcome<TokenSequence>> serial = uniform().generateAll(7, 6, 50, null);
            ParallelismTools.setParallel(true);
            List<BatchOutcome<TokenSequence>> parallel = uniform().generateAll(7, 6, 50, null);
            for (int i = 0; i < 6; i++) {
                Assertions.assertEquals(serial.get(i).getValue(), parallel.get(i).getValue());
            }
        } finally {
            ParallelismTools.setParallel(previous);
        }
    }

    @Test
    public void testFailuresAreReported() {
        BatchGenerator broken = new BatchGenerator(grammar, () -> context -> new double[1]);
        List<BatchOutcome<TokenSequence>> outcomes = broken.generateAll(0, 3, 10, null);
        for (BatchOutcome<TokenSequence> o : outcomes) {
            Assertions.assertFalse(o.isSuccess());
            Assertions.assertTrue(o.getFailure() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testGenerateAsync() {
        Future<TokenSequence> f = uniform().generateAsync(3, 40, null);
        TokenSequence s = ParallelismTools.get(f);
        Assertions.assertFalse(s.isEmpty());
        Assertions.assertTrue(s.size() <= 40);
    }
}
