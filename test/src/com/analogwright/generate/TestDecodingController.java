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

import java.util.Arrays;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.analogwright.grammar.Grammar;
import com.analogwright.grammar.GrammarOptions;
import com.analogwright.grammar.GrammarState;
import com.analogwright.graph.CircuitGraph;
import com.analogwright.graph.CircuitGraphs;
import com.analogwright.graph.IncompletePinException;
import com.analogwright.sequence.SequenceDecoder;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.support.CircuitFixtures;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

public class TestDecodingController {

    private static final Vocabulary vocab = CircuitFixtures.VOCAB;

    private static final Grammar grammar = new Grammar(vocab);

    private static final String COMMON_SOURCE = "VSS M_BS NM1 M_D VOUT1 R_C R1 R_C VDD R_C R1 R_C VOUT1 "
            + "M_D NM1 M_G VIN1 TRUNCATE";

    @Test
    public void testFollowsScript() {
        ScriptedOracle oracle = new ScriptedOracle(vocab, "CIRCUIT_General " + COMMON_SOURCE);
        DecodingController controller = new DecodingController(grammar, oracle);
        Token type = vocab.getCircuitTypeToken("General");
        TokenSequence s = controller.generate(0, 100, type);
        Assertions.assertEquals("CIRCUIT_General " + COMMON_SOURCE, s.toString());
        Assertions.assertTrue(s.isComplete());
        CircuitGraph g = new SequenceDecoder(grammar).decode(s);
        Assertions.assertTrue(CircuitGraphs.haveSameConnections(CircuitFixtures.commonSource(), g));
        Assertions.assertEquals(s.size() - 1, oracle.getCalls());
    }

    @Test
    public void testUniformOutputIsGrammatical() {
        int truncate = vocab.getTruncateToken().getId();
        DecodingController controller = new DecodingController(grammar,
                new UniformOracle(vocab.size(), truncate, 40.0));
        for (long seed = 0; seed < 30; seed++) {
            TokenSequence s = controller.generate(seed, 120);
            Assertions.assertTrue(s.isComplete() || s.size() == 120);
            Assertions.assertTrue(s.size() <= 120);
            grammar.validate(s.toIds(), false);
        }
    }

    @Test
    public void testSameSeedSameSequence() {
        DecodingController controller = new DecodingController(grammar, new UniformOracle(vocab.size()));
        Assertions.assertEquals(controller.generate(42, 60), controller.generate(42, 60));
    }

    @Test
    public void testLengthBound() {
        DecodingController controller = new DecodingController(grammar, new UniformOracle(vocab.size()));
        Token type = vocab.getCircuitTypeToken("PLL");
        Assertions.assertEquals("CIRCUIT_PLL", controller.generate(1, 1, type).toString());
        TokenSequence cut = new DecodingController(grammar, new ScriptedOracle(vocab, COMMON_SOURCE))
                .generate(1, 5);
        Assertions.assertEquals("VSS M_BS NM1 M_D VOUT1", cut.toString());
        Assertions.assertFalse(cut.isComplete());
        Assertions.assertThrows(IllegalArgumentException.class, () -> controller.generate(1, 0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> controller.generate(1, 10, vocab.getToken("VSS")));
    }

    @Test
    public void testZeroMassIsDeadEnd() {
        int truncate = vocab.getTruncateToken().getId();
        DecodingController controller = new DecodingController(grammar, context -> {
            double[] w = new double[vocab.size()];
            w[truncate] = 1.0;
            return w;
        });
        GrammarDeadEndException e = Assertions.assertThrows(GrammarDeadEndException.class,
                () -> controller.generate(0, 10));
        Assertions.assertEquals(0, e.getPosition());
        Assertions.assertEquals(GrammarState.START, e.getState());
    }

    @Test
    public void testStrictGrammarMasksConflicts() {
        // Oracle insists on rebinding the gate, which only the strict grammar removes
        Grammar strict = new Grammar(vocab, GrammarOptions.strict());
        ProbabilityOracle oracle = new ScriptedOracle(vocab, "VIN1 M_G NM1 M_G VIN2");
        GrammarDeadEndException e = Assertions.assertThrows(GrammarDeadEndException.class,
                () -> new DecodingController(strict, oracle).generate(0, 10));
        Assertions.assertEquals(4, e.getPosition());
        Assertions.assertEquals(GrammarState.AT_PIN_EDGE_FROM_DEVICE, e.getState());
    }

    @Test
    public void testInvalidDistributions() {
        DecodingController shortOracle = new DecodingController(grammar, context -> new double[3]);
        Assertions.assertThrows(IllegalArgumentException.class, () -> shortOracle.generate(0, 10));
        DecodingController negative = new DecodingController(grammar, context -> {
            double[] w = new double[vocab.size()];
            Arrays.fill(w, 1.0);
            w[vocab.getId("VSS")] = -0.5;
            return w;
        });
        Assertions.assertThrows(IllegalArgumentException.class, () -> negative.generate(0, 10));
        DecodingController nan = new DecodingController(grammar, context -> {
            double[] w = new double[vocab.size()];
            Arrays.fill(w, Double.NaN);
            return w;
        });
        Assertions.assertThrows(IllegalArgumentException.class, () -> nan.generate(0, 10));
    }

    @Test
    public void testEarlyTruncateDecodesToIncompleteDevice() {
        TokenSequence s = new DecodingController(grammar, new ScriptedOracle(vocab, "VIN1 M_G NM1 TRUNCATE"))
                .generate(0, 10);
        Assertions.assertEquals("VIN1 M_G NM1 TRUNCATE", s.toString());
        Assertions.assertThrows(IncompletePinException.class, () -> new SequenceDecoder(grammar).decode(s));

        DecodingController strict = new DecodingController(new Grammar(vocab, GrammarOptions.strict()),
                new ScriptedOracle(vocab, "VIN1 M_G NM1 TRUNCATE"));
        GrammarDeadEndException e = Assertions.assertThrows(GrammarDeadEndException.class,
                () -> strict.generate(0, 10));
        Assertions.assertEquals(3, e.getPosition());
        Assertions.assertEquals(GrammarState.AT_DEVICE, e.getState());
    }

    @Test
    public void testCancel() {
        DecodingController[] holder = new DecodingController[1];
        UniformOracle uniform = new UniformOracle(vocab.size(), vocab.getTruncateToken().getId(), 0.0);
        holder[0] = new DecodingController(grammar, context -> {
            if (context.length == 5) holder[0].cancel();
            return uniform.nextTokenDistribution(context);
        });
        Assertions.assertThrows(CancellationException.class, () -> holder[0].generate(0, 50));
        Assertions.assertTrue(holder[0].isCancelled());
    }

    @Test
    public void testInterrupt() {
        DecodingController controller = new DecodingController(grammar, new UniformOracle(vocab.size()));
        Thread.currentThread().interrupt();
        try {
            Assertions.assertThrows(CancellationException.class, () -> controller.generate(0, 50));
        } finally {
            Thread.interrupted();
        }
    }
}
