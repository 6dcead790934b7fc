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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import com.analogwright.grammar.Grammar;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.util.BatchOutcome;
import com.analogwright.util.MessageGenerator;
import com.analogwright.util.ParallelismTools;
import com.analogwright.vocab.Token;

/**
 * Runs many independent generations through {@link ParallelismTools}. Generation {@code i} uses a
 * fresh {@link DecodingController}, an oracle from the supplier, and seed {@code seed + i}, so
 * results are the same whether or not parallel processing is enabled. The supplier must hand out
 * oracles that are safe to use concurrently with one another.
 */
public class BatchGenerator {

    private final Grammar grammar;

    private final Supplier<ProbabilityOracle> oracles;

    public BatchGenerator(Grammar grammar, Supplier<ProbabilityOracle> oracles) {
        this.grammar = grammar;
        this.oracles = oracles;
    }

    /**
     * Generates {@code count} sequences and waits for all of them.
     * @return One outcome per generation, in seed order. Failed generations (dead ends, invalid
     *         oracle output) are reported in their outcome.
     */
    public List<BatchOutcome<TokenSequence>> generateAll(long seed, int count, int maxLength, Token circuitType) {
        List<Future<BatchOutcome<TokenSequence>>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final int index = i;
            final long itemSeed = seed + i;
            futures.add(ParallelismTools.submit(() -> {
                try {
                    DecodingController controller = new DecodingController(grammar, oracles.get());
                    return BatchOutcome.success(index, controller.generate(itemSeed, maxLength, circuitType));
                } catch (RuntimeException e) {
                    return BatchOutcome.failure(index, e);
                }
            }));
        }
        ParallelismTools.join(futures);
        List<BatchOutcome<TokenSequence>> outcomes = new ArrayList<>(count);
        int failures = 0;
        for (Future<BatchOutcome<TokenSequence>> f : futures) {
            BatchOutcome<TokenSequence> outcome = ParallelismTools.get(f);
            if (!outcome.isSuccess()) failures++;
            outcomes.add(outcome);
        }
        if (failures > 0) {
            MessageGenerator.briefError("WARNING: " + failures + " of " + count + " generations failed");
        }
        return outcomes;
    }

    /**
     * Starts one generation without waiting for it.
     * @return A future holding the sequence, or the generation's failure.
     */
    public Future<TokenSequence> generateAsync(long seed, int maxLength, Token circuitType) {
        return ParallelismTools.submit(() -> new DecodingController(grammar, oracles.get())
                .generate(seed, maxLength, circuitType));
    }
}
