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
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import org.jetbrains.annotations.NotNull;

import com.analogwright.grammar.Grammar;
import com.analogwright.grammar.GrammarCursor;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Grammar-guided autoregressive generation. Each step asks the {@link ProbabilityOracle} for a
 * distribution over the vocabulary, keeps only the tokens the {@link Grammar} allows next,
 * renormalizes, samples one token with a seeded random source, advances the grammar and appends
 * the token. Generation ends when TRUNCATE is sampled or when {@code maxLength} tokens have been
 * emitted; in the latter case the returned sequence is incomplete.
 * <p>
 * A controller owns its sequence buffer and grammar cursor and is meant for one generation at a
 * time. {@link #cancel()} may be called from any thread; the generation stops at the next step
 * boundary. Interrupting the generating thread has the same effect.
 */
public class DecodingController {

    private final Vocabulary vocab;

    private final Grammar grammar;

    private final ProbabilityOracle oracle;

    private volatile boolean cancelled;

    public DecodingController(@NotNull Grammar grammar, @NotNull ProbabilityOracle oracle) {
        this.vocab = grammar.getVocabulary();
        this.grammar = grammar;
        this.oracle = oracle;
    }

    public TokenSequence generate(long seed, int maxLength) {
        return generate(seed, maxLength, null);
    }

    /**
     * Generates one sequence.
     * @param seed Seed of the sampling random source.
     * @param maxLength Maximum number of tokens, circuit type token included.
     * @param circuitType Circuit type token to start with, or null to let the oracle choose the
     *                    first token.
     * @return The sequence, complete if it ends with TRUNCATE.
     * @throws GrammarDeadEndException if the oracle gives no weight to any allowed token.
     * @throws CancellationException if cancelled or interrupted.
     * @throws IllegalArgumentException if the oracle returns a distribution of the wrong size or
     *         with negative or non-finite weights.
     */
    public TokenSequence generate(long seed, int maxLength, Token circuitType) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
        }
        Random random = new Random(seed);
        GrammarCursor cursor = grammar.newCursor();
        List<Token> tokens = new ArrayList<>();
        int[] context = new int[Math.min(maxLength, 64)];
        if (circuitType != null) {
            if (!circuitType.isCircuitType()) {
                throw new IllegalArgumentException(circuitType + " is not a circuit type token");
            }
            cursor.advance(circuitType);
            tokens.add(circuitType);
            context[0] = circuitType.getId();
        }
        while (tokens.size() < maxLength) {
            checkCancelled();
            int[] view = Arrays.copyOf(context, tokens.size());
            double[] distribution = oracle.nextTokenDistribution(view);
            BitSet allowed = grammar.allowedTokenIds(cursor);
            int id = sample(distribution, allowed, random, cursor);
            Token token = vocab.getToken(id);
            cursor.advance(token);
            if (tokens.size() == context.length) {
                context = Arrays.copyOf(context, Math.min(maxLength, context.length * 2));
            }
            context[tokens.size()] = id;
            tokens.add(token);
            if (token.isTruncate()) {
                break;
            }
        }
        return new TokenSequence(tokens);
    }

    private int sample(double[] distribution, BitSet allowed, Random random, GrammarCursor cursor) {
        if (distribution == null || distribution.length != vocab.size()) {
            throw new IllegalArgumentException("Oracle returned " + (distribution == null ? "no distribution"
                    : distribution.length + " weights") + ", expected " + vocab.size());
        }
        double total = 0;
        int last = -1;
        for (int id = allowed.nextSetBit(0); id >= 0; id = allowed.nextSetBit(id + 1)) {
            double p = distribution[id];
            if (p < 0 || Double.isNaN(p) || Double.isInfinite(p)) {
                throw new IllegalArgumentException("Oracle returned invalid weight " + p + " for token "
                        + vocab.getToken(id));
            }
            if (p > 0) {
                total += p;
                last = id;
            }
        }
        if (total <= 0) {
            throw new GrammarDeadEndException("Oracle assigns zero probability to all "
                    + allowed.cardinality() + " allowed tokens", cursor.getPosition(), cursor.getState());
        }
        double r = random.nextDouble() * total;
        for (int id = allowed.nextSetBit(0); id >= 0; id = allowed.nextSetBit(id + 1)) {
            r -= distribution[id];
            if (r < 0 && distribution[id] > 0) {
                return id;
            }
        }
        return last;
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("Generation cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Generation interrupted");
        }
    }

    /**
     * Requests the running (or next) generation to stop at its next step boundary.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
