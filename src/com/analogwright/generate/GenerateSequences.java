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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

import com.analogwright.grammar.Grammar;
import com.analogwright.grammar.GrammarOptions;
import com.analogwright.sequence.SequenceCorpus;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.util.BatchOutcome;
import com.analogwright.util.MessageGenerator;
import com.analogwright.util.Params;
import com.analogwright.vocab.Token;
import com.analogwright.vocab.Vocabulary;

/**
 * Samples grammatical sequences with a {@link UniformOracle} and the decoding controller. With no
 * trained model behind it this exercises the masking and sampling path and produces random (but
 * syntactically valid) inputs for the decoder.
 */
public class GenerateSequences {

    private static final String COUNT_OPT = "n";
    private static final String MAX_LENGTH_OPT = "l";
    private static final String SEED_OPT = "s";
    private static final String CIRCUIT_TYPE_OPT = "t";
    private static final String TRUNCATE_WEIGHT_OPT = "truncate-weight";
    private static final String STRICT_OPT = "strict";
    private static final String OUTPUT_OPT = "o";
    private static final String HELP_OPT = "h";

    private static OptionParser createOptionParser() {
        OptionParser p = new OptionParser() {{
            accepts(COUNT_OPT).withRequiredArg().ofType(Integer.class).defaultsTo(10).describedAs("Number of sequences");
            accepts(MAX_LENGTH_OPT).withRequiredArg().ofType(Integer.class)
                    .defaultsTo(Params.ANALOGWRIGHT_MAX_LENGTH).describedAs("Maximum sequence length");
            accepts(SEED_OPT).withRequiredArg().ofType(Long.class).defaultsTo(0L).describedAs("Random seed");
            accepts(CIRCUIT_TYPE_OPT).withRequiredArg().describedAs("Circuit type to condition on");
            accepts(TRUNCATE_WEIGHT_OPT).withRequiredArg().ofType(Double.class).defaultsTo(1.0)
                    .describedAs("Relative weight of TRUNCATE");
            accepts(STRICT_OPT, "Mask pin re-binding and early TRUNCATE");
            accepts(OUTPUT_OPT).withRequiredArg().describedAs("Write the sequences to this corpus file");
            acceptsAll(Arrays.asList(HELP_OPT, "?"), "Print Help").forHelp();
        }};
        return p;
    }

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader("Generate Random Grammatical Sequences");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void main(String[] args) {
        OptionParser p = createOptionParser();
        OptionSet opts = p.parse(args);
        if (opts.has(HELP_OPT)) {
            printHelp(p);
            return;
        }
        Vocabulary vocab = Vocabulary.buildDefault();
        Grammar grammar = new Grammar(vocab, opts.has(STRICT_OPT) ? GrammarOptions.strict() : GrammarOptions.defaults());
        int truncateId = vocab.getTruncateToken().getId();
        double truncateWeight = (Double) opts.valueOf(TRUNCATE_WEIGHT_OPT);
        Token circuitType = opts.has(CIRCUIT_TYPE_OPT)
                ? vocab.getCircuitTypeToken((String) opts.valueOf(CIRCUIT_TYPE_OPT)) : null;

        BatchGenerator generator = new BatchGenerator(grammar,
                () -> new UniformOracle(vocab.size(), truncateId, truncateWeight));
        List<TokenSequence> sequences = new ArrayList<>();
        for (BatchOutcome<TokenSequence> outcome : generator.generateAll((Long) opts.valueOf(SEED_OPT),
                (Integer) opts.valueOf(COUNT_OPT), (Integer) opts.valueOf(MAX_LENGTH_OPT), circuitType)) {
            if (outcome.isSuccess()) {
                sequences.add(outcome.getValue());
                if (!opts.has(OUTPUT_OPT)) {
                    System.out.println(outcome.getValue());
                }
            } else {
                MessageGenerator.briefError("Generation " + outcome.getIndex() + ": " + outcome.getFailure().getMessage());
            }
        }
        if (opts.has(OUTPUT_OPT)) {
            SequenceCorpus.write(vocab, sequences, (String) opts.valueOf(OUTPUT_OPT));
            MessageGenerator.briefMessage("Wrote " + sequences.size() + " sequences to " + opts.valueOf(OUTPUT_OPT));
        }
    }
}
