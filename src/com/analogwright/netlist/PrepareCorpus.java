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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

import com.analogwright.AnalogWrightException;
import com.analogwright.augment.NetRenaming;
import com.analogwright.augment.RenamingAugmentor;
import com.analogwright.graph.AdjacencyMatrix;
import com.analogwright.graph.CircuitGraph;
import com.analogwright.sequence.BatchEncoder;
import com.analogwright.sequence.SequenceCorpus;
import com.analogwright.sequence.SequenceEncoder;
import com.analogwright.sequence.TokenSequence;
import com.analogwright.util.BatchOutcome;
import com.analogwright.util.FileTools;
import com.analogwright.util.MessageGenerator;
import com.analogwright.util.Params;
import com.analogwright.vocab.Vocabulary;
import com.analogwright.vocab.VocabularyTable;

/**
 * Turns a set of netlists into a training corpus: each netlist is parsed into a circuit, optionally
 * renamed into several isomorphic variants, and every circuit is encoded with many random
 * traversals.
 */
public class PrepareCorpus {

    private static final String OUTPUT_OPT = "o";
    private static final String CIRCUIT_TYPE_OPT = "t";
    private static final String COUNT_OPT = "n";
    private static final String MAX_LENGTH_OPT = "l";
    private static final String SEED_OPT = "s";
    private static final String RENAMINGS_OPT = "r";
    private static final String NET_RENAMING_OPT = "net-renaming";
    private static final String PAD_OPT = "pad";
    private static final String CSV_DIR_OPT = "csv-dir";
    private static final String VOCAB_TABLE_OPT = "vocab-table";
    private static final String HELP_OPT = "h";

    private static OptionParser createOptionParser() {
        OptionParser p = new OptionParser() {{
            accepts(OUTPUT_OPT).withRequiredArg().required().describedAs("Output corpus file");
            accepts(CIRCUIT_TYPE_OPT).withRequiredArg().describedAs("Circuit type of all netlists (e.g. Opamp)");
            accepts(COUNT_OPT).withRequiredArg().ofType(Integer.class)
                    .defaultsTo(Params.ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH).describedAs("Sequences per circuit");
            accepts(MAX_LENGTH_OPT).withRequiredArg().ofType(Integer.class)
                    .defaultsTo(Params.ANALOGWRIGHT_MAX_LENGTH).describedAs("Maximum sequence length");
            accepts(SEED_OPT).withRequiredArg().ofType(Long.class).defaultsTo(0L).describedAs("Random seed");
            accepts(RENAMINGS_OPT).withRequiredArg().ofType(Integer.class).defaultsTo(0)
                    .describedAs("Renamed variants per circuit");
            accepts(NET_RENAMING_OPT).withRequiredArg().defaultsTo(NetRenaming.ALL_INDEXED.name())
                    .describedAs("Nets to rename: " + Arrays.toString(NetRenaming.values()));
            accepts(PAD_OPT, "Pad every sequence with TRUNCATE to the maximum length");
            accepts(CSV_DIR_OPT).withRequiredArg().describedAs("Directory for adjacency matrices");
            accepts(VOCAB_TABLE_OPT).withRequiredArg().describedAs("Also write the vocabulary table here");
            acceptsAll(Arrays.asList(HELP_OPT, "?"), "Print Help").forHelp();
        }};
        return p;
    }

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader("Prepare Circuit Sequence Corpus");
        System.out.println("Parses netlists (*.cir) given as arguments and writes their randomized \n"
                         + "token sequences to a compressed corpus file.\n");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void main(String[] args) {
        OptionParser p = createOptionParser();
        OptionSet opts = p.parse(args);
        if (opts.has(HELP_OPT) || opts.nonOptionArguments().isEmpty()) {
            printHelp(p);
            return;
        }

        Vocabulary vocab = Vocabulary.buildDefault();
        String circuitType = (String) opts.valueOf(CIRCUIT_TYPE_OPT);
        if (circuitType != null) {
            vocab.getCircuitTypeToken(circuitType);
        }
        int count = (Integer) opts.valueOf(COUNT_OPT);
        int maxLength = (Integer) opts.valueOf(MAX_LENGTH_OPT);
        long seed = (Long) opts.valueOf(SEED_OPT);
        int renamings = (Integer) opts.valueOf(RENAMINGS_OPT);
        NetRenaming netRenaming = NetRenaming.valueOf((String) opts.valueOf(NET_RENAMING_OPT));
        String csvDir = (String) opts.valueOf(CSV_DIR_OPT);
        if (csvDir != null) {
            FileTools.makeDirs(csvDir);
        }

        NetlistParser parser = new NetlistParser(vocab.getCatalog());
        RenamingAugmentor renamer = new RenamingAugmentor(vocab, netRenaming);
        List<CircuitGraph> graphs = new ArrayList<>();
        int skipped = 0;
        for (Object arg : opts.nonOptionArguments()) {
            String fileName = arg.toString();
            CircuitGraph graph;
            try {
                graph = parser.parseFile(fileName, circuitType);
            } catch (AnalogWrightException e) {
                MessageGenerator.briefError("WARNING: Skipping " + fileName + ": " + e.getMessage());
                skipped++;
                continue;
            }
            graphs.add(graph);
            if (csvDir != null) {
                String base = FileTools.removeFileExtension(new File(fileName).getName());
                AdjacencyMatrix.write(graph, csvDir + File.separator + base + ".csv");
            }
            for (int r = 0; r < renamings; r++) {
                try {
                    graphs.add(renamer.rename(graph, seed + 7919L * (r + 1) + graphs.size()));
                } catch (AnalogWrightException e) {
                    MessageGenerator.briefError("WARNING: Cannot rename " + fileName + ": " + e.getMessage());
                    break;
                }
            }
        }

        BatchEncoder encoder = new BatchEncoder(new SequenceEncoder(vocab));
        List<TokenSequence> corpus = new ArrayList<>();
        int failed = 0;
        for (BatchOutcome<List<TokenSequence>> outcome : encoder.encodeAll(graphs, seed, count, maxLength)) {
            if (outcome.isSuccess()) {
                corpus.addAll(outcome.getValue());
            } else {
                MessageGenerator.briefError("WARNING: Circuit " + outcome.getIndex() + " not encoded: "
                        + outcome.getFailure().getMessage());
                failed++;
            }
        }
        String output = (String) opts.valueOf(OUTPUT_OPT);
        SequenceCorpus.write(vocab, corpus, output, opts.has(PAD_OPT) ? maxLength : 0);
        if (opts.has(VOCAB_TABLE_OPT)) {
            VocabularyTable.write(vocab, (String) opts.valueOf(VOCAB_TABLE_OPT));
        }
        MessageGenerator.briefMessage("Wrote " + corpus.size() + " sequences from " + graphs.size()
                + " circuits to " + output + " (" + skipped + " netlists skipped, " + failed
                + " circuits not encoded)");
    }
}
