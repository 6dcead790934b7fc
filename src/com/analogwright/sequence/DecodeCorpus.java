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
package com.analogwright.sequence;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

import com.analogwright.AnalogWrightException;
import com.analogwright.check.CheckResult;
import com.analogwright.check.CircuitChecker;
import com.analogwright.check.StructuralChecker;
import com.analogwright.grammar.Grammar;
import com.analogwright.grammar.GrammarOptions;
import com.analogwright.graph.AdjacencyMatrix;
import com.analogwright.graph.CircuitGraph;
import com.analogwright.util.FileTools;
import com.analogwright.util.MessageGenerator;
import com.analogwright.vocab.Vocabulary;

/**
 * Decodes stored or textual sequences back into circuits and reports how many of them are valid.
 * Each sequence is decoded independently; a failure is printed with its position and does not stop
 * the run.
 */
public class DecodeCorpus {

    private static final String CORPUS_OPT = "c";
    private static final String TEXT_OPT = "text";
    private static final String STRICT_OPT = "strict";
    private static final String CSV_DIR_OPT = "csv-dir";
    private static final String VERBOSE_OPT = "v";
    private static final String HELP_OPT = "h";

    private static OptionParser createOptionParser() {
        OptionParser p = new OptionParser() {{
            accepts(CORPUS_OPT).withRequiredArg().describedAs("Sequence corpus file (" + SequenceCorpus.FILE_SUFFIX + ")");
            accepts(TEXT_OPT).withRequiredArg().describedAs("Text file with one space separated sequence per line");
            accepts(STRICT_OPT, "Decode with the connectivity-aware grammar");
            accepts(CSV_DIR_OPT).withRequiredArg().describedAs("Write each decoded circuit as an adjacency matrix here");
            accepts(VERBOSE_OPT, "Print every decoded circuit");
            acceptsAll(Arrays.asList(HELP_OPT, "?"), "Print Help").forHelp();
        }};
        return p;
    }

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader("Decode Circuit Sequences");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void main(String[] args) {
        OptionParser p = createOptionParser();
        OptionSet opts = p.parse(args);
        if (opts.has(HELP_OPT) || (!opts.has(CORPUS_OPT) && !opts.has(TEXT_OPT))) {
            printHelp(p);
            return;
        }
        Vocabulary vocab = Vocabulary.buildDefault();
        List<TokenSequence> sequences = new ArrayList<>();
        if (opts.has(CORPUS_OPT)) {
            sequences.addAll(SequenceCorpus.read(vocab, (String) opts.valueOf(CORPUS_OPT)));
        }
        if (opts.has(TEXT_OPT)) {
            for (String line : FileTools.getLinesFromTextFile((String) opts.valueOf(TEXT_OPT))) {
                if (line.trim().isEmpty()) continue;
                sequences.add(TokenSequence.parse(vocab, line));
            }
        }

        Grammar grammar = new Grammar(vocab, opts.has(STRICT_OPT) ? GrammarOptions.strict() : GrammarOptions.defaults());
        SequenceDecoder decoder = new SequenceDecoder(grammar);
        CircuitChecker checker = new StructuralChecker();
        String csvDir = (String) opts.valueOf(CSV_DIR_OPT);
        if (csvDir != null) {
            FileTools.makeDirs(csvDir);
        }
        int decoded = 0;
        int valid = 0;
        for (int i = 0; i < sequences.size(); i++) {
            CircuitGraph graph;
            try {
                graph = decoder.decode(sequences.get(i));
            } catch (AnalogWrightException e) {
                MessageGenerator.briefError("Sequence " + i + ": " + e.getMessage());
                continue;
            }
            decoded++;
            CheckResult result = checker.check(graph);
            if (result.isValid()) {
                valid++;
            } else {
                MessageGenerator.briefError("Sequence " + i + ": " + result);
            }
            if (opts.has(VERBOSE_OPT)) {
                System.out.println(i + ": " + graph);
            }
            if (csvDir != null) {
                AdjacencyMatrix.write(graph, csvDir + File.separator + "circuit_" + i + ".csv");
            }
        }
        MessageGenerator.briefMessage("Decoded " + decoded + " of " + sequences.size() + " sequences, "
                + valid + " structurally valid");
    }
}
