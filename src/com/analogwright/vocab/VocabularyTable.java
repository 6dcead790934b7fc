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
package com.analogwright.vocab;

import java.util.ArrayList;
import java.util.List;

import com.analogwright.util.FileTools;
import com.analogwright.util.MessageGenerator;

/**
 * Persisted form of a {@link Vocabulary}: one {@code id<TAB>token} line per token, in id order.
 * Readers of stored sequences verify the table against the vocabulary they built so that a skew
 * between the writer's and the reader's enumeration is detected before any id is interpreted.
 */
public class VocabularyTable {

    public static final String SEPARATOR = "\t";

    public static List<String> toLines(Vocabulary vocab) {
        List<String> lines = new ArrayList<>(vocab.size());
        for (Token t : vocab.getTokens()) {
            lines.add(t.getId() + SEPARATOR + t.getName());
        }
        return lines;
    }

    public static void write(Vocabulary vocab, String fileName) {
        FileTools.writeLinesToTextFile(toLines(vocab), fileName);
    }

    /**
     * Checks that a table file describes exactly the enumeration of the given vocabulary.
     * @param vocab The vocabulary built by this process.
     * @param fileName Table file to check.
     * @throws UnknownTokenException on the first line that does not match, or if the number of
     *         entries differs.
     */
    public static void verify(Vocabulary vocab, String fileName) {
        verify(vocab, FileTools.getLinesFromTextFile(fileName));
    }

    public static void verify(Vocabulary vocab, List<String> lines) {
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            String[] parts = line.split(SEPARATOR);
            if (parts.length != 2) {
                throw new UnknownTokenException("Malformed vocabulary table line " + (i + 1)
                        + ": '" + line + "'");
            }
            int id;
            try {
                id = Integer.parseInt(parts[0].trim());
            } catch (NumberFormatException e) {
                throw new UnknownTokenException("Malformed token id on vocabulary table line "
                        + (i + 1) + ": '" + parts[0] + "'", e);
            }
            Token t = vocab.getToken(id);
            if (!t.getName().equals(parts[1].trim())) {
                throw new UnknownTokenException("Vocabulary mismatch for id " + id + ": table has '"
                        + parts[1].trim() + "' but this build has '" + t.getName() + "'");
            }
            count++;
        }
        if (count != vocab.size()) {
            throw new UnknownTokenException("Vocabulary table has " + count
                    + " entries but this build has " + vocab.size());
        }
    }

    public static void main(String[] args) {
        if (args.length != 2 || !(args[0].equals("write") || args[0].equals("verify"))) {
            MessageGenerator.briefErrorAndExit("USAGE: VocabularyTable write|verify <table file>");
        }
        Vocabulary vocab = Vocabulary.buildDefault();
        if (args[0].equals("write")) {
            write(vocab, args[1]);
            MessageGenerator.briefMessage("Wrote " + vocab + " to " + args[1]);
        } else {
            verify(vocab, args[1]);
            MessageGenerator.briefMessage(args[1] + " matches " + vocab);
        }
    }
}
