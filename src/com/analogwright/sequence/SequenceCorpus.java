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

import java.util.ArrayList;
import java.util.List;

import com.analogwright.util.FileTools;
import com.analogwright.vocab.UnknownTokenException;
import com.analogwright.vocab.Vocabulary;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * Compressed binary storage of token sequences. A corpus file records the fingerprint of the
 * vocabulary that wrote it, and refuses to be read by a process whose vocabulary enumerates
 * tokens differently.
 * <pre>
 *   int    FILE_VERSION
 *   long   vocabulary fingerprint
 *   int    vocabulary size
 *   int    number of sequences
 *   per sequence: int length, int[length] ids
 * </pre>
 */
public class SequenceCorpus {

    public static final int FILE_VERSION = 1;

    public static final String FILE_SUFFIX = ".seq";

    /**
     * Writes sequences as they are, without padding.
     */
    public static void write(Vocabulary vocab, List<TokenSequence> sequences, String fileName) {
        write(vocab, sequences, fileName, 0);
    }

    /**
     * Writes sequences, optionally padding each one with TRUNCATE to a fixed length.
     * @param vocab Vocabulary the sequences belong to.
     * @param sequences The sequences.
     * @param fileName Target file.
     * @param padToLength Fixed length of every stored sequence, or 0 to store them unpadded.
     * @throws IllegalArgumentException if a sequence is longer than a positive padToLength, or
     *         shorter and missing its closing TRUNCATE.
     */
    public static void write(Vocabulary vocab, List<TokenSequence> sequences, String fileName, int padToLength) {
        List<int[]> rows = new ArrayList<>(sequences.size());
        for (TokenSequence s : sequences) {
            rows.add(padToLength > 0 ? s.toPaddedIds(vocab, padToLength) : s.toIds());
        }
        writeIds(vocab, rows, fileName);
    }

    public static void writeIds(Vocabulary vocab, List<int[]> rows, String fileName) {
        try (Output out = FileTools.getKryoGzipOutputStream(fileName)) {
            out.writeInt(FILE_VERSION);
            out.writeLong(vocab.getFingerprint());
            out.writeInt(vocab.size());
            out.writeInt(rows.size());
            for (int[] row : rows) {
                FileTools.writeIntArray(out, row);
            }
        }
    }

    /**
     * Reads the raw id rows, padding included.
     * @throws UnknownTokenException if the file was written with a different vocabulary or
     *         contains an id outside it.
     */
    public static List<int[]> readIds(Vocabulary vocab, String fileName) {
        try (Input in = FileTools.getKryoGzipInputStream(fileName)) {
            int version = in.readInt();
            if (version != FILE_VERSION) {
                throw new IllegalStateException("Unsupported sequence corpus version " + version
                        + " in " + fileName + ", expected " + FILE_VERSION);
            }
            long fingerprint = in.readLong();
            int size = in.readInt();
            if (fingerprint != vocab.getFingerprint() || size != vocab.size()) {
                throw new UnknownTokenException("Sequence corpus " + fileName + " was written with vocabulary "
                        + Long.toHexString(fingerprint) + " (" + size + " tokens) but this build uses "
                        + Long.toHexString(vocab.getFingerprint()) + " (" + vocab.size() + " tokens)");
            }
            int count = in.readInt();
            List<int[]> rows = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int[] row = FileTools.readIntArray(in);
                for (int id : row) {
                    if (id < 0 || id >= size) {
                        throw new UnknownTokenException("Sequence " + i + " of " + fileName
                                + " holds id " + id + " outside the vocabulary");
                    }
                }
                rows.add(row);
            }
            return rows;
        }
    }

    /**
     * Reads the sequences with padding removed.
     */
    public static List<TokenSequence> read(Vocabulary vocab, String fileName) {
        List<TokenSequence> sequences = new ArrayList<>();
        for (int[] row : readIds(vocab, fileName)) {
            sequences.add(TokenSequence.fromIds(vocab, row).withoutPadding());
        }
        return sequences;
    }
}
