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
import java.util.concurrent.Future;

import com.analogwright.AnalogWrightException;
import com.analogwright.graph.CircuitGraph;
import com.analogwright.util.BatchOutcome;
import com.analogwright.util.ParallelismTools;

/**
 * Encodes a collection of circuits into an augmented corpus, one task per circuit through
 * {@link ParallelismTools}. Circuit {@code i} uses the seeds starting at {@code seed + i * count},
 * so the result does not depend on the number of threads. A circuit that cannot be encoded is
 * reported in its outcome and does not affect the others.
 */
public class BatchEncoder {

    private final SequenceEncoder encoder;

    public BatchEncoder(SequenceEncoder encoder) {
        this.encoder = encoder;
    }

    public List<BatchOutcome<List<TokenSequence>>> encodeAll(List<CircuitGraph> graphs, long seed,
                                                             int count, int maxLength) {
        List<Future<BatchOutcome<List<TokenSequence>>>> futures = new ArrayList<>(graphs.size());
        for (int i = 0; i < graphs.size(); i++) {
            final int index = i;
            final CircuitGraph graph = graphs.get(i);
            final long graphSeed = seed + (long) i * count;
            futures.add(ParallelismTools.submit(() -> {
                try {
                    return BatchOutcome.success(index, encoder.encodeMany(graph, graphSeed, count, maxLength));
                } catch (AnalogWrightException e) {
                    return BatchOutcome.failure(index, e);
                }
            }));
        }
        List<BatchOutcome<List<TokenSequence>>> outcomes = new ArrayList<>(futures.size());
        for (Future<BatchOutcome<List<TokenSequence>>> f : futures) {
            outcomes.add(ParallelismTools.get(f));
        }
        return outcomes;
    }
}
