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

/**
 * Assigns the same weight to every token, with an optional bias on TRUNCATE to control how long
 * sampled sequences grow. Combined with the grammar mask this samples uniformly among the legal
 * continuations, which is useful for smoke tests of the decoding pipeline without a model.
 */
public class UniformOracle implements ProbabilityOracle {

    private final double[] weights;

    public UniformOracle(int vocabularySize) {
        this(vocabularySize, -1, 1.0);
    }

    /**
     * @param vocabularySize Number of tokens in the vocabulary.
     * @param truncateId Id of TRUNCATE, or -1 for no bias.
     * @param truncateWeight Weight of TRUNCATE relative to every other token.
     */
    public UniformOracle(int vocabularySize, int truncateId, double truncateWeight) {
        weights = new double[vocabularySize];
        Arrays.fill(weights, 1.0);
        if (truncateId >= 0) {
            weights[truncateId] = truncateWeight;
        }
    }

    @Override
    public double[] nextTokenDistribution(int[] context) {
        return weights.clone();
    }
}
