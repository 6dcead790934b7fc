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

/**
 * The sequence model seen from the decoding loop: given the ids generated so far, returns a
 * probability distribution over the whole vocabulary. Sampling parameters such as temperature or
 * top-k belong to the implementation of this interface.
 */
public interface ProbabilityOracle {

    /**
     * @param context Ids of the tokens generated so far, oldest first. Must not be modified.
     * @return Non-negative weights indexed by token id, one per vocabulary token. They need not
     *         sum to one.
     */
    double[] nextTokenDistribution(int[] context);
}
