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
package com.analogwright.util;

/**
 * Result of one item of a batch: either a value or the failure that stopped the item. Batch
 * operations record failures here and carry on with the remaining items.
 *
 * @param <T> Type of the item's result.
 */
public class BatchOutcome<T> {

    private final int index;

    private final T value;

    private final RuntimeException failure;

    private BatchOutcome(int index, T value, RuntimeException failure) {
        this.index = index;
        this.value = value;
        this.failure = failure;
    }

    public static <T> BatchOutcome<T> success(int index, T value) {
        return new BatchOutcome<>(index, value, null);
    }

    public static <T> BatchOutcome<T> failure(int index, RuntimeException failure) {
        return new BatchOutcome<>(index, null, failure);
    }

    /**
     * @return Position of the item within its batch.
     */
    public int getIndex() {
        return index;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return The result, or null if the item failed.
     */
    public T getValue() {
        return value;
    }

    /**
     * @return The failure, or null if the item succeeded.
     */
    public RuntimeException getFailure() {
        return failure;
    }

    /**
     * Gets the result or rethrows the item's failure.
     */
    public T getOrThrow() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    @Override
    public String toString() {
        return "BatchOutcome[" + index + ": " + (failure == null ? "ok" : failure.getMessage()) + "]";
    }
}
