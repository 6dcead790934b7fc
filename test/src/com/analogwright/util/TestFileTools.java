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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

public class TestFileTools {

    @Test
    public void testIntArrays(@TempDir Path tempDir) {
        String fileName = tempDir.resolve("ints.bin").toString();
        try (Output out = FileTools.getKryoGzipOutputStream(fileName)) {
            FileTools.writeIntArray(out, new int[]{3, 1, 4});
            FileTools.writeIntArray(out, new int[0]);
            FileTools.writeIntArray(out, null);
        }
        try (Input in = FileTools.getKryoGzipInputStream(fileName)) {
            Assertions.assertArrayEquals(new int[]{3, 1, 4}, FileTools.readIntArray(in));
            Assertions.assertSame(FileTools.EMPTY_INT_ARRAY, FileTools.readIntArray(in));
            Assertions.assertEquals(0, FileTools.readIntArray(in).length);
        }
    }

    @Test
    public void testEmptyIntArrayCannotBeReplaced() throws NoSuchFieldException {
        Field field = FileTools.class.getField("EMPTY_INT_ARRAY");
        Assertions.assertTrue(Modifier.isFinal(field.getModifiers()));
        Assertions.assertEquals(0, FileTools.EMPTY_INT_ARRAY.length);
    }

    @Test
    public void testTextLines(@TempDir Path tempDir) {
        String fileName = tempDir.resolve("lines.txt").toString();
        FileTools.writeLinesToTextFile(Arrays.asList("VSS", "M_S", "NM1"), fileName);
        Assertions.assertEquals(Arrays.asList("VSS", "M_S", "NM1"), FileTools.getLinesFromTextFile(fileName));
        Assertions.assertEquals("ota", FileTools.removeFileExtension("ota.scs"));
    }
}
