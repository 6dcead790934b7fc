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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * File import/export helpers for the text tables and the compressed binary corpora written by
 * AnalogWright.
 */
public class FileTools {

    public static final int[] EMPTY_INT_ARRAY = new int[0];

    //===================================================================================//
    /* Get Streams                                                                       */
    //===================================================================================//
    /**
     * Creates a Kryo output stream that instantiates a gzip compression stream to
     * an output file.
     *
     * @param fileName Name of the file to target.
     * @return The created kryo-gzip output file stream.
     */
    public static Output getKryoGzipOutputStream(String fileName) {
        try {
            return getKryoGzipOutputStream(new FileOutputStream(fileName));
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Creates a Kryo output stream that instantiates a gzip compression stream to
     * an output stream.
     *
     * @param os The output stream to wrap.
     * @return The created kryo-gzip output file stream.
     */
    public static Output getKryoGzipOutputStream(OutputStream os) {
        return new Output(new DeflaterOutputStream(os));
    }

    /**
     * Creates a Kryo input stream that decompresses a gzip compressed input file.
     *
     * @param fileName Name of the file to read from.
     * @return The created kryo-gzip input file stream.
     */
    public static Input getKryoGzipInputStream(String fileName) {
        try {
            return getKryoGzipInputStream((new FileInputStream(fileName)));
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        }
    }

    /**
     * Creates a Kryo input stream that decompresses a gzip compressed input stream.
     *
     * @param is The gzip compressed input stream to read from.
     * @return The created kryo-gzip input file stream.
     */
    public static Input getKryoGzipInputStream(InputStream is) {
        return new Input(new InflaterInputStream(is));
    }

    //===================================================================================//
    /* Custom Read/Write Functions                                                       */
    //===================================================================================//
    public static boolean writeIntArray(Output dos, int[] intArray) {
        if (intArray == null) {
            dos.writeInt(0);
            return true;
        }
        dos.writeInt(intArray.length);
        dos.writeInts(intArray, 0, intArray.length);
        return true;
    }

    public static int[] readIntArray(Input dis) {
        int length = dis.readInt();
        if (length == 0) return EMPTY_INT_ARRAY;
        return dis.readInts(length);
    }

    /**
     * This is a simple method that writes the elements of a List of Strings
     * into lines in the text file fileName.
     * @param lines The List of Strings to be written
     * @param fileName Name of the text file to save the List to
     */
    public static void writeLinesToTextFile(List<String> lines, String fileName) {
        String nl = System.getProperty("line.separator");
        try (OutputStreamWriter fw = new OutputStreamWriter(new FileOutputStream(fileName), StandardCharsets.UTF_8);
            BufferedWriter bw = new BufferedWriter(fw)) {
            for (String line : lines) {
                bw.write(line + nl);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                fileName + File.separator + e.getMessage(), e);
        }
    }

    /**
     * This is a simple method that will read in a text file and put each line in a
     * string and put all the lines in an ArrayList.  The user is cautioned not
     * to open extremely large files with this method.
     * @param fileName Name of the text file to load.
     * @return An ArrayList containing strings of each line in the file.
     */
    public static ArrayList<String> getLinesFromTextFile(String fileName) {
        String line;

        ArrayList<String> lines = new ArrayList<String>();
        try (InputStreamReader fr = new InputStreamReader(new FileInputStream(fileName), StandardCharsets.UTF_8);
            BufferedReader br = new BufferedReader(fr)) {
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        }
        catch (FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }

        return lines;
    }

    /**
     * Takes a file name and removes everything after the last '.' inclusive
     * @param fileName The input file name
     * @return the substring of fileName if it contains a '.', it returns fileName otherwise
     */
    public static String removeFileExtension(String fileName) {
        int endIndex = fileName.lastIndexOf('.');
        if (endIndex != -1) {
            return fileName.substring(0, endIndex);
        }
        return fileName;
    }

    /**
     * Creates the directory and any missing parents.
     * @param dirName Directory to create.
     * @return True if any directory was created.
     */
    public static boolean makeDirs(String dirName) {
        return new File(dirName).mkdirs();
    }
}
