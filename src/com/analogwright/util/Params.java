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
 * Aims to be a centralized helper class to manage global AnalogWright settings. Every setting can
 * be provided either as an environment variable or as a JVM property of the same name.
 */
public class Params {

    public static String ANALOGWRIGHT_MAX_LENGTH_NAME = "ANALOGWRIGHT_MAX_LENGTH";

    public static String ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH_NAME = "ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH";

    public static String ANALOGWRIGHT_PARALLEL_NAME = "ANALOGWRIGHT_PARALLEL";

    public static int ANALOGWRIGHT_DEFAULT_MAX_LENGTH = 1024;

    public static int ANALOGWRIGHT_DEFAULT_MAX_SEQUENCES_PER_GRAPH = 200;

    /**
     * Maximum number of tokens in a sequence, matching the context window of the sequence model.
     * Stored corpora are padded with TRUNCATE up to this length and longer sequences are dropped.
     */
    public static int ANALOGWRIGHT_MAX_LENGTH = getParamOrDefaultIntSetting(ANALOGWRIGHT_MAX_LENGTH_NAME,
            ANALOGWRIGHT_DEFAULT_MAX_LENGTH);

    /**
     * Number of distinct random traversals to attempt per graph when augmenting a corpus.
     */
    public static int ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH = getParamOrDefaultIntSetting(
            ANALOGWRIGHT_MAX_SEQUENCES_PER_GRAPH_NAME, ANALOGWRIGHT_DEFAULT_MAX_SEQUENCES_PER_GRAPH);

    /**
     * Checks if the named AnalogWright parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global AnalogWright parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null
               || value.length() == 0
               || value.equals("0")
               || value.toLowerCase().equals("false")
               );
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String envValue = getParamValue(key);
        if (envValue != null) {
            try {
                return Integer.parseInt(envValue);
            } catch (NumberFormatException e) {
                MessageGenerator.briefError("WARNING: Couldn't interpret the value '" + envValue
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }

}
