/*
 *
 * Copyright (c) 2024, RapidSynth Contributors.
 * All rights reserved.
 *
 * This file is part of RapidSynth.
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
package com.rapidsynth.util;

/**
 * Centralized access to global RapidSynth settings. A setting is read from an
 * environment variable or, if absent, from a JVM property of the same name.
 */
public class Params {

    public static String RS_VERBOSE_INFERENCE_NAME = "RS_VERBOSE_INFERENCE";

    public static String RS_CHECK_NETLIST_NAME = "RS_CHECK_NETLIST";

    public static String RS_REMOVE_UNUSED_INSTANCES_NAME = "RS_REMOVE_UNUSED_INSTANCES";

    /**
     * Flag to have the sequential inference print a message for every
     * flip-flop it builds and every false loop it resolves.
     */
    public static boolean RS_VERBOSE_INFERENCE = isParamSet(RS_VERBOSE_INFERENCE_NAME);

    /**
     * Flag to validate the netlist after every flip-flop rewrite. This is
     * expensive on large designs and is meant for debugging the front end.
     */
    public static boolean RS_CHECK_NETLIST = isParamSet(RS_CHECK_NETLIST_NAME);

    /**
     * Removes instances left unused by the inference once all wires are
     * finalized. Enabled unless explicitly set to 0 or false.
     */
    public static boolean RS_REMOVE_UNUSED_INSTANCES = getParamOrDefaultBooleanSetting(
            RS_REMOVE_UNUSED_INSTANCES_NAME, true);

    /**
     * Checks if the named parameter is set via an environment variable or by
     * a JVM parameter of the same name.
     *
     * @param key Name of the global parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(getParamValue(key));
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
     * Checks the parameter value of the provided key. If it is set to
     * anything, it is interpreted by {@link #isSet(String)}. Otherwise the
     * default value is returned.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The value to return if the parameter is not set.
     * @return The interpreted parameter value or defaultValue.
     */
    public static boolean getParamOrDefaultBooleanSetting(String key, boolean defaultValue) {
        String value = getParamValue(key);
        return value == null ? defaultValue : isSet(value);
    }
}
