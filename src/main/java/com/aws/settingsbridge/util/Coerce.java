/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import javax.annotation.Nullable;

import static com.aws.settingsbridge.util.Utils.isEmpty;

public final class Coerce {
    // integral JSON numbers read back as Long, matching how stored values are normalized
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);

    private Coerce() {
    }

    /**
     * Convert the object into a boolean value.
     *
     * @param o object
     * @return result.
     */
    public static boolean toBoolean(Object o) {
        if (o instanceof Boolean) {
            return (Boolean) o;
        }
        if (o instanceof Number) {
            return ((Number) o).intValue() != 0;
        }
        if (o != null) {
            switch (o.toString()) {
                case "true":
                case "yes":
                case "on":
                case "t":
                case "y":
                case "Y":
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    /**
     * Get an object as an integer.
     *
     * @param o object to convert.
     * @return resulting int.
     * @throws NumberFormatException if the object is text that does not hold a number
     * @throws ArithmeticException   if the value does not fit in an int
     */
    public static int toInt(Object o) {
        return Math.toIntExact(toLong(o));
    }

    /**
     * Convert object to long.
     *
     * @param o object to convert.
     * @return the resulting long value.
     * @throws NumberFormatException if the object is text that does not hold a number
     */
    public static long toLong(Object o) {
        if (o instanceof Boolean) {
            return (Boolean) o ? 1 : 0;
        }
        if (o instanceof Number) {
            return ((Number) o).longValue();
        }
        if (o != null) {
            return Long.parseLong(o.toString().trim());
        }
        return 0;
    }

    /**
     * Convert object to double.
     *
     * @param o object to convert.
     * @return the resulting double value.
     * @throws NumberFormatException if the object is text that does not hold a number
     */
    public static double toDouble(Object o) {
        if (o instanceof Boolean) {
            return (Boolean) o ? 1 : 0;
        }
        if (o instanceof Number) {
            return ((Number) o).doubleValue();
        }
        if (o != null) {
            return Double.parseDouble(o.toString().trim());
        }
        return 0;
    }

    /**
     * Convert an object to string or null if it is null.
     *
     * @param o object to convert.
     * @return resulting string.
     */
    @Nullable
    public static String toString(Object o) {
        return o == null ? null : o.toString();
    }

    /**
     * Convert object to JSON encoded string and write output to the appendable.
     *
     * @param o object to convert.
     * @param out appendable to write to.
     * @throws IOException if the append fails.
     */
    public static void appendParseableString(Object o, Appendable out) throws IOException {
        try {
            out.append(MAPPER.writeValueAsString(o) + '\n');
        } catch (JsonProcessingException e) {
            throw new IOException(e);
        }
    }

    /**
     * Convert a string to the appropriate Java object.
     *
     * @param s string to convert
     * @return resulting object or empty string if the input was null.
     * @throws JsonProcessingException if it failed to read the JSON.
     */
    public static Object toObject(String s) throws JsonProcessingException {
        if (isEmpty(s)) {
            return "";
        }
        return toObject(s, new TypeReference<Object>() {});
    }

    /**
     * Convert a string to the appropriate Java object.
     *
     * @param s string to convert
     * @param t type to convert to
     * @param <T> type
     * @return resulting object
     * @throws JsonProcessingException if it failed to read the JSON.
     */
    public static <T> T toObject(String s, TypeReference<T> t) throws JsonProcessingException {
        return MAPPER.readValue(s, t);
    }
}
