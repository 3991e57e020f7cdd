/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Validation and copying of JSON-compatible preference values.
 */
public final class PreferenceValues {

    private PreferenceValues() {
    }

    /**
     * Check that a value is JSON-compatible and return a deep, unmodifiable copy of it. Maps must have string keys;
     * collections and arrays become lists. Integral numbers become {@link Long} and other numbers {@link Double},
     * the types a transaction log reads them back as. Nulls are allowed anywhere, including the top level.
     *
     * @param value proposed value
     * @return an immutable copy, equal to the input
     * @throws UnsupportedValueTypeException if the value, or anything nested in it, is not JSON-compatible
     */
    public static Object freeze(Object value) throws UnsupportedValueTypeException {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return normalize((Number) value);
        }
        if (value instanceof Character || value instanceof Enum) {
            return value.toString();
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                if (!(e.getKey() instanceof String)) {
                    throw new UnsupportedValueTypeException(
                            "Map keys must be strings, found " + (e.getKey() == null ? "null"
                                    : e.getKey().getClass().getName()));
                }
                copy.put((String) e.getKey(), freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object o : (Collection<?>) value) {
                copy.add(freeze(o));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<Object> copy = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                copy.add(freeze(Array.get(value, i)));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new UnsupportedValueTypeException(value.getClass());
    }

    private static Object normalize(Number n) throws UnsupportedValueTypeException {
        if (n instanceof Long) {
            return n;
        }
        if (n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof AtomicInteger || n instanceof AtomicLong) {
            return n.longValue();
        }
        if (n instanceof BigInteger) {
            BigInteger big = (BigInteger) n;
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new UnsupportedValueTypeException("Numbers must be finite, found " + n);
        }
        return d;
    }
}
