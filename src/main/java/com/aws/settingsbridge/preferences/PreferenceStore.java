/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * A persistent key-value store of JSON-compatible values, shared by everything in the process that reads or writes
 * settings. Implementations must be safe to call from any thread. Last write wins.
 */
public interface PreferenceStore {

    /**
     * Read the value stored under a key.
     *
     * @param key preference key
     * @return the value, or null if nothing is stored under the key
     */
    @Nullable
    Object get(String key);

    default boolean contains(String key) {
        return get(key) != null;
    }

    /**
     * Store a value. A null value removes the key.
     *
     * @param key   preference key
     * @param value JSON-compatible value, or null
     * @return true if the stored content changed
     * @throws UnsupportedValueTypeException if the value is not JSON-compatible
     */
    boolean put(String key, @Nullable Object value) throws UnsupportedValueTypeException;

    /**
     * Remove a key. Removing a missing key does nothing.
     *
     * @param key preference key
     * @return true if a value was removed
     */
    boolean remove(String key);

    /**
     * Copy every stored pair into a new map.
     *
     * @return point-in-time copy of the store content
     */
    Map<String, Object> toPOJO();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Subscribe to changes of any key. A new listener is invoked right away with {@link WhatHappened#initialized}.
     *
     * @param listener listener
     */
    void subscribe(PreferenceListener listener);

    void unsubscribe(PreferenceListener listener);
}
