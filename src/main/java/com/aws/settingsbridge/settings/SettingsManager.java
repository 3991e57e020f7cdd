/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.settings;

import com.aws.settingsbridge.bridge.BridgeMethod;
import com.aws.settingsbridge.bridge.BridgeModule;
import com.aws.settingsbridge.bridge.EventEmitter;
import com.aws.settingsbridge.bridge.InvalidArgumentsError;
import com.aws.settingsbridge.preferences.Preference;
import com.aws.settingsbridge.preferences.PreferenceListener;
import com.aws.settingsbridge.preferences.PreferenceStore;
import com.aws.settingsbridge.preferences.UnsupportedValueTypeException;
import com.aws.settingsbridge.preferences.WhatHappened;
import com.aws.settingsbridge.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * Bridge module giving the host read and write access to one shared {@link PreferenceStore}.
 *
 * <p>The store is always supplied by the host; there is no way to build this module over an implicit global store.
 * Changes that reach the store from any other writer are pushed to the host as a {@value #SETTINGS_UPDATED_EVENT}
 * event carrying the full store content. Changes made through this module are not echoed back.</p>
 */
public class SettingsManager implements BridgeModule {
    public static final String MODULE_NAME = "SettingsManager";
    public static final String SETTINGS_UPDATED_EVENT = "settingsUpdated";
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);
    private static final String KEY = "key";

    private final PreferenceStore store;
    private final EventEmitter eventEmitter;
    private final Map<String, Object> initialSettings;
    // pending notifications caused by this module's own writes, per key
    private final ConcurrentHashMap<String, Integer> ownWrites = new ConcurrentHashMap<>();
    private final PreferenceListener storeListener = this::storeChanged;
    private final AtomicBoolean invalidated = new AtomicBoolean();

    public SettingsManager(PreferenceStore store) {
        this(store, EventEmitter.NO_OP);
    }

    /**
     * Create the module over the host's store.
     *
     * @param store        preference store, required
     * @param eventEmitter channel for {@value #SETTINGS_UPDATED_EVENT} events, required
     */
    public SettingsManager(PreferenceStore store, EventEmitter eventEmitter) {
        this.store = Objects.requireNonNull(store, "store");
        this.eventEmitter = Objects.requireNonNull(eventEmitter, "eventEmitter");
        this.initialSettings = Collections.unmodifiableMap(store.toPOJO());
        store.subscribe(storeListener);
    }

    @Override
    public String getName() {
        return MODULE_NAME;
    }

    /**
     * The store content as it was when this module was created. Later writes are not reflected.
     *
     * @return snapshot of every stored pair
     */
    @Override
    @BridgeMethod
    public Map<String, Object> getConstants() {
        return initialSettings;
    }

    /**
     * Read one setting.
     *
     * @param key setting key
     * @return the value, or empty if the key is not set
     */
    @BridgeMethod
    public Optional<Object> getValue(String key) {
        checkKey(key);
        return Optional.ofNullable(store.get(key));
    }

    /**
     * Write one setting. A null value deletes the key.
     *
     * @param key   setting key
     * @param value JSON-compatible value or null
     */
    @BridgeMethod
    public void setValue(String key, @Nullable Object value) {
        checkKey(key);
        write(key, value);
    }

    /**
     * Write several settings. Entries with a null value delete their key.
     *
     * @param values settings to write
     */
    @BridgeMethod
    public void setValues(Map<String, Object> values) {
        if (values == null) {
            throw new InvalidArgumentsError("Values to set cannot be null");
        }
        values.keySet().forEach(SettingsManager::checkKey);
        values.forEach(this::write);
    }

    /**
     * Delete several settings. Keys that are not set are ignored.
     *
     * @param keys keys to delete
     */
    @BridgeMethod
    public void deleteValues(List<String> keys) {
        if (keys == null) {
            throw new InvalidArgumentsError("Keys to delete cannot be null");
        }
        keys.forEach(SettingsManager::checkKey);
        keys.forEach(k -> write(k, null));
    }

    @Override
    public void invalidate() {
        if (invalidated.compareAndSet(false, true)) {
            store.unsubscribe(storeListener);
            logger.atDebug().addKeyValue("eventType", "settings-manager-invalidated").log();
        }
    }

    private void write(String key, @Nullable Object value) {
        ownWrites.merge(key, 1, Integer::sum);
        boolean changed;
        try {
            changed = value == null ? store.remove(key) : store.put(key, value);
        } catch (UnsupportedValueTypeException e) {
            forgetOwnWrite(key);
            throw new InvalidArgumentsError("Cannot store value for " + key + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            forgetOwnWrite(key);
            throw e;
        }
        if (!changed) {
            // nothing will be published for this write
            forgetOwnWrite(key);
        }
        logger.atTrace().addKeyValue(KEY, key).addKeyValue("changed", changed).log("Setting written");
    }

    private boolean forgetOwnWrite(String key) {
        boolean[] found = new boolean[1];
        ownWrites.computeIfPresent(key, (k, n) -> {
            found[0] = true;
            return n > 1 ? n - 1 : null;
        });
        return found[0];
    }

    private void storeChanged(WhatHappened what, @Nullable Preference preference) {
        if (preference == null || what == WhatHappened.initialized || invalidated.get()) {
            return;
        }
        if (forgetOwnWrite(preference.getKey())) {
            return;
        }
        logger.atDebug().addKeyValue("eventType", "settings-updated").addKeyValue(KEY, preference.getKey()).log();
        eventEmitter.emit(SETTINGS_UPDATED_EVENT, store.toPOJO());
    }

    private static void checkKey(String key) {
        if (Utils.isEmpty(key)) {
            throw new InvalidArgumentsError("Setting key cannot be empty");
        }
    }
}
