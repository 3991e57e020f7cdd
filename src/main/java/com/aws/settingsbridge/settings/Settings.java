/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.settings;

import com.aws.settingsbridge.bridge.DeviceEventEmitter;
import com.aws.settingsbridge.bridge.ModuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Host-side view of the {@link SettingsManager} module. Keeps a cache hydrated from the module constants and
 * refreshed by {@value SettingsManager#SETTINGS_UPDATED_EVENT} events, and lets callers watch keys for changes.
 */
public class Settings implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Settings.class);

    private final ModuleRegistry registry;
    private final Map<String, Object> cache = new ConcurrentHashMap<>();
    private final List<Watch> watches = new ArrayList<>();
    private final DeviceEventEmitter.Subscription subscription;

    /**
     * Attach to the settings module of a registry.
     *
     * @param registry registry holding a {@link SettingsManager}
     */
    public Settings(ModuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        registry.getConstants(SettingsManager.MODULE_NAME).forEach((k, v) -> {
            if (v != null) {
                cache.put(k, v);
            }
        });
        subscription = registry.getEventEmitter()
                .addListener(SettingsManager.SETTINGS_UPDATED_EVENT, this::sendObservations);
    }

    @Nullable
    public Object get(String key) {
        return cache.get(key);
    }

    /**
     * Write settings through the module. Null values delete their key.
     *
     * @param settings values to write
     */
    public void set(Map<String, Object> settings) {
        registry.invoke(SettingsManager.MODULE_NAME, "setValues", Collections.singletonList(settings));
        // cache what the store holds, which may be a normalized copy of what was passed in
        for (String k : settings.keySet()) {
            Object stored = registry.invoke(SettingsManager.MODULE_NAME, "getValue", Collections.singletonList(k));
            if (stored == null) {
                cache.remove(k);
            } else {
                cache.put(k, stored);
            }
        }
    }

    /**
     * Call back when any of the keys changes through another writer.
     *
     * @param keys     keys to watch
     * @param callback called once per changed key
     * @return id to pass to {@link #clearWatch(int)}
     */
    public synchronized int watchKeys(List<String> keys, Runnable callback) {
        watches.add(new Watch(new ArrayList<>(keys), Objects.requireNonNull(callback, "callback")));
        return watches.size() - 1;
    }

    /**
     * Stop a watch. Ids stay stable, so clearing one watch never changes another's id.
     *
     * @param watchId id returned by {@link #watchKeys}
     */
    public synchronized void clearWatch(int watchId) {
        if (watchId >= 0 && watchId < watches.size()) {
            watches.set(watchId, new Watch(Collections.emptyList(), null));
        }
    }

    @Override
    public void close() {
        subscription.remove();
    }

    @SuppressWarnings("unchecked")
    private void sendObservations(Object body) {
        if (!(body instanceof Map)) {
            logger.atWarn().addKeyValue("body", body).log("Ignoring malformed settings update");
            return;
        }
        Map<String, Object> settings = (Map<String, Object>) body;
        List<String> changedKeys = new ArrayList<>();
        settings.forEach((k, v) -> {
            if (v != null && !Objects.equals(cache.put(k, v), v)) {
                changedKeys.add(k);
            }
        });
        // keys missing from the update were deleted
        for (String k : new ArrayList<>(cache.keySet())) {
            if (!settings.containsKey(k)) {
                cache.remove(k);
                changedKeys.add(k);
            }
        }
        List<Watch> current;
        synchronized (this) {
            current = new ArrayList<>(watches);
        }
        for (String k : changedKeys) {
            for (Watch w : current) {
                if (w.callback != null && w.keys.contains(k)) {
                    w.callback.run();
                }
            }
        }
    }

    private static final class Watch {
        private final List<String> keys;
        private final Runnable callback;

        private Watch(List<String> keys, @Nullable Runnable callback) {
            this.keys = keys;
            this.callback = callback;
        }
    }
}
