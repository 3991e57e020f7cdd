/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import com.aws.settingsbridge.dependency.Context;
import com.aws.settingsbridge.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * In-memory preference store whose changes are published, in order, on the {@link Context} publish queue. Attach a
 * {@link PreferencesWriter} to make it persistent.
 */
public class Preferences implements PreferenceStore {
    private static final Logger logger = LoggerFactory.getLogger(Preferences.class);

    private final Context context;
    private final Map<String, Preference> children = new ConcurrentHashMap<>();
    private final CopyOnWriteArraySet<PreferenceListener> listeners = new CopyOnWriteArraySet<>();

    public Preferences(Context context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public Context getContext() {
        return context;
    }

    /**
     * Find, and create if missing, the preference for a key. A created preference holds no value until one is set.
     *
     * @param key preference key
     * @return the preference, never null
     */
    Preference lookup(String key) {
        return children.computeIfAbsent(key, k -> new Preference(this, k));
    }

    /**
     * Find, but do not create if missing, the preference for a key.
     *
     * @param key preference key
     * @return the preference or null
     */
    @Nullable
    public Preference find(String key) {
        return children.get(key);
    }

    @Override
    @Nullable
    public Object get(String key) {
        Preference p = find(key);
        return p == null ? null : p.getOnce();
    }

    @Override
    public boolean put(String key, @Nullable Object value) throws UnsupportedValueTypeException {
        return put(System.currentTimeMillis(), key, value, true);
    }

    /**
     * Store a value with an explicit modification time.
     *
     * @param timestamp                modification time of the value
     * @param key                      preference key
     * @param value                    value, null removes the key
     * @param allowTimestampToDecrease write even if the stored value is newer than timestamp
     * @return true if the stored content changed
     * @throws UnsupportedValueTypeException if the value is not JSON-compatible
     */
    public boolean put(long timestamp, String key, @Nullable Object value, boolean allowTimestampToDecrease)
            throws UnsupportedValueTypeException {
        checkKey(key);
        if (value == null) {
            return remove(timestamp, key, allowTimestampToDecrease);
        }
        Object frozen = PreferenceValues.freeze(value);
        while (true) {
            Preference p = lookup(key);
            synchronized (p) {
                // a concurrent remove may have detached p between lookup and lock
                if (children.get(key) == p) {
                    return p.withNewerValue(timestamp, frozen, allowTimestampToDecrease);
                }
            }
        }
    }

    @Override
    public boolean remove(String key) {
        checkKey(key);
        return remove(System.currentTimeMillis(), key, true);
    }

    /**
     * Remove a key if the removal is not older than the stored value.
     *
     * @param timestamp                time of the removal
     * @param key                      preference key
     * @param allowTimestampToDecrease remove even if the stored value is newer than timestamp
     * @return true if a value was removed
     */
    public boolean remove(long timestamp, String key, boolean allowTimestampToDecrease) {
        Preference p = children.get(key);
        if (p == null) {
            return false;
        }
        synchronized (p) {
            if (children.get(key) != p || !allowTimestampToDecrease && timestamp < p.getModtime()) {
                return false;
            }
            if (p.getOnce() == null) {
                children.remove(key, p);
                return false;
            }
            p.markRemoved(Math.max(timestamp, p.getModtime()));
            // publish before detaching so a put of a new preference for this key is logged after the removal
            publish(WhatHappened.removed, p);
            children.remove(key, p);
        }
        return true;
    }

    @Override
    public Map<String, Object> toPOJO() {
        Map<String, Object> map = new TreeMap<>();
        children.values().forEach(p -> {
            Object v = p.getOnce();
            if (v != null) {
                map.put(p.getKey(), v);
            }
        });
        return map;
    }

    @Override
    public int size() {
        return (int) children.values().stream().filter(p -> p.getOnce() != null).count();
    }

    /**
     * Every preference that currently holds a value.
     *
     * @return a new list of the stored preferences
     */
    List<Preference> storedPreferences() {
        return children.values().stream().filter(p -> p.getOnce() != null).collect(Collectors.toList());
    }

    @Override
    public void subscribe(PreferenceListener listener) {
        if (listener != null && listeners.add(listener)) {
            listener.preferenceChanged(WhatHappened.initialized, null);
        }
    }

    @Override
    public void unsubscribe(PreferenceListener listener) {
        listeners.remove(listener);
    }

    void publish(WhatHappened what, Preference p) {
        context.runOnPublishQueue(() -> fire(what, p));
    }

    @SuppressWarnings("PMD.AvoidCatchingThrowable")
    private void fire(WhatHappened what, Preference p) {
        for (PreferenceListener l : listeners) {
            try {
                l.preferenceChanged(what, p);
            } catch (Throwable t) {
                logger.atError().addKeyValue("eventType", "preference-listener-error")
                        .addKeyValue("key", p.getKey()).setCause(t).log("Exception while notifying of change");
            }
        }
    }

    private static void checkKey(String key) {
        if (Utils.isEmpty(key)) {
            throw new IllegalArgumentException("Preference key cannot be empty");
        }
    }

    @Override
    public String toString() {
        return String.valueOf(toPOJO());
    }
}
