/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Host side of {@link EventEmitter}: delivers every emitted event to the listeners registered for its name, on the
 * emitting thread.
 */
public class DeviceEventEmitter implements EventEmitter {
    private static final Logger logger = LoggerFactory.getLogger(DeviceEventEmitter.class);
    private final ConcurrentHashMap<String, Set<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    /**
     * Listen to an event.
     *
     * @param eventName event name
     * @param listener  called with the event body
     * @return handle to remove the listener
     */
    public Subscription addListener(String eventName, Consumer<Object> listener) {
        listeners.computeIfAbsent(eventName, k -> new CopyOnWriteArraySet<>()).add(listener);
        return () -> removeListener(eventName, listener);
    }

    /**
     * Stop listening to an event.
     *
     * @param eventName event name
     * @param listener  listener previously added
     */
    public void removeListener(String eventName, Consumer<Object> listener) {
        listeners.computeIfPresent(eventName, (k, v) -> {
            v.remove(listener);
            return v.isEmpty() ? null : v;
        });
    }

    public int listenerCount(String eventName) {
        Set<Consumer<Object>> set = listeners.get(eventName);
        return set == null ? 0 : set.size();
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingThrowable")
    public void emit(String eventName, @Nullable Object body) {
        Set<Consumer<Object>> set = listeners.get(eventName);
        if (set == null) {
            logger.atTrace().addKeyValue("event", eventName).log("No listeners for event");
            return;
        }
        for (Consumer<Object> l : set) {
            try {
                l.accept(body);
            } catch (Throwable t) {
                logger.atError().addKeyValue("eventType", "event-listener-error").addKeyValue("event", eventName)
                        .setCause(t).log("Exception while delivering event");
            }
        }
    }

    /**
     * Handle returned by {@link #addListener}.
     */
    @FunctionalInterface
    public interface Subscription {
        void remove();
    }
}
