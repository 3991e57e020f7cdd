/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DeviceEventEmitterTest {
    private final DeviceEventEmitter emitter = new DeviceEventEmitter();

    @Test
    void GIVEN_listeners_WHEN_emit_THEN_only_listeners_of_that_event_called() {
        List<Object> updates = new ArrayList<>();
        List<Object> others = new ArrayList<>();
        emitter.addListener("settingsUpdated", updates::add);
        emitter.addListener("other", others::add);

        emitter.emit("settingsUpdated", "body");
        emitter.emit("unheard", "ignored");

        assertThat(updates, contains("body"));
        assertThat(others, empty());
    }

    @Test
    void GIVEN_subscription_WHEN_removed_THEN_no_more_events() {
        List<Object> updates = new ArrayList<>();
        DeviceEventEmitter.Subscription subscription = emitter.addListener("settingsUpdated", updates::add);
        assertEquals(1, emitter.listenerCount("settingsUpdated"));

        subscription.remove();
        emitter.emit("settingsUpdated", "body");

        assertThat(updates, empty());
        assertEquals(0, emitter.listenerCount("settingsUpdated"));
    }

    @Test
    void GIVEN_failing_listener_WHEN_emit_THEN_other_listeners_still_called() {
        List<Object> updates = new ArrayList<>();
        emitter.addListener("settingsUpdated", body -> {
            throw new IllegalStateException("listener failure");
        });
        emitter.addListener("settingsUpdated", updates::add);

        emitter.emit("settingsUpdated", null);

        assertEquals(1, updates.size());
    }
}
