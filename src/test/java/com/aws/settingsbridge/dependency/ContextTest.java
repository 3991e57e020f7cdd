/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.dependency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ContextTest {
    private Context context;

    @Mock
    private Closeable closeable;

    @BeforeEach
    void beforeEach() {
        context = new Context();
    }

    @AfterEach
    void afterEach() throws IOException {
        context.close();
    }

    @Test
    void GIVEN_tasks_queued_WHEN_wait_for_queue_THEN_all_ran_in_order_including_nested() {
        List<Integer> ran = new CopyOnWriteArrayList<>();
        context.runOnPublishQueue(() -> {
            ran.add(1);
            context.runOnPublishQueue(() -> ran.add(3));
        });
        context.runOnPublishQueue(() -> ran.add(2));

        context.waitForPublishQueueToClear();

        assertThat(ran, contains(1, 2, 3));
    }

    @Test
    void GIVEN_failing_task_WHEN_run_and_wait_THEN_throwable_returned_and_queue_keeps_running() {
        Throwable t = context.runOnPublishQueueAndWait(() -> {
            throw new IOException("task failure");
        });
        assertThat(t, instanceOf(IOException.class));

        List<Integer> ran = new CopyOnWriteArrayList<>();
        context.runOnPublishQueue(() -> {
            throw new IllegalStateException("uncaught");
        });
        context.runOnPublishQueue(() -> ran.add(1));
        context.waitForPublishQueueToClear();
        assertThat(ran, contains(1));
    }

    @Test
    void GIVEN_parts_WHEN_get_THEN_stored_instance_returned() {
        assertSame(context, context.get(Context.class));
        assertNull(context.get(String.class));
        context.put(String.class, "part");
        assertSame("part", context.get(String.class));
    }

    @Test
    void GIVEN_closeable_part_WHEN_shutdown_twice_THEN_closed_once_and_failures_tolerated() throws Exception {
        doThrow(new IOException("close failure")).when(closeable).close();
        context.put(Closeable.class, closeable);

        context.shutdown();
        context.shutdown();
        context.waitForPublishQueueToClear();

        verify(closeable, times(1)).close();
    }
}
