/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import com.aws.settingsbridge.dependency.Context;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreferencesWriterTest {
    @TempDir
    protected Path tempDir;
    private Context context;

    @BeforeEach
    void beforeEach() {
        context = new Context();
    }

    @AfterEach
    void afterEach() throws IOException {
        context.close();
    }

    @Test
    void GIVEN_writer_attached_WHEN_values_set_and_removed_THEN_reload_restores_store() throws Exception {
        Path tlog = tempDir.resolve("prefs.tlog");
        Preferences prefs = new Preferences(context);
        try (PreferencesWriter writer = PreferencesWriter.logTransactionsTo(prefs, tlog)) {
            writer.flushImmediately(true);
            Map<String, Object> nested = new HashMap<>();
            nested.put("size", 12);
            nested.put("tags", Arrays.asList("a", "b"));
            prefs.put("theme", "dark");
            prefs.put("font", nested);
            prefs.put("enabled", true);
            prefs.put("temporary", "gone soon");
            prefs.remove("temporary");
            context.waitForPublishQueueToClear();
            assertEquals(5, writer.getEntryCount());
        }

        Context reloadContext = new Context();
        try {
            Preferences reloaded = PreferencesReader.createFromTLog(reloadContext, tlog);
            assertThat(reloaded.toPOJO(), is(prefs.toPOJO()));
            assertFalse(reloaded.contains("temporary"));
        } finally {
            reloadContext.close();
        }
    }

    @Test
    void GIVEN_concurrent_put_and_remove_of_one_key_WHEN_tlog_replayed_THEN_matches_live_store() throws Exception {
        Path tlog = tempDir.resolve("prefs.tlog");
        Preferences prefs = new Preferences(context);
        int rounds = 2000;
        try (PreferencesWriter writer = PreferencesWriter.logTransactionsTo(prefs, tlog)) {
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> putter = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        prefs.put("k", i);
                    }
                    return null;
                });
                Future<?> remover = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        prefs.remove("k");
                    }
                    return null;
                });
                start.countDown();
                putter.get(30, TimeUnit.SECONDS);
                remover.get(30, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }
            context.waitForPublishQueueToClear();
        }

        Context reloadContext = new Context();
        try {
            Preferences replayed = new Preferences(reloadContext);
            PreferencesReader.mergeTLogInto(replayed, tlog, true);
            assertEquals(prefs.toPOJO(), replayed.toPOJO());
            assertEquals(prefs.find("k") != null, prefs.contains("k"));
        } finally {
            reloadContext.close();
        }
    }

    @Test
    void GIVEN_writer_closed_WHEN_value_set_THEN_nothing_written() throws Exception {
        Path tlog = tempDir.resolve("prefs.tlog");
        Preferences prefs = new Preferences(context);
        PreferencesWriter writer = PreferencesWriter.logTransactionsTo(prefs, tlog);
        prefs.put("a", 1);
        context.waitForPublishQueueToClear();
        writer.close();
        writer.close();

        prefs.put("b", 2);
        context.waitForPublishQueueToClear();
        List<String> lines = Files.readAllLines(tlog, StandardCharsets.UTF_8);
        assertThat(lines, hasSize(1));
        assertThat(lines.get(0), containsString("\"K\":\"a\""));
    }

    @Test
    void GIVEN_store_WHEN_dump_THEN_one_line_per_key_and_no_temp_file_left() throws Exception {
        Path tlog = tempDir.resolve("dump.tlog");
        Files.write(tlog, Collections.singletonList("stale content"), StandardCharsets.UTF_8);
        Preferences prefs = new Preferences(context);
        prefs.put("a", 1);
        prefs.put("a", 2);
        prefs.put("b", "x");

        PreferencesWriter.dump(prefs, tlog);

        assertThat(Files.readAllLines(tlog, StandardCharsets.UTF_8), hasSize(2));
        assertFalse(Files.exists(tempDir.resolve("dump.tlog.tmp")));
        assertTrue(PreferencesReader.validateTlog(tlog));
    }

    @Test
    void GIVEN_auto_truncate_WHEN_max_entries_exceeded_THEN_tlog_rewritten_with_current_state() throws Exception {
        Path tlog = tempDir.resolve("prefs.tlog");
        Preferences prefs = new Preferences(context);
        try (PreferencesWriter writer = PreferencesWriter.logTransactionsTo(prefs, tlog)
                .flushImmediately(true).withMaxEntries(3).withAutoTruncate()) {
            for (int i = 0; i < 4; i++) {
                prefs.put("counter", i);
            }
            context.waitForPublishQueueToClear();

            List<String> lines = Files.readAllLines(tlog, StandardCharsets.UTF_8);
            assertThat(lines, hasSize(1));
            assertThat(lines.get(0), containsString("\"V\":3"));
            assertFalse(Files.exists(tempDir.resolve("prefs.tlog.old")));
            assertEquals(0, writer.getEntryCount());

            prefs.put("counter", 4);
            context.waitForPublishQueueToClear();
            assertThat(Files.readAllLines(tlog, StandardCharsets.UTF_8), hasSize(2));
        }

        Context reloadContext = new Context();
        try {
            Preferences reloaded = PreferencesReader.createFromTLog(reloadContext, tlog);
            assertEquals(4L, reloaded.get("counter"));
        } finally {
            reloadContext.close();
        }
    }

    @Test
    void GIVEN_writer_WHEN_truncate_now_THEN_removed_keys_dropped_from_tlog() throws Exception {
        Path tlog = tempDir.resolve("prefs.tlog");
        Preferences prefs = new Preferences(context);
        try (PreferencesWriter writer = PreferencesWriter.logTransactionsTo(prefs, tlog).flushImmediately(true)) {
            prefs.put("keep", "yes");
            prefs.put("drop", "no");
            prefs.remove("drop");
            context.waitForPublishQueueToClear();
            assertThat(Files.readAllLines(tlog, StandardCharsets.UTF_8), hasSize(3));

            writer.truncateNow();
            context.waitForPublishQueueToClear();

            List<String> lines = Files.readAllLines(tlog, StandardCharsets.UTF_8);
            assertThat(lines, hasSize(1));
            assertThat(lines.get(0), containsString("\"K\":\"keep\""));
        }
    }
}
