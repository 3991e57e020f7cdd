/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import com.aws.settingsbridge.util.Coerce;
import com.aws.settingsbridge.util.Utils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.aws.settingsbridge.util.Utils.flush;

/**
 * Appends every change of a {@link Preferences} store to a transaction log, one JSON line per change.
 */
public class PreferencesWriter implements Closeable, PreferenceListener {
    private static final String TRUNCATE_TLOG_EVENT = "truncate-tlog";
    private static final String EVENT_TYPE = "eventType";
    public static final long DEFAULT_MAX_TLOG_ENTRIES = 15_000;

    private Writer out;
    private final Path tlogOutputPath;
    private final Preferences prefs;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean truncateQueued = new AtomicBoolean();
    private final AtomicLong count = new AtomicLong(0);  // entries written so far
    @SuppressFBWarnings(value = "IS2_INCONSISTENT_SYNC", justification = "No need for flush immediately to be sync")
    private boolean flushImmediately;
    @SuppressFBWarnings(value = "IS2_INCONSISTENT_SYNC", justification = "No need to sync config variable")
    private boolean autoTruncate = false;
    @SuppressFBWarnings(value = "IS2_INCONSISTENT_SYNC", justification = "No need to sync config variable")
    private long maxCount = DEFAULT_MAX_TLOG_ENTRIES;  // max before truncation
    private long retryCount = 0;  // retry truncate at this count after error occurred

    private static final Logger logger = LoggerFactory.getLogger(PreferencesWriter.class);

    @SuppressWarnings("LeakingThisInConstructor")
    PreferencesWriter(Preferences p, Writer o, Path path) {
        out = o;
        tlogOutputPath = path;
        prefs = p;
        prefs.subscribe(this);
    }

    /**
     * Write the current content of the store into a new transaction log at the given path, replacing any file
     * already there.
     *
     * @param p    store to write out
     * @param path path to write to
     * @throws IOException if writing fails
     */
    public static void dump(Preferences p, Path path) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (Preference pref : p.storedPreferences()) {
                Coerce.appendParseableString(
                        new Tlogline(pref.getModtime(), pref.getKey(), WhatHappened.changed, pref.getOnce()), w);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Create a PreferencesWriter appending to the transaction log at the given path.
     *
     * @param p    store to follow
     * @param path path of the transaction log, created if missing
     * @return PreferencesWriter
     * @throws IOException if creating the transaction log fails
     */
    public static PreferencesWriter logTransactionsTo(Preferences p, Path path) throws IOException {
        return new PreferencesWriter(p, newTlogWriter(path), path);
    }

    @Override
    public synchronized void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        prefs.unsubscribe(this);
        flush(out);
        Throwable t = Utils.close(out);
        if (t != null) {
            logger.atWarn().addKeyValue(EVENT_TYPE, "tlog-close-error").setCause(t).log();
        }
    }

    /**
     * Enable truncation of the transaction log once it holds more than the max entries.
     *
     * @return this
     */
    public synchronized PreferencesWriter withAutoTruncate() {
        autoTruncate = true;
        return this;
    }

    /**
     * Set max new entries of tlog written before truncation.
     *
     * @param numEntries max number of entries
     * @return this
     */
    public PreferencesWriter withMaxEntries(long numEntries) {
        maxCount = numEntries;
        return this;
    }

    /**
     * Set PreferencesWriter to flush immediately.
     *
     * @param fl true if the writer should flush after every entry
     * @return this
     */
    public synchronized PreferencesWriter flushImmediately(boolean fl) {
        flushImmediately = fl;
        if (fl) {
            flush(out);
        }
        return this;
    }

    @Override
    public synchronized void preferenceChanged(WhatHappened what, Preference p) {
        if (closed.get() || p == null) {
            return;
        }

        Tlogline tlogline;
        if (what == WhatHappened.changed) {
            tlogline = new Tlogline(p.getModtime(), p.getKey(), WhatHappened.changed, p.getOnce());
        } else if (what == WhatHappened.removed) {
            tlogline = new Tlogline(p.getModtime(), p.getKey(), WhatHappened.removed, null);
        } else {
            return;
        }

        try {
            Coerce.appendParseableString(tlogline, out);
        } catch (IOException ex) {
            logger.atError().addKeyValue(EVENT_TYPE, "tlog-write-error").addKeyValue("key", p.getKey())
                    .setCause(ex).log();
        }
        if (flushImmediately) {
            flush(out);
        }
        long currCount = count.incrementAndGet();
        if (autoTruncate && currCount > maxCount && currCount > retryCount
                && truncateQueued.compareAndSet(false, true)) {
            // already on the publish thread, so only queue the truncation
            prefs.getContext().runOnPublishQueue(this::truncateTlog);
            logger.atDebug().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("queued");
        }
    }

    public long getEntryCount() {
        return count.get();
    }

    private static Writer newTlogWriter(Path outputPath) throws IOException {
        return Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND, StandardOpenOption.DSYNC, StandardOpenOption.CREATE);
    }

    /**
     * Discard current tlog. Start a new tlog with the current store content.
     */
    private synchronized void truncateTlog() {
        truncateQueued.set(false);
        if (closed.get()) {
            return;
        }
        logger.atDebug().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("started");
        Path oldTlogPath = tlogOutputPath.resolveSibling(tlogOutputPath.getFileName() + ".old");
        flush(out);
        Utils.close(out);
        // move old tlog
        try {
            Files.move(tlogOutputPath, oldTlogPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(e)
                    .log("failed to rename existing tlog");
            // recover: reopen writer to old tlog
            try {
                out = newTlogWriter(tlogOutputPath);
            } catch (IOException innerException) {
                logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(innerException)
                        .log("failed to recover");
                return;
            }
            setTruncateRetryCount();
            logger.atWarn().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("recovered and will retry later");
            return;
        }
        // write current state to new tlog
        try {
            dump(prefs, tlogOutputPath);
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(e)
                    .log("failed to persist preferences");
            // recover: undo renaming and keep using old tlog
            try {
                Files.move(oldTlogPath, tlogOutputPath, StandardCopyOption.REPLACE_EXISTING);
                out = newTlogWriter(tlogOutputPath);
            } catch (IOException innerException) {
                logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(innerException)
                        .log("failed to recover");
                return;
            }
            setTruncateRetryCount();
            logger.atWarn().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("recovered and will retry later");
            return;
        }
        // open writer to new tlog
        try {
            out = newTlogWriter(tlogOutputPath);
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(e).log("failed to open writer");
            return;
        }
        count.set(0);
        retryCount = 0;
        try {
            Files.deleteIfExists(oldTlogPath);
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).setCause(e)
                    .log("failed to delete old tlog");
        }
        logger.atInfo().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("completed successfully");
    }

    private synchronized void setTruncateRetryCount() {
        retryCount = count.get() + maxCount / 2;
    }

    /**
     * Immediately truncate the tlog.
     */
    public synchronized void truncateNow() {
        if (truncateQueued.compareAndSet(false, true)) {
            logger.atInfo().addKeyValue(EVENT_TYPE, TRUNCATE_TLOG_EVENT).log("queued immediate truncation");
            prefs.getContext().runOnPublishQueue(this::truncateTlog);
        }
    }
}
