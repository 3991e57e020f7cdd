/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import com.aws.settingsbridge.dependency.Context;
import com.aws.settingsbridge.util.Coerce;
import com.aws.settingsbridge.util.Utils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class PreferencesReader {
    private static final Logger logger = LoggerFactory.getLogger(PreferencesReader.class);
    private static final String EVENT_TYPE = "eventType";
    private static final TypeReference<Tlogline> TLOG_LINE_REF = new TypeReference<Tlogline>() {
    };

    private PreferencesReader() {
    }

    /**
     * Merge the given transaction log into the given store.
     *
     * @param prefs          store to merge into
     * @param reader         reader of the transaction log to read from
     * @param forceTimestamp apply entries even if they are older than what the store holds
     * @throws IOException if reading fails
     */
    public static void mergeTLogInto(Preferences prefs, Reader reader, boolean forceTimestamp) throws IOException {
        try (BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader)) {
            for (String l = in.readLine(); l != null; l = in.readLine()) {
                if (Utils.isEmpty(l)) {
                    continue;
                }
                try {
                    Tlogline tlogline = Coerce.toObject(l, TLOG_LINE_REF);
                    if (Utils.isEmpty(tlogline.key)) {
                        continue;
                    }
                    if (WhatHappened.changed.equals(tlogline.action)) {
                        prefs.put(tlogline.timestamp, tlogline.key, tlogline.value, forceTimestamp);
                    } else if (WhatHappened.removed.equals(tlogline.action)) {
                        prefs.remove(tlogline.timestamp, tlogline.key, forceTimestamp);
                    }
                } catch (JsonProcessingException | UnsupportedValueTypeException e) {
                    logger.atError().addKeyValue(EVENT_TYPE, "tlog-merge-error").setCause(e)
                            .log("Fail to parse log line");
                }
            }
        }
    }

    /**
     * Merge the given transaction log into the given store.
     *
     * @param prefs          store to merge into
     * @param tlogPath       path of the tlog file to read from
     * @param forceTimestamp apply entries even if they are older than what the store holds
     * @throws IOException if reading fails
     */
    public static void mergeTLogInto(Preferences prefs, Path tlogPath, boolean forceTimestamp) throws IOException {
        // malformed bytes decode to replacement characters so the damaged line alone is skipped
        try (BufferedReader bufferedReader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(tlogPath), StandardCharsets.UTF_8))) {
            mergeTLogInto(prefs, bufferedReader, forceTimestamp);
        }
    }

    /**
     * Validate the tlog contents at the given path.
     *
     * @param tlogPath path to the file to validate.
     * @return true if all entries in the file are valid;
     *         false if file doesn't exist, is empty, or contains invalid entry
     */
    public static boolean validateTlog(Path tlogPath) {
        try {
            if (!Files.exists(tlogPath)) {
                logger.atDebug().addKeyValue(EVENT_TYPE, "validate-tlog").addKeyValue("path", tlogPath)
                        .log("Transaction log file does not exist at given path");
                return false;
            }
            // A power loss can leave the file truncated mid-line or padded with null bytes, so every line is checked.
            try (BufferedReader in = Files.newBufferedReader(tlogPath, StandardCharsets.UTF_8)) {
                String l = in.readLine();
                if (l == null) {
                    logger.atError().addKeyValue(EVENT_TYPE, "validate-tlog").addKeyValue("path", tlogPath)
                            .log("Empty transaction log file");
                    return false;
                }
                while (l != null) {
                    Coerce.toObject(l, TLOG_LINE_REF);
                    l = in.readLine();
                }
            }
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, "validate-tlog").addKeyValue("path", tlogPath).setCause(e)
                    .log("Unable to validate the transaction log content");
            return false;
        }
        return true;
    }

    /**
     * Create a store from a transaction log.
     *
     * @param context context for the new store
     * @param p       path to the transaction log
     * @return Preferences holding the content of the transaction log
     * @throws IOException if reading the transaction log fails
     */
    public static Preferences createFromTLog(Context context, Path p) throws IOException {
        Preferences prefs = new Preferences(context);
        mergeTLogInto(prefs, p, false);
        return prefs;
    }
}
