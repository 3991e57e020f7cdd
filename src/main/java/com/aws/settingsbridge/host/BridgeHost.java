/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.host;

import com.aws.settingsbridge.bridge.ModuleRegistry;
import com.aws.settingsbridge.config.SettingsBridgeConfig;
import com.aws.settingsbridge.dependency.Context;
import com.aws.settingsbridge.preferences.Preferences;
import com.aws.settingsbridge.preferences.PreferencesReader;
import com.aws.settingsbridge.preferences.PreferencesWriter;
import com.aws.settingsbridge.settings.SettingsManager;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires a persistent {@link Preferences} store, its transaction log and a {@link ModuleRegistry} holding the
 * {@link SettingsManager} module.
 */
public class BridgeHost {
    private static final Logger logger = LoggerFactory.getLogger(BridgeHost.class);
    private static final String EVENT_TYPE = "eventType";

    private final SettingsBridgeConfig config;
    @Getter
    private Context context;
    @Getter
    private Preferences preferences;
    @Getter
    private ModuleRegistry registry;
    private final AtomicBoolean launched = new AtomicBoolean();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public BridgeHost(SettingsBridgeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Open the store and register the settings module.
     *
     * @return this
     * @throws IOException          if the transaction log cannot be read or created
     * @throws IllegalStateException if the host was already launched
     */
    public BridgeHost launch() throws IOException {
        if (!launched.compareAndSet(false, true)) {
            throw new IllegalStateException("Bridge host already launched");
        }
        SettingsBridgeConfig.PreferencesConfig prefsConfig = config.getPreferences();
        Path transactionLogPath = prefsConfig.getStoreFilePath();
        logger.atInfo().addKeyValue(EVENT_TYPE, "bridge-host-launch").addKeyValue("storeFile", transactionLogPath)
                .log();

        context = new Context();
        preferences = new Preferences(context);
        context.put(Preferences.class, preferences);
        try {
            Path parent = transactionLogPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (readPreferences(transactionLogPath)) {
                PreferencesWriter.dump(preferences, transactionLogPath);
            }
            // changes replayed from the log are already on disk
            context.waitForPublishQueueToClear();
            // hook tlog to the store so that changes over time are persisted
            PreferencesWriter tlog = PreferencesWriter.logTransactionsTo(preferences, transactionLogPath)
                    .flushImmediately(prefsConfig.isFlushImmediately())
                    .withMaxEntries(prefsConfig.getMaxTlogEntries());
            if (prefsConfig.isAutoTruncate()) {
                tlog.withAutoTruncate();
            }
            context.put(PreferencesWriter.class, tlog);
        } catch (IOException e) {
            logger.atError().addKeyValue(EVENT_TYPE, "bridge-host-read-preferences-error").setCause(e).log();
            context.close();
            throw e;
        }

        registry = new ModuleRegistry();
        context.put(ModuleRegistry.class, registry);
        registry.register(new SettingsManager(preferences, registry.getEventEmitter()));
        return this;
    }

    /**
     * Load the store from the main transaction log, or from its backup if the main one is unusable.
     *
     * @param transactionLogPath main transaction log
     * @return true if the main transaction log must be rewritten from the loaded content
     * @throws IOException if reading fails
     */
    private boolean readPreferences(Path transactionLogPath) throws IOException {
        boolean tlogExists = Files.exists(transactionLogPath);
        if (!tlogExists) {
            Path backupTlogPath = backupOf(transactionLogPath);
            if (PreferencesReader.validateTlog(backupTlogPath)) {
                logger.atWarn().addKeyValue("path", transactionLogPath).addKeyValue("backup", backupTlogPath)
                        .log("Transaction log is missing, loading preferences from backup");
                PreferencesReader.mergeTLogInto(preferences, backupTlogPath, true);
            }
            return true;
        }
        if (Files.size(transactionLogPath) == 0) {
            return false;
        }
        if (PreferencesReader.validateTlog(transactionLogPath)) {
            PreferencesReader.mergeTLogInto(preferences, transactionLogPath, false);
            return false;
        }

        // tlog recovery logic if the main tlog isn't valid
        Path backupTlogPath = backupOf(transactionLogPath);
        if (PreferencesReader.validateTlog(backupTlogPath)) {
            logger.atError().addKeyValue("path", transactionLogPath).addKeyValue("backup", backupTlogPath)
                    .log("Transaction log is invalid, loading preferences from backup");
            PreferencesReader.mergeTLogInto(preferences, backupTlogPath, true);
        } else {
            // keep every entry that still parses, a torn last line must not cost the rest of the log
            logger.atError().addKeyValue("path", transactionLogPath)
                    .log("Transaction log is invalid and no usable backup exists, loading its readable entries");
            PreferencesReader.mergeTLogInto(preferences, transactionLogPath, false);
        }
        return true;
    }

    static Path backupOf(Path transactionLogPath) {
        return transactionLogPath.resolveSibling(transactionLogPath.getFileName() + ".old");
    }

    /**
     * Tear down the module registry and close the transaction log. Safe to call more than once.
     */
    public void shutdown() {
        if (registry == null || !shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().addKeyValue(EVENT_TYPE, "bridge-host-shutdown").log();
        registry.close();
        // let pending changes reach the tlog before closing it
        context.waitForPublishQueueToClear();
        context.shutdown();
    }
}
