/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.config;

import com.aws.settingsbridge.preferences.PreferencesWriter;
import com.aws.settingsbridge.util.Utils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsBridgeConfigTest {
    @TempDir
    protected Path tempDir;

    @AfterEach
    void afterEach() {
        System.clearProperty(SettingsBridgeConfig.STORE_FILE_PROPERTY);
    }

    @Test
    void GIVEN_yaml_file_WHEN_load_THEN_values_read_and_unknown_fields_ignored() throws Exception {
        Path configFile = tempDir.resolve("config.yaml");
        Files.write(configFile, Arrays.asList(
                "---",
                "preferences:",
                "  storeFile: \"" + tempDir.resolve("store.tlog").toString().replace("\\", "/") + "\"",
                "  flushImmediately: false",
                "  maxTlogEntries: 20",
                "  somethingNew: 1",
                "other:",
                "  key: value"), StandardCharsets.UTF_8);

        SettingsBridgeConfig config = SettingsBridgeConfig.load(configFile);

        assertEquals(tempDir.resolve("store.tlog"), config.getPreferences().getStoreFilePath());
        assertFalse(config.getPreferences().isFlushImmediately());
        assertTrue(config.getPreferences().isAutoTruncate());
        assertEquals(20, config.getPreferences().getMaxTlogEntries());
    }

    @Test
    void GIVEN_empty_yaml_WHEN_load_THEN_defaults_used() throws Exception {
        SettingsBridgeConfig config =
                SettingsBridgeConfig.load(new ByteArrayInputStream(new byte[0]));

        assertEquals(Utils.HOME_PATH.resolve(".settings-bridge/preferences.tlog"),
                config.getPreferences().getStoreFilePath());
        assertTrue(config.getPreferences().isFlushImmediately());
        assertEquals(PreferencesWriter.DEFAULT_MAX_TLOG_ENTRIES, config.getPreferences().getMaxTlogEntries());
    }

    @Test
    void GIVEN_yaml_without_preferences_WHEN_load_THEN_defaults_used() throws Exception {
        SettingsBridgeConfig config = SettingsBridgeConfig.load(
                new ByteArrayInputStream("other: 1\n".getBytes(StandardCharsets.UTF_8)));

        assertEquals(SettingsBridgeConfig.DEFAULT_STORE_FILE, config.getPreferences().getStoreFile());
    }

    @Test
    void GIVEN_bundled_resource_WHEN_load_default_THEN_matches_built_in_defaults() throws Exception {
        SettingsBridgeConfig config = SettingsBridgeConfig.loadDefault();
        assertEquals(new SettingsBridgeConfig(), config);
    }

    @Test
    void GIVEN_store_file_system_property_WHEN_load_THEN_property_wins() throws Exception {
        Path override = tempDir.resolve("override.tlog");
        System.setProperty(SettingsBridgeConfig.STORE_FILE_PROPERTY, override.toString());

        SettingsBridgeConfig config = SettingsBridgeConfig.load(new ByteArrayInputStream(
                "preferences:\n  storeFile: /somewhere/else.tlog\n".getBytes(StandardCharsets.UTF_8)));

        assertEquals(override, config.getPreferences().getStoreFilePath());
        assertEquals(override, SettingsBridgeConfig.loadDefault().getPreferences().getStoreFilePath());
    }

    @Test
    void GIVEN_builder_WHEN_fields_omitted_THEN_defaults_used() {
        SettingsBridgeConfig config = SettingsBridgeConfig.builder()
                .preferences(SettingsBridgeConfig.PreferencesConfig.builder().autoTruncate(false).build())
                .build();

        assertFalse(config.getPreferences().isAutoTruncate());
        assertTrue(config.getPreferences().isFlushImmediately());
        assertEquals(SettingsBridgeConfig.DEFAULT_STORE_FILE, config.getPreferences().getStoreFile());
    }
}
