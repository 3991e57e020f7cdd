/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.config;

import com.aws.settingsbridge.preferences.PreferencesWriter;
import com.aws.settingsbridge.util.Utils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Host configuration, read from YAML.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsBridgeConfig {
    public static final String DEFAULT_CONFIG_RESOURCE = "settings-bridge.yaml";
    public static final String STORE_FILE_PROPERTY = "settingsbridge.storeFile";
    static final String DEFAULT_STORE_FILE = "~/.settings-bridge/preferences.tlog";

    private static final ObjectMapper CONFIG_YAML_READER =
            YAMLMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();

    @Builder.Default
    private PreferencesConfig preferences = new PreferencesConfig();

    /**
     * Read configuration from a YAML file.
     *
     * @param path file to read
     * @return configuration
     * @throws IOException if the file cannot be read or parsed
     */
    public static SettingsBridgeConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Read configuration from YAML.
     *
     * @param in YAML content
     * @return configuration, with the store file overridden by the {@value #STORE_FILE_PROPERTY} system property
     * @throws IOException if the content cannot be parsed
     */
    public static SettingsBridgeConfig load(InputStream in) throws IOException {
        JsonNode node = CONFIG_YAML_READER.readTree(in);
        SettingsBridgeConfig config = node == null || node.isMissingNode() || node.isNull()
                ? new SettingsBridgeConfig()
                : CONFIG_YAML_READER.treeToValue(node, SettingsBridgeConfig.class);
        if (config.getPreferences() == null) {
            config.setPreferences(new PreferencesConfig());
        }
        return withSystemOverrides(config);
    }

    /**
     * Read the {@value #DEFAULT_CONFIG_RESOURCE} resource from the classpath, or use defaults if there is none.
     *
     * @return configuration
     * @throws IOException if the resource cannot be parsed
     */
    public static SettingsBridgeConfig loadDefault() throws IOException {
        try (InputStream in = SettingsBridgeConfig.class.getClassLoader()
                .getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                return withSystemOverrides(new SettingsBridgeConfig());
            }
            return load(in);
        }
    }

    private static SettingsBridgeConfig withSystemOverrides(SettingsBridgeConfig config) {
        String override = System.getProperty(STORE_FILE_PROPERTY);
        if (!Utils.isEmpty(override)) {
            config.getPreferences().setStoreFile(override);
        }
        return config;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreferencesConfig {
        @Builder.Default
        private String storeFile = DEFAULT_STORE_FILE;
        @Builder.Default
        private boolean flushImmediately = true;
        @Builder.Default
        private boolean autoTruncate = true;
        @Builder.Default
        private long maxTlogEntries = PreferencesWriter.DEFAULT_MAX_TLOG_ENTRIES;

        @JsonIgnore
        public Path getStoreFilePath() {
            return Utils.homePath(storeFile);
        }
    }
}
