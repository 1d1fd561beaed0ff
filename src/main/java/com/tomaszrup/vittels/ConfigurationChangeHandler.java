////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vittels;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.vittels.config.StyleOptionsParser;
import com.tomaszrup.vittels.format.StyleOptions;

/**
 * Handles didChangeConfiguration processing and holds the formatting
 * settings that result from it.
 *
 * <p>The {@code vitte.format} section is read as a whole each time, on top
 * of the options the server was initialized with. Removing a key from the
 * section therefore brings back the initial value.</p>
 */
final class ConfigurationChangeHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationChangeHandler.class);

    static final String SECTION = "vitte";
    static final String FORMAT_SECTION = "format";
    static final String ENABLED_KEY = "enabled";

    /**
     * Callback interface for forwarding raw configuration settings to the
     * server layer (e.g. so {@code VitteLanguageServer} can pick up
     * {@code vitte.logLevel}).
     */
    @FunctionalInterface
    public interface SettingsChangeListener {
        void onSettingsChanged(JsonObject settings);
    }

    private final AtomicReference<StyleOptions> initialOptions =
            new AtomicReference<>(StyleOptions.defaults());
    private final AtomicReference<StyleOptions> workspaceOptions =
            new AtomicReference<>(StyleOptions.defaults());
    private volatile boolean formattingEnabled = true;
    private SettingsChangeListener settingsChangeListener;

    void setSettingsChangeListener(SettingsChangeListener listener) {
        this.settingsChangeListener = listener;
    }

    /** Options from {@code initializationOptions}; also resets the workspace options. */
    void setInitialOptions(StyleOptions options) {
        StyleOptions initial = options != null ? options : StyleOptions.defaults();
        initialOptions.set(initial);
        workspaceOptions.set(initial);
    }

    StyleOptions getWorkspaceOptions() {
        return workspaceOptions.get();
    }

    boolean isFormattingEnabled() {
        return formattingEnabled;
    }

    /**
     * Processes a didChangeConfiguration notification.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonObject settings = (JsonObject) rawSettings;
        JsonObject format = formatSection(settings);
        if (format != null) {
            updateFormattingSettings(format);
        }
        if (settingsChangeListener != null) {
            settingsChangeListener.onSettingsChanged(settings);
        }
    }

    private void updateFormattingSettings(JsonObject format) {
        JsonElement enabled = format.get(ENABLED_KEY);
        if (enabled != null && enabled.isJsonPrimitive() && enabled.getAsJsonPrimitive().isBoolean()) {
            formattingEnabled = enabled.getAsBoolean();
        } else {
            formattingEnabled = true;
        }
        StyleOptions updated = StyleOptionsParser.fromJson(format, initialOptions.get());
        StyleOptions previous = workspaceOptions.getAndSet(updated);
        if (!updated.equals(previous)) {
            logger.info("Workspace format options changed: {}", updated);
        }
        if (!formattingEnabled) {
            logger.info("Formatting disabled via settings");
        }
    }

    static JsonObject formatSection(JsonObject settings) {
        if (!settings.has(SECTION) || !settings.get(SECTION).isJsonObject()) {
            return null;
        }
        JsonObject vitte = settings.getAsJsonObject(SECTION);
        if (!vitte.has(FORMAT_SECTION) || !vitte.get(FORMAT_SECTION).isJsonObject()) {
            return null;
        }
        return vitte.getAsJsonObject(FORMAT_SECTION);
    }
}
