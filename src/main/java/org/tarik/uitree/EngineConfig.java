/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tarik.uitree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uitree.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static java.util.stream.Collectors.toUnmodifiableSet;

public class EngineConfig {
    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";
    private static final String LIST_SEPARATOR = ",";

    // Main Config
    private static final ConfigProperty<Boolean> DEBUG_MODE =
            loadPropertyAsBoolean("debug.mode", "DEBUG_MODE", "false", false);

    // Rendering Config
    private static final ConfigProperty<String> CLASS_NAME_STRIP_PREFIX =
            loadProperty("class.name.strip.prefix", "CLASS_NAME_STRIP_PREFIX", "android.", s -> s, false);
    private static final ConfigProperty<Set<String>> EDITABLE_TEXT_CLASSES =
            loadProperty("editable.text.classes", "EDITABLE_TEXT_CLASSES", "android.widget.EditText",
                    EngineConfig::parseList, false);

    // Screen Analysis Config
    private static final ConfigProperty<Boolean> SCROLL_INDICATORS_ENABLED =
            loadPropertyAsBoolean("scroll.indicators.enabled", "SCROLL_INDICATORS_ENABLED", "true", false);

    // -----------------------------------------------------
    // Main Config
    public static boolean isDebugMode() {
        return DEBUG_MODE.value();
    }

    // -----------------------------------------------------
    // Rendering Config
    public static String getClassNameStripPrefix() {
        return CLASS_NAME_STRIP_PREFIX.value();
    }

    public static Set<String> getEditableTextClasses() {
        return EDITABLE_TEXT_CLASSES.value();
    }

    // -----------------------------------------------------
    // Screen Analysis Config
    public static boolean isScrollIndicatorsEnabled() {
        return SCROLL_INDICATORS_ENABLED.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = EngineConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file " + CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue, Function<String, T> converter,
                                                      boolean isSecret) {
        var value = getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.debug("Using default value for key '{}'", key);
            return defaultValue;
        });
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static ConfigProperty<Boolean> loadPropertyAsBoolean(String propertyKey, String envVar, String defaultValue,
                                                                 boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Boolean value = CommonUtils.parseStringAsBoolean(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct boolean value:%s".formatted(propertyKey, configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static Set<String> parseList(String value) {
        return stream(value.split(LIST_SEPARATOR))
                .map(String::trim)
                .filter(CommonUtils::isNotBlank)
                .collect(toUnmodifiableSet());
    }
}
