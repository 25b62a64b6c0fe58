/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.common.setting;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

/** {@link Settings} backed by {@link Properties}. Unknown property names are ignored. */
@Log4j2
public class PropertiesSettings extends Settings {

  public static final String DEFAULT_RESOURCE = "batchsql.properties";

  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public PropertiesSettings(Properties properties) {
    for (String name : properties.stringPropertyNames()) {
      String raw = properties.getProperty(name);
      if (StringUtils.isBlank(raw)) {
        continue;
      }
      Key.of(name)
          .ifPresentOrElse(
              key -> values.put(key, key.parse(raw)),
              () -> {
                if (name.startsWith("batchsql.")) {
                  log.warn("Ignoring unknown setting {}", name);
                }
              });
    }
  }

  /**
   * Loads settings from {@value #DEFAULT_RESOURCE} on the classpath. A missing resource yields
   * empty settings, so every option takes its default.
   */
  public static PropertiesSettings fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  public static PropertiesSettings fromClasspath(String resource) {
    Properties properties = new Properties();
    ClassLoader loader = PropertiesSettings.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("Settings resource {} not found, using defaults", resource);
      } else {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read settings resource " + resource, e);
    }
    return new PropertiesSettings(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }
}
