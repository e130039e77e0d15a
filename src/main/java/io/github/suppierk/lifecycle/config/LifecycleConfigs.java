/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.lifecycle.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;

/** Builds {@link LifecycleConfig} instances outside of a container. */
public final class LifecycleConfigs {
  private static final String OVERRIDES_SOURCE = "lifecycle-overrides";
  private static final int OVERRIDES_ORDINAL = 500;

  private LifecycleConfigs() {
    // Cannot be instantiated
  }

  /**
   * @return configuration from system properties, environment variables and {@code
   *     META-INF/microprofile-config.properties}
   */
  public static LifecycleConfig load() {
    return load(Map.of());
  }

  /**
   * @param overrides properties taking precedence over every default source, e.g. {@code
   *     lifecycle.policy.sales-won-phase=active}
   * @return resolved configuration
   */
  public static LifecycleConfig load(Map<String, String> overrides) {
    if (overrides == null) {
      throw new IllegalArgumentException("Overrides cannot be null");
    }

    final SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL))
            .withMapping(LifecycleConfig.class)
            .build();

    return config.getConfigMapping(LifecycleConfig.class);
  }
}
