// Copyright 2025 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.samlsp.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Factories for {@link ConfigSource} instances.
 */
@ParametersAreNonnullByDefault
public final class ConfigSources {

  // Non-instantiable class.
  private ConfigSources() {
  }

  /**
   * Gets a config source that reads the process environment.
   */
  @Nonnull
  public static ConfigSource environment() {
    return ENVIRONMENT;
  }

  /**
   * Gets a config source that reads a snapshot of a given map.
   */
  @Nonnull
  public static ConfigSource fromMap(Map<String, String> values) {
    Preconditions.checkNotNull(values);
    return new MapConfigSource(ImmutableMap.copyOf(values));
  }

  private static final ConfigSource ENVIRONMENT = new ConfigSource() {
    @Override
    public String get(String name) {
      return System.getenv(name);
    }

    @Override
    public String toString() {
      return "{environment}";
    }
  };

  @Immutable
  private static final class MapConfigSource implements ConfigSource {
    private final ImmutableMap<String, String> values;

    MapConfigSource(ImmutableMap<String, String> values) {
      this.values = values;
    }

    @Override
    public String get(String name) {
      return values.get(name);
    }

    @Override
    public String toString() {
      return "{map of " + values.size() + " values}";
    }
  }
}
