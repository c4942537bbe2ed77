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

package com.google.enterprise.samlsp.modules;

import com.google.common.base.Preconditions;
import com.google.enterprise.samlsp.config.ConfigException;
import com.google.enterprise.samlsp.config.ConfigSource;
import com.google.enterprise.samlsp.config.ConfigSources;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.config.SamlSettingsReader;
import com.google.inject.AbstractModule;
import com.google.inject.ProvisionException;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Guice configuration for the SAML service provider.  Settings are read once,
 * from the process environment unless another source is given.
 */
public final class SamlSpGuiceModule extends AbstractModule {
  private final ConfigSource configSource;

  public SamlSpGuiceModule() {
    this(ConfigSources.environment());
  }

  public SamlSpGuiceModule(ConfigSource configSource) {
    this.configSource = Preconditions.checkNotNull(configSource);
  }

  @Override
  protected void configure() {
    bind(ConfigSource.class).toInstance(configSource);
    bind(SamlAuthnClient.class);
  }

  @Provides
  @Singleton
  SamlSettings provideSamlSettings(ConfigSource source) {
    try {
      return SamlSettingsReader.read(source);
    } catch (ConfigException e) {
      throw new ProvisionException(e.getMessage(), e);
    }
  }
}
