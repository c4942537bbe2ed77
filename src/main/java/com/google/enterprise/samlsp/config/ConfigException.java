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

import javax.annotation.Nullable;

/**
 * An exception thrown when the SAML configuration is missing or invalid.
 * Configuration errors are fatal to the request in which they're detected.
 */
public class ConfigException extends Exception {

  @Nullable private final String param;

  public ConfigException(String message) {
    super(message);
    this.param = null;
  }

  public ConfigException(String param, String message) {
    super(message);
    this.param = param;
  }

  public ConfigException(String param, String message, Throwable cause) {
    super(message, cause);
    this.param = param;
  }

  /**
   * Gets the name of the configuration parameter at fault.
   *
   * @return The parameter name, or {@code null} if the error isn't specific
   *     to one parameter.
   */
  @Nullable
  public String getParam() {
    return param;
  }
}
