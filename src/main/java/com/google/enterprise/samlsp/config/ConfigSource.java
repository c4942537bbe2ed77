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
 * A source of named configuration values, such as the process environment.
 */
public interface ConfigSource {

  /**
   * Gets a configuration value.
   *
   * @param name The value's name.
   * @return The value, or {@code null} if it isn't set.
   */
  @Nullable
  String get(String name);
}
