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

package com.google.enterprise.samlsp.common;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Log-message decorators for SAML exchanges.  A decorated message is prefixed
 * with the identifiers needed to diagnose an IdP misconfiguration, for
 * example {@code "idp https://idp.example.com req _3f2a...: message"}.
 *
 * <p>Only identifiers are ever put into the prefix; certificates, keys and
 * message bodies never are.
 */
@ParametersAreNonnullByDefault
public final class LogDecorators {

  // Non-instantiable class.
  private LogDecorators() {
  }

  /**
   * Gets a log-message decorator for an exchange with an IdP.
   *
   * @param idpEntityId The entity ID of the IdP.
   * @param requestId The ID of the AuthnRequest being answered, if known.
   * @param nameId The authenticated subject, if known.
   * @return A decorator that prefixes messages with the given identifiers.
   */
  @Nonnull
  public static Decorator getLogDecorator(String idpEntityId, @Nullable String requestId,
      @Nullable String nameId) {
    List<String> parts = new ArrayList<>();
    parts.add("idp " + idpEntityId);
    if (!Strings.isNullOrEmpty(requestId)) {
      parts.add("req " + requestId);
    }
    if (!Strings.isNullOrEmpty(nameId)) {
      parts.add("sub " + nameId);
    }
    final String prefix = Joiner.on(' ').join(parts) + ": ";
    return new Decorator() {
      @Override
      public String apply(String message) {
        return prefix + message;
      }
    };
  }

  /**
   * Formats and decorates a log message.
   *
   * @param decorator The decorator to apply.
   * @param format A {@link String#format} template.
   * @param args The template's arguments.
   * @return The decorated message.
   */
  @Nonnull
  public static String logMessage(Decorator decorator, String format, Object... args) {
    return decorator.apply(String.format(format, args));
  }
}
