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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.enterprise.samlsp.config.ConfigException;
import com.google.enterprise.samlsp.saml.SamlValidationException;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * A single-sign-on failure, in the structured form the web layer reports:
 * a kind, a machine-readable reason, a message, and an HTTP status.
 */
@ParametersAreNonnullByDefault
public class SsoException extends Exception {
  public static final String GENERIC_CONFIGURATION_REASON = "configuration";

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .create();

  /**
   * The kinds of failure, and the HTTP status each maps to.
   */
  public enum Kind {
    CONFIGURATION(500),
    AUTHENTICATION(401);

    private final int httpStatus;

    private Kind(int httpStatus) {
      this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
      return httpStatus;
    }
  }

  @Nonnull private final Kind kind;
  @Nonnull private final String reason;

  public SsoException(Kind kind, String reason, String message, Throwable cause) {
    super(message, cause);
    this.kind = Preconditions.checkNotNull(kind);
    this.reason = Preconditions.checkNotNull(reason);
  }

  /**
   * Makes an exception for a configuration failure.  The reason is the name
   * of the offending parameter, if known.
   */
  @Nonnull
  public static SsoException configuration(ConfigException e) {
    String param = e.getParam();
    return new SsoException(Kind.CONFIGURATION,
        (param != null) ? param : GENERIC_CONFIGURATION_REASON,
        "SAML configuration error: " + e.getMessage(), e);
  }

  /**
   * Makes an exception for a response that failed validation.
   */
  @Nonnull
  public static SsoException authentication(SamlValidationException e) {
    return new SsoException(Kind.AUTHENTICATION, e.getReason().name(),
        "SAML authentication failed: " + e.getMessage(), e);
  }

  @Nonnull
  public Kind getKind() {
    return kind;
  }

  @Nonnull
  public String getReason() {
    return reason;
  }

  public int getHttpStatus() {
    return kind.getHttpStatus();
  }

  /**
   * Renders this failure as a JSON object with {@code kind}, {@code reason},
   * {@code message} and {@code http_status} members.
   */
  @Nonnull
  public String toJson() {
    return GSON.toJson(new Body(this));
  }

  private static final class Body {
    final String kind;
    final String reason;
    final String message;
    final int httpStatus;

    Body(SsoException e) {
      kind = Ascii.toLowerCase(e.kind.name());
      reason = e.reason;
      message = e.getMessage();
      httpStatus = e.getHttpStatus();
    }
  }
}
