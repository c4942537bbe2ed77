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

package com.google.enterprise.samlsp.saml;

import com.google.common.base.Preconditions;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Thrown when a SAML response fails validation.  The reason says which check
 * failed; the message says how, and never carries key material.
 */
@ParametersAreNonnullByDefault
public class SamlValidationException extends Exception {

  /**
   * The reasons a response can be rejected.
   */
  public enum Reason {
    /** A signature is missing where one is required, or doesn't verify. */
    SIGNATURE_INVALID,
    /** The assertion is outside its validity window. */
    EXPIRED,
    /** The assertion isn't addressed to this service provider. */
    AUDIENCE_MISMATCH,
    /** The assertion wasn't issued by the configured identity provider. */
    ISSUER_MISMATCH,
    /** The assertion doesn't say the user authenticated. */
    NO_AUTHN_STATEMENT,
    /** The response isn't a well-formed SAML 2.0 response we can accept. */
    MALFORMED,
    /** The identity provider reported a failure. */
    STATUS_NOT_SUCCESS,
    /** The response was sent to a different endpoint. */
    DESTINATION_MISMATCH,
    /** Required attributes are absent. */
    MISSING_ATTRIBUTES
  }

  @Nonnull private final Reason reason;

  public SamlValidationException(Reason reason, String message) {
    super(message);
    this.reason = Preconditions.checkNotNull(reason);
  }

  public SamlValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Preconditions.checkNotNull(reason);
  }

  @Nonnull
  public Reason getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return reason + ": " + super.getMessage();
  }
}
