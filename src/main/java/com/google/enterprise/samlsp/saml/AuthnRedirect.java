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
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.joda.time.DateTime;

/**
 * The result of building an authentication request: where to send the user
 * agent, and the request ID to expect back in {@code InResponseTo}.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class AuthnRedirect {
  @Nonnull private final String url;
  @Nonnull private final String requestId;
  @Nullable private final String relayState;
  @Nonnull private final DateTime issueInstant;

  private AuthnRedirect(String url, String requestId, @Nullable String relayState,
      DateTime issueInstant) {
    this.url = url;
    this.requestId = requestId;
    this.relayState = relayState;
    this.issueInstant = issueInstant;
  }

  @Nonnull
  public static AuthnRedirect make(String url, String requestId, @Nullable String relayState,
      DateTime issueInstant) {
    Preconditions.checkNotNull(url);
    Preconditions.checkNotNull(requestId);
    Preconditions.checkNotNull(issueInstant);
    return new AuthnRedirect(url, requestId, relayState, issueInstant);
  }

  /**
   * Gets the URL to redirect the user agent to: the IdP's SSO URL carrying the
   * encoded request.
   */
  @Nonnull
  public String getUrl() {
    return url;
  }

  @Nonnull
  public String getRequestId() {
    return requestId;
  }

  @Nullable
  public String getRelayState() {
    return relayState;
  }

  @Nonnull
  public DateTime getIssueInstant() {
    return issueInstant;
  }

  @Override
  public String toString() {
    return "{AuthnRedirect requestId: " + requestId + ", issueInstant: " + issueInstant + "}";
  }
}
