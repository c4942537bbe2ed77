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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.samlsp.saml.DigestAlgorithm;
import com.google.enterprise.samlsp.saml.SamlConstants;
import com.google.enterprise.samlsp.saml.SignatureAlgorithm;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.joda.time.Duration;

/**
 * The security policy applied to outbound requests and inbound responses.
 * Instances are immutable; use {@link #builder} to make one.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class SecurityPolicy {
  public static final Duration DEFAULT_CLOCK_SKEW = Duration.standardSeconds(300);
  public static final String DEFAULT_AUTHN_CONTEXT_COMPARISON = "exact";

  private final boolean signRequests;
  private final boolean wantMessagesSigned;
  private final boolean wantAssertionsSigned;
  private final boolean wantAssertionsEncrypted;
  private final boolean wantNameId;
  private final boolean wantAttributeStatement;
  @Nonnull private final ImmutableList<String> requestedAuthnContext;
  @Nonnull private final String requestedAuthnContextComparison;
  @Nonnull private final SignatureAlgorithm signatureAlgorithm;
  @Nonnull private final DigestAlgorithm digestAlgorithm;
  @Nonnull private final Duration clockSkew;

  private SecurityPolicy(Builder builder) {
    this.signRequests = builder.signRequests;
    this.wantMessagesSigned = builder.wantMessagesSigned;
    this.wantAssertionsSigned = builder.wantAssertionsSigned;
    this.wantAssertionsEncrypted = builder.wantAssertionsEncrypted;
    this.wantNameId = builder.wantNameId;
    this.wantAttributeStatement = builder.wantAttributeStatement;
    this.requestedAuthnContext = builder.requestedAuthnContext;
    this.requestedAuthnContextComparison = builder.requestedAuthnContextComparison;
    this.signatureAlgorithm = builder.signatureAlgorithm;
    this.digestAlgorithm = builder.digestAlgorithm;
    this.clockSkew = builder.clockSkew;
  }

  /** Are outbound AuthnRequests signed? */
  public boolean signRequests() {
    return signRequests;
  }

  /** Must the Response element itself carry a valid signature? */
  public boolean wantMessagesSigned() {
    return wantMessagesSigned;
  }

  /**
   * Must the assertion be covered by a valid signature, either its own or
   * the enclosing Response's?
   */
  public boolean wantAssertionsSigned() {
    return wantAssertionsSigned;
  }

  public boolean wantAssertionsEncrypted() {
    return wantAssertionsEncrypted;
  }

  /** Must the assertion's subject carry a NameID? */
  public boolean wantNameId() {
    return wantNameId;
  }

  /** Must the assertion carry an attribute statement? */
  public boolean wantAttributeStatement() {
    return wantAttributeStatement;
  }

  /**
   * Gets the authentication context classes requested from the IdP.  An
   * empty list means no {@code RequestedAuthnContext} is sent.
   */
  @Nonnull
  public ImmutableList<String> getRequestedAuthnContext() {
    return requestedAuthnContext;
  }

  @Nonnull
  public String getRequestedAuthnContextComparison() {
    return requestedAuthnContextComparison;
  }

  @Nonnull
  public SignatureAlgorithm getSignatureAlgorithm() {
    return signatureAlgorithm;
  }

  @Nonnull
  public DigestAlgorithm getDigestAlgorithm() {
    return digestAlgorithm;
  }

  /** Gets the tolerance applied to every timestamp comparison. */
  @Nonnull
  public Duration getClockSkew() {
    return clockSkew;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("signRequests", signRequests)
        .add("wantMessagesSigned", wantMessagesSigned)
        .add("wantAssertionsSigned", wantAssertionsSigned)
        .add("wantNameId", wantNameId)
        .add("wantAttributeStatement", wantAttributeStatement)
        .add("signatureAlgorithm", signatureAlgorithm)
        .add("digestAlgorithm", digestAlgorithm)
        .add("clockSkew", clockSkew)
        .toString();
  }

  /**
   * Gets a builder initialized with the default policy: unsigned requests,
   * signed assertions required, RSA-SHA256 with SHA-256 digests, and a
   * five-minute clock skew.
   */
  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder for security policies.
   */
  public static final class Builder {
    private boolean signRequests = false;
    private boolean wantMessagesSigned = false;
    private boolean wantAssertionsSigned = true;
    private boolean wantAssertionsEncrypted = false;
    private boolean wantNameId = true;
    private boolean wantAttributeStatement = false;
    private ImmutableList<String> requestedAuthnContext =
        ImmutableList.of(SamlConstants.AUTHN_CONTEXT_PASSWORD_PROTECTED_TRANSPORT);
    private String requestedAuthnContextComparison = DEFAULT_AUTHN_CONTEXT_COMPARISON;
    private SignatureAlgorithm signatureAlgorithm = SignatureAlgorithm.RSA_SHA256;
    private DigestAlgorithm digestAlgorithm = DigestAlgorithm.SHA256;
    private Duration clockSkew = DEFAULT_CLOCK_SKEW;

    private Builder() {
    }

    public Builder setSignRequests(boolean signRequests) {
      this.signRequests = signRequests;
      return this;
    }

    public Builder setWantMessagesSigned(boolean wantMessagesSigned) {
      this.wantMessagesSigned = wantMessagesSigned;
      return this;
    }

    public Builder setWantAssertionsSigned(boolean wantAssertionsSigned) {
      this.wantAssertionsSigned = wantAssertionsSigned;
      return this;
    }

    public Builder setWantAssertionsEncrypted(boolean wantAssertionsEncrypted) {
      this.wantAssertionsEncrypted = wantAssertionsEncrypted;
      return this;
    }

    public Builder setWantNameId(boolean wantNameId) {
      this.wantNameId = wantNameId;
      return this;
    }

    public Builder setWantAttributeStatement(boolean wantAttributeStatement) {
      this.wantAttributeStatement = wantAttributeStatement;
      return this;
    }

    public Builder setRequestedAuthnContext(Iterable<String> classRefs,
        @Nullable String comparison) {
      this.requestedAuthnContext = ImmutableList.copyOf(classRefs);
      this.requestedAuthnContextComparison =
          (comparison == null) ? DEFAULT_AUTHN_CONTEXT_COMPARISON : comparison;
      return this;
    }

    public Builder setSignatureAlgorithm(SignatureAlgorithm signatureAlgorithm) {
      this.signatureAlgorithm = Preconditions.checkNotNull(signatureAlgorithm);
      return this;
    }

    public Builder setDigestAlgorithm(DigestAlgorithm digestAlgorithm) {
      this.digestAlgorithm = Preconditions.checkNotNull(digestAlgorithm);
      return this;
    }

    public Builder setClockSkew(Duration clockSkew) {
      Preconditions.checkArgument(clockSkew.getMillis() >= 0, "Clock skew must be non-negative");
      this.clockSkew = clockSkew;
      return this;
    }

    @Nonnull
    public SecurityPolicy build() {
      return new SecurityPolicy(this);
    }
  }
}
