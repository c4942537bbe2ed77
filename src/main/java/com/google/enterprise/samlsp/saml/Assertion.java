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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.joda.time.DateTime;

/**
 * The content of a validated SAML assertion.  Instances are only made once
 * every check on the enclosing response has passed.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class Assertion {
  @Nonnull private final String id;
  @Nonnull private final String issuer;
  @Nullable private final String nameId;
  @Nullable private final String nameIdFormat;
  @Nullable private final DateTime notBefore;
  @Nullable private final DateTime notOnOrAfter;
  @Nonnull private final ImmutableList<String> audiences;
  @Nonnull private final ImmutableListMultimap<String, String> attributes;
  @Nullable private final DateTime authnInstant;
  @Nullable private final String sessionIndex;
  @Nullable private final DateTime sessionNotOnOrAfter;
  @Nullable private final String inResponseTo;
  private final boolean assertionSigned;
  private final boolean responseSigned;

  private Assertion(Builder builder) {
    id = builder.id;
    issuer = builder.issuer;
    nameId = builder.nameId;
    nameIdFormat = builder.nameIdFormat;
    notBefore = builder.notBefore;
    notOnOrAfter = builder.notOnOrAfter;
    audiences = builder.audiences.build();
    attributes = builder.attributes.build();
    authnInstant = builder.authnInstant;
    sessionIndex = builder.sessionIndex;
    sessionNotOnOrAfter = builder.sessionNotOnOrAfter;
    inResponseTo = builder.inResponseTo;
    assertionSigned = builder.assertionSigned;
    responseSigned = builder.responseSigned;
  }

  @Nonnull
  public String getId() {
    return id;
  }

  @Nonnull
  public String getIssuer() {
    return issuer;
  }

  @Nullable
  public String getNameId() {
    return nameId;
  }

  @Nullable
  public String getNameIdFormat() {
    return nameIdFormat;
  }

  @Nullable
  public DateTime getNotBefore() {
    return notBefore;
  }

  @Nullable
  public DateTime getNotOnOrAfter() {
    return notOnOrAfter;
  }

  @Nonnull
  public ImmutableList<String> getAudiences() {
    return audiences;
  }

  /**
   * Gets the attributes, keyed by name.  Values are in document order.
   */
  @Nonnull
  public ImmutableListMultimap<String, String> getAttributes() {
    return attributes;
  }

  /**
   * Gets the first value of an attribute, which is its canonical value.
   *
   * @return The value, or {@code null} if the attribute is absent.
   */
  @Nullable
  public String getFirstAttributeValue(String name) {
    ImmutableList<String> values = attributes.get(name);
    return values.isEmpty() ? null : values.get(0);
  }

  @Nullable
  public DateTime getAuthnInstant() {
    return authnInstant;
  }

  @Nullable
  public String getSessionIndex() {
    return sessionIndex;
  }

  @Nullable
  public DateTime getSessionNotOnOrAfter() {
    return sessionNotOnOrAfter;
  }

  @Nullable
  public String getInResponseTo() {
    return inResponseTo;
  }

  /** Did the assertion carry a signature that verified? */
  public boolean isAssertionSigned() {
    return assertionSigned;
  }

  /** Did the enclosing response carry a signature that verified? */
  public boolean isResponseSigned() {
    return responseSigned;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) {
      return true;
    }
    if (!(object instanceof Assertion)) {
      return false;
    }
    Assertion other = (Assertion) object;
    return id.equals(other.id)
        && issuer.equals(other.issuer)
        && Objects.equals(nameId, other.nameId)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, issuer, nameId, attributes);
  }

  @Override
  public String toString() {
    return "{Assertion id: " + id + ", issuer: " + issuer + ", nameId: " + nameId
        + ", attributes: " + attributes.keySet() + "}";
  }

  @Nonnull
  public static Builder builder(String id, String issuer) {
    return new Builder(id, issuer);
  }

  /**
   * A builder for assertions.
   */
  public static final class Builder {
    private final String id;
    private final String issuer;
    private String nameId;
    private String nameIdFormat;
    private DateTime notBefore;
    private DateTime notOnOrAfter;
    private final ImmutableList.Builder<String> audiences = ImmutableList.builder();
    private final ImmutableListMultimap.Builder<String, String> attributes =
        ImmutableListMultimap.builder();
    private DateTime authnInstant;
    private String sessionIndex;
    private DateTime sessionNotOnOrAfter;
    private String inResponseTo;
    private boolean assertionSigned;
    private boolean responseSigned;

    private Builder(String id, String issuer) {
      this.id = Preconditions.checkNotNull(id);
      this.issuer = Preconditions.checkNotNull(issuer);
    }

    public Builder setNameId(@Nullable String nameId, @Nullable String nameIdFormat) {
      this.nameId = nameId;
      this.nameIdFormat = nameIdFormat;
      return this;
    }

    public Builder setConditions(@Nullable DateTime notBefore, @Nullable DateTime notOnOrAfter) {
      this.notBefore = notBefore;
      this.notOnOrAfter = notOnOrAfter;
      return this;
    }

    public Builder addAudience(String audience) {
      audiences.add(audience);
      return this;
    }

    public Builder addAttributeValue(String name, String value) {
      attributes.put(name, value);
      return this;
    }

    public Builder setAuthnStatement(@Nullable DateTime authnInstant,
        @Nullable String sessionIndex, @Nullable DateTime sessionNotOnOrAfter) {
      this.authnInstant = authnInstant;
      this.sessionIndex = sessionIndex;
      this.sessionNotOnOrAfter = sessionNotOnOrAfter;
      return this;
    }

    public Builder setInResponseTo(@Nullable String inResponseTo) {
      this.inResponseTo = inResponseTo;
      return this;
    }

    public Builder setSigned(boolean assertionSigned, boolean responseSigned) {
      this.assertionSigned = assertionSigned;
      this.responseSigned = responseSigned;
      return this;
    }

    @Nonnull
    public Assertion build() {
      return new Assertion(this);
    }
  }
}
