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
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The complete SAML configuration: both parties, the security policy, and
 * the attribute mapping.  Built once at startup and shared read-only by
 * every request.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class SamlSettings {
  @Nonnull private final SpSettings sp;
  @Nonnull private final IdpSettings idp;
  @Nonnull private final SecurityPolicy policy;
  @Nonnull private final AttributeNames attributeNames;
  private final boolean debug;

  private SamlSettings(SpSettings sp, IdpSettings idp, SecurityPolicy policy,
      AttributeNames attributeNames, boolean debug) {
    this.sp = sp;
    this.idp = idp;
    this.policy = policy;
    this.attributeNames = attributeNames;
    this.debug = debug;
  }

  @Nonnull
  public static SamlSettings make(SpSettings sp, IdpSettings idp, SecurityPolicy policy,
      AttributeNames attributeNames, boolean debug) {
    Preconditions.checkNotNull(sp);
    Preconditions.checkNotNull(idp);
    Preconditions.checkNotNull(policy);
    Preconditions.checkNotNull(attributeNames);
    Preconditions.checkArgument(!policy.signRequests() || sp.hasSigningCredential(),
        "Signed requests need an SP private key");
    return new SamlSettings(sp, idp, policy, attributeNames, debug);
  }

  @Nonnull
  public SpSettings getSp() {
    return sp;
  }

  @Nonnull
  public IdpSettings getIdp() {
    return idp;
  }

  @Nonnull
  public SecurityPolicy getPolicy() {
    return policy;
  }

  @Nonnull
  public AttributeNames getAttributeNames() {
    return attributeNames;
  }

  /** Should request and attribute diagnostics be logged at INFO? */
  public boolean isDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("sp", sp)
        .add("idp", idp)
        .add("policy", policy)
        .add("attributeNames", attributeNames)
        .add("debug", debug)
        .toString();
  }
}
