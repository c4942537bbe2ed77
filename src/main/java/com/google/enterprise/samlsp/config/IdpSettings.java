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
import java.security.cert.X509Certificate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The configuration of the remote identity provider.  The IdP's certificate
 * is held in parsed form, so a public key for signature verification is
 * always available.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class IdpSettings {
  @Nonnull private final String entityId;
  @Nonnull private final String singleSignOnUrl;
  @Nullable private final String singleLogoutUrl;
  @Nonnull private final X509Certificate certificate;

  private IdpSettings(String entityId, String singleSignOnUrl, @Nullable String singleLogoutUrl,
      X509Certificate certificate) {
    this.entityId = entityId;
    this.singleSignOnUrl = singleSignOnUrl;
    this.singleLogoutUrl = singleLogoutUrl;
    this.certificate = certificate;
  }

  @Nonnull
  public static IdpSettings make(String entityId, String singleSignOnUrl,
      @Nullable String singleLogoutUrl, X509Certificate certificate) {
    Preconditions.checkNotNull(entityId);
    Preconditions.checkNotNull(singleSignOnUrl);
    Preconditions.checkNotNull(certificate);
    return new IdpSettings(entityId, singleSignOnUrl, singleLogoutUrl, certificate);
  }

  @Nonnull
  public String getEntityId() {
    return entityId;
  }

  @Nonnull
  public String getSingleSignOnUrl() {
    return singleSignOnUrl;
  }

  @Nullable
  public String getSingleLogoutUrl() {
    return singleLogoutUrl;
  }

  @Nonnull
  public X509Certificate getCertificate() {
    return certificate;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entityId", entityId)
        .add("sso", singleSignOnUrl)
        .add("slo", singleLogoutUrl)
        .add("certificateSubject", certificate.getSubjectX500Principal().getName())
        .toString();
  }
}
