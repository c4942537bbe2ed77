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
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The configuration of the local service provider.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class SpSettings {
  @Nonnull private final String entityId;
  @Nonnull private final String assertionConsumerServiceUrl;
  @Nonnull private final String singleLogoutServiceUrl;
  @Nonnull private final String nameIdFormat;
  @Nullable private final X509Certificate certificate;
  @Nullable private final PrivateKey privateKey;

  private SpSettings(String entityId, String assertionConsumerServiceUrl,
      String singleLogoutServiceUrl, String nameIdFormat,
      @Nullable X509Certificate certificate, @Nullable PrivateKey privateKey) {
    this.entityId = entityId;
    this.assertionConsumerServiceUrl = assertionConsumerServiceUrl;
    this.singleLogoutServiceUrl = singleLogoutServiceUrl;
    this.nameIdFormat = nameIdFormat;
    this.certificate = certificate;
    this.privateKey = privateKey;
  }

  /**
   * Makes an SP settings object.
   *
   * @param entityId The SP's entity ID.
   * @param assertionConsumerServiceUrl The absolute URL of the SP's ACS endpoint.
   * @param singleLogoutServiceUrl The absolute URL of the SP's SLO endpoint.
   * @param nameIdFormat The NameID format requested from the IdP.
   * @param certificate The SP's certificate, if any.
   * @param privateKey The SP's private key, if any.  A key requires a
   *     certificate; the caller is responsible for checking that they match.
   * @return The settings.
   */
  @Nonnull
  public static SpSettings make(String entityId, String assertionConsumerServiceUrl,
      String singleLogoutServiceUrl, String nameIdFormat,
      @Nullable X509Certificate certificate, @Nullable PrivateKey privateKey) {
    Preconditions.checkNotNull(entityId);
    Preconditions.checkNotNull(assertionConsumerServiceUrl);
    Preconditions.checkNotNull(singleLogoutServiceUrl);
    Preconditions.checkNotNull(nameIdFormat);
    Preconditions.checkArgument(privateKey == null || certificate != null,
        "An SP private key requires an SP certificate");
    return new SpSettings(entityId, assertionConsumerServiceUrl, singleLogoutServiceUrl,
        nameIdFormat, certificate, privateKey);
  }

  @Nonnull
  public String getEntityId() {
    return entityId;
  }

  @Nonnull
  public String getAssertionConsumerServiceUrl() {
    return assertionConsumerServiceUrl;
  }

  @Nonnull
  public String getSingleLogoutServiceUrl() {
    return singleLogoutServiceUrl;
  }

  @Nonnull
  public String getNameIdFormat() {
    return nameIdFormat;
  }

  @Nullable
  public X509Certificate getCertificate() {
    return certificate;
  }

  @Nullable
  public PrivateKey getPrivateKey() {
    return privateKey;
  }

  /**
   * Can this SP sign messages?
   */
  public boolean hasSigningCredential() {
    return privateKey != null;
  }

  // Never includes key material.
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entityId", entityId)
        .add("acs", assertionConsumerServiceUrl)
        .add("nameIdFormat", nameIdFormat)
        .add("hasCertificate", certificate != null)
        .add("hasPrivateKey", privateKey != null)
        .toString();
  }
}
