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

import com.google.common.base.Preconditions;
import com.google.enterprise.samlsp.common.Decorator;
import com.google.enterprise.samlsp.common.LogDecorators;
import com.google.enterprise.samlsp.config.ConfigException;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.config.SamlSettingsReader;
import com.google.enterprise.samlsp.identity.AttributeMapper;
import com.google.enterprise.samlsp.identity.CanonicalIdentity;
import com.google.enterprise.samlsp.saml.Assertion;
import com.google.enterprise.samlsp.saml.AuthnRedirect;
import com.google.enterprise.samlsp.saml.AuthnRequestBuilder;
import com.google.enterprise.samlsp.saml.RedirectBinding;
import com.google.enterprise.samlsp.saml.ResponseValidator;
import com.google.enterprise.samlsp.saml.SamlConstants;
import com.google.enterprise.samlsp.saml.SamlValidationException;
import com.google.enterprise.samlsp.saml.SpMetadataBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.ThreadSafe;

/**
 * The service-provider side of the SAML 2.0 Web Browser SSO profile, as seen
 * by the web layer.  This library knows how to send an authentication request
 * via the HTTP-Redirect binding, to receive a response via the HTTP-POST
 * binding, and to describe itself with metadata.  It does no I/O; the caller
 * owns the HTTP exchange and the session.
 */
@Singleton
@ThreadSafe
@ParametersAreNonnullByDefault
public final class SamlAuthnClient {
  private static final Logger logger = Logger.getLogger(SamlAuthnClient.class.getName());

  @Nonnull private final SamlSettings settings;
  @Nonnull private final AuthnRequestBuilder requestBuilder;
  @Nonnull private final ResponseValidator validator;
  @Nonnull private final SpMetadataBuilder metadataBuilder;

  @Inject
  SamlAuthnClient(SamlSettings settings) {
    this.settings = settings;
    requestBuilder = AuthnRequestBuilder.make(settings);
    validator = ResponseValidator.make(settings);
    metadataBuilder = SpMetadataBuilder.make(settings);
  }

  /**
   * Creates an instance of the authentication client library.
   *
   * @param settings The SAML settings to use.
   * @return An instance that uses the given settings.
   */
  @Nonnull
  public static SamlAuthnClient make(SamlSettings settings) {
    Preconditions.checkNotNull(settings);
    return new SamlAuthnClient(settings);
  }

  /**
   * Gets the settings for this client.
   */
  @Nonnull
  public SamlSettings getSettings() {
    return settings;
  }

  /**
   * Makes a redirect that sends the user agent to the IdP with a new
   * AuthnRequest.  The caller must remember the request ID and pass it to
   * {@link #consumeResponse}.
   *
   * @param relayState An opaque value for the IdP to return, or {@code null}.
   * @return The redirect.
   * @throws SsoException if the request can't be signed.
   */
  @Nonnull
  public AuthnRedirect makeLoginRedirect(@Nullable String relayState)
      throws SsoException {
    return makeLoginRedirect(relayState, false, false);
  }

  /**
   * Like {@link #makeLoginRedirect(String)}, but can ask the IdP to force
   * re-authentication or to avoid interacting with the user.
   */
  @Nonnull
  public AuthnRedirect makeLoginRedirect(@Nullable String relayState, boolean forceAuthn,
      boolean isPassive)
      throws SsoException {
    AuthnRedirect redirect;
    try {
      redirect = requestBuilder.build(relayState, forceAuthn, isPassive);
    } catch (GeneralSecurityException e) {
      throw SsoException.configuration(new ConfigException(SamlSettingsReader.SP_PRIVATE_KEY,
          "Unable to sign the AuthnRequest: " + e.getMessage(), e));
    }
    Decorator decorator = LogDecorators.getLogDecorator(settings.getIdp().getEntityId(),
        redirect.getRequestId(), null);
    logger.log(getDiagnosticLevel(), LogDecorators.logMessage(decorator,
        "Redirecting to %s (relay state %s)", settings.getIdp().getSingleSignOnUrl(),
        (relayState == null) ? "absent" : "present"));
    return redirect;
  }

  /**
   * Consumes a response posted to the assertion consumer service.
   *
   * @param samlResponse The {@code SAMLResponse} form parameter.
   * @param expectedRequestId The ID of the request this login started with,
   *     or {@code null} to accept an unsolicited response.
   * @return The identity of the authenticated user.
   * @throws SsoException if the response is missing or fails validation.
   */
  @Nonnull
  public CanonicalIdentity consumeResponse(@Nullable String samlResponse,
      @Nullable String expectedRequestId)
      throws SsoException {
    if (samlResponse == null || samlResponse.trim().isEmpty()) {
      throw SsoException.authentication(new SamlValidationException(
          SamlValidationException.Reason.MALFORMED, "No SAMLResponse in request"));
    }
    Assertion assertion;
    try {
      assertion = validator.validate(samlResponse, expectedRequestId);
    } catch (SamlValidationException e) {
      throw SsoException.authentication(e);
    }
    CanonicalIdentity identity = AttributeMapper.map(assertion, settings.getAttributeNames());
    Decorator decorator = LogDecorators.getLogDecorator(settings.getIdp().getEntityId(),
        expectedRequestId, assertion.getNameId());
    logger.info(LogDecorators.logMessage(decorator, "SAML user authenticated - ID: %s, Email: %s",
        identity.getId(), identity.getEmail()));
    return identity;
  }

  /**
   * Gets this service provider's metadata.
   *
   * @return The metadata XML.
   * @throws SsoException if the metadata is invalid or can't be signed.
   */
  @Nonnull
  public String getMetadata()
      throws SsoException {
    try {
      return metadataBuilder.build();
    } catch (ConfigException e) {
      throw SsoException.configuration(e);
    }
  }

  /**
   * Verifies and decodes a message the IdP sent via the HTTP-Redirect binding,
   * such as a logout response.
   *
   * @param rawQuery The query string as received.
   * @return The decoded XML message.
   * @throws SsoException if the signature doesn't verify or the message can't
   *     be decoded.
   */
  @Nonnull
  public String decodeSignedRedirect(String rawQuery)
      throws SsoException {
    try {
      RedirectBinding.verifyQuerySignature(rawQuery, settings.getIdp().getCertificate());
    } catch (GeneralSecurityException e) {
      throw SsoException.authentication(new SamlValidationException(
          SamlValidationException.Reason.SIGNATURE_INVALID, e.getMessage(), e));
    }
    try {
      Map<String, String> parameters = RedirectBinding.parseRawQuery(rawQuery);
      String message = parameters.containsKey(SamlConstants.SAML_RESPONSE)
          ? parameters.get(SamlConstants.SAML_RESPONSE)
          : parameters.get(SamlConstants.SAML_REQUEST);
      return RedirectBinding.decodeAndInflate(RedirectBinding.urlDecode(message));
    } catch (GeneralSecurityException | IOException e) {
      throw SsoException.authentication(new SamlValidationException(
          SamlValidationException.Reason.MALFORMED, e.getMessage(), e));
    }
  }

  private Level getDiagnosticLevel() {
    return settings.isDebug() ? Level.INFO : Level.FINE;
  }
}
