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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.config.IdpSettings;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.config.SecurityPolicy;
import com.google.enterprise.samlsp.config.SpSettings;
import java.security.GeneralSecurityException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.joda.time.DateTime;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds SAML 2.0 AuthnRequest messages and encodes them for the
 * HTTP-Redirect binding.  Responses are asked for on the HTTP-POST binding.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class AuthnRequestBuilder {
  private static final Logger logger = Logger.getLogger(AuthnRequestBuilder.class.getName());

  @Nonnull private final SamlSettings settings;

  private AuthnRequestBuilder(SamlSettings settings) {
    this.settings = settings;
  }

  @Nonnull
  public static AuthnRequestBuilder make(SamlSettings settings) {
    Preconditions.checkNotNull(settings);
    return new AuthnRequestBuilder(settings);
  }

  /**
   * Builds a redirect carrying a fresh AuthnRequest.
   *
   * @param relayState An opaque value for the IdP to return, or {@code null}.
   * @return The redirect.
   * @throws GeneralSecurityException if the request can't be signed.
   */
  @Nonnull
  public AuthnRedirect build(@Nullable String relayState)
      throws GeneralSecurityException {
    return build(relayState, false, false);
  }

  /**
   * Builds a redirect carrying a fresh AuthnRequest.
   *
   * @param relayState An opaque value for the IdP to return, or {@code null}.
   * @param forceAuthn If true, the IdP must re-authenticate the user.
   * @param isPassive If true, the IdP must not interact with the user.
   * @return The redirect.
   * @throws GeneralSecurityException if the request can't be signed.
   */
  @Nonnull
  public AuthnRedirect build(@Nullable String relayState, boolean forceAuthn, boolean isPassive)
      throws GeneralSecurityException {
    String requestId = SamlUtil.generateIdentifier();
    DateTime issueInstant = new DateTime();
    Document request = makeAuthnRequest(requestId, issueInstant, forceAuthn, isPassive);
    String xml = XmlUtil.writeXmlString(request);

    SecurityPolicy policy = settings.getPolicy();
    String query = RedirectBinding.encodeQuery(SamlConstants.SAML_REQUEST, xml, relayState);
    if (policy.signRequests()) {
      query = RedirectBinding.signQuery(query, policy.getSignatureAlgorithm(),
          settings.getSp().getPrivateKey());
    }
    String url = RedirectBinding.appendQuery(settings.getIdp().getSingleSignOnUrl(), query);

    logger.log(settings.isDebug() ? Level.INFO : Level.FINE,
        "AuthnRequest " + requestId + " for " + settings.getIdp().getEntityId()
        + (policy.signRequests() ? " (signed)" : " (unsigned)"));
    return AuthnRedirect.make(url, requestId, relayState, issueInstant);
  }

  /**
   * Makes the AuthnRequest document.
   */
  @VisibleForTesting
  @Nonnull
  Document makeAuthnRequest(String requestId, DateTime issueInstant, boolean forceAuthn,
      boolean isPassive) {
    SpSettings sp = settings.getSp();
    IdpSettings idp = settings.getIdp();
    SecurityPolicy policy = settings.getPolicy();
    Document document = XmlUtil.getInstance().newDocument();

    Element request = makeSamlpElement(document, SamlConstants.AUTHN_REQUEST);
    SamlUtil.declareNamespace(request, SamlConstants.SAML20P_PREFIX, SamlConstants.SAML20P_NS);
    SamlUtil.declareNamespace(request, SamlConstants.SAML20_PREFIX, SamlConstants.SAML20_NS);
    document.appendChild(request);
    request.setAttributeNS(null, SamlConstants.ID_ATTRIBUTE, requestId);
    request.setAttributeNS(null, "Version", SamlConstants.SAML_VERSION);
    request.setAttributeNS(null, "IssueInstant", SamlUtil.formatInstant(issueInstant));
    request.setAttributeNS(null, "Destination", idp.getSingleSignOnUrl());
    request.setAttributeNS(null, "ProtocolBinding", SamlConstants.SAML2_POST_BINDING_URI);
    request.setAttributeNS(null, "AssertionConsumerServiceURL",
        sp.getAssertionConsumerServiceUrl());
    if (forceAuthn) {
      request.setAttributeNS(null, "ForceAuthn", "true");
    }
    if (isPassive) {
      request.setAttributeNS(null, "IsPassive", "true");
    }

    request.appendChild(SamlUtil.makeTextElement(document, SamlConstants.SAML20_NS,
        SamlConstants.SAML20_PREFIX, SamlConstants.ISSUER, sp.getEntityId()));

    Element nameIdPolicy = makeSamlpElement(document, SamlConstants.NAME_ID_POLICY);
    nameIdPolicy.setAttributeNS(null, "Format", sp.getNameIdFormat());
    nameIdPolicy.setAttributeNS(null, "AllowCreate", "true");
    request.appendChild(nameIdPolicy);

    if (!policy.getRequestedAuthnContext().isEmpty()) {
      Element requested = makeSamlpElement(document, SamlConstants.REQUESTED_AUTHN_CONTEXT);
      requested.setAttributeNS(null, "Comparison", policy.getRequestedAuthnContextComparison());
      for (String classRef : policy.getRequestedAuthnContext()) {
        requested.appendChild(SamlUtil.makeTextElement(document, SamlConstants.SAML20_NS,
            SamlConstants.SAML20_PREFIX, SamlConstants.AUTHN_CONTEXT_CLASS_REF, classRef));
      }
      request.appendChild(requested);
    }
    return document;
  }

  private static Element makeSamlpElement(Document document, String localName) {
    return SamlUtil.makeElement(document, SamlConstants.SAML20P_NS, SamlConstants.SAML20P_PREFIX,
        localName);
  }
}
