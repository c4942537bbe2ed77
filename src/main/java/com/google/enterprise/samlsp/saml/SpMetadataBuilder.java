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

import static com.google.enterprise.samlsp.saml.SamlConstants.SAML20MD_NS;
import static com.google.enterprise.samlsp.saml.SamlConstants.SAML20MD_PREFIX;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.samlsp.common.KeyUtil;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.config.ConfigException;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.config.SamlSettingsReader;
import com.google.enterprise.samlsp.config.SecurityPolicy;
import com.google.enterprise.samlsp.config.SpSettings;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Generates the service provider's SAML 2.0 metadata.  When the service
 * provider has a signing key, the metadata is signed with it.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class SpMetadataBuilder {
  private static final Logger logger = Logger.getLogger(SpMetadataBuilder.class.getName());

  private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

  @Nonnull private final SamlSettings settings;

  private SpMetadataBuilder(SamlSettings settings) {
    this.settings = settings;
  }

  @Nonnull
  public static SpMetadataBuilder make(SamlSettings settings) {
    Preconditions.checkNotNull(settings);
    return new SpMetadataBuilder(settings);
  }

  /**
   * Builds the metadata document and serializes it.
   *
   * @return The metadata, as an XML string with a declaration.
   * @throws ConfigException if the generated metadata is invalid or can't be
   *     signed.
   */
  @Nonnull
  public String build()
      throws ConfigException {
    Document document = buildDocument();
    List<String> errors = validate(document);
    if (!errors.isEmpty()) {
      logger.severe("SAML metadata validation errors: " + errors);
      throw new ConfigException("saml_metadata",
          "SAML metadata validation failed: " + Joiner.on(", ").join(errors));
    }
    return XML_DECLARATION + XmlUtil.writeXmlString(document.getDocumentElement());
  }

  /**
   * Builds the metadata document.
   *
   * @throws ConfigException if the metadata can't be signed.
   */
  @Nonnull
  public Document buildDocument()
      throws ConfigException {
    SpSettings sp = settings.getSp();
    SecurityPolicy policy = settings.getPolicy();
    Document document = XmlUtil.getInstance().newDocument();

    Element entity = makeMdElement(document, SamlConstants.ENTITY_DESCRIPTOR);
    SamlUtil.declareNamespace(entity, SAML20MD_PREFIX, SAML20MD_NS);
    SamlUtil.declareNamespace(entity, SamlConstants.XMLSIG_PREFIX, SamlConstants.XMLSIG_NS);
    document.appendChild(entity);
    entity.setAttributeNS(null, "entityID", sp.getEntityId());

    Element descriptor = makeMdElement(document, SamlConstants.SP_SSO_DESCRIPTOR);
    entity.appendChild(descriptor);
    descriptor.setAttributeNS(null, "AuthnRequestsSigned",
        String.valueOf(policy.signRequests()));
    descriptor.setAttributeNS(null, "WantAssertionsSigned",
        String.valueOf(policy.wantAssertionsSigned()));
    descriptor.setAttributeNS(null, "protocolSupportEnumeration", SamlConstants.SAML20P_NS);

    if (sp.getCertificate() != null) {
      Element keyDescriptor = makeMdElement(document, SamlConstants.KEY_DESCRIPTOR);
      keyDescriptor.setAttributeNS(null, "use", "signing");
      descriptor.appendChild(keyDescriptor);
      Element keyInfo = makeDsElement(document, SamlConstants.KEY_INFO);
      keyDescriptor.appendChild(keyInfo);
      Element x509Data = makeDsElement(document, SamlConstants.X509_DATA);
      keyInfo.appendChild(x509Data);
      Element certificate = makeDsElement(document, SamlConstants.X509_CERTIFICATE);
      try {
        certificate.setTextContent(KeyUtil.encodeCertificate(sp.getCertificate()));
      } catch (GeneralSecurityException e) {
        throw new ConfigException(SamlSettingsReader.SP_X509_CERT,
            "Unable to encode the SP certificate", e);
      }
      x509Data.appendChild(certificate);
    }

    Element logout = makeMdElement(document, SamlConstants.SINGLE_LOGOUT_SERVICE);
    logout.setAttributeNS(null, "Binding", SamlConstants.SAML2_REDIRECT_BINDING_URI);
    logout.setAttributeNS(null, "Location", sp.getSingleLogoutServiceUrl());
    descriptor.appendChild(logout);

    Element nameIdFormat = makeMdElement(document, SamlConstants.NAME_ID_FORMAT);
    nameIdFormat.setTextContent(sp.getNameIdFormat());
    descriptor.appendChild(nameIdFormat);

    Element acs = makeMdElement(document, SamlConstants.ASSERTION_CONSUMER_SERVICE);
    acs.setAttributeNS(null, "Binding", SamlConstants.SAML2_POST_BINDING_URI);
    acs.setAttributeNS(null, "Location", sp.getAssertionConsumerServiceUrl());
    acs.setAttributeNS(null, "index", "1");
    descriptor.appendChild(acs);

    if (sp.hasSigningCredential()) {
      entity.setAttributeNS(null, SamlConstants.ID_ATTRIBUTE, SamlUtil.generateIdentifier());
      XmlSigner signer = XmlSigner.make(sp.getPrivateKey(), sp.getCertificate(),
          policy.getSignatureAlgorithm(), policy.getDigestAlgorithm());
      try {
        signer.sign(entity, descriptor);
      } catch (GeneralSecurityException e) {
        throw new ConfigException(SamlSettingsReader.SP_PRIVATE_KEY,
            "Unable to sign SAML metadata: " + e.getMessage(), e);
      }
      logger.fine("Signed SAML metadata for " + sp.getEntityId());
    }
    return document;
  }

  /**
   * Checks a service-provider metadata document for the errors that would
   * make an identity provider reject it.
   *
   * @param document The metadata document.
   * @return A description of each error found; empty if there are none.
   */
  @Nonnull
  public static ImmutableList<String> validate(Document document) {
    ImmutableList.Builder<String> errors = ImmutableList.builder();
    Element entity = document.getDocumentElement();
    if (entity == null
        || !XmlUtil.isElement(entity, SAML20MD_NS, SamlConstants.ENTITY_DESCRIPTOR)) {
      return errors.add("Document element isn't an EntityDescriptor").build();
    }
    if (Strings.isNullOrEmpty(XmlUtil.getAttribute(entity, "entityID"))) {
      errors.add("EntityDescriptor has no entityID");
    }
    if (!XmlUtil.getChildElements(entity, SAML20MD_NS, SamlConstants.IDP_SSO_DESCRIPTOR)
        .isEmpty()) {
      errors.add("Service-provider metadata has an IDPSSODescriptor");
    }
    List<Element> descriptors =
        XmlUtil.getChildElements(entity, SAML20MD_NS, SamlConstants.SP_SSO_DESCRIPTOR);
    if (descriptors.isEmpty()) {
      errors.add("EntityDescriptor has no SPSSODescriptor");
      return errors.build();
    }
    for (Element descriptor : descriptors) {
      List<Element> services = XmlUtil.getChildElements(descriptor, SAML20MD_NS,
          SamlConstants.ASSERTION_CONSUMER_SERVICE);
      if (services.isEmpty()) {
        errors.add("SPSSODescriptor has no AssertionConsumerService");
      }
      for (Element service : services) {
        if (Strings.isNullOrEmpty(XmlUtil.getAttribute(service, "Location"))) {
          errors.add("AssertionConsumerService has no Location");
        }
        if (Strings.isNullOrEmpty(XmlUtil.getAttribute(service, "Binding"))) {
          errors.add("AssertionConsumerService has no Binding");
        }
      }
    }
    return errors.build();
  }

  private static Element makeMdElement(Document document, String localName) {
    return SamlUtil.makeElement(document, SAML20MD_NS, SAML20MD_PREFIX, localName);
  }

  private static Element makeDsElement(Document document, String localName) {
    return SamlUtil.makeElement(document, SamlConstants.XMLSIG_NS, SamlConstants.XMLSIG_PREFIX,
        localName);
  }
}
