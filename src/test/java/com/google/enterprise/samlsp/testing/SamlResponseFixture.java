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

package com.google.enterprise.samlsp.testing;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.escape.Escaper;
import com.google.common.io.BaseEncoding;
import com.google.common.xml.XmlEscapers;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.saml.SamlConstants;
import com.google.enterprise.samlsp.saml.SamlUtil;
import java.io.IOException;
import java.nio.charset.Charset;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.Map;
import javax.annotation.Nullable;
import org.apache.xml.security.exceptions.XMLSecurityException;
import org.joda.time.DateTime;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds SAML responses for tests.  The defaults make a response that our
 * test settings accept at {@link SamlSpTestCase#NOW}: issued by the test IdP,
 * addressed to the test SP, answering {@link SamlTestUtil#REQUEST_ID}, with a
 * signed assertion.  Each setter breaks one aspect of that.
 */
public final class SamlResponseFixture {
  public static final String RESPONSE_ID = "_response00000000000000000000000000000001";
  public static final String ASSERTION_ID = "_assertion000000000000000000000000000001";
  public static final String NAME_ID = "alice@example.com";

  private static final Escaper TEXT = XmlEscapers.xmlContentEscaper();
  private static final Escaper ATTR = XmlEscapers.xmlAttributeEscaper();

  private String responseVersion = SamlConstants.SAML_VERSION;
  private String statusCode = SamlConstants.STATUS_SUCCESS;
  @Nullable private String statusMessage;
  @Nullable private String inResponseTo = SamlTestUtil.REQUEST_ID;
  @Nullable private String destination = SamlTestUtil.ACS_URL;
  @Nullable private String responseIssuer = SamlTestUtil.IDP_ENTITY_ID;
  @Nullable private String assertionIssuer = SamlTestUtil.IDP_ENTITY_ID;
  @Nullable private String nameId = NAME_ID;
  @Nullable private String recipient = SamlTestUtil.ACS_URL;
  @Nullable private String subjectInResponseTo = SamlTestUtil.REQUEST_ID;
  @Nullable private DateTime subjectNotOnOrAfter;
  @Nullable private DateTime notBefore;
  @Nullable private DateTime notOnOrAfter;
  @Nullable private String audience = SamlTestUtil.SP_ENTITY_ID;
  private boolean authnStatement = true;
  @Nullable private DateTime sessionNotOnOrAfter;
  private final ListMultimap<String, String> attributes = LinkedListMultimap.create();
  private boolean attributeStatement = true;
  private int assertionCount = 1;
  private boolean encryptedAssertion = false;
  private boolean signAssertion = true;
  private boolean signResponse = false;
  private PrivateKey signingKey;
  private X509Certificate signingCertificate;

  private SamlResponseFixture() {
    DateTime now = new DateTime();
    subjectNotOnOrAfter = now.plusMinutes(5);
    notBefore = now.minusMinutes(1);
    notOnOrAfter = now.plusMinutes(5);
    attributes.put("email", NAME_ID);
    attributes.put("firstName", "Alice");
    attributes.put("lastName", "Smith");
    signingKey = SamlTestUtil.getIdpKey();
    signingCertificate = SamlTestUtil.getIdpCertificate();
  }

  /**
   * Makes a fixture with the defaults.  Time-based defaults are relative to
   * the current (frozen) clock.
   */
  public static SamlResponseFixture make() {
    return new SamlResponseFixture();
  }

  public SamlResponseFixture setResponseVersion(String responseVersion) {
    this.responseVersion = responseVersion;
    return this;
  }

  public SamlResponseFixture setStatus(String statusCode, @Nullable String statusMessage) {
    this.statusCode = statusCode;
    this.statusMessage = statusMessage;
    return this;
  }

  public SamlResponseFixture setInResponseTo(@Nullable String inResponseTo) {
    this.inResponseTo = inResponseTo;
    this.subjectInResponseTo = inResponseTo;
    return this;
  }

  public SamlResponseFixture setDestination(@Nullable String destination) {
    this.destination = destination;
    return this;
  }

  public SamlResponseFixture setResponseIssuer(@Nullable String responseIssuer) {
    this.responseIssuer = responseIssuer;
    return this;
  }

  public SamlResponseFixture setAssertionIssuer(@Nullable String assertionIssuer) {
    this.assertionIssuer = assertionIssuer;
    return this;
  }

  public SamlResponseFixture setNameId(@Nullable String nameId) {
    this.nameId = nameId;
    return this;
  }

  public SamlResponseFixture setRecipient(@Nullable String recipient) {
    this.recipient = recipient;
    return this;
  }

  public SamlResponseFixture setSubjectNotOnOrAfter(@Nullable DateTime subjectNotOnOrAfter) {
    this.subjectNotOnOrAfter = subjectNotOnOrAfter;
    return this;
  }

  public SamlResponseFixture setConditions(@Nullable DateTime notBefore,
      @Nullable DateTime notOnOrAfter) {
    this.notBefore = notBefore;
    this.notOnOrAfter = notOnOrAfter;
    return this;
  }

  public SamlResponseFixture setAudience(@Nullable String audience) {
    this.audience = audience;
    return this;
  }

  public SamlResponseFixture setAuthnStatement(boolean authnStatement) {
    this.authnStatement = authnStatement;
    return this;
  }

  public SamlResponseFixture setSessionNotOnOrAfter(@Nullable DateTime sessionNotOnOrAfter) {
    this.sessionNotOnOrAfter = sessionNotOnOrAfter;
    return this;
  }

  public SamlResponseFixture clearAttributes() {
    attributes.clear();
    return this;
  }

  public SamlResponseFixture addAttribute(String name, String... values) {
    for (String value : values) {
      attributes.put(name, value);
    }
    return this;
  }

  public SamlResponseFixture setAttributeStatement(boolean attributeStatement) {
    this.attributeStatement = attributeStatement;
    return this;
  }

  public SamlResponseFixture setAssertionCount(int assertionCount) {
    this.assertionCount = assertionCount;
    return this;
  }

  public SamlResponseFixture setEncryptedAssertion(boolean encryptedAssertion) {
    this.encryptedAssertion = encryptedAssertion;
    return this;
  }

  public SamlResponseFixture setSigned(boolean signAssertion, boolean signResponse) {
    this.signAssertion = signAssertion;
    this.signResponse = signResponse;
    return this;
  }

  public SamlResponseFixture setSigningCredential(PrivateKey key, X509Certificate certificate) {
    this.signingKey = key;
    this.signingCertificate = certificate;
    return this;
  }

  /**
   * Gets the unsigned response XML.
   */
  public String toXml() {
    StringBuilder builder = new StringBuilder();
    builder.append("<samlp:Response xmlns:samlp=\"").append(SamlConstants.SAML20P_NS)
        .append("\" xmlns:saml=\"").append(SamlConstants.SAML20_NS).append("\"");
    attribute(builder, "ID", RESPONSE_ID);
    attribute(builder, "Version", responseVersion);
    attribute(builder, "IssueInstant", SamlUtil.formatInstant(new DateTime()));
    attribute(builder, "Destination", destination);
    attribute(builder, "InResponseTo", inResponseTo);
    builder.append(">");
    element(builder, "saml:Issuer", responseIssuer);
    builder.append("<samlp:Status><samlp:StatusCode");
    attribute(builder, "Value", statusCode);
    builder.append("/>");
    element(builder, "samlp:StatusMessage", statusMessage);
    builder.append("</samlp:Status>");
    for (int i = 0; i < assertionCount; i++) {
      appendAssertion(builder, (i == 0) ? ASSERTION_ID : ASSERTION_ID + i);
    }
    if (encryptedAssertion) {
      builder.append("<saml:EncryptedAssertion/>");
    }
    builder.append("</samlp:Response>");
    return builder.toString();
  }

  private void appendAssertion(StringBuilder builder, String id) {
    builder.append("<saml:Assertion");
    attribute(builder, "ID", id);
    attribute(builder, "Version", SamlConstants.SAML_VERSION);
    attribute(builder, "IssueInstant", SamlUtil.formatInstant(new DateTime()));
    builder.append(">");
    element(builder, "saml:Issuer", assertionIssuer);
    builder.append("<saml:Subject>");
    if (nameId != null) {
      builder.append("<saml:NameID");
      attribute(builder, "Format", SamlConstants.NAMEID_FORMAT_EMAIL);
      builder.append(">").append(TEXT.escape(nameId)).append("</saml:NameID>");
    }
    builder.append("<saml:SubjectConfirmation");
    attribute(builder, "Method", SamlConstants.BEARER_METHOD);
    builder.append("><saml:SubjectConfirmationData");
    attribute(builder, "InResponseTo", subjectInResponseTo);
    attribute(builder, "NotOnOrAfter", format(subjectNotOnOrAfter));
    attribute(builder, "Recipient", recipient);
    builder.append("/></saml:SubjectConfirmation></saml:Subject>");
    builder.append("<saml:Conditions");
    attribute(builder, "NotBefore", format(notBefore));
    attribute(builder, "NotOnOrAfter", format(notOnOrAfter));
    builder.append(">");
    if (audience != null) {
      builder.append("<saml:AudienceRestriction>");
      element(builder, "saml:Audience", audience);
      builder.append("</saml:AudienceRestriction>");
    }
    builder.append("</saml:Conditions>");
    if (authnStatement) {
      builder.append("<saml:AuthnStatement");
      attribute(builder, "AuthnInstant", SamlUtil.formatInstant(new DateTime()));
      attribute(builder, "SessionIndex", "_session1");
      attribute(builder, "SessionNotOnOrAfter", format(sessionNotOnOrAfter));
      builder.append("><saml:AuthnContext>");
      element(builder, "saml:AuthnContextClassRef",
          SamlConstants.AUTHN_CONTEXT_PASSWORD_PROTECTED_TRANSPORT);
      builder.append("</saml:AuthnContext></saml:AuthnStatement>");
    }
    if (attributeStatement && !attributes.isEmpty()) {
      builder.append("<saml:AttributeStatement>");
      for (Map.Entry<String, Collection<String>> entry : attributes.asMap().entrySet()) {
        builder.append("<saml:Attribute");
        attribute(builder, "Name", entry.getKey());
        builder.append(">");
        for (String value : entry.getValue()) {
          element(builder, "saml:AttributeValue", value);
        }
        builder.append("</saml:Attribute>");
      }
      builder.append("</saml:AttributeStatement>");
    }
    builder.append("</saml:Assertion>");
  }

  /**
   * Builds the response as a DOM document, signed as configured.
   */
  public Document toDocument()
      throws IOException, XMLSecurityException {
    Document document = XmlUtil.getInstance().readXmlDocument(toXml());
    Element response = document.getDocumentElement();
    if (signAssertion) {
      Element assertion = XmlUtil.findChildElement(response, SamlConstants.SAML20_NS,
          SamlConstants.ASSERTION);
      SamlTestUtil.sign(assertion, signingKey, signingCertificate);
    }
    if (signResponse) {
      SamlTestUtil.sign(response, signingKey, signingCertificate);
    }
    return document;
  }

  /**
   * Builds the response, signed as configured, and encodes it as a
   * {@code SAMLResponse} parameter value.
   */
  public String encode()
      throws IOException, XMLSecurityException {
    return SamlTestUtil.base64(XmlUtil.writeXmlString(toDocument()));
  }

  /**
   * Like {@link #encode()}, but serializes the response in a given character
   * encoding, with an XML declaration naming it.
   */
  public String encode(Charset charset)
      throws IOException, XMLSecurityException {
    String xml = "<?xml version=\"1.0\" encoding=\"" + charset.name() + "\"?>\n"
        + XmlUtil.writeXmlString(toDocument());
    return BaseEncoding.base64().encode(xml.getBytes(charset));
  }

  @Nullable
  private static String format(@Nullable DateTime instant) {
    return (instant == null) ? null : SamlUtil.formatInstant(instant);
  }

  private static void attribute(StringBuilder builder, String name, @Nullable String value) {
    if (value != null) {
      builder.append(' ').append(name).append("=\"").append(ATTR.escape(value)).append('"');
    }
  }

  private static void element(StringBuilder builder, String name, @Nullable String text) {
    if (text != null) {
      builder.append('<').append(name).append('>').append(TEXT.escape(text))
          .append("</").append(name).append('>');
    }
  }
}
