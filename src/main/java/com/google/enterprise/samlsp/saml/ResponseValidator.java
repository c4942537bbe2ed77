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

import static com.google.enterprise.samlsp.saml.SamlConstants.SAML20P_NS;
import static com.google.enterprise.samlsp.saml.SamlConstants.SAML20_NS;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.samlsp.common.Decorator;
import com.google.enterprise.samlsp.common.LogDecorators;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.config.SecurityPolicy;
import com.google.enterprise.samlsp.saml.SamlValidationException.Reason;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.joda.time.DateTime;
import org.joda.time.Duration;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Validates SAML 2.0 responses received on the HTTP-POST binding.
 *
 * <p>Checks run in a fixed order and the first failure is reported:
 * <ol>
 * <li>structure and status,
 * <li>signatures,
 * <li>validity windows,
 * <li>audience,
 * <li>issuer and destination,
 * <li>the request the response answers,
 * <li>authentication statement, subject and attributes.
 * </ol>
 * An {@link Assertion} is returned only if every check passes.
 *
 * <p>Instances keep no mutable state; each call parses its own document.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class ResponseValidator {
  private static final Logger logger = Logger.getLogger(ResponseValidator.class.getName());

  @Nonnull private final SamlSettings settings;
  @Nonnull private final SignatureVerifier verifier;

  private ResponseValidator(SamlSettings settings, SignatureVerifier verifier) {
    this.settings = settings;
    this.verifier = verifier;
  }

  @Nonnull
  public static ResponseValidator make(SamlSettings settings) {
    Preconditions.checkNotNull(settings);
    return new ResponseValidator(settings, SignatureVerifier.getInstance());
  }

  /**
   * Validates a response.
   *
   * @param samlResponse The base64-encoded {@code SAMLResponse} parameter.
   * @param expectedRequestId The ID of the AuthnRequest this response should
   *     answer, or {@code null} to accept an unsolicited response.
   * @return The validated assertion.
   * @throws SamlValidationException if any check fails.
   */
  @Nonnull
  public Assertion validate(String samlResponse, @Nullable String expectedRequestId)
      throws SamlValidationException {
    Decorator decorator = LogDecorators.getLogDecorator(settings.getIdp().getEntityId(),
        expectedRequestId, null);
    try {
      Assertion assertion = validateInternal(samlResponse, expectedRequestId);
      decorator = LogDecorators.getLogDecorator(settings.getIdp().getEntityId(),
          expectedRequestId, assertion.getNameId());
      logger.log(settings.isDebug() ? Level.INFO : Level.FINE,
          decorator.apply("Accepted assertion " + assertion.getId()
              + " with attributes " + assertion.getAttributes().keySet()));
      return assertion;
    } catch (SamlValidationException e) {
      logger.warning(decorator.apply("Rejected SAML response: " + e.getMessage()));
      throw e;
    }
  }

  private Assertion validateInternal(String samlResponse, @Nullable String expectedRequestId)
      throws SamlValidationException {
    SecurityPolicy policy = settings.getPolicy();

    // 1. Structure and status.
    Element response = parseResponse(samlResponse);
    checkStatus(response);
    if (!XmlUtil.getChildElements(response, SAML20_NS, SamlConstants.ENCRYPTED_ASSERTION)
        .isEmpty()) {
      throw new SamlValidationException(Reason.MALFORMED,
          "Encrypted assertions are not supported");
    }
    List<Element> assertions =
        XmlUtil.getChildElements(response, SAML20_NS, SamlConstants.ASSERTION);
    if (assertions.size() != 1) {
      throw new SamlValidationException(Reason.MALFORMED,
          "Expected exactly one Assertion, found " + assertions.size());
    }
    Element assertion = assertions.get(0);
    if (!SamlConstants.SAML_VERSION.equals(XmlUtil.getAttribute(assertion, "Version"))) {
      throw new SamlValidationException(Reason.MALFORMED, "Assertion version isn't 2.0");
    }
    String assertionId = XmlUtil.getAttribute(assertion, SamlConstants.ID_ATTRIBUTE);
    if (Strings.isNullOrEmpty(assertionId)) {
      throw new SamlValidationException(Reason.MALFORMED, "Assertion has no ID");
    }

    // 2. Signatures.
    boolean assertionSigned = checkSignature(assertion);
    boolean responseSigned = checkSignature(response);
    if (policy.wantAssertionsSigned() && !assertionSigned && !responseSigned) {
      throw new SamlValidationException(Reason.SIGNATURE_INVALID,
          "Neither the assertion nor the response is signed");
    }
    if (policy.wantMessagesSigned() && !responseSigned) {
      throw new SamlValidationException(Reason.SIGNATURE_INVALID, "Response isn't signed");
    }

    Element conditions = getOptionalChild(assertion, SamlConstants.CONDITIONS);
    Element subject = getOptionalChild(assertion, SamlConstants.SUBJECT);
    List<Element> bearerData = getBearerConfirmationData(subject);
    List<Element> authnStatements =
        XmlUtil.getChildElements(assertion, SAML20_NS, SamlConstants.AUTHN_STATEMENT);

    // 3. Validity windows.
    DateTime now = new DateTime();
    Duration skew = policy.getClockSkew();
    DateTime notBefore = null;
    DateTime notOnOrAfter = null;
    if (conditions != null) {
      notBefore = getInstant(conditions, "NotBefore");
      notOnOrAfter = getInstant(conditions, "NotOnOrAfter");
      if (notBefore != null && now.plus(skew).isBefore(notBefore)) {
        throw new SamlValidationException(Reason.EXPIRED,
            "Assertion not valid before " + notBefore);
      }
      checkNotOnOrAfter(now, skew, notOnOrAfter, "Assertion");
    }
    for (Element data : bearerData) {
      checkNotOnOrAfter(now, skew, getInstant(data, "NotOnOrAfter"), "Subject confirmation");
    }
    DateTime authnInstant = null;
    String sessionIndex = null;
    DateTime sessionNotOnOrAfter = null;
    if (!authnStatements.isEmpty()) {
      Element authnStatement = authnStatements.get(0);
      authnInstant = getInstant(authnStatement, "AuthnInstant");
      sessionIndex = XmlUtil.getAttribute(authnStatement, "SessionIndex");
      sessionNotOnOrAfter = getInstant(authnStatement, "SessionNotOnOrAfter");
      checkNotOnOrAfter(now, skew, sessionNotOnOrAfter, "Session");
    }

    // 4. Audience.
    ImmutableList<String> audiences = checkAudience(conditions);

    // 5. Issuer and destination.
    String idpEntityId = settings.getIdp().getEntityId();
    Element assertionIssuer = getOptionalChild(assertion, SamlConstants.ISSUER);
    if (assertionIssuer == null
        || !idpEntityId.equals(XmlUtil.getTrimmedText(assertionIssuer))) {
      throw new SamlValidationException(Reason.ISSUER_MISMATCH,
          "Assertion issuer isn't " + idpEntityId);
    }
    Element responseIssuer = getOptionalChild(response, SamlConstants.ISSUER);
    if (responseIssuer != null
        && !idpEntityId.equals(XmlUtil.getTrimmedText(responseIssuer))) {
      throw new SamlValidationException(Reason.ISSUER_MISMATCH,
          "Response issuer isn't " + idpEntityId);
    }
    String acsUrl = settings.getSp().getAssertionConsumerServiceUrl();
    String destination = XmlUtil.getAttribute(response, "Destination");
    if (destination != null && !acsUrl.equals(destination)) {
      throw new SamlValidationException(Reason.DESTINATION_MISMATCH,
          "Response destination " + destination + " isn't " + acsUrl);
    }
    for (Element data : bearerData) {
      String recipient = XmlUtil.getAttribute(data, "Recipient");
      if (recipient != null && !acsUrl.equals(recipient)) {
        throw new SamlValidationException(Reason.DESTINATION_MISMATCH,
            "Subject confirmation recipient " + recipient + " isn't " + acsUrl);
      }
    }

    // 6. The request this answers.
    String inResponseTo = XmlUtil.getAttribute(response, "InResponseTo");
    if (expectedRequestId != null) {
      if (!expectedRequestId.equals(inResponseTo)) {
        throw new SamlValidationException(Reason.MALFORMED,
            "Response InResponseTo " + inResponseTo + " isn't " + expectedRequestId);
      }
      for (Element data : bearerData) {
        String dataInResponseTo = XmlUtil.getAttribute(data, "InResponseTo");
        if (dataInResponseTo != null && !expectedRequestId.equals(dataInResponseTo)) {
          throw new SamlValidationException(Reason.MALFORMED,
              "Subject confirmation InResponseTo " + dataInResponseTo + " isn't "
              + expectedRequestId);
        }
      }
    }

    // 7. Statements and subject.
    if (authnStatements.isEmpty()) {
      throw new SamlValidationException(Reason.NO_AUTHN_STATEMENT,
          "Assertion has no AuthnStatement");
    }
    Element nameId = (subject == null) ? null : getOptionalChild(subject, SamlConstants.NAME_ID);
    if (nameId == null && subject != null
        && getOptionalChild(subject, SamlConstants.ENCRYPTED_ID) != null) {
      throw new SamlValidationException(Reason.MALFORMED, "Encrypted NameIDs are not supported");
    }
    if (policy.wantNameId() && (nameId == null || XmlUtil.getTrimmedText(nameId).isEmpty())) {
      throw new SamlValidationException(Reason.MALFORMED, "Assertion has no NameID");
    }
    List<Element> attributeStatements =
        XmlUtil.getChildElements(assertion, SAML20_NS, SamlConstants.ATTRIBUTE_STATEMENT);
    if (policy.wantAttributeStatement() && attributeStatements.isEmpty()) {
      throw new SamlValidationException(Reason.MISSING_ATTRIBUTES,
          "Assertion has no AttributeStatement");
    }

    Assertion.Builder builder = Assertion.builder(assertionId,
        XmlUtil.getTrimmedText(assertionIssuer))
        .setConditions(notBefore, notOnOrAfter)
        .setAuthnStatement(authnInstant, sessionIndex, sessionNotOnOrAfter)
        .setInResponseTo(inResponseTo)
        .setSigned(assertionSigned, responseSigned);
    if (nameId != null) {
      builder.setNameId(XmlUtil.getTrimmedText(nameId), XmlUtil.getAttribute(nameId, "Format"));
    }
    for (String audience : audiences) {
      builder.addAudience(audience);
    }
    for (Element attributeStatement : attributeStatements) {
      for (Element attribute : XmlUtil.getChildElements(attributeStatement, SAML20_NS,
               SamlConstants.ATTRIBUTE)) {
        String name = XmlUtil.getAttribute(attribute, "Name");
        if (Strings.isNullOrEmpty(name)) {
          throw new SamlValidationException(Reason.MALFORMED, "Attribute has no Name");
        }
        for (Element value : XmlUtil.getChildElements(attribute, SAML20_NS,
                 SamlConstants.ATTRIBUTE_VALUE)) {
          builder.addAttributeValue(name, XmlUtil.getTrimmedText(value));
        }
      }
    }
    return builder.build();
  }

  private static Element parseResponse(String samlResponse)
      throws SamlValidationException {
    if (samlResponse.trim().isEmpty()) {
      throw new SamlValidationException(Reason.MALFORMED, "Empty SAML response");
    }
    byte[] xml;
    try {
      xml = SamlUtil.decodeBase64(samlResponse);
    } catch (IllegalArgumentException e) {
      throw new SamlValidationException(Reason.MALFORMED, "SAML response isn't valid base64", e);
    }
    Document document;
    try {
      // The parser picks the character encoding from the XML declaration.
      document = XmlUtil.getInstance().readXmlDocument(new ByteArrayInputStream(xml));
    } catch (IOException e) {
      throw new SamlValidationException(Reason.MALFORMED, e.getMessage(), e);
    }
    Element response = document.getDocumentElement();
    if (!XmlUtil.isElement(response, SAML20P_NS, SamlConstants.RESPONSE)) {
      throw new SamlValidationException(Reason.MALFORMED,
          "Document element isn't a SAML 2.0 Response");
    }
    if (!SamlConstants.SAML_VERSION.equals(XmlUtil.getAttribute(response, "Version"))) {
      throw new SamlValidationException(Reason.MALFORMED, "Response version isn't 2.0");
    }
    return response;
  }

  private static void checkStatus(Element response)
      throws SamlValidationException {
    Element status = XmlUtil.findChildElement(response, SAML20P_NS, SamlConstants.STATUS);
    Element statusCode = (status == null)
        ? null
        : XmlUtil.findChildElement(status, SAML20P_NS, SamlConstants.STATUS_CODE);
    if (statusCode == null) {
      throw new SamlValidationException(Reason.MALFORMED, "Response has no StatusCode");
    }
    String value = XmlUtil.getAttribute(statusCode, "Value");
    if (SamlConstants.STATUS_SUCCESS.equals(value)) {
      return;
    }
    StringBuilder message = new StringBuilder("Status ").append(value);
    Element subCode = XmlUtil.findChildElement(statusCode, SAML20P_NS, SamlConstants.STATUS_CODE);
    if (subCode != null) {
      message.append(" / ").append(XmlUtil.getAttribute(subCode, "Value"));
    }
    Element statusMessage =
        XmlUtil.findChildElement(status, SAML20P_NS, SamlConstants.STATUS_MESSAGE);
    if (statusMessage != null) {
      message.append(": ").append(XmlUtil.getTrimmedText(statusMessage));
    }
    throw new SamlValidationException(Reason.STATUS_NOT_SUCCESS, message.toString());
  }

  // Returns true if the element is signed; throws if it's signed but the
  // signature doesn't verify.
  private boolean checkSignature(Element element)
      throws SamlValidationException {
    if (!SignatureVerifier.isSigned(element)) {
      return false;
    }
    if (!verifier.verify(element, settings.getIdp().getCertificate())) {
      throw new SamlValidationException(Reason.SIGNATURE_INVALID,
          element.getLocalName() + " signature doesn't verify");
    }
    return true;
  }

  private ImmutableList<String> checkAudience(@Nullable Element conditions)
      throws SamlValidationException {
    String entityId = settings.getSp().getEntityId();
    List<Element> restrictions = (conditions == null)
        ? ImmutableList.<Element>of()
        : XmlUtil.getChildElements(conditions, SAML20_NS, SamlConstants.AUDIENCE_RESTRICTION);
    if (restrictions.isEmpty()) {
      throw new SamlValidationException(Reason.AUDIENCE_MISMATCH,
          "Assertion has no audience restriction");
    }
    ImmutableList.Builder<String> audiences = ImmutableList.builder();
    // Every restriction must admit us.
    for (Element restriction : restrictions) {
      boolean found = false;
      for (Element audience : XmlUtil.getChildElements(restriction, SAML20_NS,
               SamlConstants.AUDIENCE)) {
        String value = XmlUtil.getTrimmedText(audience);
        audiences.add(value);
        if (entityId.equals(value)) {
          found = true;
        }
      }
      if (!found) {
        throw new SamlValidationException(Reason.AUDIENCE_MISMATCH,
            "Assertion isn't addressed to " + entityId);
      }
    }
    return audiences.build();
  }

  private static void checkNotOnOrAfter(DateTime now, Duration skew,
      @Nullable DateTime notOnOrAfter, String what)
      throws SamlValidationException {
    if (notOnOrAfter != null && !now.minus(skew).isBefore(notOnOrAfter)) {
      throw new SamlValidationException(Reason.EXPIRED,
          what + " expired at " + notOnOrAfter);
    }
  }

  private static List<Element> getBearerConfirmationData(@Nullable Element subject) {
    if (subject == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Element> builder = ImmutableList.builder();
    for (Element confirmation : XmlUtil.getChildElements(subject, SAML20_NS,
             SamlConstants.SUBJECT_CONFIRMATION)) {
      if (!SamlConstants.BEARER_METHOD.equals(XmlUtil.getAttribute(confirmation, "Method"))) {
        continue;
      }
      Element data = XmlUtil.findChildElement(confirmation, SAML20_NS,
          SamlConstants.SUBJECT_CONFIRMATION_DATA);
      if (data != null) {
        builder.add(data);
      }
    }
    return builder.build();
  }

  @Nullable
  private static Element getOptionalChild(Element parent, String localName)
      throws SamlValidationException {
    List<Element> children = XmlUtil.getChildElements(parent, SAML20_NS, localName);
    if (children.size() > 1) {
      throw new SamlValidationException(Reason.MALFORMED,
          parent.getLocalName() + " has more than one " + localName);
    }
    return children.isEmpty() ? null : children.get(0);
  }

  @Nullable
  private static DateTime getInstant(Element element, String attributeName)
      throws SamlValidationException {
    String value = XmlUtil.getAttribute(element, attributeName);
    try {
      return SamlUtil.parseInstant(value);
    } catch (IllegalArgumentException e) {
      throw new SamlValidationException(Reason.MALFORMED,
          element.getLocalName() + "/@" + attributeName + " isn't a valid instant", e);
    }
  }
}
