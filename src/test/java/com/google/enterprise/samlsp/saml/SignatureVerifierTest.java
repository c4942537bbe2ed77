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

import com.google.common.io.BaseEncoding;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.testing.SamlResponseFixture;
import com.google.enterprise.samlsp.testing.SamlSpTestCase;
import com.google.enterprise.samlsp.testing.SamlTestUtil;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import org.apache.xml.security.algorithms.MessageDigestAlgorithm;
import org.apache.xml.security.signature.XMLSignature;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Unit tests for {@link SignatureVerifier}.  Signatures are made by Apache
 * Santuario directly, as an IdP would make them, and by {@link XmlSigner}.
 */
public class SignatureVerifierTest extends SamlSpTestCase {

  private final SignatureVerifier verifier = SignatureVerifier.getInstance();
  private X509Certificate idpCertificate;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    idpCertificate = SamlTestUtil.getIdpCertificate();
  }

  public void testValidAssertionSignature() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    assertTrue(SignatureVerifier.isSigned(assertion));
    assertTrue(verifier.verify(assertion, idpCertificate));
  }

  public void testValidSignatureSurvivesSerialization() throws Exception {
    Document document = reparse(SamlResponseFixture.make().setSigned(true, true).toDocument());
    assertTrue(verifier.verify(document.getDocumentElement(), idpCertificate));
    assertTrue(verifier.verify(getAssertion(document), idpCertificate));
  }

  public void testSha1Signature() throws Exception {
    Document document = SamlResponseFixture.make().setSigned(false, false).toDocument();
    Element assertion = getAssertion(document);
    SamlTestUtil.sign(assertion, SamlTestUtil.getIdpKey(), idpCertificate,
        XMLSignature.ALGO_ID_SIGNATURE_RSA_SHA1, MessageDigestAlgorithm.ALGO_ID_DIGEST_SHA1);
    assertTrue(verifier.verify(assertion, idpCertificate));
  }

  public void testUnsigned() throws Exception {
    Element assertion =
        getAssertion(SamlResponseFixture.make().setSigned(false, false).toDocument());
    assertFalse(SignatureVerifier.isSigned(assertion));
    assertNull(SignatureVerifier.getSignature(assertion));
    assertFalse(verifier.verify(assertion, idpCertificate));
    expectRejection(assertion, "found 0");
  }

  public void testWrongCertificate() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    X509Certificate untrusted =
        SamlTestUtil.getCertificate(SamlTestUtil.UNTRUSTED_CERT_RESOURCE);
    assertFalse(verifier.verify(assertion, untrusted));
    expectRejection(assertion, untrusted, "doesn't verify");
  }

  public void testKeyInfoIgnored() throws Exception {
    X509Certificate untrusted =
        SamlTestUtil.getCertificate(SamlTestUtil.UNTRUSTED_CERT_RESOURCE);
    PrivateKey untrustedKey = SamlTestUtil.getPrivateKey(SamlTestUtil.UNTRUSTED_KEY_RESOURCE);
    Element assertion = getAssertion(SamlResponseFixture.make()
        .setSigningCredential(untrustedKey, untrusted)
        .toDocument());
    assertTrue(verifier.verify(assertion, untrusted));
    assertFalse(verifier.verify(assertion, idpCertificate));
  }

  public void testTamperedContent() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    Element nameId = (Element) assertion.getElementsByTagNameNS(SamlConstants.SAML20_NS,
        SamlConstants.NAME_ID).item(0);
    nameId.setTextContent("mallory@example.com");
    expectRejection(assertion, "Digest");
  }

  public void testTamperedAttributeValue() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    Element value = (Element) assertion.getElementsByTagNameNS(SamlConstants.SAML20_NS,
        SamlConstants.ATTRIBUTE_VALUE).item(0);
    value.setTextContent("mallory@example.com");
    assertFalse(verifier.verify(assertion, idpCertificate));
    expectRejection(assertion, "Digest");
  }

  public void testTamperedSignedInfo() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    Element digestValue = getDsElement(assertion, SamlConstants.DIGEST_VALUE);
    byte[] digest = SamlUtil.decodeBase64(digestValue.getTextContent());
    digest[0] ^= 1;
    digestValue.setTextContent(BaseEncoding.base64().encode(digest));
    expectRejection(assertion, "Digest");
  }

  public void testDuplicateId() throws Exception {
    Document document = SamlResponseFixture.make().toDocument();
    Element assertion = getAssertion(document);
    Element copy = (Element) assertion.cloneNode(true);
    document.getDocumentElement().appendChild(copy);
    expectRejection(assertion, "used by 2 elements");
    expectRejection(copy, "used by 2 elements");
  }

  public void testWrappedAssertion() throws Exception {
    // The signed original is hidden away and a forged copy takes its place.
    Document document = SamlResponseFixture.make().toDocument();
    Element response = document.getDocumentElement();
    Element original = getAssertion(document);
    Element forged = (Element) original.cloneNode(true);
    forged.getElementsByTagNameNS(SamlConstants.SAML20_NS, SamlConstants.NAME_ID).item(0)
        .setTextContent("mallory@example.com");
    response.replaceChild(forged, original);
    Element signature = SignatureVerifier.getSignature(forged);
    signature.appendChild(original);
    assertFalse(verifier.verify(forged, idpCertificate));
  }

  public void testReferenceToAnotherElement() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    getDsElement(assertion, SamlConstants.REFERENCE)
        .setAttributeNS(null, "URI", "#" + SamlResponseFixture.RESPONSE_ID);
    expectRejection(assertion, "doesn't name the signed element");
  }

  public void testEmptyReferenceUri() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    getDsElement(assertion, SamlConstants.REFERENCE).setAttributeNS(null, "URI", "");
    expectRejection(assertion, "doesn't name the signed element");
  }

  public void testTwoSignatures() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    Element signature = SignatureVerifier.getSignature(assertion);
    assertion.appendChild(signature.cloneNode(true));
    expectRejection(assertion, "found 2");
  }

  public void testMissingEnvelopedTransform() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    Element transform = getDsElement(assertion, SamlConstants.TRANSFORM);
    transform.getParentNode().removeChild(transform);
    expectRejection(assertion, "enveloped-signature");
  }

  public void testInclusiveCanonicalizationRejected() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    List<Element> transforms = XmlUtil.getChildElements(
        getDsElement(assertion, SamlConstants.TRANSFORMS));
    transforms.get(1).setAttributeNS(null, SamlConstants.ALGORITHM_ATTRIBUTE,
        "http://www.w3.org/TR/2001/REC-xml-c14n-20010315");
    expectRejection(assertion, "Transform not allowed");
  }

  public void testUnsupportedSignatureMethod() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    getDsElement(assertion, SamlConstants.SIGNATURE_METHOD).setAttributeNS(null,
        SamlConstants.ALGORITHM_ATTRIBUTE, "http://www.w3.org/2000/09/xmldsig#dsa-sha1");
    expectRejection(assertion, "Unsupported signature method");
  }

  public void testXmlSignerOutputVerifies() throws Exception {
    Document document = SamlResponseFixture.make().setSigned(false, false).toDocument();
    Element assertion = getAssertion(document);
    XmlSigner signer = XmlSigner.make(SamlTestUtil.getIdpKey(), idpCertificate,
        SignatureAlgorithm.RSA_SHA256, DigestAlgorithm.SHA256);
    Element issuer = XmlUtil.findChildElement(assertion, SamlConstants.SAML20_NS,
        SamlConstants.ISSUER);
    Element signature = signer.sign(assertion, issuer.getNextSibling());
    assertSame(signature, SignatureVerifier.getSignature(assertion));
    assertTrue(verifier.verify(assertion, idpCertificate));

    Document parsed = reparse(document);
    Element parsedAssertion = getAssertion(parsed);
    assertTrue(verifier.verify(parsedAssertion, idpCertificate));

    // Santuario agrees.
    parsedAssertion.setIdAttributeNS(null, SamlConstants.ID_ATTRIBUTE, true);
    XMLSignature santuario =
        new XMLSignature(SignatureVerifier.getSignature(parsedAssertion), "");
    assertTrue(santuario.checkSignatureValue(idpCertificate));
  }

  public void testXmlSignerRefusesSignedElement() throws Exception {
    Element assertion = getAssertion(SamlResponseFixture.make().toDocument());
    XmlSigner signer = XmlSigner.make(SamlTestUtil.getIdpKey(), idpCertificate,
        SignatureAlgorithm.RSA_SHA256, DigestAlgorithm.SHA256);
    try {
      signer.sign(assertion, null);
      fail("Signed an already signed element");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }

  private void expectRejection(Element element, String messageFragment) {
    expectRejection(element, idpCertificate, messageFragment);
  }

  private void expectRejection(Element element, X509Certificate certificate,
      String messageFragment) {
    try {
      verifier.checkSignature(element, certificate);
      fail("Signature accepted");
    } catch (GeneralSecurityException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(messageFragment));
    }
  }

  private static Element getAssertion(Document document) {
    return XmlUtil.findChildElement(document.getDocumentElement(), SamlConstants.SAML20_NS,
        SamlConstants.ASSERTION);
  }

  private static Element getDsElement(Element signed, String localName) {
    Node node = SignatureVerifier.getSignature(signed)
        .getElementsByTagNameNS(SamlConstants.XMLSIG_NS, localName).item(0);
    return (Element) node;
  }

  private static Document reparse(Document document) throws Exception {
    return XmlUtil.getInstance().readXmlDocument(XmlUtil.writeXmlString(document));
  }
}
