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

import static com.google.enterprise.samlsp.testing.SamlTestUtil.ACS_URL;
import static com.google.enterprise.samlsp.testing.SamlTestUtil.PROXY_BASE_URL;
import static com.google.enterprise.samlsp.testing.SamlTestUtil.SP_ENTITY_ID;

import com.google.common.collect.ImmutableList;
import com.google.enterprise.samlsp.common.KeyUtil;
import com.google.enterprise.samlsp.common.XmlUtil;
import com.google.enterprise.samlsp.config.SamlSettings;
import com.google.enterprise.samlsp.testing.SamlSpTestCase;
import com.google.enterprise.samlsp.testing.SamlTestUtil;
import java.util.List;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Unit tests for {@link SpMetadataBuilder}.
 */
public class SpMetadataBuilderTest extends SamlSpTestCase {
  private static final String MD = SamlConstants.SAML20MD_NS;

  public void testUnsignedMetadata() throws Exception {
    String xml = SpMetadataBuilder.make(SamlTestUtil.makeSettings()).build();
    assertTrue(xml, xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));

    Document document = XmlUtil.getInstance().readXmlDocument(xml);
    assertTrue(SpMetadataBuilder.validate(document).isEmpty());
    Element entity = document.getDocumentElement();
    assertTrue(XmlUtil.isElement(entity, MD, SamlConstants.ENTITY_DESCRIPTOR));
    assertEquals(SP_ENTITY_ID, XmlUtil.getAttribute(entity, "entityID"));
    assertNull(XmlUtil.getAttribute(entity, SamlConstants.ID_ATTRIBUTE));
    assertNull(SignatureVerifier.getSignature(entity));

    Element descriptor = XmlUtil.findChildElement(entity, MD, SamlConstants.SP_SSO_DESCRIPTOR);
    assertEquals("false", XmlUtil.getAttribute(descriptor, "AuthnRequestsSigned"));
    assertEquals("true", XmlUtil.getAttribute(descriptor, "WantAssertionsSigned"));
    assertEquals(SamlConstants.SAML20P_NS,
        XmlUtil.getAttribute(descriptor, "protocolSupportEnumeration"));
    assertNull(XmlUtil.findChildElement(descriptor, MD, SamlConstants.KEY_DESCRIPTOR));

    Element logout = XmlUtil.findChildElement(descriptor, MD,
        SamlConstants.SINGLE_LOGOUT_SERVICE);
    assertEquals(SamlConstants.SAML2_REDIRECT_BINDING_URI,
        XmlUtil.getAttribute(logout, "Binding"));
    assertEquals(PROXY_BASE_URL + "/sso/saml/sls", XmlUtil.getAttribute(logout, "Location"));

    assertEquals(SamlConstants.NAMEID_FORMAT_EMAIL, XmlUtil.getTrimmedText(
        XmlUtil.findChildElement(descriptor, MD, SamlConstants.NAME_ID_FORMAT)));

    List<Element> services = XmlUtil.getChildElements(descriptor, MD,
        SamlConstants.ASSERTION_CONSUMER_SERVICE);
    assertEquals(1, services.size());
    assertEquals(SamlConstants.SAML2_POST_BINDING_URI,
        XmlUtil.getAttribute(services.get(0), "Binding"));
    assertEquals(ACS_URL, XmlUtil.getAttribute(services.get(0), "Location"));
    assertEquals("1", XmlUtil.getAttribute(services.get(0), "index"));
  }

  public void testSignedMetadata() throws Exception {
    SamlSettings settings = SamlTestUtil.makeSettings(SamlTestUtil.makeSigningEnvironment());
    String xml = SpMetadataBuilder.make(settings).build();

    Document document = XmlUtil.getInstance().readXmlDocument(xml);
    assertTrue(SpMetadataBuilder.validate(document).isEmpty());
    Element entity = document.getDocumentElement();
    Element descriptor = XmlUtil.findChildElement(entity, MD, SamlConstants.SP_SSO_DESCRIPTOR);
    assertEquals("true", XmlUtil.getAttribute(descriptor, "AuthnRequestsSigned"));

    Element keyDescriptor = XmlUtil.findChildElement(descriptor, MD,
        SamlConstants.KEY_DESCRIPTOR);
    assertEquals("signing", XmlUtil.getAttribute(keyDescriptor, "use"));
    Element certificate = (Element) keyDescriptor.getElementsByTagNameNS(
        SamlConstants.XMLSIG_NS, SamlConstants.X509_CERTIFICATE).item(0);
    assertEquals(KeyUtil.encodeCertificate(settings.getSp().getCertificate()),
        XmlUtil.getTrimmedText(certificate));

    // The signature precedes the descriptor and verifies with the SP's own key.
    Element signature = SignatureVerifier.getSignature(entity);
    assertNotNull(signature);
    assertSame(descriptor, XmlUtil.getChildElements(entity).get(1));
    assertSame(signature, XmlUtil.getChildElements(entity).get(0));
    SignatureVerifier.getInstance().checkSignature(entity, settings.getSp().getCertificate());
    assertFalse(SignatureVerifier.getInstance().verify(entity,
        SamlTestUtil.getIdpCertificate()));
  }

  public void testEachBuildHasFreshId() throws Exception {
    SpMetadataBuilder builder =
        SpMetadataBuilder.make(SamlTestUtil.makeSettings(SamlTestUtil.makeSigningEnvironment()));
    String first = XmlUtil.getAttribute(builder.buildDocument().getDocumentElement(), "ID");
    String second = XmlUtil.getAttribute(builder.buildDocument().getDocumentElement(), "ID");
    assertNotNull(first);
    assertFalse(first.equals(second));
  }

  public void testValidateWrongDocumentElement() throws Exception {
    assertEquals(ImmutableList.of("Document element isn't an EntityDescriptor"),
        SpMetadataBuilder.validate(parse("<md:EntitiesDescriptor xmlns:md=\"" + MD + "\"/>")));
  }

  public void testValidateReportsEveryError() throws Exception {
    Document document = parse("<md:EntityDescriptor xmlns:md=\"" + MD + "\">"
        + "<md:IDPSSODescriptor/>"
        + "<md:SPSSODescriptor>"
        + "<md:AssertionConsumerService index=\"1\"/>"
        + "</md:SPSSODescriptor>"
        + "<md:SPSSODescriptor/>"
        + "</md:EntityDescriptor>");
    assertEquals(
        ImmutableList.of(
            "EntityDescriptor has no entityID",
            "Service-provider metadata has an IDPSSODescriptor",
            "AssertionConsumerService has no Location",
            "AssertionConsumerService has no Binding",
            "SPSSODescriptor has no AssertionConsumerService"),
        SpMetadataBuilder.validate(document));
  }

  public void testValidateNoDescriptor() throws Exception {
    Document document = parse("<md:EntityDescriptor xmlns:md=\"" + MD + "\""
        + " entityID=\"" + SP_ENTITY_ID + "\"/>");
    assertEquals(ImmutableList.of("EntityDescriptor has no SPSSODescriptor"),
        SpMetadataBuilder.validate(document));
  }

  private static Document parse(String xml) throws Exception {
    return XmlUtil.getInstance().readXmlDocument(xml);
  }
}
