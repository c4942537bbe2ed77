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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.samlsp.common.XmlUtil;
import java.security.GeneralSecurityException;
import java.security.SignatureException;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import org.apache.xml.security.Init;
import org.apache.xml.security.exceptions.XMLSecurityException;
import org.apache.xml.security.signature.XMLSignature;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Verifies enveloped XML-DSig signatures on SAML elements against a single
 * trusted certificate.
 *
 * <p>Only the shape of signature that SAML 2.0 profiles allow is accepted: a
 * single {@code ds:Signature} child of the signed element, holding a single
 * {@code ds:Reference} whose URI names the signed element's {@code ID}, with
 * the enveloped-signature transform and exclusive canonicalization.  The
 * {@code ID} must identify exactly one element in the whole document, and that
 * element must be the one being verified.  Any {@code ds:KeyInfo} is ignored;
 * the configured certificate is the only trust anchor.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class SignatureVerifier {
  private static final Logger logger = Logger.getLogger(SignatureVerifier.class.getName());

  private static final SignatureVerifier INSTANCE = new SignatureVerifier();

  private static final ImmutableSet<String> EXCLUSIVE_C14N_ALGORITHMS =
      ImmutableSet.of(
          SamlConstants.C14N_EXCL_OMIT_COMMENTS,
          SamlConstants.C14N_EXCL_WITH_COMMENTS);

  static {
    Init.init();
  }

  private SignatureVerifier() {
  }

  @Nonnull
  public static SignatureVerifier getInstance() {
    return INSTANCE;
  }

  /**
   * Gets the signature of a signed element.
   *
   * @param signedElement The element that might be signed.
   * @return The first {@code ds:Signature} child, or {@code null} if the
   *     element has none.
   */
  @Nullable
  public static Element getSignature(Element signedElement) {
    return XmlUtil.findChildElement(signedElement, SamlConstants.XMLSIG_NS,
        SamlConstants.SIGNATURE);
  }

  /**
   * Is the given element signed?  A signed element isn't necessarily validly
   * signed.
   */
  public static boolean isSigned(Element element) {
    return getSignature(element) != null;
  }

  /**
   * Verifies the signature on an element.
   *
   * @param signedElement The element carrying an enveloped signature.
   * @param certificate The certificate whose key must have made the signature.
   * @return True only if the signature is well formed, its digest matches the
   *     element, and its value verifies with the certificate's public key.
   */
  public boolean verify(Element signedElement, X509Certificate certificate) {
    try {
      checkSignature(signedElement, certificate);
    } catch (GeneralSecurityException e) {
      logger.warning("Signature on " + signedElement.getLocalName() + " rejected: "
          + e.getMessage());
      return false;
    }
    logger.fine("Signature on " + signedElement.getLocalName() + " verified");
    return true;
  }

  /**
   * Like {@link #verify}, but reports why a signature was rejected.
   *
   * @throws GeneralSecurityException if the signature doesn't verify.
   */
  public void checkSignature(Element signedElement, X509Certificate certificate)
      throws GeneralSecurityException {
    List<Element> signatures = XmlUtil.getChildElements(signedElement, SamlConstants.XMLSIG_NS,
        SamlConstants.SIGNATURE);
    if (signatures.size() != 1) {
      throw new SignatureException("Expected exactly one Signature element, found "
          + signatures.size());
    }
    Element signature = signatures.get(0);

    List<Element> children = XmlUtil.getChildElements(signature);
    if (children.isEmpty()
        || !XmlUtil.isElement(children.get(0), SamlConstants.XMLSIG_NS,
            SamlConstants.SIGNED_INFO)) {
      throw new SignatureException("Signature doesn't start with SignedInfo");
    }
    Element signedInfo = children.get(0);

    Element c14nMethod = getOnlyChild(signedInfo, SamlConstants.CANONICALIZATION_METHOD);
    String c14nAlgorithm = getAlgorithm(c14nMethod);
    if (!isExclusiveC14n(c14nAlgorithm)) {
      throw new SignatureException("Unsupported canonicalization method: " + c14nAlgorithm);
    }
    String signatureMethod = getAlgorithm(getOnlyChild(signedInfo,
        SamlConstants.SIGNATURE_METHOD));
    if (SignatureAlgorithm.forUri(signatureMethod) == null) {
      throw new SignatureException("Unsupported signature method: " + signatureMethod);
    }

    Element reference = getOnlyChild(signedInfo, SamlConstants.REFERENCE);
    checkReferenceTarget(signedElement, reference);

    String referenceC14n = null;
    boolean enveloped = false;
    Element transforms = getOnlyChild(reference, SamlConstants.TRANSFORMS);
    for (Element transform : XmlUtil.getChildElements(transforms)) {
      if (!XmlUtil.isElement(transform, SamlConstants.XMLSIG_NS, SamlConstants.TRANSFORM)) {
        throw new SignatureException("Unexpected element in Transforms: "
            + transform.getLocalName());
      }
      String algorithm = getAlgorithm(transform);
      if (SamlConstants.TRANSFORM_ENVELOPED_SIGNATURE.equals(algorithm) && !enveloped) {
        enveloped = true;
      } else if (isExclusiveC14n(algorithm) && referenceC14n == null) {
        referenceC14n = algorithm;
      } else {
        throw new SignatureException("Transform not allowed: " + algorithm);
      }
    }
    if (!enveloped) {
      throw new SignatureException("Reference lacks the enveloped-signature transform");
    }
    if (referenceC14n == null) {
      throw new SignatureException("Reference lacks an exclusive canonicalization transform");
    }

    String digestMethod = getAlgorithm(getOnlyChild(reference, SamlConstants.DIGEST_METHOD));
    if (DigestAlgorithm.forUri(digestMethod) == null) {
      throw new SignatureException("Unsupported digest method: " + digestMethod);
    }

    // The shape is as expected, so let Santuario check the digest and the
    // signature value.  The reference resolves through the DOM's ID
    // attributes, and the ID is known to be unique.
    signedElement.setIdAttributeNS(null, SamlConstants.ID_ATTRIBUTE, true);
    try {
      XMLSignature xmlSignature = new XMLSignature(signature, "", true);
      if (!xmlSignature.getSignedInfo().item(0).verify()) {
        throw new SignatureException("Digest of " + signedElement.getLocalName()
            + " doesn't match its reference");
      }
      if (!xmlSignature.checkSignatureValue(certificate)) {
        throw new SignatureException(
            "Signature value doesn't verify with the trusted certificate");
      }
    } catch (XMLSecurityException e) {
      throw new SignatureException("Unable to process signature on "
          + signedElement.getLocalName() + ": " + e.getMessage(), e);
    }
  }

  // The reference must name the signed element, whose ID is unique in the
  // document.
  private static void checkReferenceTarget(Element signedElement, Element reference)
      throws SignatureException {
    String id = XmlUtil.getAttribute(signedElement, SamlConstants.ID_ATTRIBUTE);
    if (id == null || id.isEmpty()) {
      throw new SignatureException("Signed element has no ID");
    }
    String uri = XmlUtil.getAttribute(reference, "URI");
    if (!("#" + id).equals(uri)) {
      throw new SignatureException("Reference URI " + uri + " doesn't name the signed element");
    }
    List<Element> matches = findElementsWithId(signedElement.getOwnerDocument(), id);
    if (matches.size() != 1) {
      throw new SignatureException("ID " + id + " is used by " + matches.size() + " elements");
    }
    if (matches.get(0) != signedElement) {
      throw new SignatureException("ID " + id + " resolves to a different element");
    }
  }

  private static boolean isExclusiveC14n(String algorithm) {
    return EXCLUSIVE_C14N_ALGORITHMS.contains(algorithm);
  }

  private static ImmutableList<Element> findElementsWithId(Document document, String id) {
    ImmutableList.Builder<Element> builder = ImmutableList.builder();
    NodeList elements = document.getElementsByTagNameNS("*", "*");
    for (int i = 0; i < elements.getLength(); i++) {
      Element element = (Element) elements.item(i);
      if (id.equals(XmlUtil.getAttribute(element, SamlConstants.ID_ATTRIBUTE))) {
        builder.add(element);
      }
    }
    return builder.build();
  }

  private static Element getOnlyChild(Element parent, String localName)
      throws SignatureException {
    List<Element> children = XmlUtil.getChildElements(parent, SamlConstants.XMLSIG_NS,
        localName);
    if (children.size() != 1) {
      throw new SignatureException("Expected exactly one " + localName + " in "
          + parent.getLocalName() + ", found " + children.size());
    }
    return children.get(0);
  }

  private static String getAlgorithm(Element element)
      throws SignatureException {
    String algorithm = XmlUtil.getAttribute(element, SamlConstants.ALGORITHM_ATTRIBUTE);
    if (algorithm == null) {
      throw new SignatureException(element.getLocalName() + " has no Algorithm");
    }
    return algorithm;
  }
}
