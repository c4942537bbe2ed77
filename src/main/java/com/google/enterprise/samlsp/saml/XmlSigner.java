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

import com.google.common.base.Preconditions;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SignatureException;
import java.security.cert.X509Certificate;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.apache.xml.security.Init;
import org.apache.xml.security.exceptions.XMLSecurityException;
import org.apache.xml.security.signature.XMLSignature;
import org.apache.xml.security.transforms.Transforms;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Makes enveloped XML-DSig signatures of the shape that
 * {@link SignatureVerifier} accepts, using Apache Santuario.
 */
@ParametersAreNonnullByDefault
public final class XmlSigner {
  static {
    Init.init();
  }

  private final PrivateKey key;
  private final X509Certificate certificate;
  private final SignatureAlgorithm signatureAlgorithm;
  private final DigestAlgorithm digestAlgorithm;

  private XmlSigner(PrivateKey key, X509Certificate certificate,
      SignatureAlgorithm signatureAlgorithm, DigestAlgorithm digestAlgorithm) {
    this.key = key;
    this.certificate = certificate;
    this.signatureAlgorithm = signatureAlgorithm;
    this.digestAlgorithm = digestAlgorithm;
  }

  public static XmlSigner make(PrivateKey key, X509Certificate certificate,
      SignatureAlgorithm signatureAlgorithm, DigestAlgorithm digestAlgorithm) {
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(certificate);
    Preconditions.checkNotNull(signatureAlgorithm);
    Preconditions.checkNotNull(digestAlgorithm);
    return new XmlSigner(key, certificate, signatureAlgorithm, digestAlgorithm);
  }

  /**
   * Signs an element, inserting the signature as a child.
   *
   * @param element The element to sign.  It must have an {@code ID} attribute
   *     and must not already be signed.
   * @param insertBefore The child before which to insert the signature, or
   *     {@code null} to append it.
   * @return The inserted {@code ds:Signature} element.
   * @throws GeneralSecurityException if signing fails.
   */
  public Element sign(Element element, @Nullable Node insertBefore)
      throws GeneralSecurityException {
    String id = element.getAttributeNS(null, SamlConstants.ID_ATTRIBUTE);
    Preconditions.checkArgument(!id.isEmpty(), "Element to be signed has no ID");
    Preconditions.checkArgument(!SignatureVerifier.isSigned(element), "Element already signed");
    Document document = element.getOwnerDocument();
    // Santuario resolves the "#ID" reference through the DOM's ID attributes.
    element.setIdAttributeNS(null, SamlConstants.ID_ATTRIBUTE, true);
    try {
      XMLSignature signature = new XMLSignature(document, "", signatureAlgorithm.getUri(),
          SamlConstants.C14N_EXCL_OMIT_COMMENTS);
      element.insertBefore(signature.getElement(), insertBefore);
      Transforms transforms = new Transforms(document);
      transforms.addTransform(Transforms.TRANSFORM_ENVELOPED_SIGNATURE);
      transforms.addTransform(Transforms.TRANSFORM_C14N_EXCL_OMIT_COMMENTS);
      signature.addDocument("#" + id, transforms, digestAlgorithm.getUri());
      signature.addKeyInfo(certificate);
      signature.sign(key);
      return signature.getElement();
    } catch (XMLSecurityException e) {
      throw new SignatureException("Unable to sign " + element.getLocalName() + ": "
          + e.getMessage(), e);
    }
  }
}
