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

/**
 * Names and URIs from the SAML 2.0 and XML-DSig standards.
 */
public final class SamlConstants {

  // Non-instantiable class.
  private SamlConstants() {
  }

  public static final String SAML_VERSION = "2.0";

  public static final String SAML20_NS = "urn:oasis:names:tc:SAML:2.0:assertion";
  public static final String SAML20P_NS = "urn:oasis:names:tc:SAML:2.0:protocol";
  public static final String SAML20MD_NS = "urn:oasis:names:tc:SAML:2.0:metadata";
  public static final String XMLSIG_NS = "http://www.w3.org/2000/09/xmldsig#";
  public static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

  public static final String SAML20_PREFIX = "saml";
  public static final String SAML20P_PREFIX = "samlp";
  public static final String SAML20MD_PREFIX = "md";
  public static final String XMLSIG_PREFIX = "ds";

  public static final String SAML2_POST_BINDING_URI =
      "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-POST";
  public static final String SAML2_REDIRECT_BINDING_URI =
      "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Redirect";

  public static final String NAMEID_FORMAT_EMAIL =
      "urn:oasis:names:tc:SAML:1.1:nameid-format:emailAddress";
  public static final String NAMEID_FORMAT_UNSPECIFIED =
      "urn:oasis:names:tc:SAML:1.1:nameid-format:unspecified";

  public static final String STATUS_SUCCESS = "urn:oasis:names:tc:SAML:2.0:status:Success";
  public static final String BEARER_METHOD = "urn:oasis:names:tc:SAML:2.0:cm:bearer";
  public static final String AUTHN_CONTEXT_PASSWORD_PROTECTED_TRANSPORT =
      "urn:oasis:names:tc:SAML:2.0:ac:classes:PasswordProtectedTransport";

  public static final String C14N_EXCL_OMIT_COMMENTS = "http://www.w3.org/2001/10/xml-exc-c14n#";
  public static final String C14N_EXCL_WITH_COMMENTS =
      "http://www.w3.org/2001/10/xml-exc-c14n#WithComments";
  public static final String TRANSFORM_ENVELOPED_SIGNATURE =
      "http://www.w3.org/2000/09/xmldsig#enveloped-signature";

  // Element names.
  public static final String RESPONSE = "Response";
  public static final String ASSERTION = "Assertion";
  public static final String ENCRYPTED_ASSERTION = "EncryptedAssertion";
  public static final String AUTHN_REQUEST = "AuthnRequest";
  public static final String ISSUER = "Issuer";
  public static final String STATUS = "Status";
  public static final String STATUS_CODE = "StatusCode";
  public static final String STATUS_MESSAGE = "StatusMessage";
  public static final String SUBJECT = "Subject";
  public static final String NAME_ID = "NameID";
  public static final String ENCRYPTED_ID = "EncryptedID";
  public static final String SUBJECT_CONFIRMATION = "SubjectConfirmation";
  public static final String SUBJECT_CONFIRMATION_DATA = "SubjectConfirmationData";
  public static final String CONDITIONS = "Conditions";
  public static final String AUDIENCE_RESTRICTION = "AudienceRestriction";
  public static final String AUDIENCE = "Audience";
  public static final String AUTHN_STATEMENT = "AuthnStatement";
  public static final String ATTRIBUTE_STATEMENT = "AttributeStatement";
  public static final String ATTRIBUTE = "Attribute";
  public static final String ATTRIBUTE_VALUE = "AttributeValue";
  public static final String NAME_ID_POLICY = "NameIDPolicy";
  public static final String REQUESTED_AUTHN_CONTEXT = "RequestedAuthnContext";
  public static final String AUTHN_CONTEXT_CLASS_REF = "AuthnContextClassRef";

  public static final String ENTITY_DESCRIPTOR = "EntityDescriptor";
  public static final String SP_SSO_DESCRIPTOR = "SPSSODescriptor";
  public static final String IDP_SSO_DESCRIPTOR = "IDPSSODescriptor";
  public static final String KEY_DESCRIPTOR = "KeyDescriptor";
  public static final String SINGLE_LOGOUT_SERVICE = "SingleLogoutService";
  public static final String NAME_ID_FORMAT = "NameIDFormat";
  public static final String ASSERTION_CONSUMER_SERVICE = "AssertionConsumerService";

  public static final String SIGNATURE = "Signature";
  public static final String SIGNED_INFO = "SignedInfo";
  public static final String CANONICALIZATION_METHOD = "CanonicalizationMethod";
  public static final String SIGNATURE_METHOD = "SignatureMethod";
  public static final String REFERENCE = "Reference";
  public static final String TRANSFORMS = "Transforms";
  public static final String TRANSFORM = "Transform";
  public static final String DIGEST_METHOD = "DigestMethod";
  public static final String DIGEST_VALUE = "DigestValue";
  public static final String KEY_INFO = "KeyInfo";
  public static final String X509_DATA = "X509Data";
  public static final String X509_CERTIFICATE = "X509Certificate";

  // Attribute names.
  public static final String ID_ATTRIBUTE = "ID";
  public static final String ALGORITHM_ATTRIBUTE = "Algorithm";

  // HTTP binding parameter names.
  public static final String SAML_REQUEST = "SAMLRequest";
  public static final String SAML_RESPONSE = "SAMLResponse";
  public static final String RELAY_STATE = "RelayState";
  public static final String SIG_ALG = "SigAlg";
  public static final String SIGNATURE_PARAM = "Signature";
}
