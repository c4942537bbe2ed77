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

package com.google.enterprise.samlsp.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import com.google.enterprise.samlsp.common.KeyUtil;
import com.google.enterprise.samlsp.saml.DigestAlgorithm;
import com.google.enterprise.samlsp.saml.SamlConstants;
import com.google.enterprise.samlsp.saml.SignatureAlgorithm;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.joda.time.Duration;

/**
 * Reads the SAML configuration from a {@link ConfigSource}.
 *
 * <p>The required parameters are checked first, in a fixed order, so a
 * missing one is reported before any certificate is parsed.  Signing of
 * outbound requests is turned on exactly when an SP private key is given.
 */
@ParametersAreNonnullByDefault
public final class SamlSettingsReader {
  private static final Logger logger = Logger.getLogger(SamlSettingsReader.class.getName());

  public static final String IDP_ENTITY_ID = "SAML_IDP_ENTITY_ID";
  public static final String IDP_SSO_URL = "SAML_IDP_SSO_URL";
  public static final String IDP_X509_CERT = "SAML_IDP_X509_CERT";
  public static final String IDP_SLO_URL = "SAML_IDP_SLO_URL";
  public static final String PROXY_BASE_URL = "PROXY_BASE_URL";
  public static final String SP_ENTITY_ID = "SAML_ENTITY_ID";
  public static final String SP_ACS_PATH = "SAML_ACS_PATH";
  public static final String SP_NAME_ID_FORMAT = "SAML_NAME_ID_FORMAT";
  public static final String SP_X509_CERT = "SAML_SP_X509_CERT";
  public static final String SP_PRIVATE_KEY = "SAML_SP_PRIVATE_KEY";
  public static final String SIGNATURE_ALGORITHM = "SAML_SIGNATURE_ALGORITHM";
  public static final String DIGEST_ALGORITHM = "SAML_DIGEST_ALGORITHM";
  public static final String CLOCK_SKEW_SECONDS = "SAML_CLOCK_SKEW_SECONDS";
  public static final String WANT_MESSAGES_SIGNED = "SAML_WANT_MESSAGES_SIGNED";
  public static final String WANT_ASSERTIONS_SIGNED = "SAML_WANT_ASSERTIONS_SIGNED";
  public static final String WANT_ASSERTIONS_ENCRYPTED = "SAML_WANT_ASSERTIONS_ENCRYPTED";
  public static final String WANT_ATTRIBUTE_STATEMENT = "SAML_WANT_ATTRIBUTE_STATEMENT";
  public static final String USER_ID_ATTRIBUTE = "SAML_USER_ID_ATTRIBUTE";
  public static final String USER_EMAIL_ATTRIBUTE = "SAML_USER_EMAIL_ATTRIBUTE";
  public static final String USER_FIRST_NAME_ATTRIBUTE = "SAML_USER_FIRST_NAME_ATTRIBUTE";
  public static final String USER_LAST_NAME_ATTRIBUTE = "SAML_USER_LAST_NAME_ATTRIBUTE";
  public static final String USER_DISPLAY_NAME_ATTRIBUTE = "SAML_USER_DISPLAY_NAME_ATTRIBUTE";
  public static final String DEBUG = "SAML_DEBUG";

  public static final String DEFAULT_ACS_PATH = "/sso/saml/acs";
  public static final String DEFAULT_METADATA_PATH = "/sso/saml/metadata";
  public static final String DEFAULT_SLS_PATH = "/sso/saml/sls";

  private final ConfigSource source;

  private SamlSettingsReader(ConfigSource source) {
    this.source = source;
  }

  /**
   * Reads the SAML settings.
   *
   * @param source The configuration source to read.
   * @return The settings.
   * @throws ConfigException if a required parameter is missing, or any
   *     parameter is malformed.
   */
  @Nonnull
  public static SamlSettings read(ConfigSource source)
      throws ConfigException {
    return new SamlSettingsReader(source).read();
  }

  /**
   * Is SAML single-sign-on configured?  True when all of the IdP parameters
   * are set; doesn't check that they're valid.
   */
  public static boolean isSamlConfigured(ConfigSource source) {
    return !Strings.isNullOrEmpty(source.get(IDP_ENTITY_ID))
        && !Strings.isNullOrEmpty(source.get(IDP_SSO_URL))
        && !Strings.isNullOrEmpty(source.get(IDP_X509_CERT));
  }

  private SamlSettings read()
      throws ConfigException {
    String idpEntityId = getRequired(IDP_ENTITY_ID, "Set it in the environment");
    String idpSsoUrl = getRequired(IDP_SSO_URL, "Set it in the environment");
    String idpCertText = getRequired(IDP_X509_CERT, "Set it in the environment");
    String baseUrl = CharMatcher.is('/').trimTrailingFrom(
        getRequired(PROXY_BASE_URL, "Required for SAML SSO redirects"));

    X509Certificate idpCertificate = parseCertificate(IDP_X509_CERT, idpCertText);
    IdpSettings idp =
        IdpSettings.make(idpEntityId, idpSsoUrl, getOptional(IDP_SLO_URL), idpCertificate);

    String spCertText = getOptional(SP_X509_CERT);
    String spKeyText = getOptional(SP_PRIVATE_KEY);
    X509Certificate spCertificate =
        (spCertText == null) ? null : parseCertificate(SP_X509_CERT, spCertText);
    PrivateKey spKey = (spKeyText == null) ? null : parsePrivateKey(spKeyText);
    if (spKey != null) {
      checkKeyPair(spKey, spCertificate);
    }

    SpSettings sp = SpSettings.make(
        getOrDefault(SP_ENTITY_ID, baseUrl + DEFAULT_METADATA_PATH),
        baseUrl + getOrDefault(SP_ACS_PATH, DEFAULT_ACS_PATH),
        baseUrl + DEFAULT_SLS_PATH,
        getOrDefault(SP_NAME_ID_FORMAT, SamlConstants.NAMEID_FORMAT_EMAIL),
        spCertificate,
        spKey);

    if (getBoolean(WANT_ASSERTIONS_ENCRYPTED, false)) {
      throw new ConfigException(WANT_ASSERTIONS_ENCRYPTED,
          "Encrypted assertions are not supported");
    }

    SecurityPolicy policy = SecurityPolicy.builder()
        .setSignRequests(spKey != null)
        .setWantMessagesSigned(getBoolean(WANT_MESSAGES_SIGNED, false))
        .setWantAssertionsSigned(getBoolean(WANT_ASSERTIONS_SIGNED, true))
        .setWantAttributeStatement(getBoolean(WANT_ATTRIBUTE_STATEMENT, false))
        .setSignatureAlgorithm(getSignatureAlgorithm())
        .setDigestAlgorithm(getDigestAlgorithm())
        .setClockSkew(getClockSkew())
        .build();

    AttributeNames attributeNames = AttributeNames.make(
        getOrDefault(USER_ID_ATTRIBUTE, AttributeNames.DEFAULT_USER_ID),
        getOrDefault(USER_EMAIL_ATTRIBUTE, AttributeNames.DEFAULT_EMAIL),
        getOrDefault(USER_FIRST_NAME_ATTRIBUTE, AttributeNames.DEFAULT_FIRST_NAME),
        getOrDefault(USER_LAST_NAME_ATTRIBUTE, AttributeNames.DEFAULT_LAST_NAME),
        getOrDefault(USER_DISPLAY_NAME_ATTRIBUTE, AttributeNames.DEFAULT_DISPLAY_NAME));

    SamlSettings settings =
        SamlSettings.make(sp, idp, policy, attributeNames, getBoolean(DEBUG, false));
    logger.fine("SAML settings built - SP entity ID: " + sp.getEntityId()
        + ", IdP SSO URL: " + idp.getSingleSignOnUrl());
    return settings;
  }

  private String getRequired(String name, String hint)
      throws ConfigException {
    String value = getOptional(name);
    if (value == null) {
      throw new ConfigException(name, name + " not set. " + hint);
    }
    return value;
  }

  @Nullable
  private String getOptional(String name) {
    return Strings.emptyToNull(Strings.nullToEmpty(source.get(name)).trim());
  }

  private String getOrDefault(String name, String defaultValue) {
    String value = getOptional(name);
    return (value == null) ? defaultValue : value;
  }

  private boolean getBoolean(String name, boolean defaultValue) {
    String value = getOptional(name);
    return (value == null) ? defaultValue : "true".equalsIgnoreCase(value);
  }

  private SignatureAlgorithm getSignatureAlgorithm()
      throws ConfigException {
    String uri = getOptional(SIGNATURE_ALGORITHM);
    if (uri == null) {
      return SignatureAlgorithm.RSA_SHA256;
    }
    SignatureAlgorithm algorithm = SignatureAlgorithm.forUri(uri);
    if (algorithm == null) {
      throw new ConfigException(SIGNATURE_ALGORITHM, "Unsupported signature algorithm: " + uri);
    }
    return algorithm;
  }

  private DigestAlgorithm getDigestAlgorithm()
      throws ConfigException {
    String uri = getOptional(DIGEST_ALGORITHM);
    if (uri == null) {
      return DigestAlgorithm.SHA256;
    }
    DigestAlgorithm algorithm = DigestAlgorithm.forUri(uri);
    if (algorithm == null) {
      throw new ConfigException(DIGEST_ALGORITHM, "Unsupported digest algorithm: " + uri);
    }
    return algorithm;
  }

  private Duration getClockSkew()
      throws ConfigException {
    String value = getOptional(CLOCK_SKEW_SECONDS);
    if (value == null) {
      return SecurityPolicy.DEFAULT_CLOCK_SKEW;
    }
    Integer seconds = Ints.tryParse(value);
    if (seconds == null || seconds < 0) {
      throw new ConfigException(CLOCK_SKEW_SECONDS,
          CLOCK_SKEW_SECONDS + " must be a non-negative integer");
    }
    return Duration.standardSeconds(seconds);
  }

  private static X509Certificate parseCertificate(String name, String text)
      throws ConfigException {
    try {
      return KeyUtil.parseCertificate(text);
    } catch (CertificateException e) {
      // The certificate itself stays out of the message.
      throw new ConfigException(name, name + " is not a valid X.509 certificate", e);
    }
  }

  private static PrivateKey parsePrivateKey(String text)
      throws ConfigException {
    try {
      return KeyUtil.parsePrivateKey(text);
    } catch (GeneralSecurityException e) {
      throw new ConfigException(SP_PRIVATE_KEY,
          SP_PRIVATE_KEY + " is not a valid RSA private key", e);
    }
  }

  private static void checkKeyPair(PrivateKey key, @Nullable X509Certificate certificate)
      throws ConfigException {
    if (certificate == null) {
      throw new ConfigException(SP_X509_CERT,
          SP_X509_CERT + " must be set when " + SP_PRIVATE_KEY + " is set");
    }
    boolean matches;
    try {
      matches = KeyUtil.keyMatchesCertificate(key, certificate);
    } catch (GeneralSecurityException e) {
      throw new ConfigException(SP_PRIVATE_KEY,
          SP_PRIVATE_KEY + " can't be used with " + SP_X509_CERT, e);
    }
    if (!matches) {
      throw new ConfigException(SP_PRIVATE_KEY,
          SP_PRIVATE_KEY + " does not match " + SP_X509_CERT);
    }
  }
}
