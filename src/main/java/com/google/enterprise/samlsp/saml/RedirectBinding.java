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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteStreams;
import com.google.common.net.UrlEscapers;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.cert.X509Certificate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * The SAML 2.0 HTTP-Redirect binding: messages travel as raw-DEFLATE
 * compressed, base64 encoded query parameters, and are signed over the query
 * string rather than with an embedded XML signature.
 */
@ParametersAreNonnullByDefault
public final class RedirectBinding {
  private static final Logger logger = Logger.getLogger(RedirectBinding.class.getName());

  /** The largest inflated message we'll accept. */
  public static final int MAX_INFLATED_SIZE = 1024 * 1024;

  private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

  // Non-instantiable class.
  private RedirectBinding() {
  }

  /**
   * Compresses a message with raw DEFLATE (no zlib header) and base64 encodes
   * the result.  The output isn't URL encoded.
   */
  @Nonnull
  public static String deflateAndEncode(String message) {
    Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
    try {
      deflater.setInput(message.getBytes(StandardCharsets.UTF_8));
      deflater.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[8192];
      while (!deflater.finished()) {
        int count = deflater.deflate(buffer);
        out.write(buffer, 0, count);
      }
      return BaseEncoding.base64().encode(out.toByteArray());
    } finally {
      deflater.end();
    }
  }

  /**
   * Reverses {@link #deflateAndEncode}.
   *
   * @throws IOException if the value isn't base64, doesn't inflate, or
   *     inflates to more than {@link #MAX_INFLATED_SIZE} bytes.
   */
  @Nonnull
  public static String decodeAndInflate(String encoded)
      throws IOException {
    byte[] compressed;
    try {
      compressed = SamlUtil.decodeBase64(encoded);
    } catch (IllegalArgumentException e) {
      throw new IOException("Message isn't valid base64", e);
    }
    Inflater inflater = new Inflater(true);
    try (InputStream in = ByteStreams.limit(
        new InflaterInputStream(new ByteArrayInputStream(compressed), inflater),
        MAX_INFLATED_SIZE + 1)) {
      byte[] bytes = ByteStreams.toByteArray(in);
      if (bytes.length > MAX_INFLATED_SIZE) {
        throw new IOException("Inflated message exceeds " + MAX_INFLATED_SIZE + " bytes");
      }
      return new String(bytes, StandardCharsets.UTF_8);
    } finally {
      inflater.end();
    }
  }

  /**
   * Builds the query string carrying a message.
   *
   * @param messageParameter {@code SAMLRequest} or {@code SAMLResponse}.
   * @param message The XML message.
   * @param relayState The relay state, or {@code null}.
   * @return The unsigned query string, without a leading {@code ?}.
   */
  @Nonnull
  public static String encodeQuery(String messageParameter, String message,
      @Nullable String relayState) {
    StringBuilder builder = new StringBuilder();
    appendParameter(builder, messageParameter, deflateAndEncode(message));
    if (relayState != null) {
      appendParameter(builder, SamlConstants.RELAY_STATE, relayState);
    }
    return builder.toString();
  }

  /**
   * Signs a query made by {@link #encodeQuery}.  The signature covers exactly
   * {@code <param>=...&RelayState=...&SigAlg=...} as URL encoded here, and is
   * appended as {@code Signature}.
   *
   * @param query The unsigned query.
   * @param algorithm The signature algorithm.
   * @param key The signing key.
   * @return The signed query string.
   * @throws GeneralSecurityException if signing fails.
   */
  @Nonnull
  public static String signQuery(String query, SignatureAlgorithm algorithm, PrivateKey key)
      throws GeneralSecurityException {
    StringBuilder builder = new StringBuilder(query);
    appendParameter(builder, SamlConstants.SIG_ALG, algorithm.getUri());
    byte[] signature = sign(builder.toString(), algorithm, key);
    appendParameter(builder, SamlConstants.SIGNATURE_PARAM,
        BaseEncoding.base64().encode(signature));
    return builder.toString();
  }

  /**
   * Appends a query to a URL, respecting any query the URL already has.
   */
  @Nonnull
  public static String appendQuery(String url, String query) {
    return url + ((url.indexOf('?') < 0) ? "?" : "&") + query;
  }

  /**
   * Verifies the signature on a received redirect-binding query.  The signed
   * string is rebuilt from the parameters exactly as they were encoded in the
   * query, never re-encoded.
   *
   * @param rawQuery The query string as received, without a leading {@code ?}.
   *     It carries either a {@code SAMLRequest} or a {@code SAMLResponse}.
   * @param certificate The certificate of the expected signer.
   * @throws GeneralSecurityException if the query isn't signed, is signed
   *     with an unsupported algorithm, or the signature doesn't verify.
   */
  public static void verifyQuerySignature(String rawQuery, X509Certificate certificate)
      throws GeneralSecurityException {
    Map<String, String> parameters = parseRawQuery(rawQuery);
    String messageParameter = parameters.containsKey(SamlConstants.SAML_RESPONSE)
        ? SamlConstants.SAML_RESPONSE
        : SamlConstants.SAML_REQUEST;
    String message = parameters.get(messageParameter);
    String sigAlg = parameters.get(SamlConstants.SIG_ALG);
    String signature = parameters.get(SamlConstants.SIGNATURE_PARAM);
    if (message == null || sigAlg == null || signature == null) {
      throw new SignatureException("Query lacks a message, " + SamlConstants.SIG_ALG
          + " or " + SamlConstants.SIGNATURE_PARAM);
    }
    SignatureAlgorithm algorithm = SignatureAlgorithm.forUri(urlDecode(sigAlg));
    if (algorithm == null) {
      throw new SignatureException("Unsupported signature algorithm: " + urlDecode(sigAlg));
    }

    StringBuilder signed = new StringBuilder();
    signed.append(messageParameter).append('=').append(message);
    String relayState = parameters.get(SamlConstants.RELAY_STATE);
    if (relayState != null) {
      signed.append('&').append(SamlConstants.RELAY_STATE).append('=').append(relayState);
    }
    signed.append('&').append(SamlConstants.SIG_ALG).append('=').append(sigAlg);

    byte[] signatureBytes;
    try {
      signatureBytes = SamlUtil.decodeBase64(urlDecode(signature));
    } catch (IllegalArgumentException e) {
      throw new SignatureException("Query signature isn't valid base64", e);
    }
    Signature verifier = Signature.getInstance(algorithm.getJcaName());
    verifier.initVerify(certificate.getPublicKey());
    verifier.update(signed.toString().getBytes(StandardCharsets.UTF_8));
    if (!verifier.verify(signatureBytes)) {
      throw new SignatureException("Query signature doesn't verify");
    }
    logger.fine("Verified redirect-binding signature using " + algorithm);
  }

  /**
   * Splits a query string into its raw (still URL encoded) parameter values.
   *
   * @throws SignatureException if a parameter appears more than once.
   */
  @Nonnull
  public static ImmutableMap<String, String> parseRawQuery(String rawQuery)
      throws SignatureException {
    Map<String, String> parameters = new LinkedHashMap<>();
    for (String pair : Splitter.on('&').omitEmptyStrings().split(rawQuery)) {
      int equals = pair.indexOf('=');
      String name = (equals < 0) ? pair : pair.substring(0, equals);
      String value = (equals < 0) ? "" : pair.substring(equals + 1);
      if (parameters.put(name, value) != null) {
        throw new SignatureException("Query parameter repeated: " + name);
      }
    }
    return ImmutableMap.copyOf(parameters);
  }

  /**
   * Decodes a URL-encoded query value.
   */
  @Nonnull
  public static String urlDecode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  private static void appendParameter(StringBuilder builder, String name, String value) {
    if (builder.length() > 0) {
      builder.append('&');
    }
    builder.append(name).append('=').append(ESCAPER.escape(value));
  }

  private static byte[] sign(String data, SignatureAlgorithm algorithm, PrivateKey key)
      throws GeneralSecurityException {
    Signature signer = Signature.getInstance(algorithm.getJcaName());
    signer.initSign(key);
    signer.update(data.getBytes(StandardCharsets.UTF_8));
    return signer.sign();
  }
}
