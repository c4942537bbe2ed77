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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import java.security.SecureRandom;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Static helpers shared by the SAML message builders and validators.
 */
@ParametersAreNonnullByDefault
public final class SamlUtil {

  /**
   * The number of random bytes in a generated identifier.  160 bits, well
   * above the 128 bits SAML asks for.
   */
  public static final int IDENTIFIER_BYTES = 20;

  private static final SecureRandom random = new SecureRandom();
  private static final DateTimeFormatter INSTANT_PRINTER =
      ISODateTimeFormat.dateTimeNoMillis().withZoneUTC();
  private static final DateTimeFormatter INSTANT_PARSER =
      ISODateTimeFormat.dateTimeParser().withZoneUTC();

  // Non-instantiable class.
  private SamlUtil() {
  }

  /**
   * Generates a random message identifier.  The identifier starts with an
   * underscore so that it's a valid {@code xs:ID}.
   */
  @Nonnull
  public static String generateIdentifier() {
    byte[] bytes = new byte[IDENTIFIER_BYTES];
    random.nextBytes(bytes);
    return "_" + BaseEncoding.base16().lowerCase().encode(bytes);
  }

  /**
   * Formats an instant as an {@code xs:dateTime} in UTC, without fractional
   * seconds.
   */
  @Nonnull
  public static String formatInstant(DateTime instant) {
    return INSTANT_PRINTER.print(instant);
  }

  /**
   * Parses an {@code xs:dateTime} value.
   *
   * @param value The value to parse; may be null.
   * @return The parsed instant, or {@code null} if the value is null or empty.
   * @throws IllegalArgumentException if the value isn't a valid date/time.
   */
  @Nullable
  public static DateTime parseInstant(@Nullable String value) {
    if (Strings.isNullOrEmpty(value)) {
      return null;
    }
    return INSTANT_PARSER.parseDateTime(value.trim());
  }

  /**
   * Decodes a base64 value, ignoring any embedded whitespace.
   *
   * @throws IllegalArgumentException if the value isn't valid base64.
   */
  @Nonnull
  public static byte[] decodeBase64(String value) {
    return BaseEncoding.base64().decode(CharMatcher.whitespace().removeFrom(value));
  }

  /**
   * Makes a namespace-qualified element.
   */
  @Nonnull
  public static Element makeElement(Document document, String namespaceUri, String prefix,
      String localName) {
    return document.createElementNS(namespaceUri, prefix + ":" + localName);
  }

  /**
   * Makes a namespace-qualified element containing some text.
   */
  @Nonnull
  public static Element makeTextElement(Document document, String namespaceUri, String prefix,
      String localName, String text) {
    Element element = makeElement(document, namespaceUri, prefix, localName);
    element.setTextContent(text);
    return element;
  }

  /**
   * Declares a namespace prefix on an element.  Elements made with
   * {@link Document#createElementNS} carry no declarations of their own, and
   * canonicalization only sees explicit ones.
   */
  public static void declareNamespace(Element element, String prefix, String namespaceUri) {
    element.setAttributeNS(SamlConstants.XMLNS_NS, "xmlns:" + prefix, namespaceUri);
  }
}
