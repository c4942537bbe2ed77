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

package com.google.enterprise.samlsp.common;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.ls.DOMImplementationLS;
import org.w3c.dom.ls.LSSerializer;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Utilities for reading, writing and navigating DOM documents.
 *
 * <p>Documents are always parsed namespace-aware.  Document type declarations
 * are refused outright, so neither internal nor external entities are ever
 * expanded, and XInclude is never processed.
 */
@ThreadSafe
@ParametersAreNonnullByDefault
public final class XmlUtil {
  private static final XmlUtil INSTANCE = new XmlUtil();

  private static final String DISALLOW_DOCTYPE_FEATURE =
      "http://apache.org/xml/features/disallow-doctype-decl";
  private static final String EXTERNAL_GENERAL_ENTITIES_FEATURE =
      "http://xml.org/sax/features/external-general-entities";
  private static final String EXTERNAL_PARAMETER_ENTITIES_FEATURE =
      "http://xml.org/sax/features/external-parameter-entities";
  private static final String LOAD_EXTERNAL_DTD_FEATURE =
      "http://apache.org/xml/features/nonvalidating/load-external-dtd";

  @GuardedBy("this") private final DocumentBuilderFactory factory;

  private XmlUtil() {
    factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setValidating(false);
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature(DISALLOW_DOCTYPE_FEATURE, true);
      factory.setFeature(EXTERNAL_GENERAL_ENTITIES_FEATURE, false);
      factory.setFeature(EXTERNAL_PARAMETER_ENTITIES_FEATURE, false);
      factory.setFeature(LOAD_EXTERNAL_DTD_FEATURE, false);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser doesn't support secure processing", e);
    }
  }

  @Nonnull
  public static XmlUtil getInstance() {
    return INSTANCE;
  }

  private synchronized DocumentBuilder newDocumentBuilder() {
    DocumentBuilder builder;
    try {
      builder = factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e);
    }
    builder.setErrorHandler(THROWING_ERROR_HANDLER);
    return builder;
  }

  /**
   * Reads an XML document.
   *
   * @param reader A reader supplying the document's characters.
   * @return The parsed document.
   * @throws IOException if the input can't be read or isn't well-formed XML.
   */
  @Nonnull
  public Document readXmlDocument(Reader reader)
      throws IOException {
    try {
      return newDocumentBuilder().parse(new InputSource(reader));
    } catch (SAXException e) {
      throw new IOException("Unable to parse XML: " + e.getMessage(), e);
    }
  }

  /**
   * Reads an XML document from bytes.  The character encoding is taken from
   * the byte-order mark or the XML declaration, defaulting to UTF-8.
   *
   * @param in A stream supplying the document's bytes.
   * @return The parsed document.
   * @throws IOException if the input can't be read or isn't well-formed XML.
   */
  @Nonnull
  public Document readXmlDocument(InputStream in)
      throws IOException {
    try {
      return newDocumentBuilder().parse(new InputSource(in));
    } catch (SAXException e) {
      throw new IOException("Unable to parse XML: " + e.getMessage(), e);
    }
  }

  @Nonnull
  public Document readXmlDocument(String xml)
      throws IOException {
    return readXmlDocument(new StringReader(xml));
  }

  /**
   * Makes a new, empty document.
   */
  @Nonnull
  public Document newDocument() {
    return newDocumentBuilder().newDocument();
  }

  /**
   * Serializes a node without an XML declaration.
   *
   * @param node The node to serialize.
   * @return The serialized string.
   */
  @Nonnull
  public static String writeXmlString(Node node) {
    Document document = (node instanceof Document) ? (Document) node : node.getOwnerDocument();
    DOMImplementationLS domImplLS = (DOMImplementationLS) document.getImplementation();
    LSSerializer serializer = domImplLS.createLSSerializer();
    serializer.getDomConfig().setParameter("xml-declaration", false);
    return serializer.writeToString(node);
  }

  /**
   * Gets the element children of a given element that have a given name.
   *
   * @param parent The element to search.
   * @param namespaceUri The namespace URI of the wanted children.
   * @param localName The local name of the wanted children.
   * @return The matching children, in document order.
   */
  @Nonnull
  public static ImmutableList<Element> getChildElements(Element parent, String namespaceUri,
      String localName) {
    ImmutableList.Builder<Element> builder = ImmutableList.builder();
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (isElement(child, namespaceUri, localName)) {
        builder.add((Element) child);
      }
    }
    return builder.build();
  }

  /**
   * Gets all the element children of a given element.
   */
  @Nonnull
  public static ImmutableList<Element> getChildElements(Element parent) {
    ImmutableList.Builder<Element> builder = ImmutableList.builder();
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        builder.add((Element) child);
      }
    }
    return builder.build();
  }

  /**
   * Gets the first element child of a given element that has a given name.
   *
   * @return The child, or {@code null} if there's none.
   */
  @Nullable
  public static Element findChildElement(Element parent, String namespaceUri, String localName) {
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (isElement(child, namespaceUri, localName)) {
        return (Element) child;
      }
    }
    return null;
  }

  /**
   * Is the given node an element with the given name?
   */
  public static boolean isElement(Node node, String namespaceUri, String localName) {
    return node.getNodeType() == Node.ELEMENT_NODE
        && namespaceUri.equals(node.getNamespaceURI())
        && localName.equals(node.getLocalName());
  }

  /**
   * Gets the value of an unqualified attribute.  Unlike
   * {@link Element#getAttribute}, distinguishes a missing attribute from an
   * empty one.
   *
   * @return The attribute's value, or {@code null} if it isn't present.
   */
  @Nullable
  public static String getAttribute(Element element, String name) {
    return element.hasAttributeNS(null, name) ? element.getAttributeNS(null, name) : null;
  }

  /**
   * Gets the trimmed text content of an element.
   */
  @Nonnull
  public static String getTrimmedText(Element element) {
    return element.getTextContent().trim();
  }

  private static final ErrorHandler THROWING_ERROR_HANDLER = new ErrorHandler() {
    @Override
    public void warning(SAXParseException exception) {
    }

    @Override
    public void error(SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(SAXParseException exception) throws SAXException {
      throw exception;
    }
  };
}
