package com.example.vparam.source;

import com.example.vparam.validation.ConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/** XPath selector over an XML body; every matched node contributes its text content. */
@Slf4j
@Component
public class XPathExtractor implements DocumentExtractor {

  /** Keeps the parser off stderr: warnings are logged, errors abort the parse. */
  private static final ErrorHandler PARSE_ERRORS = new ErrorHandler() {
    @Override
    public void warning(SAXParseException ex) {
      log.debug("XML warning at line {}: {}", ex.getLineNumber(), ex.getMessage());
    }

    @Override
    public void error(SAXParseException ex) throws SAXException {
      throw ex;
    }

    @Override
    public void fatalError(SAXParseException ex) throws SAXException {
      throw ex;
    }
  };

  @Override
  public SelectorKind kind() {
    return SelectorKind.XPATH;
  }

  @Override
  public Object parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(PARSE_ERRORS);
      return builder.parse(new InputSource(new StringReader(body)));
    } catch (ParserConfigurationException | SAXException | IOException ex) {
      log.warn("Request body is not valid XML: {}", ex.getMessage());
      return null;
    }
  }

  @Override
  public List<String> select(Object document, String path) {
    try {
      NodeList nodes = (NodeList) XPathFactory.newInstance().newXPath()
          .evaluate(path, (Document) document, XPathConstants.NODESET);
      List<String> values = new ArrayList<>(nodes.getLength());
      for (int i = 0; i < nodes.getLength(); i++) {
        values.add(nodes.item(i).getTextContent());
      }
      return values;
    } catch (XPathExpressionException ex) {
      throw new ConfigurationException("Invalid XPath \"" + path + "\"", ex);
    }
  }
}
