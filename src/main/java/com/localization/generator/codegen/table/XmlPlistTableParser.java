package com.localization.generator.codegen.table;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import com.localization.generator.codegen.exception.MalformedTableException;
import com.localization.generator.codegen.model.input.LocalizationEntry;

/**
 * Parser for {@code .strings} files saved as XML property lists:
 * a {@code <plist>} holding one {@code <dict>} of {@code <key>}/{@code <string>} pairs.
 * Any other value element makes the table malformed.
 */
public class XmlPlistTableParser implements TableParser {
    private static final Logger log = LoggerFactory.getLogger(XmlPlistTableParser.class);

    @Override
    public List<LocalizationEntry> parse(String content, Path path) throws MalformedTableException {
        Element dict = rootDictionary(readDocument(content, path), path);

        Map<String, String> entries = new LinkedHashMap<>();
        List<Element> children = childElements(dict);
        if (children.size() % 2 != 0) {
            throw new MalformedTableException(path, "<dict> has a key without a value");
        }
        for (int i = 0; i < children.size(); i += 2) {
            Element key = children.get(i);
            Element value = children.get(i + 1);
            if (!"key".equals(key.getTagName())) {
                throw new MalformedTableException(path, "expected <key> but found <" + key.getTagName() + ">");
            }
            if (!"string".equals(value.getTagName())) {
                throw new MalformedTableException(path,
                        "value for key '" + key.getTextContent() + "' is not a string");
            }
            String previous = entries.put(key.getTextContent(), value.getTextContent());
            if (previous != null) {
                log.debug("Key '{}' defined more than once in {}, keeping last value", key.getTextContent(), path);
            }
        }

        return entries.entrySet().stream()
                .map(e -> new LocalizationEntry(e.getKey(), e.getValue()))
                .toList();
    }

    private Document readDocument(String content, Path path) throws MalformedTableException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            // plists reference Apple's DTD by URL; never fetch it
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException e) {
            throw new MalformedTableException(path, "invalid XML property list: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new MalformedTableException(path, "could not read XML property list", e);
        }
    }

    private Element rootDictionary(Document document, Path path) throws MalformedTableException {
        Element root = document.getDocumentElement();
        if (!"plist".equals(root.getTagName())) {
            throw new MalformedTableException(path, "root element is <" + root.getTagName() + ">, expected <plist>");
        }
        List<Element> values = childElements(root);
        if (values.size() != 1 || !"dict".equals(values.get(0).getTagName())) {
            throw new MalformedTableException(path, "<plist> must contain exactly one <dict>");
        }
        return values.get(0);
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }
}
