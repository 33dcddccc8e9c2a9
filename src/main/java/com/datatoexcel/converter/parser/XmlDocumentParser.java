package com.datatoexcel.converter.parser;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ListNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;

/**
 * Parses XML into the document model using the usual XML-to-dictionary conventions:
 * <ul>
 *   <li>the document is an object with a single field named after the root element;</li>
 *   <li>an element without attributes or child elements becomes its trimmed text, or null when empty;</li>
 *   <li>any other element becomes an object holding {@code @attribute} fields, then child elements
 *       (repeated names collected into a list), then non-blank text under {@code #text}.</li>
 * </ul>
 * All values are strings. Namespace prefixes are kept as part of the names.
 */
public class XmlDocumentParser implements DocumentParser {

    static final String ATTRIBUTE_PREFIX = "@";
    static final String TEXT_KEY = "#text";

    private final XMLInputFactory inputFactory;

    public XmlDocumentParser() {
        inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    @Override
    public SourceFormat getFormat() {
        return SourceFormat.XML;
    }

    @Override
    public ObjectNode parse(Reader reader) {
        try {
            return read(inputFactory.createXMLStreamReader(reader));
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Invalid xml document: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the file as bytes so that the encoding named in the xml declaration (or a byte order
     * mark) is honoured.
     */
    @Override
    public ObjectNode parse(Path file) {
        DocumentParser.requireFormat(getFormat(), file);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return read(inputFactory.createXMLStreamReader(in));
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Invalid xml document: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private ObjectNode read(XMLStreamReader xml) {
        try {
            while (xml.hasNext()) {
                if (xml.next() == XMLStreamConstants.START_ELEMENT) {
                    String rootName = qualifiedName(xml.getPrefix(), xml.getLocalName());
                    DocumentNode root = readElement(xml);
                    return new ObjectNode(Map.of(rootName, root));
                }
            }
            throw new DocumentParseException("Document root must be an object, found empty document");
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Invalid xml document: " + e.getMessage(), e);
        } finally {
            close(xml);
        }
    }

    /**
     * Reads the element the reader is positioned on, leaving the reader on its end tag.
     */
    private DocumentNode readElement(XMLStreamReader xml) throws XMLStreamException {
        Map<String, DocumentNode> attributes = new LinkedHashMap<>();
        for (int i = 0; i < xml.getNamespaceCount(); i++) {
            String prefix = xml.getNamespacePrefix(i);
            String key = prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix;
            attributes.put(ATTRIBUTE_PREFIX + key, ScalarNode.of(xml.getNamespaceURI(i)));
        }
        for (int i = 0; i < xml.getAttributeCount(); i++) {
            String name = qualifiedName(xml.getAttributePrefix(i), xml.getAttributeLocalName(i));
            attributes.put(ATTRIBUTE_PREFIX + name, ScalarNode.of(xml.getAttributeValue(i)));
        }

        Map<String, Object> children = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder();

        while (xml.hasNext()) {
            int event = xml.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    String name = qualifiedName(xml.getPrefix(), xml.getLocalName());
                    addChild(children, name, readElement(xml));
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
                        text.append(xml.getText());
                case XMLStreamConstants.END_ELEMENT -> {
                    return buildElement(attributes, children, text.toString().trim());
                }
                default -> {
                    // comments and processing instructions carry no data
                }
            }
        }
        throw new DocumentParseException("Unexpected end of xml document inside element " + xml.getLocalName());
    }

    @SuppressWarnings("unchecked")
    private static void addChild(Map<String, Object> children, String name, DocumentNode child) {
        Object existing = children.get(name);
        if (existing == null) {
            children.put(name, child);
        } else if (existing instanceof List) {
            ((List<DocumentNode>) existing).add(child);
        } else {
            List<DocumentNode> repeated = new ArrayList<>();
            repeated.add((DocumentNode) existing);
            repeated.add(child);
            children.put(name, repeated);
        }
    }

    @SuppressWarnings("unchecked")
    private static DocumentNode buildElement(Map<String, DocumentNode> attributes, Map<String, Object> children,
                                             String text) {
        if (attributes.isEmpty() && children.isEmpty()) {
            return text.isEmpty() ? ScalarNode.NULL : ScalarNode.of(text);
        }
        Map<String, DocumentNode> fields = new LinkedHashMap<>(attributes);
        children.forEach((name, value) -> {
            if (value instanceof List) {
                fields.put(name, new ListNode((List<DocumentNode>) value));
            } else {
                fields.put(name, (DocumentNode) value);
            }
        });
        if (!text.isEmpty()) {
            fields.put(TEXT_KEY, ScalarNode.of(text));
        }
        return new ObjectNode(fields);
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static void close(XMLStreamReader xml) {
        if (xml == null) {
            return;
        }
        try {
            xml.close();
        } catch (XMLStreamException e) {
            throw new DocumentParseException("Failed to close xml reader: " + e.getMessage(), e);
        }
    }
}
