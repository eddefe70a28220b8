package com.diagramforge.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * {@link XmlDocumentCodec} backed by the JDK's JAXP DOM parser and identity transformer.
 *
 * <p>DTDs and external entities are rejected. Parse errors are reported through
 * {@link XmlParseException} only; nothing is printed to stderr.
 */
public class DomXmlCodec implements XmlDocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(DomXmlCodec.class);

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private static final ErrorHandler SILENT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.trace("XML warning at {}:{}: {}", exception.getLineNumber(), exception.getColumnNumber(),
                exception.getMessage());
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

    private final DocumentBuilderFactory builderFactory;
    private final TransformerFactory transformerFactory;

    public DomXmlCodec() {
        this.builderFactory = createBuilderFactory();
        this.transformerFactory = createTransformerFactory();
    }

    @Override
    public Document parse(String xml) throws XmlParseException {
        if (xml == null || xml.isBlank()) {
            throw new XmlParseException("Document is empty", 1, 1, null);
        }
        try {
            DocumentBuilder builder = newBuilder();
            builder.setErrorHandler(SILENT_ERRORS);
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new XmlParseException(e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new XmlParseException(e.getMessage(), e);
        }
    }

    @Override
    public String serialize(Document document) {
        return serialize(document, false);
    }

    @Override
    public String serialize(Document document, boolean indent) {
        try {
            Transformer transformer = newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            if (indent) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty(INDENT_AMOUNT, "2");
            }
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize XML document: " + e.getMessage(), e);
        }
    }

    /**
     * Creates an empty document for programmatic construction.
     *
     * @return new document
     */
    public Document newDocument() {
        return newBuilder().newDocument();
    }

    private synchronized DocumentBuilder newBuilder() {
        try {
            return builderFactory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private synchronized Transformer newTransformer() throws TransformerException {
        return transformerFactory.newTransformer();
    }

    private static DocumentBuilderFactory createBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            log.warn("XML parser does not support hardening features: {}", e.getMessage());
        }
        return factory;
    }

    private static TransformerFactory createTransformerFactory() {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        return factory;
    }
}
