package com.diagramforge.core.xml;

import org.w3c.dom.Document;

import java.util.ServiceLoader;

/**
 * XML parsing and serialization capability the engine depends on.
 *
 * <p>The engine never touches a concrete XML library directly; it asks for a codec. The
 * default is {@link DomXmlCodec}. Alternative implementations are discovered via Java SPI.
 *
 * <p><b>Registration:</b> list implementations in
 * {@code META-INF/services/com.diagramforge.core.xml.XmlDocumentCodec}
 *
 * @see DomXmlCodec
 */
public interface XmlDocumentCodec {

    /**
     * Parses a complete document.
     *
     * @param xml document text
     * @return a fresh, caller-owned document
     * @throws XmlParseException if the text is not well-formed
     */
    Document parse(String xml) throws XmlParseException;

    /**
     * Serializes a document without an XML declaration, preserving existing whitespace.
     *
     * @param document document to write
     * @return document text
     */
    String serialize(Document document);

    /**
     * Serializes a document, optionally re-indenting it.
     *
     * @param document document to write
     * @param indent whether to pretty-print with two-space indentation
     * @return document text
     */
    String serialize(Document document, boolean indent);

    /**
     * Returns whether the text parses as well-formed XML.
     *
     * @param xml document text
     * @return {@code true} if well-formed
     */
    default boolean isWellFormed(String xml) {
        try {
            parse(xml);
            return true;
        } catch (XmlParseException e) {
            return false;
        }
    }

    /**
     * Loads the first codec registered through {@link ServiceLoader}, or the DOM codec.
     *
     * @return codec instance
     */
    static XmlDocumentCodec load() {
        return ServiceLoader.load(XmlDocumentCodec.class)
            .findFirst()
            .orElseGet(DomXmlCodec::new);
    }
}
