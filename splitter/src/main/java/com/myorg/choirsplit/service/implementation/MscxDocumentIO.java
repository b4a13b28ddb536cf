package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.exception.ScoreStructureException;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.Text;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

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
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes uncompressed MuseScore documents (.mscx). Whitespace-only text between
 * elements is dropped on load; output is re-indented.
 */
@Slf4j
public class MscxDocumentIO {

    public Document load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Score not found: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            Document doc = load(in, path.getFileName().toString());
            log.info("Loaded score {}", path.toAbsolutePath());
            return doc;
        }
    }

    public Document load(InputStream in, String debugName) throws IOException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setValidating(false);
            dbf.setXIncludeAware(false);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);

            DocumentBuilder builder = dbf.newDocumentBuilder();
            // scores carry no DTD; never fetch one
            builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            Document doc = builder.parse(in);
            stripWhitespace(doc.getDocumentElement());
            return doc;
        } catch (SAXException e) {
            throw new ScoreStructureException("museScore", "Could not parse " + debugName + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    public void save(Document doc, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(path)) {
            write(doc, out);
        }
        log.info("Score written to {}", path.toAbsolutePath());
    }

    public byte[] toBytes(Document doc) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(doc, out);
        return out.toByteArray();
    }

    private void write(Document doc, OutputStream out) throws IOException {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IOException("Could not serialize score: " + e.getMessage(), e);
        }
    }

    /** Drops indentation text nodes; text of leaf elements is left alone. */
    private static void stripWhitespace(Node node) {
        boolean mixed = false;
        for (Node c = node.getFirstChild(); c != null; c = c.getNextSibling()) {
            if (c.getNodeType() == Node.ELEMENT_NODE) {
                mixed = true;
                break;
            }
        }
        if (!mixed) return;
        Node child = node.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.TEXT_NODE && ((Text) child).getData().isBlank()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                stripWhitespace(child);
            }
            child = next;
        }
    }
}
