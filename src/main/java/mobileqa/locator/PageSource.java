package mobileqa.locator;

import mobileqa.MobileQAException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed UI hierarchy dump (the XML returned by the driver's page source)
 * that locators can be evaluated against without a device.
 *
 * <p>Path queries are handed to the JDK XPath 1.0 engine, except those using
 * {@code matches()}, which XPath 1.0 lacks; those and every other locator
 * shape are evaluated through the selector AST by {@link SelectorMatcher}.
 * Results are always in document order.
 */
public final class PageSource {

    private static final Logger log = LoggerFactory.getLogger(PageSource.class);

    private final Document document;
    private final List<Element> elements;

    private PageSource(Document document) {
        this.document = document;
        this.elements = new ArrayList<>();
        collect(document.getDocumentElement(), elements);
    }

    /**
     * Parses a hierarchy dump.
     *
     * @throws MobileQAException if the text is not well-formed XML
     */
    public static PageSource parse(String xml) {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setExpandEntityReferences(false);
            DocumentBuilder builder = dbf.newDocumentBuilder();
            return new PageSource(builder.parse(new InputSource(new StringReader(xml))));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new MobileQAException("Cannot parse page source: " + e.getMessage(), e);
        }
    }

    /** Reads and parses a hierarchy dump saved to disk. */
    public static PageSource load(Path path) throws IOException {
        log.debug("Loading page source from {}", path);
        return parse(Files.readString(path));
    }

    // ── Queries ───────────────────────────────────────────────────────────

    /** Nodes selected by {@code locator}, in document order. */
    public List<Element> select(Locator locator) {
        if (locator.getShape() == LocatorShape.PATH_QUERY
                && !locator.getPathQuery().contains("matches(")) {
            return evaluateXPath(locator.getPathQuery());
        }
        List<Element> result = new SelectorMatcher(elements).select(LocatorConverter.toSelector(locator));
        log.debug("{} matched {} node(s)", locator, result.size());
        return result;
    }

    public int count(Locator locator) {
        return select(locator).size();
    }

    private List<Element> evaluateXPath(String expression) {
        XPath xpath = XPathFactory.newInstance().newXPath();
        NodeList nodes;
        try {
            nodes = (NodeList) xpath.evaluate(expression, document, XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new InvalidLocatorException("Cannot evaluate path query '" + expression + "'", e);
        }
        List<Element> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element e) out.add(e);
        }
        log.debug("{} matched {} node(s)", expression, out.size());
        return out;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** All attributes of a node, in the order the parser reports them. */
    public static Map<String, String> attributesOf(Element element) {
        Map<String, String> out = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node a = attrs.item(i);
            out.put(a.getNodeName(), a.getNodeValue());
        }
        return out;
    }

    public Document getDocument() { return document; }

    /** Every element of the dump, root included, in document order. */
    public List<Element> getElements() { return List.copyOf(elements); }

    private static void collect(Element e, List<Element> out) {
        out.add(e);
        for (Node c = e.getFirstChild(); c != null; c = c.getNextSibling()) {
            if (c instanceof Element child) collect(child, out);
        }
    }
}
