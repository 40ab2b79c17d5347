package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.interfaces.StylesheetParseException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SAX ile okuyup DOM ağacı kuran, her elemente kaynak satır numarasını iliştiren yükleyici.
 * <p>
 * Standart DOM ayrıştırıcısı satır bilgisini korumadığı için ağaç SAX olayları üzerinden
 * elle kurulur. Satır numaraları {@link Element#getUserData(String)} ile
 * {@link #LINE_START} ve {@link #LINE_END} anahtarlarından okunur.
 * <p>
 * Yorumlar ve işleme talimatları ağaca alınmaz.
 */
final class LineAwareDocumentLoader {

    static final String LINE_START = "lineStart";
    static final String LINE_END = "lineEnd";

    Document load(String source) throws StylesheetParseException {
        if (source == null || source.isBlank()) {
            throw new StylesheetParseException("XSLT içeriği boş");
        }

        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            // XXE koruma
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            SAXParser parser = factory.newSAXParser();
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            parser.parse(new InputSource(new StringReader(source)), new DomBuildingHandler(document));
            return document;

        } catch (SAXParseException e) {
            throw new StylesheetParseException(
                    "XML ayrıştırma hatası (satır " + e.getLineNumber() + "): " + e.getMessage(),
                    e.getLineNumber(), e);
        } catch (SAXException | IOException e) {
            throw new StylesheetParseException("XML ayrıştırma hatası: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML ayrıştırıcı yapılandırılamadı", e);
        }
    }

    static int lineStart(Element element) {
        Object line = element.getUserData(LINE_START);
        return line instanceof Integer value ? value : 0;
    }

    static int lineEnd(Element element) {
        Object line = element.getUserData(LINE_END);
        return line instanceof Integer value ? value : lineStart(element);
    }

    /**
     * Elementi alt ağacıyla birlikte XML metnine çevirir.
     * <p>
     * Yalnızca elementin kendi üzerinde bildirilmiş namespace'ler yazılır;
     * üst elementlerden miras alınanlar eklenmez.
     */
    static String serialize(Element element) {
        StringBuilder out = new StringBuilder();
        append(out, element);
        return out.toString();
    }

    private static void append(StringBuilder out, Node node) {
        switch (node.getNodeType()) {
            case Node.ELEMENT_NODE -> {
                Element element = (Element) node;
                out.append('<').append(element.getTagName());
                NamedNodeMap attributes = element.getAttributes();
                for (int i = 0; i < attributes.getLength(); i++) {
                    Attr attr = (Attr) attributes.item(i);
                    out.append(' ').append(attr.getName()).append("=\"")
                            .append(escape(attr.getValue(), true)).append('"');
                }
                NodeList children = element.getChildNodes();
                if (children.getLength() == 0) {
                    out.append("/>");
                    return;
                }
                out.append('>');
                for (int i = 0; i < children.getLength(); i++) {
                    append(out, children.item(i));
                }
                out.append("</").append(element.getTagName()).append('>');
            }
            case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> out.append(escape(node.getNodeValue(), false));
            default -> {
                // Ağaçta yalnızca element ve metin düğümleri bulunur
            }
        }
    }

    private static String escape(String value, boolean attribute) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append(attribute ? "&quot;" : "\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    // ── SAX Handler ─────────────────────────────────────────────────

    private static final class DomBuildingHandler extends DefaultHandler {

        private final Document document;
        private final Deque<Element> stack = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();
        private final Map<String, String> pendingNamespaces = new LinkedHashMap<>();
        private Locator locator;

        DomBuildingHandler(Document document) {
            this.document = document;
        }

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startPrefixMapping(String prefix, String uri) {
            pendingNamespaces.put(prefix, uri);
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            flushText();

            Element element = document.createElementNS(uri.isEmpty() ? null : uri, qName);
            for (var ns : pendingNamespaces.entrySet()) {
                String attrName = ns.getKey().isEmpty() ? "xmlns" : "xmlns:" + ns.getKey();
                element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, attrName, ns.getValue());
            }
            pendingNamespaces.clear();

            for (int i = 0; i < attributes.getLength(); i++) {
                String attrUri = attributes.getURI(i);
                element.setAttributeNS(attrUri.isEmpty() ? null : attrUri, attributes.getQName(i), attributes.getValue(i));
            }
            element.setUserData(LINE_START, currentLine(), null);

            if (stack.isEmpty()) {
                document.appendChild(element);
            } else {
                stack.peek().appendChild(element);
            }
            stack.push(element);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            flushText();
            Element element = stack.pop();
            element.setUserData(LINE_END, currentLine(), null);
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            text.append(ch, start, length);
        }

        private void flushText() {
            if (text.length() > 0 && !stack.isEmpty()) {
                stack.peek().appendChild(document.createTextNode(text.toString()));
            }
            text.setLength(0);
        }

        private int currentLine() {
            return locator != null ? locator.getLineNumber() : 0;
        }
    }
}
