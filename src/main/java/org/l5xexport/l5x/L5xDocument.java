package org.l5xexport.l5x;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已加载的 L5X 文档，以及基于它的“命名空间透明”查询层。
 * <p>
 * 加载规则：
 * <ul>
 *   <li>文件不存在：抛出 {@link L5xNotFoundException}（在解析之前判断）。</li>
 *   <li>XML 不是良构文档：抛出 {@link L5xParseException}，消息包含解析器给出的行列号与原因。</li>
 *   <li>根元素本地名不是 {@value #ROOT_ELEMENT_NAME}：抛出 {@link L5xInvalidFormatException}。</li>
 * </ul>
 * <p>
 * 查询规则：
 * <ul>
 *   <li>路径用 {@code /} 分隔，每一段只匹配“直接子元素”，不做递归搜索。</li>
 *   <li>根元素带命名空间时，每一段都按 {@code {ns}localName} 匹配；否则只匹配不带命名空间的同名元素。</li>
 * </ul>
 * 因此同一份文档带/不带命名空间，查询结果完全一致。
 */
public final class L5xDocument {

    public static final String ROOT_ELEMENT_NAME = "RSLogix5000Content";

    private static final Logger log = LoggerFactory.getLogger(L5xDocument.class);

    private final Path source;
    private final Element root;
    private final String namespace;

    private L5xDocument(Path source, Element root, String namespace) {
        this.source = source;
        this.root = root;
        this.namespace = namespace;
    }

    public static L5xDocument load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new L5xNotFoundException(path);
        }

        Document document;
        try (InputStream in = Files.newInputStream(path)) {
            document = newDocumentBuilder().parse(in, path.toUri().toString());
        } catch (SAXParseException e) {
            throw new L5xParseException("line " + e.getLineNumber() + ", column " + e.getColumnNumber()
                    + ": " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new L5xParseException(e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }

        Element root = document.getDocumentElement();
        String namespace = root.getNamespaceURI() == null ? "" : root.getNamespaceURI();
        String rootLocalName = localName(root);
        if (!ROOT_ELEMENT_NAME.equals(rootLocalName)) {
            throw new L5xInvalidFormatException(rootLocalName, ROOT_ELEMENT_NAME);
        }
        log.debug("Loaded {} (namespace: '{}')", path, namespace);
        return new L5xDocument(path, root, namespace);
    }

    public Path source() {
        return source;
    }

    public Element root() {
        return root;
    }

    /**
     * 根元素上检测到的命名空间 URI；未声明时为空串。
     */
    public String namespace() {
        return namespace;
    }

    public Element find(String path) {
        return find(path, root);
    }

    public Element find(String path, Element context) {
        List<Element> matches = findAll(path, context);
        return matches.isEmpty() ? null : matches.get(0);
    }

    public List<Element> findAll(String path) {
        return findAll(path, root);
    }

    /**
     * 按路径逐级匹配直接子元素，结果保持文档顺序。
     */
    public List<Element> findAll(String path, Element context) {
        Element start = context == null ? root : context;
        List<Element> current = List.of(start);
        for (String segment : path.split("/")) {
            List<Element> next = new ArrayList<>();
            for (Element parent : current) {
                collectChildren(parent, segment, next);
            }
            if (next.isEmpty()) {
                return List.of();
            }
            current = next;
        }
        return current;
    }

    /**
     * 读取子元素 {@code Description} 的文本：去掉首尾空白，并把换行压平为空格；不存在时返回空串。
     */
    public String description(Element element) {
        if (element == null) {
            return "";
        }
        Element description = find("Description", element);
        if (description == null) {
            return "";
        }
        return text(description).strip().replace("\n", " ");
    }

    /**
     * 元素自身的文本（文本节点 + CDATA），原样返回，不做 trim；元素为 null 时返回空串。
     */
    public String text(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            short type = child.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                sb.append(child.getNodeValue());
            }
        }
        return sb.toString();
    }

    /**
     * 按源文件中的书写顺序读取路径上第一个匹配元素的全部属性（不含 xmlns 声明）；未匹配时返回空 Map。
     * <p>
     * DOM 的 {@link org.w3c.dom.NamedNodeMap} 按属性名排序，丢失了原始顺序，这里用 StAX 重新扫描源文件。
     * 路径规则与 {@link #findAll(String)} 相同：从根元素开始逐级匹配直接子元素。
     */
    public Map<String, String> attributesInSourceOrder(String path) {
        String[] segments = path.split("/");
        Map<String, String> attributes = new LinkedHashMap<>();
        try (InputStream in = Files.newInputStream(source)) {
            XMLStreamReader reader = newInputFactory().createXMLStreamReader(in);
            try {
                int depth = -1;
                int matched = 0;
                while (reader.hasNext()) {
                    int event = reader.next();
                    if (event == XMLStreamConstants.START_ELEMENT) {
                        depth++;
                        if (depth > 0 && depth == matched + 1 && matches(reader, segments[matched])) {
                            matched++;
                            if (matched == segments.length) {
                                for (int i = 0; i < reader.getAttributeCount(); i++) {
                                    attributes.put(attributeName(reader, i), reader.getAttributeValue(i));
                                }
                                return attributes;
                            }
                        }
                    } else if (event == XMLStreamConstants.END_ELEMENT) {
                        // 离开已匹配的那一级
                        if (depth > 0 && depth == matched) {
                            matched--;
                        }
                        depth--;
                    }
                }
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new L5xParseException(e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
        return attributes;
    }

    public static String attribute(Element element, String name, String defaultValue) {
        if (element == null || !element.hasAttribute(name)) {
            return defaultValue;
        }
        return element.getAttribute(name);
    }

    public static boolean booleanAttribute(Element element, String name, boolean defaultValue) {
        if (element == null || !element.hasAttribute(name)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(element.getAttribute(name).trim());
    }

    private void collectChildren(Element parent, String localName, List<Element> out) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && matches((Element) child, localName)) {
                out.add((Element) child);
            }
        }
    }

    private boolean matches(Element element, String localName) {
        if (!localName.equals(localName(element))) {
            return false;
        }
        String elementNamespace = element.getNamespaceURI();
        if (namespace.isEmpty()) {
            return elementNamespace == null || elementNamespace.isEmpty();
        }
        return namespace.equals(elementNamespace);
    }

    private boolean matches(XMLStreamReader reader, String localName) {
        if (!localName.equals(reader.getLocalName())) {
            return false;
        }
        String elementNamespace = reader.getNamespaceURI();
        if (namespace.isEmpty()) {
            return elementNamespace == null || elementNamespace.isEmpty();
        }
        return namespace.equals(elementNamespace);
    }

    private static String attributeName(XMLStreamReader reader, int index) {
        String prefix = reader.getAttributePrefix(index);
        String local = reader.getAttributeLocalName(index);
        return prefix == null || prefix.isEmpty() ? local : prefix + ":" + local;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
    }

    private static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        return factory;
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            // 关闭 DTD 与外部实体
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

            DocumentBuilder builder = factory.newDocumentBuilder();
            // 默认的 ErrorHandler 会先把 [Fatal Error] 打印到 stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("当前运行环境的 XML 解析器不支持所需的安全特性", e);
        }
    }
}
