package com.example.llmexplorer.fingerprint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * 把 uiautomator dump 出来的 XML 解析成 UiSnapshot
 *
 * 顶层的 hierarchy 元素变成一个合成根节点，所有 node 元素挂在它下面
 */
@Slf4j
@Component
public class UiHierarchyXmlParser {

    public static final String ROOT_CLASS = "hierarchy";

    private static final Set<String> KNOWN_ATTRIBUTES = Set.of(
            "class", "resource-id", "text", "content-desc", "package", "bounds",
            "clickable", "long-clickable", "checkable", "checked", "scrollable",
            "enabled", "focused", "selected", "password", "focusable");

    public UiSnapshot parse(String xml, String screenName) {
        if (xml == null || xml.isBlank()) {
            throw new CaptureException("uiautomator dump 为空");
        }

        SAXParser parser;
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            parser = factory.newSAXParser();
        } catch (ParserConfigurationException | SAXException e) {
            throw new CaptureException("无法创建 XML 解析器", e);
        }

        HierarchyHandler handler = new HierarchyHandler();
        try {
            parser.parse(new InputSource(new StringReader(xml)), handler);
        } catch (SAXException | IOException e) {
            log.warn("[Fingerprint] uiautomator dump 解析失败: {}", e.getMessage());
            throw new CaptureException("uiautomator dump 不是合法的 XML", e);
        }

        if (handler.root.getChildren().isEmpty()) {
            throw new CaptureException("uiautomator dump 中没有任何节点");
        }

        return UiSnapshot.builder()
                .screenName(screenName)
                .packageName(handler.firstPackage)
                .root(handler.root)
                .capturedAt(Instant.now())
                .build();
    }

    private static class HierarchyHandler extends DefaultHandler {

        private final UiElementNode root = UiElementNode.builder().className(ROOT_CLASS).build();
        private final Deque<UiElementNode> open = new ArrayDeque<>();
        private String firstPackage;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            if (!"node".equals(qName)) {
                return;
            }
            UiElementNode node = toNode(attributes);
            if (firstPackage == null && node.getPackageName() != null) {
                firstPackage = node.getPackageName();
            }
            UiElementNode parent = open.isEmpty() ? root : open.peek();
            parent.addChild(node);
            open.push(node);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            if ("node".equals(qName) && !open.isEmpty()) {
                open.pop();
            }
        }

        private UiElementNode toNode(Attributes attributes) {
            UiElementNode node = UiElementNode.builder()
                    .className(attributes.getValue("class"))
                    .resourceId(emptyToNull(attributes.getValue("resource-id")))
                    .text(emptyToNull(attributes.getValue("text")))
                    .contentDesc(emptyToNull(attributes.getValue("content-desc")))
                    .packageName(emptyToNull(attributes.getValue("package")))
                    .bounds(Bounds.parse(attributes.getValue("bounds")))
                    .clickable(flag(attributes, "clickable"))
                    .longClickable(flag(attributes, "long-clickable"))
                    .checkable(flag(attributes, "checkable"))
                    .checked(flag(attributes, "checked"))
                    .scrollable(flag(attributes, "scrollable"))
                    .enabled(attributes.getValue("enabled") == null || flag(attributes, "enabled"))
                    .focused(flag(attributes, "focused"))
                    .selected(flag(attributes, "selected"))
                    .password(flag(attributes, "password"))
                    .build();
            for (int i = 0; i < attributes.getLength(); i++) {
                String name = attributes.getQName(i);
                if (!KNOWN_ATTRIBUTES.contains(name)) {
                    node.getExtras().put(name, attributes.getValue(i));
                }
            }
            return node;
        }

        private static boolean flag(Attributes attributes, String name) {
            return "true".equalsIgnoreCase(attributes.getValue(name));
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
