package com.myorg.choirsplit.service.processing;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Small DOM helpers. All list-returning methods hand out snapshots, so callers may
 * remove or insert nodes while iterating.
 */
public final class XmlNodes {

    private XmlNodes() {}

    public static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e) out.add(e);
        }
        return out;
    }

    public static List<Element> children(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element e : childElements(parent)) {
            if (tag.equals(e.getTagName())) out.add(e);
        }
        return out;
    }

    public static Element child(Element parent, String tag) {
        if (parent == null) return null;
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && tag.equals(e.getTagName())) return e;
        }
        return null;
    }

    public static List<Element> descendants(Element root, String tag) {
        List<Element> out = new ArrayList<>();
        if (root == null) return out;
        NodeList nodes = root.getElementsByTagName(tag);
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add((Element) nodes.item(i));
        }
        return out;
    }

    public static Element firstDescendant(Element root, String tag) {
        if (root == null) return null;
        NodeList nodes = root.getElementsByTagName(tag);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    /** Trimmed text content, or null for a missing element. */
    public static String text(Element e) {
        return e == null ? null : e.getTextContent().trim();
    }

    public static String childText(Element parent, String tag) {
        return text(child(parent, tag));
    }

    public static Integer childInt(Element parent, String tag) {
        String raw = childText(parent, tag);
        if (raw == null || raw.isEmpty()) return null;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    /** Sets the text of {@code parent/tag}, appending the child when it does not exist yet. */
    public static Element setChildText(Element parent, String tag, String value) {
        Element c = child(parent, tag);
        if (c == null) {
            c = parent.getOwnerDocument().createElement(tag);
            parent.appendChild(c);
        }
        c.setTextContent(value);
        return c;
    }

    public static Element appendTextElement(Element parent, String tag, String value) {
        Element c = parent.getOwnerDocument().createElement(tag);
        c.setTextContent(value);
        parent.appendChild(c);
        return c;
    }

    public static Element deepCopy(Element e) {
        return (Element) e.cloneNode(true);
    }

    public static void insertAfter(Node newNode, Node reference) {
        reference.getParentNode().insertBefore(newNode, reference.getNextSibling());
    }

    public static void remove(Node n) {
        if (n != null && n.getParentNode() != null) {
            n.getParentNode().removeChild(n);
        }
    }

    public static void removeAll(List<? extends Node> nodes) {
        for (Node n : nodes) remove(n);
    }

    /** Staff id attribute as int, -1 when absent or not a number. */
    public static int staffId(Element staff) {
        String raw = staff.getAttribute("id");
        if (raw == null || raw.isBlank()) return -1;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return -1;
        }
    }

    public static boolean hasChild(Element parent, String tag) {
        return child(parent, tag) != null;
    }
}
