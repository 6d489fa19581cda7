/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.exceptions.MalformedInputException;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reading helpers over DOM elements. Only direct children are ever looked at
 */
final class XmlElements {

    private XmlElements() {}

    static List<Element> children(Element parent) {
        List<Element> output = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE)
                output.add((Element) node);
        }
        return output;
    }

    static List<Element> children(Element parent, String tag) {
        List<Element> output = new ArrayList<>();
        for (Element child : children(parent)) {
            if (child.getTagName().equals(tag))
                output.add(child);
        }
        return output;
    }

    /**
     * @return the first direct child with the given tag or null
     */
    static Element child(Element parent, String tag) {
        for (Element child : children(parent)) {
            if (child.getTagName().equals(tag))
                return child;
        }
        return null;
    }

    /**
     * @return the trimmed text of the element, null if the element is missing or has no text
     */
    static String text(Element element) {
        if (element == null)
            return null;
        return StringUtils.trimToNull(element.getTextContent());
    }

    static String requireText(Element element, String what) {
        String text = text(element);
        if (text == null)
            throw new MalformedInputException("missing or empty " + what);
        return text;
    }

    static String attribute(Element element, String name, String defaultValue) {
        if (!element.hasAttribute(name))
            return defaultValue;
        return element.getAttribute(name);
    }

    static Integer intAttribute(Element element, String name) {
        String value = attribute(element, name, null);
        return value == null ? null : parseInt(value, name);
    }

    static int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException("invalid " + what + " [" + text + "]", e);
        }
    }

    static BigDecimal parseDecimal(String text, String what) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException("invalid " + what + " [" + text + "]", e);
        }
    }
}
