/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.uitree.render;

import com.google.common.escape.Escaper;
import org.tarik.uitree.model.UiNode;

import java.util.Map;

import static com.google.common.xml.XmlEscapers.xmlAttributeEscaper;

/**
 * Writes a (pruned) UI tree back as a hierarchy dump which keeps all original attributes of the surviving nodes. The
 * attributes of the root node are written onto the {@code hierarchy} container element.
 */
public class LegacyXmlWriter {
    public static final String EMPTY_HIERARCHY = "<hierarchy/>";
    private static final String ROOT_ELEMENT_NAME = "hierarchy";
    private static final String NODE_ELEMENT_NAME = "node";
    private static final String INDENT = "  ";
    private static final String LINE_SEPARATOR = "\n";
    private static final Escaper ATTRIBUTE_ESCAPER = xmlAttributeEscaper();

    public String write(UiNode root) {
        var builder = new StringBuilder();
        builder.append('<').append(ROOT_ELEMENT_NAME);
        appendAttributes(root.attributes(), builder);
        builder.append('>').append(LINE_SEPARATOR);

        root.children().forEach(child -> writeNode(child, builder, 1));

        builder.append("</").append(ROOT_ELEMENT_NAME).append('>').append(LINE_SEPARATOR);
        return builder.toString();
    }

    private void writeNode(UiNode node, StringBuilder builder, int depth) {
        var indent = INDENT.repeat(depth);
        builder.append(indent).append('<').append(NODE_ELEMENT_NAME);
        appendAttributes(node.attributes(), builder);

        if (node.children().isEmpty()) {
            builder.append("/>").append(LINE_SEPARATOR);
        } else {
            builder.append('>').append(LINE_SEPARATOR);
            node.children().forEach(child -> writeNode(child, builder, depth + 1));
            builder.append(indent).append("</").append(NODE_ELEMENT_NAME).append('>').append(LINE_SEPARATOR);
        }
    }

    private static void appendAttributes(Map<String, String> attributes, StringBuilder builder) {
        attributes.forEach((name, value) -> builder.append(' ')
                .append(name)
                .append("=\"")
                .append(ATTRIBUTE_ESCAPER.escape(value))
                .append('"'));
    }
}
