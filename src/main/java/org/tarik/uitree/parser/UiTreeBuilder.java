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
package org.tarik.uitree.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uitree.model.UiNode;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.*;

import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static javax.xml.stream.XMLStreamConstants.END_ELEMENT;
import static javax.xml.stream.XMLStreamConstants.START_ELEMENT;
import static org.tarik.uitree.utils.CommonUtils.isBlank;

/**
 * Builds a {@link UiNode} tree out of an accessibility hierarchy dump using a streaming XML cursor. Only the repeated
 * {@code node} elements become tree nodes, any wrapping container element (usually {@code hierarchy}) is skipped.
 */
public class UiTreeBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(UiTreeBuilder.class);
    private static final String NODE_ELEMENT_NAME = "node";
    private static final char NON_BREAKING_SPACE = '\u00A0';
    private static final XMLInputFactory XML_INPUT_FACTORY = createInputFactory();

    /**
     * @param xml the raw hierarchy dump
     * @return the first {@code node} element with all its descendants, or empty if the dump contains no nodes or is
     * not well-formed
     */
    public Optional<UiNode> buildTree(String xml) {
        if (isBlank(xml)) {
            LOG.warn("Received a blank hierarchy dump, no UI tree can be built");
            return empty();
        }

        var cleanedXml = xml.replace(NON_BREAKING_SPACE, ' ');
        XMLStreamReader reader = null;
        try {
            reader = XML_INPUT_FACTORY.createXMLStreamReader(new StringReader(cleanedXml));
            return ofNullable(readTree(reader)).map(NodeBuilder::build);
        } catch (XMLStreamException | RuntimeException e) {
            LOG.warn("Couldn't parse the hierarchy dump, no UI tree will be built: {}", e.getMessage());
            return empty();
        } finally {
            closeQuietly(reader);
        }
    }

    private static NodeBuilder readTree(XMLStreamReader reader) throws XMLStreamException {
        NodeBuilder root = null;
        Deque<NodeBuilder> nodeStack = new ArrayDeque<>();
        while (reader.hasNext()) {
            int eventType = reader.next();
            if (eventType == START_ELEMENT && NODE_ELEMENT_NAME.equals(reader.getLocalName())) {
                var node = new NodeBuilder(readAttributes(reader));
                if (root == null) {
                    root = node;
                } else if (nodeStack.isEmpty()) {
                    LOG.debug("Skipping a top-level node which follows the already closed root node");
                } else {
                    nodeStack.peekLast().children.add(node);
                }
                nodeStack.addLast(node);
            } else if (eventType == END_ELEMENT && NODE_ELEMENT_NAME.equals(reader.getLocalName())) {
                nodeStack.pollLast();
            }
        }
        return root;
    }

    private static Map<String, String> readAttributes(XMLStreamReader reader) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static XMLInputFactory createInputFactory() {
        var factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        return factory;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader != null) {
            try {
                reader.close();
            } catch (XMLStreamException e) {
                LOG.debug("Couldn't close XML stream reader", e);
            }
        }
    }

    private static final class NodeBuilder {
        private final Map<String, String> attributes;
        private final List<NodeBuilder> children = new ArrayList<>();

        private NodeBuilder(Map<String, String> attributes) {
            this.attributes = attributes;
        }

        private UiNode build() {
            return new UiNode(attributes, children.stream().map(NodeBuilder::build).toList());
        }
    }
}
