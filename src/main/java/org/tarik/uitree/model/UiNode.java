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
package org.tarik.uitree.model;

import org.jetbrains.annotations.NotNull;
import org.tarik.uitree.EngineConfig;

import java.util.*;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static org.tarik.uitree.model.UiNode.Attribute.*;
import static org.tarik.uitree.utils.CommonUtils.isNotBlank;

/**
 * A single node of an accessibility hierarchy dump. Both the attributes (kept in document order) and the children are
 * immutable snapshots, so pruning produces new nodes via {@link #withChildren(List)} instead of re-parenting existing ones.
 */
public record UiNode(Map<String, String> attributes, List<UiNode> children) {
    private static final String TRUE = "true";
    private static final String FALSE = "false";
    private static final String IDENTITY_KEY_DELIMITER = "|";
    private static final List<Attribute> SUMMARY_FLAGS = List.of(CHECKABLE, CHECKED, CLICKABLE, ENABLED, FOCUSABLE, FOCUSED,
            SCROLLABLE, LONG_CLICKABLE, SELECTED);
    private static final List<Attribute> INTERACTION_FLAGS = List.of(CLICKABLE, LONG_CLICKABLE, CHECKABLE, SCROLLABLE, FOCUSABLE);

    public enum Attribute {
        TEXT("text"),
        CONTENT_DESC("content-desc"),
        RESOURCE_ID("resource-id"),
        CLASS("class"),
        BOUNDS("bounds"),
        CHECKABLE("checkable"),
        CHECKED("checked"),
        CLICKABLE("clickable"),
        ENABLED("enabled"),
        FOCUSABLE("focusable"),
        FOCUSED("focused"),
        SCROLLABLE("scrollable"),
        LONG_CLICKABLE("long-clickable"),
        SELECTED("selected"),
        PASSWORD("password");

        private final String xmlName;

        Attribute(String xmlName) {
            this.xmlName = xmlName;
        }

        public String xmlName() {
            return xmlName;
        }
    }

    public UiNode {
        attributes = unmodifiableMap(new LinkedHashMap<>(requireNonNull(attributes)));
        children = List.copyOf(requireNonNull(children));
    }

    public static UiNode leaf(Map<String, String> attributes) {
        return new UiNode(attributes, List.of());
    }

    public UiNode withChildren(List<UiNode> newChildren) {
        return new UiNode(attributes, newChildren);
    }

    public String getAttribute(Attribute attribute) {
        return attributes.getOrDefault(attribute.xmlName(), "");
    }

    public boolean isTrue(Attribute attribute) {
        return TRUE.equals(attributes.get(attribute.xmlName()));
    }

    /**
     * @return the non-blank {@code text} attribute, falling back to a non-blank {@code content-desc}, or an empty string
     */
    public String getVisibleText() {
        var text = getAttribute(TEXT);
        if (isNotBlank(text)) {
            return text;
        }
        var contentDescription = getAttribute(CONTENT_DESC);
        return isNotBlank(contentDescription) ? contentDescription : "";
    }

    public String getResourceId() {
        return getAttribute(RESOURCE_ID);
    }

    public String getClassName() {
        return getAttribute(CLASS);
    }

    public Optional<Bounds> getBounds() {
        return Bounds.parse(attributes.get(BOUNDS.xmlName()));
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean isSemanticallyImportant() {
        return isNotBlank(getResourceId()) || isNotBlank(getAttribute(TEXT)) || isNotBlank(getAttribute(CONTENT_DESC));
    }

    public boolean isInteractive() {
        if (FALSE.equals(attributes.get(ENABLED.xmlName()))) {
            return false;
        }
        return INTERACTION_FLAGS.stream().anyMatch(this::isTrue)
                || EngineConfig.getEditableTextClasses().contains(getClassName())
                || isTrue(PASSWORD);
    }

    /**
     * The key used to recognize the same element across two snapshots of the screen: visible text, resource ID and
     * class name joined with {@code |}.
     */
    public String getIdentityKey() {
        return String.join(IDENTITY_KEY_DELIMITER, getVisibleText(), getResourceId(), getClassName());
    }

    /**
     * @return e.g. "This element is clickable, enabled, long clickable." or an empty string if none of the state flags
     * is set
     */
    public String getTrueFlagsSummary() {
        var trueFlags = SUMMARY_FLAGS.stream()
                .filter(this::isTrue)
                .map(flag -> flag.xmlName().replace("-", " "))
                .collect(joining(", "));
        return trueFlags.isEmpty() ? "" : "This element is %s.".formatted(trueFlags);
    }

    @NotNull
    @Override
    public String toString() {
        return new StringJoiner(", ", UiNode.class.getSimpleName() + "[", "]")
                .add("text='" + getVisibleText() + "'")
                .add("id='" + getResourceId() + "'")
                .add("bounds='" + getAttribute(BOUNDS) + "'")
                .add("children=" + children.size())
                .toString();
    }
}
