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

import org.tarik.uitree.EngineConfig;
import org.tarik.uitree.model.UiNode;

import static org.tarik.uitree.utils.CommonUtils.removePrefix;

/**
 * Formats single elements the way they appear in the rendered UI text.
 */
public class ElementFormatter {
    private static final String NEW_ELEMENT_MARKER = "* ";
    private static final String ELEMENT_DESCRIPTION_FORMAT = "text:\"%s\" <%s> <%s> <%s>";

    /**
     * @return the description of an interactive element without its index, e.g.
     * {@code text:"Login" <com.app:id/login> <This element is clickable, enabled.> <widget.Button>}
     */
    public static String describe(UiNode node) {
        return ELEMENT_DESCRIPTION_FORMAT.formatted(toSingleLine(node.getVisibleText()), node.getResourceId(),
                node.getTrueFlagsSummary(), getShortClassName(node));
    }

    public static String getShortClassName(UiNode node) {
        return removePrefix(node.getClassName(), EngineConfig.getClassNameStripPrefix());
    }

    static String toSingleLine(String text) {
        return text.replace('\n', ' ');
    }

    static String newElementMarker(boolean isNew) {
        return isNew ? NEW_ELEMENT_MARKER : "";
    }
}
