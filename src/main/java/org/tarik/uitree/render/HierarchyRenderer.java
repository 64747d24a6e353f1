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

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uitree.model.UiNode;

import java.util.Set;

import static java.util.Objects.requireNonNull;
import static org.tarik.uitree.render.ElementFormatter.*;
import static org.tarik.uitree.utils.CommonUtils.isNotBlank;

/**
 * Renders a pruned UI tree into the compact text given to the model. Rules:
 * <ul>
 *     <li>only interactive elements get a numeric index like {@code [1]}, assigned in document order;</li>
 *     <li>each nesting level is indented with one tab;</li>
 *     <li>elements which weren't present in the previous snapshot are prefixed with {@code * };</li>
 *     <li>non-interactive elements are shown only if they have visible text.</li>
 * </ul>
 * The renderer keeps no state between calls, all per-call data is returned in the {@link RenderResult}.
 */
public class HierarchyRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(HierarchyRenderer.class);
    private static final String INDENT = "\t";
    private static final String LINE_SEPARATOR = "\n";

    public RenderResult render(UiNode prunedRoot, @Nullable Set<String> previousNodeKeys) {
        requireNonNull(prunedRoot);
        var context = new RenderContext(previousNodeKeys == null ? Set.of() : previousNodeKeys);
        prunedRoot.children().forEach(child -> renderNode(child, 0, context));

        var elementMap = context.elementMapBuilder.build();
        LOG.debug("Rendered {} interactive element(s) out of {} top-level node(s)", elementMap.size(),
                prunedRoot.children().size());
        return new RenderResult(context.output.toString(), elementMap, prunedRoot);
    }

    private void renderNode(UiNode node, int depth, RenderContext context) {
        var indent = INDENT.repeat(depth);
        var isNew = node.isSemanticallyImportant() && !context.previousNodeKeys.contains(node.getIdentityKey());

        if (node.isInteractive()) {
            int index = context.elementMapBuilder.add(node);
            context.output.append(indent)
                    .append(newElementMarker(isNew))
                    .append('[').append(index).append("] ")
                    .append(describe(node))
                    .append(LINE_SEPARATOR);
        } else {
            var text = node.getVisibleText();
            if (isNotBlank(text)) {
                context.output.append(indent)
                        .append(newElementMarker(isNew))
                        .append(toSingleLine(text))
                        .append(LINE_SEPARATOR);
            }
        }

        node.children().forEach(child -> renderNode(child, depth + 1, context));
    }

    private static final class RenderContext {
        private final Set<String> previousNodeKeys;
        private final StringBuilder output = new StringBuilder();
        private final ElementMap.Builder elementMapBuilder = new ElementMap.Builder();

        private RenderContext(Set<String> previousNodeKeys) {
            this.previousNodeKeys = previousNodeKeys;
        }
    }
}
