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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.uitree.model.UiNode;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of rendering one hierarchy dump.
 *
 * @param text       the indented, LLM-oriented representation of the screen, empty if nothing could be rendered
 * @param elementMap the indices of the interactive elements mentioned in {@code text}
 * @param prunedRoot the root of the pruned tree, null if the dump couldn't be parsed
 */
public record RenderResult(@NotNull String text, @NotNull ElementMap elementMap, @Nullable UiNode prunedRoot) {
    private static final RenderResult EMPTY = new RenderResult("", ElementMap.empty(), null);

    public RenderResult {
        requireNonNull(text);
        requireNonNull(elementMap);
    }

    public static RenderResult empty() {
        return EMPTY;
    }

    public Optional<UiNode> getPrunedRoot() {
        return Optional.ofNullable(prunedRoot);
    }

    /**
     * Collects the identity keys of all the nodes which survived pruning, in document order. Passing them as the
     * previous snapshot keys of the next render call makes only the newly appeared elements get marked.
     */
    public Set<String> nodeKeys() {
        Set<String> keys = new LinkedHashSet<>();
        getPrunedRoot().ifPresent(root -> root.children().forEach(child -> collectKeys(child, keys)));
        return unmodifiableSet(keys);
    }

    private static void collectKeys(UiNode node, Set<String> keys) {
        keys.add(node.getIdentityKey());
        node.children().forEach(child -> collectKeys(child, keys));
    }
}
