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

import org.tarik.uitree.model.ScreenSize;
import org.tarik.uitree.model.UiNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Removes the nodes which carry no information for the agent and promotes their children to the nearest kept
 * ancestor, keeping the document order of all the survivors.
 */
public class TreePruner {
    private static final Predicate<UiNode> NO_VISIBILITY_FILTER = node -> true;

    /**
     * Creates a visibility predicate which keeps only the nodes covering at least one pixel of the given screen. Nodes
     * without parsable bounds are considered invisible.
     */
    public static Predicate<UiNode> visibleOn(ScreenSize screenSize) {
        requireNonNull(screenSize);
        return node -> node.getBounds()
                .map(bounds -> bounds.isVisibleOn(screenSize))
                .orElse(false);
    }

    public static Predicate<UiNode> noVisibilityFilter() {
        return NO_VISIBILITY_FILTER;
    }

    /**
     * Prunes every child of the root while keeping the root itself, which is only a container of the whole screen.
     *
     * @return a copy of the root with the pruned children
     */
    public UiNode pruneChildren(UiNode root, Predicate<UiNode> visibility) {
        return root.withChildren(pruneAll(root.children(), visibility));
    }

    /**
     * Prunes the given node bottom-up.
     *
     * @return a single-element list with the (cleaned) node if it's kept, otherwise the list of its pruned children which
     * are to be promoted into the node's position
     */
    public List<UiNode> prune(UiNode node, Predicate<UiNode> visibility) {
        var cleanedNode = node.withChildren(pruneAll(node.children(), visibility));

        if (!visibility.test(cleanedNode)) {
            return cleanedNode.children();
        }

        if (cleanedNode.isSemanticallyImportant() || cleanedNode.isInteractive() || cleanedNode.hasChildren()) {
            return List.of(cleanedNode);
        } else {
            return cleanedNode.children();
        }
    }

    private List<UiNode> pruneAll(List<UiNode> nodes, Predicate<UiNode> visibility) {
        List<UiNode> result = new ArrayList<>();
        nodes.forEach(child -> result.addAll(prune(child, visibility)));
        return result;
    }
}
