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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.uitree.model.ScreenSize;
import org.tarik.uitree.model.UiNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.uitree.UiNodeFixtures.*;
import static org.tarik.uitree.parser.TreePruner.noVisibilityFilter;
import static org.tarik.uitree.parser.TreePruner.visibleOn;

class TreePrunerTest {
    private static final Predicate<UiNode> VISIBLE_ON_100_X_200 = visibleOn(new ScreenSize(100, 200));
    private final TreePruner treePruner = new TreePruner();

    @Test
    @DisplayName("Important leaf is kept as is")
    void importantLeafIsKept() {
        var label = label("Title", "[0,0][50,20]");

        assertThat(treePruner.prune(label, VISIBLE_ON_100_X_200)).containsExactly(label);
    }

    @Test
    @DisplayName("Uninformative visible leaf is removed")
    void uninformativeLeafIsRemoved() {
        var divider = UiNode.leaf(attributes("class", "android.view.View", "bounds", "[0,50][100,51]"));

        assertThat(treePruner.prune(divider, VISIBLE_ON_100_X_200)).isEmpty();
    }

    @Test
    @DisplayName("Uninformative container is kept as long as some of its children survive")
    void containerWithSurvivingChildIsKept() {
        // Given
        var button = button("OK", "ok", "[10,10][40,40]");
        var container = container("[0,0][100,100]", button);

        // When
        var result = treePruner.prune(container, VISIBLE_ON_100_X_200);

        // Then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).attributes()).isEqualTo(container.attributes());
        assertThat(result.get(0).children()).containsExactly(button);
    }

    @Test
    @DisplayName("Off-screen node is removed and its children are promoted even if the node itself is important")
    void offScreenNodeChildrenArePromoted() {
        // Given
        var hiddenButton = button("Hidden Button", "", "[5,5][15,15]");
        var offScreenList = node(attributes("resource-id", "list", "bounds", "[-50,-50][-10,-10]"), hiddenButton);

        // When
        var result = treePruner.prune(offScreenList, VISIBLE_ON_100_X_200);

        // Then
        assertThat(result).containsExactly(hiddenButton);
    }

    @Test
    @DisplayName("Node without parsable bounds is treated as invisible")
    void nodeWithoutBoundsIsInvisible() {
        var label = UiNode.leaf(attributes("text", "No bounds"));

        assertThat(treePruner.prune(label, VISIBLE_ON_100_X_200)).isEmpty();
        assertThat(treePruner.prune(label, noVisibilityFilter())).containsExactly(label);
    }

    @Test
    @DisplayName("Promoted nodes take the position of their removed ancestor, keeping the document order")
    void promotionPreservesOrder() {
        // Given
        var first = label("1", "[0,0][10,10]");
        var second = label("2", "[0,10][10,20]");
        var third = label("3", "[0,20][10,30]");
        var fourth = label("4", "[0,30][10,40]");
        var root = container("[0,0][100,200]",
                first,
                node(attributes("bounds", "[0,0][0,0]"),
                        node(attributes("bounds", "[0,0][0,0]"), second),
                        third),
                UiNode.leaf(attributes("bounds", "[0,40][100,41]")),
                fourth);

        // When
        var prunedRoot = treePruner.pruneChildren(root, VISIBLE_ON_100_X_200);

        // Then
        assertThat(prunedRoot.children()).containsExactly(first, second, third, fourth);
        assertThat(prunedRoot.attributes()).isEqualTo(root.attributes());
    }

    @Test
    @DisplayName("Root itself is never pruned, even when it's invisible")
    void rootIsNeverPruned() {
        // Given
        var label = label("Visible", "[0,0][10,10]");
        var root = node(attributes("bounds", "[500,500][600,600]"), label);

        // When
        var prunedRoot = treePruner.pruneChildren(root, VISIBLE_ON_100_X_200);

        // Then
        assertThat(prunedRoot.children()).containsExactly(label);
    }

    @Test
    @DisplayName("Pruning never increases the node count and keeps every visible important node reachable")
    void pruningIsMonotonic() {
        // Given
        var root = container("[0,0][100,200]",
                container("[0,0][100,100]",
                        container("[0,0][50,50]", button("A", "a", "[0,0][10,10]")),
                        UiNode.leaf(attributes("bounds", "[0,60][100,61]"))),
                container("[0,100][100,200]",
                        label("B", "[0,100][50,150]"),
                        container("[-100,0][-1,10]", label("C", "[0,150][50,190]"))));

        // When
        var prunedRoot = treePruner.pruneChildren(root, VISIBLE_ON_100_X_200);

        // Then
        var originalNodes = flatten(root);
        var prunedNodes = flatten(prunedRoot);
        assertThat(prunedNodes.size()).isLessThanOrEqualTo(originalNodes.size());
        assertThat(prunedNodes).extracting(UiNode::getVisibleText)
                .filteredOn(text -> !text.isEmpty())
                .containsExactly("A", "B", "C");
    }

    private static List<UiNode> flatten(UiNode node) {
        List<UiNode> nodes = new ArrayList<>();
        nodes.add(node);
        node.children().forEach(child -> nodes.addAll(flatten(child)));
        return nodes;
    }
}
