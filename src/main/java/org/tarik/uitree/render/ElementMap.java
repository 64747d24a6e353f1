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
import org.tarik.uitree.model.Bounds;
import org.tarik.uitree.model.Coordinates;
import org.tarik.uitree.model.UiNode;

import java.util.*;

import static java.util.Collections.unmodifiableMap;
import static java.util.Optional.ofNullable;

/**
 * Maps the numeric indices of interactive elements, as they appear in the rendered UI text (e.g. {@code [3]}), back
 * to the rendered nodes. An instance belongs to exactly one render call and is never updated afterward.
 */
public final class ElementMap {
    private static final ElementMap EMPTY = new ElementMap(Map.of());

    private final Map<Integer, UiNode> nodesByIndex;

    private ElementMap(Map<Integer, UiNode> nodesByIndex) {
        this.nodesByIndex = nodesByIndex;
    }

    public static ElementMap empty() {
        return EMPTY;
    }

    public Optional<UiNode> getNode(int index) {
        return ofNullable(nodesByIndex.get(index));
    }

    /**
     * @return the center of the element's bounds, or empty if the index is unknown or the element has no valid bounds
     */
    public Optional<Coordinates> getCenter(int index) {
        return getNode(index)
                .flatMap(UiNode::getBounds)
                .map(Bounds::center);
    }

    /**
     * @return a one-line description of the element, suitable for recording which element was acted upon
     */
    public Optional<String> describe(int index) {
        return getNode(index).map(ElementFormatter::describe);
    }

    public Map<Integer, UiNode> asMap() {
        return nodesByIndex;
    }

    public int size() {
        return nodesByIndex.size();
    }

    public boolean isEmpty() {
        return nodesByIndex.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        var that = (ElementMap) obj;
        return Objects.equals(this.nodesByIndex, that.nodesByIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodesByIndex);
    }

    @NotNull
    @Override
    public String toString() {
        return new StringJoiner(", ", ElementMap.class.getSimpleName() + "[", "]")
                .add("size=" + nodesByIndex.size())
                .toString();
    }

    /**
     * Assigns sequential indices starting with 1 in the order the nodes are added.
     */
    static final class Builder {
        private final Map<Integer, UiNode> nodesByIndex = new LinkedHashMap<>();

        int add(UiNode node) {
            int index = nodesByIndex.size() + 1;
            nodesByIndex.put(index, node);
            return index;
        }

        ElementMap build() {
            return nodesByIndex.isEmpty() ? EMPTY : new ElementMap(unmodifiableMap(new LinkedHashMap<>(nodesByIndex)));
        }
    }
}
