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
package org.tarik.uitree;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uitree.model.Coordinates;
import org.tarik.uitree.model.ScreenSize;
import org.tarik.uitree.model.UiNode;
import org.tarik.uitree.parser.TreePruner;
import org.tarik.uitree.parser.UiTreeBuilder;
import org.tarik.uitree.render.ElementMap;
import org.tarik.uitree.render.HierarchyRenderer;
import org.tarik.uitree.render.LegacyXmlWriter;
import org.tarik.uitree.render.RenderResult;

import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.uitree.parser.TreePruner.noVisibilityFilter;
import static org.tarik.uitree.parser.TreePruner.visibleOn;
import static org.tarik.uitree.render.LegacyXmlWriter.EMPTY_HIERARCHY;

/**
 * Turns a raw accessibility hierarchy dump into the compact, indexed UI representation consumed by the agent, and
 * resolves the indices of that representation back to tap coordinates.
 * <p>
 * An instance remembers the element map of its latest {@link #render} call, which is what {@link #resolveCenter(int)}
 * works with. A new render call replaces it. Instances are therefore not meant to be shared between concurrently
 * running perception cycles; use one instance per cycle or serialize the calls.
 */
public class SemanticParser {
    private static final Logger LOG = LoggerFactory.getLogger(SemanticParser.class);
    private static final boolean DEBUG_MODE = EngineConfig.isDebugMode();

    private final UiTreeBuilder treeBuilder;
    private final TreePruner treePruner;
    private final HierarchyRenderer renderer;
    private final LegacyXmlWriter legacyXmlWriter;
    private ElementMap latestElementMap = ElementMap.empty();
    private ScreenSize latestScreenSize;

    public SemanticParser() {
        this(new UiTreeBuilder(), new TreePruner(), new HierarchyRenderer(), new LegacyXmlWriter());
    }

    SemanticParser(UiTreeBuilder treeBuilder, TreePruner treePruner, HierarchyRenderer renderer, LegacyXmlWriter legacyXmlWriter) {
        this.treeBuilder = treeBuilder;
        this.treePruner = treePruner;
        this.renderer = renderer;
        this.legacyXmlWriter = legacyXmlWriter;
    }

    /**
     * Parses, prunes and renders the hierarchy dump.
     *
     * @param xml              the raw hierarchy dump
     * @param previousNodeKeys identity keys ({@code text|resource-id|class}) of the elements seen in the previous
     *                         snapshot; the elements missing there get marked as new. Null is treated as an empty set.
     * @param screenWidth      the device screen width in pixels
     * @param screenHeight     the device screen height in pixels
     * @return the rendered text with its element map, or an empty result if the dump couldn't be parsed or the screen
     * size is negative
     */
    public RenderResult render(String xml, @Nullable Set<String> previousNodeKeys, int screenWidth, int screenHeight) {
        checkNotNull(xml, "Hierarchy dump must not be null");
        latestElementMap = ElementMap.empty();
        if (!isValidScreenSize(screenWidth, screenHeight)) {
            return RenderResult.empty();
        }
        var screenSize = new ScreenSize(screenWidth, screenHeight);
        latestScreenSize = screenSize;

        var result = treeBuilder.buildTree(xml)
                .map(root -> pruneAndLogStatistics(root, visibleOn(screenSize)))
                .map(prunedRoot -> renderer.render(prunedRoot, previousNodeKeys))
                .orElseGet(RenderResult::empty);
        latestElementMap = result.elementMap();

        if (DEBUG_MODE) {
            LOG.info("Rendered UI for the screen {}x{}:\n{}", screenWidth, screenHeight, result.text());
        }
        return result;
    }

    /**
     * @param elementIndex the index of an interactive element as it appears in the latest rendered text
     * @return the center of the element's bounds, or empty if the latest render call produced no such element or its
     * bounds are unknown
     */
    public Optional<Coordinates> resolveCenter(int elementIndex) {
        var center = latestElementMap.getCenter(elementIndex);
        if (center.isEmpty()) {
            LOG.debug("Element with index {} is either not present in the latest rendered UI or has no valid bounds", elementIndex);
        }
        return center;
    }

    /**
     * @return the element map of the latest render call, empty before the first call
     */
    public ElementMap getLatestElementMap() {
        return latestElementMap;
    }

    /**
     * Filters the hierarchy dump and writes the surviving nodes back as XML with all their original attributes. The
     * visibility filter uses the screen size of the latest render call; without any previous render call only
     * uninformative nodes are removed.
     */
    public String legacyFilter(String xml) {
        var visibility = latestScreenSize == null ? noVisibilityFilter() : visibleOn(latestScreenSize);
        return legacyFilter(xml, visibility);
    }

    public String legacyFilter(String xml, int screenWidth, int screenHeight) {
        checkNotNull(xml, "Hierarchy dump must not be null");
        if (!isValidScreenSize(screenWidth, screenHeight)) {
            return EMPTY_HIERARCHY;
        }
        return legacyFilter(xml, visibleOn(new ScreenSize(screenWidth, screenHeight)));
    }

    private String legacyFilter(String xml, Predicate<UiNode> visibility) {
        checkNotNull(xml, "Hierarchy dump must not be null");
        return treeBuilder.buildTree(xml)
                .map(root -> pruneAndLogStatistics(root, visibility))
                .map(legacyXmlWriter::write)
                .orElse(EMPTY_HIERARCHY);
    }

    private static boolean isValidScreenSize(int screenWidth, int screenHeight) {
        if (screenWidth < 0 || screenHeight < 0) {
            LOG.warn("Got invalid screen size {}x{}, nothing on the screen can be visible", screenWidth, screenHeight);
            return false;
        }
        return true;
    }

    private UiNode pruneAndLogStatistics(UiNode root, Predicate<UiNode> visibility) {
        var prunedRoot = treePruner.pruneChildren(root, visibility);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Pruned UI tree from {} to {} node(s)", countNodes(root), countNodes(prunedRoot));
        }
        return prunedRoot;
    }

    private static int countNodes(UiNode node) {
        return 1 + node.children().stream().mapToInt(SemanticParser::countNodes).sum();
    }
}
