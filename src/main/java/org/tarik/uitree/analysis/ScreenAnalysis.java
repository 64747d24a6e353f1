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
package org.tarik.uitree.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.tarik.uitree.render.ElementMap;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static org.tarik.uitree.model.UiNode.Attribute.BOUNDS;

/**
 * A complete analysis of the screen at a single point in time.
 *
 * @param uiRepresentation the LLM-oriented UI text, decorated with the page position markers
 * @param keyboardOpen     true if the software keyboard is likely visible
 * @param activityName     the name of the foreground activity
 * @param elementMap       resolves the {@code [n]} indices of {@code uiRepresentation} back to the elements
 * @param scrollUp         the amount of pixels of content which can be revealed by scrolling up
 * @param scrollDown       the amount of pixels of content which can be revealed by scrolling down
 */
public record ScreenAnalysis(@NotNull String uiRepresentation,
                             boolean keyboardOpen,
                             @NotNull String activityName,
                             @NotNull ElementMap elementMap,
                             int scrollUp,
                             int scrollDown) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public ScreenAnalysis {
        requireNonNull(uiRepresentation);
        requireNonNull(activityName);
        requireNonNull(elementMap);
    }

    /**
     * Serializes the analysis for the agent loop. The element map is reduced to the bounds of each indexed element.
     */
    public String toJson() {
        Map<Integer, String> elementBounds = new LinkedHashMap<>();
        elementMap.asMap().forEach((index, node) -> elementBounds.put(index, node.getAttribute(BOUNDS)));
        var view = new JsonView(uiRepresentation, keyboardOpen, activityName, elementBounds, scrollUp, scrollDown);
        try {
            return OBJECT_MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    record JsonView(String uiRepresentation,
                            boolean keyboardOpen,
                            String activityName,
                            Map<Integer, String> elementBounds,
                            int scrollUp,
                            int scrollDown) {
    }
}
