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

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uitree.EngineConfig;
import org.tarik.uitree.SemanticParser;

import java.util.Set;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;
import static org.tarik.uitree.utils.CommonUtils.isBlank;

/**
 * Combines the rendered UI of a captured screen with the rest of the screen state into a {@link ScreenAnalysis}.
 */
public class ScreenAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(ScreenAnalyzer.class);
    private static final String EMPTY_SCREEN_MESSAGE = "The screen is empty or contains no interactive elements.";
    private static final String CONTENT_ABOVE_TEMPLATE = "... %d pixels above - scroll up to see more ...";
    private static final String CONTENT_BELOW_TEMPLATE = "... %d pixels below - scroll down to see more ...";
    private static final String START_OF_PAGE = "[Start of page]";
    private static final String END_OF_PAGE = "[End of page]";

    private final SemanticParser semanticParser;

    public ScreenAnalyzer(SemanticParser semanticParser) {
        this.semanticParser = requireNonNull(semanticParser);
    }

    /**
     * @param rawData          the captured screen, null if the capturing side couldn't deliver it
     * @param keyboardOpen     whether the software keyboard is shown
     * @param activityName     the foreground activity name
     * @param previousNodeKeys node identity keys of the previous snapshot, used to mark the new elements
     */
    public ScreenAnalysis analyze(@Nullable RawScreenData rawData, boolean keyboardOpen, @Nullable String activityName,
                                  @Nullable Set<String> previousNodeKeys) {
        var screenData = ofNullable(rawData).orElseGet(() -> {
            LOG.warn("No raw screen data available, analyzing an empty screen");
            return RawScreenData.unavailable();
        });

        var renderResult = semanticParser.render(screenData.xml(), previousNodeKeys, screenData.screenWidth(),
                screenData.screenHeight());
        String uiRepresentation;
        if (isBlank(renderResult.text())) {
            uiRepresentation = EMPTY_SCREEN_MESSAGE;
        } else if (EngineConfig.isScrollIndicatorsEnabled()) {
            uiRepresentation = addScrollIndicators(renderResult.text(), screenData);
        } else {
            uiRepresentation = renderResult.text();
        }

        return new ScreenAnalysis(uiRepresentation, keyboardOpen, ofNullable(activityName).orElse(""),
                renderResult.elementMap(), screenData.pixelsAbove(), screenData.pixelsBelow());
    }

    private static String addScrollIndicators(String uiText, RawScreenData screenData) {
        var header = screenData.pixelsAbove() > 0 ? CONTENT_ABOVE_TEMPLATE.formatted(screenData.pixelsAbove()) : START_OF_PAGE;
        var footer = screenData.pixelsBelow() > 0 ? CONTENT_BELOW_TEMPLATE.formatted(screenData.pixelsBelow()) : END_OF_PAGE;
        return "%s\n%s\n%s".formatted(header, uiText, footer);
    }
}
