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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;
import static org.tarik.uitree.utils.CommonUtils.isBlank;

/**
 * What the capturing side delivers for one screen: the hierarchy dump, the screen size and how much content is
 * scrolled out of view above and below.
 */
public record RawScreenData(String xml, int pixelsAbove, int pixelsBelow, int screenWidth, int screenHeight) {
    private static final Logger LOG = LoggerFactory.getLogger(RawScreenData.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final String UNAVAILABLE_SERVICE_XML = "<hierarchy error=\"service not available\"/>";

    /**
     * Substitute data used when the accessibility service couldn't deliver anything; it renders as an empty screen.
     */
    public static RawScreenData unavailable() {
        return new RawScreenData(UNAVAILABLE_SERVICE_XML, 0, 0, 0, 0);
    }

    public static Optional<RawScreenData> fromJson(String json) {
        if (isBlank(json)) {
            return empty();
        }
        try {
            var data = OBJECT_MAPPER.readValue(json, RawScreenData.class);
            if (data == null || data.xml() == null) {
                LOG.warn("Received raw screen data without the hierarchy dump");
                return empty();
            }
            return of(data);
        } catch (JsonProcessingException e) {
            LOG.error("Couldn't deserialize raw screen data from JSON", e);
            return empty();
        }
    }
}
