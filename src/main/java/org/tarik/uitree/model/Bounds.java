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
package org.tarik.uitree.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Optional.empty;
import static org.tarik.uitree.utils.CommonUtils.isBlank;
import static org.tarik.uitree.utils.CommonUtils.parseStringAsInteger;

/**
 * The on-screen pixel rectangle of a UI node, as reported by the accessibility layer in the {@code bounds} attribute,
 * e.g. {@code [0,63][1080,210]}. The right and bottom edges are exclusive.
 */
public record Bounds(int left, int top, int right, int bottom) {
    private static final Pattern BOUNDS_PATTERN = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");
    private static final String BOUNDS_FORMAT = "[%d,%d][%d,%d]";

    /**
     * Parses the value of a {@code bounds} attribute. The whole value must match {@code [left,top][right,bottom]}, any
     * surrounding whitespace, sign other than minus or out-of-range number makes it unparsable.
     *
     * @param boundsValue the raw attribute value, may be null
     * @return parsed bounds or empty if the value is absent or malformed
     */
    public static Optional<Bounds> parse(@Nullable String boundsValue) {
        if (isBlank(boundsValue)) {
            return empty();
        }
        var matcher = BOUNDS_PATTERN.matcher(boundsValue);
        if (!matcher.matches()) {
            return empty();
        }

        var left = parseStringAsInteger(matcher.group(1));
        var top = parseStringAsInteger(matcher.group(2));
        var right = parseStringAsInteger(matcher.group(3));
        var bottom = parseStringAsInteger(matcher.group(4));
        if (left.isEmpty() || top.isEmpty() || right.isEmpty() || bottom.isEmpty()) {
            return empty();
        }
        return Optional.of(new Bounds(left.get(), top.get(), right.get(), bottom.get()));
    }

    public String format() {
        return BOUNDS_FORMAT.formatted(left, top, right, bottom);
    }

    public Coordinates center() {
        return new Coordinates((int) Math.floorDiv((long) left + right, 2), (int) Math.floorDiv((long) top + bottom, 2));
    }

    /**
     * A node is visible if it covers at least one pixel of the {@code [0,width) x [0,height)} screen area.
     */
    public boolean isVisibleOn(@NotNull ScreenSize screenSize) {
        return !(right <= 0 || left >= screenSize.width() || bottom <= 0 || top >= screenSize.height());
    }

    @NotNull
    @Override
    public String toString() {
        return format();
    }
}
