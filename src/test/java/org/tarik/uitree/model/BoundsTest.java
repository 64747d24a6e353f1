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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundsTest {
    private static final ScreenSize SCREEN_100_X_100 = new ScreenSize(100, 100);

    @Test
    @DisplayName("Well-formed bounds are parsed and formatted back to the same value")
    void parseAndFormatRoundTrip() {
        // Given
        var rawBounds = "[0,63][1080,210]";

        // When
        var bounds = Bounds.parse(rawBounds);

        // Then
        assertThat(bounds).contains(new Bounds(0, 63, 1080, 210));
        assertThat(bounds.orElseThrow().format()).isEqualTo(rawBounds);
    }

    @Test
    @DisplayName("Negative coordinates of partially off-screen nodes are accepted")
    void parseNegativeCoordinates() {
        assertThat(Bounds.parse("[-10,-10][5,5]")).contains(new Bounds(-10, -10, 5, 5));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            " [0,0][10,10]",
            "[0,0][10,10] ",
            "[0, 0][10,10]",
            "[+1,0][10,10]",
            "[0,0][10]",
            "[a,0][10,10]",
            "0,0,10,10",
            "[0,0][10,10][20,20]",
            "[0,0][99999999999,10]"
    })
    @DisplayName("Anything other than the exact [left,top][right,bottom] form is unparsable")
    void unparsableBounds(String rawBounds) {
        assertThat(Bounds.parse(rawBounds)).isEmpty();
    }

    @Test
    @DisplayName("Center is calculated using integer division")
    void centerUsesIntegerDivision() {
        assertThat(new Bounds(10, 20, 30, 60).center()).isEqualTo(new Coordinates(20, 40));
        assertThat(new Bounds(0, 0, 5, 7).center()).isEqualTo(new Coordinates(2, 3));
    }

    @Test
    @DisplayName("Center of a node spanning negative coordinates is floored")
    void centerIsFlooredForNegativeSums() {
        assertThat(new Bounds(-5, -5, 2, 2).center()).isEqualTo(new Coordinates(-2, -2));
    }

    @ParameterizedTest(name = "{0} on 100x100 -> visible: {1}")
    @CsvSource(delimiter = ';', value = {
            "[0,0][0,0];false",
            "[-10,-10][5,5];true",
            "[100,0][150,50];false",
            "[0,100][50,150];false",
            "[-50,-50][0,10];false",
            "[10,-50][20,0];false",
            "[99,99][200,200];true",
            "[0,0][100,100];true",
            "[-50,-50][-10,-10];false"
    })
    @DisplayName("Visibility requires at least one pixel inside the screen")
    void visibilityAgainstScreenEdges(String rawBounds, boolean expectedVisible) {
        var bounds = Bounds.parse(rawBounds).orElseThrow();

        assertThat(bounds.isVisibleOn(SCREEN_100_X_100)).isEqualTo(expectedVisible);
    }

    @Test
    @DisplayName("Screen size must not be negative")
    void negativeScreenSizeIsRejected() {
        assertThatThrownBy(() -> new ScreenSize(-1, 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width");
    }
}
