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
package org.tarik.uitree.utils;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;

public class CommonUtils {
    private static final String TRUE = "true";
    private static final String FALSE = "false";

    public static boolean isBlank(@Nullable String str) {
        return str == null || str.isBlank();
    }

    public static boolean isNotBlank(@Nullable String str) {
        return !isBlank(str);
    }

    public static Optional<Integer> parseStringAsInteger(@Nullable String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return of(Integer.parseInt(str.trim()));
        } catch (NumberFormatException e) {
            return empty();
        }
    }

    /**
     * Strict boolean parsing: unlike {@link Boolean#parseBoolean(String)}, any value other than "true" or "false"
     * (case-insensitive) is rejected.
     */
    public static Optional<Boolean> parseStringAsBoolean(@Nullable String str) {
        if (isBlank(str)) {
            return empty();
        }
        var value = str.trim();
        if (TRUE.equalsIgnoreCase(value)) {
            return of(true);
        } else if (FALSE.equalsIgnoreCase(value)) {
            return of(false);
        } else {
            return empty();
        }
    }

    public static String removePrefix(String str, @Nullable String prefix) {
        if (isBlank(prefix) || !str.startsWith(prefix)) {
            return str;
        }
        return str.substring(prefix.length());
    }
}
