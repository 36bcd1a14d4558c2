/*
 * Copyright 2018 Netflix, Inc.
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

package com.netflix.fieldsan.sanitizer.internal;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String transformations applied by the string directives.
 */
public final class StringTransforms {

    /**
     * Enclosing marks, control, format, private use and unassigned characters, and characters used by markup or
     * scripts.
     */
    private static final Pattern XSS_CHARACTERS = Pattern.compile("[\\p{Me}\\p{C}<>=;(){}\\[\\]?]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s\\s+");

    private StringTransforms() {
    }

    /**
     * Replaces each suspicious character with a space, and collapses runs of whitespace characters into a single space.
     */
    public static String xss(String text) {
        String replaced = XSS_CHARACTERS.matcher(text).replaceAll(" ");
        return WHITESPACE_RUN.matcher(replaced).replaceAll(" ");
    }

    public static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    public static String upper(String text) {
        return text.toUpperCase(Locale.ROOT);
    }

    /**
     * Lowercases the text, and changes the first character of each whitespace delimited word to title case.
     */
    public static String title(String text) {
        String lower = lower(text);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean wordStart = true;
        for (int i = 0; i < lower.length(); ) {
            int codePoint = lower.codePointAt(i);
            if (Character.isWhitespace(codePoint)) {
                wordStart = true;
                sb.appendCodePoint(codePoint);
            } else {
                sb.appendCodePoint(wordStart ? Character.toTitleCase(codePoint) : codePoint);
                wordStart = false;
            }
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }

    /**
     * Lowercases the text, and changes its first letter to title case.
     */
    public static String capitalize(String text) {
        String lower = lower(text);
        for (int i = 0; i < lower.length(); ) {
            int codePoint = lower.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            if (Character.isLetter(codePoint)) {
                return lower.substring(0, i) + new String(Character.toChars(Character.toTitleCase(codePoint))) + lower.substring(next);
            }
            i = next;
        }
        return lower;
    }
}
