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

package com.netflix.fieldsan.common.util;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static java.util.Arrays.asList;

/**
 * A set of string manipulation related functions.
 */
public final class StringExt {

    public final static Pattern SEMICOLON_SPLIT_RE = Pattern.compile("\\s*;\\s*");

    private StringExt() {
    }

    /**
     * Return true if the string value is not null, and it is not an empty string.
     */
    public static boolean isNotEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    /**
     * Return true if the string value is null or an empty string.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Return string with trimmed whitespace characters. If the argument is null, return empty string.
     */
    public static String safeTrim(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String trimmed = s.trim();
        return trimmed.isEmpty() ? "" : trimmed;
    }

    /**
     * Returns a list of semicolon separated values from the parameter. The white space characters around each value
     * is removed as well.
     */
    public static List<String> splitBySemicolon(String value) {
        if (!isNotEmpty(value)) {
            return Collections.emptyList();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Collections.emptyList() : asList(SEMICOLON_SPLIT_RE.split(trimmed));
    }

    /**
     * Remove all leading and trailing characters of the text that belong to the given character set. Unlike
     * {@link String#trim()}, only the provided characters are removed.
     */
    public static String trim(String text, String charSet) {
        if (isEmpty(text) || isEmpty(charSet)) {
            return text;
        }
        int begin = 0;
        int end = text.length();
        while (begin < end && charSet.indexOf(text.charAt(begin)) >= 0) {
            begin++;
        }
        while (end > begin && charSet.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return begin == 0 && end == text.length() ? text : text.substring(begin, end);
    }

    /**
     * Returns the first <code>maxCodePoints</code> code points of the text. Surrogate pairs are never split.
     */
    public static String truncate(String text, int maxCodePoints) {
        if (text == null || maxCodePoints >= text.length()) {
            return text;
        }
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }
}
