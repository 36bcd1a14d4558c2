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

package com.netflix.fieldsan.sanitizer;

import java.util.Optional;

/**
 * Sanitization directives recognized in {@link Sanitize} annotations.
 */
public enum Directive {

    /**
     * Remove leading and trailing spaces (or the characters given as the directive value) from a string.
     */
    Trim("trim"),

    /**
     * Upper bound of a numeric value, or the maximum length of a string.
     */
    Max("max"),

    /**
     * Lower bound of a numeric value.
     */
    Min("min"),

    /**
     * Value set on an absent optional field or collection element.
     */
    Def("def"),

    Lower("lower"),

    Upper("upper"),

    /**
     * Capitalize each whitespace delimited word of a string, and lowercase the remaining letters.
     */
    Title("title"),

    /**
     * Capitalize the first letter of a string, and lowercase the remaining letters.
     */
    Cap("cap"),

    /**
     * Strip markup and control characters from a string.
     */
    Xss("xss"),

    /**
     * Reformat a date string according to the configured date formats.
     */
    Date("date"),

    /**
     * Maximum number of elements in a list or an array.
     */
    MaxSize("maxsize");

    private final String tagName;

    Directive(String tagName) {
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }

    public static Optional<Directive> fromTagName(String tagName) {
        for (Directive directive : values()) {
            if (directive.tagName.equals(tagName)) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }
}
