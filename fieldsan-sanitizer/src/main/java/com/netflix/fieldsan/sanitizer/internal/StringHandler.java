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

import java.util.List;

import com.netflix.fieldsan.common.util.StringExt;
import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * String field handler. Transformations are applied in a fixed order: xss, trim, date, max, lower, upper, title, cap.
 * An absent value is replaced with the 'def' directive value as is.
 */
public class StringHandler implements FieldHandler {

    private static final Logger logger = LoggerFactory.getLogger(StringHandler.class);

    static final String DEFAULT_TRIM_SET = " ";

    private final String defaultValue;
    private final boolean xss;
    private final String trimSet;
    private final DateReformatter dateReformatter;
    private final Integer maxLength;
    private final boolean lower;
    private final boolean upper;
    private final boolean title;
    private final boolean cap;

    private StringHandler(Directives directives, String fieldPath, DateReformatter dateReformatter) {
        this.maxLength = DirectiveValues.parse(directives, Directive.Max, fieldPath, PrimitiveParsers::parseNonNegativeInt);
        this.defaultValue = DirectiveValues.getString(directives, Directive.Def, fieldPath);
        this.xss = directives.contains(Directive.Xss);
        this.trimSet = directives.contains(Directive.Trim)
                ? directives.getValue(Directive.Trim).filter(StringExt::isNotEmpty).orElse(DEFAULT_TRIM_SET)
                : null;
        this.dateReformatter = directives.contains(Directive.Date) ? dateReformatter : null;
        this.lower = directives.contains(Directive.Lower);
        this.upper = directives.contains(Directive.Upper);
        this.title = directives.contains(Directive.Title);
        this.cap = directives.contains(Directive.Cap);
    }

    @Override
    public int apply(List<Slot> slots) {
        int corrections = 0;
        for (Slot slot : slots) {
            if (!slot.isPresent()) {
                if (defaultValue != null) {
                    slot.set(defaultValue);
                    logger.debug("Set default value '{}' in {}", defaultValue, slot.getPath());
                    corrections++;
                }
                continue;
            }
            String value = (String) slot.get();
            String sanitized = transform(value);
            if (!sanitized.equals(value)) {
                slot.set(sanitized);
                logger.debug("Changed value '{}' to '{}' in {}", value, sanitized, slot.getPath());
                corrections++;
            }
        }
        return corrections;
    }

    String transform(String value) {
        String result = value;
        if (xss) {
            result = StringTransforms.xss(result);
        }
        if (trimSet != null) {
            result = StringExt.trim(result, trimSet);
        }
        if (dateReformatter != null) {
            result = dateReformatter.reformat(result);
        }
        if (maxLength != null) {
            result = StringExt.truncate(result, maxLength);
        }
        if (lower) {
            result = StringTransforms.lower(result);
        }
        if (upper) {
            result = StringTransforms.upper(result);
        }
        if (title) {
            result = StringTransforms.title(result);
        }
        if (cap) {
            result = StringTransforms.capitalize(result);
        }
        return result;
    }

    /**
     * @throws com.netflix.fieldsan.sanitizer.SanitizerException if 'max' is not a non-negative integer, or 'def' has no value
     */
    public static StringHandler compile(Directives directives, String fieldPath, DateReformatter dateReformatter) {
        return new StringHandler(directives, fieldPath, dateReformatter);
    }
}
