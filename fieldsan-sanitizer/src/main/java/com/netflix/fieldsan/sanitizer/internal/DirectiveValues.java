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

import java.util.Optional;
import java.util.function.Function;

import com.netflix.fieldsan.common.util.tuple.Either;
import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;

import static com.netflix.fieldsan.sanitizer.SanitizerException.directiveParse;
import static com.netflix.fieldsan.sanitizer.SanitizerException.missingDirectiveValue;

/**
 * Typed access to directive values.
 */
final class DirectiveValues {

    private DirectiveValues() {
    }

    /**
     * Returns the parsed directive value, or null if the directive is not set.
     *
     * @throws com.netflix.fieldsan.sanitizer.SanitizerException if the directive is a flag, or its value cannot be parsed
     */
    static <T> T parse(Directives directives, Directive directive, String fieldPath, Function<String, Either<T, String>> parser) {
        if (!directives.contains(directive)) {
            return null;
        }
        String text = requireValue(directives, directive, fieldPath);
        return parser.apply(text).orElseThrow(error -> directiveParse(fieldPath, directive, text, error));
    }

    /**
     * Returns the raw directive value, or null if the directive is not set.
     */
    static String getString(Directives directives, Directive directive, String fieldPath) {
        if (!directives.contains(directive)) {
            return null;
        }
        return requireValue(directives, directive, fieldPath);
    }

    private static String requireValue(Directives directives, Directive directive, String fieldPath) {
        Optional<String> value = directives.getValue(directive);
        if (!value.isPresent()) {
            throw missingDirectiveValue(fieldPath, directive);
        }
        return value.get();
    }
}
