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

import static java.lang.String.format;

public class SanitizerException extends RuntimeException {

    public enum ErrorCode {
        /**
         * A directive value cannot be parsed as the type it governs.
         */
        DirectiveParse,

        /**
         * The 'max' directive value is lower than the 'min' directive value.
         */
        RangeInverted,

        /**
         * The 'def' directive value is outside of the range set by 'min' and 'max'.
         */
        DefaultOutOfRange,

        /**
         * A field value cannot be read or written.
         */
        FieldAccess,

        /**
         * Invalid or conflicting sanitizer configuration.
         */
        InvalidConfiguration
    }

    private final ErrorCode errorCode;
    private final String fieldPath;
    private final Directive directive;

    private SanitizerException(ErrorCode errorCode, String fieldPath, Directive directive, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.fieldPath = fieldPath;
        this.directive = directive;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Path of the failing field starting from the sanitized entity, like 'owner.pets[1].name'. Empty for
     * configuration errors.
     */
    public Optional<String> getFieldPath() {
        return Optional.ofNullable(fieldPath);
    }

    public Optional<Directive> getDirective() {
        return Optional.ofNullable(directive);
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof SanitizerException) && ((SanitizerException) error).getErrorCode() == errorCode;
    }

    public static SanitizerException directiveParse(String fieldPath, Directive directive, String value, String reason) {
        return new SanitizerException(
                ErrorCode.DirectiveParse,
                fieldPath,
                directive,
                format("Invalid value '%s' of directive '%s' in field %s: %s", value, directive.getTagName(), fieldPath, reason),
                null
        );
    }

    public static SanitizerException missingDirectiveValue(String fieldPath, Directive directive) {
        return new SanitizerException(
                ErrorCode.DirectiveParse,
                fieldPath,
                directive,
                format("Directive '%s' in field %s requires a value", directive.getTagName(), fieldPath),
                null
        );
    }

    public static SanitizerException rangeInverted(String fieldPath, Object min, Object max) {
        return new SanitizerException(
                ErrorCode.RangeInverted,
                fieldPath,
                Directive.Max,
                format("Directive 'max' (%s) is less than 'min' (%s) in field %s", max, min, fieldPath),
                null
        );
    }

    public static SanitizerException defaultOutOfRange(String fieldPath, Object defaultValue, Directive bound, Object boundValue) {
        String relation = bound == Directive.Max ? "higher than" : "lower than";
        return new SanitizerException(
                ErrorCode.DefaultOutOfRange,
                fieldPath,
                Directive.Def,
                format("Directive 'def' (%s) is %s '%s' (%s) in field %s", defaultValue, relation, bound.getTagName(), boundValue, fieldPath),
                null
        );
    }

    public static SanitizerException fieldAccess(String fieldPath, String reason, Throwable cause) {
        return new SanitizerException(
                ErrorCode.FieldAccess,
                fieldPath,
                null,
                format("Cannot sanitize field %s: %s", fieldPath, reason),
                cause
        );
    }

    public static SanitizerException invalidConfiguration(String message, Object... args) {
        return new SanitizerException(ErrorCode.InvalidConfiguration, null, null, format(message, args), null);
    }

    public static SanitizerException invalidConfiguration(Throwable cause, String message, Object... args) {
        return new SanitizerException(ErrorCode.InvalidConfiguration, null, null, format(message, args), cause);
    }
}
