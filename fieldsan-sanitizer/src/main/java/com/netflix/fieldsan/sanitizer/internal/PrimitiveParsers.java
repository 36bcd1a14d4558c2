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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.Function;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.netflix.fieldsan.common.util.tuple.Either;

/**
 * Parsers of directive values. A parser returns either the parsed value, or an error message.
 */
public final class PrimitiveParsers {

    private PrimitiveParsers() {
    }

    public static Either<Byte, String> parseByte(String text) {
        return parseNumber(text, Byte::valueOf);
    }

    public static Either<Short, String> parseShort(String text) {
        return parseNumber(text, Short::valueOf);
    }

    public static Either<Integer, String> parseInt(String text) {
        return parseNumber(text, Integer::valueOf);
    }

    public static Either<Long, String> parseLong(String text) {
        return parseNumber(text, Long::valueOf);
    }

    public static Either<Float, String> parseFloat(String text) {
        Either<Float, String> result = parseNumber(text, Float::valueOf);
        return result.flatMap(value -> value.isNaN() ? Either.ofError("not a number") : Either.ofValue(value));
    }

    public static Either<Double, String> parseDouble(String text) {
        Either<Double, String> result = parseNumber(text, Double::valueOf);
        return result.flatMap(value -> value.isNaN() ? Either.ofError("not a number") : Either.ofValue(value));
    }

    public static Either<UnsignedInteger, String> parseUnsignedInt(String text) {
        return parseNumber(text, UnsignedInteger::valueOf);
    }

    public static Either<UnsignedLong, String> parseUnsignedLong(String text) {
        return parseNumber(text, UnsignedLong::valueOf);
    }

    public static Either<BigInteger, String> parseBigInteger(String text) {
        return parseNumber(text, BigInteger::new);
    }

    public static Either<BigDecimal, String> parseBigDecimal(String text) {
        return parseNumber(text, BigDecimal::new);
    }

    /**
     * Integer value that is zero or positive, like a string length or a collection size.
     */
    public static Either<Integer, String> parseNonNegativeInt(String text) {
        return parseInt(text).flatMap(value -> value < 0 ? Either.ofError("negative value") : Either.ofValue(value));
    }

    /**
     * Accepts 'true' or 'false', ignoring case.
     */
    public static Either<Boolean, String> parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Either.ofValue(true);
        }
        if ("false".equalsIgnoreCase(text)) {
            return Either.ofValue(false);
        }
        return Either.ofError("expected 'true' or 'false'");
    }

    private static <T> Either<T, String> parseNumber(String text, Function<String, T> parser) {
        if (text == null || text.isEmpty()) {
            return Either.ofError("empty value");
        }
        try {
            return Either.ofValue(parser.apply(text));
        } catch (NumberFormatException e) {
            return Either.ofError(e.getMessage() == null ? "not a number" : e.getMessage());
        }
    }
}
