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
 * A numeric value type, with its directive value parser. Values are compared with their natural ordering.
 */
public final class NumericType<T extends Comparable<? super T>> {

    public static final NumericType<Byte> BYTE = new NumericType<>("byte", Byte.class, PrimitiveParsers::parseByte);
    public static final NumericType<Short> SHORT = new NumericType<>("short", Short.class, PrimitiveParsers::parseShort);
    public static final NumericType<Integer> INT = new NumericType<>("int", Integer.class, PrimitiveParsers::parseInt);
    public static final NumericType<Long> LONG = new NumericType<>("long", Long.class, PrimitiveParsers::parseLong);
    public static final NumericType<Float> FLOAT = new NumericType<>("float", Float.class, PrimitiveParsers::parseFloat);
    public static final NumericType<Double> DOUBLE = new NumericType<>("double", Double.class, PrimitiveParsers::parseDouble);
    public static final NumericType<UnsignedInteger> UNSIGNED_INT = new NumericType<>("unsigned int", UnsignedInteger.class, PrimitiveParsers::parseUnsignedInt);
    public static final NumericType<UnsignedLong> UNSIGNED_LONG = new NumericType<>("unsigned long", UnsignedLong.class, PrimitiveParsers::parseUnsignedLong);
    public static final NumericType<BigInteger> BIG_INTEGER = new NumericType<>("big integer", BigInteger.class, PrimitiveParsers::parseBigInteger);
    public static final NumericType<BigDecimal> BIG_DECIMAL = new NumericType<>("big decimal", BigDecimal.class, PrimitiveParsers::parseBigDecimal);

    private final String name;
    private final Class<T> valueType;
    private final Function<String, Either<T, String>> parser;

    private NumericType(String name, Class<T> valueType, Function<String, Either<T, String>> parser) {
        this.name = name;
        this.valueType = valueType;
        this.parser = parser;
    }

    public String getName() {
        return name;
    }

    public Either<T, String> parse(String text) {
        return parser.apply(text);
    }

    public T cast(Object value) {
        return valueType.cast(value);
    }

    public boolean isLess(T first, T second) {
        return first.compareTo(second) < 0;
    }

    @Override
    public String toString() {
        return "NumericType{" + name + '}';
    }
}
