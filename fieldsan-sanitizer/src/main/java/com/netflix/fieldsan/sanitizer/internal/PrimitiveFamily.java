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
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;

/**
 * Scalar value types with a handler. Each constant creates the handler for the fields of its types.
 */
public enum PrimitiveFamily {

    StringValue(ImmutableSet.of(String.class), EnumSet.of(
            Directive.Xss, Directive.Trim, Directive.Date, Directive.Max, Directive.Def,
            Directive.Lower, Directive.Upper, Directive.Title, Directive.Cap
    )) {
        @Override
        public FieldHandler compile(Directives directives, String fieldPath, DateReformatter dateReformatter) {
            return StringHandler.compile(directives, fieldPath, dateReformatter);
        }
    },

    BooleanValue(ImmutableSet.of(Boolean.TYPE, Boolean.class), EnumSet.of(Directive.Def)) {
        @Override
        public FieldHandler compile(Directives directives, String fieldPath, DateReformatter dateReformatter) {
            return BooleanHandler.compile(directives, fieldPath);
        }
    },

    ByteValue(ImmutableSet.of(Byte.TYPE, Byte.class), NumericType.BYTE),

    ShortValue(ImmutableSet.of(Short.TYPE, Short.class), NumericType.SHORT),

    IntValue(ImmutableSet.of(Integer.TYPE, Integer.class), NumericType.INT),

    LongValue(ImmutableSet.of(Long.TYPE, Long.class), NumericType.LONG),

    FloatValue(ImmutableSet.of(Float.TYPE, Float.class), NumericType.FLOAT),

    DoubleValue(ImmutableSet.of(Double.TYPE, Double.class), NumericType.DOUBLE),

    UnsignedIntValue(ImmutableSet.of(UnsignedInteger.class), NumericType.UNSIGNED_INT),

    UnsignedLongValue(ImmutableSet.of(UnsignedLong.class), NumericType.UNSIGNED_LONG),

    BigIntegerValue(ImmutableSet.of(BigInteger.class), NumericType.BIG_INTEGER),

    BigDecimalValue(ImmutableSet.of(BigDecimal.class), NumericType.BIG_DECIMAL);

    private final Set<Class<?>> types;
    private final Set<Directive> directives;
    private final NumericType<?> numericType;

    PrimitiveFamily(Set<Class<?>> types, Set<Directive> directives) {
        this.types = types;
        this.directives = directives;
        this.numericType = null;
    }

    PrimitiveFamily(Set<Class<?>> types, NumericType<?> numericType) {
        this.types = types;
        this.directives = EnumSet.of(Directive.Min, Directive.Max, Directive.Def);
        this.numericType = numericType;
    }

    /**
     * Directives used by the family handler.
     */
    public Set<Directive> getDirectives() {
        return directives;
    }

    /**
     * Creates a handler for a field with the given directives.
     *
     * @throws com.netflix.fieldsan.sanitizer.SanitizerException if the directives are invalid
     */
    public FieldHandler compile(Directives directives, String fieldPath, DateReformatter dateReformatter) {
        return NumericHandler.compile(numericType, directives, fieldPath);
    }

    public static Optional<PrimitiveFamily> of(Class<?> type) {
        for (PrimitiveFamily family : values()) {
            if (family.types.contains(type)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}
