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

import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.fieldsan.sanitizer.SanitizerException.defaultOutOfRange;
import static com.netflix.fieldsan.sanitizer.SanitizerException.rangeInverted;

/**
 * Numeric field handler. Present values are clamped to the [min, max] range, and absent values are set to the
 * default value. A default value is not clamped, as it is checked to be within the range when the handler is built.
 */
public class NumericHandler<T extends Comparable<? super T>> implements FieldHandler {

    private static final Logger logger = LoggerFactory.getLogger(NumericHandler.class);

    private final NumericType<T> numericType;
    private final T min;
    private final T max;
    private final T defaultValue;

    private NumericHandler(NumericType<T> numericType, T min, T max, T defaultValue) {
        this.numericType = numericType;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
    }

    @Override
    public int apply(List<Slot> slots) {
        int corrections = 0;
        for (Slot slot : slots) {
            if (!slot.isPresent()) {
                if (defaultValue != null) {
                    slot.set(defaultValue);
                    logger.debug("Set default value {} in {}", defaultValue, slot.getPath());
                    corrections++;
                }
                continue;
            }
            T value = numericType.cast(slot.get());
            T sanitized = clamp(value);
            if (sanitized != value) {
                slot.set(sanitized);
                logger.debug("Changed value {} to {} in {}", value, sanitized, slot.getPath());
                corrections++;
            }
        }
        return corrections;
    }

    /**
     * Returns the same instance if the value is within the range.
     */
    T clamp(T value) {
        T result = value;
        if (min != null && numericType.isLess(result, min)) {
            result = min;
        }
        if (max != null && numericType.isLess(max, result)) {
            result = max;
        }
        return result;
    }

    /**
     * @throws com.netflix.fieldsan.sanitizer.SanitizerException if a directive value is invalid, 'max' is less
     *                                                         than 'min', or 'def' is outside of the range
     */
    public static <T extends Comparable<? super T>> NumericHandler<T> compile(NumericType<T> numericType, Directives directives, String fieldPath) {
        T min = DirectiveValues.parse(directives, Directive.Min, fieldPath, numericType::parse);
        T max = DirectiveValues.parse(directives, Directive.Max, fieldPath, numericType::parse);
        T defaultValue = DirectiveValues.parse(directives, Directive.Def, fieldPath, numericType::parse);

        if (min != null && max != null && numericType.isLess(max, min)) {
            throw rangeInverted(fieldPath, min, max);
        }
        if (defaultValue != null) {
            if (max != null && numericType.isLess(max, defaultValue)) {
                throw defaultOutOfRange(fieldPath, defaultValue, Directive.Max, max);
            }
            if (min != null && numericType.isLess(defaultValue, min)) {
                throw defaultOutOfRange(fieldPath, defaultValue, Directive.Min, min);
            }
        }
        return new NumericHandler<>(numericType, min, max, defaultValue);
    }
}
