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

/**
 * Boolean field handler, which only sets a default value on absent slots.
 */
public class BooleanHandler implements FieldHandler {

    private static final Logger logger = LoggerFactory.getLogger(BooleanHandler.class);

    private final Boolean defaultValue;

    private BooleanHandler(Boolean defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public int apply(List<Slot> slots) {
        if (defaultValue == null) {
            return 0;
        }
        int corrections = 0;
        for (Slot slot : slots) {
            if (!slot.isPresent()) {
                slot.set(defaultValue);
                logger.debug("Set default value {} in {}", defaultValue, slot.getPath());
                corrections++;
            }
        }
        return corrections;
    }

    public static BooleanHandler compile(Directives directives, String fieldPath) {
        return new BooleanHandler(DirectiveValues.parse(directives, Directive.Def, fieldPath, PrimitiveParsers::parseBoolean));
    }
}
