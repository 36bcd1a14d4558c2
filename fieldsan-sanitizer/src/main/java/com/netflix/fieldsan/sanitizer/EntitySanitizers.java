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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

/**
 * A collection of predefined sanitizers.
 */
public final class EntitySanitizers {

    private static final Supplier<EntitySanitizer> DEFAULT_SANITIZER = Suppliers.memoize(() -> EntitySanitizerBuilder.newBuilder().build());

    private EntitySanitizers() {
    }

    /**
     * Sanitizer with the default configuration: the {@value Sanitize#DEFAULT_TAG} tag name, and no date formats.
     * The instance is created on first use, and shared afterwards.
     */
    public static EntitySanitizer defaultSanitizer() {
        return DEFAULT_SANITIZER.get();
    }
}
