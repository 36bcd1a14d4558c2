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

/**
 * Sanitizes entity fields in place, according to the directives declared in their {@link Sanitize} annotations.
 * Nested entities, {@link java.util.Optional} values, lists and arrays are processed recursively.
 * <p>
 * Sanitization stops at the first failure. Fields processed before the failing one keep their sanitized values,
 * so the entity should not be used after an error unless partial changes are acceptable.
 * <p>
 * Implementations are thread safe, but a single entity instance must not be sanitized concurrently.
 */
public interface EntitySanitizer {

    /**
     * Sanitize the entity in place.
     *
     * @throws SanitizerException if a field directive is invalid, or a field cannot be updated
     */
    <T> void sanitize(T entity);
}
