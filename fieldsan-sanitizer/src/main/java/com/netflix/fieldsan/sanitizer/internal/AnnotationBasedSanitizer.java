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

import java.lang.reflect.Field;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import com.netflix.fieldsan.common.util.ReflectionExt;

/**
 * Walks entity fields in declaration order, super class fields first, and sanitizes each field according to its
 * {@link com.netflix.fieldsan.sanitizer.Sanitize} directives. Nested entities are sanitized depth first. The walk
 * stops at the first error.
 */
public class AnnotationBasedSanitizer {

    private final String tagName;
    private final DateReformatter dateReformatter;
    private final Function<Class<?>, Boolean> entityPredicate;
    private final SanitizerMetrics metrics;

    private final ConcurrentMap<Field, FieldDescriptor> fieldDescriptors = new ConcurrentHashMap<>();

    public AnnotationBasedSanitizer(String tagName,
                                    DateReformatter dateReformatter,
                                    Function<Class<?>, Boolean> entityPredicate,
                                    SanitizerMetrics metrics) {
        this.tagName = tagName;
        this.dateReformatter = dateReformatter;
        this.entityPredicate = entityPredicate;
        this.metrics = metrics;
    }

    public void apply(Object entity) {
        sanitizeEntity(entity, "");
    }

    FieldDescriptor getFieldDescriptor(Field field) {
        return fieldDescriptors.computeIfAbsent(
                field,
                f -> FieldDescriptor.analyze(f, tagName, entityPredicate, dateReformatter.isConfigured())
        );
    }

    private void sanitizeEntity(Object entity, String path) {
        for (Field field : ReflectionExt.getInstanceFields(entity.getClass())) {
            FieldDescriptor descriptor = getFieldDescriptor(field);
            if (descriptor.isActive()) {
                String fieldPath = path.isEmpty() ? field.getName() : path + '.' + field.getName();
                sanitizeField(entity, descriptor, fieldPath);
            }
        }
    }

    private void sanitizeField(Object holder, FieldDescriptor descriptor, String fieldPath) {
        CollectionSizeHandler sizeHandler = descriptor.getShape().isCollection()
                ? CollectionSizeHandler.compile(descriptor.getDirectives(), fieldPath)
                : null;

        if (descriptor.getKind() == FieldDescriptor.Kind.Entity) {
            if (sizeHandler != null) {
                metrics.valuesCorrected(sizeHandler.apply(holder, descriptor, fieldPath));
            }
            for (Slot slot : Slots.normalize(holder, descriptor, fieldPath)) {
                Object value = slot.get();
                if (value != null) {
                    sanitizeEntity(value, slot.getPath());
                }
            }
            return;
        }

        // Directive values are validated before the field is modified
        FieldHandler handler = descriptor.getFamily()
                .map(family -> family.compile(descriptor.getDirectives(), fieldPath, dateReformatter))
                .orElse(FieldHandler.NO_OP);
        if (sizeHandler != null) {
            metrics.valuesCorrected(sizeHandler.apply(holder, descriptor, fieldPath));
        }
        metrics.valuesCorrected(handler.apply(Slots.normalize(holder, descriptor, fieldPath)));
    }
}
