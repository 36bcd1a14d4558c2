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
import java.lang.reflect.Type;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.netflix.fieldsan.common.util.ReflectionExt;
import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;
import com.netflix.fieldsan.sanitizer.Sanitize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static description of a field: its shape, its element type and its directives.
 */
public class FieldDescriptor {

    private static final Logger logger = LoggerFactory.getLogger(FieldDescriptor.class);

    public enum Kind {
        /**
         * Field holding scalar values of a {@link PrimitiveFamily}.
         */
        Primitive,

        /**
         * Field holding nested entities.
         */
        Entity,

        /**
         * Field not handled by the sanitizer.
         */
        Unsupported
    }

    private final Field field;
    private final Kind kind;
    private final FieldShape shape;
    private final boolean optionalWrapper;
    private final Class<?> elementType;
    private final PrimitiveFamily family;
    private final Directives directives;

    private FieldDescriptor(Field field,
                            Kind kind,
                            FieldShape shape,
                            boolean optionalWrapper,
                            Class<?> elementType,
                            PrimitiveFamily family,
                            Directives directives) {
        this.field = field;
        this.kind = kind;
        this.shape = shape;
        this.optionalWrapper = optionalWrapper;
        this.elementType = elementType;
        this.family = family;
        this.directives = directives;
    }

    public Field getField() {
        return field;
    }

    public Kind getKind() {
        return kind;
    }

    public FieldShape getShape() {
        return shape;
    }

    /**
     * True if the field type is {@link Optional}.
     */
    public boolean isOptionalWrapper() {
        return optionalWrapper;
    }

    /**
     * Scalar type, or the element type of a collection, with {@link Optional} unwrapped.
     */
    public Class<?> getElementType() {
        return elementType;
    }

    public Optional<PrimitiveFamily> getFamily() {
        return Optional.ofNullable(family);
    }

    public Directives getDirectives() {
        return directives;
    }

    /**
     * True if sanitizing the field has any effect.
     */
    public boolean isActive() {
        switch (kind) {
            case Primitive:
                return !directives.isEmpty();
            case Entity:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" +
                "field=" + field.getName() +
                ", kind=" + kind +
                ", shape=" + shape +
                ", elementType=" + elementType.getName() +
                ", family=" + family +
                ", directives=" + directives +
                '}';
    }

    /**
     * Resolves the field shape and element type from its declared type, and reads the directives of the
     * {@link Sanitize} annotations with the given tag. Fields of unsupported types and ignored directives are
     * reported in the log.
     */
    public static FieldDescriptor analyze(Field field,
                                          String tagName,
                                          Function<Class<?>, Boolean> entityPredicate,
                                          boolean dateFormatsConfigured) {
        Directives directives = readDirectives(field, tagName);
        String fieldName = field.getDeclaringClass().getSimpleName() + '.' + field.getName();
        if (!directives.getUnknownNames().isEmpty()) {
            logger.warn("Ignoring unknown directives {} in field {}", directives.getUnknownNames(), fieldName);
        }

        Type type = field.getGenericType();
        Class<?> rawType = ReflectionExt.getRawType(type);
        boolean optionalWrapper = rawType == Optional.class;
        if (optionalWrapper) {
            type = ReflectionExt.getTypeArgument(type, 0);
            rawType = ReflectionExt.getRawType(type);
        }

        boolean collection = false;
        Type elementGenericType = type;
        if (rawType.isArray()) {
            collection = true;
            elementGenericType = ReflectionExt.getArrayComponentType(type);
        } else if (List.class.isAssignableFrom(rawType)) {
            collection = true;
            elementGenericType = ReflectionExt.getTypeArgument(type, 0);
        }
        Class<?> elementType = ReflectionExt.getRawType(elementGenericType);

        FieldShape shape = collection
                ? FieldShape.of(optionalWrapper, true, !elementType.isPrimitive())
                : FieldShape.of(optionalWrapper || !elementType.isPrimitive(), false, false);

        Optional<PrimitiveFamily> family = PrimitiveFamily.of(elementType);
        Kind kind;
        Set<Directive> supported;
        if (family.isPresent()) {
            kind = Kind.Primitive;
            supported = EnumSet.copyOf(family.get().getDirectives());
        } else if (!isContainer(elementType) && entityPredicate.apply(elementType)) {
            kind = Kind.Entity;
            supported = EnumSet.noneOf(Directive.class);
        } else {
            if (!directives.isEmpty()) {
                logger.warn("Ignoring directives {} in field {} of unsupported type {}", directives.getDirectives(), fieldName, field.getGenericType());
            }
            return new FieldDescriptor(field, Kind.Unsupported, shape, optionalWrapper, elementType, null, Directives.empty());
        }
        if (collection) {
            supported.add(Directive.MaxSize);
        }

        Set<Directive> ignored = EnumSet.noneOf(Directive.class);
        for (Directive directive : directives.getDirectives()) {
            if (!supported.contains(directive)) {
                ignored.add(directive);
            }
        }
        if (!ignored.isEmpty()) {
            logger.warn("Ignoring directives {} not applicable to field {} of type {}", ignored, fieldName, field.getGenericType());
        }
        if (supported.contains(Directive.Date) && directives.contains(Directive.Date) && !dateFormatsConfigured) {
            logger.warn("No date input formats configured; field {} with the 'date' directive will be set to an empty string", fieldName);
        }

        return new FieldDescriptor(field, kind, shape, optionalWrapper, elementType, family.orElse(null), directives);
    }

    private static boolean isContainer(Class<?> type) {
        return type.isArray() || type == Optional.class || List.class.isAssignableFrom(type);
    }

    /**
     * Directives of all annotations with the tag. Annotations are concatenated, so if a directive is repeated, the
     * last occurrence wins.
     */
    private static Directives readDirectives(Field field, String tagName) {
        StringBuilder sb = new StringBuilder();
        for (Sanitize annotation : field.getAnnotationsByType(Sanitize.class)) {
            if (annotation.tag().equals(tagName)) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(annotation.value());
            }
        }
        return sb.length() == 0 ? Directives.empty() : Directives.parse(sb.toString());
    }
}
