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

package com.netflix.fieldsan.common.util;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

import static java.lang.String.format;

/**
 * Helper reflection functions.
 */
public final class ReflectionExt {

    private static final Set<Class<?>> WRAPPERS = ImmutableSet.of(
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            Boolean.class, Character.class
    );

    private static final Set<Class<?>> STD_DATA_TYPES = ImmutableSet.of(
            String.class, BigInteger.class, BigDecimal.class, UnsignedInteger.class, UnsignedLong.class
    );

    private static final String[] JDK_PACKAGE_PREFIXES = {"java.", "javax.", "jdk.", "sun.", "com.sun."};

    private static final ConcurrentMap<Class<?>, List<Field>> CLASS_INSTANCE_FIELDS = new ConcurrentHashMap<>();

    private ReflectionExt() {
    }

    public static boolean isPrimitiveOrWrapper(Class<?> type) {
        if (type.isPrimitive()) {
            return true;
        }
        return WRAPPERS.contains(type);
    }

    public static boolean isStandardDataType(Class<?> type) {
        return isPrimitiveOrWrapper(type) || STD_DATA_TYPES.contains(type);
    }

    /**
     * Returns true if the type belongs to the JDK or to one of its internal packages.
     */
    public static boolean isJdkType(Class<?> type) {
        if (type.isPrimitive()) {
            return true;
        }
        String name = type.getName();
        for (String prefix : JDK_PACKAGE_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the raw class of a generic type, or {@link Object} if the type is a type variable or a wildcard.
     */
    public static Class<?> getRawType(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        if (type instanceof GenericArrayType) {
            Class<?> componentType = getRawType(((GenericArrayType) type).getGenericComponentType());
            return java.lang.reflect.Array.newInstance(componentType, 0).getClass();
        }
        return Object.class;
    }

    /**
     * For a parameterized type like <code>List&lt;String&gt;</code> returns its type argument at the given position.
     * For a raw type, returns {@link Object}.
     */
    public static Type getTypeArgument(Type type, int index) {
        if (!(type instanceof ParameterizedType)) {
            return Object.class;
        }
        Type[] arguments = ((ParameterizedType) type).getActualTypeArguments();
        if (index >= arguments.length) {
            throw new IllegalArgumentException(format("Type %s has no type argument at position %s", type, index));
        }
        return arguments[index];
    }

    /**
     * Returns the component type of an array type, including generic arrays like <code>List&lt;String&gt;[]</code>.
     */
    public static Type getArrayComponentType(Type type) {
        if (type instanceof GenericArrayType) {
            return ((GenericArrayType) type).getGenericComponentType();
        }
        Class<?> rawType = getRawType(type);
        if (!rawType.isArray()) {
            throw new IllegalArgumentException(format("Type %s is not an array", type));
        }
        return rawType.getComponentType();
    }

    public static <T> T getFieldValue(Field field, Object object) {
        try {
            return (T) field.get(object);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException(format("Cannot access field %s in %s", field.getName(), object.getClass()), e);
        }
    }

    public static void setFieldValue(Field field, Object object, Object value) {
        try {
            field.set(object, value);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException(format("Cannot set field %s in %s", field.getName(), object.getClass()), e);
        }
    }

    /**
     * Returns all non-static, non-synthetic fields of a class and its super classes. Fields of a super class come
     * before fields of its subclasses, and within a class the fields are in their declaration order. The hierarchy
     * walk stops at the first JDK class, as fields of the JDK modules are not accessible.
     */
    public static List<Field> getInstanceFields(Class<?> type) {
        return CLASS_INSTANCE_FIELDS.computeIfAbsent(type, t -> {
            LinkedList<Class<?>> hierarchy = new LinkedList<>();
            for (Class<?> current = t; current != null && !isJdkType(current); current = current.getSuperclass()) {
                hierarchy.addFirst(current);
            }
            List<Field> fields = new ArrayList<>();
            for (Class<?> current : hierarchy) {
                for (Field field : current.getDeclaredFields()) {
                    if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                        field.setAccessible(true);
                        fields.add(field);
                    }
                }
            }
            return Collections.unmodifiableList(fields);
        });
    }
}
