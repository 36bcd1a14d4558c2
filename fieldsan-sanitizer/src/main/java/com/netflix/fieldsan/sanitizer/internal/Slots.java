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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.netflix.fieldsan.common.util.ReflectionExt;

import static com.netflix.fieldsan.sanitizer.SanitizerException.fieldAccess;

/**
 * Flattens a field value of any {@link FieldShape} into an ordered list of slots.
 */
public final class Slots {

    private Slots() {
    }

    /**
     * Returns slots of the field in the given holder object. A collection field yields one slot per element, in
     * the collection order, or no slots if the collection is absent.
     */
    public static List<Slot> normalize(Object holder, FieldDescriptor descriptor, String fieldPath) {
        Field field = descriptor.getField();
        if (!descriptor.getShape().isCollection()) {
            return Collections.singletonList(
                    descriptor.isOptionalWrapper()
                            ? new OptionalFieldSlot(holder, field, fieldPath)
                            : new FieldSlot(holder, field, fieldPath)
            );
        }

        Object collection = readCollection(holder, descriptor, fieldPath);
        if (collection == null) {
            return Collections.emptyList();
        }
        List<Slot> slots = new ArrayList<>();
        if (collection instanceof List) {
            List<Object> list = (List<Object>) collection;
            for (int i = 0; i < list.size(); i++) {
                slots.add(new ListElementSlot(list, i, fieldPath + '[' + i + ']'));
            }
        } else {
            int length = Array.getLength(collection);
            for (int i = 0; i < length; i++) {
                slots.add(new ArrayElementSlot(collection, i, fieldPath + '[' + i + ']'));
            }
        }
        return slots;
    }

    /**
     * Returns the list or the array held by a collection field, or null if it is absent.
     */
    static Object readCollection(Object holder, FieldDescriptor descriptor, String fieldPath) {
        Object value = readField(holder, descriptor.getField(), fieldPath);
        if (descriptor.isOptionalWrapper()) {
            return value == null ? null : ((Optional<?>) value).orElse(null);
        }
        return value;
    }

    /**
     * Replaces the array held by a collection field.
     */
    static void writeArray(Object holder, FieldDescriptor descriptor, String fieldPath, Object array) {
        writeField(holder, descriptor.getField(), fieldPath, descriptor.isOptionalWrapper() ? Optional.of(array) : array);
    }

    private static Object readField(Object holder, Field field, String fieldPath) {
        try {
            return ReflectionExt.getFieldValue(field, holder);
        } catch (IllegalArgumentException e) {
            throw fieldAccess(fieldPath, e.getMessage(), e);
        }
    }

    private static void writeField(Object holder, Field field, String fieldPath, Object value) {
        try {
            ReflectionExt.setFieldValue(field, holder, value);
        } catch (IllegalArgumentException e) {
            throw fieldAccess(fieldPath, e.getMessage(), e);
        }
    }

    private static abstract class AbstractSlot implements Slot {

        private final String path;

        AbstractSlot(String path) {
            this.path = path;
        }

        @Override
        public String getPath() {
            return path;
        }

        @Override
        public boolean isPresent() {
            return get() != null;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "{path=" + path + '}';
        }
    }

    private static class FieldSlot extends AbstractSlot {

        private final Object holder;
        private final Field field;

        FieldSlot(Object holder, Field field, String path) {
            super(path);
            this.holder = holder;
            this.field = field;
        }

        @Override
        public Object get() {
            return readField(holder, field, getPath());
        }

        @Override
        public void set(Object value) {
            writeField(holder, field, getPath(), value);
        }
    }

    private static class OptionalFieldSlot extends AbstractSlot {

        private final Object holder;
        private final Field field;

        OptionalFieldSlot(Object holder, Field field, String path) {
            super(path);
            this.holder = holder;
            this.field = field;
        }

        @Override
        public Object get() {
            Optional<?> value = (Optional<?>) readField(holder, field, getPath());
            return value == null ? null : value.orElse(null);
        }

        @Override
        public void set(Object value) {
            writeField(holder, field, getPath(), Optional.of(value));
        }
    }

    private static class ListElementSlot extends AbstractSlot {

        private final List<Object> list;
        private final int index;

        ListElementSlot(List<Object> list, int index, String path) {
            super(path);
            this.list = list;
            this.index = index;
        }

        @Override
        public Object get() {
            return list.get(index);
        }

        @Override
        public void set(Object value) {
            try {
                list.set(index, value);
            } catch (UnsupportedOperationException e) {
                throw fieldAccess(getPath(), "list is not modifiable", e);
            }
        }
    }

    private static class ArrayElementSlot extends AbstractSlot {

        private final Object array;
        private final int index;

        ArrayElementSlot(Object array, int index, String path) {
            super(path);
            this.array = array;
            this.index = index;
        }

        @Override
        public Object get() {
            return Array.get(array, index);
        }

        @Override
        public void set(Object value) {
            try {
                Array.set(array, index, value);
            } catch (IllegalArgumentException e) {
                throw fieldAccess(getPath(), e.getMessage(), e);
            }
        }
    }
}
