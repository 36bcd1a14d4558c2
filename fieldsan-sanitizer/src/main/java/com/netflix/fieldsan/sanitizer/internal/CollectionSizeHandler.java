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
import java.util.List;

import com.netflix.fieldsan.sanitizer.Directive;
import com.netflix.fieldsan.sanitizer.Directives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.fieldsan.sanitizer.SanitizerException.fieldAccess;

/**
 * Truncates lists and arrays to the size set by the 'maxsize' directive. Lists are truncated in place, and arrays
 * are replaced with a truncated copy.
 */
public class CollectionSizeHandler {

    private static final Logger logger = LoggerFactory.getLogger(CollectionSizeHandler.class);

    private static final CollectionSizeHandler UNBOUNDED = new CollectionSizeHandler(null);

    private final Integer maxSize;

    private CollectionSizeHandler(Integer maxSize) {
        this.maxSize = maxSize;
    }

    /**
     * @return 1 if the collection was truncated, 0 otherwise
     */
    public int apply(Object holder, FieldDescriptor descriptor, String fieldPath) {
        if (maxSize == null) {
            return 0;
        }
        Object collection = Slots.readCollection(holder, descriptor, fieldPath);
        if (collection == null) {
            return 0;
        }
        if (collection instanceof List) {
            List<?> list = (List<?>) collection;
            int size = list.size();
            if (size <= maxSize) {
                return 0;
            }
            try {
                list.subList(maxSize, size).clear();
            } catch (UnsupportedOperationException e) {
                throw fieldAccess(fieldPath, "list is not modifiable", e);
            }
            logger.debug("Truncated list from {} to {} elements in {}", size, maxSize, fieldPath);
            return 1;
        }

        int length = Array.getLength(collection);
        if (length <= maxSize) {
            return 0;
        }
        Object truncated = Array.newInstance(collection.getClass().getComponentType(), maxSize);
        System.arraycopy(collection, 0, truncated, 0, maxSize);
        Slots.writeArray(holder, descriptor, fieldPath, truncated);
        logger.debug("Truncated array from {} to {} elements in {}", length, maxSize, fieldPath);
        return 1;
    }

    public static CollectionSizeHandler compile(Directives directives, String fieldPath) {
        Integer maxSize = DirectiveValues.parse(directives, Directive.MaxSize, fieldPath, PrimitiveParsers::parseNonNegativeInt);
        return maxSize == null ? UNBOUNDED : new CollectionSizeHandler(maxSize);
    }
}
