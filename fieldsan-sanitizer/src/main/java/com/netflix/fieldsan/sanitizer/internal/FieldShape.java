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

/**
 * Structure of a field value, independent of its element type.
 */
public enum FieldShape {

    /**
     * A primitive value, which is never absent.
     */
    Scalar(false, false, false),

    /**
     * A reference value, or {@link java.util.Optional}, which may be absent.
     */
    Optional(true, false, false),

    /**
     * A primitive array.
     */
    Collection(false, true, false),

    /**
     * A primitive array wrapped in {@link java.util.Optional}.
     */
    OptionalCollection(true, true, false),

    /**
     * A list, or an array of reference values. Elements may be null.
     */
    CollectionOfOptional(false, true, true),

    /**
     * A list, or an array of reference values, wrapped in {@link java.util.Optional}. Elements may be null.
     */
    OptionalCollectionOfOptional(true, true, true);

    private final boolean optional;
    private final boolean collection;
    private final boolean optionalElements;

    FieldShape(boolean optional, boolean collection, boolean optionalElements) {
        this.optional = optional;
        this.collection = collection;
        this.optionalElements = optionalElements;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isCollection() {
        return collection;
    }

    public boolean hasOptionalElements() {
        return optionalElements;
    }

    public static FieldShape of(boolean optional, boolean collection, boolean optionalElements) {
        for (FieldShape shape : values()) {
            if (shape.optional == optional && shape.collection == collection && shape.optionalElements == optionalElements) {
                return shape;
            }
        }
        // Optional elements outside of a collection are just an optional value
        return optional || optionalElements ? Optional : Scalar;
    }
}
