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
 * A single scalar value of a field: the field itself, the content of an {@link java.util.Optional} field, or an
 * element of a list or an array. An absent slot holds a null value.
 */
public interface Slot {

    String getPath();

    boolean isPresent();

    /**
     * @return the slot value, or null if absent
     */
    Object get();

    /**
     * @throws com.netflix.fieldsan.sanitizer.SanitizerException with the FieldAccess error code, if the value cannot be written
     */
    void set(Object value);
}
