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

/**
 * Sanitizes the values of a single field, built from the field directives. Directive values are validated when
 * a handler is created, so a handler never fails on a directive.
 */
public interface FieldHandler {

    FieldHandler NO_OP = slots -> 0;

    /**
     * @return number of slots whose value was changed
     */
    int apply(List<Slot> slots);
}
