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

import com.netflix.fieldsan.sanitizer.SanitizerException;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

public class SanitizerMetrics {

    public static final String SANITIZER_METRICS_ROOT = "fieldsan.sanitizer.";
    public static final String ENTITIES_METRIC = SANITIZER_METRICS_ROOT + "entities";
    public static final String ERRORS_METRIC = SANITIZER_METRICS_ROOT + "errors";
    public static final String CORRECTIONS_METRIC = SANITIZER_METRICS_ROOT + "corrections";
    public static final String ERROR_CODE_TAG = "errorCode";

    private final Registry registry;
    private final Counter entitiesCounter;
    private final Counter correctionsCounter;
    private final Id errorsId;

    public SanitizerMetrics(Registry registry) {
        this.registry = registry;
        this.entitiesCounter = registry.counter(ENTITIES_METRIC);
        this.correctionsCounter = registry.counter(CORRECTIONS_METRIC);
        this.errorsId = registry.createId(ERRORS_METRIC);
    }

    public void entitySanitized() {
        entitiesCounter.increment();
    }

    public void valuesCorrected(int count) {
        if (count > 0) {
            correctionsCounter.increment(count);
        }
    }

    public void sanitizationFailed(SanitizerException error) {
        registry.counter(errorsId.withTag(ERROR_CODE_TAG, error.getErrorCode().name())).increment();
    }
}
