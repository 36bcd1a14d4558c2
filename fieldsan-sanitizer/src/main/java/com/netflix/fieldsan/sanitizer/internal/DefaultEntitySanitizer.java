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

import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.netflix.fieldsan.common.util.ReflectionExt;
import com.netflix.fieldsan.sanitizer.EntitySanitizer;
import com.netflix.fieldsan.sanitizer.SanitizerException;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultEntitySanitizer implements EntitySanitizer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultEntitySanitizer.class);

    private final AnnotationBasedSanitizer annotationBasedSanitizer;
    private final SanitizerMetrics metrics;

    public DefaultEntitySanitizer(String tagName,
                                  DateReformatter dateReformatter,
                                  Function<Class<?>, Boolean> entityPredicate,
                                  Registry registry) {
        this.metrics = new SanitizerMetrics(registry);
        this.annotationBasedSanitizer = new AnnotationBasedSanitizer(tagName, dateReformatter, entityPredicate, metrics);
    }

    @Override
    public <T> void sanitize(T entity) {
        Preconditions.checkNotNull(entity, "null entity");
        Class<?> type = entity.getClass();
        Preconditions.checkArgument(
                !ReflectionExt.isJdkType(type) && !type.isArray() && !type.isEnum(),
                "Not an entity type: %s", type.getName()
        );

        try {
            annotationBasedSanitizer.apply(entity);
        } catch (SanitizerException e) {
            metrics.sanitizationFailed(e);
            logger.debug("Sanitization of {} failed: {}", type.getSimpleName(), e.getMessage());
            throw e;
        }
        metrics.entitySanitized();
    }
}
