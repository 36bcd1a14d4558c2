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

package com.netflix.fieldsan.sanitizer;

import java.util.List;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.netflix.fieldsan.common.util.ReflectionExt;
import com.netflix.fieldsan.common.util.StringExt;
import com.netflix.fieldsan.sanitizer.internal.DateReformatter;
import com.netflix.fieldsan.sanitizer.internal.DefaultEntitySanitizer;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;

import static com.netflix.fieldsan.sanitizer.SanitizerException.invalidConfiguration;

/**
 * {@link EntitySanitizer} builder. Each option can be set at most once. Invalid options are reported as
 * {@link SanitizerException} with the {@link SanitizerException.ErrorCode#InvalidConfiguration} error code.
 */
public class EntitySanitizerBuilder {

    private static final int MAX_TAG_NAME_LENGTH = 10;

    private static final Function<Class<?>, Boolean> ENTITY_CANDIDATE = type ->
            !ReflectionExt.isJdkType(type)
                    && !ReflectionExt.isStandardDataType(type)
                    && !type.isEnum()
                    && !type.isArray()
                    && !type.isAnnotation();

    private String tagName;
    private DateFormatOption dateFormatOption;
    private Function<Class<?>, Boolean> includesPredicate;
    private Registry registry;

    private EntitySanitizerBuilder() {
    }

    /**
     * Name of the {@link Sanitize#tag()} to read. Defaults to {@value Sanitize#DEFAULT_TAG}.
     */
    public EntitySanitizerBuilder withTagName(String tagName) {
        if (this.tagName != null) {
            throw invalidConfiguration("Tag name already set to '%s'", this.tagName);
        }
        if (tagName == null || tagName.isEmpty() || tagName.length() > MAX_TAG_NAME_LENGTH) {
            throw invalidConfiguration("Tag name '%s' must be between 1 and %s characters", tagName, MAX_TAG_NAME_LENGTH);
        }
        this.tagName = tagName;
        return this;
    }

    public EntitySanitizerBuilder withDateFormat(DateFormatOption dateFormatOption) {
        if (this.dateFormatOption != null) {
            throw invalidConfiguration("Date format already set to %s", this.dateFormatOption);
        }
        if (dateFormatOption == null) {
            throw invalidConfiguration("Date format option is null");
        }
        this.dateFormatOption = dateFormatOption;
        return this;
    }

    /**
     * Nested objects are sanitized recursively if their type is an entity type. By default all types outside of the JDK,
     * which are not a number, string, enum or array type, are entity types. Registering predicates restricts the
     * entity types to those accepted by at least one of them (multiple predicates are joined by logical 'or').
     */
    public EntitySanitizerBuilder processEntities(Function<Class<?>, Boolean> includesPredicate) {
        Preconditions.checkNotNull(includesPredicate, "null predicate");
        Function<Class<?>, Boolean> previous = this.includesPredicate;
        this.includesPredicate = previous == null
                ? includesPredicate
                : type -> previous.apply(type) || includesPredicate.apply(type);
        return this;
    }

    public EntitySanitizerBuilder withRegistry(Registry registry) {
        Preconditions.checkNotNull(registry, "null registry");
        this.registry = registry;
        return this;
    }

    /**
     * Reads the tag name and the date formats from the configuration. Date formats are set only if at least one
     * input format is configured.
     */
    public EntitySanitizerBuilder withConfiguration(FieldSanitizerConfiguration configuration) {
        withTagName(configuration.getTagName());

        List<String> inputFormats = StringExt.splitBySemicolon(configuration.getDateInputFormats());
        if (!inputFormats.isEmpty()) {
            String outputFormat = configuration.getDateOutputFormat();
            withDateFormat(DateFormatOption.newBuilder()
                    .withInputFormats(inputFormats)
                    .withOutputFormat(StringExt.isEmpty(outputFormat) ? null : outputFormat)
                    .withKeepFormat(configuration.isDateKeepFormat())
                    .build()
            );
        }
        return this;
    }

    public EntitySanitizer build() {
        DateReformatter dateReformatter;
        try {
            dateReformatter = dateFormatOption == null ? DateReformatter.none() : DateReformatter.from(dateFormatOption);
        } catch (IllegalArgumentException e) {
            throw invalidConfiguration(e, "Invalid date format option %s: %s", dateFormatOption, e.getMessage());
        }

        Function<Class<?>, Boolean> entityPredicate;
        if (includesPredicate == null) {
            entityPredicate = ENTITY_CANDIDATE;
        } else {
            Function<Class<?>, Boolean> includes = includesPredicate;
            entityPredicate = type -> ENTITY_CANDIDATE.apply(type) && includes.apply(type);
        }

        return new DefaultEntitySanitizer(
                tagName == null ? Sanitize.DEFAULT_TAG : tagName,
                dateReformatter,
                entityPredicate,
                registry == null ? new DefaultRegistry() : registry
        );
    }

    public static EntitySanitizerBuilder newBuilder() {
        return new EntitySanitizerBuilder();
    }
}
