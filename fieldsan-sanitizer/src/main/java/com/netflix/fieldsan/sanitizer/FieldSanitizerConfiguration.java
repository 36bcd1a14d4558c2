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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "fieldsan.sanitizer")
public interface FieldSanitizerConfiguration {

    /**
     * @return name of the {@link Sanitize} tag to read (between 1 and 10 characters)
     */
    @DefaultValue(Sanitize.DEFAULT_TAG)
    String getTagName();

    /**
     * @return semicolon separated list of accepted date input formats. If empty, no date format option is configured.
     */
    @DefaultValue("")
    String getDateInputFormats();

    @DefaultValue("")
    String getDateOutputFormat();

    /**
     * @return if true, a reformatted date keeps the input format it was parsed with
     */
    @DefaultValue("false")
    boolean isDateKeepFormat();
}
