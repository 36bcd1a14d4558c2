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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares sanitization directives for a field. The value is a comma separated list of directives, where each
 * directive is either a flag (for example <code>trim</code>) or a name/value pair (for example <code>max=5</code>):
 * <pre>
 * &#64;Sanitize("max=5,trim,lower")
 * private String name;
 * </pre>
 * An {@link EntitySanitizer} reads only the annotation whose {@link #tag()} matches its configured tag name, so
 * the same field may carry directives for several differently configured sanitizers.
 *
 * @see Directive
 */
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(Sanitize.List.class)
public @interface Sanitize {

    /**
     * Tag name used when none is configured.
     */
    String DEFAULT_TAG = "san";

    /**
     * Comma separated directives.
     */
    String value();

    /**
     * Name of the tag this annotation belongs to.
     */
    String tag() default DEFAULT_TAG;

    @Target({ElementType.FIELD})
    @Retention(RetentionPolicy.RUNTIME)
    @Documented
    @interface List {
        Sanitize[] value();
    }
}
