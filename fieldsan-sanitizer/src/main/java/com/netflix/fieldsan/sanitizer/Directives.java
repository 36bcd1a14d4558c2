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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.netflix.fieldsan.common.util.StringExt;

/**
 * Directives resolved from a single {@link Sanitize} annotation value. Flag directives (without '=') have no value.
 */
public final class Directives {

    private static final Directives EMPTY = new Directives(new EnumMap<>(Directive.class), Collections.emptySet());

    private final Map<Directive, String> values;
    private final Set<String> unknownNames;

    private Directives(Map<Directive, String> values, Set<String> unknownNames) {
        this.values = values;
        this.unknownNames = unknownNames;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(Directive directive) {
        return values.containsKey(directive);
    }

    /**
     * Returns the directive value, or {@link Optional#empty()} if the directive is absent or is a flag.
     */
    public Optional<String> getValue(Directive directive) {
        return Optional.ofNullable(values.get(directive));
    }

    public Set<Directive> getDirectives() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Names found in the annotation value that do not match any {@link Directive}.
     */
    public Set<String> getUnknownNames() {
        return unknownNames;
    }

    @Override
    public String toString() {
        return "Directives{" +
                "values=" + values +
                ", unknownNames=" + unknownNames +
                '}';
    }

    public static Directives empty() {
        return EMPTY;
    }

    /**
     * Parses an annotation value like "max=5,trim,lower". A component containing '=' is split at the first '='
     * into a name and a value, and a component without '=' is a flag. Names are trimmed, values are kept as is.
     * Empty components are ignored, and if a directive is repeated the last occurrence wins.
     */
    public static Directives parse(String text) {
        if (StringExt.isEmpty(text)) {
            return EMPTY;
        }
        Map<Directive, String> values = new EnumMap<>(Directive.class);
        Set<String> unknownNames = new LinkedHashSet<>();
        for (String component : text.split(",")) {
            int idx = component.indexOf('=');
            String name = StringExt.safeTrim(idx < 0 ? component : component.substring(0, idx));
            if (name.isEmpty()) {
                continue;
            }
            String value = idx < 0 ? null : component.substring(idx + 1);
            Optional<Directive> directive = Directive.fromTagName(name);
            if (directive.isPresent()) {
                values.put(directive.get(), value);
            } else {
                unknownNames.add(name);
            }
        }
        return new Directives(values, unknownNames.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(unknownNames));
    }
}
