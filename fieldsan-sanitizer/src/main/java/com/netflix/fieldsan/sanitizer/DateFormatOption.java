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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.util.Arrays.asList;

/**
 * Date formats used by the {@link Directive#Date} directive. A date string is parsed with the input formats, in order,
 * and the first one that matches wins. The parsed date is then printed with the output format, or with the matched
 * input format if {@link #isKeepFormat()} is set.
 * <p>
 * A format is either a {@link java.time.format.DateTimeFormatter} pattern, like 'yyyy-MM-dd', or a name of one of the
 * predefined {@link java.time.format.DateTimeFormatter} constants, like 'ISO_OFFSET_DATE_TIME' or 'RFC_1123_DATE_TIME'.
 */
public final class DateFormatOption {

    private final List<String> inputFormats;
    private final String outputFormat;
    private final boolean keepFormat;

    private DateFormatOption(List<String> inputFormats, String outputFormat, boolean keepFormat) {
        this.inputFormats = inputFormats;
        this.outputFormat = outputFormat;
        this.keepFormat = keepFormat;
    }

    public List<String> getInputFormats() {
        return inputFormats;
    }

    public Optional<String> getOutputFormat() {
        return Optional.ofNullable(outputFormat);
    }

    public boolean isKeepFormat() {
        return keepFormat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DateFormatOption that = (DateFormatOption) o;
        return keepFormat == that.keepFormat &&
                Objects.equals(inputFormats, that.inputFormats) &&
                Objects.equals(outputFormat, that.outputFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputFormats, outputFormat, keepFormat);
    }

    @Override
    public String toString() {
        return "DateFormatOption{" +
                "inputFormats=" + inputFormats +
                ", outputFormat='" + outputFormat + '\'' +
                ", keepFormat=" + keepFormat +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> inputFormats = Collections.emptyList();
        private String outputFormat;
        private boolean keepFormat;

        private Builder() {
        }

        public Builder withInputFormats(List<String> inputFormats) {
            this.inputFormats = inputFormats;
            return this;
        }

        public Builder withInputFormats(String... inputFormats) {
            return withInputFormats(asList(inputFormats));
        }

        public Builder withOutputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder withKeepFormat(boolean keepFormat) {
            this.keepFormat = keepFormat;
            return this;
        }

        public DateFormatOption build() {
            Objects.requireNonNull(inputFormats, "inputFormats");
            return new DateFormatOption(Collections.unmodifiableList(new ArrayList<>(inputFormats)), outputFormat, keepFormat);
        }
    }
}
