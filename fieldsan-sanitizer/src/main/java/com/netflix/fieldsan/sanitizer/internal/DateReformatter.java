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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.netflix.fieldsan.sanitizer.DateFormatOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reformats date strings according to a {@link DateFormatOption}. Input values are resolved strictly, so a value
 * naming a non-existent date does not match. Dates without a time zone are interpreted as UTC, dates without a time
 * as the start of the day, partial dates as the first day of the period, and times without a date as a time
 * of {@link #DEFAULT_DATE}.
 */
public class DateReformatter {

    private static final Logger logger = LoggerFactory.getLogger(DateReformatter.class);

    private static final Map<String, DateTimeFormatter> PREDEFINED_FORMATTERS = ImmutableMap.<String, DateTimeFormatter>builder()
            .put("BASIC_ISO_DATE", DateTimeFormatter.BASIC_ISO_DATE)
            .put("ISO_LOCAL_DATE", DateTimeFormatter.ISO_LOCAL_DATE)
            .put("ISO_OFFSET_DATE", DateTimeFormatter.ISO_OFFSET_DATE)
            .put("ISO_DATE", DateTimeFormatter.ISO_DATE)
            .put("ISO_LOCAL_DATE_TIME", DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .put("ISO_OFFSET_DATE_TIME", DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .put("ISO_ZONED_DATE_TIME", DateTimeFormatter.ISO_ZONED_DATE_TIME)
            .put("ISO_DATE_TIME", DateTimeFormatter.ISO_DATE_TIME)
            .put("ISO_ORDINAL_DATE", DateTimeFormatter.ISO_ORDINAL_DATE)
            .put("ISO_WEEK_DATE", DateTimeFormatter.ISO_WEEK_DATE)
            .put("ISO_INSTANT", DateTimeFormatter.ISO_INSTANT)
            .put("RFC_1123_DATE_TIME", DateTimeFormatter.RFC_1123_DATE_TIME)
            .build();

    static final LocalDate DEFAULT_DATE = LocalDate.of(1970, 1, 1);

    private static final DateReformatter NONE = new DateReformatter(Collections.emptyList(), null, false);

    private final List<DateTimeFormatter> inputFormatters;
    private final DateTimeFormatter outputFormatter;
    private final boolean keepFormat;

    private DateReformatter(List<DateTimeFormatter> inputFormatters, DateTimeFormatter outputFormatter, boolean keepFormat) {
        this.inputFormatters = inputFormatters;
        this.outputFormatter = outputFormatter;
        this.keepFormat = keepFormat;
    }

    public boolean isConfigured() {
        return !inputFormatters.isEmpty();
    }

    /**
     * Returns the date printed in the output format, or an empty string if the value does not match any of the
     * input formats.
     */
    public String reformat(String value) {
        for (DateTimeFormatter inputFormatter : inputFormatters) {
            Optional<ZonedDateTime> parsed = parse(inputFormatter, value);
            if (parsed.isPresent()) {
                DateTimeFormatter formatter = keepFormat ? inputFormatter : outputFormatter;
                try {
                    return formatter.format(parsed.get());
                } catch (DateTimeException e) {
                    logger.debug("Cannot print date {} parsed from '{}': {}", parsed.get(), value, e.getMessage());
                    return "";
                }
            }
        }
        return "";
    }

    private static Optional<ZonedDateTime> parse(DateTimeFormatter formatter, String value) {
        TemporalAccessor parsed;
        try {
            parsed = formatter.parseBest(value,
                    ZonedDateTime::from, LocalDateTime::from, LocalDate::from, YearMonth::from, Year::from,
                    LocalTime::from, Instant::from
            );
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        if (parsed instanceof ZonedDateTime) {
            return Optional.of((ZonedDateTime) parsed);
        }
        if (parsed instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) parsed).atZone(ZoneOffset.UTC));
        }
        if (parsed instanceof LocalDate) {
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC));
        }
        if (parsed instanceof YearMonth) {
            return Optional.of(((YearMonth) parsed).atDay(1).atStartOfDay(ZoneOffset.UTC));
        }
        if (parsed instanceof Year) {
            return Optional.of(((Year) parsed).atDay(1).atStartOfDay(ZoneOffset.UTC));
        }
        if (parsed instanceof LocalTime) {
            return Optional.of(((LocalTime) parsed).atDate(DEFAULT_DATE).atZone(ZoneOffset.UTC));
        }
        return Optional.of(((Instant) parsed).atZone(ZoneOffset.UTC));
    }

    public static DateReformatter none() {
        return NONE;
    }

    /**
     * @throws IllegalArgumentException if the formats are invalid, or the option is incomplete
     */
    public static DateReformatter from(DateFormatOption option) {
        Preconditions.checkArgument(!option.getInputFormats().isEmpty(), "at least one input format required");
        Preconditions.checkArgument(option.isKeepFormat() || option.getOutputFormat().isPresent(),
                "output format required if the input format is not kept");

        List<DateTimeFormatter> inputFormatters = new ArrayList<>();
        for (String inputFormat : option.getInputFormats()) {
            inputFormatters.add(toFormatter(inputFormat));
        }
        DateTimeFormatter outputFormatter = option.getOutputFormat().map(DateReformatter::toFormatter).orElse(null);
        return new DateReformatter(Collections.unmodifiableList(inputFormatters), outputFormatter, option.isKeepFormat());
    }

    /**
     * Pattern based formatters default the era, so the year-of-era letter 'y' resolves under
     * {@link ResolverStyle#STRICT} the same way as the proleptic year letter 'u'.
     */
    static DateTimeFormatter toFormatter(String format) {
        Preconditions.checkArgument(format != null && !format.isEmpty(), "empty date format");
        DateTimeFormatter predefined = PREDEFINED_FORMATTERS.get(format);
        if (predefined != null) {
            return predefined.withResolverStyle(ResolverStyle.STRICT);
        }
        return new DateTimeFormatterBuilder()
                .appendPattern(format)
                .parseDefaulting(ChronoField.ERA, 1)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
