package com.newsdigest.aggregator.source;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Publication date parsing for feed items. Formats are tried in order and the
 * first one that parses wins. Values without an offset are taken as UTC.
 */
@UtilityClass
public class FeedDates {

    private final DateTimeFormatter RFC_822_ZONE_NAME =
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.US);
    private final DateTimeFormatter ISO_COMPACT_OFFSET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ", Locale.US);
    private final DateTimeFormatter ISO_MILLIS_COMPACT_OFFSET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ", Locale.US);

    private final List<Function<String, Instant>> PARSERS = List.of(
            v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            v -> ZonedDateTime.parse(v, RFC_822_ZONE_NAME).toInstant(),
            v -> OffsetDateTime.parse(v, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            v -> OffsetDateTime.parse(v, ISO_COMPACT_OFFSET).toInstant(),
            v -> OffsetDateTime.parse(v, ISO_MILLIS_COMPACT_OFFSET).toInstant(),
            v -> LocalDateTime.parse(v, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            v -> LocalDate.parse(v, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    public Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, v))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
