package com.yourcompany.fakeidp.saml;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Validity window of one response, derived from a single captured instant so that every timestamp in the
 * document is consistent. Values are rendered as UTC {@code xs:dateTime} with second precision.
 */
public final class ResponseTimestamps {

    static final Duration NOT_BEFORE_SKEW = Duration.ofSeconds(5);
    static final Duration CONDITIONS_LIFETIME = Duration.ofHours(1);
    static final Duration SUBJECT_CONFIRMATION_LIFETIME = Duration.ofMinutes(3);

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Instant issueInstant;

    private ResponseTimestamps(Instant issueInstant) {
        this.issueInstant = issueInstant.truncatedTo(ChronoUnit.SECONDS);
    }

    public static ResponseTimestamps capture(Clock clock) {
        return new ResponseTimestamps(Objects.requireNonNull(clock, "Clock is required").instant());
    }

    public static ResponseTimestamps at(Instant instant) {
        return new ResponseTimestamps(Objects.requireNonNull(instant, "Instant is required"));
    }

    public Instant getIssueInstant() {
        return issueInstant;
    }

    public Instant getNotBefore() {
        return issueInstant.minus(NOT_BEFORE_SKEW);
    }

    public Instant getNotOnOrAfter() {
        return issueInstant.plus(CONDITIONS_LIFETIME);
    }

    public Instant getSubjectConfirmationNotOnOrAfter() {
        return issueInstant.plus(SUBJECT_CONFIRMATION_LIFETIME);
    }

    public static String format(Instant instant) {
        return FORMATTER.format(instant);
    }
}
