package io.procjobs.backend.model.query;

import lombok.Value;

import java.time.Instant;

/**
 * Creation time constraint of a job query.
 * Either an exact {@code match}, or an {@code after}/{@code before} range where each end may be open.
 */
@Value
public class DatetimeInterval {

    Instant after;
    Instant before;
    Instant match;

    public static DatetimeInterval exactly(Instant instant) {
        return new DatetimeInterval(null, null, instant);
    }

    public static DatetimeInterval between(Instant after, Instant before) {
        return new DatetimeInterval(after, before, null);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        if (match != null) {
            return match.equals(instant);
        }
        if (after != null && instant.isBefore(after)) {
            return false;
        }
        return before == null || !instant.isAfter(before);
    }
}
