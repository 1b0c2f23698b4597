package com.redditads.ingestion.cursor;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Day-by-day report cursor. Starts are held back by the conversion window because the Ads API
 * publishes recent days with a lag; the walk itself runs up to and including today (UTC).
 */
@Component
public class DateWindowCursor {

    private final Clock clock;

    public DateWindowCursor(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Clamp a requested start so it never lies inside the trailing {@code conversionWindowDays}.
     *
     * @return {@code today - conversionWindowDays} when the requested date is on or after it, else the requested date
     */
    public LocalDate validStart(LocalDate requestedDate, int conversionWindowDays) {
        if (conversionWindowDays < 0) {
            throw new IllegalArgumentException("conversionWindowDays must not be negative");
        }
        LocalDate settled = today().minusDays(conversionWindowDays);
        return requestedDate.isBefore(settled) ? requestedDate : settled;
    }

    /**
     * Move past the day just queried.
     *
     * @param currentDate      day just queried
     * @param lastSeenBookmark highest replication value observed so far, at least {@code currentDate}
     */
    public CursorStep advance(LocalDate currentDate, LocalDate lastSeenBookmark) {
        LocalDate today = today();
        LocalDate next = currentDate.isBefore(today) ? currentDate.plusDays(1) : currentDate;
        boolean done = !lastSeenBookmark.isBefore(today);
        return new CursorStep(next, done);
    }
}
