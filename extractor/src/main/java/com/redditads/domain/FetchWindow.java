package com.redditads.domain;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inclusive report date range sent as {@code starts_at} / {@code ends_at}.
 */
public record FetchWindow(LocalDate startsAt, LocalDate endsAt) {

    public FetchWindow {
        if (startsAt == null || endsAt == null) {
            throw new IllegalArgumentException("startsAt and endsAt are required");
        }
        if (endsAt.isBefore(startsAt)) {
            throw new IllegalArgumentException("endsAt " + endsAt + " is before startsAt " + startsAt);
        }
    }

    public static FetchWindow singleDay(LocalDate day) {
        return new FetchWindow(day, day);
    }

    /** Query parameters in request order (YYYY-MM-DD). */
    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("starts_at", startsAt.toString());
        params.put("ends_at", endsAt.toString());
        return params;
    }
}
