package com.redditads.ingestion.cursor;

import java.time.LocalDate;

/**
 * Result of one cursor advance: the next day to query and whether the walk has reached today.
 */
public record CursorStep(LocalDate nextDate, boolean done) {
}
