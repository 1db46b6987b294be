package com.cronix.cron;

import java.time.ZonedDateTime;

/**
 * Thrown when an expression has no fire time inside the search horizon, e.g. {@code 0 0 30 2 *}.
 */
public class NoUpcomingFireTimeException extends IllegalStateException {
    public NoUpcomingFireTimeException(String expression, ZonedDateTime after) {
        super("schedule '" + expression + "' has no fire time within "
                + CronExpression.SEARCH_HORIZON_YEARS + " years after " + after);
    }
}
