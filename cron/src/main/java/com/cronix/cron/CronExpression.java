package com.cronix.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

/**
 * A parsed 5-field ({@code minute hour day month weekday}) or 6-field
 * ({@code second minute hour day month weekday}) cron expression.
 *
 * <p>Every field must match for a time to fire, including day-of-month and
 * day-of-week together. Instances are immutable and safe to share.
 */
public final class CronExpression {
    static final int SEARCH_HORIZON_YEARS = 4;

    private static final Map<String, String> DESCRIPTORS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private static final CronParser MINUTES = new CronParser(definition(false));
    private static final CronParser SECONDS = new CronParser(definition(true));

    private final String expression;
    private final String fields;
    private final boolean withSeconds;
    private final Cron cron;
    private final ExecutionTime executionTime;

    private CronExpression(String expression, String fields, boolean withSeconds, Cron cron) {
        this.expression = expression;
        this.fields = fields;
        this.withSeconds = withSeconds;
        this.cron = cron;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    /**
     * Unix crontab fields, optionally preceded by seconds. Sunday is 0 or 7 and
     * both day fields must match.
     */
    private static CronDefinition definition(boolean withSeconds) {
        CronDefinitionBuilder builder = CronDefinitionBuilder.defineCron();
        if (withSeconds) {
            builder = builder.withSeconds().withValidRange(0, 59).withStrictRange().and();
        }
        return builder
                .withMinutes().withValidRange(0, 59).withStrictRange().and()
                .withHours().withValidRange(0, 23).withStrictRange().and()
                .withDayOfMonth().withValidRange(1, 31).withStrictRange().and()
                .withMonth().withValidRange(1, 12).withStrictRange().and()
                .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).withIntMapping(7, 0)
                .withStrictRange().and()
                .matchDayOfWeekAndDayOfMonth()
                .instance();
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String fields = trimmed;
        if (trimmed.startsWith("@")) {
            fields = DESCRIPTORS.get(trimmed.toLowerCase(Locale.ROOT));
            if (fields == null) {
                throw new InvalidScheduleException(trimmed, "unknown descriptor");
            }
        }

        String[] parts = fields.split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            throw new InvalidScheduleException(trimmed,
                    "expected 5 or 6 fields but found " + parts.length);
        }
        // '?' means "any" in the two day fields only
        int dayOfMonth = parts.length - 3;
        for (int i = dayOfMonth; i < parts.length; i += 2) {
            if ("?".equals(parts[i])) {
                parts[i] = "*";
            }
        }
        boolean withSeconds = parts.length == 6;
        String normalized = String.join(" ", parts);
        try {
            Cron cron = (withSeconds ? SECONDS : MINUTES).parse(normalized);
            cron.validate();
            return new CronExpression(trimmed, normalized, withSeconds, cron);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(trimmed, e.getMessage());
        }
    }

    /**
     * Returns true if {@code expression} parses.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    public Instant next(Instant after, ZoneId zone) {
        return next(ZonedDateTime.ofInstant(after, zone)).toInstant();
    }

    /**
     * Earliest time strictly after {@code after} that matches every field.
     *
     * @throws NoUpcomingFireTimeException if nothing matches within four years
     */
    public ZonedDateTime next(ZonedDateTime after) {
        Optional<ZonedDateTime> next;
        try {
            next = executionTime.nextExecution(after);
        } catch (IllegalArgumentException e) {
            throw new NoUpcomingFireTimeException(expression, after);
        }
        ZonedDateTime limit = after.plusYears(SEARCH_HORIZON_YEARS);
        if (next.isEmpty() || next.get().isAfter(limit)) {
            throw new NoUpcomingFireTimeException(expression, after);
        }
        return next.get();
    }

    public boolean hasSeconds() {
        return withSeconds;
    }

    /**
     * The expression as written, trimmed.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * The field list with descriptors such as {@code @daily} expanded.
     */
    public String getFields() {
        return fields;
    }

    /**
     * The cron-utils model, for describing the schedule.
     */
    public Cron getCron() {
        return cron;
    }

    public int fieldCount() {
        return withSeconds ? 6 : 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronExpression)) {
            return false;
        }
        return fields.equals(((CronExpression) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
