package com.cronix.cron;

/**
 * Thrown when a cron expression cannot be parsed: wrong field count, a value
 * outside the field's range, or malformed syntax.
 */
public class InvalidScheduleException extends IllegalArgumentException {
    private final String expression;

    public InvalidScheduleException(String expression, String message) {
        super("invalid schedule '" + expression + "': " + message);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
