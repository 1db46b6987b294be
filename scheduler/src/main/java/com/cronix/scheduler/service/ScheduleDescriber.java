package com.cronix.scheduler.service;

import java.util.Locale;

import com.cronix.cron.CronExpression;
import com.cronix.cron.InvalidScheduleException;
import com.cronutils.descriptor.CronDescriptor;

import lombok.extern.slf4j.Slf4j;

/**
 * Human readable schedules ("every 5 minutes") for the job list, described from
 * the same parsed expression the scheduler fires on. Falls back to the raw
 * expression when cron-utils cannot describe it.
 */
@Slf4j
public class ScheduleDescriber {
    private final CronDescriptor descriptor = CronDescriptor.instance(Locale.UK);

    public String describe(String schedule) {
        CronExpression cron;
        try {
            cron = CronExpression.parse(schedule);
        } catch (InvalidScheduleException e) {
            return schedule;
        }
        try {
            return descriptor.describe(cron.getCron());
        } catch (RuntimeException e) {
            log.debug("No description for '{}': {}", schedule, e.getMessage());
            return cron.getExpression();
        }
    }
}
