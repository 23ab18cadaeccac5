package cyntientops.dailyops.recurrence;

import cyntientops.dailyops.model.RoutineTemplate;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a template has an occurrence on a calendar date.
 * Pure: no I/O, no clock, no platform calendar; ISO week fields only.
 *
 * <p>The explicit day-of-week set is checked first and applies to every
 * frequency; the frequency rule is checked second.
 */
public final class RecurrenceEngine {

    public boolean isDue(RoutineTemplate template, LocalDate date) {
        return isDue(template.recurrence(), template.dayGate(), date);
    }

    public boolean isDue(Recurrence recurrence, Optional<Set<DayOfWeek>> dayGate, LocalDate date) {
        DayOfWeek weekday = date.getDayOfWeek();

        if (dayGate.isPresent() && !dayGate.get().contains(weekday)) {
            return false;
        }

        return switch (recurrence.frequency()) {
            case DAILY -> true;
            case WEEKDAYS -> weekday != DayOfWeek.SATURDAY && weekday != DayOfWeek.SUNDAY;
            case WEEKENDS -> weekday == DayOfWeek.SATURDAY || weekday == DayOfWeek.SUNDAY;
            case WEEKLY -> true;
            case BIWEEKLY -> weekday == DayOfWeek.MONDAY && date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR) % 2 == 0;
            case MONTHLY -> date.getDayOfMonth() == 1;
            case QUARTERLY -> date.getDayOfMonth() == 1 && (date.getMonthValue() - 1) % 3 == 0;
            case YEARLY -> date.getDayOfMonth() == 1 && date.getMonthValue() == 1;
            case CUSTOM -> recurrence.customDays().contains(weekday);
            case UNRECOGNIZED -> false;
        };
    }
}
