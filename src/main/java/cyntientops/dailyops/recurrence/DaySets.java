package cyntientops.dailyops.recurrence;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Day-of-week abbreviations ("mon".."sun") and comma-list parsing.
 */
public final class DaySets {

    private DaySets() {
    }

    /** Lowercase three-letter abbreviation, e.g. "mon" */
    public static String abbreviation(DayOfWeek day) {
        return day.name().substring(0, 3).toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a list such as "Mon, wed,FRI" or "monday,tuesday".
     * Unknown tokens are dropped; null or blank input yields an empty set.
     */
    public static Set<DayOfWeek> parse(String list) {
        if (list == null || list.isBlank()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(DayOfWeek.class));
        }
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String raw : list.split("[,\\s]+")) {
            DayOfWeek day = fromToken(raw);
            if (day != null) {
                days.add(day);
            }
        }
        return Collections.unmodifiableSet(days);
    }

    static DayOfWeek fromToken(String token) {
        String t = token.trim().toLowerCase(Locale.ROOT);
        if (t.length() < 3) {
            return null;
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            String full = day.name().toLowerCase(Locale.ROOT);
            if (t.equals(full) || t.equals(abbreviation(day))) {
                return day;
            }
        }
        return null;
    }
}
