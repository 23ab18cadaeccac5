package cyntientops.dailyops.recurrence;

import java.util.Locale;

/**
 * Closed recurrence vocabulary. {@link #UNRECOGNIZED} is never due.
 */
public enum Frequency {
    DAILY("daily"),
    WEEKDAYS("weekdays"),
    WEEKENDS("weekends"),
    WEEKLY("weekly"),
    BIWEEKLY("bi-weekly", "biweekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly", "annually", "annual"),
    /** Comma list of day abbreviations, e.g. "mon,wed,fri" */
    CUSTOM(),
    UNRECOGNIZED();

    private final String[] names;

    Frequency(String... names) {
        this.names = names;
    }

    /**
     * Match a named frequency. Returns null for comma lists and unknown values;
     * use {@link Recurrence#parse(String)} for the full vocabulary.
     */
    static Frequency named(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Frequency f : values()) {
            for (String name : f.names) {
                if (name.equals(v)) {
                    return f;
                }
            }
        }
        return null;
    }
}
