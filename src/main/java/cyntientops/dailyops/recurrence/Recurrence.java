package cyntientops.dailyops.recurrence;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Parsed recurrence rule.
 *
 * @param customDays days listed by a {@link Frequency#CUSTOM} value; empty otherwise
 */
public record Recurrence(Frequency frequency, Set<DayOfWeek> customDays, String raw) {

    public Recurrence {
        customDays = Set.copyOf(customDays);
    }

    public static Recurrence parse(String value) {
        if (value == null || value.isBlank()) {
            return new Recurrence(Frequency.UNRECOGNIZED, Set.of(), value);
        }
        Frequency named = Frequency.named(value);
        if (named != null) {
            return new Recurrence(named, Set.of(), value);
        }
        if (value.contains(",")) {
            return new Recurrence(Frequency.CUSTOM, DaySets.parse(value), value);
        }
        return new Recurrence(Frequency.UNRECOGNIZED, Set.of(), value);
    }

    public boolean isRecognized() {
        return frequency != Frequency.UNRECOGNIZED;
    }
}
