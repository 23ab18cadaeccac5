package cyntientops.dailyops.model;

import java.util.Locale;

/**
 * Routine priority. The rank is what gets stored and sorted on.
 */
public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static TaskPriority fromRank(int rank) {
        for (TaskPriority p : values()) {
            if (p.rank == rank) {
                return p;
            }
        }
        return NORMAL;
    }

    /**
     * Derive the priority of an imported routine from its title and category.
     */
    public static TaskPriority derive(String taskName, String category) {
        String name = taskName == null ? "" : taskName.toLowerCase(Locale.ROOT);
        String cat = category == null ? "" : category.toLowerCase(Locale.ROOT);
        if (name.contains("emergency")) {
            return URGENT;
        }
        if (name.contains("inspection") || name.contains("compliance") || cat.equals("sanitation")) {
            return HIGH;
        }
        return NORMAL;
    }
}
