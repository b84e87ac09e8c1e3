package taskweave.engine.model;

/**
 * Task priority levels. Lower level value means the task is dispatched earlier.
 */
public enum TaskPriority {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3),
    BACKGROUND(4);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static TaskPriority fromLevel(int level) {
        for (TaskPriority p : values()) {
            if (p.level == level) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}
