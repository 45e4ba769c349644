package conductor.coordinator.model;

/**
 * Task priority, highest first.
 */
public enum TaskPriority {
    CRITICAL(3),
    HIGH(2),
    NORMAL(1),
    LOW(0);

    private final int weight;

    TaskPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Lenient parse used by the API layer. Null or blank means NORMAL.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TaskPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
