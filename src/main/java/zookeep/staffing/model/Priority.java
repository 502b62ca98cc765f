package zookeep.staffing.model;

/**
 * Task priority levels. Lower value is more urgent.
 */
public final class Priority {
    public static final int URGENT = 0;
    public static final int NORMAL = 1;
    public static final int LOW = 2;

    private Priority() {
    }

    public static boolean isValid(int priority) {
        return priority >= URGENT && priority <= LOW;
    }

    public static String label(int priority) {
        return switch (priority) {
            case URGENT -> "URGENT";
            case NORMAL -> "NORMAL";
            case LOW -> "LOW";
            default -> "P" + priority;
        };
    }
}
