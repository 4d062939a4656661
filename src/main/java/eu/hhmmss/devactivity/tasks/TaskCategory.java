package eu.hhmmss.devactivity.tasks;

import java.util.Arrays;
import java.util.Optional;

/**
 * Area of work a closed task belongs to, written as a single trailing letter in task lists.
 */
public enum TaskCategory {
    INFRASTRUCTURE('I'),
    FRONTEND('F'),
    BACKEND('B');

    private final char marker;

    TaskCategory(char marker) {
        this.marker = marker;
    }

    public char getMarker() {
        return marker;
    }

    public static Optional<TaskCategory> fromMarker(char marker) {
        return Arrays.stream(values())
                .filter(category -> category.getMarker() == marker)
                .findFirst();
    }
}
