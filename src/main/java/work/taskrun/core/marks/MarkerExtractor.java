package work.taskrun.core.marks;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the markers with a given name off a task function.
 */
public final class MarkerExtractor {
    private MarkerExtractor() {}

    public static Extraction removeMarkers(TaskFunction function, String name) {
        if (!(function instanceof MarkedFunction marked)) {
            return new Extraction(function, List.of());
        }
        List<Mark> removed = new ArrayList<>();
        List<Mark> remaining = new ArrayList<>();
        for (Mark mark : marked.markers()) {
            if (mark.name().equals(name)) {
                removed.add(mark);
            } else {
                remaining.add(mark);
            }
        }
        return new Extraction(marked.withMarkers(remaining), List.copyOf(removed));
    }

    /**
     * @param function the function without the extracted markers
     * @param markers the extracted markers in declaration order
     */
    public record Extraction(TaskFunction function, List<Mark> markers) {}
}
