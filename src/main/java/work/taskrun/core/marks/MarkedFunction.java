package work.taskrun.core.marks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Task function carrying its markers and keyword arguments. Marking an already marked function adds to the
 * same layer instead of wrapping it again.
 */
public final class MarkedFunction implements WrappedFunction {
    private final TaskFunction wrapped;
    private final List<Mark> markers;
    private final Map<String, Object> kwargs;

    public MarkedFunction(TaskFunction wrapped, List<Mark> markers, Map<String, Object> kwargs) {
        this.wrapped = Objects.requireNonNull(wrapped, "wrapped");
        this.markers = markers == null ? List.of() : List.copyOf(markers);
        this.kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static MarkedFunction mark(TaskFunction function, Mark mark) {
        if (function instanceof MarkedFunction marked) {
            var markers = new ArrayList<>(marked.markers);
            markers.add(mark);
            return new MarkedFunction(marked.wrapped, markers, marked.kwargs);
        }
        return new MarkedFunction(function, List.of(mark), Map.of());
    }

    /**
     * Markers of the outermost marked layer, or an empty list for plain functions.
     */
    public static List<Mark> markersOf(TaskFunction function) {
        return function instanceof MarkedFunction marked ? marked.markers : List.of();
    }

    public static Map<String, Object> kwargsOf(TaskFunction function) {
        return function instanceof MarkedFunction marked ? marked.kwargs : Map.of();
    }

    @Override
    public TaskFunction wrapped() {
        return wrapped;
    }

    public List<Mark> markers() {
        return markers;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    public MarkedFunction withMarkers(List<Mark> newMarkers) {
        return new MarkedFunction(wrapped, newMarkers, kwargs);
    }

    @Override
    public void call(Map<String, Object> arguments) throws Exception {
        wrapped.call(arguments);
    }
}
