package work.taskrun.core.collect;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Context of one collection run: project root, node collectors, the node identity cache and the task
 * function registry.
 */
public final class CollectionSession {
    private final Path root;
    private final List<NodeCollector> collectors = new CopyOnWriteArrayList<>();
    private final FilePathNodeCache cache = new FilePathNodeCache();
    private final TaskFunctionRegistry functions;

    public CollectionSession(Path root, TaskFunctionRegistry functions) {
        this.root = root == null
            ? Paths.get("").toAbsolutePath().normalize()
            : root.toAbsolutePath().normalize();
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    /**
     * Session with the file path collector and the builtin task functions installed.
     */
    public static CollectionSession create(Path root) {
        var session = new CollectionSession(root, new TaskFunctionRegistry());
        BuiltinTaskFunctions.register(session.functions(), session.root());
        session.registerCollector(new FilePathCollector());
        return session;
    }

    public Path root() {
        return root;
    }

    /**
     * Collectors are consulted in registration order.
     */
    public CollectionSession registerCollector(NodeCollector collector) {
        collectors.add(Objects.requireNonNull(collector, "collector"));
        return this;
    }

    public List<NodeCollector> collectors() {
        return List.copyOf(collectors);
    }

    public FilePathNodeCache cache() {
        return cache;
    }

    public TaskFunctionRegistry functions() {
        return functions;
    }

    /**
     * Forgets every node handed out so far. Call at the start of a run.
     */
    public void reset() {
        cache.reset();
    }
}
