package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.taskrun.core.marks.Declarations;
import work.taskrun.core.marks.Mark;
import work.taskrun.core.marks.MarkedFunction;
import work.taskrun.core.marks.MarkerExtractor;
import work.taskrun.core.marks.TaskFunction;
import work.taskrun.core.marks.WrappedFunction;
import work.taskrun.core.nodes.FunctionTask;
import work.taskrun.core.nodes.Node;
import work.taskrun.core.nodes.NodeMerger;
import work.taskrun.core.nodes.NodeSpec;
import work.taskrun.core.nodes.NodeTree;
import work.taskrun.core.shared.Names;

/**
 * Builds tasks from a marked task function: extracts the declarations, normalizes and merges them and
 * resolves every reference into a node.
 */
public final class TaskFactory {
    private TaskFactory() {}

    public static FunctionTask create(Path path, String baseName, TaskFunction function, CollectionSession session) {
        String name = Names.createTaskName(path, baseName);

        var dependencies = MarkerExtractor.removeMarkers(function, Declarations.DEPENDS_ON);
        NodeTree<Node> dependsOn = collectNodes(session, path, name, dependencies.markers(), Declarations.DEPENDS_ON);

        var products = MarkerExtractor.removeMarkers(dependencies.function(), Declarations.PRODUCES);
        NodeTree<Node> produces = collectNodes(session, path, name, products.markers(), Declarations.PRODUCES);

        TaskFunction remaining = products.function();
        return FunctionTask.builder()
            .baseName(baseName)
            .name(name)
            .path(path)
            .function(WrappedFunction.unwrap(function))
            .dependsOn(dependsOn)
            .produces(produces)
            .markers(MarkedFunction.markersOf(remaining))
            .kwargs(MarkedFunction.kwargsOf(remaining))
            .build();
    }

    private static NodeTree<Node> collectNodes(
        CollectionSession session,
        Path path,
        String taskName,
        List<Mark> markers,
        String kind
    ) {
        List<NodeSpec> declarations = new ArrayList<>(markers.size());
        for (Mark mark : markers) {
            declarations.add(Declarations.parse(mark));
        }
        NodeTree<Object> references = NodeMerger.mergeDeclarations(declarations, kind);
        return references.map(reference -> NodeResolver.resolve(session, path, taskName, reference));
    }
}
