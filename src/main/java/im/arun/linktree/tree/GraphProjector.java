package im.arun.linktree.tree;

import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.BoundNode;
import im.arun.linktree.model.GraphEdge;
import im.arun.linktree.model.GraphNode;
import im.arun.linktree.model.GraphProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a bound forest into node and edge lists for a graph renderer.
 * Output is pre-order, so the same forest always projects to the same lists.
 * Nodes sharing a keyword on different paths stay separate.
 */
public class GraphProjector {
    private static final Logger logger = LoggerFactory.getLogger(GraphProjector.class);

    public GraphProjection project(BoundForest forest) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        // Explicit stack keeps very deep trees off the call stack
        Deque<BoundNode> pending = new ArrayDeque<>();
        Map<BoundNode, String> parentIds = new IdentityHashMap<>();
        List<BoundNode> roots = forest.getRoots();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }

        while (!pending.isEmpty()) {
            BoundNode node = pending.pop();
            nodes.add(new GraphNode(node.getId(), node.getKeyword(), node.getDepth(), node.getAggregateCount()));
            String parentId = parentIds.remove(node);
            if (parentId != null) {
                edges.add(new GraphEdge(parentId, node.getId()));
            }
            List<BoundNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                parentIds.put(children.get(i), node.getId());
                pending.push(children.get(i));
            }
        }

        logger.debug("Projected graph: {} nodes, {} edges", nodes.size(), edges.size());
        return new GraphProjection(Collections.unmodifiableList(nodes), Collections.unmodifiableList(edges));
    }
}
