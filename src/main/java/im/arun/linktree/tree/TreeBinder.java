package im.arun.linktree.tree;

import im.arun.linktree.config.BindingMode;
import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.BoundNode;
import im.arun.linktree.model.EngineWarning;
import im.arun.linktree.model.KeywordForest;
import im.arun.linktree.model.KeywordNode;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches procedure records to the keyword nodes their tags name.
 *
 * <p>A record lands on every matching node, wherever it sits in the forest. Counts are summed
 * bottom-up so each node reports the records bound at or below it.
 */
public class TreeBinder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBinder.class);

    private final BindingMode bindingMode;

    public TreeBinder(LinkTreeConfig config) {
        this.bindingMode = config.getBindingMode();
    }

    public BoundForest bind(KeywordForest forest, Collection<ProcedureRecord> records) {
        Map<String, List<ProcedureRecord>> recordsByTag = indexByTag(records);
        BoundForest result = new BoundForest();

        for (KeywordNode root : forest.getRoots()) {
            result.getRoots().add(bindTree(root, recordsByTag, result));
        }

        for (ProcedureRecord record : records) {
            if (result.boundNodeIds(record.getCode()).isEmpty()) {
                result.getUnbound().add(record);
                result.getWarnings().add(record.isUntagged()
                    ? EngineWarning.of(WarningType.UNBOUND_RECORD, record.getCode(),
                        "Record has no tags")
                    : EngineWarning.of(WarningType.UNBOUND_RECORD, record.getCode(),
                        "Tags %s match no node", record.getTags()));
            }
        }

        if (!result.getUnbound().isEmpty()) {
            logger.warn("{} of {} records are not bound to any node", result.getUnbound().size(), records.size());
        }
        logger.info("Bound {} records onto {} nodes ({} mode)",
            records.size() - result.getUnbound().size(), result.getNodesById().size(), bindingMode);
        return result;
    }

    /**
     * Index records by each of their tags, keeping collection order within a tag.
     */
    private Map<String, List<ProcedureRecord>> indexByTag(Collection<ProcedureRecord> records) {
        Map<String, List<ProcedureRecord>> index = new HashMap<>();
        for (ProcedureRecord record : records) {
            for (String tag : record.getTags()) {
                index.computeIfAbsent(tag, k -> new ArrayList<>()).add(record);
            }
        }
        return index;
    }

    /**
     * Bind one tree with an explicit stack, so depth is limited by heap rather than call stack.
     * Nodes are created and indexed in pre-order; aggregates are then summed in reverse pre-order,
     * which visits every child before its parent.
     */
    private BoundNode bindTree(KeywordNode root, Map<String, List<ProcedureRecord>> recordsByTag,
                               BoundForest result) {
        List<BoundNode> visited = new ArrayList<>();
        Deque<KeywordNode> pending = new ArrayDeque<>();
        Map<KeywordNode, BoundNode> boundParents = new IdentityHashMap<>();
        BoundNode boundRoot = null;
        pending.push(root);

        while (!pending.isEmpty()) {
            KeywordNode node = pending.pop();
            BoundNode bound = new BoundNode(node);
            String key = bindingMode == BindingMode.PATH ? node.getId() : node.getKeyword();
            bound.getDirectRecords().addAll(recordsByTag.getOrDefault(key, List.of()));

            result.getNodesById().put(bound.getId(), bound);
            for (ProcedureRecord record : bound.getDirectRecords()) {
                result.getNodeIdsByCode()
                    .computeIfAbsent(record.getCode(), k -> new ArrayList<>())
                    .add(bound.getId());
            }

            BoundNode boundParent = boundParents.remove(node);
            if (boundParent == null) {
                boundRoot = bound;
            } else {
                boundParent.getChildren().add(bound);
            }
            visited.add(bound);

            List<KeywordNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                boundParents.put(children.get(i), bound);
                pending.push(children.get(i));
            }
        }

        for (int i = visited.size() - 1; i >= 0; i--) {
            BoundNode bound = visited.get(i);
            int aggregate = bound.getDirectCount();
            for (BoundNode child : bound.getChildren()) {
                aggregate += child.getAggregateCount();
            }
            bound.setAggregateCount(aggregate);
        }
        return boundRoot;
    }
}
