package im.arun.linktree.tree;

import im.arun.linktree.config.BindingMode;
import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.BoundNode;
import im.arun.linktree.model.KeywordForest;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeBinderTest {

    private static final String TREE = "Root\n    ChildA\n    ChildB";

    private KeywordTreeParser parser;
    private TreeBinder binder;

    @BeforeEach
    void setUp() {
        LinkTreeConfig config = new LinkTreeConfig();
        parser = new KeywordTreeParser(config);
        binder = new TreeBinder(config);
    }

    @Test
    void testRecordBindsToMatchingKeyword() {
        ProcedureRecord p1 = record("P1", "Install Widget", "ChildA");

        BoundForest bound = binder.bind(parser.parse(TREE), List.of(p1));

        assertEquals(List.of(p1), node(bound, "Root/ChildA").getDirectRecords());
        assertTrue(node(bound, "Root").getDirectRecords().isEmpty());
        assertEquals(1, node(bound, "Root").getAggregateCount());
        assertEquals(0, node(bound, "Root/ChildB").getAggregateCount());
        assertEquals(List.of("Root/ChildA"), bound.boundNodeIds("P1"));
        assertTrue(bound.getUnbound().isEmpty());
    }

    @Test
    void testRecordTaggedAtParentAndChildCountsTwiceAtParent() {
        ProcedureRecord p1 = record("P1", "Install Widget", "ChildA", "Root");

        BoundForest bound = binder.bind(parser.parse(TREE), List.of(p1));

        assertEquals(1, node(bound, "Root").getDirectCount());
        assertEquals(1, node(bound, "Root/ChildA").getDirectCount());
        assertEquals(2, node(bound, "Root").getAggregateCount());
        assertEquals(List.of("Root", "Root/ChildA"), bound.boundNodeIds("P1"));
    }

    @Test
    void testRepeatedKeywordFansOutToEveryBranch() {
        KeywordForest forest = parser.parse("Pumps\n    Seal\nValves\n    Seal\n        Seal");
        ProcedureRecord p1 = record("P1", "Replace seal", "Seal");

        BoundForest bound = binder.bind(forest, List.of(p1));

        assertEquals(List.of("Pumps/Seal", "Valves/Seal", "Valves/Seal/Seal"), bound.boundNodeIds("P1"));
        assertEquals(1, node(bound, "Pumps").getAggregateCount());
        assertEquals(2, node(bound, "Valves").getAggregateCount());
    }

    @Test
    void testDirectRecordsKeepCollectionOrder() {
        ProcedureRecord b = record("B", "Second", "ChildA");
        ProcedureRecord a = record("A", "First", "ChildA");

        BoundForest bound = binder.bind(parser.parse(TREE), List.of(b, a));

        assertEquals(List.of(b, a), node(bound, "Root/ChildA").getDirectRecords());
    }

    @Test
    void testUnmatchedAndUntaggedRecordsAreKeptAsUnbound() {
        ProcedureRecord stray = record("P2", "Stray", "Nowhere");
        ProcedureRecord untagged = record("P3", "Untagged");
        ProcedureRecord bound1 = record("P1", "Bound", "ChildB");

        BoundForest bound = binder.bind(parser.parse(TREE), List.of(stray, untagged, bound1));

        assertEquals(List.of(stray, untagged), bound.getUnbound());
        assertEquals(2, bound.getWarnings().size());
        assertTrue(bound.getWarnings().stream().allMatch(w -> w.getType() == WarningType.UNBOUND_RECORD));
        assertEquals("P2", bound.getWarnings().get(0).getSubject());
        assertTrue(bound.boundNodeIds("P2").isEmpty());
    }

    @Test
    void testPathModeMatchesFullIdOnly() {
        LinkTreeConfig config = new LinkTreeConfig();
        config.setBindingMode(BindingMode.PATH);
        TreeBinder pathBinder = new TreeBinder(config);
        KeywordForest forest = parser.parse("Pumps\n    Seal\nValves\n    Seal");
        ProcedureRecord byPath = record("P1", "Valve seal", "Valves/Seal");
        ProcedureRecord byKeyword = record("P2", "Any seal", "Seal");

        BoundForest bound = pathBinder.bind(forest, List.of(byPath, byKeyword));

        assertEquals(List.of("Valves/Seal"), bound.boundNodeIds("P1"));
        assertEquals(0, node(bound, "Pumps").getAggregateCount());
        assertEquals(List.of(byKeyword), bound.getUnbound());
    }

    @Test
    void testFindNodeResolvesIdsFromEveryRoot() {
        BoundForest bound = binder.bind(parser.parse(TREE, "Misc\n    Notes"), List.of());

        assertTrue(bound.findNode("Misc/Notes").isPresent());
        assertTrue(bound.findNode("Root/ChildB").isPresent());
        assertFalse(bound.findNode("Root/Missing").isPresent());
        assertEquals(5, bound.getNodesById().size());
    }

    @Test
    void testAggregateEqualsDirectPlusChildrenForRandomTrees() {
        Random random = new Random(7);
        String[] pool = {"a", "b", "c", "d", "e", "f"};

        for (int round = 0; round < 50; round++) {
            StringBuilder text = new StringBuilder();
            int lines = 1 + random.nextInt(30);
            for (int i = 0; i < lines; i++) {
                text.append("    ".repeat(random.nextInt(5)))
                    .append(pool[random.nextInt(pool.length)])
                    .append('\n');
            }

            List<ProcedureRecord> records = new ArrayList<>();
            int recordCount = random.nextInt(20);
            for (int i = 0; i < recordCount; i++) {
                Set<String> tags = new LinkedHashSet<>();
                int tagCount = random.nextInt(3);
                for (int t = 0; t < tagCount; t++) {
                    tags.add(pool[random.nextInt(pool.length)]);
                }
                records.add(new ProcedureRecord("R" + i, "Record " + i, "http://x/" + i, tags));
            }

            BoundForest bound = binder.bind(parser.parse(text.toString()), records);

            int directTotal = 0;
            for (BoundNode node : bound.getNodesById().values()) {
                int expected = node.getDirectCount();
                for (BoundNode child : node.getChildren()) {
                    expected += child.getAggregateCount();
                }
                assertEquals(expected, node.getAggregateCount(), node.getId());
                directTotal += node.getDirectCount();
            }
            int rootTotal = bound.getRoots().stream().mapToInt(BoundNode::getAggregateCount).sum();
            assertEquals(directTotal, rootTotal);
        }
    }

    private static BoundNode node(BoundForest bound, String id) {
        return bound.findNode(id).orElseThrow();
    }

    private static ProcedureRecord record(String code, String title, String... tags) {
        return new ProcedureRecord(code, title, "http://x", new LinkedHashSet<>(List.of(tags)));
    }
}
