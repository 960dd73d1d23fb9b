package im.arun.linktree.service;

import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.GraphNode;
import im.arun.linktree.model.KeywordForest;
import im.arun.linktree.model.LinkTreeView;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.RecordRow;
import im.arun.linktree.model.SearchHit;
import im.arun.linktree.model.WarningType;
import im.arun.linktree.store.ProcedureRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of parse, bind and project, including retagging between runs.
 */
class LinkTreeServiceTest {

    private static final String TREE = "Root\n    ChildA\n    ChildB";

    private LinkTreeConfig config;
    private LinkTreeService service;

    @BeforeEach
    void setUp() {
        config = new LinkTreeConfig();
        service = new LinkTreeService(config);
    }

    @Test
    void testParsesRootWithTwoChildren() {
        KeywordForest forest = service.parse(TREE, null);

        assertEquals(1, forest.getRoots().size());
        assertEquals(List.of("Root", "Root/ChildA", "Root/ChildB"),
            forest.preOrder().stream().map(n -> n.getId()).collect(Collectors.toList()));
    }

    @Test
    void testBindsRecordUnderChild() {
        ProcedureRecordStore store = storeWith(new RecordRow("P1", "Install Widget", "http://x", "ChildA"));

        LinkTreeView view = service.build(TREE, null, store);

        BoundForest tree = view.getTree();
        assertEquals(List.of("P1"), codes(tree.findNode("Root/ChildA").orElseThrow().getDirectRecords()));
        assertEquals(1, tree.findNode("Root").orElseThrow().getAggregateCount());
        assertEquals(1, graphCount(view, "Root"));
        assertEquals(1, graphCount(view, "Root/ChildA"));
    }

    @Test
    void testRetaggingMovesCountAfterRebind() {
        ProcedureRecordStore store = storeWith(new RecordRow("P1", "Install Widget", "http://x", "ChildA"));
        KeywordForest forest = service.parse(TREE, null);
        LinkTreeView before = service.bind(forest, store);

        store.updateTags("P1", "ChildB");
        LinkTreeView after = service.bind(forest, store);

        assertEquals(1, graphCount(before, "Root/ChildA"));
        assertEquals(0, graphCount(after, "Root/ChildA"));
        assertEquals(1, graphCount(after, "Root/ChildB"));
        assertEquals(1, graphCount(after, "Root"));
        // the earlier view is a snapshot and does not change
        assertEquals(0, graphCount(before, "Root/ChildB"));
    }

    @Test
    void testParentAndChildTagsCountTwiceAtParent() {
        ProcedureRecordStore store = storeWith(new RecordRow("P1", "Install Widget", "http://x", "ChildA,Root"));

        LinkTreeView view = service.build(TREE, null, store);

        assertEquals(2, graphCount(view, "Root"));
        assertEquals(1, view.getTree().findNode("Root").orElseThrow().getDirectCount());
        assertEquals(1, graphCount(view, "Root/ChildA"));
    }

    @Test
    void testAddedRecordAppearsAfterRebind() {
        ProcedureRecordStore store = storeWith(new RecordRow("P1", "Install Widget", "http://x", "ChildA"));
        KeywordForest forest = service.parse(TREE, "Misc\n    Notes");

        store.add("P2", "Write notes", "http://y", "Notes");
        LinkTreeView view = service.bind(forest, store);

        assertEquals(1, graphCount(view, "Misc"));
        assertEquals(List.of("Root", "Root/ChildA", "Root/ChildB", "Misc", "Misc/Notes"),
            view.getGraph().getNodes().stream().map(GraphNode::getId).collect(Collectors.toList()));
        assertEquals(3, view.getGraph().getEdges().size());
    }

    @Test
    void testViewCollectsWarningsFromEveryStage() {
        ProcedureRecordStore store = storeWith(
            new RecordRow("P1", "First", "http://x", "ChildA"),
            new RecordRow("P1", "Second", "http://x", "Nowhere"));

        LinkTreeView view = service.build("Root\n            ChildA", null, store);

        List<WarningType> types = view.getWarnings().stream()
            .map(w -> w.getType())
            .collect(Collectors.toList());
        assertEquals(List.of(WarningType.INDENT_CLAMPED, WarningType.DUPLICATE_CODE, WarningType.UNBOUND_RECORD), types);
        assertEquals(List.of("P1"), codes(view.getTree().getUnbound()));
    }

    @Test
    void testKeywordListCoversBothSources() {
        LinkTreeView view = service.build(TREE, "Misc\n    ChildA", storeWith());

        assertEquals(List.of("ChildA", "ChildB", "Misc", "Root"), List.copyOf(view.getKeywords()));
    }

    @Test
    void testSearchReturnsHitsWithNodeContext() {
        ProcedureRecordStore store = storeWith(
            new RecordRow("P1", "Procedure A", "http://x", "ChildA"),
            new RecordRow("P2", "REPROCESS", "http://y", ""),
            new RecordRow("P3", "Install", "http://z", "ChildB"));
        LinkTreeView view = service.build(TREE, null, store);

        List<SearchHit> hits = service.search("proc", store, view);

        assertEquals(List.of("P1", "P2"), hits.stream().map(h -> h.getRecord().getCode()).collect(Collectors.toList()));
        assertEquals(List.of("Root/ChildA"), hits.get(0).getNodeIds());
        assertTrue(hits.get(1).getNodeIds().isEmpty());
        assertTrue(service.search("", store).isEmpty());
    }

    private ProcedureRecordStore storeWith(RecordRow... rows) {
        return ProcedureRecordStore.fromRows(List.of(rows), config);
    }

    private static int graphCount(LinkTreeView view, String id) {
        return view.getGraph().getNodes().stream()
            .filter(n -> n.getId().equals(id))
            .findFirst()
            .orElseThrow()
            .getRecordCount();
    }

    private static List<String> codes(List<ProcedureRecord> records) {
        return records.stream().map(ProcedureRecord::getCode).collect(Collectors.toList());
    }

    @Test
    void testVeryDeepTreeBindsAndProjects() {
        int levels = 5000;
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            text.append("\t".repeat(i)).append("k\n");
        }
        ProcedureRecordStore store = storeWith(new RecordRow("P1", "Everywhere", "http://x", "k"));

        LinkTreeView view = service.build(text.toString(), null, store);

        assertEquals(levels, view.getTree().getRoots().get(0).getAggregateCount());
        assertEquals(levels, view.getGraph().getNodes().size());
        assertEquals(levels - 1, view.getGraph().getEdges().size());
        assertEquals(levels - 1, view.getGraph().getNodes().get(levels - 1).getDepth());
        assertTrue(view.getWarnings().stream().noneMatch(w -> w.getType() == WarningType.INDENT_CLAMPED));
    }
}
