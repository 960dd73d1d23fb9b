package im.arun.linktree.service;

import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.EngineWarning;
import im.arun.linktree.model.GraphProjection;
import im.arun.linktree.model.KeywordForest;
import im.arun.linktree.model.LinkTreeView;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.SearchHit;
import im.arun.linktree.search.ProcedureSearchIndex;
import im.arun.linktree.store.ProcedureRecordStore;
import im.arun.linktree.tree.GraphProjector;
import im.arun.linktree.tree.KeywordTreeParser;
import im.arun.linktree.tree.TreeBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the parse, bind and project pipeline for one dataset.
 *
 * <p>Holds no dataset state. Every call rebuilds its result from the inputs it is given,
 * so after a record is added or retagged the caller simply calls {@link #bind} again.
 */
public class LinkTreeService {
    private static final Logger logger = LoggerFactory.getLogger(LinkTreeService.class);

    private final KeywordTreeParser parser;
    private final TreeBinder binder;
    private final GraphProjector projector;
    private final ProcedureSearchIndex searchIndex;

    public LinkTreeService(LinkTreeConfig config) {
        this.parser = new KeywordTreeParser(config);
        this.binder = new TreeBinder(config);
        this.projector = new GraphProjector();
        this.searchIndex = new ProcedureSearchIndex();
    }

    public KeywordForest parse(String treeText, String otherKeywordsText) {
        return parser.parse(treeText, otherKeywordsText);
    }

    /**
     * Parse both tree texts, then bind and project the store's records onto them.
     */
    public LinkTreeView build(String treeText, String otherKeywordsText, ProcedureRecordStore store) {
        return bind(parse(treeText, otherKeywordsText), store);
    }

    /**
     * Bind and project against an already parsed forest.
     */
    public LinkTreeView bind(KeywordForest forest, ProcedureRecordStore store) {
        BoundForest bound = binder.bind(forest, store.records());
        GraphProjection graph = projector.project(bound);

        List<EngineWarning> warnings = new ArrayList<>(forest.getWarnings());
        warnings.addAll(store.getWarnings());
        warnings.addAll(bound.getWarnings());

        logger.info("Built view: {} graph nodes, {} edges, {} unbound records, {} warnings",
            graph.getNodes().size(), graph.getEdges().size(), bound.getUnbound().size(), warnings.size());
        return new LinkTreeView(bound, graph, forest.allKeywords(), warnings);
    }

    public List<ProcedureRecord> search(String query, ProcedureRecordStore store) {
        return searchIndex.search(query, store.records());
    }

    public List<SearchHit> search(String query, ProcedureRecordStore store, LinkTreeView view) {
        return searchIndex.search(query, store.records(), view.getTree());
    }
}
