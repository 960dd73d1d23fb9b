package im.arun.linktree.search;

import im.arun.linktree.model.BoundForest;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring search over record titles.
 * Results keep collection order; there is no scoring.
 */
public class ProcedureSearchIndex {
    private static final Logger logger = LoggerFactory.getLogger(ProcedureSearchIndex.class);

    /**
     * @return records whose title contains the query, or an empty list for a blank query
     */
    public List<ProcedureRecord> search(String query, Collection<ProcedureRecord> records) {
        List<ProcedureRecord> results = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return results;
        }

        // Surrounding spaces are part of the needle; only an all-blank query is rejected
        String needle = fold(query);
        for (ProcedureRecord record : records) {
            if (fold(record.getTitle()).contains(needle)) {
                results.add(record);
            }
        }

        logger.debug("Search '{}' matched {} of {} records", query, results.size(), records.size());
        return results;
    }

    /**
     * Search and attach the ids of the nodes each match is bound to.
     * Unbound matches are returned with an empty id list.
     */
    public List<SearchHit> search(String query, Collection<ProcedureRecord> records, BoundForest forest) {
        List<SearchHit> hits = new ArrayList<>();
        for (ProcedureRecord record : search(query, records)) {
            hits.add(new SearchHit(record, List.copyOf(forest.boundNodeIds(record.getCode()))));
        }
        return hits;
    }

    private static String fold(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
