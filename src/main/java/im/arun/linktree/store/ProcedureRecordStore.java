package im.arun.linktree.store;

import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.exception.DuplicateCodeException;
import im.arun.linktree.exception.ProcedureNotFoundException;
import im.arun.linktree.model.EngineWarning;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.RecordRow;
import im.arun.linktree.model.WarningType;
import im.arun.linktree.util.TagUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory collection of procedure records keyed by code.
 *
 * <p>Rows are indexed in source order. When a code repeats, the later row replaces the earlier
 * one but keeps its position in the listing. Persistence is the caller's job: read rows in,
 * mutate, then write {@link #exportRows()} back out.
 *
 * <p>Not thread-safe.
 */
public class ProcedureRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(ProcedureRecordStore.class);

    private final String tagDelimiter;
    private final String defaultTag;
    private final Map<String, ProcedureRecord> recordsByCode = new LinkedHashMap<>();
    private final List<EngineWarning> warnings = new ArrayList<>();

    public ProcedureRecordStore(LinkTreeConfig config) {
        this.tagDelimiter = config.getTagDelimiter();
        this.defaultTag = config.getDefaultTag() == null ? "" : config.getDefaultTag().strip();
    }

    public static ProcedureRecordStore fromRows(List<RecordRow> rows, LinkTreeConfig config) {
        ProcedureRecordStore store = new ProcedureRecordStore(config);
        int rowNumber = 0;
        for (RecordRow row : rows) {
            rowNumber++;
            store.ingest(row, rowNumber);
        }
        logger.info("Loaded {} records from {} rows", store.size(), rowNumber);
        return store;
    }

    private void ingest(RecordRow row, int rowNumber) {
        String code = strip(row.getCode());
        if (code.isEmpty()) {
            logger.warn("Skipping row {} without a code", rowNumber);
            return;
        }

        ProcedureRecord record = new ProcedureRecord(code, strip(row.getTitle()), strip(row.getLink()),
            TagUtils.parseTags(row.getTags(), tagDelimiter));

        if (recordsByCode.containsKey(code)) {
            EngineWarning warning = EngineWarning.of(WarningType.DUPLICATE_CODE, code,
                "Row %d replaces an earlier record with the same code", rowNumber);
            logger.warn("{}: {}", code, warning.getMessage());
            warnings.add(warning);
        }
        recordsByCode.put(code, record);
    }

    /**
     * All records in listing order.
     */
    public List<ProcedureRecord> records() {
        return List.copyOf(recordsByCode.values());
    }

    public int size() {
        return recordsByCode.size();
    }

    public Optional<ProcedureRecord> findByCode(String code) {
        return Optional.ofNullable(recordsByCode.get(code));
    }

    public List<ProcedureRecord> findByTag(String tag) {
        return recordsByCode.values().stream()
            .filter(record -> record.hasTag(tag))
            .collect(Collectors.toList());
    }

    /**
     * Append a new record.
     *
     * @param tagString delimited tags; when empty the configured default tag is used, if any
     * @return the stored record
     * @throws IllegalArgumentException if code, title or link is blank
     * @throws DuplicateCodeException   if the code is already present
     */
    public ProcedureRecord add(String code, String title, String link, String tagString) {
        code = strip(code);
        title = strip(title);
        link = strip(link);
        if (code.isEmpty() || title.isEmpty() || link.isEmpty()) {
            throw new IllegalArgumentException("code, title and link are required");
        }
        if (recordsByCode.containsKey(code)) {
            throw new DuplicateCodeException(code);
        }

        Set<String> tags = TagUtils.parseTags(tagString, tagDelimiter);
        if (tags.isEmpty() && !defaultTag.isEmpty()) {
            tags.add(defaultTag);
        }

        ProcedureRecord record = new ProcedureRecord(code, title, link, tags);
        recordsByCode.put(code, record);
        logger.info("Added procedure {} with tags {}", code, record.getTags());
        return record;
    }

    /**
     * Replace the tags of an existing record. An empty tag string leaves the record untagged.
     *
     * @throws ProcedureNotFoundException if no record has this code
     */
    public ProcedureRecord updateTags(String code, String tagString) {
        String key = strip(code);
        ProcedureRecord existing = recordsByCode.get(key);
        if (existing == null) {
            throw new ProcedureNotFoundException(key);
        }

        ProcedureRecord updated = existing.withTags(TagUtils.parseTags(tagString, tagDelimiter));
        recordsByCode.put(key, updated);
        logger.info("Updated tags of {}: {} -> {}", key, existing.getTags(), updated.getTags());
        return updated;
    }

    /**
     * Flat listing in the input row shape, tags joined with the configured delimiter.
     */
    public List<RecordRow> exportRows() {
        List<RecordRow> rows = new ArrayList<>(recordsByCode.size());
        for (ProcedureRecord record : recordsByCode.values()) {
            rows.add(new RecordRow(record.getCode(), record.getTitle(), record.getLink(),
                TagUtils.joinTags(record.getTags(), tagDelimiter)));
        }
        return rows;
    }

    public List<EngineWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    private static String strip(String value) {
        return value == null ? "" : value.strip();
    }
}
