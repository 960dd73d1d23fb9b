package im.arun.linktree.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.linktree.exception.RecordSourceException;
import im.arun.linktree.model.RecordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the record source CSV with Jackson CSV.
 *
 * <p>Columns are located by header name, case-insensitively, with English and Korean aliases:
 * code ({@code name} preferred, then {@code code}/{@code 코드}), title ({@code title}/{@code 제목}),
 * link ({@code link}/{@code url}/{@code 링크}) and tags ({@code tag}/{@code tags}/{@code 태그}).
 * Writing keeps an existing header so hand-maintained files stay recognisable.
 */
public class RecordCsvCodec {
    private static final Logger logger = LoggerFactory.getLogger(RecordCsvCodec.class);

    public static final List<String> DEFAULT_HEADER = List.of("code", "title", "link", "tags");

    private static final Set<String> NAME_ALIASES = Set.of("name");
    private static final Set<String> CODE_ALIASES = Set.of("code", "코드");
    private static final Set<String> TITLE_ALIASES = Set.of("title", "제목");
    private static final Set<String> LINK_ALIASES = Set.of("link", "url", "링크");
    private static final Set<String> TAG_ALIASES = Set.of("tag", "tags", "태그");

    private final CsvMapper csvMapper;

    public RecordCsvCodec() {
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    }

    /**
     * Header and rows of a parsed record CSV.
     */
    public static class CsvContent {
        public final List<String> header;
        public final List<RecordRow> rows;

        public CsvContent(List<String> header, List<RecordRow> rows) {
            this.header = header;
            this.rows = rows;
        }
    }

    public CsvContent read(String csvText) {
        if (csvText == null || csvText.isBlank()) {
            return new CsvContent(List.of(), List.of());
        }
        if (csvText.charAt(0) == '\uFEFF') {
            csvText = csvText.substring(1);
        }

        List<String[]> lines;
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).readValues(csvText)) {
            lines = iterator.readAll();
        } catch (IOException e) {
            throw new RecordSourceException("Failed to parse record CSV: " + e.getMessage(), e);
        }
        if (lines.isEmpty()) {
            return new CsvContent(List.of(), List.of());
        }

        List<String> header = new ArrayList<>();
        for (String name : lines.get(0)) {
            header.add(name == null ? "" : name.strip());
        }

        int codeColumn = findColumn(header, NAME_ALIASES);
        if (codeColumn < 0) {
            codeColumn = findColumn(header, CODE_ALIASES);
        }
        int titleColumn = findColumn(header, TITLE_ALIASES);
        int linkColumn = findColumn(header, LINK_ALIASES);
        int tagColumn = findColumn(header, TAG_ALIASES);

        if (codeColumn < 0) {
            throw new RecordSourceException("Record CSV has no code column; header was " + header);
        }
        if (titleColumn < 0 || linkColumn < 0 || tagColumn < 0) {
            logger.warn("Record CSV header {} lacks title, link or tag column; missing values are empty", header);
        }

        List<RecordRow> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            if (isBlankLine(cells)) {
                continue;
            }
            rows.add(new RecordRow(
                cell(cells, codeColumn),
                cell(cells, titleColumn),
                cell(cells, linkColumn),
                cell(cells, tagColumn)));
        }

        logger.debug("Read {} record rows with header {}", rows.size(), header);
        return new CsvContent(header, rows);
    }

    public String write(List<RecordRow> rows) {
        return write(rows, null);
    }

    /**
     * Write rows as CSV text.
     *
     * @param rows   records in listing order
     * @param header header to keep, or null/empty for {@link #DEFAULT_HEADER}
     */
    public String write(List<RecordRow> rows, List<String> header) {
        List<String> columns = new ArrayList<>(new LinkedHashSet<>(
            header == null || header.isEmpty() ? DEFAULT_HEADER : header));
        boolean hasNameColumn = findColumn(columns, NAME_ALIASES) >= 0;

        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : columns) {
            schemaBuilder.addColumn(column);
        }
        CsvSchema schema = schemaBuilder.build().withoutHeader();

        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writerFor(Map.class).with(schema).writeValues(out)) {
            // Header goes out as a regular row so it is present even with no records
            Map<String, String> headerRow = new LinkedHashMap<>();
            for (String column : columns) {
                headerRow.put(column, column);
            }
            writer.write(headerRow);

            for (RecordRow row : rows) {
                Map<String, String> values = new LinkedHashMap<>();
                for (String column : columns) {
                    values.put(column, valueFor(column, row, hasNameColumn));
                }
                writer.write(values);
            }
        } catch (IOException e) {
            throw new RecordSourceException("Failed to write record CSV: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private String valueFor(String column, RecordRow row, boolean hasNameColumn) {
        String key = normalizeHeader(column);
        if (NAME_ALIASES.contains(key)) {
            return nullToEmpty(row.getCode());
        }
        if (CODE_ALIASES.contains(key)) {
            // The name column carries the code when both exist
            return hasNameColumn ? "" : nullToEmpty(row.getCode());
        }
        if (TITLE_ALIASES.contains(key)) {
            return nullToEmpty(row.getTitle());
        }
        if (LINK_ALIASES.contains(key)) {
            return nullToEmpty(row.getLink());
        }
        if (TAG_ALIASES.contains(key)) {
            return nullToEmpty(row.getTags());
        }
        return "";
    }

    private static int findColumn(List<String> header, Set<String> aliases) {
        for (int i = 0; i < header.size(); i++) {
            if (aliases.contains(normalizeHeader(header.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private static String normalizeHeader(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }

    private static String cell(String[] cells, int column) {
        if (column < 0 || column >= cells.length || cells[column] == null) {
            return "";
        }
        return cells[column].strip();
    }

    private static boolean isBlankLine(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
