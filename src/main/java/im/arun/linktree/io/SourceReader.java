package im.arun.linktree.io;

import im.arun.linktree.exception.RecordSourceException;
import im.arun.linktree.exception.TreeParseException;
import im.arun.linktree.model.RecordRow;
import im.arun.linktree.store.RecordCsvCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * File access for tree texts and the record CSV. All files are UTF-8.
 * A missing file reads as empty, matching a dataset that has not been filled in yet.
 */
public class SourceReader {
    private static final Logger logger = LoggerFactory.getLogger(SourceReader.class);
    private static final String BOM = "\uFEFF";

    private final RecordCsvCodec codec;

    public SourceReader() {
        this(new RecordCsvCodec());
    }

    public SourceReader(RecordCsvCodec codec) {
        this.codec = codec;
    }

    /**
     * Read a tree text file.
     *
     * @param path tree file, may be null
     * @return file contents, or an empty string when the path is null or missing
     * @throws TreeParseException if the bytes are not valid UTF-8
     * @throws IOException        if the file exists but cannot be read
     */
    public String readTreeText(Path path) throws IOException {
        if (path == null) {
            return "";
        }
        if (!Files.exists(path)) {
            logger.info("Tree source {} not found, treating as empty", path);
            return "";
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new TreeParseException(path.toString(), "Tree source is not valid UTF-8: " + path, e);
        }
    }

    public RecordCsvCodec.CsvContent readRecords(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            logger.info("Record source {} not found, starting empty", path);
            return new RecordCsvCodec.CsvContent(List.of(), List.of());
        }
        try {
            return codec.read(Files.readString(path, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            throw new RecordSourceException("Record source is not valid UTF-8: " + path, e);
        }
    }

    /**
     * Rewrite the whole record file. A BOM is written so spreadsheet tools detect UTF-8.
     */
    public void writeRecords(Path path, List<RecordRow> rows, List<String> header) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, BOM + codec.write(rows, header), StandardCharsets.UTF_8);
        logger.info("Wrote {} records to {}", rows.size(), path);
    }
}
