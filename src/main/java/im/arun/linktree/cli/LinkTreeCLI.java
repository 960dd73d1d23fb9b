package im.arun.linktree.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.linktree.config.ConfigLoader;
import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.exception.DuplicateCodeException;
import im.arun.linktree.exception.ProcedureNotFoundException;
import im.arun.linktree.exception.RecordSourceException;
import im.arun.linktree.exception.TreeParseException;
import im.arun.linktree.io.SourceReader;
import im.arun.linktree.model.LinkTreeView;
import im.arun.linktree.model.ProcedureRecord;
import im.arun.linktree.model.SearchHit;
import im.arun.linktree.service.LinkTreeService;
import im.arun.linktree.store.ProcedureRecordStore;
import im.arun.linktree.store.RecordCsvCodec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end: loads tree texts and the record CSV from disk and runs the engine.
 */
@Command(
    name = "linktree",
    description = "Organize tagged procedures into a keyword tree and graph",
    mixinStandardHelpOptions = true,
    version = "LinkTree 1.0",
    subcommands = {
        LinkTreeCLI.RenderCommand.class,
        LinkTreeCLI.SearchCommand.class,
        LinkTreeCLI.AddCommand.class,
        LinkTreeCLI.TagCommand.class,
        LinkTreeCLI.ExportCommand.class
    }
)
public class LinkTreeCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "YAML configuration file (defaults to bundled linktree.yaml)")
    private String configPath;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    LinkTreeConfig loadConfig() {
        return new ConfigLoader(configPath).load();
    }

    /**
     * Shared plumbing for subcommands: config, file access, JSON output and error reporting.
     */
    abstract static class DatasetCommand implements Callable<Integer> {

        @ParentCommand
        LinkTreeCLI parent;

        @Spec
        CommandSpec spec;

        final SourceReader sourceReader = new SourceReader();

        @Override
        public Integer call() {
            try {
                return run(parent.loadConfig());
            } catch (ProcedureNotFoundException | DuplicateCodeException | IllegalArgumentException e) {
                err().println("Error: " + e.getMessage());
                return 1;
            } catch (NoSuchFileException e) {
                err().println("Error: file not found: " + e.getFile());
                return 1;
            } catch (TreeParseException | RecordSourceException | IOException e) {
                err().println("Error reading sources: " + e.getMessage());
                return 1;
            }
        }

        abstract int run(LinkTreeConfig config) throws IOException;

        ProcedureRecordStore loadStore(RecordCsvCodec.CsvContent content, LinkTreeConfig config) {
            return ProcedureRecordStore.fromRows(content.rows, config);
        }

        PrintWriter out() {
            return spec.commandLine().getOut();
        }

        PrintWriter err() {
            return spec.commandLine().getErr();
        }

        void emit(String text, String outputPath) throws IOException {
            if (outputPath != null) {
                Files.writeString(Paths.get(outputPath), text);
                out().println("Output written to: " + outputPath);
            } else {
                out().println(text);
            }
            out().flush();
        }

        static String toJson(Object value) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            return mapper.writeValueAsString(value);
        }

        /**
         * Resolve a path the user named explicitly; an omitted option stays null.
         *
         * @throws NoSuchFileException if the named file does not exist
         */
        static Path existingPath(String value) throws NoSuchFileException {
            if (value == null) {
                return null;
            }
            Path path = Paths.get(value);
            if (!Files.exists(path)) {
                throw new NoSuchFileException(value);
            }
            return path;
        }
    }

    @Command(name = "render", description = "Print the bound tree and its graph projection as JSON")
    static class RenderCommand extends DatasetCommand {

        @Option(names = {"--tree"}, description = "Primary keyword tree text file")
        String treePath;

        @Option(names = {"--other"}, description = "Other keywords tree text file")
        String otherPath;

        @Option(names = {"--records"}, description = "Record CSV file")
        String recordsPath;

        @Option(names = {"--output"}, description = "Output JSON file path")
        String outputPath;

        @Override
        int run(LinkTreeConfig config) throws IOException {
            LinkTreeService service = new LinkTreeService(config);
            ProcedureRecordStore store = loadStore(sourceReader.readRecords(existingPath(recordsPath)), config);

            LinkTreeView view = service.build(
                sourceReader.readTreeText(existingPath(treePath)),
                sourceReader.readTreeText(existingPath(otherPath)),
                store);

            emit(toJson(view), outputPath);
            return 0;
        }
    }

    @Command(name = "search", description = "Find records whose title contains the query")
    static class SearchCommand extends DatasetCommand {

        @Option(names = {"--records"}, description = "Record CSV file", required = true)
        String recordsPath;

        @Option(names = {"--tree"}, description = "Primary keyword tree text file, for node context")
        String treePath;

        @Option(names = {"--other"}, description = "Other keywords tree text file, for node context")
        String otherPath;

        @Option(names = {"--query", "-q"}, description = "Text to look for (case-insensitive)", required = true)
        String query;

        @Override
        int run(LinkTreeConfig config) throws IOException {
            LinkTreeService service = new LinkTreeService(config);
            ProcedureRecordStore store = loadStore(sourceReader.readRecords(existingPath(recordsPath)), config);

            LinkTreeView view = service.build(
                sourceReader.readTreeText(existingPath(treePath)),
                sourceReader.readTreeText(existingPath(otherPath)),
                store);
            List<SearchHit> hits = service.search(query, store, view);

            emit(toJson(hits), null);
            return 0;
        }
    }

    @Command(name = "add", description = "Append a record and rewrite the record CSV")
    static class AddCommand extends DatasetCommand {

        @Option(names = {"--records"}, description = "Record CSV file", required = true)
        String recordsPath;

        @Option(names = {"--code"}, required = true)
        String code;

        @Option(names = {"--title"}, required = true)
        String title;

        @Option(names = {"--link"}, required = true)
        String link;

        @Option(names = {"--tags"}, description = "Delimited tags", defaultValue = "")
        String tags;

        @Override
        int run(LinkTreeConfig config) throws IOException {
            Path path = Paths.get(recordsPath);
            RecordCsvCodec.CsvContent content = sourceReader.readRecords(path);
            ProcedureRecordStore store = loadStore(content, config);

            ProcedureRecord record = store.add(code, title, link, tags);
            sourceReader.writeRecords(path, store.exportRows(), content.header);

            out().println("Added " + record.getCode() + " " + record.getTags());
            out().flush();
            return 0;
        }
    }

    @Command(name = "tag", description = "Replace the tags of a record and rewrite the record CSV")
    static class TagCommand extends DatasetCommand {

        @Option(names = {"--records"}, description = "Record CSV file", required = true)
        String recordsPath;

        @Option(names = {"--code"}, required = true)
        String code;

        @Option(names = {"--tags"}, description = "Delimited tags; empty clears them", defaultValue = "")
        String tags;

        @Override
        int run(LinkTreeConfig config) throws IOException {
            Path path = existingPath(recordsPath);
            RecordCsvCodec.CsvContent content = sourceReader.readRecords(path);
            ProcedureRecordStore store = loadStore(content, config);

            ProcedureRecord record = store.updateTags(code, tags);
            sourceReader.writeRecords(path, store.exportRows(), content.header);

            out().println("Updated " + record.getCode() + " " + record.getTags());
            out().flush();
            return 0;
        }
    }

    @Command(name = "export", description = "Print the flat record listing as CSV")
    static class ExportCommand extends DatasetCommand {

        @Option(names = {"--records"}, description = "Record CSV file", required = true)
        String recordsPath;

        @Option(names = {"--output"}, description = "Output CSV file path")
        String outputPath;

        @Override
        int run(LinkTreeConfig config) throws IOException {
            ProcedureRecordStore store = loadStore(sourceReader.readRecords(existingPath(recordsPath)), config);
            String csv = new RecordCsvCodec().write(store.exportRows());
            emit(csv.stripTrailing(), outputPath);
            return 0;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LinkTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
