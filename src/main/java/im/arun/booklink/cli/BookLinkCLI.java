package im.arun.booklink.cli;

import im.arun.booklink.config.BookLinkConfig;
import im.arun.booklink.config.ConfigLoader;
import im.arun.booklink.io.DocumentReader;
import im.arun.booklink.io.DocumentWriter;
import im.arun.booklink.model.Document;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.pipeline.BuildMode;
import im.arun.booklink.pipeline.DocumentPipeline;
import im.arun.booklink.pipeline.PipelineResult;
import im.arun.booklink.post.ChapterNumberer;
import im.arun.booklink.util.BookLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface for BookLink using Picocli.
 * <p>
 * A book is built in two runs: first every chapter with {@code --export-refs} to fill the
 * symbol table store, then every chapter again with {@code --html} or {@code --latex}.
 */
@Command(
    name = "booklink",
    description = "Number, index and cross-link the document trees of a book",
    mixinStandardHelpOptions = true,
    version = "BookLink 1.0"
)
public class BookLinkCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(BookLinkCLI.class);

    @Parameters(paramLabel = "TREE", arity = "0..*", description = "Document tree JSON files to process")
    private List<Path> trees = new ArrayList<>();

    @ArgGroup(exclusive = true)
    private FormatOption formatOption;

    static class FormatOption {
        @Option(names = "--html", description = "Prepare trees for HTML output (default)")
        boolean html;

        @Option(names = {"--latex", "--tex"}, description = "Prepare trees for LaTeX output")
        boolean latex;
    }

    @Option(names = "--export-refs", description = "Only number and collect; write symbol table records to the store")
    private boolean exportRefs;

    @Option(names = "--store", description = "Symbol table store directory")
    private String storeDir;

    @Option(names = "--external", split = ",",
        description = "Documents whose symbol tables are consulted (defaults to all TREE files)")
    private List<String> externalDocuments = new ArrayList<>();

    @Option(names = "--bibliography", description = "Bibliography record file")
    private String bibliographyFile;

    @Option(names = "--config", description = "YAML configuration file")
    private String configPath;

    @Option(names = "--output-dir", description = "Directory for processed trees", defaultValue = "out")
    private Path outputDir;

    @Option(names = "--diagnostics", description = "Directory for per-document JSON diagnostics reports")
    private Path diagnosticsDir;

    @Option(names = "--chapter-numbers", split = ",",
        description = "Rendered .html/.tex files to prefix with their chapter number")
    private List<Path> chapterFiles = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        if (trees.isEmpty() && chapterFiles.isEmpty()) {
            System.err.println("Error: no document trees or rendered files given");
            return 1;
        }

        BookLinkConfig config = new ConfigLoader(configPath).load(userOptions());
        if (config.getExternalDocuments().isEmpty()) {
            config.setExternalDocuments(documentNames());
        }
        DocumentPipeline pipeline = new DocumentPipeline(config);
        DocumentReader reader = new DocumentReader();
        DocumentWriter writer = new DocumentWriter();
        BuildMode mode = exportRefs ? BuildMode.EXPORT_REFERENCES : BuildMode.RENDER;

        long warnings = 0;
        try {
            for (Path tree : trees) {
                Document document = reader.read(tree);
                PipelineResult result = pipeline.process(document, mode);
                if (mode == BuildMode.EXPORT_REFERENCES) {
                    System.out.println("Exported " + result.getRecordPath());
                } else {
                    System.out.println("Wrote " + writer.write(document, outputDir));
                }
                if (diagnosticsDir != null) {
                    result.getContext().getDiagnostics().writeTo(diagnosticsDir.resolve(document.getName() + ".diagnostics.json"));
                }
                warnings += result.getContext().getDiagnostics().warningCount();
            }

            ChapterNumberer numberer = new ChapterNumberer();
            for (Path file : chapterFiles) {
                numberer.applyTo(file);
            }
        } catch (BookLinkException | IOException e) {
            logger.error("Build failed: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("Processed " + trees.size() + " document(s) with " + warnings + " warning(s)");
        return 0;
    }

    Map<String, Object> userOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (formatOption != null) {
            options.put("format", formatOption.latex ? OutputFormat.LATEX : OutputFormat.HTML);
        }
        if (storeDir != null) {
            options.put("store_dir", storeDir);
        }
        if (bibliographyFile != null) {
            options.put("bibliography_file", bibliographyFile);
        }

        if (!externalDocuments.isEmpty()) {
            options.put("external_documents", new ArrayList<>(new LinkedHashSet<>(externalDocuments)));
        }
        return options;
    }

    private List<String> documentNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Path tree : trees) {
            names.add(DocumentReader.documentName(tree));
        }
        return new ArrayList<>(names);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BookLinkCLI()).execute(args);
        System.exit(exitCode);
    }
}
