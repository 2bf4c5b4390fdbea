package im.arun.booklink.pipeline;

import im.arun.booklink.citation.BibliographyParser;
import im.arun.booklink.citation.CitationPass;
import im.arun.booklink.cleanup.LiteralDedentPass;
import im.arun.booklink.colorize.DoctestHighlightPass;
import im.arun.booklink.colorize.DoctestIgnoreCheckPass;
import im.arun.booklink.config.BookLinkConfig;
import im.arun.booklink.index.IndexBuilderPass;
import im.arun.booklink.index.TermCollectionPass;
import im.arun.booklink.model.Document;
import im.arun.booklink.numbering.NumberingPass;
import im.arun.booklink.reference.CrossReferencePass;
import im.arun.booklink.reference.LocalReferencePass;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.store.SymbolTableStore;
import im.arun.booklink.util.BookLinkException;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the tree passes over one document in priority order.
 * <p>
 * Numbering and term collection come first, reference rewriting after them, index and
 * citation synthesis next, cleanup and highlighting last. In
 * {@link BuildMode#EXPORT_REFERENCES} only the collecting passes run and the resulting
 * symbol table record is written to the store.
 */
public class DocumentPipeline {
    private static final Logger logger = LoggerFactory.getLogger(DocumentPipeline.class);

    /** Passes below this priority collect state; from here on they rewrite references. */
    static final int EXPORT_CUTOFF = 200;

    private final BookLinkConfig config;
    private final SymbolTableStore store;
    private final List<TreePass> passes;
    private final PassObserver observer;

    public DocumentPipeline(BookLinkConfig config) {
        this(config, new SymbolTableStore(Paths.get(config.getStoreDir())), defaultPasses(), new LoggingPassObserver());
    }

    public DocumentPipeline(BookLinkConfig config, SymbolTableStore store, List<TreePass> passes, PassObserver observer) {
        this.config = config;
        this.store = store;
        this.passes = new ArrayList<>(passes);
        this.passes.sort(Comparator.comparingInt(TreePass::priority));
        this.observer = observer == null ? PassObserver.NONE : observer;
    }

    public static List<TreePass> defaultPasses() {
        return List.of(
            new NumberingPass(),
            new TermCollectionPass(),
            new DoctestIgnoreCheckPass(),
            new LocalReferencePass(),
            new CrossReferencePass(),
            new IndexBuilderPass(),
            new CitationPass(),
            new LiteralDedentPass(),
            new DoctestHighlightPass());
    }

    public List<TreePass> getPasses() {
        return List.copyOf(passes);
    }

    public SymbolTableStore getStore() {
        return store;
    }

    public PipelineResult process(Document document, BuildMode mode) throws IOException {
        Diagnostics diagnostics = new Diagnostics(document.getName());
        ProcessingContext context = new ProcessingContext(document.getName(), config, diagnostics);

        if (mode == BuildMode.RENDER) {
            loadExternalRecords(document.getName(), context);
            loadBibliography(context);
        }

        for (TreePass pass : passes) {
            if (mode == BuildMode.EXPORT_REFERENCES && pass.priority() >= EXPORT_CUTOFF) {
                continue;
            }
            observer.passStarted(document.getName(), pass);
            long start = System.currentTimeMillis();
            pass.apply(document.getRoot(), context);
            observer.passFinished(document.getName(), pass, System.currentTimeMillis() - start);
        }

        Path recordPath = null;
        if (mode == BuildMode.EXPORT_REFERENCES) {
            recordPath = exportRecord(document, context);
        }

        logger.info("Processed {} ({}) with {} warnings", document.getName(), mode, diagnostics.warningCount());
        return new PipelineResult(document, mode, context, recordPath);
    }

    private void loadExternalRecords(String documentName, ProcessingContext context) {
        for (String external : config.getExternalDocuments()) {
            if (external.equals(documentName)) {
                continue;
            }
            store.read(external, context.getDiagnostics()).ifPresent(context::addExternalRecord);
        }
        logger.debug("Loaded {} of {} external symbol tables", context.getExternalRecords().size(),
            config.getExternalDocuments().size());
    }

    private void loadBibliography(ProcessingContext context) {
        if (config.getBibliographyFile() == null) {
            return;
        }
        Path file = Paths.get(config.getBibliographyFile());
        try {
            context.setBibliography(new BibliographyParser().parse(file, context.getDiagnostics()));
        } catch (IOException e) {
            throw new BookLinkException("Cannot read bibliography " + file, e);
        }
    }

    private Path exportRecord(Document document, ProcessingContext context) throws IOException {
        SymbolTableRecord record = new SymbolTableRecord(document.getName());
        record.getReferenceLabels().putAll(context.getLabels().asMap());
        record.getTargets().addAll(TreeUtils.declaredIds(document.getRoot()));
        record.getTerms().putAll(context.getTerms());
        store.write(record);
        return store.recordPath(document.getName());
    }
}
