package im.arun.booklink.pipeline;

import im.arun.booklink.config.BookLinkConfig;
import im.arun.booklink.model.Document;
import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.store.SymbolTableStore;
import im.arun.booklink.util.BookLinkException;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static im.arun.booklink.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class DocumentPipelineTest {

    private static BookLinkConfig config(Path store) {
        BookLinkConfig config = new BookLinkConfig();
        config.setStoreDir(store.toString());
        config.setExternalDocuments(List.of("ch1", "ch2"));
        return config;
    }

    private static Document chapterOne() {
        Node term = Node.of(NodeKind.INDEX_TERM, Node.text("Tree"));
        Node doctest = new Node(NodeKind.DOCTEST_BLOCK);
        doctest.setText(">>> 1 + 1\n2");
        return new Document("ch1", document(
            section("sec-trees", "Trees",
                paragraph(Node.text("A "), term, Node.text(" is a graph.")),
                figure("fig-tree"),
                doctest)));
    }

    private static Document chapterTwo() {
        return new Document("ch2", document(
            section("sec-parsing", "Parsing",
                paragraph(Node.text("See figure "), reference("fig-tree", "tree"), Node.text(".")),
                paragraph(reference("sec-parsing", "this section"))),
            new Node(NodeKind.INDEX)));
    }

    @Test
    void passesRunInPriorityOrder() {
        List<TreePass> passes = new DocumentPipeline(new BookLinkConfig()).getPasses();
        List<String> names = passes.stream().map(TreePass::name).collect(Collectors.toList());

        assertEquals(List.of("numbering", "index-terms", "doctest-ignore-check", "local-references",
            "cross-references", "index", "citations", "literal-dedent", "doctest-highlight"), names);
    }

    @Test
    void exportWritesRecordWithoutRendering(@TempDir Path tmp) throws Exception {
        DocumentPipeline pipeline = new DocumentPipeline(config(tmp));
        Document ch1 = chapterOne();

        PipelineResult result = pipeline.process(ch1, BuildMode.EXPORT_REFERENCES);

        assertTrue(Files.exists(result.getRecordPath()));
        SymbolTableRecord record = pipeline.getStore().read("ch1", new Diagnostics()).orElseThrow();
        assertEquals("1", record.getReferenceLabels().get("sec-trees"));
        assertEquals("1.1", record.getReferenceLabels().get("fig-tree"));
        assertTrue(record.getTargets().containsAll(List.of("sec-trees", "fig-tree", "tree")));
        assertEquals("1", record.getTerms().get("tree").getSectionLabel());
        assertFalse(TreeUtils.findAll(ch1.getRoot(), NodeKind.DOCTEST_BLOCK).isEmpty());
    }

    @Test
    void exportedRecordsResolveLinksOfLaterRuns(@TempDir Path tmp) throws Exception {
        DocumentPipeline pipeline = new DocumentPipeline(config(tmp));
        pipeline.process(chapterOne(), BuildMode.EXPORT_REFERENCES);

        Document ch2 = chapterTwo();
        PipelineResult result = pipeline.process(ch2, BuildMode.RENDER);

        assertNull(result.getRecordPath());
        List<Node> references = TreeUtils.findAll(ch2.getRoot(), NodeKind.REFERENCE);
        Node toFigure = references.get(0);
        assertEquals("ch1.html#fig-tree", toFigure.getAttribute(Node.REFURI));
        assertEquals("Figure 1.1", toFigure.astext());
        assertEquals("1", references.get(1).astext());

        Node index = ch2.getRoot().getLastChild();
        assertEquals(NodeKind.BULLET_LIST, index.getKind());
        Node entry = index.getChildren().get(1);
        assertEquals("ch1.html#tree", entry.getFirstChild().getAttribute(Node.REFURI));
        assertEquals("Tree (see §1)", entry.astext());
        assertEquals(0, result.getContext().getDiagnostics().count(Diagnostics.SYMBOL_STORE));
    }

    @Test
    void renderHighlightsDoctests(@TempDir Path tmp) throws Exception {
        Document ch1 = chapterOne();
        new DocumentPipeline(config(tmp)).process(ch1, BuildMode.RENDER);

        assertTrue(TreeUtils.findAll(ch1.getRoot(), NodeKind.DOCTEST_BLOCK).isEmpty());
        Node raw = TreeUtils.findAll(ch1.getRoot(), NodeKind.RAW).get(0);
        assertTrue(raw.getText().contains("pysrc-output"));
    }

    @Test
    void missingExternalRecordIsReportedNotFatal(@TempDir Path tmp) throws Exception {
        PipelineResult result = new DocumentPipeline(config(tmp)).process(chapterTwo(), BuildMode.RENDER);

        assertEquals(1, result.getContext().getDiagnostics().count(Diagnostics.SYMBOL_STORE));
        Node toFigure = TreeUtils.findAll(result.getDocument().getRoot(), NodeKind.REFERENCE).get(0);
        assertFalse(toFigure.isResolved());
    }

    @Test
    void unreadableBibliographyIsFatal(@TempDir Path tmp) {
        BookLinkConfig config = config(tmp);
        config.setBibliographyFile(tmp.resolve("absent.bib").toString());

        assertThrows(BookLinkException.class,
            () -> new DocumentPipeline(config).process(chapterTwo(), BuildMode.RENDER));
    }

    @Test
    void observerSeesEveryPass(@TempDir Path tmp) throws Exception {
        List<String> seen = new ArrayList<>();
        PassObserver observer = new PassObserver() {
            @Override
            public void passFinished(String documentName, TreePass pass, long elapsedMillis) {
                seen.add(documentName + ":" + pass.name());
            }
        };
        BookLinkConfig config = config(tmp);
        DocumentPipeline pipeline = new DocumentPipeline(config,
            new SymbolTableStore(tmp), DocumentPipeline.defaultPasses(), observer);

        pipeline.process(chapterOne(), BuildMode.EXPORT_REFERENCES);

        assertEquals(List.of("ch1:numbering", "ch1:index-terms", "ch1:doctest-ignore-check"), seen);
    }
}
