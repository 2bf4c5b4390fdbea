package im.arun.booklink.numbering;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static im.arun.booklink.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class NumberingPassTest {

    private ProcessingContext number(Node root, OutputFormat format) {
        ProcessingContext context = context(format);
        new NumberingPass().apply(root, context);
        return context;
    }

    @Test
    void sectionsAreNumberedByRankWithinTheirParent() {
        Node root = document(
            section("intro", "Intro",
                section("intro-a", "A"),
                section("intro-b", "B",
                    section("intro-b-x", "X"))),
            section("next", "Next"));

        ReferenceLabelTable labels = number(root, OutputFormat.HTML).getLabels();

        assertEquals("1", labels.get("intro"));
        assertEquals("1.1", labels.get("intro-a"));
        assertEquals("1.2", labels.get("intro-b"));
        assertEquals("1.2.1", labels.get("intro-b-x"));
        assertEquals("2", labels.get("next"));
        assertTrue(labels.isSealed());
    }

    @Test
    void htmlTitlesGetAGeneratedNumber() {
        Node intro = section("intro", "Intro");
        number(document(intro), OutputFormat.HTML);

        Node title = intro.firstChildOfKind(NodeKind.TITLE);
        Node generated = title.getFirstChild();
        assertEquals(NodeKind.GENERATED, generated.getKind());
        assertEquals("1 ", generated.getText());
        assertEquals("1 Intro", title.astext());
    }

    @Test
    void latexTitlesAreLeftToTheRenderer() {
        Node intro = section("intro", "Intro");
        number(document(intro), OutputFormat.LATEX);

        assertEquals("Intro", intro.firstChildOfKind(NodeKind.TITLE).astext());
        assertEquals("1", intro.getAttribute(Node.LABEL));
    }

    @Test
    void contextChangeRestartsTopLevelCounterInItsAlphabet() {
        Node root = document(
            contextMarker("preface"),
            section("p1", "Preface"),
            section("p2", "Conventions"),
            contextMarker("body"),
            section("b1", "Language"),
            contextMarker("appendix"),
            section("a1", "Grammar"),
            section("a2", "Tables",
                section("a2-1", "Tags")));

        ReferenceLabelTable labels = number(root, OutputFormat.HTML).getLabels();

        assertEquals("I", labels.get("p1"));
        assertEquals("II", labels.get("p2"));
        assertEquals("1", labels.get("b1"));
        assertEquals("A", labels.get("a1"));
        assertEquals("B", labels.get("a2"));
        assertEquals("B.1", labels.get("a2-1"));
    }

    @Test
    void prefaceSectionsAreNotNumberedVisiblyByDefault() {
        Node preface = section("p1", "Preface");
        number(document(contextMarker("preface"), preface), OutputFormat.HTML);

        assertEquals("Preface", preface.firstChildOfKind(NodeKind.TITLE).astext());
        assertEquals("I", preface.getAttribute(Node.LABEL));
    }

    @Test
    void unknownContextIsReportedAndIgnored() {
        Node root = document(contextMarker("epilogue"), section("s1", "One"));
        ProcessingContext context = number(root, OutputFormat.HTML);

        assertEquals("1", context.getLabels().get("s1"));
        assertEquals(1, context.getDiagnostics().count(Diagnostics.SECTION_CONTEXT));
    }

    @Test
    void latexContextChangeEmitsCounterReset() {
        Node appendix = section("a1", "Grammar");
        Node root = document(contextMarker("appendix"), appendix);
        number(root, OutputFormat.LATEX);

        Node raw = appendix.getPreviousSibling();
        assertEquals(NodeKind.RAW, raw.getKind());
        assertEquals("latex", raw.getAttribute(Node.FORMAT));
        assertTrue(raw.getText().contains("\\setcounter{section}{0}"));
        assertTrue(raw.getText().contains("\\Alph{section}"));
    }

    @Test
    void explicitNumberOverridesCounterAndIsStripped() {
        Node trees = section("trees", "3. Trees",
            section("trees-sub", "Subtrees"));
        Node root = document(trees, section("next", "Next"));

        ReferenceLabelTable labels = number(root, OutputFormat.HTML).getLabels();

        assertEquals("3", labels.get("trees"));
        assertEquals("3.1", labels.get("trees-sub"));
        assertEquals("4", labels.get("next"));
        assertEquals("3 Trees", trees.firstChildOfKind(NodeKind.TITLE).astext());
    }

    @Test
    void explicitNumberAtWrongDepthIsReported() {
        Node wrong = section("wrong", "2. Wrong");
        Node root = document(section("intro", "Intro", wrong));

        ProcessingContext context = number(root, OutputFormat.LATEX);

        assertEquals("1.1", context.getLabels().get("wrong"));
        assertEquals("2. Wrong", wrong.firstChildOfKind(NodeKind.TITLE).astext());
        assertEquals(1, context.getDiagnostics().count(Diagnostics.SECTION_DEPTH));
    }

    @Test
    void explicitNumberInLatexEmitsSetCounter() {
        Node trees = section("trees", "5. Trees");
        number(document(trees), OutputFormat.LATEX);

        Node raw = trees.getPreviousSibling();
        assertEquals(NodeKind.RAW, raw.getKind());
        assertEquals("\\setcounter{section}{4}", raw.getText());
        assertEquals("Trees", trees.firstChildOfKind(NodeKind.TITLE).astext());
    }

    @Test
    void figureAndTableCountersDoNotResetAcrossSections() {
        Node captioned = figure("fig-a", Node.of(NodeKind.CAPTION, Node.text("A tree")));
        Node bare = table("tab-a");
        Node later = figure("fig-b");
        Node root = document(
            section("one", "One", captioned, bare),
            section("two", "Two", later));

        ReferenceLabelTable labels = number(root, OutputFormat.HTML).getLabels();

        assertEquals("1.1", labels.get("fig-a"));
        assertEquals("1.1", labels.get("tab-a"));
        assertEquals("2.2", labels.get("fig-b"));
        assertEquals("Figure 1.1: A tree", captioned.getLastChild().astext());
        assertEquals("Table 1.1", bare.getLastChild().astext());
    }

    @Test
    void figureLabelsIgnoreInterleavedTables() {
        Node root = document(section("one", "One",
            figure("f1"), table("t1"), figure("f2"), table("t2"), figure("f3")));

        ReferenceLabelTable labels = number(root, OutputFormat.LATEX).getLabels();

        assertEquals(List.of("1.1", "1.2", "1.3"), List.of(labels.get("f1"), labels.get("f2"), labels.get("f3")));
        assertEquals(List.of("1.1", "1.2"), List.of(labels.get("t1"), labels.get("t2")));
    }

    @Test
    void latexFloatsGetAnEmptyCaption() {
        Node bare = figure("fig-a");
        number(document(section("one", "One", bare)), OutputFormat.LATEX);

        Node caption = bare.getLastChild();
        assertEquals(NodeKind.CAPTION, caption.getKind());
        assertTrue(caption.getChildren().isEmpty());
    }

    @Test
    void precedingAnchorIsAdopted() {
        Node anchor = target("fig-anchor");
        Node plain = figure(null);
        number(document(section("one", "One", anchor, plain)), OutputFormat.HTML);

        assertEquals("1.1", plain.getAttribute(Node.LABEL));
        assertEquals(List.of("fig-anchor"), anchor.getIds());
        assertNull(anchor.getAttribute(Node.REFID));
    }

    @Test
    void anchoredSectionAfterLatexResetKeepsItsAnchor() {
        Node anchor = target("sec-anchor");
        Node appendix = section(null, "Grammar");
        ProcessingContext context = number(document(contextMarker("appendix"), anchor, appendix), OutputFormat.LATEX);

        assertEquals("A", context.getLabels().get("sec-anchor"));
    }

    @Test
    void examplesAreNumberedAndNestedOnesSpliced() {
        Node root = document(
            example("e1", paragraph(Node.text("first"))),
            example("e2",
                example("e2a",
                    example("e2ai", paragraph(Node.text("deep")))),
                example("e2b", paragraph(Node.text("second")))),
            example("e3", paragraph(Node.text("third"))));

        ReferenceLabelTable labels = number(root, OutputFormat.HTML).getLabels();

        assertEquals("(1)", labels.get("e1"));
        assertEquals("(2)", labels.get("e2"));
        assertEquals("(2a)", labels.get("e2a"));
        assertEquals("(2a.i)", labels.get("e2ai"));
        assertEquals("(2b)", labels.get("e2b"));
        assertEquals("(3)", labels.get("e3"));

        List<String> remaining = TreeUtils.findAll(root, NodeKind.EXAMPLE).stream()
            .map(node -> node.getAttribute(Node.LABEL))
            .collect(Collectors.toList());
        assertEquals(List.of("(1)", "(2a.i)", "(2b)", "(3)"), remaining);
    }
}
