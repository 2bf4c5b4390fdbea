package im.arun.booklink.index;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.model.TermEntry;
import im.arun.booklink.numbering.NumberingPass;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.util.TreeUtils;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static im.arun.booklink.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndexTest {

    private static Node term(String text) {
        return Node.of(NodeKind.INDEX_TERM, Node.text(text));
    }

    @Test
    void keysAreNormalizedAndDisambiguated() {
        assertEquals("binary_tree", IndexKeys.normalize("Binary  Tree!"));
        assertEquals("term", IndexKeys.normalize("  "));

        Set<String> used = new HashSet<>();
        assertEquals("foo", IndexKeys.disambiguate("foo", used));
        assertEquals("foo_2", IndexKeys.disambiguate("foo", used));
        assertEquals("foo_3", IndexKeys.disambiguate("foo", used));
    }

    @Test
    void termsBecomeAnchorsWithTheirSectionLabel() {
        Node first = term("Parse tree");
        Node second = term("parse-tree");
        Node root = document(section("one", "One", paragraph(first), section("one-a", "A", paragraph(second))));

        ProcessingContext context = context(OutputFormat.HTML);
        new NumberingPass().apply(root, context);
        new TermCollectionPass().apply(root, context);

        assertTrue(first.getIds().contains("parse_tree"));
        assertTrue(second.getIds().contains("parse_tree_2"));
        TermEntry entry = context.getTerms().get("parse_tree_2");
        assertEquals("1.1", entry.getSectionLabel());
        assertEquals("parse-tree", entry.getContent().astext());
        assertNull(entry.getContent().getParent());
    }

    @Test
    void indexMergesLocalAndExternalTerms() {
        Node placeholder = new Node(NodeKind.INDEX);
        Node extra = new Node(NodeKind.INDEX);
        Node root = document(
            section("one", "One", paragraph(term("Parse tree")), paragraph(term("parse tree"))),
            placeholder,
            extra);

        SymbolTableRecord other = new SymbolTableRecord("ch2");
        other.getTerms().put("alpha", new TermEntry(term("Alpha"), "alpha", "2.1"));
        other.getTerms().put("parse_tree", new TermEntry(term("Parse Tree"), "parse_tree", "2.3"));

        ProcessingContext context = context(OutputFormat.HTML);
        context.addExternalRecord(other);
        new NumberingPass().apply(root, context);
        new TermCollectionPass().apply(root, context);
        new IndexBuilderPass().apply(root, context);

        assertTrue(TreeUtils.findAll(root, NodeKind.INDEX).isEmpty());
        Node list = root.getLastChild();
        assertEquals(NodeKind.BULLET_LIST, list.getKind());
        assertEquals("index", list.getAttribute("class"));

        List<Node> items = list.getChildren();
        assertEquals(6, items.size());
        assertEquals("A", items.get(0).astext());
        assertEquals(IndexBuilderPass.HEADING_CLASS, items.get(0).getAttribute("class"));
        assertEquals("Alpha (see §2.1)", items.get(1).astext());
        assertEquals("P", items.get(2).astext());

        Node alphaLink = items.get(1).getFirstChild();
        assertEquals("ch2.html#alpha", alphaLink.getAttribute(Node.REFURI));
        Node localLink = items.get(3).getFirstChild();
        assertEquals("parse_tree", localLink.getAttribute(Node.REFID));
        assertEquals("ch2.html#parse_tree", items.get(5).getFirstChild().getAttribute(Node.REFURI));
    }

    @Test
    void nonLetterKeysGroupUnderSymbols() {
        assertEquals("Symbols", IndexBuilderPass.groupOf("2to3"));
        assertEquals("Q", IndexBuilderPass.groupOf("queue"));
    }
}
