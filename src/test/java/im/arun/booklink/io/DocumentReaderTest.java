package im.arun.booklink.io;

import im.arun.booklink.model.Document;
import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.util.BookLinkException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentReaderTest {

    private static final String TREE = "{\"kind\":\"document\",\"children\":["
        + "{\"kind\":\"section\",\"ids\":[\"intro\"],\"children\":["
        + "{\"kind\":\"title\",\"children\":[{\"kind\":\"text\",\"text\":\"Intro\"}]},"
        + "{\"kind\":\"doctest-block\",\"attributes\":{\"ignore\":\"true\"},\"text\":\">>> 1\"},"
        + "{\"kind\":\"sidebar\"}]}]}";

    @Test
    void readsTreeAndLinksParents(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("ch01.json");
        Files.writeString(file, TREE);

        Document document = new DocumentReader().read(file);

        assertEquals("ch01", document.getName());
        Node root = document.getRoot();
        assertEquals(NodeKind.DOCUMENT, root.getKind());
        Node section = root.getFirstChild();
        assertSame(root, section.getParent());
        assertEquals("intro", section.getIds().get(0));
        assertEquals("Intro>>> 1", section.astext());
        assertTrue(section.getChildren().get(1).isFlagSet("ignore"));
        assertEquals(NodeKind.OTHER, section.getLastChild().getKind());
    }

    @Test
    void writtenTreeReadsBack(@TempDir Path tmp) throws Exception {
        Document original = new DocumentReader().read("ch01", TREE);

        Path written = new DocumentWriter().write(original, tmp.resolve("out"));
        Document reread = new DocumentReader().read(written);

        assertEquals(tmp.resolve("out/ch01.json"), written);
        assertEquals(original.getRoot().astext(), reread.getRoot().astext());
        assertEquals("doctest-block", reread.getRoot().getFirstChild().getChildren().get(1).getKind().getTag());
    }

    @Test
    void missingOrBrokenTreeFailsHard(@TempDir Path tmp) throws Exception {
        DocumentReader reader = new DocumentReader();
        assertThrows(BookLinkException.class, () -> reader.read(tmp.resolve("absent.json")));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"kind\": ");
        assertThrows(BookLinkException.class, () -> reader.read(broken));
    }

    @Test
    void documentNameDropsTreeSuffixes() {
        assertEquals("ch02", DocumentReader.documentName(Path.of("trees/ch02.tree.json")));
        assertEquals("ch02", DocumentReader.documentName(Path.of("ch02")));
    }
}
