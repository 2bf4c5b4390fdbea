package im.arun.booklink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class BookLinkCLITest {

    private static final String CH1 = "{\"kind\":\"document\",\"children\":["
        + "{\"kind\":\"section\",\"ids\":[\"sec-trees\"],\"children\":["
        + "{\"kind\":\"title\",\"children\":[{\"kind\":\"text\",\"text\":\"Trees\"}]}]}]}";

    private static final String CH2 = "{\"kind\":\"document\",\"children\":["
        + "{\"kind\":\"paragraph\",\"children\":["
        + "{\"kind\":\"text\",\"text\":\"see section \"},"
        + "{\"kind\":\"reference\",\"attributes\":{\"refid\":\"sec-trees\"},\"children\":[{\"kind\":\"text\",\"text\":\"trees\"}]}]}]}";

    private static int run(String... args) {
        return new CommandLine(new BookLinkCLI()).execute(args);
    }

    @Test
    void exportThenRenderLinksChapters(@TempDir Path tmp) throws Exception {
        Path ch1 = tmp.resolve("ch1.json");
        Path ch2 = tmp.resolve("ch2.json");
        Files.writeString(ch1, CH1);
        Files.writeString(ch2, CH2);
        Path store = tmp.resolve("refs");
        Path out = tmp.resolve("out");

        assertEquals(0, run("--export-refs", "--store", store.toString(), ch1.toString(), ch2.toString()));
        assertTrue(Files.exists(store.resolve("ch1.refs.json")));
        assertTrue(Files.exists(store.resolve("ch2.refs.json")));

        assertEquals(0, run("--latex", "--store", store.toString(), "--output-dir", out.toString(),
            "--diagnostics", tmp.resolve("diag").toString(), ch2.toString(), ch1.toString()));

        JsonNode tree = new ObjectMapper().readTree(out.resolve("ch2.json").toFile());
        JsonNode reference = tree.get("children").get(0).get("children").get(1);
        assertEquals("ch1.tex#sec-trees", reference.get("attributes").get("refuri").asText());
        assertEquals("Section 1", reference.get("children").get(0).get("text").asText());
        assertTrue(Files.exists(tmp.resolve("diag/ch2.diagnostics.json")));
    }

    @Test
    void missingTreeExitsWithError(@TempDir Path tmp) {
        assertEquals(1, run("--store", tmp.toString(), tmp.resolve("absent.json").toString()));
    }

    @Test
    void nothingToDoIsAnError() {
        assertEquals(1, run());
    }

    @Test
    void htmlAndLatexAreExclusive(@TempDir Path tmp) {
        assertNotEquals(0, run("--html", "--latex", tmp.resolve("x.json").toString()));
    }
}
