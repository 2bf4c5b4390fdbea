package im.arun.booklink.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.booklink.model.Document;
import im.arun.booklink.model.Node;
import im.arun.booklink.util.BookLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a parsed document tree from its JSON form.
 * The document name is the file name without its {@code .json} (and {@code .tree}) suffix.
 */
public class DocumentReader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentReader.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Document read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BookLinkException("Document tree not found: " + path);
        }
        Node root;
        try {
            root = objectMapper.readValue(path.toFile(), Node.class);
        } catch (IOException e) {
            throw new BookLinkException("Cannot read document tree " + path + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new BookLinkException("Document tree " + path + " is empty");
        }
        String name = documentName(path);
        logger.info("Read document {} from {}", name, path);
        return new Document(name, root);
    }

    public Document read(String name, String json) {
        try {
            return new Document(name, objectMapper.readValue(json, Node.class));
        } catch (IOException e) {
            throw new BookLinkException("Cannot parse document tree for " + name + ": " + e.getMessage(), e);
        }
    }

    public static String documentName(Path path) {
        String fileName = path.getFileName().toString();
        for (String suffix : new String[] {".json", ".tree"}) {
            if (fileName.endsWith(suffix)) {
                fileName = fileName.substring(0, fileName.length() - suffix.length());
            }
        }
        return fileName;
    }
}
