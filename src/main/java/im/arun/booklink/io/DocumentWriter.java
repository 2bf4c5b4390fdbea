package im.arun.booklink.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.booklink.model.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a processed tree back out as JSON, ready for a renderer.
 */
public class DocumentWriter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    public Path write(Document document, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(document.getName() + ".json");
        objectMapper.writeValue(target.toFile(), document.getRoot());
        return target;
    }

    public String toJson(Document document) throws IOException {
        return objectMapper.writeValueAsString(document.getRoot());
    }
}
