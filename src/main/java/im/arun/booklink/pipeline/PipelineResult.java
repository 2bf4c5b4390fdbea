package im.arun.booklink.pipeline;

import im.arun.booklink.model.Document;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

@Data
@AllArgsConstructor
public class PipelineResult {
    private Document document;
    private BuildMode mode;
    private ProcessingContext context;
    /** Written record in export mode, null otherwise. */
    private Path recordPath;
}
