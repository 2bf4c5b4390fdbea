package im.arun.booklink.config;

import im.arun.booklink.model.OutputFormat;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BookLinkConfig {
    private OutputFormat format = OutputFormat.HTML;
    private boolean numberSections = true;
    private boolean numberPrefaceSections = false;
    private String storeDir = "refs";
    private List<String> externalDocuments = new ArrayList<>();
    private String linkExtension;
    private String bibliographyFile;
    private String bibliographyUri = "bibliography.html";
    private boolean localBibliography = false;
    private boolean stripDoctestDirectives = true;
    private boolean highlightDoctests = true;
    private List<String> extraBuiltins = new ArrayList<>();

    /**
     * Extension appended to a document base name when linking to it from another document.
     */
    public String effectiveLinkExtension() {
        return linkExtension != null ? linkExtension : format.getExtension();
    }
}
