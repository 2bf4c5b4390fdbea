package im.arun.booklink.model;

/**
 * Target output format of a build.
 */
public enum OutputFormat {
    HTML(".html"),
    LATEX(".tex");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Value of the {@code format} attribute on raw nodes meant for this output.
     */
    public String rawFormatName() {
        return this == HTML ? "html" : "latex";
    }
}
