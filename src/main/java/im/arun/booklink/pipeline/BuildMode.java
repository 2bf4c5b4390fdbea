package im.arun.booklink.pipeline;

public enum BuildMode {
    /** Run every pass and hand the tree to the renderer. */
    RENDER,
    /** Number and collect only, then write the symbol table record; nothing is rendered. */
    EXPORT_REFERENCES
}
