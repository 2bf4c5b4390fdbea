package im.arun.booklink.pipeline;

import im.arun.booklink.model.Node;

/**
 * One traversal over the document tree. Passes run in ascending {@link #priority()};
 * later passes read state that earlier ones put into the {@link ProcessingContext}.
 */
public interface TreePass {

    String name();

    int priority();

    void apply(Node root, ProcessingContext context);
}
