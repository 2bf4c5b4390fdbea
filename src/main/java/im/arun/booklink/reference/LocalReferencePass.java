package im.arun.booklink.reference;

import im.arun.booklink.model.Node;
import im.arun.booklink.numbering.ReferenceLabelTable;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Replaces the text of references to numbered nodes of the same document by their labels.
 * Tables of contents are left alone.
 */
public class LocalReferencePass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(LocalReferencePass.class);

    @Override
    public String name() {
        return "local-references";
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        int resolved = visit(root, context.getLabels());
        logger.info("Resolved {} local references", resolved);
    }

    private int visit(Node node, ReferenceLabelTable labels) {
        switch (node.getKind()) {
            case CONTENTS:
                return 0;
            case REFERENCE:
                return resolve(node, labels) ? 1 : 0;
            default:
                int count = 0;
                for (Node child : new ArrayList<>(node.getChildren())) {
                    count += visit(child, labels);
                }
                return count;
        }
    }

    private boolean resolve(Node reference, ReferenceLabelTable labels) {
        if (reference.isResolved()) {
            return false;
        }
        String refid = reference.getAttribute(Node.REFID);
        if (!labels.contains(refid)) {
            return false;
        }
        LinkText.relabel(reference, labels.get(refid));
        reference.markResolved();
        return true;
    }
}
