package im.arun.booklink.reference;

import im.arun.booklink.model.Node;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Points references at identifiers declared by other documents, using their
 * persisted symbol table records. Runs after local resolution; references it or the
 * local pass already resolved are skipped.
 */
public class CrossReferencePass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(CrossReferencePass.class);

    @Override
    public String name() {
        return "cross-references";
    }

    @Override
    public int priority() {
        return 210;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        Map<String, ExternalTarget> lookup = buildLookup(context.getExternalRecords(),
            context.getConfig().effectiveLinkExtension());
        Set<String> localIds = TreeUtils.declaredIds(root);

        int resolved = 0;
        int unresolved = 0;
        for (Node reference : collectReferences(root)) {
            if (reference.isResolved()) {
                continue;
            }
            String refid = reference.getAttribute(Node.REFID);
            if (refid == null || localIds.contains(refid)) {
                continue;
            }
            ExternalTarget target = lookup.get(refid);
            if (target == null) {
                unresolved++;
                context.getDiagnostics().info(Diagnostics.UNRESOLVED, "Reference to '%s' matches no known target", refid);
                continue;
            }
            reference.setAttribute(Node.REFURI, target.href(refid));
            if (target.getLabel() != null) {
                LinkText.relabel(reference, target.getLabel());
            }
            reference.markResolved();
            resolved++;
        }
        logger.info("Resolved {} cross-document references against {} records; {} left dangling",
            resolved, context.getExternalRecords().size(), unresolved);
    }

    /**
     * Merged identifier lookup over all records; the first record declaring an
     * identifier wins.
     */
    public static Map<String, ExternalTarget> buildLookup(List<SymbolTableRecord> records, String extension) {
        Map<String, ExternalTarget> lookup = new LinkedHashMap<>();
        for (SymbolTableRecord record : records) {
            String uri = record.getDocument() + extension;
            for (String id : record.getTargets()) {
                ExternalTarget previous = lookup.putIfAbsent(id,
                    new ExternalTarget(uri, record.getReferenceLabels().get(id)));
                if (previous != null && !previous.getUri().equals(uri)) {
                    logger.debug("Identifier '{}' declared by both {} and {}; keeping the first", id, previous.getUri(), uri);
                }
            }
            for (Map.Entry<String, String> label : record.getReferenceLabels().entrySet()) {
                lookup.putIfAbsent(label.getKey(), new ExternalTarget(uri, label.getValue()));
            }
        }
        return lookup;
    }

    private static List<Node> collectReferences(Node node) {
        List<Node> result = new ArrayList<>();
        collect(node, result);
        return result;
    }

    private static void collect(Node node, List<Node> result) {
        switch (node.getKind()) {
            case CONTENTS:
                return;
            case REFERENCE:
                result.add(node);
                return;
            default:
                for (Node child : node.getChildren()) {
                    collect(child, result);
                }
        }
    }
}
