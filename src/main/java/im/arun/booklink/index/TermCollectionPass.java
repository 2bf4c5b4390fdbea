package im.arun.booklink.index;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.TermEntry;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects index terms into the context's term table. Each term node becomes an
 * anchor whose id is its key; the entry keeps a copy of the term's content and the
 * label of the section it appears in.
 */
public class TermCollectionPass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(TermCollectionPass.class);

    @Override
    public String name() {
        return "index-terms";
    }

    @Override
    public int priority() {
        return 110;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        Map<String, TermEntry> terms = context.getTerms();
        Set<String> used = new HashSet<>(terms.keySet());
        for (Node term : TreeUtils.findAll(root, NodeKind.INDEX_TERM)) {
            String key = IndexKeys.disambiguate(IndexKeys.normalize(term.astext()), used);
            if (!term.getIds().contains(key)) {
                term.getIds().add(key);
            }
            terms.put(key, new TermEntry(term.deepCopy(), key, TreeUtils.enclosingSectionLabel(term)));
        }
        logger.info("Collected {} index terms", terms.size());
    }
}
