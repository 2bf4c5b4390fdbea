package im.arun.booklink.index;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.TermEntry;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the book index in place of the document's {@code index} placeholder:
 * local and external terms sorted by key, grouped under letter headings, each
 * entry linking to its anchor.
 */
public class IndexBuilderPass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilderPass.class);

    public static final String HEADING_CLASS = "index-heading";
    public static final String ENTRY_CLASS = "index-entry";

    @Override
    public String name() {
        return "index";
    }

    @Override
    public int priority() {
        return 300;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        List<Node> placeholders = TreeUtils.findAll(root, NodeKind.INDEX);
        if (placeholders.isEmpty()) {
            return;
        }

        Map<String, IndexItem> items = merge(context);
        Node list = render(items);
        placeholders.get(0).replaceWith(List.of(list));
        for (Node extra : placeholders.subList(1, placeholders.size())) {
            extra.replaceWith(List.of());
        }
        logger.info("Built index with {} entries", items.size());
    }

    private Map<String, IndexItem> merge(ProcessingContext context) {
        Map<String, IndexItem> items = new TreeMap<>();
        Set<String> used = new HashSet<>();
        for (TermEntry entry : context.getTerms().values()) {
            used.add(entry.getId());
            items.put(entry.getId(), new IndexItem(entry, null));
        }
        String extension = context.getConfig().effectiveLinkExtension();
        for (SymbolTableRecord record : context.getExternalRecords()) {
            String uri = record.getDocument() + extension;
            for (Map.Entry<String, TermEntry> external : record.getTerms().entrySet()) {
                String key = IndexKeys.disambiguate(external.getKey(), used);
                TermEntry entry = external.getValue();
                String id = entry.getId() != null ? entry.getId() : external.getKey();
                items.put(key, new IndexItem(entry, uri + "#" + id));
            }
        }
        return items;
    }

    private Node render(Map<String, IndexItem> items) {
        Node list = new Node(NodeKind.BULLET_LIST);
        list.setAttribute("class", "index");
        String currentGroup = null;
        for (Map.Entry<String, IndexItem> item : items.entrySet()) {
            String group = groupOf(item.getKey());
            if (!group.equals(currentGroup)) {
                Node heading = Node.of(NodeKind.LIST_ITEM, Node.text(group));
                heading.setAttribute("class", HEADING_CLASS);
                list.appendChild(heading);
                currentGroup = group;
            }
            list.appendChild(renderEntry(item.getValue()));
        }
        return list;
    }

    private Node renderEntry(IndexItem item) {
        TermEntry entry = item.entry;
        Node link = new Node(NodeKind.REFERENCE);
        if (item.externalHref != null) {
            link.setAttribute(Node.REFURI, item.externalHref);
        } else {
            link.setAttribute(Node.REFID, entry.getId());
        }
        link.markResolved();
        if (entry.getContent() != null) {
            for (Node child : entry.getContent().getChildren()) {
                link.appendChild(child.deepCopy());
            }
        }
        if (link.getChildren().isEmpty()) {
            link.appendChild(Node.text(entry.getId()));
        }

        Node listItem = Node.of(NodeKind.LIST_ITEM, link);
        listItem.setAttribute("class", ENTRY_CLASS);
        if (entry.getSectionLabel() != null) {
            listItem.appendChild(Node.text(" (see §" + entry.getSectionLabel() + ")"));
        }
        return listItem;
    }

    static String groupOf(String key) {
        char first = key.charAt(0);
        return Character.isLetter(first) ? String.valueOf(Character.toUpperCase(first)) : "Symbols";
    }

    private static final class IndexItem {
        private final TermEntry entry;
        private final String externalHref;

        IndexItem(TermEntry entry, String externalHref) {
            this.entry = entry;
            this.externalHref = externalHref;
        }
    }
}
