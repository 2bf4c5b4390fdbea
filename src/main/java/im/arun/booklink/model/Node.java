package im.arun.booklink.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node in the document tree handed over by the markup parser.
 * The tree owns its nodes: children are owned, the parent link is a back-reference
 * maintained by the child-manipulation methods and never serialized.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"kind", "ids", "names", "attributes", "text", "children"})
public class Node {

    public static final String REFID = "refid";
    public static final String REFURI = "refuri";
    public static final String REFNAME = "refname";
    public static final String LABEL = "label";
    public static final String RESOLVED = "resolved";
    public static final String FORMAT = "format";

    @Getter
    @Setter
    @JsonProperty("kind")
    private NodeKind kind = NodeKind.OTHER;

    @Getter
    @Setter
    @JsonProperty("text")
    private String text;

    @Getter
    @JsonProperty("ids")
    private List<String> ids = new ArrayList<>();

    @Getter
    @JsonProperty("names")
    private List<String> names = new ArrayList<>();

    @Getter
    @JsonProperty("attributes")
    private Map<String, String> attributes = new LinkedHashMap<>();

    @JsonProperty("children")
    private List<Node> children = new ArrayList<>();

    @JsonIgnore
    private Node parent;

    public Node() {
    }

    public Node(NodeKind kind) {
        this.kind = kind;
    }

    public static Node text(String value) {
        Node node = new Node(NodeKind.TEXT);
        node.setText(value);
        return node;
    }

    public static Node of(NodeKind kind, Node... children) {
        Node node = new Node(kind);
        for (Node child : children) {
            node.appendChild(child);
        }
        return node;
    }

    public static Node raw(String format, String value) {
        Node node = new Node(NodeKind.RAW);
        node.setAttribute(FORMAT, format);
        node.setText(value);
        return node;
    }

    @JsonIgnore
    public Node getParent() {
        return parent;
    }

    /**
     * Read-only view of the children; use the mutators below to change them.
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @JsonProperty("children")
    public void setChildren(List<Node> newChildren) {
        for (Node child : children) {
            child.parent = null;
        }
        children = new ArrayList<>();
        if (newChildren != null) {
            newChildren.forEach(this::appendChild);
        }
    }

    @JsonProperty("ids")
    public void setIds(List<String> ids) {
        this.ids = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
    }

    @JsonProperty("names")
    public void setNames(List<String> names) {
        this.names = names == null ? new ArrayList<>() : new ArrayList<>(names);
    }

    @JsonProperty("attributes")
    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public Node appendChild(Node child) {
        detach(child);
        child.parent = this;
        children.add(child);
        return this;
    }

    public Node insertChild(int index, Node child) {
        detach(child);
        child.parent = this;
        children.add(index, child);
        return this;
    }

    public void removeChild(Node child) {
        if (children.remove(child)) {
            child.parent = null;
        }
    }

    /**
     * Replaces this node, in its parent, by the given nodes (possibly none).
     */
    public void replaceWith(List<Node> replacements) {
        if (parent == null) {
            throw new IllegalStateException("Cannot replace a node without a parent");
        }
        Node oldParent = parent;
        int index = indexInParent();
        List<Node> moved = new ArrayList<>(replacements);
        oldParent.children.remove(index);
        this.parent = null;
        for (int i = 0; i < moved.size(); i++) {
            oldParent.insertChild(index + i, moved.get(i));
        }
    }

    public void replaceChildren(Node... newChildren) {
        setChildren(List.of(newChildren));
    }

    @JsonIgnore
    public int indexInParent() {
        if (parent == null) {
            return -1;
        }
        for (int i = 0; i < parent.children.size(); i++) {
            if (parent.children.get(i) == this) {
                return i;
            }
        }
        return -1;
    }

    @JsonIgnore
    public Node getPreviousSibling() {
        int index = indexInParent();
        return index > 0 ? parent.children.get(index - 1) : null;
    }

    @JsonIgnore
    public Node getFirstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    @JsonIgnore
    public Node getLastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public Node firstChildOfKind(NodeKind childKind) {
        for (Node child : children) {
            if (child.kind == childKind) {
                return child;
            }
        }
        return null;
    }

    /**
     * Nearest ancestor of the given kind, or null.
     */
    public Node findAncestor(NodeKind ancestorKind) {
        Node current = parent;
        while (current != null && current.kind != ancestorKind) {
            current = current.parent;
        }
        return current;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public void setAttribute(String name, String value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    public boolean isFlagSet(String name) {
        return "true".equalsIgnoreCase(attributes.get(name));
    }

    @JsonIgnore
    public boolean isResolved() {
        return isFlagSet(RESOLVED);
    }

    public void markResolved() {
        attributes.put(RESOLVED, "true");
    }

    /**
     * Text content of the subtree, concatenated in document order.
     */
    public String astext() {
        if (kind.isTextual()) {
            return text == null ? "" : text;
        }
        StringBuilder sb = new StringBuilder();
        for (Node child : children) {
            sb.append(child.astext());
        }
        return sb.toString();
    }

    /**
     * Copy of the whole subtree; the copy has no parent.
     */
    public Node deepCopy() {
        Node copy = new Node(kind);
        copy.text = text;
        copy.ids = new ArrayList<>(ids);
        copy.names = new ArrayList<>(names);
        copy.attributes = new LinkedHashMap<>(attributes);
        for (Node child : children) {
            copy.appendChild(child.deepCopy());
        }
        return copy;
    }

    private static void detach(Node child) {
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
    }

    @Override
    public String toString() {
        return kind.getTag() + (ids.isEmpty() ? "" : ids) + (text == null ? "" : "(\"" + text + "\")");
    }
}
