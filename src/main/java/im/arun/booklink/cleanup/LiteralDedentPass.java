package im.arun.booklink.cleanup;

import im.arun.booklink.model.Node;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the indentation shared by all non-blank lines of literal and doctest blocks.
 * Runs last, after every pass that reads or rewrites block text.
 */
public class LiteralDedentPass implements TreePass {

    @Override
    public String name() {
        return "literal-dedent";
    }

    @Override
    public int priority() {
        return 900;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        for (Node node : TreeUtils.preorder(root)) {
            switch (node.getKind()) {
                case LITERAL_BLOCK:
                case DOCTEST_BLOCK:
                    if (node.getText() != null) {
                        node.setText(dedent(node.getText()));
                    }
                    break;
                default:
                    break;
            }
        }
    }

    public static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        String margin = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String indent = line.substring(0, line.length() - line.stripLeading().length());
            margin = margin == null ? indent : commonPrefix(margin, indent);
        }
        if (margin == null || margin.isEmpty()) {
            return text;
        }
        List<String> result = new ArrayList<>(lines.length);
        for (String line : lines) {
            result.add(line.isBlank() ? "" : line.substring(margin.length()));
        }
        return String.join("\n", result);
    }

    private static String commonPrefix(String a, String b) {
        int i = 0;
        while (i < a.length() && i < b.length() && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }
}
