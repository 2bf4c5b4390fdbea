package im.arun.booklink.colorize;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;

import java.util.regex.Pattern;

/**
 * Warns about {@code doctest-ignore} blocks separated from their session by a blank
 * line: the parser then attaches the directive to nothing and the session is still tested.
 */
public class DoctestIgnoreCheckPass implements TreePass {

    public static final String IGNORE = "ignore";
    public static final String BLOCK_TEXT = "block-text";
    public static final String LINE = "line";

    private static final Pattern BLANK_AFTER_DIRECTIVE = Pattern.compile("^[^\\n]*\\n\\s*\\n");

    @Override
    public String name() {
        return "doctest-ignore-check";
    }

    @Override
    public int priority() {
        return 120;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        for (Node block : TreeUtils.findAll(root, NodeKind.DOCTEST_BLOCK)) {
            String blockText = block.getAttribute(BLOCK_TEXT);
            if (!block.isFlagSet(IGNORE) || blockText == null) {
                continue;
            }
            if (BLANK_AFTER_DIRECTIVE.matcher(blockText).find()) {
                String line = block.getAttribute(LINE);
                context.getDiagnostics().warn(Diagnostics.DOCTEST_IGNORE,
                    "doctest-ignore on line %s will not be ignored, because there is a blank line "
                        + "between the directive and the doctest example", line == null ? "?" : line);
            }
        }
    }
}
