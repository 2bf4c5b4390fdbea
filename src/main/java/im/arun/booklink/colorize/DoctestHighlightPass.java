package im.arun.booklink.colorize;

import im.arun.booklink.config.BookLinkConfig;
import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replaces doctest blocks and inline literals by raw, colorized markup for the
 * target format, so the renderer emits them verbatim.
 */
public class DoctestHighlightPass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(DoctestHighlightPass.class);

    @Override
    public String name() {
        return "doctest-highlight";
    }

    @Override
    public int priority() {
        return 950;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        BookLinkConfig config = context.getConfig();
        if (!config.isHighlightDoctests()) {
            return;
        }
        SessionColorizer colorizer = new SessionColorizer(
            PythonVocabulary.withExtraBuiltins(config.getExtraBuiltins()), context.getDiagnostics());
        OutputFormat format = context.getFormat();
        boolean strip = config.isStripDoctestDirectives();

        int blocks = 0;
        int literals = 0;
        for (Node node : TreeUtils.preorder(root)) {
            if (node.getParent() == null) {
                continue;
            }
            if (node.getKind() == NodeKind.DOCTEST_BLOCK) {
                String colorized = colorize(colorizer, format, node.astext(), false, strip);
                node.replaceWith(List.of(Node.raw(format.rawFormatName(), wrap(format, colorized, false))));
                blocks++;
            } else if (node.getKind() == NodeKind.LITERAL) {
                String colorized = colorize(colorizer, format, node.astext(), true, strip);
                node.replaceWith(List.of(Node.raw(format.rawFormatName(), wrap(format, colorized, true))));
                literals++;
            }
        }
        logger.info("Colorized {} doctest blocks and {} inline literals", blocks, literals);
    }

    private static String colorize(SessionColorizer colorizer, OutputFormat format, String text,
                                   boolean inline, boolean strip) {
        SpanMarkup markup = format == OutputFormat.HTML ? new HtmlSpanMarkup() : new LatexSpanMarkup();
        return colorizer.colorize(text, markup, inline, strip);
    }

    private static String wrap(OutputFormat format, String colorized, boolean inline) {
        if (format == OutputFormat.HTML) {
            HtmlSpanMarkup html = new HtmlSpanMarkup();
            return inline ? html.inline(colorized) : html.block(colorized);
        }
        LatexSpanMarkup latex = new LatexSpanMarkup();
        return inline ? latex.inline(colorized) : latex.block(colorized);
    }
}
