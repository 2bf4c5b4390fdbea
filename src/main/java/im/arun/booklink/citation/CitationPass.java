package im.arun.booklink.citation;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.Diagnostics;
import im.arun.booklink.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rewrites citation references. With a locally rendered LaTeX bibliography each
 * citation becomes a {@code \cite} command; otherwise it links to the shared
 * bibliography page with the citation key as link text and the formatted author
 * and year in its {@code title} attribute.
 */
public class CitationPass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(CitationPass.class);

    /** Attribute carrying the formatted "[Author, Year]" text, shown as a tooltip. */
    public static final String TITLE = "title";

    @Override
    public String name() {
        return "citations";
    }

    @Override
    public int priority() {
        return 310;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        boolean latexCite = context.getConfig().isLocalBibliography() && context.getFormat() == OutputFormat.LATEX;
        Map<String, String> bibliography = context.getBibliography();
        String bibliographyUri = context.getConfig().getBibliographyUri();

        int count = 0;
        for (Node citation : TreeUtils.findAll(root, NodeKind.CITATION_REFERENCE)) {
            String written = citationText(citation);
            if (written.isEmpty()) {
                continue;
            }
            String key = written.toLowerCase(Locale.ROOT);
            if (latexCite) {
                citation.replaceWith(List.of(Node.raw(OutputFormat.LATEX.rawFormatName(), "\\cite{" + key + "}")));
            } else {
                Node link = Node.of(NodeKind.REFERENCE, Node.text(written));
                link.setAttribute(Node.REFURI, bibliographyUri + "#" + key);
                String formatted = bibliography.get(key);
                if (formatted == null) {
                    context.getDiagnostics().info(Diagnostics.BIBLIOGRAPHY, "Citation '%s' is not in the bibliography", key);
                } else {
                    link.setAttribute(TITLE, formatted);
                }
                link.markResolved();
                citation.replaceWith(List.of(link));
            }
            count++;
        }
        logger.info("Rewrote {} citations", count);
    }

    private static String citationText(Node citation) {
        String key = citation.getAttribute(Node.REFNAME);
        if (key == null) {
            key = citation.astext();
        }
        return key.trim();
    }
}
