package im.arun.booklink.numbering;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.model.SectionContext;
import im.arun.booklink.pipeline.ProcessingContext;
import im.arun.booklink.pipeline.TreePass;
import im.arun.booklink.util.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns labels to sections, figures, tables and examples in document order and
 * records them, keyed by anchor identifier, in the context's {@link ReferenceLabelTable}.
 */
public class NumberingPass implements TreePass {
    private static final Logger logger = LoggerFactory.getLogger(NumberingPass.class);

    public static final String CONTEXT_ATTRIBUTE = "context";
    public static final String SECTION_NUMBER_CLASS = "sectnum";

    static final Pattern EXPLICIT_NUMBER = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)*)\\.?\\s+");

    private static final String[] LATEX_LEVELS = {"section", "subsection", "subsubsection", "paragraph", "subparagraph"};

    @Override
    public String name() {
        return "numbering";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public void apply(Node root, ProcessingContext context) {
        Walker walker = new Walker(context);
        walker.visit(root);
        context.getLabels().seal();
        logger.info("Numbered {} sections, {} figures, {} tables and {} examples; {} labels recorded",
            walker.sectionCount, walker.figureCount, walker.tableCount, walker.exampleCount,
            context.getLabels().size());
    }

    /**
     * Adopts the identifier of an anchor marker immediately preceding {@code node}:
     * the marker's {@code refid} becomes its own id and is removed as a reference.
     */
    static String adoptAnchor(Node node) {
        Node previous = node.getPreviousSibling();
        if (previous == null || previous.getKind() != NodeKind.TARGET) {
            return null;
        }
        String refid = previous.removeAttribute(Node.REFID);
        if (refid == null) {
            return null;
        }
        previous.setIds(List.of(refid));
        return refid;
    }

    private static final class Walker {
        private final ProcessingContext context;
        private final ReferenceLabelTable labels;
        private final Diagnostics diagnostics;
        private final OutputFormat format;
        private final CounterState counters = new CounterState();

        private SectionContext sectionContext = SectionContext.BODY;
        private SectionContext pendingContext;

        private int sectionCount;
        private int figureCount;
        private int tableCount;
        private int exampleCount;

        Walker(ProcessingContext context) {
            this.context = context;
            this.labels = context.getLabels();
            this.diagnostics = context.getDiagnostics();
            this.format = context.getFormat();
        }

        void visit(Node node) {
            switch (node.getKind()) {
                case SECTION_CONTEXT:
                    armContext(node);
                    break;
                case SECTION:
                    enterSection(node);
                    visitChildren(node);
                    counters.popSection();
                    break;
                case FIGURE:
                case TABLE:
                    numberFloat(node);
                    visitChildren(node);
                    break;
                case EXAMPLE:
                    enterExample(node);
                    visitChildren(node);
                    leaveExample(node);
                    break;
                default:
                    visitChildren(node);
                    break;
            }
        }

        private void visitChildren(Node node) {
            for (Node child : new ArrayList<>(node.getChildren())) {
                visit(child);
            }
        }

        private void armContext(Node marker) {
            String value = marker.getAttribute(CONTEXT_ATTRIBUTE);
            if (value == null) {
                value = marker.astext();
            }
            SectionContext requested = SectionContext.parse(value);
            if (requested == null) {
                diagnostics.warn(Diagnostics.SECTION_CONTEXT, "Unknown section context '%s'; ignored", value);
                return;
            }
            pendingContext = requested;
        }

        private void enterSection(Node section) {
            String anchor = adoptAnchor(section);
            if (counters.sectionDepth() == 1 && pendingContext != null) {
                sectionContext = pendingContext;
                pendingContext = null;
                counters.resetTop();
                if (format == OutputFormat.LATEX) {
                    insertBefore(section, Node.raw(format.rawFormatName(), latexContextReset(sectionContext)));
                }
            }

            counters.incrementSection();
            applyExplicitNumber(section);

            String label = LabelFormatter.section(counters.sectionValues(), sectionContext);
            section.setAttribute(Node.LABEL, label);
            register(section, anchor, label);
            sectionCount++;

            Node title = section.firstChildOfKind(NodeKind.TITLE);
            if (title != null && isNumberDisplayed()) {
                Node generated = new Node(NodeKind.GENERATED);
                generated.setText(label + " ");
                generated.setAttribute("class", SECTION_NUMBER_CLASS);
                title.insertChild(0, generated);
            }

            counters.pushSection();
        }

        private boolean isNumberDisplayed() {
            if (format != OutputFormat.HTML || !context.getConfig().isNumberSections()) {
                return false;
            }
            return sectionContext != SectionContext.PREFACE || context.getConfig().isNumberPrefaceSections();
        }

        private void applyExplicitNumber(Node section) {
            Node title = section.firstChildOfKind(NodeKind.TITLE);
            Node leaf = title == null ? null : firstTextLeaf(title);
            if (leaf == null) {
                return;
            }
            Matcher matcher = EXPLICIT_NUMBER.matcher(leaf.getText());
            if (!matcher.find()) {
                return;
            }
            String[] parts = matcher.group(1).split("\\.");
            int depth = counters.sectionDepth();
            if (parts.length != depth) {
                diagnostics.warn(Diagnostics.SECTION_DEPTH,
                    "Section '%s' is numbered %s but sits at depth %d; explicit number ignored",
                    title.astext().trim(), matcher.group(1), depth);
                return;
            }
            int[] numbers = new int[parts.length];
            try {
                for (int i = 0; i < parts.length; i++) {
                    numbers[i] = Integer.parseInt(parts[i]);
                }
            } catch (NumberFormatException e) {
                diagnostics.warn(Diagnostics.SECTION_DEPTH, "Section number %s is out of range; ignored", matcher.group(1));
                return;
            }
            counters.setSectionNumbers(numbers);
            leaf.setText(leaf.getText().substring(matcher.end()));
            if (format == OutputFormat.LATEX) {
                insertBefore(section, Node.raw(format.rawFormatName(), latexNumberReset(numbers)));
            }
        }

        private void numberFloat(Node node) {
            boolean figure = node.getKind() == NodeKind.FIGURE;
            int number = figure ? counters.nextFigure() : counters.nextTable();
            String label = LabelFormatter.floating(counters.topValue(), number, sectionContext);
            String noun = figure ? "Figure" : "Table";
            if (figure) {
                figureCount++;
            } else {
                tableCount++;
            }

            node.setAttribute(Node.LABEL, label);
            register(node, adoptAnchor(node), label);

            Node last = node.getLastChild();
            if (last != null && last.getKind() == NodeKind.CAPTION) {
                if (format == OutputFormat.HTML) {
                    last.insertChild(0, Node.text(noun + " " + label + ": "));
                }
            } else if (format == OutputFormat.HTML) {
                node.appendChild(Node.of(NodeKind.CAPTION, Node.text(noun + " " + label)));
            } else {
                node.appendChild(new Node(NodeKind.CAPTION));
            }
        }

        private void enterExample(Node example) {
            counters.incrementExample();
            String label = LabelFormatter.example(counters.exampleValues());
            example.setAttribute(Node.LABEL, label);
            register(example, adoptAnchor(example), label);
            exampleCount++;
            counters.pushExample();
        }

        private void leaveExample(Node example) {
            int nested = counters.popExample();
            if (nested > 0 && example.getParent() != null) {
                example.replaceWith(new ArrayList<>(example.getChildren()));
            }
        }

        private void register(Node node, String anchor, String label) {
            Set<String> ids = new LinkedHashSet<>(node.getIds());
            if (anchor != null) {
                ids.add(anchor);
            }
            if (ids.isEmpty()) {
                logger.debug("{} {} has no anchor and cannot be referenced", node.getKind().getTag(), label);
                return;
            }
            for (String id : ids) {
                labels.put(id, label);
            }
        }

        private static void insertBefore(Node node, Node inserted) {
            Node parent = node.getParent();
            if (parent != null) {
                parent.insertChild(node.indexInParent(), inserted);
            }
        }

        private static Node firstTextLeaf(Node node) {
            if (node.getKind() == NodeKind.TEXT) {
                return node.getText() == null ? null : node;
            }
            for (Node child : node.getChildren()) {
                Node leaf = firstTextLeaf(child);
                if (leaf != null) {
                    return leaf;
                }
            }
            return null;
        }

        private static String latexContextReset(SectionContext context) {
            String style;
            switch (context) {
                case PREFACE:
                    style = "\\Roman";
                    break;
                case APPENDIX:
                    style = "\\Alph";
                    break;
                default:
                    style = "\\arabic";
                    break;
            }
            return "\\setcounter{section}{0}\n\\renewcommand{\\thesection}{" + style + "{section}}";
        }

        private static String latexNumberReset(int[] numbers) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < numbers.length && i < LATEX_LEVELS.length; i++) {
                boolean innermost = i == numbers.length - 1;
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("\\setcounter{").append(LATEX_LEVELS[i]).append("}{")
                    .append(innermost ? numbers[i] - 1 : numbers[i]).append('}');
            }
            return sb.toString();
        }
    }
}
