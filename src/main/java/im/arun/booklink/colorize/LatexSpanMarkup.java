package im.arun.booklink.colorize;

/**
 * {@code \pysrcTAG{text}} with LaTeX special characters escaped, for use inside
 * an {@code alltt} environment.
 */
public class LatexSpanMarkup implements SpanMarkup {

    private static final String PREAMBLE = String.join("\n",
        "% For Python source code:",
        "\\usepackage{alltt}",
        "% Python source code: Prompt",
        "\\newcommand{\\pysrcprompt}[1]{\\textbf{#1}}",
        "\\newcommand{\\pysrcmore}[1]{\\textbf{#1}}",
        "% Python source code: Source code",
        "\\newcommand{\\pysrckeyword}[1]{\\textbf{#1}}",
        "\\newcommand{\\pysrcbuiltin}[1]{\\textbf{#1}}",
        "\\newcommand{\\pysrcstring}[1]{\\textit{#1}}",
        "\\newcommand{\\pysrcother}[1]{\\textbf{#1}}",
        "% Python source code: Comments",
        "\\newcommand{\\pysrccomment}[1]{\\textrm{#1}}",
        "% Python interpreter: Traceback message",
        "\\newcommand{\\pysrcexcept}[1]{\\textbf{#1}}",
        "% Python interpreter: Output",
        "\\newcommand{\\pysrcoutput}[1]{#1}",
        "");

    @Override
    public String markup(String text, SpanTag tag) {
        return "\\pysrc" + tag.getMarkupName() + "{" + escape(text) + "}";
    }

    public String block(String colorized) {
        return "\\begin{alltt}\n" + colorized + "\n\\end{alltt}\n";
    }

    public String inline(String colorized) {
        return "\\texttt{" + colorized + "}";
    }

    /**
     * Macro definitions a LaTeX document needs before it can use the colorized output.
     */
    public static String preamble() {
        return PREAMBLE;
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\':
                    sb.append("\\textbackslash{}");
                    break;
                case '{':
                case '}':
                case '#':
                case '$':
                case '%':
                case '&':
                case '_':
                    sb.append('\\').append(c);
                    break;
                case '^':
                    sb.append("\\textasciicircum{}");
                    break;
                case '~':
                    sb.append("\\textasciitilde{}");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
