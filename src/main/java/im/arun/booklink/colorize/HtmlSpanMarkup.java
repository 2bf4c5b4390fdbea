package im.arun.booklink.colorize;

import org.apache.commons.text.StringEscapeUtils;

/**
 * {@code <span class="pysrc-TAG">text</span>}, text HTML-escaped.
 */
public class HtmlSpanMarkup implements SpanMarkup {

    public static final String CLASS_PREFIX = "pysrc-";

    @Override
    public String markup(String text, SpanTag tag) {
        return "<span class=\"" + CLASS_PREFIX + tag.getMarkupName() + "\">"
            + StringEscapeUtils.escapeHtml4(text) + "</span>";
    }

    public String block(String colorized) {
        return "<pre class=\"doctest-block\">\n" + colorized + "\n</pre>\n";
    }

    public String inline(String colorized) {
        return "<tt class=\"doctest\"><span class=\"pre\">" + colorized + "</span></tt>";
    }
}
