package im.arun.booklink.reference;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the visible text of a resolved reference.
 * A classifier word ending the text just before the reference ("see figure ") is
 * pulled into the link, so the whole phrase "Figure 3.1" becomes clickable.
 */
public final class LinkText {

    static final Pattern CLASSIFIER = Pattern.compile(
        "(?i)\\b(figure|table|example|chapter|section|appendix|sentence|tree|listing|program)\\s*$");

    private LinkText() {}

    public static void relabel(Node reference, String label) {
        String linkText = label;
        Node previous = reference.getPreviousSibling();
        if (previous != null && previous.getKind() == NodeKind.TEXT && previous.getText() != null) {
            Matcher matcher = CLASSIFIER.matcher(previous.getText());
            if (matcher.find()) {
                linkText = StringUtils.capitalize(matcher.group(1).toLowerCase()) + " " + label;
                String remaining = previous.getText().substring(0, matcher.start());
                if (remaining.isEmpty()) {
                    previous.getParent().removeChild(previous);
                } else {
                    previous.setText(remaining);
                }
            }
        }
        reference.replaceChildren(Node.text(linkText));
    }
}
