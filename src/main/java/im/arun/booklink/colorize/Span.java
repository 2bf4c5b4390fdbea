package im.arun.booklink.colorize;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Span {
    private String text;
    private SpanTag tag;

    @Override
    public String toString() {
        return "[" + tag.getMarkupName() + "]\"" + text + "\"";
    }
}
