package im.arun.booklink.numbering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters of one numbering traversal.
 * <p>
 * The section stack holds one counter per open nesting level plus the top-level
 * counter, which is never popped. Figure and table counters are plain scalars that
 * section boundaries never reset. The example stack mirrors the section stack for
 * nested examples.
 */
public class CounterState {

    private final List<Integer> sections = new ArrayList<>(List.of(0));
    private final List<Integer> examples = new ArrayList<>(List.of(0));
    private int figures;
    private int tables;

    /**
     * Nesting depth of the section about to be numbered; 1 at top level.
     */
    public int sectionDepth() {
        return sections.size();
    }

    public void incrementSection() {
        int last = sections.size() - 1;
        sections.set(last, sections.get(last) + 1);
    }

    public void pushSection() {
        sections.add(0);
    }

    public void popSection() {
        if (sections.size() <= 1) {
            throw new IllegalStateException("Section counter stack underflow");
        }
        sections.remove(sections.size() - 1);
    }

    public void resetTop() {
        sections.set(0, 0);
    }

    public int topValue() {
        return sections.get(0);
    }

    /**
     * Overrides the open levels with explicitly given numbers; the array length must
     * equal {@link #sectionDepth()}.
     */
    public void setSectionNumbers(int[] numbers) {
        if (numbers.length != sections.size()) {
            throw new IllegalArgumentException("Expected " + sections.size() + " numbers, got " + numbers.length);
        }
        for (int i = 0; i < numbers.length; i++) {
            sections.set(i, numbers[i]);
        }
    }

    public List<Integer> sectionValues() {
        return Collections.unmodifiableList(sections);
    }

    public int nextFigure() {
        return ++figures;
    }

    public int nextTable() {
        return ++tables;
    }

    public void incrementExample() {
        int last = examples.size() - 1;
        examples.set(last, examples.get(last) + 1);
    }

    public void pushExample() {
        examples.add(0);
    }

    /**
     * Pops the counter pushed for the example being left and returns its value,
     * i.e. the number of sub-examples it contained.
     */
    public int popExample() {
        if (examples.size() <= 1) {
            throw new IllegalStateException("Example counter stack underflow");
        }
        return examples.remove(examples.size() - 1);
    }

    public List<Integer> exampleValues() {
        return Collections.unmodifiableList(examples);
    }
}
