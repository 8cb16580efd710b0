package io.rtfde.core.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered context diff. An empty result means the compared sequences were identical.
 */
public class DiffResult {

    private final List<String> lines;

    public DiffResult(List<String> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static DiffResult empty() {
        return new DiffResult(List.of());
    }

    public List<String> lines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Joins the lines with newlines. Lines that already end with a line feed (units that kept their terminator)
     * are not given a second one.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            builder.append(line);
            if (i < lines.size() - 1 && !line.endsWith("\n")) {
                builder.append('\n');
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return text();
    }
}
