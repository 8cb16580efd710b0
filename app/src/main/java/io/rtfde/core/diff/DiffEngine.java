package io.rtfde.core.diff;

import io.rtfde.core.tree.Tree;
import io.rtfde.core.tree.TreeFlattener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces context diffs of strings and parse trees for inspecting what a transformation changed.
 */
public class DiffEngine {

    private final ContextDiff contextDiff;

    public DiffEngine() {
        this(new ContextDiff());
    }

    public DiffEngine(ContextDiff contextDiff) {
        this.contextDiff = Objects.requireNonNull(contextDiff, "contextDiff");
    }

    /**
     * Diffs two strings line by line. Each line keeps its terminator so line ending changes show up. Besides
     * {@code \n}, {@code \r\n} and {@code \r}, the boundaries listed in {@link #isLineBoundary(char)} end a line.
     */
    public DiffResult stringDiff(String original, String revised) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(revised, "revised");
        return contextDiff.diff(splitLinesKeepEnds(original), splitLinesKeepEnds(revised));
    }

    /**
     * Diffs two strings split by a regular expression. Line breaks are removed before splitting, text captured by
     * groups in the separator is kept as units, and empty units are dropped from both sides.
     *
     * @param separator regular expression to split by; null falls back to line based diffing
     */
    public DiffResult stringDiff(String original, String revised, String separator) {
        if (separator == null) {
            return stringDiff(original, revised);
        }
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(revised, "revised");
        Pattern pattern = Pattern.compile(separator);
        return contextDiff.diff(splitBy(pattern, original), splitBy(pattern, revised));
    }

    /**
     * Diffs the full flattening of two trees, so token position drift is reported as well as value changes.
     */
    public DiffResult treeDiff(Tree original, Tree revised) {
        List<String> flatOriginal = TreeFlattener.flatten(original).collect(Collectors.toList());
        List<String> flatRevised = TreeFlattener.flatten(revised).collect(Collectors.toList());
        return contextDiff.diff(flatOriginal, flatRevised);
    }

    static List<String> splitLinesKeepEnds(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i += 2;
            } else if (isLineBoundary(ch)) {
                i++;
            } else {
                i++;
                continue;
            }
            lines.add(text.substring(start, i));
            start = i;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /**
     * Line boundaries recognised when splitting text into lines: the usual terminators plus vertical tab, form
     * feed, the file, group and record separators, next line and the Unicode line and paragraph separators.
     */
    static boolean isLineBoundary(char ch) {
        return switch (ch) {
            case '\n', '\r', '\u000B', '\f', '\u001C', '\u001D', '\u001E', '\u0085', '\u2028', '\u2029' -> true;
            default -> false;
        };
    }

    /**
     * Splits on every match of {@code pattern}. Text captured by groups in the pattern is kept as units of its
     * own, between the pieces it separated.
     */
    static List<String> splitBy(Pattern pattern, String text) {
        String joined = text.replace("\r", "").replace("\n", "");
        List<String> units = new ArrayList<>();
        Matcher matcher = pattern.matcher(joined);
        int last = 0;
        while (matcher.find()) {
            units.add(joined.substring(last, matcher.start()));
            for (int group = 1; group <= matcher.groupCount(); group++) {
                String captured = matcher.group(group);
                if (captured != null) {
                    units.add(captured);
                }
            }
            last = matcher.end();
        }
        units.add(joined.substring(last));
        return units.stream()
                .filter(unit -> !unit.isEmpty())
                .collect(Collectors.toList());
    }
}
