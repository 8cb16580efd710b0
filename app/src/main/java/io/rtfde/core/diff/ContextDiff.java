package io.rtfde.core.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;

/**
 * Renders the difference between two sequences of units in the classic context diff format.
 *
 * <pre>
 * ***
 * ---
 * ***************
 * *** 1,2 ****
 *   a
 * ! b
 * --- 1,2 ----
 *   a
 * ! c
 * </pre>
 */
public class ContextDiff {

    public static final int DEFAULT_CONTEXT = 3;

    private static final String HUNK_SEPARATOR = "***************";

    private final DiffAlgorithm algorithm;
    private final int context;

    public ContextDiff() {
        this(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM, DEFAULT_CONTEXT);
    }

    public ContextDiff(DiffAlgorithm.SupportedAlgorithm algorithm, int context) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (context < 0) {
            throw new IllegalArgumentException("context must be zero or greater");
        }
        this.algorithm = DiffAlgorithm.getAlgorithm(algorithm);
        this.context = context;
    }

    public DiffResult diff(List<String> original, List<String> revised) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(revised, "revised");
        UnitSequence a = new UnitSequence(List.copyOf(original));
        UnitSequence b = new UnitSequence(List.copyOf(revised));
        EditList edits = algorithm.diff(UnitSequence.COMPARATOR, a, b);
        if (edits.isEmpty()) {
            return DiffResult.empty();
        }

        List<String> lines = new ArrayList<>();
        lines.add("*** ");
        lines.add("--- ");
        for (List<Opcode> group : group(toOpcodes(edits, a.size(), b.size()))) {
            renderGroup(group, a, b, lines);
        }
        return new DiffResult(lines);
    }

    static List<Opcode> toOpcodes(EditList edits, int sizeA, int sizeB) {
        List<Opcode> opcodes = new ArrayList<>();
        int posA = 0;
        int posB = 0;
        for (Edit edit : edits) {
            if (edit.getBeginA() > posA || edit.getBeginB() > posB) {
                opcodes.add(new Opcode(Opcode.Kind.EQUAL, posA, edit.getBeginA(), posB, edit.getBeginB()));
            }
            opcodes.add(new Opcode(kindOf(edit), edit.getBeginA(), edit.getEndA(), edit.getBeginB(), edit.getEndB()));
            posA = edit.getEndA();
            posB = edit.getEndB();
        }
        if (posA < sizeA || posB < sizeB) {
            opcodes.add(new Opcode(Opcode.Kind.EQUAL, posA, sizeA, posB, sizeB));
        }
        return opcodes;
    }

    private static Opcode.Kind kindOf(Edit edit) {
        return switch (edit.getType()) {
            case INSERT -> Opcode.Kind.INSERT;
            case DELETE -> Opcode.Kind.DELETE;
            case REPLACE -> Opcode.Kind.REPLACE;
            case EMPTY -> Opcode.Kind.EQUAL;
        };
    }

    /**
     * Splits opcodes into hunks, trimming leading and trailing equal runs to the context size and breaking
     * wherever an equal run is longer than twice the context.
     */
    List<List<Opcode>> group(List<Opcode> opcodes) {
        List<Opcode> codes = new ArrayList<>(opcodes);
        if (codes.isEmpty()) {
            return List.of();
        }
        Opcode first = codes.get(0);
        if (first.kind() == Opcode.Kind.EQUAL) {
            codes.set(0, new Opcode(Opcode.Kind.EQUAL,
                    Math.max(first.beginA(), first.endA() - context), first.endA(),
                    Math.max(first.beginB(), first.endB() - context), first.endB()));
        }
        Opcode last = codes.get(codes.size() - 1);
        if (last.kind() == Opcode.Kind.EQUAL) {
            codes.set(codes.size() - 1, new Opcode(Opcode.Kind.EQUAL,
                    last.beginA(), Math.min(last.endA(), last.beginA() + context),
                    last.beginB(), Math.min(last.endB(), last.beginB() + context)));
        }

        List<List<Opcode>> groups = new ArrayList<>();
        List<Opcode> current = new ArrayList<>();
        for (Opcode code : codes) {
            int beginA = code.beginA();
            int beginB = code.beginB();
            if (code.kind() == Opcode.Kind.EQUAL && code.lengthA() > context * 2) {
                current.add(new Opcode(Opcode.Kind.EQUAL,
                        beginA, Math.min(code.endA(), beginA + context),
                        beginB, Math.min(code.endB(), beginB + context)));
                groups.add(current);
                current = new ArrayList<>();
                beginA = Math.max(beginA, code.endA() - context);
                beginB = Math.max(beginB, code.endB() - context);
            }
            current.add(new Opcode(code.kind(), beginA, code.endA(), beginB, code.endB()));
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        groups.removeIf(ContextDiff::isUnchanged);
        return groups;
    }

    private static boolean isUnchanged(List<Opcode> group) {
        return group.stream().allMatch(code -> code.kind() == Opcode.Kind.EQUAL);
    }

    private void renderGroup(List<Opcode> group, UnitSequence a, UnitSequence b, List<String> lines) {
        Opcode first = group.get(0);
        Opcode last = group.get(group.size() - 1);
        lines.add(HUNK_SEPARATOR);

        lines.add("*** " + formatRange(first.beginA(), last.endA()) + " ****");
        if (group.stream().anyMatch(code -> code.kind() == Opcode.Kind.REPLACE || code.kind() == Opcode.Kind.DELETE)) {
            for (Opcode code : group) {
                if (code.kind() != Opcode.Kind.INSERT) {
                    for (String unit : a.slice(code.beginA(), code.endA())) {
                        lines.add(code.kind().prefix() + unit);
                    }
                }
            }
        }

        lines.add("--- " + formatRange(first.beginB(), last.endB()) + " ----");
        if (group.stream().anyMatch(code -> code.kind() == Opcode.Kind.REPLACE || code.kind() == Opcode.Kind.INSERT)) {
            for (Opcode code : group) {
                if (code.kind() != Opcode.Kind.DELETE) {
                    for (String unit : b.slice(code.beginB(), code.endB())) {
                        lines.add(code.kind().prefix() + unit);
                    }
                }
            }
        }
    }

    static String formatRange(int start, int stop) {
        int beginning = start + 1;
        int length = stop - start;
        if (length == 0) {
            beginning--;
        }
        if (length <= 1) {
            return Integer.toString(beginning);
        }
        return beginning + "," + (beginning + length - 1);
    }
}
