package io.rtfde.core.grammar;

import java.util.List;

/**
 * Lists the rules, terminals and ignored tokens of an evaluated grammar. Useful when a grammar change does not
 * parse the way it reads.
 */
public final class GrammarReport {

    private static final String BANNER = " " + "=".repeat(15) + " ";
    private static final String INDENT = "    ";

    private GrammarReport() {
    }

    public static String describe(ParserGrammar grammar) {
        if (grammar == null) {
            throw new IllegalArgumentException("A parser grammar is required");
        }
        StringBuilder builder = new StringBuilder();
        appendSection(builder, "RULES", grammar.rules());
        appendSection(builder, "TERMINALS", grammar.terminals());
        appendSection(builder, "IGNORED TOKENS", grammar.ignoredTokens());
        return builder.toString();
    }

    private static void appendSection(StringBuilder builder, String title, List<String> entries) {
        builder.append(BANNER).append(title).append(BANNER).append("\n\n");
        if (entries == null) {
            return;
        }
        for (String entry : entries) {
            builder.append(INDENT).append(entry).append('\n');
        }
    }
}
