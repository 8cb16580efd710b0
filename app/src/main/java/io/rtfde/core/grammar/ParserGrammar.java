package io.rtfde.core.grammar;

import java.util.List;

/**
 * Evaluated grammar of the external RTF parser, as exposed by its adapter.
 */
public interface ParserGrammar {

    List<String> rules();

    List<String> terminals();

    List<String> ignoredTokens();
}
