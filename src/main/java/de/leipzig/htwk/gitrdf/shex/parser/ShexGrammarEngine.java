package de.leipzig.htwk.gitrdf.shex.parser;

/**
 * Turns ShExC text into a schema. Implementations never throw on bad input; they report
 * line-tagged errors in the outcome instead.
 */
public interface ShexGrammarEngine {

  ParseOutcome parse(String shexcText);
}
