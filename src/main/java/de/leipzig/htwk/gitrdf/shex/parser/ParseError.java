package de.leipzig.htwk.gitrdf.shex.parser;

/**
 * A grammar error tagged with the 1-based line it was found on.
 */
public record ParseError(String message, int line) {

  @Override
  public String toString() {
    return "line " + line + ": " + message;
  }
}
