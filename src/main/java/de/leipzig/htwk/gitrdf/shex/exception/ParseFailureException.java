package de.leipzig.htwk.gitrdf.shex.exception;

/**
 * The grammar engine returned neither a schema nor any line-tagged error, so there is nothing
 * to recover from.
 */
public class ParseFailureException extends SchemaParseException {

  public ParseFailureException(String message) {
    super(message);
  }
}
