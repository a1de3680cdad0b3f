package de.leipzig.htwk.gitrdf.shex.exception;

/**
 * Base of the terminal ShExC parse failures. Thrown for a single schema text; callers working on a
 * batch catch it per item.
 */
public class SchemaParseException extends Exception {

  public SchemaParseException(String message) {
    super(message);
  }
}
