package de.leipzig.htwk.gitrdf.shex.exception;

import java.util.List;

import de.leipzig.htwk.gitrdf.shex.parser.ParseError;

/**
 * Parsing still failed after the offending lines of the first attempt were stripped.
 */
public class UnrecoverableParseException extends SchemaParseException {

  private final List<Integer> strippedLines;
  private final List<ParseError> firstAttemptErrors;
  private final List<ParseError> retryErrors;

  public UnrecoverableParseException(List<Integer> strippedLines, List<ParseError> firstAttemptErrors,
      List<ParseError> retryErrors) {
    super(String.format("Unable to parse schema: still %d error(s) after stripping lines %s",
        retryErrors.size(), strippedLines));
    this.strippedLines = List.copyOf(strippedLines);
    this.firstAttemptErrors = List.copyOf(firstAttemptErrors);
    this.retryErrors = List.copyOf(retryErrors);
  }

  public List<Integer> getStrippedLines() {
    return strippedLines;
  }

  public List<ParseError> getFirstAttemptErrors() {
    return firstAttemptErrors;
  }

  public List<ParseError> getRetryErrors() {
    return retryErrors;
  }
}
