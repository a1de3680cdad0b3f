package de.leipzig.htwk.gitrdf.shex.parser;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;

/**
 * Result of one grammar engine run: either a schema, or {@code null} together with the errors
 * that prevented it.
 */
public record ParseOutcome(ShapeSchema schema, List<ParseError> errors) {

  public ParseOutcome {
    errors = errors != null ? List.copyOf(errors) : List.of();
  }

  public static ParseOutcome success(ShapeSchema schema) {
    return new ParseOutcome(schema, List.of());
  }

  public static ParseOutcome failure(List<ParseError> errors) {
    return new ParseOutcome(null, errors);
  }

  public boolean hasSchema() {
    return schema != null;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Distinct offending line numbers in ascending order. */
  public Set<Integer> errorLines() {
    Set<Integer> lines = new TreeSet<>();
    for (ParseError error : errors) {
      lines.add(error.line());
    }
    return lines;
  }
}
