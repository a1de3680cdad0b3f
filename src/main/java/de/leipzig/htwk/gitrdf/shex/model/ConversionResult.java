package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

/**
 * Outcome of a ShExC to schema conversion. {@code droppedLines} lists the 1-based lines that were
 * stripped to recover from parse errors; empty when the first parse succeeded.
 */
public record ConversionResult(
    ShapeSchema schema,
    String base,
    NamespaceTable namespaces,
    List<CommentRecord> comments,
    List<Integer> droppedLines
) {

  public ConversionResult {
    comments = comments != null ? List.copyOf(comments) : List.of();
    droppedLines = droppedLines != null ? List.copyOf(droppedLines) : List.of();
  }

  public boolean isDegraded() {
    return !droppedLines.isEmpty();
  }
}
