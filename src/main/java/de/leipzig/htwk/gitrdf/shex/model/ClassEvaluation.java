package de.leipzig.htwk.gitrdf.shex.model;

import java.util.Locale;

/**
 * Distances for one compared class. {@code graphEditDistance} is {@code null} when it was not
 * requested or the search timed out without a complete assignment.
 */
public record ClassEvaluation(
    String classId,
    String shapeId,
    int treeEditDistance,
    int groundTruthTreeSize,
    double normalizedTreeEditDistance,
    Double graphEditDistance
) {

  public String getSummary() {
    return String.format(Locale.ROOT, "Class: %s | TED: %d | Ground Truth Tree Size: %d | Normalized TED: %.3f",
        classId, treeEditDistance, groundTruthTreeSize, normalizedTreeEditDistance);
  }
}
