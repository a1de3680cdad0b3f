package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;
import java.util.Locale;

public record EvaluationSummary(
    String dataset,
    List<ClassEvaluation> results,
    List<String> skippedClasses,
    double averageTreeEditDistance,
    double averageNormalizedTreeEditDistance
) {

  public EvaluationSummary {
    results = List.copyOf(results);
    skippedClasses = List.copyOf(skippedClasses);
  }

  public int getComparedCount() {
    return results.size();
  }

  public int getSkippedCount() {
    return skippedClasses.size();
  }

  public String getSummary() {
    return String.format(Locale.ROOT, "%s: %d compared, %d skipped, average TED %.3f, normalized average TED %.3f",
        dataset, results.size(), skippedClasses.size(), averageTreeEditDistance, averageNormalizedTreeEditDistance);
  }
}
