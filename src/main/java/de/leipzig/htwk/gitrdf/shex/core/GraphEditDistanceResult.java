package de.leipzig.htwk.gitrdf.shex.core;

/**
 * Outcome of a bounded graph edit distance search. {@code distance} is {@code null} when the
 * deadline passed before any complete node assignment was found. When {@code timedOut} is set a
 * non-null distance is an upper bound, not necessarily the optimum.
 */
public record GraphEditDistanceResult(Double distance, boolean timedOut, long expandedStates) {

  public boolean isKnown() {
    return distance != null;
  }

  public boolean isExact() {
    return distance != null && !timedOut;
  }
}
