package de.leipzig.htwk.gitrdf.shex.model;

/**
 * Triple expression of a shape: a triple constraint or an each-of / one-of group.
 * {@code min}/{@code max} are {@code null} when not stated; {@link #UNBOUNDED} marks an open max.
 */
public interface TripleExpression {

  int UNBOUNDED = -1;

  Integer min();

  Integer max();

  default int effectiveMin() {
    return min() != null ? min() : 1;
  }

  default int effectiveMax() {
    return max() != null ? max() : 1;
  }
}
