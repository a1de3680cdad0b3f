package de.leipzig.htwk.gitrdf.shex.model;

/**
 * One predicate rule of a shape. {@code valueExpr} is {@code null} for the {@code .} wildcard.
 */
public record TripleConstraint(
    String predicate,
    boolean inverse,
    ValueExpression valueExpr,
    Integer min,
    Integer max
) implements TripleExpression {

  public TripleConstraint(String predicate, ValueExpression valueExpr, Integer min, Integer max) {
    this(predicate, false, valueExpr, min, max);
  }

  public TripleConstraint(String predicate, ValueExpression valueExpr) {
    this(predicate, false, valueExpr, null, null);
  }
}
