package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

/**
 * {@code ShapeOr} / {@code ShapeAnd} over value expressions.
 */
public record ShapeJunction(Operator operator, List<ValueExpression> operands) implements ValueExpression {

  public ShapeJunction {
    operands = List.copyOf(operands);
  }

  public enum Operator {
    OR("ShapeOr"),
    AND("ShapeAnd");

    private final String shexjType;

    Operator(String shexjType) {
      this.shexjType = shexjType;
    }

    public String getShexjType() {
      return shexjType;
    }

    public static Operator fromShexjType(String type) {
      for (Operator operator : values()) {
        if (operator.shexjType.equals(type)) {
          return operator;
        }
      }
      throw new IllegalArgumentException("Unknown shape junction type: " + type);
    }
  }
}
