package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

public record OneOf(List<TripleExpression> expressions, Integer min, Integer max) implements GroupExpression {

  public OneOf {
    expressions = List.copyOf(expressions);
  }

  public OneOf(List<TripleExpression> expressions) {
    this(expressions, null, null);
  }
}
