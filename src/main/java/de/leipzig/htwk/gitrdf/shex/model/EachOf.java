package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

public record EachOf(List<TripleExpression> expressions, Integer min, Integer max) implements GroupExpression {

  public EachOf {
    expressions = List.copyOf(expressions);
  }

  public EachOf(List<TripleExpression> expressions) {
    this(expressions, null, null);
  }
}
