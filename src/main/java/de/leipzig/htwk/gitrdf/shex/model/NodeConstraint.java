package de.leipzig.htwk.gitrdf.shex.model;

import java.util.List;

/**
 * Node-level restriction: a node kind, a datatype or an enumerated value set.
 */
public record NodeConstraint(NodeKind nodeKind, String datatype, List<ValueSetValue> values) implements ValueExpression {

  public NodeConstraint {
    values = values != null ? List.copyOf(values) : null;
  }

  public static NodeConstraint ofNodeKind(NodeKind nodeKind) {
    return new NodeConstraint(nodeKind, null, null);
  }

  public static NodeConstraint ofDatatype(String datatype) {
    return new NodeConstraint(null, datatype, null);
  }

  public static NodeConstraint ofValues(List<ValueSetValue> values) {
    return new NodeConstraint(null, null, values);
  }

  public boolean hasValues() {
    return values != null;
  }
}
