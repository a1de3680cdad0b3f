package de.leipzig.htwk.gitrdf.shex.model;

public enum NodeKind {
  IRI("iri"),
  BNODE("bnode"),
  NONLITERAL("nonliteral"),
  LITERAL("literal");

  private final String shexjName;

  NodeKind(String shexjName) {
    this.shexjName = shexjName;
  }

  public String getShexjName() {
    return shexjName;
  }

  /** ShExC keyword, e.g. {@code IRI}. */
  public String getKeyword() {
    return name();
  }

  public static NodeKind fromShexjName(String name) {
    for (NodeKind kind : values()) {
      if (kind.shexjName.equals(name)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown node kind: " + name);
  }

  public static NodeKind fromKeyword(String keyword) {
    for (NodeKind kind : values()) {
      if (kind.name().equalsIgnoreCase(keyword)) {
        return kind;
      }
    }
    return null;
  }
}
