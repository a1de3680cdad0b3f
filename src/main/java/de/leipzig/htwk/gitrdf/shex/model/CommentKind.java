package de.leipzig.htwk.gitrdf.shex.model;

public enum CommentKind {
  /** Comment above the first shape declaration; reinserted as its own line. */
  GENERAL,
  /** Comment inside the shape section; reinserted inline after its anchor line. */
  CONSTRAINT
}
