package de.leipzig.htwk.gitrdf.shex.model;

/**
 * A comment lifted out of ShExC text. {@code anchor} is the verbatim line the comment is
 * reattached to after re-serialization; {@code null} means the start of the document.
 */
public record CommentRecord(String text, CommentKind kind, String anchor) {

  public boolean isDocumentStart() {
    return anchor == null;
  }
}
