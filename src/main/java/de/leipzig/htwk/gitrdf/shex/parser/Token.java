package de.leipzig.htwk.gitrdf.shex.parser;

/**
 * Lexical token. {@code firstOnLine} marks the first token of its source line, which is where
 * statement-level error recovery resumes.
 */
record Token(TokenType type, String text, int line, boolean firstOnLine) {

  boolean is(TokenType expected) {
    return type == expected;
  }

  boolean isKeyword(String keyword) {
    return type == TokenType.NAME && text.equalsIgnoreCase(keyword);
  }

  String describe() {
    return switch (type) {
      case EOF -> "end of input";
      case IRIREF -> "<" + text + ">";
      case STRING -> "\"" + text + "\"";
      default -> "'" + text + "'";
    };
  }
}
