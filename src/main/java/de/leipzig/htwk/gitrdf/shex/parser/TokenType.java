package de.leipzig.htwk.gitrdf.shex.parser;

enum TokenType {
  IRIREF,
  PNAME,
  NAME,
  STRING,
  LANGTAG,
  INTEGER,
  DECIMAL,
  AT,
  LBRACE,
  RBRACE,
  LBRACKET,
  RBRACKET,
  LPAREN,
  RPAREN,
  SEMICOLON,
  PIPE,
  STAR,
  PLUS,
  QUESTION,
  EQUALS,
  COMMA,
  CARET,
  DATATYPE_MARK,
  TILDE,
  DOT,
  MINUS,
  ANNOTATION,
  SEMACT,
  ERROR,
  EOF
}
