package de.leipzig.htwk.gitrdf.shex.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits ShExC text into tokens. {@code #} comments are dropped here; lexical problems become
 * {@link TokenType#ERROR} tokens so the parser can report them with their line.
 */
final class ShexcLexer {

  private final String text;
  private final List<Token> tokens = new ArrayList<>();
  private int pos = 0;
  private int line = 1;
  private boolean lineStart = true;

  ShexcLexer(String text) {
    this.text = text;
  }

  List<Token> tokenize() {
    int n = text.length();
    if (n > 0 && text.charAt(0) == '\uFEFF') {
      pos = 1;
    }
    while (pos < n) {
      char c = text.charAt(pos);
      if (c == '\n') {
        line++;
        lineStart = true;
        pos++;
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '#') {
        skipToEndOfLine();
      } else if (c == '<') {
        readIriRef();
      } else if (c == '"' || c == '\'') {
        readString(c);
      } else if (c == '/' && peek(1) == '/') {
        pos += 2;
        emit(TokenType.ANNOTATION, "//");
      } else if (c == '%') {
        readSemanticAction();
      } else if (c == '^' && peek(1) == '^') {
        pos += 2;
        emit(TokenType.DATATYPE_MARK, "^^");
      } else if (Character.isDigit(c) || ((c == '-' || c == '+' || c == '.') && Character.isDigit(peek(1)))) {
        readNumber();
      } else if (Character.isLetter(c) || c == '_' || c == ':') {
        readWord();
      } else {
        readPunctuation(c);
      }
    }
    tokens.add(new Token(TokenType.EOF, "", line, true));
    return tokens;
  }

  private char peek(int offset) {
    int index = pos + offset;
    return index < text.length() ? text.charAt(index) : '\0';
  }

  private void emit(TokenType type, String value) {
    tokens.add(new Token(type, value, line, lineStart));
    lineStart = false;
  }

  private void skipToEndOfLine() {
    while (pos < text.length() && text.charAt(pos) != '\n') {
      pos++;
    }
  }

  private void readIriRef() {
    int end = pos + 1;
    while (end < text.length() && text.charAt(end) != '>' && text.charAt(end) != '\n') {
      end++;
    }
    if (end >= text.length() || text.charAt(end) != '>') {
      emit(TokenType.ERROR, "Unterminated IRI");
      pos = end;
      return;
    }
    String iri = text.substring(pos + 1, end);
    pos = end + 1;
    if (iri.chars().anyMatch(ch -> ch == ' ' || ch == '"' || ch == '{' || ch == '}')) {
      emit(TokenType.ERROR, "Invalid character in IRI <" + iri + ">");
    } else {
      emit(TokenType.IRIREF, iri);
    }
  }

  private void readString(char quote) {
    StringBuilder value = new StringBuilder();
    int i = pos + 1;
    while (i < text.length()) {
      char ch = text.charAt(i);
      if (ch == quote) {
        break;
      }
      if (ch == '\n') {
        emit(TokenType.ERROR, "Unterminated string literal");
        pos = i;
        return;
      }
      if (ch == '\\' && i + 1 < text.length()) {
        char escaped = text.charAt(i + 1);
        switch (escaped) {
          case 'n' -> value.append('\n');
          case 't' -> value.append('\t');
          case 'r' -> value.append('\r');
          default -> value.append(escaped);
        }
        i += 2;
        continue;
      }
      value.append(ch);
      i++;
    }
    if (i >= text.length()) {
      emit(TokenType.ERROR, "Unterminated string literal");
      pos = i;
      return;
    }
    pos = i + 1;
    emit(TokenType.STRING, value.toString());
    if (peek(0) == '@' && Character.isLetter(peek(1))) {
      int start = pos + 1;
      int end = start;
      while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '-')) {
        end++;
      }
      emit(TokenType.LANGTAG, text.substring(start, end));
      pos = end;
    }
  }

  private void readSemanticAction() {
    int close = text.indexOf("%}", pos + 1);
    int nextPercent = text.indexOf('%', pos + 1);
    int end;
    if (close >= 0 && (nextPercent < 0 || nextPercent == close)) {
      end = close + 2;
    } else if (nextPercent >= 0) {
      end = nextPercent + 1;
    } else {
      end = text.length();
    }
    String action = text.substring(pos, end);
    emit(TokenType.SEMACT, action);
    line += (int) action.chars().filter(ch -> ch == '\n').count();
    pos = end;
  }

  private void readNumber() {
    int start = pos;
    if (text.charAt(pos) == '-' || text.charAt(pos) == '+') {
      pos++;
    }
    boolean decimal = false;
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (Character.isDigit(ch)) {
        pos++;
      } else if (ch == '.' && !decimal && Character.isDigit(peek(1))) {
        decimal = true;
        pos++;
      } else {
        break;
      }
    }
    emit(decimal ? TokenType.DECIMAL : TokenType.INTEGER, text.substring(start, pos));
  }

  private void readWord() {
    int start = pos;
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == '.' || ch == ':') {
        pos++;
      } else {
        break;
      }
    }
    while (pos > start + 1 && text.charAt(pos - 1) == '.') {
      pos--;
    }
    String word = text.substring(start, pos);
    emit(word.indexOf(':') >= 0 ? TokenType.PNAME : TokenType.NAME, word);
  }

  private void readPunctuation(char c) {
    TokenType type = switch (c) {
      case '@' -> TokenType.AT;
      case '{' -> TokenType.LBRACE;
      case '}' -> TokenType.RBRACE;
      case '[' -> TokenType.LBRACKET;
      case ']' -> TokenType.RBRACKET;
      case '(' -> TokenType.LPAREN;
      case ')' -> TokenType.RPAREN;
      case ';' -> TokenType.SEMICOLON;
      case '|' -> TokenType.PIPE;
      case '*' -> TokenType.STAR;
      case '+' -> TokenType.PLUS;
      case '?' -> TokenType.QUESTION;
      case '=' -> TokenType.EQUALS;
      case ',' -> TokenType.COMMA;
      case '^' -> TokenType.CARET;
      case '~' -> TokenType.TILDE;
      case '.' -> TokenType.DOT;
      case '-' -> TokenType.MINUS;
      default -> TokenType.ERROR;
    };
    pos++;
    emit(type, type == TokenType.ERROR ? "Unexpected character '" + c + "'" : String.valueOf(c));
  }
}
