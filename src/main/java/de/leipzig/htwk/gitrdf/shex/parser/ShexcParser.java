package de.leipzig.htwk.gitrdf.shex.parser;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.EachOf;
import de.leipzig.htwk.gitrdf.shex.model.NodeConstraint;
import de.leipzig.htwk.gitrdf.shex.model.NodeKind;
import de.leipzig.htwk.gitrdf.shex.model.OneOf;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeJunction;
import de.leipzig.htwk.gitrdf.shex.model.ShapeReference;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.model.TripleConstraint;
import de.leipzig.htwk.gitrdf.shex.model.TripleExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueSetValue;

/**
 * Recursive-descent ShExC reader. Statement-level and constraint-level errors are recorded with
 * their line and parsing resumes at the next statement or constraint, so one run reports every
 * offending line it can find. Any error means no schema is returned.
 */
@Component
public class ShexcParser implements ShexGrammarEngine {

  private static final Logger logger = LoggerFactory.getLogger(ShexcParser.class);

  @Override
  public ParseOutcome parse(String shexcText) {
    if (shexcText == null || shexcText.isBlank()) {
      logger.debug("[PARSER] Empty input, nothing to parse");
      return ParseOutcome.failure(List.of());
    }
    Run run = new Run(new ShexcLexer(shexcText).tokenize());
    run.parseSchema();

    if (!run.errors.isEmpty()) {
      logger.debug("[PARSER] {} error(s): {}", run.errors.size(), run.errors);
      return ParseOutcome.failure(run.errors);
    }
    if (run.shapes.isEmpty() && run.start == null) {
      logger.debug("[PARSER] Input declares no shapes");
      return ParseOutcome.failure(List.of());
    }
    return ParseOutcome.success(new ShapeSchema(run.start, run.shapes));
  }

  private static final class SyntaxError extends RuntimeException {
    private final int line;

    SyntaxError(String message, int line) {
      super(message, null, false, false);
      this.line = line;
    }
  }

  /**
   * State of a single parse; the parser bean itself stays stateless.
   */
  private static final class Run {
    private final List<Token> tokens;
    private final Map<String, String> prefixes = new LinkedHashMap<>();
    private final List<ShapeDefinition> shapes = new ArrayList<>();
    private final List<ParseError> errors = new ArrayList<>();
    private String base;
    private String start;
    private int pos = 0;

    Run(List<Token> tokens) {
      this.tokens = tokens;
    }

    // ========== STATEMENTS ==========

    void parseSchema() {
      while (true) {
        int statementStart = pos;
        try {
          if (peek().is(TokenType.EOF)) {
            return;
          }
          parseStatement();
        } catch (SyntaxError e) {
          errors.add(new ParseError(e.getMessage(), e.line));
          skipToNextStatement(statementStart);
        }
      }
    }

    private void parseStatement() {
      Token token = peek();
      if (token.isKeyword("PREFIX")) {
        next();
        Token prefixToken = expect(TokenType.PNAME, "prefix declaration");
        String prefix = prefixToken.text().substring(0, prefixToken.text().indexOf(':'));
        prefixes.put(prefix, resolve(expect(TokenType.IRIREF, "namespace IRI").text()));
      } else if (token.isKeyword("BASE")) {
        next();
        base = expect(TokenType.IRIREF, "base IRI").text();
      } else if (token.isKeyword("IMPORT")) {
        next();
        expect(TokenType.IRIREF, "import IRI");
      } else if (token.isKeyword("start")) {
        next();
        expect(TokenType.EQUALS, "'=' after start");
        ValueExpression startExpression = parseValueExpression();
        if (!(startExpression instanceof ShapeReference reference)) {
          throw new SyntaxError("start must reference a shape", token.line());
        }
        start = reference.shapeId();
      } else if (token.is(TokenType.IRIREF) || token.is(TokenType.PNAME)) {
        parseShapeDeclaration();
      } else {
        throw unexpected(token, "a directive or shape declaration");
      }
    }

    private void parseShapeDeclaration() {
      Token labelToken = next();
      String id = iri(labelToken);
      List<String> extra = new ArrayList<>();
      boolean closed = false;

      while (true) {
        Token token = peek();
        if (token.isKeyword("EXTRA")) {
          next();
          extra.add(parsePredicate());
          while (peek().is(TokenType.IRIREF) || peek().is(TokenType.PNAME) || peek().isKeyword("a")) {
            extra.add(parsePredicate());
          }
        } else if (token.isKeyword("CLOSED")) {
          next();
          closed = true;
        } else {
          break;
        }
      }

      Token open = peek();
      if (!open.is(TokenType.LBRACE)) {
        throw new SyntaxError("Shape " + labelToken.describe() + " must be followed by a '{ ... }' body, found "
            + open.describe(), open.line());
      }
      next();
      TripleExpression expression = null;
      if (!peek().is(TokenType.RBRACE)) {
        expression = parseTripleExpression(TokenType.RBRACE);
      }
      if (peek().is(TokenType.RBRACE)) {
        next();
      } else if (peek().firstOnLine() && startsShapeDeclaration(pos)) {
        errors.add(new ParseError("Missing '}' closing shape " + labelToken.describe(), tokens.get(pos - 1).line()));
        shapes.add(new ShapeDefinition(id, extra, closed, expression));
        return;
      } else {
        throw unexpected(peek(), "'}' closing shape " + labelToken.describe());
      }
      skipAnnotationsAndActions();
      shapes.add(new ShapeDefinition(id, extra, closed, expression));
    }

    // ========== TRIPLE EXPRESSIONS ==========

    /**
     * Parses {@code a ; b | c ; d} up to (not including) {@code terminator}.
     */
    private TripleExpression parseTripleExpression(TokenType terminator) {
      List<TripleExpression> alternatives = new ArrayList<>();
      alternatives.add(parseEachOf(terminator));
      while (peek().is(TokenType.PIPE)) {
        next();
        alternatives.add(parseEachOf(terminator));
      }
      alternatives.removeIf(Objects::isNull);
      if (alternatives.isEmpty()) {
        return null;
      }
      return alternatives.size() == 1 ? alternatives.get(0) : new OneOf(alternatives);
    }

    private TripleExpression parseEachOf(TokenType terminator) {
      List<TripleExpression> members = new ArrayList<>();
      while (!peek().is(terminator) && !peek().is(TokenType.PIPE) && !peek().is(TokenType.EOF)
          && !atNextShape(terminator)) {
        int memberStart = pos;
        try {
          members.add(parseUnaryTripleExpression());
          if (peek().is(TokenType.SEMICOLON)) {
            next();
          } else if (!peek().is(terminator) && !peek().is(TokenType.PIPE) && !atNextShape(terminator)) {
            throw unexpected(peek(), "';' or the end of the shape");
          }
        } catch (SyntaxError e) {
          errors.add(new ParseError(e.getMessage(), e.line));
          skipToNextConstraint(terminator);
          if (pos == memberStart) {
            pos++;
          }
        }
      }
      if (members.isEmpty()) {
        return null;
      }
      return members.size() == 1 ? members.get(0) : new EachOf(members);
    }

    /**
     * A shape declaration starting a new line inside a body means the previous {@code '}'} is missing.
     */
    private boolean atNextShape(TokenType terminator) {
      return terminator == TokenType.RBRACE && peek().firstOnLine() && startsShapeDeclaration(pos);
    }

    private TripleExpression parseUnaryTripleExpression() {
      Token token = peek();
      if (token.is(TokenType.LPAREN)) {
        next();
        TripleExpression inner = parseTripleExpression(TokenType.RPAREN);
        expect(TokenType.RPAREN, "')' closing group");
        int[] cardinality = parseCardinality();
        skipAnnotationsAndActions();
        if (inner == null) {
          throw new SyntaxError("Empty group", token.line());
        }
        if (cardinality == null) {
          return inner;
        }
        if (inner instanceof EachOf eachOf) {
          return new EachOf(eachOf.expressions(), cardinality[0], cardinality[1]);
        }
        if (inner instanceof OneOf oneOf) {
          return new OneOf(oneOf.expressions(), cardinality[0], cardinality[1]);
        }
        return new EachOf(List.of(inner), cardinality[0], cardinality[1]);
      }
      return parseTripleConstraint();
    }

    private TripleConstraint parseTripleConstraint() {
      boolean inverse = false;
      if (peek().is(TokenType.CARET)) {
        next();
        inverse = true;
      }
      String predicate = parsePredicate();
      ValueExpression valueExpr = parseValueExpression();
      int[] cardinality = parseCardinality();
      skipAnnotationsAndActions();
      return new TripleConstraint(predicate, inverse, valueExpr,
          cardinality != null ? cardinality[0] : null,
          cardinality != null ? cardinality[1] : null);
    }

    private String parsePredicate() {
      Token token = next();
      if (token.isKeyword("a") && token.text().equals("a")) {
        return RDF.TYPE.stringValue();
      }
      if (token.is(TokenType.IRIREF) || token.is(TokenType.PNAME)) {
        return iri(token);
      }
      throw unexpected(token, "a predicate");
    }

    /**
     * Returns {@code {min, max}} or {@code null} when no cardinality is written.
     */
    private int[] parseCardinality() {
      Token token = peek();
      if (token.is(TokenType.STAR)) {
        next();
        return new int[] {0, TripleExpression.UNBOUNDED};
      }
      if (token.is(TokenType.PLUS)) {
        next();
        return new int[] {1, TripleExpression.UNBOUNDED};
      }
      if (token.is(TokenType.QUESTION)) {
        next();
        return new int[] {0, 1};
      }
      if (token.is(TokenType.LBRACE) && peekAt(1).is(TokenType.INTEGER)) {
        next();
        Token minToken = next();
        Token maxToken = minToken;
        if (peek().is(TokenType.COMMA)) {
          next();
          if (peek().is(TokenType.INTEGER)) {
            maxToken = next();
          } else {
            if (peek().is(TokenType.STAR)) {
              next();
            }
            maxToken = null;
          }
        }
        expect(TokenType.RBRACE, "'}' closing cardinality");
        int min = parseBound(minToken);
        int max = maxToken != null ? parseBound(maxToken) : TripleExpression.UNBOUNDED;
        if (max != TripleExpression.UNBOUNDED && max < min) {
          throw new SyntaxError("Cardinality max " + max + " is below min " + min, token.line());
        }
        return new int[] {min, max};
      }
      return null;
    }

    private int parseBound(Token token) {
      String text = token.text();
      if (text.startsWith("-") || text.startsWith("+")) {
        throw new SyntaxError("Cardinality bound must be an unsigned integer, found " + text, token.line());
      }
      try {
        return Integer.parseInt(text);
      } catch (NumberFormatException e) {
        throw new SyntaxError("Cardinality bound " + text + " is out of range", token.line());
      }
    }

    // ========== VALUE EXPRESSIONS ==========

    private ValueExpression parseValueExpression() {
      List<ValueExpression> disjuncts = new ArrayList<>();
      disjuncts.add(parseConjunction());
      while (peek().isKeyword("OR")) {
        next();
        disjuncts.add(parseConjunction());
      }
      return disjuncts.size() == 1 ? disjuncts.get(0) : new ShapeJunction(ShapeJunction.Operator.OR, disjuncts);
    }

    private ValueExpression parseConjunction() {
      List<ValueExpression> conjuncts = new ArrayList<>();
      conjuncts.add(parseValueAtom());
      while (peek().isKeyword("AND")) {
        next();
        conjuncts.add(parseValueAtom());
      }
      return conjuncts.size() == 1 ? conjuncts.get(0) : new ShapeJunction(ShapeJunction.Operator.AND, conjuncts);
    }

    private ValueExpression parseValueAtom() {
      Token token = peek();
      if (token.is(TokenType.AT)) {
        next();
        Token label = next();
        if (!label.is(TokenType.IRIREF) && !label.is(TokenType.PNAME)) {
          throw unexpected(label, "a shape label after '@'");
        }
        return new ShapeReference(iri(label));
      }
      if (token.is(TokenType.DOT)) {
        next();
        return null;
      }
      if (token.is(TokenType.LBRACKET)) {
        return NodeConstraint.ofValues(parseValueSet());
      }
      if (token.is(TokenType.LPAREN)) {
        next();
        ValueExpression inner = parseValueExpression();
        expect(TokenType.RPAREN, "')' closing value expression");
        return inner;
      }
      if (token.is(TokenType.NAME)) {
        NodeKind nodeKind = NodeKind.fromKeyword(token.text());
        if (nodeKind != null) {
          next();
          return NodeConstraint.ofNodeKind(nodeKind);
        }
        throw unexpected(token, "a value expression");
      }
      if (token.is(TokenType.IRIREF) || token.is(TokenType.PNAME)) {
        next();
        return NodeConstraint.ofDatatype(iri(token));
      }
      if (token.is(TokenType.LBRACE)) {
        throw new SyntaxError("Inline shape expressions are not supported", token.line());
      }
      throw unexpected(token, "a value expression");
    }

    private List<ValueSetValue> parseValueSet() {
      Token open = expect(TokenType.LBRACKET, "'['");
      List<ValueSetValue> values = new ArrayList<>();
      while (!peek().is(TokenType.RBRACKET)) {
        Token token = next();
        switch (token.type()) {
          case IRIREF, PNAME -> {
            String iri = iri(token);
            if (peek().is(TokenType.TILDE)) {
              next();
              values.add(ValueSetValue.iriStem(iri));
            } else {
              values.add(ValueSetValue.iri(iri));
            }
          }
          case STRING -> {
            if (peek().is(TokenType.LANGTAG)) {
              values.add(ValueSetValue.literal(token.text(), null, next().text()));
            } else if (peek().is(TokenType.DATATYPE_MARK)) {
              next();
              Token datatype = next();
              if (!datatype.is(TokenType.IRIREF) && !datatype.is(TokenType.PNAME)) {
                throw unexpected(datatype, "a datatype IRI after '^^'");
              }
              values.add(ValueSetValue.literal(token.text(), iri(datatype), null));
            } else {
              values.add(ValueSetValue.literal(token.text(), null, null));
            }
          }
          case INTEGER -> values.add(ValueSetValue.literal(token.text(), XSD.INTEGER.stringValue(), null));
          case DECIMAL -> values.add(ValueSetValue.literal(token.text(), XSD.DECIMAL.stringValue(), null));
          case NAME -> {
            if (token.isKeyword("true") || token.isKeyword("false")) {
              values.add(ValueSetValue.literal(token.text().toLowerCase(), XSD.BOOLEAN.stringValue(), null));
            } else {
              throw unexpected(token, "a value set member");
            }
          }
          case EOF -> throw new SyntaxError("Unterminated value set", open.line());
          default -> throw unexpected(token, "a value set member");
        }
      }
      next();
      return values;
    }

    // ========== TOKENS ==========

    private Token peek() {
      return peekAt(0);
    }

    private Token peekAt(int offset) {
      int index = Math.min(pos + offset, tokens.size() - 1);
      Token token = tokens.get(index);
      if (token.is(TokenType.ERROR)) {
        throw new SyntaxError(token.text(), token.line());
      }
      return token;
    }

    private Token next() {
      Token token = peek();
      if (!token.is(TokenType.EOF)) {
        pos++;
      }
      return token;
    }

    private Token expect(TokenType type, String what) {
      Token token = peek();
      if (!token.is(type)) {
        throw unexpected(token, what);
      }
      return next();
    }

    private SyntaxError unexpected(Token token, String expected) {
      return new SyntaxError("Expected " + expected + " but found " + token.describe(), token.line());
    }

    private void skipAnnotationsAndActions() {
      while (true) {
        Token token = peek();
        if (token.is(TokenType.SEMACT)) {
          next();
        } else if (token.is(TokenType.ANNOTATION)) {
          next();
          parsePredicate();
          Token object = next();
          if (object.is(TokenType.STRING) && (peek().is(TokenType.LANGTAG))) {
            next();
          } else if (object.is(TokenType.STRING) && peek().is(TokenType.DATATYPE_MARK)) {
            next();
            next();
          }
        } else {
          return;
        }
      }
    }

    /**
     * Drops tokens up to the next line that starts a directive or a shape declaration outside any
     * brace, always advancing past the failed statement's first token.
     */
    private void skipToNextStatement(int statementStart) {
      pos = Math.max(pos, statementStart + 1);
      int depth = braceDepth(statementStart, pos);
      while (pos < tokens.size() - 1) {
        Token token = tokens.get(pos);
        if (depth <= 0 && token.firstOnLine() && startsStatement(token)) {
          return;
        }
        if (token.is(TokenType.LBRACE)) {
          depth++;
        } else if (token.is(TokenType.RBRACE)) {
          depth--;
        }
        pos++;
      }
    }

    private int braceDepth(int from, int to) {
      int depth = 0;
      for (int i = from; i < to && i < tokens.size(); i++) {
        if (tokens.get(i).is(TokenType.LBRACE)) {
          depth++;
        } else if (tokens.get(i).is(TokenType.RBRACE)) {
          depth--;
        }
      }
      return depth;
    }

    private boolean startsStatement(Token token) {
      return token.is(TokenType.IRIREF) || token.is(TokenType.PNAME)
          || token.isKeyword("PREFIX") || token.isKeyword("BASE")
          || token.isKeyword("IMPORT") || token.isKeyword("start");
    }

    /**
     * Drops tokens up to the next {@code ;} (consumed), {@code |} or terminator at the current
     * nesting level.
     */
    private void skipToNextConstraint(TokenType terminator) {
      int depth = 0;
      while (pos < tokens.size() - 1) {
        Token token = tokens.get(pos);
        if (depth == 0) {
          if (token.is(TokenType.SEMICOLON)) {
            pos++;
            return;
          }
          if (token.is(terminator) || token.is(TokenType.PIPE)) {
            return;
          }
          if (terminator == TokenType.RBRACE && token.firstOnLine() && startsShapeDeclaration(pos)) {
            return;
          }
        }
        if (token.is(TokenType.LBRACE) || token.is(TokenType.LPAREN) || token.is(TokenType.LBRACKET)) {
          depth++;
        } else if (token.is(TokenType.RBRACE) || token.is(TokenType.RPAREN) || token.is(TokenType.RBRACKET)) {
          depth--;
        }
        pos++;
      }
    }

    private boolean startsShapeDeclaration(int index) {
      Token token = tokens.get(index);
      if (!token.is(TokenType.IRIREF) && !token.is(TokenType.PNAME)) {
        return false;
      }
      Token following = tokens.get(Math.min(index + 1, tokens.size() - 1));
      return following.is(TokenType.LBRACE) || following.isKeyword("EXTRA") || following.isKeyword("CLOSED");
    }

    // ========== IRIS ==========

    private String iri(Token token) {
      if (token.is(TokenType.IRIREF)) {
        return resolve(token.text());
      }
      String text = token.text();
      int colon = text.indexOf(':');
      String prefix = text.substring(0, colon);
      String expanded = prefixes.containsKey(prefix) ? prefixes.get(prefix) + text.substring(colon + 1) : null;
      if (expanded == null) {
        throw new SyntaxError("Undeclared prefix '" + prefix + ":'", token.line());
      }
      return expanded;
    }

    private String resolve(String iri) {
      if (base == null || iri.contains(":")) {
        return iri;
      }
      try {
        return URI.create(base).resolve(iri).toString();
      } catch (IllegalArgumentException e) {
        return base + iri;
      }
    }
  }
}
