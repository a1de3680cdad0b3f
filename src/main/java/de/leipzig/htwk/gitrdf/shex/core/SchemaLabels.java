package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.vocabulary.RDF;

import de.leipzig.htwk.gitrdf.shex.model.NodeConstraint;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeJunction;
import de.leipzig.htwk.gitrdf.shex.model.ShapeReference;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.model.TripleConstraint;
import de.leipzig.htwk.gitrdf.shex.model.TripleExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueSetValue;

/**
 * Display labels for the three nodes a triple constraint contributes to a schema graph or tree:
 * predicate, node constraint and cardinality.
 */
public final class SchemaLabels {

  private static final String WDT = "http://www.wikidata.org/prop/direct/";

  private static final Map<String, String> PREDICATE_ALIASES = Map.of(
      RDF.TYPE.stringValue(), "rdf:type",
      WDT + "P31", "wdt:P31",
      WDT + "P279", "wdt:P279");

  private SchemaLabels() {
  }

  /**
   * @return the predicate label, or {@code null} for nested {@code EachOf}/{@code OneOf} groups
   */
  public static String predicateLabel(TripleExpression expression) {
    if (!(expression instanceof TripleConstraint constraint)) {
      return null;
    }
    String predicate = PREDICATE_ALIASES.getOrDefault(constraint.predicate(), constraint.predicate());
    return constraint.inverse() ? "^" + predicate : predicate;
  }

  public static String nodeConstraintLabel(TripleConstraint constraint, ShapeSchema schema) {
    return valueExpressionLabel(constraint.valueExpr(), schema);
  }

  private static String valueExpressionLabel(ValueExpression valueExpr, ShapeSchema schema) {
    if (valueExpr == null) {
      return ".";
    }
    if (valueExpr instanceof ShapeReference reference) {
      ShapeDefinition referenced = schema != null ? schema.getShape(reference.shapeId()) : null;
      NodeConstraint valueShape = referenced != null ? referenced.getValueShapeConstraint() : null;
      return valueShape != null ? valueSetLabel(valueShape.values()) : "@" + reference.shapeId();
    }
    if (valueExpr instanceof ShapeJunction junction) {
      List<String> operands = new ArrayList<>();
      for (ValueExpression operand : junction.operands()) {
        operands.add(valueExpressionLabel(operand, schema));
      }
      return String.join(" " + junction.operator().name() + " ", operands);
    }
    NodeConstraint nodeConstraint = (NodeConstraint) valueExpr;
    if (nodeConstraint.nodeKind() != null) {
      return nodeConstraint.nodeKind().getKeyword();
    }
    if (nodeConstraint.datatype() != null) {
      return nodeConstraint.datatype();
    }
    if (nodeConstraint.hasValues()) {
      return valueSetLabel(nodeConstraint.values());
    }
    return ".";
  }

  /** Values sorted, so {@code [wd:Q5 wd:Q6]} and {@code [wd:Q6 wd:Q5]} get the same label. */
  private static String valueSetLabel(List<ValueSetValue> values) {
    List<String> rendered = new ArrayList<>();
    for (ValueSetValue value : values) {
      rendered.add(valueLabel(value));
    }
    rendered.sort(null);
    return "[" + String.join(" ", rendered) + "]";
  }

  private static String valueLabel(ValueSetValue value) {
    switch (value.kind()) {
      case IRI:
        return value.value();
      case IRI_STEM:
        return value.value() + "~";
      default:
        if (value.language() != null) {
          return "\"" + value.value() + "\"@" + value.language();
        }
        if (value.datatype() != null) {
          return "\"" + value.value() + "\"^^" + value.datatype();
        }
        return "\"" + value.value() + "\"";
    }
  }

  public static String cardinalityLabel(TripleExpression expression) {
    int min = expression.effectiveMin();
    int max = expression.effectiveMax();
    if (min == 0 && max == 1) {
      return "?";
    }
    if (min == 0 && max == TripleExpression.UNBOUNDED) {
      return "*";
    }
    if (min == 1 && max == TripleExpression.UNBOUNDED) {
      return "+";
    }
    return "{" + min + "," + (max == TripleExpression.UNBOUNDED ? "*" : String.valueOf(max)) + "}";
  }
}
