package de.leipzig.htwk.gitrdf.shex.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.GroupExpression;
import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;
import de.leipzig.htwk.gitrdf.shex.model.NodeConstraint;
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
 * Writes ShExC in a fixed layout: directives, a blank line, the start declaration, then one block
 * per shape with one triple constraint per line. Comment anchors recorded from text written in
 * this layout are found again after a round trip.
 */
@Component
public class ShexcWriter implements ShexSerializer {

  private static final String INDENT = "  ";

  @Override
  public String serialize(ShapeSchema schema, String base, NamespaceTable namespaces) {
    NamespaceTable table = namespaces != null ? namespaces : NamespaceTable.empty();
    Context context = new Context(base, table);
    List<String> lines = new ArrayList<>();

    if (base != null) {
      lines.add("BASE <" + base + ">");
    }
    for (Map.Entry<String, String> prefix : table.asMap().entrySet()) {
      lines.add("PREFIX " + prefix.getKey() + ": <" + prefix.getValue() + ">");
    }
    if (!lines.isEmpty()) {
      lines.add("");
    }

    if (schema.getStart() != null) {
      lines.add("start = @" + context.label(schema.getStart()));
      lines.add("");
    }

    List<ShapeDefinition> shapes = schema.getShapes();
    for (int i = 0; i < shapes.size(); i++) {
      writeShape(shapes.get(i), context, lines);
      if (i < shapes.size() - 1) {
        lines.add("");
      }
    }
    return String.join("\n", lines);
  }

  private void writeShape(ShapeDefinition shape, Context context, List<String> lines) {
    StringBuilder header = new StringBuilder(context.label(shape.getId()));
    if (!shape.getExtra().isEmpty()) {
      header.append(" EXTRA");
      for (String extra : shape.getExtra()) {
        header.append(' ').append(context.predicate(extra));
      }
    }
    if (shape.isClosed()) {
      header.append(" CLOSED");
    }
    header.append(" {");
    lines.add(header.toString());

    TripleExpression expression = shape.getExpression();
    if (expression instanceof GroupExpression group && !hasCardinality(group)) {
      writeMembers(group, INDENT, context, lines);
    } else if (expression != null) {
      lines.addAll(expressionLines(expression, INDENT, context));
    }
    lines.add("}");
  }

  private void writeMembers(GroupExpression group, String indent, Context context, List<String> lines) {
    String separator = group instanceof OneOf ? " |" : " ;";
    List<TripleExpression> members = group.expressions();
    for (int i = 0; i < members.size(); i++) {
      List<String> memberLines = expressionLines(members.get(i), indent, context);
      if (i < members.size() - 1) {
        int last = memberLines.size() - 1;
        memberLines.set(last, memberLines.get(last) + separator);
      }
      lines.addAll(memberLines);
    }
  }

  private List<String> expressionLines(TripleExpression expression, String indent, Context context) {
    List<String> lines = new ArrayList<>();
    if (expression instanceof TripleConstraint constraint) {
      lines.add(indent + tripleConstraint(constraint, context));
    } else if (expression instanceof GroupExpression group) {
      lines.add(indent + "(");
      writeMembers(group, indent + INDENT, context, lines);
      lines.add(indent + ")" + cardinalitySuffix(group));
    }
    return lines;
  }

  private String tripleConstraint(TripleConstraint constraint, Context context) {
    StringBuilder line = new StringBuilder();
    if (constraint.inverse()) {
      line.append('^');
    }
    line.append(context.predicate(constraint.predicate()));
    line.append(' ').append(valueExpression(constraint.valueExpr(), context, false));
    line.append(cardinalitySuffix(constraint));
    return line.toString();
  }

  String valueExpression(ValueExpression valueExpr, Context context, boolean nested) {
    if (valueExpr == null) {
      return ".";
    }
    if (valueExpr instanceof ShapeReference reference) {
      return "@" + context.label(reference.shapeId());
    }
    if (valueExpr instanceof ShapeJunction junction) {
      List<String> operands = new ArrayList<>();
      for (ValueExpression operand : junction.operands()) {
        operands.add(valueExpression(operand, context, true));
      }
      String joined = String.join(" " + junction.operator().name() + " ", operands);
      return nested ? "(" + joined + ")" : joined;
    }
    NodeConstraint nodeConstraint = (NodeConstraint) valueExpr;
    if (nodeConstraint.nodeKind() != null) {
      return nodeConstraint.nodeKind().getKeyword();
    }
    if (nodeConstraint.datatype() != null) {
      return context.iri(nodeConstraint.datatype());
    }
    List<String> values = new ArrayList<>();
    for (ValueSetValue value : nodeConstraint.values()) {
      values.add(valueSetValue(value, context));
    }
    return "[" + String.join(" ", values) + "]";
  }

  private String valueSetValue(ValueSetValue value, Context context) {
    switch (value.kind()) {
      case IRI:
        return context.iri(value.value());
      case IRI_STEM:
        return context.iri(value.value()) + "~";
      default:
        if (value.language() != null) {
          return quote(value.value()) + "@" + value.language();
        }
        String datatype = value.datatype();
        if (XSD.INTEGER.stringValue().equals(datatype) && value.value().matches("[+-]?\\d+")) {
          return value.value();
        }
        if (XSD.DECIMAL.stringValue().equals(datatype) && value.value().matches("[+-]?\\d*\\.\\d+")) {
          return value.value();
        }
        if (XSD.BOOLEAN.stringValue().equals(datatype)
            && ("true".equals(value.value()) || "false".equals(value.value()))) {
          return value.value();
        }
        if (datatype != null) {
          return quote(value.value()) + "^^" + context.iri(datatype);
        }
        return quote(value.value());
    }
  }

  private static String quote(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
  }

  private static boolean hasCardinality(TripleExpression expression) {
    return expression.min() != null || expression.max() != null;
  }

  static String cardinalitySuffix(TripleExpression expression) {
    if (!hasCardinality(expression)) {
      return "";
    }
    int min = expression.effectiveMin();
    int max = expression.effectiveMax();
    if (min == 1 && max == 1) {
      return "";
    }
    if (min == 0 && max == 1) {
      return " ?";
    }
    if (min == 0 && max == TripleExpression.UNBOUNDED) {
      return " *";
    }
    if (min == 1 && max == TripleExpression.UNBOUNDED) {
      return " +";
    }
    if (max == TripleExpression.UNBOUNDED) {
      return " {" + min + ",}";
    }
    return min == max ? " {" + min + "}" : " {" + min + "," + max + "}";
  }

  /**
   * IRI rendering against the declared prefixes and base.
   */
  static final class Context {
    private final String base;
    private final NamespaceTable namespaces;

    Context(String base, NamespaceTable namespaces) {
      this.base = base;
      this.namespaces = namespaces;
    }

    String iri(String iri) {
      String compacted = namespaces.compact(iri);
      if (compacted != null) {
        return compacted;
      }
      if (base != null && iri.startsWith(base) && iri.length() > base.length()) {
        return "<" + iri.substring(base.length()) + ">";
      }
      return "<" + iri + ">";
    }

    String label(String shapeId) {
      return iri(shapeId);
    }

    String predicate(String iri) {
      if (RDF.TYPE.stringValue().equals(iri) && namespaces.compact(iri) == null) {
        return "a";
      }
      return iri(iri);
    }
  }
}
