package de.leipzig.htwk.gitrdf.shex.parser;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import de.leipzig.htwk.gitrdf.shex.model.EachOf;
import de.leipzig.htwk.gitrdf.shex.model.GroupExpression;
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
 * Reads and writes the ShExJ interchange form. Shape references are plain id strings, as in
 * ShExJ; {@code ShapeDecl} wrappers are accepted on input.
 */
@Component
public class ShexJsonCodec {

  static final String SHEX_CONTEXT = "http://www.w3.org/ns/shex.jsonld";

  private final ObjectMapper objectMapper = new ObjectMapper();

  // ========== WRITE ==========

  public String write(ShapeSchema schema) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(schema));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize schema " + schema, e);
    }
  }

  public ObjectNode toJson(ShapeSchema schema) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("@context", SHEX_CONTEXT);
    root.put("type", "Schema");
    if (schema.getStart() != null) {
      root.put("start", schema.getStart());
    }
    ArrayNode shapes = root.putArray("shapes");
    for (ShapeDefinition shape : schema.getShapes()) {
      ObjectNode shapeNode = shapes.addObject();
      shapeNode.put("type", "Shape");
      shapeNode.put("id", shape.getId());
      if (shape.isClosed()) {
        shapeNode.put("closed", true);
      }
      if (!shape.getExtra().isEmpty()) {
        ArrayNode extra = shapeNode.putArray("extra");
        shape.getExtra().forEach(extra::add);
      }
      if (shape.getExpression() != null) {
        shapeNode.set("expression", tripleExpressionToJson(shape.getExpression()));
      }
    }
    return root;
  }

  private ObjectNode tripleExpressionToJson(TripleExpression expression) {
    ObjectNode node = objectMapper.createObjectNode();
    if (expression instanceof TripleConstraint constraint) {
      node.put("type", "TripleConstraint");
      if (constraint.inverse()) {
        node.put("inverse", true);
      }
      node.put("predicate", constraint.predicate());
      if (constraint.valueExpr() != null) {
        node.set("valueExpr", valueExpressionToJson(constraint.valueExpr()));
      }
    } else {
      GroupExpression group = (GroupExpression) expression;
      node.put("type", group instanceof OneOf ? "OneOf" : "EachOf");
      ArrayNode members = node.putArray("expressions");
      for (TripleExpression member : group.expressions()) {
        members.add(tripleExpressionToJson(member));
      }
    }
    if (expression.min() != null) {
      node.put("min", expression.min());
    }
    if (expression.max() != null) {
      node.put("max", expression.max());
    }
    return node;
  }

  private JsonNode valueExpressionToJson(ValueExpression valueExpr) {
    if (valueExpr instanceof ShapeReference reference) {
      return objectMapper.getNodeFactory().textNode(reference.shapeId());
    }
    ObjectNode node = objectMapper.createObjectNode();
    if (valueExpr instanceof ShapeJunction junction) {
      node.put("type", junction.operator().getShexjType());
      ArrayNode operands = node.putArray("shapeExprs");
      for (ValueExpression operand : junction.operands()) {
        operands.add(valueExpressionToJson(operand));
      }
      return node;
    }
    NodeConstraint constraint = (NodeConstraint) valueExpr;
    node.put("type", "NodeConstraint");
    if (constraint.nodeKind() != null) {
      node.put("nodeKind", constraint.nodeKind().getShexjName());
    }
    if (constraint.datatype() != null) {
      node.put("datatype", constraint.datatype());
    }
    if (constraint.hasValues()) {
      ArrayNode values = node.putArray("values");
      for (ValueSetValue value : constraint.values()) {
        switch (value.kind()) {
          case IRI -> values.add(value.value());
          case IRI_STEM -> values.addObject().put("type", "IriStem").put("stem", value.value());
          default -> {
            ObjectNode literal = values.addObject().put("value", value.value());
            if (value.datatype() != null) {
              literal.put("type", value.datatype());
            }
            if (value.language() != null) {
              literal.put("language", value.language());
            }
          }
        }
      }
    }
    return node;
  }

  // ========== READ ==========

  public ShapeSchema read(String shexjText) {
    JsonNode root;
    try {
      root = objectMapper.readTree(shexjText);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed ShExJ: " + e.getOriginalMessage(), e);
    }
    return fromJson(root);
  }

  public ShapeSchema fromJson(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("ShExJ document must be a JSON object");
    }
    String start = root.hasNonNull("start") ? root.get("start").asText() : null;
    List<ShapeDefinition> shapes = new ArrayList<>();
    for (JsonNode shapeNode : root.path("shapes")) {
      shapes.add(shapeFromJson(shapeNode));
    }
    return new ShapeSchema(start, shapes);
  }

  private ShapeDefinition shapeFromJson(JsonNode shapeNode) {
    String id = requireText(shapeNode, "id");
    JsonNode shape = shapeNode;
    if ("ShapeDecl".equals(shapeNode.path("type").asText())) {
      shape = shapeNode.path("shapeExpr");
    }
    String type = shape.path("type").asText("Shape");
    if (!"Shape".equals(type)) {
      throw new IllegalArgumentException("Unsupported shape declaration type '" + type + "' for " + id);
    }
    List<String> extra = new ArrayList<>();
    for (JsonNode predicate : shape.path("extra")) {
      extra.add(predicate.asText());
    }
    TripleExpression expression = shape.hasNonNull("expression")
        ? tripleExpressionFromJson(shape.get("expression"))
        : null;
    return new ShapeDefinition(id, extra, shape.path("closed").asBoolean(false), expression);
  }

  private TripleExpression tripleExpressionFromJson(JsonNode node) {
    String type = node.hasNonNull("type") ? node.get("type").asText() : inferTripleExpressionType(node);
    Integer min = node.hasNonNull("min") ? node.get("min").asInt() : null;
    Integer max = node.hasNonNull("max") ? node.get("max").asInt() : null;
    switch (type) {
      case "TripleConstraint":
        ValueExpression valueExpr = node.hasNonNull("valueExpr") ? valueExpressionFromJson(node.get("valueExpr")) : null;
        return new TripleConstraint(requireText(node, "predicate"), node.path("inverse").asBoolean(false),
            valueExpr, min, max);
      case "EachOf":
      case "OneOf":
        List<TripleExpression> members = new ArrayList<>();
        for (JsonNode member : node.path("expressions")) {
          members.add(tripleExpressionFromJson(member));
        }
        return "EachOf".equals(type) ? new EachOf(members, min, max) : new OneOf(members, min, max);
      default:
        throw new IllegalArgumentException("Unsupported triple expression type '" + type + "'");
    }
  }

  /**
   * Untyped members of the minimal interchange form are told apart by their keys.
   */
  private static String inferTripleExpressionType(JsonNode node) {
    if (node.has("predicate")) {
      return "TripleConstraint";
    }
    if (node.has("expressions")) {
      return "EachOf";
    }
    return "";
  }

  private ValueExpression valueExpressionFromJson(JsonNode node) {
    if (node.isTextual()) {
      return new ShapeReference(node.asText());
    }
    String type = node.path("type").asText();
    if (type.isEmpty() && (node.has("nodeKind") || node.has("datatype") || node.has("values"))) {
      type = "NodeConstraint";
    }
    switch (type) {
      case "NodeConstraint":
        NodeKind nodeKind = node.hasNonNull("nodeKind") ? NodeKind.fromShexjName(node.get("nodeKind").asText()) : null;
        String datatype = node.hasNonNull("datatype") ? node.get("datatype").asText() : null;
        List<ValueSetValue> values = null;
        if (node.has("values")) {
          values = new ArrayList<>();
          for (JsonNode value : node.get("values")) {
            values.add(valueSetValueFromJson(value));
          }
        }
        return new NodeConstraint(nodeKind, datatype, values);
      case "ShapeOr":
      case "ShapeAnd":
        List<ValueExpression> operands = new ArrayList<>();
        for (JsonNode operand : node.path("shapeExprs")) {
          operands.add(valueExpressionFromJson(operand));
        }
        return new ShapeJunction(ShapeJunction.Operator.fromShexjType(type), operands);
      default:
        throw new IllegalArgumentException("Unsupported value expression type '" + type + "'");
    }
  }

  private ValueSetValue valueSetValueFromJson(JsonNode value) {
    if (value.isTextual()) {
      return ValueSetValue.iri(value.asText());
    }
    if ("IriStem".equals(value.path("type").asText())) {
      return ValueSetValue.iriStem(requireText(value, "stem"));
    }
    return ValueSetValue.literal(requireText(value, "value"),
        value.hasNonNull("type") ? value.get("type").asText() : null,
        value.hasNonNull("language") ? value.get("language").asText() : null);
  }

  private static String requireText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isValueNode()) {
      throw new IllegalArgumentException("ShExJ node is missing '" + field + "': " + node);
    }
    return value.asText();
  }
}
