package de.leipzig.htwk.gitrdf.shex.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import de.leipzig.htwk.gitrdf.shex.model.EachOf;
import de.leipzig.htwk.gitrdf.shex.model.NodeConstraint;
import de.leipzig.htwk.gitrdf.shex.model.NodeKind;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeJunction;
import de.leipzig.htwk.gitrdf.shex.model.ShapeReference;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.model.TripleConstraint;
import de.leipzig.htwk.gitrdf.shex.model.TripleExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueSetValue;

public class ShexJsonCodecTest {

  private static final String EX = "http://example.org/";

  private final ShexJsonCodec codec = new ShexJsonCodec();

  @Test
  public void toJsonShouldUseShexjVocabulary() {
    ShapeSchema schema = new ShapeSchema(EX + "Person", List.of(new ShapeDefinition(EX + "Person", List.of(EX + "type"),
        true, new EachOf(List.of(
            new TripleConstraint(EX + "name", NodeConstraint.ofNodeKind(NodeKind.LITERAL)),
            new TripleConstraint(EX + "knows", true, new ShapeReference(EX + "Person"), 0,
                TripleExpression.UNBOUNDED))))));

    ObjectNode json = codec.toJson(schema);

    assertEquals(ShexJsonCodec.SHEX_CONTEXT, json.get("@context").asText());
    assertEquals("Schema", json.get("type").asText());
    assertEquals(EX + "Person", json.get("start").asText());

    JsonNode shape = json.get("shapes").get(0);
    assertEquals("Shape", shape.get("type").asText());
    assertTrue(shape.get("closed").asBoolean());
    assertEquals(EX + "type", shape.get("extra").get(0).asText());

    JsonNode expression = shape.get("expression");
    assertEquals("EachOf", expression.get("type").asText());
    JsonNode name = expression.get("expressions").get(0);
    assertEquals("literal", name.get("valueExpr").get("nodeKind").asText());
    assertFalse(name.has("min"));
    JsonNode knows = expression.get("expressions").get(1);
    assertTrue(knows.get("inverse").asBoolean());
    assertEquals(EX + "Person", knows.get("valueExpr").asText());
    assertEquals(0, knows.get("min").asInt());
    assertEquals(-1, knows.get("max").asInt());
  }

  @Test
  public void readShouldBuildSchemaFromShexj() {
    String shexj = """
        {
          "@context": "http://www.w3.org/ns/shex.jsonld",
          "type": "Schema",
          "start": "http://example.org/City",
          "shapes": [
            {
              "type": "ShapeDecl",
              "id": "http://example.org/City",
              "shapeExpr": {
                "type": "Shape",
                "expression": {
                  "type": "EachOf",
                  "expressions": [
                    {
                      "type": "TripleConstraint",
                      "predicate": "http://example.org/status",
                      "valueExpr": {
                        "type": "NodeConstraint",
                        "values": [
                          "http://example.org/Capital",
                          { "type": "IriStem", "stem": "http://example.org/town/" },
                          { "value": "village", "language": "en" }
                        ]
                      },
                      "min": 0,
                      "max": 1
                    },
                    {
                      "type": "TripleConstraint",
                      "predicate": "http://example.org/country",
                      "valueExpr": {
                        "type": "ShapeOr",
                        "shapeExprs": [
                          "http://example.org/Country",
                          { "type": "NodeConstraint", "nodeKind": "iri" }
                        ]
                      }
                    }
                  ]
                }
              }
            }
          ]
        }
        """;

    ShapeSchema schema = codec.read(shexj);

    assertEquals(EX + "City", schema.getStart());
    ShapeDefinition city = schema.getShape(EX + "City");
    assertFalse(city.isClosed());
    EachOf members = assertInstanceOf(EachOf.class, city.getExpression());

    TripleConstraint status = assertInstanceOf(TripleConstraint.class, members.expressions().get(0));
    assertEquals(0, status.min());
    assertEquals(1, status.max());
    NodeConstraint values = assertInstanceOf(NodeConstraint.class, status.valueExpr());
    assertEquals(List.of(
        ValueSetValue.iri(EX + "Capital"),
        ValueSetValue.iriStem(EX + "town/"),
        ValueSetValue.literal("village", null, "en")), values.values());

    TripleConstraint country = assertInstanceOf(TripleConstraint.class, members.expressions().get(1));
    assertNull(country.min());
    ShapeJunction junction = assertInstanceOf(ShapeJunction.class, country.valueExpr());
    assertEquals(ShapeJunction.Operator.OR, junction.operator());
    assertEquals(new ShapeReference(EX + "Country"), junction.operands().get(0));
    assertEquals(NodeConstraint.ofNodeKind(NodeKind.IRI), junction.operands().get(1));
  }

  @Test
  public void writtenDocumentShouldReadBackUnchanged() {
    ShapeSchema schema = new ShapeSchema(null, List.of(new ShapeDefinition(EX + "Item",
        new TripleConstraint(EX + "count", NodeConstraint.ofValues(List.of(
            ValueSetValue.literal("3", "http://www.w3.org/2001/XMLSchema#integer", null))), 2, 5))));

    ShapeSchema read = codec.read(codec.write(schema));

    assertNull(read.getStart());
    assertEquals(schema.getShape(EX + "Item").getExpression(), read.getShape(EX + "Item").getExpression());
  }

  @Test
  public void readShouldAcceptUntypedInterchangeForm() {
    String shexj = "{\"start\":\"Person\",\"shapes\":[{\"id\":\"Person\",\"expression\":{\"expressions\":["
        + "{\"predicate\":\"knows\",\"valueExpr\":\"Person\",\"min\":0,\"max\":-1},"
        + "{\"predicate\":\"name\",\"valueExpr\":{\"datatype\":\"string\"}}]}},"
        + "{\"id\":\"Pet\",\"expression\":{\"predicate\":\"owner\",\"valueExpr\":\"Person\"}}]}";

    ShapeSchema schema = codec.read(shexj);

    assertEquals("Person", schema.getStart());
    EachOf person = assertInstanceOf(EachOf.class, schema.getShape("Person").getExpression());
    TripleConstraint knows = assertInstanceOf(TripleConstraint.class, person.expressions().get(0));
    assertEquals("knows", knows.predicate());
    assertEquals(new ShapeReference("Person"), knows.valueExpr());
    assertEquals(0, knows.min());
    assertEquals(TripleExpression.UNBOUNDED, knows.max());
    TripleConstraint name = assertInstanceOf(TripleConstraint.class, person.expressions().get(1));
    assertEquals(NodeConstraint.ofDatatype("string"), name.valueExpr());
    TripleConstraint owner = assertInstanceOf(TripleConstraint.class, schema.getShape("Pet").getExpression());
    assertEquals("owner", owner.predicate());
  }

  @Test
  public void readShouldRejectMalformedJson() {
    assertThrows(IllegalArgumentException.class, () -> codec.read("{ \"type\": \"Schema\", "));
    assertThrows(IllegalArgumentException.class, () -> codec.read("[]"));
  }

  @Test
  public void readShouldRejectUnsupportedShapeDeclarations() {
    String shexj = """
        { "type": "Schema", "shapes": [ { "type": "NodeConstraint", "id": "http://example.org/Id", "nodeKind": "iri" } ] }
        """;

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.read(shexj));
    assertTrue(ex.getMessage().contains("http://example.org/Id"));
  }
}
