package de.leipzig.htwk.gitrdf.shex.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.gitrdf.shex.model.EachOf;
import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;
import de.leipzig.htwk.gitrdf.shex.model.NodeConstraint;
import de.leipzig.htwk.gitrdf.shex.model.NodeKind;
import de.leipzig.htwk.gitrdf.shex.model.OneOf;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeReference;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.model.TripleConstraint;
import de.leipzig.htwk.gitrdf.shex.model.TripleExpression;
import de.leipzig.htwk.gitrdf.shex.model.ValueSetValue;

public class ShexcWriterTest {

  private static final String EX = "http://example.org/";
  private static final String FOAF = "http://xmlns.com/foaf/0.1/";
  private static final String XSD = "http://www.w3.org/2001/XMLSchema#";

  private final ShexcWriter writer = new ShexcWriter();

  private static NamespaceTable namespaces() {
    Map<String, String> prefixes = new LinkedHashMap<>();
    prefixes.put("ex", EX);
    prefixes.put("foaf", FOAF);
    prefixes.put("xsd", XSD);
    return NamespaceTable.of(prefixes);
  }

  private static ShapeSchema personSchema() {
    return new ShapeSchema(EX + "Person", List.of(new ShapeDefinition(EX + "Person", new EachOf(List.of(
        new TripleConstraint(FOAF + "name", NodeConstraint.ofDatatype(XSD + "string")),
        new TripleConstraint(FOAF + "knows", new ShapeReference(EX + "Person"), 0, TripleExpression.UNBOUNDED))))));
  }

  @Test
  public void serializeShouldWriteOneConstraintPerLine() {
    String shexc = writer.serialize(personSchema(), null, namespaces());

    assertEquals(String.join("\n",
        "PREFIX ex: <http://example.org/>",
        "PREFIX foaf: <http://xmlns.com/foaf/0.1/>",
        "PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>",
        "",
        "start = @ex:Person",
        "",
        "ex:Person {",
        "  foaf:name xsd:string ;",
        "  foaf:knows @ex:Person *",
        "}"), shexc);
  }

  @Test
  public void serializeShouldFallBackToBaseRelativeAndFullIris() {
    ShapeSchema schema = new ShapeSchema(null, List.of(new ShapeDefinition("http://other.org/shapes/Thing",
        List.of(), true, new TripleConstraint("http://www.w3.org/1999/02/22-rdf-syntax-ns#type",
            NodeConstraint.ofValues(List.of(ValueSetValue.iri("http://other.org/Thing"), ValueSetValue.literal("5",
                XSD + "integer", null), ValueSetValue.literal("x", null, "en")))))));

    String shexc = writer.serialize(schema, "http://other.org/shapes/", NamespaceTable.empty());

    assertEquals(String.join("\n",
        "BASE <http://other.org/shapes/>",
        "",
        "<Thing> CLOSED {",
        "  a [<http://other.org/Thing> 5 \"x\"@en]",
        "}"), shexc);
  }

  @Test
  public void serializeShouldWriteNestedGroupsWithCardinality() {
    ShapeSchema schema = new ShapeSchema(EX + "Item", List.of(new ShapeDefinition(EX + "Item", new EachOf(List.of(
        new TripleConstraint(EX + "label", NodeConstraint.ofNodeKind(NodeKind.LITERAL), 1, 1),
        new OneOf(List.of(
            new TripleConstraint(EX + "isbn", NodeConstraint.ofNodeKind(NodeKind.LITERAL)),
            new TripleConstraint(EX + "doi", NodeConstraint.ofNodeKind(NodeKind.IRI), 2, 4)), 0, 1))))));

    String shexc = writer.serialize(schema, null, namespaces());

    assertTrue(shexc.endsWith(String.join("\n",
        "ex:Item {",
        "  ex:label LITERAL ;",
        "  (",
        "    ex:isbn LITERAL |",
        "    ex:doi IRI {2,4}",
        "  ) ?",
        "}")), shexc);
  }

  @Test
  public void serializedTextShouldParseBackToTheSameSchema() {
    ShapeSchema original = personSchema();
    String shexc = writer.serialize(original, null, namespaces());

    ParseOutcome outcome = new ShexcParser().parse(shexc);

    assertTrue(outcome.hasSchema(), () -> "unexpected errors " + outcome.errors());
    assertEquals(original.getStart(), outcome.schema().getStart());
    assertEquals(original.getShape(EX + "Person").getExpression(), outcome.schema().getShape(EX + "Person").getExpression());
  }

  @Test
  public void cardinalitySuffixShouldUseShorthandWherePossible() {
    assertEquals("", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null)));
    assertEquals("", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null, 1, 1)));
    assertEquals(" ?", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null, 0, 1)));
    assertEquals(" +", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null, 1, -1)));
    assertEquals(" {3}", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null, 3, 3)));
    assertEquals(" {2,}", ShexcWriter.cardinalitySuffix(new TripleConstraint(EX + "p", null, 2, -1)));
  }
}
