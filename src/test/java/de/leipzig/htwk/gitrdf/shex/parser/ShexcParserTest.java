package de.leipzig.htwk.gitrdf.shex.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

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
import de.leipzig.htwk.gitrdf.shex.model.ValueSetValue;

public class ShexcParserTest {

  private static final String WD = "http://www.wikidata.org/entity/";
  private static final String WDT = "http://www.wikidata.org/prop/direct/";
  private static final String XSD = "http://www.w3.org/2001/XMLSchema#";

  private final ShexcParser parser = new ShexcParser();

  @Test
  public void parseHumanSchemaShouldResolvePrefixesAndCardinalities() {
    String shexc = String.join("\n",
        "PREFIX wd: <http://www.wikidata.org/entity/>",
        "PREFIX wdt: <http://www.wikidata.org/prop/direct/>",
        "PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>",
        "",
        "# humans",
        "start = @<Human>",
        "",
        "<Human> EXTRA wdt:P31 {",
        "  wdt:P31 [wd:Q5] ;  # instance of",
        "  wdt:P21 IRI ? ;",
        "  wdt:P569 xsd:dateTime * ;",
        "  wdt:P19 @<Place> {1,3}",
        "}",
        "",
        "<Place> {",
        "  wdt:P17 . +",
        "}");

    ParseOutcome outcome = parser.parse(shexc);

    assertTrue(outcome.hasSchema(), () -> "unexpected errors " + outcome.errors());
    ShapeSchema schema = outcome.schema();
    assertEquals("Human", schema.getStart());
    assertEquals(2, schema.getShapeCount());

    ShapeDefinition human = schema.getShape("Human");
    assertEquals(List.of(WDT + "P31"), human.getExtra());
    List<TripleExpression> constraints = human.getConstraintSequence();
    assertEquals(4, constraints.size());

    TripleConstraint instanceOf = (TripleConstraint) constraints.get(0);
    assertEquals(WDT + "P31", instanceOf.predicate());
    assertEquals(List.of(ValueSetValue.iri(WD + "Q5")), ((NodeConstraint) instanceOf.valueExpr()).values());
    assertNull(instanceOf.min());

    TripleConstraint gender = (TripleConstraint) constraints.get(1);
    assertEquals(NodeKind.IRI, ((NodeConstraint) gender.valueExpr()).nodeKind());
    assertEquals(0, gender.min());
    assertEquals(1, gender.max());

    TripleConstraint birth = (TripleConstraint) constraints.get(2);
    assertEquals(XSD + "dateTime", ((NodeConstraint) birth.valueExpr()).datatype());
    assertEquals(TripleExpression.UNBOUNDED, birth.max());

    TripleConstraint birthPlace = (TripleConstraint) constraints.get(3);
    assertEquals(new ShapeReference("Place"), birthPlace.valueExpr());
    assertEquals(1, birthPlace.min());
    assertEquals(3, birthPlace.max());

    TripleConstraint country = (TripleConstraint) schema.getShape("Place").getExpression();
    assertNull(country.valueExpr());
    assertEquals(1, country.effectiveMin());
    assertEquals(TripleExpression.UNBOUNDED, country.effectiveMax());
  }

  @Test
  public void parseShouldResolveRelativeLabelsAgainstBase() {
    String shexc = String.join("\n",
        "BASE <http://example.org/shapes/>",
        "PREFIX foaf: <http://xmlns.com/foaf/0.1/>",
        "start = @<Person>",
        "<Person> CLOSED {",
        "  a [foaf:Person] ;",
        "  ^foaf:knows @<Person> {2,}",
        "}");

    ShapeSchema schema = parser.parse(shexc).schema();

    assertEquals("http://example.org/shapes/Person", schema.getStart());
    ShapeDefinition person = schema.getShape("http://example.org/shapes/Person");
    assertTrue(person.isClosed());
    TripleConstraint type = (TripleConstraint) person.getConstraintSequence().get(0);
    assertEquals("http://www.w3.org/1999/02/22-rdf-syntax-ns#type", type.predicate());
    TripleConstraint knownBy = (TripleConstraint) person.getConstraintSequence().get(1);
    assertTrue(knownBy.inverse());
    assertEquals(2, knownBy.min());
    assertEquals(TripleExpression.UNBOUNDED, knownBy.max());
  }

  @Test
  public void parseShouldBuildGroupsJunctionsAndLiteralValueSets() {
    String shexc = String.join("\n",
        "PREFIX ex: <http://example.org/>",
        "ex:Item {",
        "  ex:status [\"open\" \"closed\"@en 3 true] ;",
        "  ( ex:isbn LITERAL | ex:doi IRI ) ? ;",
        "  ex:owner @ex:Person OR @ex:Group",
        "}");

    ShapeDefinition item = parser.parse(shexc).schema().getShape("http://example.org/Item");

    List<TripleExpression> sequence = item.getConstraintSequence();
    assertEquals(3, sequence.size());

    List<ValueSetValue> values = ((NodeConstraint) ((TripleConstraint) sequence.get(0)).valueExpr()).values();
    assertEquals(ValueSetValue.literal("open", null, null), values.get(0));
    assertEquals("en", values.get(1).language());
    assertEquals(XSD + "integer", values.get(2).datatype());
    assertEquals(XSD + "boolean", values.get(3).datatype());

    OneOf identifier = assertInstanceOf(OneOf.class, sequence.get(1));
    assertEquals(2, identifier.expressions().size());
    assertEquals(0, identifier.min());
    assertEquals(1, identifier.max());

    ShapeJunction owner = assertInstanceOf(ShapeJunction.class, ((TripleConstraint) sequence.get(2)).valueExpr());
    assertEquals(ShapeJunction.Operator.OR, owner.operator());
    assertEquals(2, owner.operands().size());
  }

  @Test
  public void parseShouldReportEveryOffendingLine() {
    String shexc = String.join("\n",
        "PREFIX wdt: <http://www.wikidata.org/prop/direct/>",
        "start = @<Human>",
        "<Human> {",
        "  wdt:P31 IRI ;",
        "  wdt:P21 foo:bar ;",
        "  wdt:P569 LITERAL {3,1} ;",
        "  wdt:P19 IRI",
        "}");

    ParseOutcome outcome = parser.parse(shexc);

    assertFalse(outcome.hasSchema());
    assertEquals(Set.of(5, 6), outcome.errorLines());
    assertTrue(outcome.errors().get(0).message().contains("foo:"));
  }

  @Test
  public void parseShouldSucceedOnceOffendingLinesAreRemoved() {
    String shexc = String.join("\n",
        "PREFIX wdt: <http://www.wikidata.org/prop/direct/>",
        "start = @<Human>",
        "<Human> {",
        "  wdt:P31 IRI ;",
        "  wdt:P19 IRI",
        "}");

    ParseOutcome outcome = parser.parse(shexc);

    assertTrue(outcome.hasSchema());
    EachOf expression = assertInstanceOf(EachOf.class, outcome.schema().getShape("Human").getExpression());
    assertEquals(2, expression.expressions().size());
  }

  @Test
  public void parseShouldReportBrokenStatementAndContinue() {
    String shexc = String.join("\n",
        "PREFIX ex: <http://example.org/>",
        "PREFIX broken",
        "ex:A {",
        "  ex:p IRI",
        "}",
        "ex:B  ex:q IRI",
        "ex:C {",
        "  ex:r IRI",
        "}");

    ParseOutcome outcome = parser.parse(shexc);

    assertEquals(Set.of(2, 6), outcome.errorLines());
  }

  @Test
  public void parseShouldKeepShapeWhenClosingBraceIsMissing() {
    String shexc = String.join("\n",
        "PREFIX ex: <http://example.org/>",
        "ex:A {",
        "  ex:p IRI",
        "ex:B {",
        "  ex:q IRI",
        "}");

    ParseOutcome outcome = parser.parse(shexc);

    assertEquals(Set.of(3), outcome.errorLines());
  }

  @Test
  public void parseShouldReportStrayCharacterBetweenStatements() {
    ParseOutcome outcome = parser.parse("PREFIX ex: <http://ex/>\n$\nex:S { ex:p . }");

    assertFalse(outcome.hasSchema());
    assertEquals(Set.of(2), outcome.errorLines());
    assertTrue(outcome.errors().get(0).message().contains("'$'"));
  }

  @Test
  public void parseShouldIgnoreByteOrderMark() {
    ParseOutcome outcome = parser.parse("\uFEFFPREFIX ex: <http://ex/>\nex:S { ex:p . }");

    assertTrue(outcome.hasSchema(), () -> "unexpected errors " + outcome.errors());
    assertTrue(outcome.schema().hasShape("http://ex/S"));
  }

  @Test
  public void parseShouldRejectOutOfRangeCardinality() {
    ParseOutcome outcome = parser.parse("<http://ex/S> {\n  <http://ex/p> . {99999999999}\n}");

    assertFalse(outcome.hasSchema());
    assertEquals(Set.of(2), outcome.errorLines());
  }

  @Test
  public void parseShouldRejectNegativeCardinality() {
    ParseOutcome outcome = parser.parse("<http://ex/S> {\n  <http://ex/p> . {-1,5}\n}");

    assertFalse(outcome.hasSchema());
    assertEquals(Set.of(2), outcome.errorLines());
  }

  @Test
  public void parseEmptyInputShouldYieldNeitherSchemaNorErrors() {
    ParseOutcome outcome = parser.parse("  \n# only a comment\n");

    assertFalse(outcome.hasSchema());
    assertFalse(outcome.hasErrors());
  }
}
