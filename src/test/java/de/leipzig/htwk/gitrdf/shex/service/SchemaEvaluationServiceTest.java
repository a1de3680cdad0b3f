package de.leipzig.htwk.gitrdf.shex.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import de.leipzig.htwk.gitrdf.shex.model.ClassEvaluation;
import de.leipzig.htwk.gitrdf.shex.model.EachOf;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationClass;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationSummary;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
public class SchemaEvaluationServiceTest {

  private static final Path GROUND_TRUTH = Paths.get("src/test/resources/schemas/ground-truth");
  private static final Path PREDICTED = Paths.get("src/test/resources/schemas/predicted");

  private static final EvaluationClass HUMAN = new EvaluationClass("http://www.wikidata.org/entity/Q5", "human");
  private static final EvaluationClass CITY = new EvaluationClass("http://www.wikidata.org/entity/Q515", "city");
  private static final EvaluationClass EARTH = new EvaluationClass("http://www.wikidata.org/entity/Q2", "earth");
  private static final EvaluationClass COUNTRY = new EvaluationClass("http://www.wikidata.org/entity/Q6256", "country");

  @Autowired
  private SchemaEvaluationService evaluationService;

  @Test
  public void evaluateShouldAverageOverComparedClassesOnly() {
    EvaluationSummary summary = evaluationService.evaluate("wes", List.of(HUMAN, CITY, COUNTRY),
        GROUND_TRUTH, PREDICTED, false);

    assertEquals(2, summary.getComparedCount());
    assertEquals(List.of("Q6256"), summary.skippedClasses());

    ClassEvaluation human = summary.results().get(0);
    assertEquals("Q5", human.classId());
    assertEquals("Human", human.shapeId());
    assertEquals(2, human.treeEditDistance());
    assertEquals(27, human.groundTruthTreeSize());
    assertEquals(2.0 / 81.0, human.normalizedTreeEditDistance(), 1e-12);
    assertNull(human.graphEditDistance());

    ClassEvaluation city = summary.results().get(1);
    assertEquals(0, city.treeEditDistance());
    assertEquals(0.0, city.normalizedTreeEditDistance());

    assertEquals(1.0, summary.averageTreeEditDistance(), 1e-12);
    assertEquals(1.0 / 81.0, summary.averageNormalizedTreeEditDistance(), 1e-12);
  }

  @Test
  public void evaluateShouldRecoverFromStrayCharacterLine(@TempDir Path workDir) throws IOException {
    String earth = "PREFIX ex: <http://example.org/>\n"
        + "PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>\n"
        + "\n"
        + "ex:Earth {\n"
        + "  ex:name xsd:string ;\n"
        + "  ex:radius xsd:decimal ?\n"
        + "}\n";
    Path groundTruthDir = Files.createDirectories(workDir.resolve("ground-truth"));
    Path predictedDir = Files.createDirectories(workDir.resolve("predicted"));
    Files.writeString(groundTruthDir.resolve("Q2.shex"), earth);
    Files.writeString(predictedDir.resolve("Q2.shex"), earth.replace("\n\nex:Earth", "\n$\nex:Earth"));
    Files.copy(GROUND_TRUTH.resolve("Q515.shex"), groundTruthDir.resolve("Q515.shex"));
    Files.copy(PREDICTED.resolve("Q515.shex"), predictedDir.resolve("Q515.shex"));

    EvaluationSummary summary = evaluationService.evaluate("wes", List.of(EARTH, CITY),
        groundTruthDir, predictedDir, false);

    assertEquals(2, summary.getComparedCount());
    assertTrue(summary.skippedClasses().isEmpty());
    assertEquals("Q2", summary.results().get(0).classId());
    assertEquals(0, summary.results().get(0).treeEditDistance());
  }

  @Test
  public void evaluateShouldComputeGraphEditDistanceWhenRequested() {
    EvaluationSummary summary = evaluationService.evaluate("wes", List.of(CITY), GROUND_TRUTH, PREDICTED, true);

    assertEquals(0.0, summary.results().get(0).graphEditDistance());
  }

  @Test
  public void evaluateShouldYieldNaNWhenNothingWasCompared() {
    EvaluationSummary summary = evaluationService.evaluate("wes", List.of(COUNTRY), GROUND_TRUTH, PREDICTED, false);

    assertEquals(0, summary.getComparedCount());
    assertTrue(Double.isNaN(summary.averageTreeEditDistance()));
    assertTrue(Double.isNaN(summary.averageNormalizedTreeEditDistance()));
  }

  @Test
  public void shapeIdForShouldCamelCaseWesLabels() {
    assertEquals("HumanSettlement", SchemaEvaluationService.shapeIdFor("wes", "human settlement"));
    assertEquals("City", SchemaEvaluationService.shapeIdFor("wes", " CITY "));
    assertEquals("human settlement", SchemaEvaluationService.shapeIdFor("other", "human settlement"));
  }

  @Test
  public void resolveShapeIdShouldMatchLocalName() {
    ShapeSchema schema = new ShapeSchema(null, List.of(
        new ShapeDefinition("http://example.org/shapes/Human", new EachOf(List.of())),
        new ShapeDefinition("Place", null)));

    assertEquals("http://example.org/shapes/Human", SchemaEvaluationService.resolveShapeId(schema, "Human"));
    assertEquals("Place", SchemaEvaluationService.resolveShapeId(schema, "Place"));
    assertEquals("Unknown", SchemaEvaluationService.resolveShapeId(schema, "Unknown"));
  }
}
