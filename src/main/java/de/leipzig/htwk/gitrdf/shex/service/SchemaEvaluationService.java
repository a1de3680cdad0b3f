package de.leipzig.htwk.gitrdf.shex.service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shex.config.EvaluationConfig;
import de.leipzig.htwk.gitrdf.shex.exception.SchemaParseException;
import de.leipzig.htwk.gitrdf.shex.model.ClassEvaluation;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationClass;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationSummary;
import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;

/**
 * Compares predicted schemas against ground truth schemas class by class. A class whose files are
 * missing or unreadable is skipped and left out of the averages; it never stops the batch.
 */
@Service
public class SchemaEvaluationService {

  private static final Logger logger = LoggerFactory.getLogger(SchemaEvaluationService.class);

  private static final String WES_DATASET = "wes";

  @Autowired
  private ShexConversionService conversionService;

  @Autowired
  private SchemaFileService fileService;

  @Autowired
  private SchemaSimilarityService similarityService;

  @Autowired
  private EvaluationConfig config;

  public EvaluationSummary evaluate(List<EvaluationClass> classes) {
    return evaluate(config.getDataset(), classes, Paths.get(config.getGroundTruthDir()),
        Paths.get(config.getPredictedDir()), config.isIncludeGraphEditDistance());
  }

  public EvaluationSummary evaluate(String dataset, List<EvaluationClass> classes, Path groundTruthDir,
      Path predictedDir, boolean includeGraphEditDistance) {
    logger.info("[EVALUATION] Evaluating {} class(es) of dataset '{}' ({} vs {})",
        classes.size(), dataset, groundTruthDir, predictedDir);

    List<ClassEvaluation> results = new ArrayList<>();
    List<String> skipped = new ArrayList<>();

    for (EvaluationClass evaluationClass : classes) {
      String classId = evaluationClass.classId();
      String shapeId = shapeIdFor(dataset, evaluationClass.classLabel());
      logger.info("[EVALUATION] Evaluating shape '{}' in class '{}'", shapeId, classId);

      ClassEvaluation result;
      try {
        result = evaluateClass(classId, shapeId, groundTruthDir, predictedDir, includeGraphEditDistance);
      } catch (RuntimeException e) {
        logger.error("[ERROR] Unexpected failure while evaluating class '{}', skipping it", classId, e);
        result = null;
      }
      if (result == null) {
        skipped.add(classId);
        continue;
      }
      logger.info("[EVALUATION] {}", result.getSummary());
      results.add(result);
    }

    double averageTed = average(results, false);
    double averageNormalizedTed = average(results, true);
    if (results.isEmpty()) {
      logger.warn("[WARNING] No class could be compared, averages are undefined");
    } else {
      logger.info(String.format(Locale.ROOT, "[EVALUATION] Average TED (over %d schema): %.3f", results.size(), averageTed));
      logger.info(String.format(Locale.ROOT, "[EVALUATION] Normalized Average TED (over %d schema): %.3f",
          results.size(), averageNormalizedTed));
    }
    if (!skipped.isEmpty()) {
      logger.warn("[WARNING] Skipped {} class(es): {}", skipped.size(), skipped);
    }

    return new EvaluationSummary(dataset, results, skipped, averageTed, averageNormalizedTed);
  }

  /**
   * @return the comparison, or {@code null} when the class has to be skipped
   */
  private ClassEvaluation evaluateClass(String classId, String shapeId, Path groundTruthDir, Path predictedDir,
      boolean includeGraphEditDistance) {
    Path groundTruthFile = groundTruthDir.resolve(classId + config.getFileExtension());
    Path predictedFile = predictedDir.resolve(classId + config.getFileExtension());

    ShapeSchema groundTruth = loadSchema(groundTruthFile, classId);
    if (groundTruth == null) {
      return null;
    }
    if (!fileService.exists(predictedFile)) {
      logger.warn("[WARNING] File '{}' does not exist, skipping class '{}'", predictedFile, classId);
      return null;
    }
    ShapeSchema predicted = loadSchema(predictedFile, classId);
    if (predicted == null) {
      return null;
    }

    try {
      SchemaSimilarityService.SimilarityReport report = similarityService.compare(
          groundTruth, resolveShapeId(groundTruth, shapeId),
          predicted, resolveShapeId(predicted, shapeId), includeGraphEditDistance);
      if (report.normalizedTreeEditDistance() == null) {
        logger.warn("[WARNING] Ground truth shape '{}' of class '{}' has no triple constraints, skipping",
            shapeId, classId);
        return null;
      }
      return new ClassEvaluation(classId, shapeId, report.treeEditDistance(), report.groundTruthTreeSize(),
          report.normalizedTreeEditDistance(), report.graphEditDistance());
    } catch (IllegalArgumentException e) {
      logger.warn("[WARNING] Could not compare class '{}': {}", classId, e.getMessage());
      return null;
    }
  }

  private ShapeSchema loadSchema(Path schemaFile, String classId) {
    if (!fileService.exists(schemaFile)) {
      logger.warn("[WARNING] File '{}' does not exist, skipping class '{}'", schemaFile, classId);
      return null;
    }
    try {
      return conversionService.forward(fileService.readSchema(schemaFile)).schema();
    } catch (SchemaParseException e) {
      logger.warn("[WARNING] Could not parse '{}' for class '{}': {}", schemaFile, classId, e.getMessage());
    } catch (IOException | IllegalArgumentException e) {
      logger.warn("[WARNING] Could not read '{}' for class '{}': {}", schemaFile, classId, e.getMessage());
    }
    return null;
  }

  /**
   * Shape ids in parsed schemas are full IRIs while the naming convention yields a local name;
   * picks the declared shape whose IRI ends in that name, if any.
   */
  static String resolveShapeId(ShapeSchema schema, String shapeId) {
    if (schema.hasShape(shapeId)) {
      return shapeId;
    }
    for (ShapeDefinition shape : schema.getShapes()) {
      String id = shape.getId();
      if (id.endsWith("/" + shapeId) || id.endsWith("#" + shapeId) || id.endsWith(":" + shapeId)) {
        return id;
      }
    }
    return shapeId;
  }

  /**
   * {@code wes} shapes are named after the class label in upper camel case
   * ({@code "human settlement"} becomes {@code HumanSettlement}); other datasets use the label as is.
   */
  static String shapeIdFor(String dataset, String classLabel) {
    if (!WES_DATASET.equals(dataset)) {
      return classLabel;
    }
    StringBuilder shapeId = new StringBuilder();
    for (String word : classLabel.trim().split("\\s+")) {
      if (!word.isEmpty()) {
        shapeId.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
      }
    }
    return shapeId.toString();
  }

  private static double average(List<ClassEvaluation> results, boolean normalized) {
    if (results.isEmpty()) {
      return Double.NaN;
    }
    double sum = 0;
    for (ClassEvaluation result : results) {
      sum += normalized ? result.normalizedTreeEditDistance() : result.treeEditDistance();
    }
    return sum / results.size();
  }
}
