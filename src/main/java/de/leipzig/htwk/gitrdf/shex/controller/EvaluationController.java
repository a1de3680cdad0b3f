package de.leipzig.htwk.gitrdf.shex.controller;

import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import de.leipzig.htwk.gitrdf.shex.config.EvaluationConfig;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationClass;
import de.leipzig.htwk.gitrdf.shex.model.EvaluationSummary;
import de.leipzig.htwk.gitrdf.shex.service.SchemaEvaluationService;

@RestController
@RequestMapping("/api/evaluation")
public class EvaluationController {

  private static final Logger logger = LoggerFactory.getLogger(EvaluationController.class);

  @Autowired
  private SchemaEvaluationService evaluationService;
  @Autowired
  private EvaluationConfig config;

  /**
   * Evaluate a batch of classes; unset request fields fall back to the configured evaluation settings
   */
  @PostMapping
  public ResponseEntity<EvaluationResponse> evaluate(@RequestBody EvaluationRequest request) {
    String dataset = request.dataset() != null ? request.dataset() : config.getDataset();
    logger.info("[EVALUATION] Batch evaluation request for dataset '{}'", dataset);

    try {
      if (request.classes() == null || request.classes().isEmpty()) {
        throw new IllegalArgumentException("At least one class must be given");
      }

      EvaluationSummary summary = evaluationService.evaluate(
          dataset,
          request.classes(),
          Paths.get(request.groundTruthDir() != null ? request.groundTruthDir() : config.getGroundTruthDir()),
          Paths.get(request.predictedDir() != null ? request.predictedDir() : config.getPredictedDir()),
          request.includeGraphEditDistance() != null
              ? request.includeGraphEditDistance()
              : config.isIncludeGraphEditDistance());

      return ResponseEntity.ok(new EvaluationResponse(true, summary, summary.getSummary()));

    } catch (IllegalArgumentException e) {
      logger.error("Invalid evaluation request for dataset: {} - {}", dataset, e.getMessage());
      return ResponseEntity.badRequest().body(new EvaluationResponse(false, null, "Invalid request: " + e.getMessage()));
    } catch (Exception e) {
      logger.error("Evaluation failed for dataset: {}", dataset, e);
      return ResponseEntity.status(500).body(new EvaluationResponse(false, null, e.getMessage()));
    }
  }

  public record EvaluationRequest(
      String dataset,
      List<EvaluationClass> classes,
      String groundTruthDir,
      String predictedDir,
      Boolean includeGraphEditDistance
  ) {}

  public record EvaluationResponse(
      boolean success,
      EvaluationSummary summary,
      String message
  ) {}
}
