package de.leipzig.htwk.gitrdf.shex.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import de.leipzig.htwk.gitrdf.shex.exception.SchemaParseException;
import de.leipzig.htwk.gitrdf.shex.exception.UnrecoverableParseException;
import de.leipzig.htwk.gitrdf.shex.model.CommentRecord;
import de.leipzig.htwk.gitrdf.shex.model.ConversionResult;
import de.leipzig.htwk.gitrdf.shex.model.NamespaceTable;
import de.leipzig.htwk.gitrdf.shex.service.SchemaSimilarityService;
import de.leipzig.htwk.gitrdf.shex.service.SchemaSimilarityService.SimilarityReport;
import de.leipzig.htwk.gitrdf.shex.service.ShexConversionService;
import de.leipzig.htwk.gitrdf.shex.service.ShexConversionService.ShexjDocument;

@RestController
@RequestMapping("/api/schemas")
public class SchemaController {

  private static final Logger logger = LoggerFactory.getLogger(SchemaController.class);

  @Autowired
  private ShexConversionService conversionService;
  @Autowired
  private SchemaSimilarityService similarityService;

  // ========== CONVERSION ENDPOINTS ==========

  /**
   * Convert ShExC to ShExJ, returning base, prefixes and comments alongside
   */
  @PostMapping("/shexj")
  public ResponseEntity<ShexjResponse> toShexJ(@RequestBody ShexcRequest request) {
    logger.info("[CONVERSION] ShExC to ShExJ ({} chars)", request.shexc() != null ? request.shexc().length() : 0);

    try {
      if (request.shexc() == null || request.shexc().isBlank()) {
        throw new IllegalArgumentException("ShExC text cannot be null or empty");
      }
      ShexjDocument document = conversionService.toShexJ(request.shexc());
      ConversionResult conversion = document.conversion();

      return ResponseEntity.ok(new ShexjResponse(
          true,
          document.shexj(),
          conversion.base(),
          conversion.namespaces().asMap(),
          conversion.comments(),
          conversion.droppedLines(),
          conversion.isDegraded() ? "Recovered after dropping lines " + conversion.droppedLines() : "OK"
      ));

    } catch (UnrecoverableParseException e) {
      logger.error("Unrecoverable ShExC input - {}", e.getMessage());
      return ResponseEntity.badRequest().body(new ShexjResponse(
          false, null, null, Map.of(), List.of(), e.getStrippedLines(), e.getMessage()));
    } catch (SchemaParseException | IllegalArgumentException e) {
      logger.error("Invalid ShExC input - {}", e.getMessage());
      return ResponseEntity.badRequest().body(new ShexjResponse(
          false, null, null, Map.of(), List.of(), List.of(), "Invalid request: " + e.getMessage()));
    } catch (Exception e) {
      logger.error("ShExC to ShExJ conversion failed", e);
      return ResponseEntity.status(500).body(new ShexjResponse(
          false, null, null, Map.of(), List.of(), List.of(), e.getMessage()));
    }
  }

  /**
   * Convert ShExJ back to ShExC, reinserting the given comments
   */
  @PostMapping("/shexc")
  public ResponseEntity<ShexcResponse> toShexC(@RequestBody ShexjRequest request) {
    logger.info("[CONVERSION] ShExJ to ShExC ({} comments)", request.comments() != null ? request.comments().size() : 0);

    try {
      if (request.shexj() == null || request.shexj().isBlank()) {
        throw new IllegalArgumentException("ShExJ text cannot be null or empty");
      }
      NamespaceTable namespaces = NamespaceTable.of(request.prefixes());
      String shexc = conversionService.toShexC(request.shexj(), request.base(), namespaces, request.comments());
      return ResponseEntity.ok(new ShexcResponse(true, shexc, "OK"));

    } catch (IllegalArgumentException e) {
      logger.error("Invalid ShExJ input - {}", e.getMessage());
      return ResponseEntity.badRequest().body(new ShexcResponse(false, null, "Invalid request: " + e.getMessage()));
    } catch (Exception e) {
      logger.error("ShExJ to ShExC conversion failed", e);
      return ResponseEntity.status(500).body(new ShexcResponse(false, null, e.getMessage()));
    }
  }

  // ========== SIMILARITY ENDPOINTS ==========

  /**
   * Compare a predicted ShExC schema against a ground truth ShExC schema
   */
  @PostMapping("/similarity")
  public ResponseEntity<SimilarityResponse> compare(@RequestBody SimilarityRequest request) {
    boolean includeGed = Boolean.TRUE.equals(request.includeGraphEditDistance());
    logger.info("[SIMILARITY] Comparing schemas for shape '{}' (GED: {})", request.shapeId(), includeGed);

    try {
      if (request.groundTruth() == null || request.predicted() == null) {
        throw new IllegalArgumentException("Both groundTruth and predicted ShExC are required");
      }
      SimilarityReport report = similarityService.compare(
          conversionService.forward(request.groundTruth()).schema(),
          conversionService.forward(request.predicted()).schema(),
          request.shapeId(),
          includeGed);

      return ResponseEntity.ok(new SimilarityResponse(
          true,
          report.shapeId(),
          report.treeEditDistance(),
          report.groundTruthTreeSize(),
          report.normalizedTreeEditDistance(),
          report.graphEditDistance(),
          report.graphEditDistanceTimedOut(),
          "OK"
      ));

    } catch (SchemaParseException | IllegalArgumentException e) {
      logger.error("Invalid similarity request for shape: {} - {}", request.shapeId(), e.getMessage());
      return ResponseEntity.badRequest().body(SimilarityResponse.failed(request.shapeId(), "Invalid request: " + e.getMessage()));
    } catch (Exception e) {
      logger.error("Similarity computation failed for shape: {}", request.shapeId(), e);
      return ResponseEntity.status(500).body(SimilarityResponse.failed(request.shapeId(), e.getMessage()));
    }
  }

  // ========== REQUEST / RESPONSE TYPES ==========

  public record ShexcRequest(String shexc) {}

  public record ShexjRequest(
      String shexj,
      String base,
      Map<String, String> prefixes,
      List<CommentRecord> comments
  ) {}

  public record SimilarityRequest(
      String groundTruth,
      String predicted,
      String shapeId,
      Boolean includeGraphEditDistance
  ) {}

  public record ShexjResponse(
      boolean success,
      String shexj,
      String base,
      Map<String, String> prefixes,
      List<CommentRecord> comments,
      List<Integer> droppedLines,
      String message
  ) {}

  public record ShexcResponse(
      boolean success,
      String shexc,
      String message
  ) {}

  public record SimilarityResponse(
      boolean success,
      String shapeId,
      Integer treeEditDistance,
      Integer groundTruthTreeSize,
      Double normalizedTreeEditDistance,
      Double graphEditDistance,
      boolean graphEditDistanceTimedOut,
      String message
  ) {
    static SimilarityResponse failed(String shapeId, String message) {
      return new SimilarityResponse(false, shapeId, null, null, null, null, false, message);
    }
  }
}
