package de.leipzig.htwk.gitrdf.shex.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shex.config.SimilarityConfig;
import de.leipzig.htwk.gitrdf.shex.core.GraphEditDistance;
import de.leipzig.htwk.gitrdf.shex.core.GraphEditDistanceResult;
import de.leipzig.htwk.gitrdf.shex.core.SchemaGraphBuilder;
import de.leipzig.htwk.gitrdf.shex.core.SchemaTreeBuilder;
import de.leipzig.htwk.gitrdf.shex.core.ShapeNode;
import de.leipzig.htwk.gitrdf.shex.core.SiblingOrderer;
import de.leipzig.htwk.gitrdf.shex.core.TreeEditDistance;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;

/**
 * Structural similarity of a predicted schema to a ground truth schema.
 */
@Service
public class SchemaSimilarityService {

  private static final Logger logger = LoggerFactory.getLogger(SchemaSimilarityService.class);

  @Autowired
  private SchemaTreeBuilder treeBuilder;

  @Autowired
  private SchemaGraphBuilder graphBuilder;

  @Autowired
  private SiblingOrderer siblingOrderer;

  @Autowired
  private TreeEditDistance treeEditDistance;

  @Autowired
  private GraphEditDistance graphEditDistance;

  @Autowired
  private SimilarityConfig config;

  /**
   * @param normalizedTreeEditDistance {@code null} when the ground truth tree has no constraints
   * @param graphEditDistance          {@code null} when not requested or unknown after a timeout
   */
  public record SimilarityReport(
      String shapeId,
      int treeEditDistance,
      int groundTruthTreeSize,
      Double normalizedTreeEditDistance,
      Double graphEditDistance,
      boolean graphEditDistanceTimedOut
  ) {
  }

  public SimilarityReport compare(ShapeSchema groundTruth, ShapeSchema predicted, String shapeId,
      boolean includeGraphEditDistance) {
    return compare(groundTruth, shapeId, predicted, shapeId, includeGraphEditDistance);
  }

  public SimilarityReport compare(ShapeSchema groundTruth, String groundTruthShapeId, ShapeSchema predicted,
      String predictedShapeId, boolean includeGraphEditDistance) {
    ShapeNode groundTruthTree = treeBuilder.build(groundTruth, groundTruthShapeId);
    ShapeNode predictedTree = treeBuilder.build(predicted, predictedShapeId);
    String shapeId = groundTruthTree.getLabel();

    int ted = treeEditDistance(groundTruthTree, predictedTree);
    int size = groundTruthTree.size();
    Double normalized = size > 0 ? treeEditDistance.normalize(ted, groundTruthTree) : null;

    Double ged = null;
    boolean timedOut = false;
    if (includeGraphEditDistance) {
      GraphEditDistanceResult result = graphEditDistance(groundTruth, predicted);
      ged = result.distance();
      timedOut = result.timedOut();
    }

    logger.debug("[SIMILARITY] Shape '{}': TED {}, size {}, normalized {}, GED {}", shapeId, ted, size, normalized, ged);
    return new SimilarityReport(shapeId, ted, size, normalized, ged, timedOut);
  }

  /**
   * Orders both trees against each other, then takes their tree edit distance. The trees are
   * reordered in place.
   */
  public int treeEditDistance(ShapeNode first, ShapeNode second) {
    siblingOrderer.order(first, second);
    return treeEditDistance.compute(first, second);
  }

  /**
   * Graph edit distance between the start-shape graphs, with the two roots matched onto each other.
   */
  public GraphEditDistanceResult graphEditDistance(ShapeSchema first, ShapeSchema second) {
    SchemaGraphBuilder.RootedGraph graph1 = graphBuilder.build(first);
    SchemaGraphBuilder.RootedGraph graph2 = graphBuilder.build(second);
    return graphEditDistance.compute(graph1.graph(), graph2.graph(), graph1.rootId(), graph2.rootId(),
        config.getGraphEditDistanceTimeout());
  }
}
