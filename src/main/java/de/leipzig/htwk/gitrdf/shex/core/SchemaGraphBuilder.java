package de.leipzig.htwk.gitrdf.shex.core;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shex.model.ShapeDefinition;
import de.leipzig.htwk.gitrdf.shex.model.ShapeSchema;
import de.leipzig.htwk.gitrdf.shex.model.TripleConstraint;
import de.leipzig.htwk.gitrdf.shex.model.TripleExpression;

/**
 * Builds the label graph of a schema's start shape: for each triple constraint a chain
 * {@code root -> predicate -> node constraint -> cardinality}.
 */
@Component
public class SchemaGraphBuilder {

  private static final Logger logger = LoggerFactory.getLogger(SchemaGraphBuilder.class);

  public record RootedGraph(String rootId, SchemaGraph graph) {
  }

  public RootedGraph build(ShapeSchema schema) {
    String rootId = schema.getStart();
    if (!schema.hasShape(rootId)) {
      String fallback = schema.getFirstShapeId();
      logger.warn("[WARNING] Start shape '{}' not found in schema, falling back to first shape '{}'", rootId, fallback);
      rootId = fallback;
    }

    SchemaGraph graph = new SchemaGraph();
    if (rootId == null) {
      logger.warn("[WARNING] Schema declares no shapes, returning empty graph");
      return new RootedGraph(null, graph);
    }
    graph.addNode(rootId);

    ShapeDefinition rootShape = schema.getShape(rootId);
    List<TripleExpression> sequence = rootShape.getConstraintSequence();
    if (sequence == null) {
      logger.warn("[WARNING] Shape '{}' has no expression, graph holds the root only", rootId);
      return new RootedGraph(rootId, graph);
    }

    for (TripleExpression expression : sequence) {
      String predicate = SchemaLabels.predicateLabel(expression);
      if (predicate == null) {
        logger.debug("[GRAPH] Skipping nested {} in shape '{}'", expression.getClass().getSimpleName(), rootId);
        continue;
      }
      String nodeConstraint = SchemaLabels.nodeConstraintLabel((TripleConstraint) expression, schema);
      String cardinality = SchemaLabels.cardinalityLabel(expression);

      graph.addEdge(rootId, predicate);
      graph.addEdge(predicate, nodeConstraint);
      graph.addEdge(nodeConstraint, cardinality);
    }

    logger.debug("[GRAPH] Built graph for '{}': {}", rootId, graph);
    return new RootedGraph(rootId, graph);
  }
}
