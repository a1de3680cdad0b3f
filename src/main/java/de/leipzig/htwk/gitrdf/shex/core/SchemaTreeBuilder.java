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
 * Builds the ordered tree of one shape. Unlike {@link SchemaGraphBuilder} nothing is merged: each
 * triple constraint hangs its own {@code predicate -> node constraint -> cardinality} branch under
 * the root.
 */
@Component
public class SchemaTreeBuilder {

  private static final Logger logger = LoggerFactory.getLogger(SchemaTreeBuilder.class);

  public ShapeNode build(ShapeSchema schema, String shapeId) {
    String rootId = shapeId;
    if (!schema.hasShape(rootId)) {
      rootId = schema.getFirstShapeId();
      logger.warn("[WARNING] Shape '{}' not found in schema, falling back to first shape '{}'", shapeId, rootId);
    }
    if (rootId == null) {
      throw new IllegalArgumentException("Schema declares no shapes, cannot build tree for '" + shapeId + "'");
    }

    ShapeNode root = new ShapeNode(rootId);
    ShapeDefinition shape = schema.getShape(rootId);
    List<TripleExpression> sequence = shape.getConstraintSequence();
    if (sequence == null) {
      logger.warn("[WARNING] Shape '{}' has no expression, tree holds the root only", rootId);
      return root;
    }

    for (TripleExpression expression : sequence) {
      String predicate = SchemaLabels.predicateLabel(expression);
      if (predicate == null) {
        logger.debug("[TREE] Skipping nested {} in shape '{}'", expression.getClass().getSimpleName(), rootId);
        continue;
      }
      String nodeConstraint = SchemaLabels.nodeConstraintLabel((TripleConstraint) expression, schema);
      String cardinality = SchemaLabels.cardinalityLabel(expression);

      root.addChild(new ShapeNode(predicate)
          .addChild(new ShapeNode(nodeConstraint)
              .addChild(new ShapeNode(cardinality))));
    }
    return root;
  }
}
