package de.leipzig.htwk.gitrdf.shex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed shape schema: shape declarations keyed by id plus the designated start shape.
 * Instances are immutable once produced by a parse or a ShExJ read.
 */
public class ShapeSchema {

  private final String start;
  private final List<ShapeDefinition> shapes;
  private final Map<String, ShapeDefinition> shapesById;

  public ShapeSchema(String start, List<ShapeDefinition> shapes) {
    this.start = start;
    this.shapes = shapes != null ? List.copyOf(shapes) : List.of();
    Map<String, ShapeDefinition> byId = new LinkedHashMap<>();
    for (ShapeDefinition shape : this.shapes) {
      byId.putIfAbsent(shape.getId(), shape);
    }
    this.shapesById = Collections.unmodifiableMap(byId);
  }

  public String getStart() {
    return start;
  }

  public List<ShapeDefinition> getShapes() {
    return shapes;
  }

  public ShapeDefinition getShape(String id) {
    return id != null ? shapesById.get(id) : null;
  }

  public boolean hasShape(String id) {
    return id != null && shapesById.containsKey(id);
  }

  public boolean isEmpty() {
    return shapes.isEmpty();
  }

  public String getFirstShapeId() {
    return shapes.isEmpty() ? null : shapes.get(0).getId();
  }

  public int getShapeCount() {
    return shapes.size();
  }

  @Override
  public String toString() {
    return String.format("ShapeSchema{start='%s', shapes=%s}", start, shapesById.keySet());
  }
}
