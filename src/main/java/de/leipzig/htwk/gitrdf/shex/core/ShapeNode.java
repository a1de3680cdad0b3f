package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered labelled tree node. Every triple constraint gets its own nodes, equal labels are never
 * merged.
 */
public class ShapeNode {

  private final String label;
  private final List<ShapeNode> children = new ArrayList<>();

  public ShapeNode(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public List<ShapeNode> getChildren() {
    return children;
  }

  /**
   * Appends {@code child} and returns this node, so chains read top-down.
   */
  public ShapeNode addChild(ShapeNode child) {
    children.add(child);
    return this;
  }

  /** Number of nodes below this one. */
  public int size() {
    int size = 0;
    for (ShapeNode child : children) {
      size += 1 + child.size();
    }
    return size;
  }

  /** Root-to-leaf paths, one per line, e.g. {@code Person -> knows -> @Person -> *}. */
  public List<String> getPaths() {
    List<String> paths = new ArrayList<>();
    collectPaths(new ArrayList<>(), paths);
    return paths;
  }

  private void collectPaths(List<String> current, List<String> paths) {
    current.add(label);
    if (children.isEmpty()) {
      paths.add(String.join(" -> ", current));
    } else {
      for (ShapeNode child : children) {
        child.collectPaths(current, paths);
      }
    }
    current.remove(current.size() - 1);
  }

  @Override
  public String toString() {
    return String.join("\n", getPaths());
  }
}
