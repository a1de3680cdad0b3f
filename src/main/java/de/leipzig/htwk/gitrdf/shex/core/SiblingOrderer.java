package de.leipzig.htwk.gitrdf.shex.core;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Brings two trees into a comparable child order before an ordered tree edit distance is taken.
 * At every level, children whose label also occurs among the other tree's root children come
 * first; ties are broken by label.
 */
@Component
public class SiblingOrderer {

  public void order(ShapeNode first, ShapeNode second) {
    // Both key sets are taken before sorting; sorting never changes them.
    Set<String> firstKeys = childLabels(first);
    Set<String> secondKeys = childLabels(second);

    sort(first, secondKeys);
    sort(second, firstKeys);
  }

  private static void sort(ShapeNode node, Set<String> otherKeys) {
    node.getChildren().sort(Comparator
        .comparing((ShapeNode child) -> !otherKeys.contains(child.getLabel()))
        .thenComparing(ShapeNode::getLabel));
    for (ShapeNode child : node.getChildren()) {
      sort(child, otherKeys);
    }
  }

  static Set<String> childLabels(ShapeNode node) {
    Set<String> labels = new HashSet<>();
    for (ShapeNode child : node.getChildren()) {
      labels.add(child.getLabel());
    }
    return labels;
  }
}
