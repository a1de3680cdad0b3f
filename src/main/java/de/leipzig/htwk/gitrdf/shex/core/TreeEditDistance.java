package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Unit-cost tree edit distance over ordered labelled trees (Zhang-Shasha). Insert and delete cost
 * 1, relabelling costs 0 for equal labels and 1 otherwise.
 */
@Component
public class TreeEditDistance {

  private static final int COST_INSERT = 1;
  private static final int COST_DELETE = 1;
  private static final int COST_RELABEL = 1;

  public int compute(ShapeNode first, ShapeNode second) {
    IndexedTree t1 = new IndexedTree(first);
    IndexedTree t2 = new IndexedTree(second);
    int n = t1.size();
    int m = t2.size();

    // treedist[i][j]: distance between the subtrees rooted at postorder nodes i and j (1-based)
    int[][] treedist = new int[n + 1][m + 1];

    for (int i : t1.keyroots()) {
      for (int j : t2.keyroots()) {
        int iOffset = t1.left[i] - 1;
        int jOffset = t2.left[j] - 1;
        int rows = i - iOffset;
        int cols = j - jOffset;
        int[][] forestdist = new int[rows + 1][cols + 1];

        for (int i1 = 1; i1 <= rows; i1++) {
          forestdist[i1][0] = forestdist[i1 - 1][0] + COST_DELETE;
        }
        for (int j1 = 1; j1 <= cols; j1++) {
          forestdist[0][j1] = forestdist[0][j1 - 1] + COST_INSERT;
        }

        for (int i1 = 1; i1 <= rows; i1++) {
          for (int j1 = 1; j1 <= cols; j1++) {
            int x = i1 + iOffset;
            int y = j1 + jOffset;
            int delete = forestdist[i1 - 1][j1] + COST_DELETE;
            int insert = forestdist[i1][j1 - 1] + COST_INSERT;

            if (t1.left[x] == t1.left[i] && t2.left[y] == t2.left[j]) {
              // both prefixes are whole trees
              int relabel = t1.label(x).equals(t2.label(y)) ? 0 : COST_RELABEL;
              forestdist[i1][j1] = Math.min(Math.min(delete, insert), forestdist[i1 - 1][j1 - 1] + relabel);
              treedist[x][y] = forestdist[i1][j1];
            } else {
              int p = t1.left[x] - 1 - iOffset;
              int q = t2.left[y] - 1 - jOffset;
              forestdist[i1][j1] = Math.min(Math.min(delete, insert), forestdist[p][q] + treedist[x][y]);
            }
          }
        }
      }
    }
    return treedist[n][m];
  }

  /**
   * Distance scaled by the ground truth tree: {@code distance / (3 * size)}, where size counts the
   * nodes below the root.
   */
  public double normalize(int distance, ShapeNode groundTruth) {
    int size = groundTruth.size();
    if (size == 0) {
      throw new IllegalArgumentException("Cannot normalize against empty tree '" + groundTruth.getLabel() + "'");
    }
    return distance / (3.0 * size);
  }

  /**
   * Postorder numbering (1-based) with the leftmost leaf of every node.
   */
  private static final class IndexedTree {
    private final List<ShapeNode> postorder = new ArrayList<>();
    private final int[] left;

    IndexedTree(ShapeNode root) {
      List<Integer> leftmost = new ArrayList<>();
      index(root, leftmost);
      left = new int[postorder.size() + 1];
      for (int k = 0; k < leftmost.size(); k++) {
        left[k + 1] = leftmost.get(k);
      }
    }

    private int index(ShapeNode node, List<Integer> leftmost) {
      int firstLeaf = -1;
      for (ShapeNode child : node.getChildren()) {
        int childLeaf = index(child, leftmost);
        if (firstLeaf < 0) {
          firstLeaf = childLeaf;
        }
      }
      postorder.add(node);
      int own = postorder.size();
      if (firstLeaf < 0) {
        firstLeaf = own;
      }
      leftmost.add(firstLeaf);
      return firstLeaf;
    }

    int size() {
      return postorder.size();
    }

    String label(int index) {
      return postorder.get(index - 1).getLabel();
    }

    /** Nodes with no later node sharing their leftmost leaf, in ascending order. */
    List<Integer> keyroots() {
      List<Integer> keyroots = new ArrayList<>();
      for (int i = 1; i <= size(); i++) {
        boolean keyroot = true;
        for (int k = i + 1; k <= size(); k++) {
          if (left[k] == left[i]) {
            keyroot = false;
            break;
          }
        }
        if (keyroot) {
          keyroots.add(i);
        }
      }
      return keyroots;
    }
  }
}
