package de.leipzig.htwk.gitrdf.shex.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Graph edit distance between two label graphs by depth-first branch and bound over node
 * assignments. Nodes and edges substitute at cost 0 for equal labels and 1 otherwise; insertions
 * and deletions cost 1. The search stops at the deadline and reports the best assignment found so
 * far.
 */
@Component
public class GraphEditDistance {

  private static final Logger logger = LoggerFactory.getLogger(GraphEditDistance.class);

  private static final int DELETED = -1;

  public GraphEditDistanceResult compute(SchemaGraph first, SchemaGraph second, Duration timeout) {
    return compute(first, second, null, null, timeout);
  }

  /**
   * @param firstRoot  node of {@code first} forced onto {@code secondRoot}; both or neither given
   * @param timeout    wall-clock bound of the search
   */
  public GraphEditDistanceResult compute(SchemaGraph first, SchemaGraph second, String firstRoot,
      String secondRoot, Duration timeout) {
    Search search = new Search(first, second, firstRoot, secondRoot, timeout);
    search.run();

    Double distance = search.best == Integer.MAX_VALUE ? null : (double) search.best;
    if (search.timedOut) {
      logger.warn("[GED] Search timed out after {} ms ({} states), best distance so far: {}",
          timeout.toMillis(), search.expanded, distance != null ? distance : "unknown");
    } else {
      logger.debug("[GED] Distance {} after {} states", distance, search.expanded);
    }
    return new GraphEditDistanceResult(distance, search.timedOut, search.expanded);
  }

  private static final class Search {
    private final List<String> nodes1;
    private final List<String> nodes2;
    private final boolean[][] adjacency1;
    private final boolean[][] adjacency2;
    private final String[][] edgeLabels1;
    private final String[][] edgeLabels2;
    private final int forcedTarget;
    private final long deadline;

    private final int[] assignment;
    private final boolean[] used;
    private int best = Integer.MAX_VALUE;
    private boolean timedOut = false;
    private long expanded = 0;

    Search(SchemaGraph first, SchemaGraph second, String firstRoot, String secondRoot, Duration timeout) {
      nodes1 = new ArrayList<>(first.getNodes());
      nodes2 = new ArrayList<>(second.getNodes());
      if (firstRoot != null && secondRoot != null && first.hasNode(firstRoot) && second.hasNode(secondRoot)) {
        // the forced pair is decided first
        nodes1.remove(firstRoot);
        nodes1.add(0, firstRoot);
        forcedTarget = nodes2.indexOf(secondRoot);
      } else {
        forcedTarget = DELETED;
      }
      adjacency1 = new boolean[nodes1.size()][nodes1.size()];
      edgeLabels1 = new String[nodes1.size()][nodes1.size()];
      fill(first, nodes1, adjacency1, edgeLabels1);
      adjacency2 = new boolean[nodes2.size()][nodes2.size()];
      edgeLabels2 = new String[nodes2.size()][nodes2.size()];
      fill(second, nodes2, adjacency2, edgeLabels2);

      assignment = new int[nodes1.size()];
      used = new boolean[nodes2.size()];
      deadline = System.nanoTime() + timeout.toNanos();
    }

    private static void fill(SchemaGraph graph, List<String> nodes, boolean[][] adjacency, String[][] labels) {
      for (SchemaGraph.Edge edge : graph.getEdges()) {
        int source = nodes.indexOf(edge.source());
        int target = nodes.indexOf(edge.target());
        adjacency[source][target] = true;
        labels[source][target] = edge.label();
      }
    }

    void run() {
      expand(0, 0);
    }

    private void expand(int depth, int cost) {
      if (timedOut) {
        return;
      }
      expanded++;
      if (System.nanoTime() - deadline >= 0) {
        timedOut = true;
        return;
      }

      if (depth == nodes1.size()) {
        int total = cost + insertionCost();
        if (total < best) {
          best = total;
        }
        return;
      }
      if (cost + lowerBound(depth) >= best) {
        return;
      }

      for (int candidate : candidates(depth)) {
        assignment[depth] = candidate;
        int step = candidate == DELETED ? 1 : (nodes1.get(depth).equals(nodes2.get(candidate)) ? 0 : 1);
        if (candidate != DELETED) {
          used[candidate] = true;
        }
        step += edgeCost(depth);
        expand(depth + 1, cost + step);
        if (candidate != DELETED) {
          used[candidate] = false;
        }
        if (timedOut) {
          return;
        }
      }
    }

    /** Same-label node first, then the remaining free nodes, deletion last. */
    private List<Integer> candidates(int depth) {
      List<Integer> candidates = new ArrayList<>();
      if (depth == 0 && forcedTarget != DELETED) {
        candidates.add(forcedTarget);
        return candidates;
      }
      int sameLabel = nodes2.indexOf(nodes1.get(depth));
      if (sameLabel >= 0 && !used[sameLabel]) {
        candidates.add(sameLabel);
      }
      for (int j = 0; j < nodes2.size(); j++) {
        if (!used[j] && j != sameLabel) {
          candidates.add(j);
        }
      }
      candidates.add(DELETED);
      return candidates;
    }

    /** Edges between the node just assigned and every node assigned before it, itself included. */
    private int edgeCost(int depth) {
      int cost = 0;
      for (int other = 0; other <= depth; other++) {
        cost += pairCost(depth, other);
        if (other != depth) {
          cost += pairCost(other, depth);
        }
      }
      return cost;
    }

    private int pairCost(int source, int target) {
      boolean inFirst = adjacency1[source][target];
      int mappedSource = assignment[source];
      int mappedTarget = assignment[target];
      boolean inSecond = mappedSource != DELETED && mappedTarget != DELETED
          && adjacency2[mappedSource][mappedTarget];
      if (inFirst && inSecond) {
        return edgeLabels1[source][target].equals(edgeLabels2[mappedSource][mappedTarget]) ? 0 : 1;
      }
      return inFirst || inSecond ? 1 : 0;
    }

    /** Unused nodes of the second graph are inserted, together with every edge touching them. */
    private int insertionCost() {
      int cost = 0;
      for (int j = 0; j < nodes2.size(); j++) {
        if (!used[j]) {
          cost++;
        }
      }
      for (int s = 0; s < nodes2.size(); s++) {
        for (int t = 0; t < nodes2.size(); t++) {
          if (adjacency2[s][t] && (!used[s] || !used[t])) {
            cost++;
          }
        }
      }
      return cost;
    }

    /**
     * Admissible estimate for the unassigned rest: unmatched labels among the remaining nodes plus
     * the difference in edges still touching an undecided node.
     */
    private int lowerBound(int depth) {
      Set<String> remaining1 = new HashSet<>(nodes1.subList(depth, nodes1.size()));
      int remaining2 = 0;
      int common = 0;
      for (int j = 0; j < nodes2.size(); j++) {
        if (!used[j]) {
          remaining2++;
          if (remaining1.contains(nodes2.get(j))) {
            common++;
          }
        }
      }
      int nodeBound = Math.max(remaining1.size(), remaining2) - common;

      int pending1 = 0;
      for (int s = 0; s < nodes1.size(); s++) {
        for (int t = 0; t < nodes1.size(); t++) {
          if (adjacency1[s][t] && (s >= depth || t >= depth)) {
            pending1++;
          }
        }
      }
      int pending2 = 0;
      for (int s = 0; s < nodes2.size(); s++) {
        for (int t = 0; t < nodes2.size(); t++) {
          if (adjacency2[s][t] && (!used[s] || !used[t])) {
            pending2++;
          }
        }
      }
      return nodeBound + Math.abs(pending1 - pending2);
    }
  }
}
