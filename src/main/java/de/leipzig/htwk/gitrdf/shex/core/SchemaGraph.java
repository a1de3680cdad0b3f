package de.leipzig.htwk.gitrdf.shex.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph whose nodes are labels. Adding a label twice yields the same node, so triple
 * constraints sharing a predicate or node-constraint label share a graph node.
 */
public class SchemaGraph {

  public record Edge(String source, String target, String label) {
  }

  private final Set<String> nodes = new LinkedHashSet<>();
  private final Map<String, Map<String, Edge>> outgoing = new LinkedHashMap<>();

  public void addNode(String label) {
    if (nodes.add(label)) {
      outgoing.put(label, new LinkedHashMap<>());
    }
  }

  /**
   * Adds {@code source -> target} labelled {@code "<source> <target>"}, creating missing nodes.
   */
  public void addEdge(String source, String target) {
    addNode(source);
    addNode(target);
    outgoing.get(source).putIfAbsent(target, new Edge(source, target, source + " " + target));
  }

  public boolean hasNode(String label) {
    return nodes.contains(label);
  }

  public boolean hasEdge(String source, String target) {
    Map<String, Edge> edges = outgoing.get(source);
    return edges != null && edges.containsKey(target);
  }

  /** Edge label, or {@code null} when there is no such edge. */
  public String getEdgeLabel(String source, String target) {
    Map<String, Edge> edges = outgoing.get(source);
    Edge edge = edges != null ? edges.get(target) : null;
    return edge != null ? edge.label() : null;
  }

  public List<String> getNodes() {
    return List.copyOf(nodes);
  }

  public List<Edge> getEdges() {
    List<Edge> edges = new ArrayList<>();
    outgoing.values().forEach(targets -> edges.addAll(targets.values()));
    return edges;
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public int getEdgeCount() {
    int count = 0;
    for (Map<String, Edge> edges : outgoing.values()) {
      count += edges.size();
    }
    return count;
  }

  @Override
  public String toString() {
    return "SchemaGraph{nodes=" + nodes.size() + ", edges=" + getEdgeCount() + "}";
  }
}
