package syncc.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import syncc.frontend.Node;
import syncc.frontend.VarDecl;

/**
 * Directed graph over the variables of one node. An edge {@code u -> v} means that the equation defining {@code u}
 * has to be executed before the equation defining {@code v}.
 */
public class DependencyGraph {
  public enum EdgeKind {
    /** {@code v}'s definition reads {@code u} in the same step. */
    DATA,
    /**
     * {@code u}'s definition reads memory {@code v}, so it has to run before the memory cell of {@code v} is overwritten.
     */
    MEMORY
  }

  public static record Edge(String from, String to, EdgeKind kind) {
    @Override
    public String toString() {
      return from + (kind == EdgeKind.DATA ? " -> " : " ~> ") + to;
    }
  }

  private final Node node;
  /** Vertices in declaration order, each with its successors in insertion order. */
  private final LinkedHashMap<String, LinkedHashMap<String, EdgeKind>> successors = new LinkedHashMap<>();
  private final LinkedHashMap<String, LinkedHashMap<String, EdgeKind>> predecessors = new LinkedHashMap<>();

  public DependencyGraph(Node node) {
    this.node = node;
    for (VarDecl var : node.getAllVariables()) {
      successors.put(var.name(), new LinkedHashMap<>());
      predecessors.put(var.name(), new LinkedHashMap<>());
    }
  }

  public Node getNode() { return node; }

  /**
   * Adds an edge. A DATA edge replaces a MEMORY edge between the same vertices, never the other way round.
   * Memory self loops are dropped: an update may always read the cell it overwrites.
   */
  public void addEdge(String from, String to, EdgeKind kind) {
    if (!successors.containsKey(from) || !successors.containsKey(to))
      throw new IllegalArgumentException(String.format("Node %s has no variable %s", node.getName(), successors.containsKey(from) ? to : from));
    if (from.equals(to) && kind == EdgeKind.MEMORY)
      return;
    EdgeKind existing = successors.get(from).get(to);
    if (existing == EdgeKind.DATA)
      return;
    successors.get(from).put(to, kind);
    predecessors.get(to).put(from, kind);
  }

  public List<String> vertices() { return new ArrayList<>(successors.keySet()); }

  public Map<String, EdgeKind> successors(String vertex) { return Collections.unmodifiableMap(successors.get(vertex)); }
  public Map<String, EdgeKind> predecessors(String vertex) { return Collections.unmodifiableMap(predecessors.get(vertex)); }

  public Optional<EdgeKind> edgeKind(String from, String to) {
    var succ = successors.get(from);
    return succ == null ? Optional.empty() : Optional.ofNullable(succ.get(to));
  }
  public boolean hasEdge(String from, String to) { return edgeKind(from, to).isPresent(); }

  /** All edges, ordered by source and then insertion. */
  public List<Edge> edges() {
    ArrayList<Edge> ret = new ArrayList<>();
    successors.forEach((from, succ) -> succ.forEach((to, kind) -> ret.add(new Edge(from, to, kind))));
    return ret;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("dependencies of ").append(node.getName()).append(":");
    for (Edge edge : edges())
      sb.append("\n  ").append(edge);
    return sb.toString();
  }
}
