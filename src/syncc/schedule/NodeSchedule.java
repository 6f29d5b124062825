package syncc.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import syncc.frontend.Equation;
import syncc.frontend.Node;

/**
 * Result of scheduling one node.
 */
public class NodeSchedule {
  private final Node node;
  private final DependencyGraph graph;
  private final List<Equation> order;
  private final LinkedHashMap<String, Integer> fanIn;
  private final LinkedHashSet<String> unused;
  private final List<UnusedVariableWarning> warnings;

  NodeSchedule(Node node, DependencyGraph graph, List<Equation> order, LinkedHashMap<String, Integer> fanIn, LinkedHashSet<String> unused,
               List<UnusedVariableWarning> warnings) {
    this.node = node.withEquations(order);
    this.graph = graph;
    this.order = List.copyOf(order);
    this.fanIn = fanIn;
    this.unused = unused;
    this.warnings = List.copyOf(warnings);
  }

  /** The node with its equations in scheduled order, including copies inserted to break memory cycles. */
  public Node getNode() { return node; }
  /** The dependency graph the order was computed from (after cycle breaking). */
  public DependencyGraph getGraph() { return graph; }
  public List<Equation> getOrder() { return order; }
  /** Number of reads of each variable, in declaration order. */
  public Map<String, Integer> getFanIn() { return Collections.unmodifiableMap(fanIn); }
  public int getFanIn(String var) { return fanIn.getOrDefault(var, 0); }
  /** Variables that are never read and are not outputs. */
  public Set<String> getUnused() { return Collections.unmodifiableSet(unused); }
  public List<UnusedVariableWarning> getWarnings() { return warnings; }

  /** Index in {@link #getOrder()} of the equation defining the variable, or -1. */
  public int positionOf(String var) {
    for (int i = 0; i < order.size(); ++i) {
      if (order.get(i).lhs().contains(var))
        return i;
    }
    return -1;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("schedule of ").append(node.getName()).append(":");
    for (Equation eq : order)
      sb.append("\n  ").append(String.join(", ", eq.lhs()));
    return sb.toString();
  }

  public String fanInTableToString() {
    StringBuilder sb = new StringBuilder("fan-in of ").append(node.getName()).append(":");
    fanIn.forEach((var, count) -> sb.append("\n  ").append(var).append(": ").append(count));
    return sb.toString();
  }
}
