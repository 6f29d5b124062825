package syncc.schedule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.CausalityCycleException;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.Program;

/**
 * Orders the nodes of a program so that every node comes after the nodes it calls.
 */
public class NodeSorter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Names of the nodes called by a node, in order of first occurrence. */
  public static List<String> callees(Node node) {
    LinkedHashSet<String> ret = new LinkedHashSet<>();
    for (Equation eq : node.getEquations())
      collectCalls(eq.rhs(), ret);
    return new ArrayList<>(ret);
  }

  private static void collectCalls(Expr expr, LinkedHashSet<String> out) {
    if (expr instanceof Expr.Call)
      out.add(((Expr.Call)expr).node());
    for (Expr child : expr.children())
      collectCalls(child, out);
  }

  /**
   * Sorts the nodes, callees first; among independent nodes, declaration order is kept.
   * Calls to nodes outside of the program (imported nodes) are ignored.
   * @throws CausalityCycleException if nodes call each other recursively
   */
  public static Program sort(Program program) throws CausalityCycleException {
    List<Node> nodes = program.getNodes();
    HashMap<String, Integer> indexByName = new HashMap<>();
    for (int i = 0; i < nodes.size(); ++i)
      indexByName.put(nodes.get(i).getName(), i);

    // callee -> callers
    List<LinkedHashSet<Integer>> callers = new ArrayList<>();
    nodes.forEach(node -> callers.add(new LinkedHashSet<>()));
    int[] pendingCallees = new int[nodes.size()];
    for (int i = 0; i < nodes.size(); ++i) {
      for (String callee : callees(nodes.get(i))) {
        Integer calleeIdx = indexByName.get(callee);
        if (calleeIdx == null)
          continue;
        if (callers.get(calleeIdx).add(i))
          pendingCallees[i]++;
      }
    }

    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < nodes.size(); ++i) {
      if (pendingCallees[i] == 0)
        ready.add(i);
    }
    List<Node> sorted = new ArrayList<>();
    while (!ready.isEmpty()) {
      int cur = ready.poll();
      sorted.add(nodes.get(cur));
      for (int caller : callers.get(cur)) {
        if (--pendingCallees[caller] == 0)
          ready.add(caller);
      }
    }
    if (sorted.size() != nodes.size()) {
      List<List<Integer>> cycles = StronglyConnected.cyclicComponents(callers);
      List<String> names = cycles.get(0).stream().map(i -> nodes.get(i).getName()).toList();
      logger.error("Module {}: recursive calls between nodes {}", program.getModuleName(), names);
      throw new CausalityCycleException(program.getModuleName(), names);
    }
    logger.debug("Node order of {}: {}", program.getModuleName(), sorted.stream().map(Node::getName).toList());
    return program.withNodes(sorted);
  }
}
