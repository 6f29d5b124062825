package syncc.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.CausalityCycleException;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.VarDecl;
import syncc.schedule.DependencyGraph.EdgeKind;

/**
 * Orders the equations of a node so that every variable is computed before it is read in the same step, and every
 * memory is read before it is overwritten.
 * <p>
 * Ties between simultaneously ready equations are broken by declaration order (inputs, outputs, locals, memories) of
 * the first defined variable, so identical inputs always yield identical schedules.
 */
public class Scheduler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Equation-level view of a dependency graph. */
  private static class EquationGraph {
    final List<Equation> equations;
    /** Equation index by defined variable */
    final HashMap<String, Integer> definedBy = new HashMap<>();
    final List<LinkedHashSet<Integer>> dataSuccessors = new ArrayList<>();
    final List<LinkedHashSet<Integer>> allSuccessors = new ArrayList<>();
    /** Tie-break rank: smallest declaration index of the defined variables */
    final int[] rank;

    EquationGraph(Node node, DependencyGraph graph) {
      this.equations = node.getEquations();
      rank = new int[equations.size()];
      for (int i = 0; i < equations.size(); ++i) {
        int i_ = i;
        equations.get(i).lhs().forEach(var -> definedBy.putIfAbsent(var, i_));
        rank[i] = equations.get(i).lhs().stream().mapToInt(node::declarationIndex).min().orElse(Integer.MAX_VALUE);
        dataSuccessors.add(new LinkedHashSet<>());
        allSuccessors.add(new LinkedHashSet<>());
      }
      for (DependencyGraph.Edge edge : graph.edges()) {
        Integer from = definedBy.get(edge.from());
        Integer to = definedBy.get(edge.to());
        if (from == null || to == null)
          continue; // inputs and undefined variables impose no order
        if (edge.kind() == EdgeKind.DATA)
          dataSuccessors.get(from).add(to);
        allSuccessors.get(from).add(to);
      }
    }

    /** Defined variables of a set of equations, in declaration order. */
    List<String> variablesOf(Node node, List<Integer> eqIndices) {
      return eqIndices.stream()
          .flatMap(i -> equations.get(i).lhs().stream())
          .distinct()
          .sorted(Comparator.comparingInt(node::declarationIndex))
          .toList();
    }
  }

  public static NodeSchedule schedule(Node node) throws CausalityCycleException {
    return schedule(node, DependencyGraphBuilder.build(node));
  }

  /**
   * Schedules a node.
   * @param node the node
   * @param graph the dependency graph of exactly this node
   * @return the schedule; its node may contain additional copy variables that break cycles through memories
   * @throws CausalityCycleException if a variable's value depends on itself within one step
   */
  public static NodeSchedule schedule(Node node, DependencyGraph graph) throws CausalityCycleException {
    if (graph.getNode() != node)
      throw new IllegalArgumentException("Dependency graph does not belong to node " + node.getName());

    checkSameStepCycles(node, new EquationGraph(node, graph));

    while (true) {
      Optional<Node> rewritten = breakMemoryCycle(node, new EquationGraph(node, graph));
      if (rewritten.isEmpty())
        break;
      node = rewritten.get();
      graph = DependencyGraphBuilder.build(node);
    }

    List<Equation> order = topologicalOrder(node, new EquationGraph(node, graph));

    LinkedHashMap<String, Integer> fanIn = new LinkedHashMap<>();
    node.getAllVariables().forEach(var -> fanIn.put(var.name(), 0));
    for (Equation eq : order)
      countReads(fanIn, DependencyGraphBuilder.equationReads(node, eq));
    for (Expr assertion : node.getAssertions())
      countReads(fanIn, assertion.reads());

    LinkedHashSet<String> unused = new LinkedHashSet<>();
    List<UnusedVariableWarning> warnings = new ArrayList<>();
    for (VarDecl var : node.getAllVariables()) {
      if (var.isOutput() || fanIn.get(var.name()) > 0)
        continue;
      unused.add(var.name());
      if (var.isInput() || var.isMemory()) {
        UnusedVariableWarning warning = new UnusedVariableWarning(node.getName(), var.name(), var.role());
        logger.warn("{}", warning);
        warnings.add(warning);
      }
    }
    NodeSchedule ret = new NodeSchedule(node, graph, order, fanIn, unused, warnings);
    logger.debug("{}", ret);
    logger.trace("{}", ret.fanInTableToString());
    return ret;
  }

  private static void countReads(LinkedHashMap<String, Integer> fanIn, List<String> reads) {
    for (String read : reads)
      fanIn.computeIfPresent(read, (var, count) -> count + 1);
  }

  /** Rejects cycles made of same-step reads only. */
  private static void checkSameStepCycles(Node node, EquationGraph eqGraph) throws CausalityCycleException {
    List<List<Integer>> cycles = StronglyConnected.cyclicComponents(eqGraph.dataSuccessors);
    if (cycles.isEmpty())
      return;
    for (List<Integer> cycle : cycles)
      logger.error("Causality error in node {}: cyclic dependency between {}", node.getName(), eqGraph.variablesOf(node, cycle));
    throw new CausalityCycleException(node.getName(), eqGraph.variablesOf(node, cycles.get(0)));
  }

  /**
   * Breaks one cycle that passes through a memory edge: the reading equation is rewritten to read a fresh local copy
   * of the memory, which is computed before anything else can overwrite the memory.
   * @return the rewritten node, or empty if there is no cycle left
   */
  private static Optional<Node> breakMemoryCycle(Node node, EquationGraph eqGraph) throws CausalityCycleException {
    List<List<Integer>> cycles = StronglyConnected.cyclicComponents(eqGraph.allSuccessors);
    if (cycles.isEmpty())
      return Optional.empty();
    List<Integer> cycle = cycles.get(0);

    String bestMemory = null;
    int bestReader = -1;
    for (int reader : cycle) {
      for (String read : eqGraph.equations.get(reader).rhs().reads()) {
        Integer update = eqGraph.definedBy.get(read);
        if (!node.isMemory(read) || update == null || update == reader || !cycle.contains(update))
          continue;
        boolean better = bestMemory == null || node.declarationIndex(read) < node.declarationIndex(bestMemory) ||
                         (read.equals(bestMemory) && eqGraph.rank[reader] < eqGraph.rank[bestReader]);
        if (better) {
          bestMemory = read;
          bestReader = reader;
        }
      }
    }
    if (bestMemory == null) {
      List<String> vars = eqGraph.variablesOf(node, cycle);
      logger.error("Causality error in node {}: cyclic dependency between {} cannot be broken", node.getName(), vars);
      throw new CausalityCycleException(node.getName(), vars);
    }

    VarDecl memory = node.lookupVariable(bestMemory).orElseThrow();
    String copyName = node.freshName(bestMemory + "_copy");
    String memoryName = bestMemory;
    logger.debug("Node {}: breaking dependency cycle through memory {} with copy {}", node.getName(), memoryName, copyName);

    List<Equation> equations = new ArrayList<>(node.getEquations());
    Equation readerEq = equations.get(bestReader);
    equations.set(bestReader, new Equation(readerEq.lhs(), readerEq.rhs().renameVars(var -> var.equals(memoryName) ? copyName : var)));
    VarDecl copy = new VarDecl(copyName, memory.type(), memory.clock(), VarDecl.Role.LOCAL);
    return Optional.of(node.withEquations(equations).withAddedLocal(copy, new Equation(copyName, new Expr.Var(memoryName))));
  }

  /** Kahn's algorithm with the declaration order tie-break. */
  private static List<Equation> topologicalOrder(Node node, EquationGraph eqGraph) throws CausalityCycleException {
    int n = eqGraph.equations.size();
    int[] inDegree = new int[n];
    for (int i = 0; i < n; ++i) {
      for (int succ : eqGraph.allSuccessors.get(i)) {
        if (succ != i)
          inDegree[succ]++;
      }
    }
    PriorityQueue<Integer> ready =
        new PriorityQueue<>(Comparator.<Integer>comparingInt(i -> eqGraph.rank[i]).thenComparingInt(i -> i));
    for (int i = 0; i < n; ++i) {
      if (inDegree[i] == 0)
        ready.add(i);
    }
    List<Equation> order = new ArrayList<>(n);
    while (!ready.isEmpty()) {
      int cur = ready.poll();
      order.add(eqGraph.equations.get(cur));
      for (int succ : eqGraph.allSuccessors.get(cur)) {
        if (succ != cur && --inDegree[succ] == 0)
          ready.add(succ);
      }
    }
    if (order.size() != n) {
      // Not reachable after cycle breaking; report what is left rather than a partial order.
      List<List<Integer>> cycles = StronglyConnected.cyclicComponents(eqGraph.allSuccessors);
      throw new CausalityCycleException(node.getName(), eqGraph.variablesOf(node, cycles.isEmpty() ? List.of() : cycles.get(0)));
    }
    return order;
  }
}
