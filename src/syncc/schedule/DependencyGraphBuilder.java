package syncc.schedule;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.VarDecl;
import syncc.schedule.DependencyGraph.EdgeKind;

/**
 * Derives the dependency graph of a node from its equations.
 */
public class DependencyGraphBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Builds the graph. For every equation, each variable read in the same step (see {@link #sameStepReads}) yields a
   * DATA edge to every defined variable, or a MEMORY edge from every defined variable if the read variable is a
   * memory. Node calls are opaque: all arguments flow to all results. Names that are not variables of the node
   * (global constants) are ignored.
   */
  public static DependencyGraph build(Node node) {
    DependencyGraph graph = new DependencyGraph(node);
    for (Equation eq : node.getEquations()) {
      for (String read : sameStepReads(node, eq)) {
        var readVar = node.lookupVariable(read);
        if (readVar.isEmpty())
          continue;
        for (String defined : eq.lhs()) {
          if (!node.hasVariable(defined))
            continue;
          if (readVar.get().isMemory())
            graph.addEdge(defined, read, EdgeKind.MEMORY);
          else
            graph.addEdge(read, defined, EdgeKind.DATA);
        }
      }
    }
    logger.trace("{}", graph);
    return graph;
  }

  /** Variables read by an equation: its right-hand side reads followed by the sampling variables of its clock. */
  public static List<String> equationReads(Node node, Equation eq) {
    List<String> ret = new ArrayList<>(eq.rhs().reads());
    node.lookupVariable(eq.lhs().get(0)).map(VarDecl::clock).ifPresent(clock -> ret.addAll(clock.variables()));
    return ret;
  }

  /**
   * Variables whose value of the current step an equation needs. The update of a memory reads all of its right-hand
   * side in the step it is executed in; other equations read the operands of {@code pre} and the second operand of
   * {@code fby} from the previous step.
   */
  public static List<String> sameStepReads(Node node, Equation eq) {
    if (node.isMemory(eq.lhs().get(0)))
      return equationReads(node, eq);
    List<String> ret = new ArrayList<>();
    collectSameStepReads(eq.rhs(), ret);
    node.lookupVariable(eq.lhs().get(0)).map(VarDecl::clock).ifPresent(clock -> ret.addAll(clock.variables()));
    return ret;
  }

  private static void collectSameStepReads(Expr expr, List<String> out) {
    if (expr instanceof Expr.Pre)
      return;
    if (expr instanceof Expr.Fby) {
      collectSameStepReads(((Expr.Fby)expr).init(), out);
      return;
    }
    expr.collectOwnReads(out);
    for (Expr child : expr.children())
      collectSameStepReads(child, out);
  }
}
