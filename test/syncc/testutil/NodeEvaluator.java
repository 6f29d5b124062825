package syncc.testutil;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import syncc.frontend.Clock;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.frontend.VarDecl;

/**
 * Reference semantics of a node, evaluated on the equations as written (unscheduled), instant by instant.
 * A variable whose clock is inactive is absent ({@code null}); memories hold the value of the previous update of
 * their equation; arrows track the first activation of their equation.
 */
public class NodeEvaluator {
  private final Program program;
  private final Node node;
  private final Map<String, Object> constants;
  private final HashMap<String, Integer> definedBy = new HashMap<>();
  private final HashMap<String, Object> cells = new HashMap<>();
  private final HashSet<Integer> started = new HashSet<>();
  private final HashMap<Integer, NodeEvaluator> instances = new HashMap<>();

  private HashMap<String, Object> env;
  private HashSet<String> absent;
  private int currentEquation;

  public NodeEvaluator(Program program, Node node, Map<String, Object> constants) {
    this.program = program;
    this.node = node;
    this.constants = constants;
    List<Equation> equations = node.getEquations();
    for (int i = 0; i < equations.size(); ++i) {
      for (String var : equations.get(i).lhs())
        definedBy.put(var, i);
    }
    for (VarDecl mem : node.getMemories())
      cells.put(mem.name(), initialValue(mem, equations.get(definedBy.get(mem.name())).rhs()));
  }

  private Object initialValue(VarDecl mem, Expr rhs) {
    Expr init = null;
    if (rhs instanceof Expr.Fby)
      init = ((Expr.Fby)rhs).init();
    else if (rhs instanceof Expr.Arrow)
      init = ((Expr.Arrow)rhs).first();
    else
      init = mem.init().orElse(null);
    if (init == null)
      return mem.type().getDefaultValue();
    if (init instanceof Expr.Const)
      return ((Expr.Const)init).value();
    return constants.get(((Expr.Var)init).name());
  }

  /** Evaluates one instant; returns the outputs by name, {@code null} for absent ones. */
  public Map<String, Object> step(Map<String, Object> inputs) {
    env = new HashMap<>(inputs);
    absent = new HashSet<>();
    List<Equation> equations = node.getEquations();
    for (Equation eq : equations) {
      if (!node.isMemory(eq.lhs().get(0)))
        value(eq.lhs().get(0));
    }
    HashMap<String, Object> nextCells = new HashMap<>();
    for (VarDecl mem : node.getMemories()) {
      int eqIndex = definedBy.get(mem.name());
      if (!active(mem.clock()))
        continue;
      currentEquation = eqIndex;
      nextCells.put(mem.name(), eval(nextOf(equations.get(eqIndex).rhs())));
    }
    for (int i = 0; i < equations.size(); ++i) {
      if (active(clockOf(equations.get(i))))
        started.add(i);
    }
    cells.putAll(nextCells);
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    for (VarDecl output : node.getOutputs())
      ret.put(output.name(), value(output.name()));
    return ret;
  }

  private Expr nextOf(Expr rhs) {
    if (rhs instanceof Expr.Fby)
      return ((Expr.Fby)rhs).next();
    if (rhs instanceof Expr.Pre)
      return ((Expr.Pre)rhs).operand();
    return Expr.advance(((Expr.Arrow)rhs).rest(), node::hasVariable).orElseThrow();
  }

  private Clock clockOf(Equation eq) { return node.lookupVariable(eq.lhs().get(0)).map(VarDecl::clock).orElse(Clock.BASE); }

  private boolean active(Clock clock) {
    for (Clock.Guard guard : clock.guards()) {
      Object val = value(guard.variable());
      if (val == null || (Boolean)val != guard.polarity())
        return false;
    }
    return true;
  }

  private Object value(String var) {
    if (node.isMemory(var))
      return cells.get(var);
    if (env.containsKey(var))
      return env.get(var);
    if (absent.contains(var))
      return null;
    Integer eqIndex = definedBy.get(var);
    if (eqIndex == null)
      throw new IllegalStateException("No value for " + var + " in " + node.getName());
    Equation eq = node.getEquations().get(eqIndex);
    if (!active(clockOf(eq))) {
      absent.addAll(eq.lhs());
      return null;
    }
    int savedEquation = currentEquation;
    currentEquation = eqIndex;
    if (eq.rhs() instanceof Expr.Call) {
      Expr.Call call = (Expr.Call)eq.rhs();
      NodeEvaluator callee = instances.computeIfAbsent(eqIndex, i -> new NodeEvaluator(program, program.findNode(call.node()).orElseThrow(), constants));
      HashMap<String, Object> args = new HashMap<>();
      for (int i = 0; i < call.args().size(); ++i)
        args.put(callee.node.getInputs().get(i).name(), eval(call.args().get(i)));
      Map<String, Object> results = callee.step(args);
      for (int i = 0; i < eq.lhs().size(); ++i)
        env.put(eq.lhs().get(i), results.get(callee.node.getOutputs().get(i).name()));
    } else {
      env.put(var, eval(eq.rhs()));
    }
    currentEquation = savedEquation;
    return env.get(var);
  }

  private Object eval(Expr expr) {
    if (expr instanceof Expr.Const)
      return ((Expr.Const)expr).value();
    if (expr instanceof Expr.Var) {
      String name = ((Expr.Var)expr).name();
      return node.hasVariable(name) ? value(name) : constants.get(name);
    }
    if (expr instanceof Expr.Apply) {
      Expr.Apply apply = (Expr.Apply)expr;
      return apply.op().apply(apply.args().stream().map(this::eval).toList());
    }
    if (expr instanceof Expr.Ite) {
      Expr.Ite ite = (Expr.Ite)expr;
      return (Boolean)eval(ite.cond()) ? eval(ite.thenExpr()) : eval(ite.elseExpr());
    }
    if (expr instanceof Expr.When)
      return eval(((Expr.When)expr).operand());
    if (expr instanceof Expr.Merge) {
      Expr.Merge merge = (Expr.Merge)expr;
      return (Boolean)value(merge.clock()) ? eval(merge.onTrue()) : eval(merge.onFalse());
    }
    if (expr instanceof Expr.Arrow) {
      Expr.Arrow arrow = (Expr.Arrow)expr;
      return started.contains(currentEquation) ? eval(arrow.rest()) : eval(arrow.first());
    }
    throw new IllegalArgumentException("Cannot evaluate " + expr + " in " + node.getName());
  }
}
