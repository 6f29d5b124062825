package syncc.machine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.UnresolvedCallException;
import syncc.error.UnsupportedConstructException;
import syncc.frontend.Clock;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.Type;
import syncc.frontend.VarDecl;
import syncc.machine.Instruction.Assign;
import syncc.machine.Instruction.Branch;
import syncc.machine.Instruction.ResetCall;
import syncc.machine.Instruction.StateAssign;
import syncc.machine.Instruction.StepCall;
import syncc.schedule.NodeSchedule;

/**
 * Lowers scheduled nodes to machines. Callees are translated first (recursively) and memoized in a
 * {@link MachineTable}, so the machine of a node depends only on its own schedule and on its callees' machines.
 */
public class MachineTranslator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Prefix of the hidden memory cells that track the first activation of arrow equations. */
  public static final String FIRST_FLAG_PREFIX = "__first_";
  /** Prefix of the hidden memory cells that hold the previous value of a {@code pre} or {@code fby} operand. */
  public static final String DELAY_PREFIX = "__pre_";

  private final Map<String, NodeSchedule> schedules;
  private final Map<String, Machine> importedInterfaces;
  private final MachineTable table;
  private final HashSet<String> inProgress = new HashSet<>();

  /**
   * @param schedules schedules of the nodes of the unit, by node name
   * @param importedInterfaces interface-only machines of the imported nodes, by node name
   * @param table the arena the machines are added to
   */
  public MachineTranslator(Map<String, NodeSchedule> schedules, Map<String, Machine> importedInterfaces, MachineTable table) {
    this.schedules = schedules;
    this.importedInterfaces = importedInterfaces;
    this.table = table;
  }

  public MachineTable getTable() { return table; }

  /** Translates the given nodes (and their callees) in order; returns the machines of the listed nodes. */
  public List<Machine> translateAll(List<String> nodeNames) throws UnresolvedCallException, UnsupportedConstructException {
    ArrayList<Machine> ret = new ArrayList<>();
    for (String nodeName : nodeNames)
      ret.add(table.get(translate(nodeName, nodeName)));
    return ret;
  }

  /**
   * Returns the arena index of the machine of a node, translating it if necessary.
   * @param caller the node requesting the machine, for error reporting
   */
  public int translate(String nodeName, String caller) throws UnresolvedCallException, UnsupportedConstructException {
    var existing = table.indexOf(nodeName);
    if (existing.isPresent())
      return existing.get();
    NodeSchedule schedule = schedules.get(nodeName);
    if (schedule == null) {
      Machine imported = importedInterfaces.get(nodeName);
      if (imported == null)
        throw new UnresolvedCallException(caller, nodeName);
      logger.debug("Using the interface of imported node {}", nodeName);
      return table.add(imported);
    }
    if (!inProgress.add(nodeName))
      throw new UnresolvedCallException(caller, nodeName);
    try {
      Machine machine = new NodeTranslation(schedule.getNode()).translate();
      logger.trace("Machine:\n{}", machine);
      return table.add(machine);
    } finally {
      inProgress.remove(nodeName);
    }
  }

  /** Translation state of a single node. */
  private class NodeTranslation {
    private final Node node;
    private final ArrayList<MemoryCell> memories = new ArrayList<>();
    private final LinkedHashMap<String, Machine.Instance> instances = new LinkedHashMap<>();
    private final HashMap<String, Integer> instanceCounters = new HashMap<>();
    private final ArrayList<String> firstFlags = new ArrayList<>();
    private final ArrayList<MemoryCell> delayCells = new ArrayList<>();
    /** Updates of the delay cells, run at the end of the step once every reader has seen the old value */
    private final ArrayList<Instruction> delayUpdates = new ArrayList<>();
    /** Samplings of the sub-expression being translated, below the clock of the equation */
    private final ArrayList<Clock.Guard> sampling = new ArrayList<>();
    /** Flag of the equation currently being translated, allocated on its first arrow. */
    private String currentFlag;
    private Equation currentEquation;

    NodeTranslation(Node node) { this.node = node; }

    Machine translate() throws UnresolvedCallException, UnsupportedConstructException {
      HashMap<String, Equation> definitions = new HashMap<>();
      for (Equation eq : node.getEquations()) {
        for (String var : eq.lhs())
          definitions.put(var, eq);
      }
      for (VarDecl mem : node.getMemories()) {
        Equation def = definitions.get(mem.name());
        if (def == null)
          throw new UnsupportedConstructException(node.getName(), mem.name(), "memory without a defining equation");
        memories.add(new MemoryCell(mem.name(), mem.type(), memoryInit(mem, def)));
      }

      ArrayList<Instruction> step = new ArrayList<>();
      for (Equation eq : node.getEquations()) {
        currentEquation = eq;
        currentFlag = null;
        List<Instruction> body = translateEquation(eq);
        if (currentFlag != null) {
          body = new ArrayList<>(body);
          body.add(new StateAssign(currentFlag, new Value.Literal(false)));
        }
        step.addAll(underClock(lhsClock(eq), body));
      }
      currentEquation = null;
      currentFlag = null;

      ArrayList<Value> assertions = new ArrayList<>();
      for (Expr assertion : node.getAssertions()) {
        if (assertion.anyMatch(sub -> sub instanceof Expr.Arrow || sub instanceof Expr.Fby))
          throw new UnsupportedConstructException(node.getName(), assertion.toString(), "arrow in an assertion");
        assertions.add(translateValue(assertion));
      }
      step.addAll(delayUpdates);

      for (String flag : firstFlags)
        memories.add(new MemoryCell(flag, Type.BOOL, new Value.Literal(true)));
      memories.addAll(delayCells);

      ArrayList<Instruction> reset = new ArrayList<>();
      for (MemoryCell cell : memories)
        reset.add(new StateAssign(cell.name(), cell.init()));
      boolean stateful = !memories.isEmpty();
      for (var entry : instances.entrySet()) {
        if (table.get(entry.getValue().machineIndex()).isStateful()) {
          reset.add(new ResetCall(entry.getKey()));
          stateful = true;
        }
      }

      return new Machine(node.getName(), node.isStateless(), stateful, false, node.getInputs(), node.getOutputs(), node.getLocals(), memories,
                         instances, reset, Instruction.joinAdjacentBranches(step), assertions, Map.of());
    }

    private Value memoryInit(VarDecl mem, Equation def) throws UnsupportedConstructException {
      Expr rhs = def.rhs();
      Expr init;
      if (rhs instanceof Expr.Fby)
        init = ((Expr.Fby)rhs).init();
      else if (rhs instanceof Expr.Arrow && advanced(((Expr.Arrow)rhs).rest()).isPresent())
        init = ((Expr.Arrow)rhs).first();
      else if (rhs instanceof Expr.Pre)
        init = mem.init().orElse(null);
      else
        throw new UnsupportedConstructException(node.getName(), def.toString(),
                                                "memory " + mem.name() + " is not defined by pre, fby or an arrow to previous values");
      if (init == null)
        return new Value.Literal(mem.type().getDefaultValue());
      if (init instanceof Expr.Const)
        return new Value.Literal(((Expr.Const)init).value());
      if (init instanceof Expr.Var && !node.hasVariable(((Expr.Var)init).name()))
        return new Value.ConstRef(((Expr.Var)init).name());
      throw new UnsupportedConstructException(node.getName(), def.toString(), "initial value of memory " + mem.name() + " is not a constant");
    }

    private Optional<Expr> advanced(Expr rest) { return Expr.advance(rest, node::hasVariable); }

    private Clock lhsClock(Equation eq) {
      return node.lookupVariable(eq.lhs().get(0)).map(VarDecl::clock).orElse(Clock.BASE);
    }

    private List<Instruction> translateEquation(Equation eq) throws UnresolvedCallException, UnsupportedConstructException {
      Expr rhs = eq.rhs();
      if (rhs instanceof Expr.Call)
        return List.of(translateCall(eq, (Expr.Call)rhs));
      if (eq.lhs().size() != 1)
        throw new UnsupportedConstructException(node.getName(), eq.toString(), "several variables defined by a non-call expression");
      String var = eq.lhs().get(0);
      if (node.isMemory(var)) {
        Expr next;
        if (rhs instanceof Expr.Fby)
          next = ((Expr.Fby)rhs).next();
        else if (rhs instanceof Expr.Pre)
          next = ((Expr.Pre)rhs).operand();
        else
          next = advanced(((Expr.Arrow)rhs).rest()).orElseThrow();
        return List.of(new StateAssign(var, translateValue(next)));
      }
      if (rhs instanceof Expr.Merge) {
        Expr.Merge merge = (Expr.Merge)rhs;
        Value onTrue = translateSampled(merge.onTrue(), merge.clock(), true);
        Value onFalse = translateSampled(merge.onFalse(), merge.clock(), false);
        return List.of(new Branch(varValue(merge.clock()), List.of(new Assign(var, onTrue)), List.of(new Assign(var, onFalse))));
      }
      return List.of(new Assign(var, translateValue(rhs)));
    }

    private Instruction translateCall(Equation eq, Expr.Call call) throws UnresolvedCallException, UnsupportedConstructException {
      int calleeIndex = MachineTranslator.this.translate(call.node(), node.getName());
      Machine callee = table.get(calleeIndex);
      if (callee.getInputs().size() != call.args().size() || callee.getOutputs().size() != eq.lhs().size())
        throw new UnsupportedConstructException(node.getName(), eq.toString(),
                                                String.format("call to %s with %d arguments and %d results, expected %d and %d", call.node(),
                                                              call.args().size(), eq.lhs().size(), callee.getInputs().size(),
                                                              callee.getOutputs().size()));
      ArrayList<Value> args = new ArrayList<>();
      for (Expr arg : call.args())
        args.add(translateValue(arg));
      String instance;
      do {
        int k = instanceCounters.merge(call.node(), 1, Integer::sum);
        instance = call.node() + "_" + k;
      } while (instances.containsKey(instance));
      instances.put(instance, new Machine.Instance(call.node(), calleeIndex));
      return new StepCall(instance, args, eq.lhs());
    }

    private Value varValue(String name) {
      if (!node.hasVariable(name))
        return new Value.ConstRef(name);
      return node.isMemory(name) ? new Value.StateRef(name) : new Value.LocalRef(name);
    }

    private Value translateValue(Expr expr) throws UnsupportedConstructException {
      if (expr instanceof Expr.Const)
        return new Value.Literal(((Expr.Const)expr).value());
      if (expr instanceof Expr.Var)
        return varValue(((Expr.Var)expr).name());
      if (expr instanceof Expr.Apply) {
        Expr.Apply apply = (Expr.Apply)expr;
        ArrayList<Value> args = new ArrayList<>();
        for (Expr arg : apply.args())
          args.add(translateValue(arg));
        return new Value.Apply(apply.op(), args);
      }
      if (expr instanceof Expr.Ite) {
        Expr.Ite ite = (Expr.Ite)expr;
        return new Value.Cond(translateValue(ite.cond()), translateValue(ite.thenExpr()), translateValue(ite.elseExpr()));
      }
      if (expr instanceof Expr.When) {
        Expr.When when = (Expr.When)expr;
        return translateSampled(when.operand(), when.clock(), when.polarity());
      }
      if (expr instanceof Expr.Arrow) {
        Expr.Arrow arrow = (Expr.Arrow)expr;
        return new Value.Cond(new Value.StateRef(firstFlag()), translateValue(arrow.first()), translateValue(arrow.rest()));
      }
      if (expr instanceof Expr.Pre)
        return delay(((Expr.Pre)expr).operand());
      if (expr instanceof Expr.Fby) {
        Expr.Fby fby = (Expr.Fby)expr;
        return new Value.Cond(new Value.StateRef(firstFlag()), translateValue(fby.init()), delay(fby.next()));
      }
      String context = currentEquation != null ? currentEquation.toString() : expr.toString();
      if (expr instanceof Expr.Merge)
        throw new UnsupportedConstructException(node.getName(), context, "merge nested in an expression");
      if (expr instanceof Expr.Call)
        throw new UnsupportedConstructException(node.getName(), context, "node call nested in an expression");
      throw new UnsupportedConstructException(node.getName(), context, "unknown expression " + expr.getClass().getSimpleName());
    }

    private Value translateSampled(Expr operand, String clock, boolean polarity) throws UnsupportedConstructException {
      sampling.add(new Clock.Guard(clock, polarity));
      try {
        return translateValue(operand);
      } finally {
        sampling.remove(sampling.size() - 1);
      }
    }

    /**
     * Allocates a hidden memory cell that holds the previous value of {@code operand} and returns its read. The cell is
     * updated at the end of the step, on the clock of the operand.
     */
    private Value delay(Expr operand) throws UnsupportedConstructException {
      String context = currentEquation != null ? currentEquation.toString() : operand.toString();
      if (operand.anyMatch(sub -> sub instanceof Expr.Arrow || sub instanceof Expr.Fby))
        throw new UnsupportedConstructException(node.getName(), context, "arrow under a delay");
      Type type = typeOf(operand).orElseThrow(
          () -> new UnsupportedConstructException(node.getName(), context, "cannot infer the type of the delayed expression " + operand));
      String cell = node.freshName(DELAY_PREFIX + (delayCells.size() + 1));
      while (isHiddenName(cell))
        cell = node.freshName(cell + "_");
      delayCells.add(new MemoryCell(cell, type, new Value.Literal(type.getDefaultValue())));
      // reserved before the operand is translated: a nested delay updates after the cell that reads it
      int updateIndex = delayUpdates.size();
      delayUpdates.add(null);
      Clock clock = currentEquation != null ? lhsClock(currentEquation) : Clock.BASE;
      for (Clock.Guard guard : sampling)
        clock = Clock.on(clock, guard.variable(), guard.polarity());
      Value value = translateValue(operand);
      List<Instruction> update = underClock(clock, List.of(new StateAssign(cell, value)));
      delayUpdates.set(updateIndex, update.get(0));
      return new Value.StateRef(cell);
    }

    private boolean isHiddenName(String name) {
      return firstFlags.contains(name) || delayCells.stream().anyMatch(cell -> cell.name().equals(name));
    }

    private Optional<Type> typeOf(Expr expr) {
      if (expr instanceof Expr.Const)
        return Optional.of(Type.ofLiteral(((Expr.Const)expr).value()));
      if (expr instanceof Expr.Var)
        return node.lookupVariable(((Expr.Var)expr).name()).map(VarDecl::type);
      if (expr instanceof Expr.Apply && ((Expr.Apply)expr).op().isPredicate())
        return Optional.of(Type.BOOL);
      if (expr instanceof Expr.Ite)
        return typeOf(((Expr.Ite)expr).thenExpr()).or(() -> typeOf(((Expr.Ite)expr).elseExpr()));
      if (expr instanceof Expr.Call)
        return Optional.empty();
      // the remaining operators have the type of any of their operands
      return expr.children().stream().map(this::typeOf).flatMap(Optional::stream).findFirst();
    }

    private String firstFlag() {
      if (currentFlag == null) {
        String flag = node.freshName(FIRST_FLAG_PREFIX + (firstFlags.size() + 1));
        while (isHiddenName(flag))
          flag = node.freshName(flag + "_");
        firstFlags.add(flag);
        currentFlag = flag;
      }
      return currentFlag;
    }

    private List<Instruction> underClock(Clock clock, List<Instruction> body) {
      List<Instruction> ret = body;
      List<Clock.Guard> guards = clock.guards();
      for (int i = guards.size() - 1; i >= 0; --i) {
        Clock.Guard guard = guards.get(i);
        Branch branch = guard.polarity() ? new Branch(varValue(guard.variable()), ret, List.of())
                                         : new Branch(varValue(guard.variable()), List.of(), ret);
        ret = List.of(branch);
      }
      return ret;
    }
  }
}
