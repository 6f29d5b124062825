package syncc.optimize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.frontend.VarDecl;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.MemoryCell;
import syncc.machine.Value;

/**
 * Replaces global constants by their values, folds operators applied to literals, propagates locals that are
 * assigned once to a literal or to a copy of another step variable, and removes assignments to locals nobody reads.
 */
public class ConstantUnfolding implements MachinePass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Map<String, Object> constants;

  /** @param constants values of the global constants (own and imported), by name */
  public ConstantUnfolding(Map<String, Object> constants) { this.constants = constants; }

  @Override
  public String getName() {
    return "constant unfolding";
  }
  @Override
  public int getMinLevel() {
    return 2;
  }

  @Override
  public Machine apply(Machine machine) {
    if (machine.isInterfaceOnly())
      return machine;
    Machine cur = replaceConstants(machine);
    while (true) {
      Machine next = removeDeadLocals(unfoldOneLocal(fold(cur)));
      if (next.equals(cur))
        return cur;
      cur = next;
    }
  }

  private Value replaceConstant(Value value) {
    return Value.rewrite(value, sub -> {
      if (sub instanceof Value.ConstRef && constants.containsKey(((Value.ConstRef)sub).name()))
        return new Value.Literal(constants.get(((Value.ConstRef)sub).name()));
      return null;
    });
  }

  private Machine replaceConstants(Machine machine) {
    List<MemoryCell> memories = machine.getMemories().stream()
        .map(cell -> new MemoryCell(cell.name(), cell.type(), replaceConstant(cell.init()))).toList();
    return machine.withMemories(memories, Instruction.mapAll(machine.getReset(), this::replaceConstant))
        .withStep(Instruction.mapAll(machine.getStep(), this::replaceConstant))
        .withAssertions(machine.getAssertions().stream().map(this::replaceConstant).toList());
  }

  /** Folds operator applications on literals (bottom-up) and conditionals with a literal condition. */
  static Value foldValue(Value value) {
    List<Value> children = value.children();
    if (children.isEmpty())
      return value;
    ArrayList<Value> newChildren = new ArrayList<>();
    for (Value child : children)
      newChildren.add(foldValue(child));
    Value rebuilt = newChildren.equals(children) ? value : value.withChildren(newChildren);
    if (rebuilt instanceof Value.Cond) {
      Value.Cond cond = (Value.Cond)rebuilt;
      if (cond.cond() instanceof Value.Literal)
        return Boolean.TRUE.equals(((Value.Literal)cond.cond()).value()) ? cond.thenValue() : cond.elseValue();
      return rebuilt;
    }
    if (rebuilt instanceof Value.Apply && newChildren.stream().allMatch(child -> child instanceof Value.Literal)) {
      Value.Apply apply = (Value.Apply)rebuilt;
      try {
        return new Value.Literal(apply.op().apply(newChildren.stream().map(child -> ((Value.Literal)child).value()).toList()));
      } catch (ArithmeticException e) {
        logger.trace("Not folding {}: {}", apply, e.getMessage());
      }
    }
    return rebuilt;
  }

  private static List<Instruction> foldInstructions(List<Instruction> instrs) {
    ArrayList<Instruction> ret = new ArrayList<>();
    for (Instruction instr : instrs) {
      if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        Value guard = foldValue(branch.guard());
        if (guard instanceof Value.Literal) {
          ret.addAll(foldInstructions(Boolean.TRUE.equals(((Value.Literal)guard).value()) ? branch.onTrue() : branch.onFalse()));
          continue;
        }
        ret.add(new Instruction.Branch(guard, foldInstructions(branch.onTrue()), foldInstructions(branch.onFalse())));
      } else
        ret.add(instr.mapValues(ConstantUnfolding::foldValue));
    }
    return ret;
  }

  private Machine fold(Machine machine) {
    return machine.withStep(foldInstructions(machine.getStep()))
        .withAssertions(machine.getAssertions().stream().map(ConstantUnfolding::foldValue).toList());
  }

  /** Finds a local that can be replaced by its only assigned value. */
  private Optional<Instruction.Assign> findUnfoldable(Machine machine) {
    StepUses uses = new StepUses(machine);
    List<Instruction> flat = Instruction.flatten(machine.getStep());
    for (VarDecl local : machine.getLocals()) {
      if (uses.defs(local.name()) != 1 || uses.reads(local.name()) == 0)
        continue;
      for (int i = 0; i < flat.size(); ++i) {
        if (!(flat.get(i) instanceof Instruction.Assign) || !((Instruction.Assign)flat.get(i)).var().equals(local.name()))
          continue;
        Instruction.Assign def = (Instruction.Assign)flat.get(i);
        if (def.value() instanceof Value.Literal)
          return Optional.of(def);
        if (def.value() instanceof Value.LocalRef && !def.value().equals(new Value.LocalRef(local.name()))) {
          String source = ((Value.LocalRef)def.value()).name();
          boolean rewrittenLater = flat.subList(i + 1, flat.size()).stream().anyMatch(later -> later.definedLocals().contains(source));
          if (!rewrittenLater)
            return Optional.of(def);
        }
      }
    }
    return Optional.empty();
  }

  private Machine unfoldOneLocal(Machine machine) {
    Optional<Instruction.Assign> found = findUnfoldable(machine);
    if (found.isEmpty())
      return machine;
    Value.LocalRef ref = new Value.LocalRef(found.get().var());
    Value replacement = found.get().value();
    logger.trace("Unfolding {} := {} in {}", ref, replacement, machine.getName());
    UnaryOperator<Value> subst = value -> Value.rewrite(value, sub -> sub.equals(ref) ? replacement : null);
    return machine.withStep(Instruction.mapAll(machine.getStep(), subst))
        .withAssertions(machine.getAssertions().stream().map(subst).toList());
  }

  /** Removes assignments to locals that are never read, then the declarations of locals that are no longer used. */
  static Machine removeDeadLocals(Machine machine) {
    StepUses uses = new StepUses(machine);
    List<String> dead = machine.getLocals().stream().map(VarDecl::name).filter(var -> uses.reads(var) == 0).toList();
    List<Instruction> step = StepUses.dropEmptyBranches(removeAssignments(machine.getStep(), dead));
    Machine ret = machine.withStep(step);
    StepUses newUses = new StepUses(ret);
    List<VarDecl> locals = ret.getLocals().stream().filter(var -> newUses.reads(var.name()) > 0 || newUses.defs(var.name()) > 0).toList();
    if (locals.size() == ret.getLocals().size())
      return ret;
    var aliases = new LinkedHashMap<>(ret.getAliases());
    aliases.entrySet().removeIf(entry -> locals.stream().noneMatch(var -> var.name().equals(entry.getValue())));
    return ret.withLocals(locals).withAliases(aliases);
  }

  private static List<Instruction> removeAssignments(List<Instruction> instrs, List<String> dead) {
    ArrayList<Instruction> ret = new ArrayList<>();
    for (Instruction instr : instrs) {
      if (instr instanceof Instruction.Assign && dead.contains(((Instruction.Assign)instr).var()))
        continue;
      if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        ret.add(new Instruction.Branch(branch.guard(), removeAssignments(branch.onTrue(), dead), removeAssignments(branch.onFalse(), dead)));
      } else
        ret.add(instr);
    }
    return ret;
  }
}
