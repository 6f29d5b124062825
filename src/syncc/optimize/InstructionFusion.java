package syncc.optimize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.frontend.VarDecl;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.Value;

/**
 * Substitutes locals that are assigned once and read once into their consumer, provided the consumer follows the
 * assignment in the same instruction sequence and no operand of the assigned value is written in between. Adjacent
 * branches on the same guard are merged afterwards.
 */
public class InstructionFusion implements MachinePass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  @Override
  public String getName() {
    return "instruction fusion";
  }
  @Override
  public int getMinLevel() {
    return 3;
  }

  @Override
  public Machine apply(Machine machine) {
    if (machine.isInterfaceOnly())
      return machine;
    Machine cur = machine;
    while (true) {
      Optional<Machine> fused = fuseOne(cur);
      if (fused.isPresent()) {
        cur = fused.get();
        continue;
      }
      Machine joined = cur.withStep(Instruction.joinAdjacentBranches(cur.getStep()));
      if (joined.equals(cur))
        return cur;
      cur = joined;
    }
  }

  private static Optional<Machine> fuseOne(Machine machine) {
    StepUses uses = new StepUses(machine);
    for (VarDecl local : machine.getLocals()) {
      String var = local.name();
      if (uses.defs(var) != 1 || uses.reads(var) != 1 || StepUses.readsInAssertions(machine, var))
        continue;
      Optional<List<Instruction>> step = fuseIn(machine.getStep(), var);
      if (step.isPresent()) {
        logger.trace("Fusing {} into its consumer in {}", var, machine.getName());
        List<VarDecl> locals = machine.getLocals().stream().filter(decl -> !decl.name().equals(var)).toList();
        return Optional.of(machine.withStep(step.get()).withLocals(locals));
      }
    }
    return Optional.empty();
  }

  private static boolean readsDirectly(Instruction instr, Value.LocalRef ref) {
    return instr.values().stream().anyMatch(value -> Value.localReads(value).contains(ref.name()));
  }
  private static boolean reads(Instruction instr, Value.LocalRef ref) {
    return Instruction.flatten(List.of(instr)).stream().anyMatch(sub -> readsDirectly(sub, ref));
  }

  /** Looks for the assignment of {@code var} in the sequence (or nested branches) and substitutes it into its reader. */
  private static Optional<List<Instruction>> fuseIn(List<Instruction> seq, String var) {
    Value.LocalRef ref = new Value.LocalRef(var);
    for (int i = 0; i < seq.size(); ++i) {
      Instruction instr = seq.get(i);
      if (instr instanceof Instruction.Assign && ((Instruction.Assign)instr).var().equals(var)) {
        Value value = ((Instruction.Assign)instr).value();
        if (Value.localReads(value).contains(var))
          return Optional.empty();
        for (int j = i + 1; j < seq.size(); ++j) {
          Instruction consumer = seq.get(j);
          if (!reads(consumer, ref))
            continue;
          boolean direct = readsDirectly(consumer, ref);
          List<Instruction> between = seq.subList(i + 1, direct ? j : j + 1);
          if (Instruction.writesAnyOperand(between, value))
            return Optional.empty();
          UnaryOperator<Value> subst = read -> Value.rewrite(read, sub -> sub.equals(ref) ? value : null);
          ArrayList<Instruction> ret = new ArrayList<>(seq);
          ret.set(j, consumer.mapValues(subst));
          ret.remove(i);
          return Optional.of(ret);
        }
        return Optional.empty();
      }
      if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        Optional<List<Instruction>> onTrue = fuseIn(branch.onTrue(), var);
        Optional<List<Instruction>> onFalse = onTrue.isPresent() ? Optional.empty() : fuseIn(branch.onFalse(), var);
        if (onTrue.isPresent() || onFalse.isPresent()) {
          ArrayList<Instruction> ret = new ArrayList<>(seq);
          ret.set(i, new Instruction.Branch(branch.guard(), onTrue.orElse(branch.onTrue()), onFalse.orElse(branch.onFalse())));
          return Optional.of(ret);
        }
      }
    }
    return Optional.empty();
  }
}
