package syncc.optimize;

import java.util.HashMap;
import java.util.List;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.Value;

/** Read and write counts of the step variables of a machine. */
final class StepUses {
  private final HashMap<String, Integer> reads = new HashMap<>();
  private final HashMap<String, Integer> defs = new HashMap<>();

  StepUses(Machine machine) {
    for (Instruction instr : Instruction.flatten(machine.getStep())) {
      for (Value value : instr.values())
        Value.localReads(value).forEach(var -> reads.merge(var, 1, Integer::sum));
      instr.definedLocals().forEach(var -> defs.merge(var, 1, Integer::sum));
    }
    for (Value assertion : machine.getAssertions())
      Value.localReads(assertion).forEach(var -> reads.merge(var, 1, Integer::sum));
  }

  int reads(String var) { return reads.getOrDefault(var, 0); }
  int defs(String var) { return defs.getOrDefault(var, 0); }

  static boolean readsInAssertions(Machine machine, String var) {
    return machine.getAssertions().stream().anyMatch(assertion -> Value.localReads(assertion).contains(var));
  }

  /** Removes the branches with two empty bodies, recursively. */
  static List<Instruction> dropEmptyBranches(List<Instruction> instrs) {
    return instrs.stream().map(instr -> {
      if (!(instr instanceof Instruction.Branch))
        return instr;
      Instruction.Branch branch = (Instruction.Branch)instr;
      return (Instruction)new Instruction.Branch(branch.guard(), dropEmptyBranches(branch.onTrue()), dropEmptyBranches(branch.onFalse()));
    }).filter(instr -> !(instr instanceof Instruction.Branch) || !isEmpty((Instruction.Branch)instr)).toList();
  }
  private static boolean isEmpty(Instruction.Branch branch) { return branch.onTrue().isEmpty() && branch.onFalse().isEmpty(); }
}
