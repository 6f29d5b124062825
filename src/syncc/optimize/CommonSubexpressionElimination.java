package syncc.optimize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.Value;

/**
 * Available-expression rewriting: a compound value already computed into a variable earlier in the same instruction
 * sequence is replaced by that variable. Entries computed inside a branch are not available after it; an entry dies
 * as soon as one of its operands or its holder is written.
 */
public class CommonSubexpressionElimination implements MachinePass {

  @Override
  public String getName() {
    return "common subexpression elimination";
  }
  @Override
  public int getMinLevel() {
    return 4;
  }

  @Override
  public Machine apply(Machine machine) {
    if (machine.isInterfaceOnly())
      return machine;
    return machine.withStep(eliminate(machine.getStep(), new LinkedHashMap<>()));
  }

  private static List<Instruction> eliminate(List<Instruction> instrs, LinkedHashMap<Value, String> available) {
    ArrayList<Instruction> ret = new ArrayList<>();
    for (Instruction instr : instrs) {
      if (instr instanceof Instruction.Assign) {
        Instruction.Assign assign = (Instruction.Assign)instr;
        Value value = reuse(assign.value(), available);
        ret.add(new Instruction.Assign(assign.var(), value));
        kill(available, Set.of(assign.var()), Set.of());
        if (!value.isAtomic() && !Value.localReads(value).contains(assign.var()))
          available.putIfAbsent(value, assign.var());
      } else if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        Instruction.Branch rewritten = new Instruction.Branch(reuse(branch.guard(), available), eliminate(branch.onTrue(), new LinkedHashMap<>(available)),
                                                              eliminate(branch.onFalse(), new LinkedHashMap<>(available)));
        ret.add(rewritten);
        List<Instruction> bodies = new ArrayList<>(branch.onTrue());
        bodies.addAll(branch.onFalse());
        kill(available, Instruction.writtenLocals(bodies), Instruction.writtenMemories(bodies));
      } else {
        ret.add(instr.mapValues(value -> reuse(value, available)));
        kill(available, Instruction.writtenLocals(List.of(instr)), Instruction.writtenMemories(List.of(instr)));
      }
    }
    return ret;
  }

  /** Looks up each compound node both as written and after its operands were rewritten. */
  private static Value reuse(Value value, LinkedHashMap<Value, String> available) {
    if (value.isAtomic())
      return value;
    String holder = available.get(value);
    if (holder != null)
      return new Value.LocalRef(holder);
    List<Value> children = value.children().stream().map(child -> reuse(child, available)).toList();
    Value rebuilt = children.equals(value.children()) ? value : value.withChildren(children);
    holder = available.get(rebuilt);
    return holder == null ? rebuilt : new Value.LocalRef(holder);
  }

  private static void kill(LinkedHashMap<Value, String> available, Set<String> locals, Set<String> memories) {
    if (locals.isEmpty() && memories.isEmpty())
      return;
    available.entrySet().removeIf(entry -> locals.contains(entry.getValue()) || Value.localReads(entry.getKey()).stream().anyMatch(locals::contains) ||
                                           Value.stateReads(entry.getKey()).stream().anyMatch(memories::contains));
  }
}
