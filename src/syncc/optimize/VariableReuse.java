package syncc.optimize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.frontend.Type;
import syncc.frontend.VarDecl;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.Value;

/**
 * Lets locals of the same type share a storage slot when their live ranges over the linearized step do not overlap.
 * Inputs, outputs and memories never share.
 */
public class VariableReuse implements MachinePass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Live range of a local as positions in {@link Instruction#flatten(List)} of the step.
   * @param def position of the first write
   * @param lastUse position of the last read or write (the step length for reads in assertions)
   */
  public static record LiveRange(String var, Type type, int def, int lastUse) {}

  @Override
  public String getName() {
    return "variable reuse";
  }
  @Override
  public int getMinLevel() {
    return 3;
  }

  /** Live ranges of the written locals of the machine, ordered by first write. */
  public static List<LiveRange> liveRanges(Machine machine) {
    List<Instruction> flat = Instruction.flatten(machine.getStep());
    HashMap<String, Integer> firstDef = new HashMap<>();
    HashMap<String, Integer> lastUse = new HashMap<>();
    for (int pos = 0; pos < flat.size(); ++pos) {
      Instruction instr = flat.get(pos);
      for (Value value : instr.values()) {
        for (String var : Value.localReads(value))
          lastUse.merge(var, pos, Math::max);
      }
      // every write keeps the local live, so two outputs of one call never share a slot
      for (String var : instr.definedLocals()) {
        firstDef.putIfAbsent(var, pos);
        lastUse.merge(var, pos, Math::max);
      }
    }
    for (Value assertion : machine.getAssertions()) {
      for (String var : Value.localReads(assertion))
        lastUse.put(var, flat.size());
    }
    ArrayList<LiveRange> ret = new ArrayList<>();
    for (VarDecl local : machine.getLocals()) {
      Integer def = firstDef.get(local.name());
      if (def == null)
        continue;
      ret.add(new LiveRange(local.name(), local.type(), def, Math.max(def, lastUse.getOrDefault(local.name(), def))));
    }
    ret.sort(Comparator.comparingInt(LiveRange::def));
    return ret;
  }

  /**
   * Greedy linear scan over the live ranges: each local takes the first slot of its type whose current occupant is
   * dead before the local is written.
   * @return the locals that share another local's slot, mapped to that local
   */
  public static Map<String, String> computeSlots(Machine machine) {
    class Slot {
      final String owner;
      final Type type;
      int end;
      Slot(LiveRange range) {
        this.owner = range.var();
        this.type = range.type();
        this.end = range.lastUse();
      }
    }
    ArrayList<Slot> slots = new ArrayList<>();
    LinkedHashMap<String, String> ret = new LinkedHashMap<>();
    for (LiveRange range : liveRanges(machine)) {
      Slot free = slots.stream().filter(slot -> slot.type == range.type() && slot.end < range.def()).findFirst().orElse(null);
      if (free == null) {
        slots.add(new Slot(range));
        continue;
      }
      ret.put(range.var(), free.owner);
      free.end = Math.max(free.end, range.lastUse());
    }
    return ret;
  }

  @Override
  public Machine apply(Machine machine) {
    if (machine.isInterfaceOnly())
      return machine;
    Map<String, String> slots = computeSlots(machine);
    if (slots.isEmpty())
      return machine;
    logger.debug("Slot reuse in {}: {}", machine.getName(), slots);
    List<Instruction> step = rename(machine.getStep(), slots);
    List<Value> assertions = machine.getAssertions().stream().map(value -> renameValue(value, slots)).toList();
    List<VarDecl> locals = machine.getLocals().stream().filter(var -> !slots.containsKey(var.name())).toList();
    LinkedHashMap<String, String> aliases = new LinkedHashMap<>();
    machine.getAliases().forEach((var, slot) -> aliases.put(var, slots.getOrDefault(slot, slot)));
    aliases.putAll(slots);
    return machine.withStep(step).withAssertions(assertions).withLocals(locals).withAliases(aliases);
  }

  private static Value renameValue(Value value, Map<String, String> slots) {
    return Value.rewrite(value, sub -> {
      if (sub instanceof Value.LocalRef && slots.containsKey(((Value.LocalRef)sub).name()))
        return new Value.LocalRef(slots.get(((Value.LocalRef)sub).name()));
      return null;
    });
  }

  private static List<Instruction> rename(List<Instruction> instrs, Map<String, String> slots) {
    ArrayList<Instruction> ret = new ArrayList<>();
    for (Instruction instr : instrs) {
      if (instr instanceof Instruction.Assign) {
        Instruction.Assign assign = (Instruction.Assign)instr;
        ret.add(new Instruction.Assign(slots.getOrDefault(assign.var(), assign.var()), renameValue(assign.value(), slots)));
      } else if (instr instanceof Instruction.StepCall) {
        Instruction.StepCall call = (Instruction.StepCall)instr;
        ret.add(new Instruction.StepCall(call.instance(), call.args().stream().map(arg -> renameValue(arg, slots)).toList(),
                                         call.outputs().stream().map(out -> slots.getOrDefault(out, out)).toList()));
      } else if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        ret.add(new Instruction.Branch(renameValue(branch.guard(), slots), rename(branch.onTrue(), slots), rename(branch.onFalse(), slots)));
      } else
        ret.add(instr.mapValues(value -> renameValue(value, slots)));
    }
    return ret;
  }
}
