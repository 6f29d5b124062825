package syncc.testutil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import syncc.frontend.VarDecl;
import syncc.machine.Instruction;
import syncc.machine.Machine;
import syncc.machine.MachineTable;
import syncc.machine.Value;

/**
 * Executes machines directly, one object per instance. Locals start out unassigned in every step, so a read before
 * the corresponding write fails instead of returning a stale value.
 */
public class MachineInterpreter {
  private final MachineTable table;
  private final Machine machine;
  private final Map<String, Object> constants;
  private final HashMap<String, Object> cells = new HashMap<>();
  private final HashMap<String, MachineInterpreter> instances = new HashMap<>();
  private HashMap<String, Object> env = new HashMap<>();
  private final List<Boolean> assertionResults = new ArrayList<>();

  public MachineInterpreter(MachineTable table, Machine machine, Map<String, Object> constants) {
    if (machine.isInterfaceOnly())
      throw new IllegalArgumentException("Cannot execute imported machine " + machine.getName());
    this.table = table;
    this.machine = machine;
    this.constants = constants;
    for (String instance : machine.getInstances().keySet())
      instances.put(instance, new MachineInterpreter(table, table.instanceMachine(machine, instance), constants));
  }

  public Machine getMachine() { return machine; }

  public void reset() {
    env = new HashMap<>();
    execute(machine.getReset());
  }

  /** Runs one step; returns the outputs by name. */
  public Map<String, Object> step(Map<String, Object> inputs) {
    env = new HashMap<>();
    for (VarDecl input : machine.getInputs()) {
      if (!inputs.containsKey(input.name()))
        throw new IllegalArgumentException("Missing input " + input.name() + " of " + machine.getName());
      env.put(input.name(), inputs.get(input.name()));
    }
    execute(machine.getStep());
    assertionResults.clear();
    for (Value assertion : machine.getAssertions())
      assertionResults.add((Boolean)eval(assertion));
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    for (VarDecl output : machine.getOutputs())
      ret.put(output.name(), env.get(output.name()));
    return ret;
  }

  public Object getCell(String name) {
    if (!cells.containsKey(name))
      throw new IllegalStateException("Memory " + name + " of " + machine.getName() + " is not initialized");
    return cells.get(name);
  }

  public MachineInterpreter getInstance(String name) { return instances.get(name); }

  /** Results of the assertions in the last step. */
  public List<Boolean> getAssertionResults() { return assertionResults; }

  private void execute(List<Instruction> instrs) {
    for (Instruction instr : instrs) {
      if (instr instanceof Instruction.Assign) {
        Instruction.Assign assign = (Instruction.Assign)instr;
        env.put(assign.var(), eval(assign.value()));
      } else if (instr instanceof Instruction.StateAssign) {
        Instruction.StateAssign assign = (Instruction.StateAssign)instr;
        cells.put(assign.memory(), eval(assign.value()));
      } else if (instr instanceof Instruction.Branch) {
        Instruction.Branch branch = (Instruction.Branch)instr;
        execute((Boolean)eval(branch.guard()) ? branch.onTrue() : branch.onFalse());
      } else if (instr instanceof Instruction.StepCall) {
        Instruction.StepCall call = (Instruction.StepCall)instr;
        MachineInterpreter inst = instances.get(call.instance());
        HashMap<String, Object> args = new HashMap<>();
        for (int i = 0; i < call.args().size(); ++i)
          args.put(inst.machine.getInputs().get(i).name(), eval(call.args().get(i)));
        Map<String, Object> results = inst.step(args);
        for (int i = 0; i < call.outputs().size(); ++i)
          env.put(call.outputs().get(i), results.get(inst.machine.getOutputs().get(i).name()));
      } else if (instr instanceof Instruction.ResetCall) {
        instances.get(((Instruction.ResetCall)instr).instance()).reset();
      } else {
        throw new IllegalArgumentException("Unknown instruction " + instr);
      }
    }
  }

  private Object eval(Value value) {
    if (value instanceof Value.Literal)
      return ((Value.Literal)value).value();
    if (value instanceof Value.LocalRef) {
      String name = ((Value.LocalRef)value).name();
      if (!env.containsKey(name))
        throw new IllegalStateException("Read of unassigned variable " + name + " in " + machine.getName());
      return env.get(name);
    }
    if (value instanceof Value.StateRef)
      return getCell(((Value.StateRef)value).name());
    if (value instanceof Value.ConstRef) {
      String name = ((Value.ConstRef)value).name();
      if (!constants.containsKey(name))
        throw new IllegalStateException("Unknown constant " + name);
      return constants.get(name);
    }
    if (value instanceof Value.Apply) {
      Value.Apply apply = (Value.Apply)value;
      return apply.op().apply(apply.args().stream().map(this::eval).toList());
    }
    if (value instanceof Value.Cond) {
      Value.Cond cond = (Value.Cond)value;
      return (Boolean)eval(cond.cond()) ? eval(cond.thenValue()) : eval(cond.elseValue());
    }
    throw new IllegalArgumentException("Unknown value " + value);
  }
}
