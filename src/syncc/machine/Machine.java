package syncc.machine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import syncc.frontend.VarDecl;

/**
 * Transition system of one node: memory cells, a reset procedure, a step procedure and the sub-instances the step
 * calls. Immutable; optimizer passes create modified copies through the {@code with*} methods.
 */
public class Machine {
  /**
   * A sub-node instance.
   * @param callee name of the called node
   * @param machineIndex index of the callee's machine in the {@link MachineTable}
   */
  public static record Instance(String callee, int machineIndex) {}

  private final String name;
  private final boolean declaredStateless;
  private final boolean stateful;
  private final boolean interfaceOnly;
  private final List<VarDecl> inputs;
  private final List<VarDecl> outputs;
  private final List<VarDecl> locals;
  private final List<MemoryCell> memories;
  private final Map<String, Instance> instances;
  private final List<Instruction> reset;
  private final List<Instruction> step;
  private final List<Value> assertions;
  private final Map<String, String> aliases;

  public Machine(String name, boolean declaredStateless, boolean stateful, boolean interfaceOnly, List<VarDecl> inputs, List<VarDecl> outputs,
                 List<VarDecl> locals, List<MemoryCell> memories, Map<String, Instance> instances, List<Instruction> reset,
                 List<Instruction> step, List<Value> assertions, Map<String, String> aliases) {
    this.name = name;
    this.declaredStateless = declaredStateless;
    this.stateful = stateful;
    this.interfaceOnly = interfaceOnly;
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
    this.locals = List.copyOf(locals);
    this.memories = List.copyOf(memories);
    this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
    this.reset = List.copyOf(reset);
    this.step = List.copyOf(step);
    this.assertions = List.copyOf(assertions);
    this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
  }

  /** Machine of an imported node: only the interface is known, there are no procedures. */
  public static Machine interfaceOnly(String name, boolean stateless, List<VarDecl> inputs, List<VarDecl> outputs) {
    return new Machine(name, stateless, !stateless, true, inputs, outputs, List.of(), List.of(), Map.of(), List.of(), List.of(), List.of(), Map.of());
  }

  public String getName() { return name; }
  /** Whether the node was declared as a function. */
  public boolean isDeclaredStateless() { return declaredStateless; }
  /** Whether the machine owns memory, directly or through a stateful instance. */
  public boolean isStateful() { return stateful; }
  /** Whether this is the machine of an imported node, with no reset or step body. */
  public boolean isInterfaceOnly() { return interfaceOnly; }
  public List<VarDecl> getInputs() { return inputs; }
  public List<VarDecl> getOutputs() { return outputs; }
  public List<VarDecl> getLocals() { return locals; }
  public List<MemoryCell> getMemories() { return memories; }
  public Map<String, Instance> getInstances() { return instances; }
  public List<Instruction> getReset() { return reset; }
  public List<Instruction> getStep() { return step; }
  public List<Value> getAssertions() { return assertions; }
  /** Locals that were merged into the slot of another local, mapped to that slot. */
  public Map<String, String> getAliases() { return aliases; }

  public Optional<VarDecl> lookupStepVariable(String varName) {
    for (List<VarDecl> vars : List.of(inputs, outputs, locals)) {
      for (VarDecl var : vars) {
        if (var.name().equals(varName))
          return Optional.of(var);
      }
    }
    return Optional.empty();
  }
  public Optional<MemoryCell> lookupMemory(String cellName) {
    return memories.stream().filter(cell -> cell.name().equals(cellName)).findFirst();
  }

  public Machine withStep(List<Instruction> newStep) {
    return new Machine(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, locals, memories, instances, reset, newStep, assertions, aliases);
  }
  public Machine withLocals(List<VarDecl> newLocals) {
    return new Machine(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, newLocals, memories, instances, reset, step, assertions, aliases);
  }
  public Machine withMemories(List<MemoryCell> newMemories, List<Instruction> newReset) {
    return new Machine(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, locals, newMemories, instances, newReset, step, assertions, aliases);
  }
  public Machine withAssertions(List<Value> newAssertions) {
    return new Machine(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, locals, memories, instances, reset, step, newAssertions, aliases);
  }
  public Machine withAliases(Map<String, String> newAliases) {
    return new Machine(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, locals, memories, instances, reset, step, assertions, newAliases);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, declaredStateless, stateful, interfaceOnly, inputs, outputs, locals, memories, instances, reset, step, assertions, aliases);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Machine other = (Machine)obj;
    return name.equals(other.name) && declaredStateless == other.declaredStateless && stateful == other.stateful &&
        interfaceOnly == other.interfaceOnly && inputs.equals(other.inputs) && outputs.equals(other.outputs) && locals.equals(other.locals) &&
        memories.equals(other.memories) && instances.equals(other.instances) && reset.equals(other.reset) && step.equals(other.step) &&
        assertions.equals(other.assertions) && aliases.equals(other.aliases);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("machine ").append(name).append(interfaceOnly ? " (imported)" : "").append(stateful ? "" : " (stateless)").append('\n');
    for (MemoryCell cell : memories)
      sb.append("  mem ").append(cell).append('\n');
    instances.forEach((instName, inst) -> sb.append("  inst ").append(instName).append(": ").append(inst.callee()).append('\n'));
    sb.append("  reset\n");
    Instruction.print(reset, "    ", sb);
    sb.append("  step (").append(String.join(", ", inputs.stream().map(VarDecl::toString).toList())).append(") returns (");
    sb.append(String.join(", ", outputs.stream().map(VarDecl::toString).toList())).append(")\n");
    for (VarDecl var : locals)
      sb.append("    var ").append(var).append('\n');
    Instruction.print(step, "    ", sb);
    for (Value assertion : assertions)
      sb.append("  assert ").append(assertion).append('\n');
    aliases.forEach((local, slot) -> sb.append("  slot ").append(local).append(" -> ").append(slot).append('\n'));
    return sb.toString();
  }
}
