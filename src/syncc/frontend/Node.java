package syncc.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A dataflow node: interface (inputs, outputs), locals, memories, equations and assertions.
 * Immutable; rewrites create new instances.
 */
public class Node {
  private final String name;
  private final boolean stateless;
  private final List<VarDecl> inputs;
  private final List<VarDecl> outputs;
  private final List<VarDecl> locals;
  private final List<VarDecl> memories;
  private final List<Equation> equations;
  private final List<Expr> assertions;

  /** Variables by name, with their index in declaration order. */
  private final HashMap<String, Integer> declIndex = new HashMap<>();
  private final List<VarDecl> allVars;

  public Node(String name, boolean stateless, List<VarDecl> inputs, List<VarDecl> outputs, List<VarDecl> locals, List<VarDecl> memories,
              List<Equation> equations, List<Expr> assertions) {
    this.name = name;
    this.stateless = stateless;
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
    this.locals = List.copyOf(locals);
    this.memories = List.copyOf(memories);
    this.equations = List.copyOf(equations);
    this.assertions = List.copyOf(assertions);
    this.allVars = Stream.of(this.inputs, this.outputs, this.locals, this.memories).flatMap(List::stream).toList();
    for (int i = 0; i < allVars.size(); ++i) {
      if (declIndex.putIfAbsent(allVars.get(i).name(), i) != null)
        throw new IllegalArgumentException(String.format("Node %s declares variable %s twice", name, allVars.get(i).name()));
    }
  }

  public String getName() { return name; }
  /** Whether the node is declared as a function, i.e. must not hold state. */
  public boolean isStateless() { return stateless; }
  public List<VarDecl> getInputs() { return inputs; }
  public List<VarDecl> getOutputs() { return outputs; }
  public List<VarDecl> getLocals() { return locals; }
  public List<VarDecl> getMemories() { return memories; }
  public List<Equation> getEquations() { return equations; }
  public List<Expr> getAssertions() { return assertions; }

  /** All variables in declaration order: inputs, outputs, locals, memories. */
  public List<VarDecl> getAllVariables() { return allVars; }

  public Optional<VarDecl> lookupVariable(String varName) {
    Integer idx = declIndex.get(varName);
    return idx == null ? Optional.empty() : Optional.of(allVars.get(idx));
  }
  public boolean hasVariable(String varName) { return declIndex.containsKey(varName); }
  public boolean isMemory(String varName) { return lookupVariable(varName).map(VarDecl::isMemory).orElse(false); }

  /**
   * Position of a variable in declaration order; used as the deterministic tie-break throughout scheduling.
   * Unknown names sort last.
   */
  public int declarationIndex(String varName) { return declIndex.getOrDefault(varName, Integer.MAX_VALUE); }

  /** Returns a copy with the given equations, in that order. */
  public Node withEquations(List<Equation> newEquations) {
    return new Node(name, stateless, inputs, outputs, locals, memories, newEquations, assertions);
  }

  /** Returns a copy with an additional local variable and its defining equation (appended). */
  public Node withAddedLocal(VarDecl local, Equation definition) {
    ArrayList<VarDecl> newLocals = new ArrayList<>(locals);
    newLocals.add(local);
    ArrayList<Equation> newEquations = new ArrayList<>(equations);
    newEquations.add(definition);
    return new Node(name, stateless, inputs, outputs, newLocals, memories, newEquations, assertions);
  }

  /** Returns a fresh variable name based on {@code base} that this node does not declare yet. */
  public String freshName(String base) {
    if (!hasVariable(base))
      return base;
    for (int i = 1;; ++i) {
      String candidate = base + "_" + i;
      if (!hasVariable(candidate))
        return candidate;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(stateless ? "function " : "node ").append(name);
    sb.append(" (").append(String.join("; ", inputs.stream().map(VarDecl::toString).toList())).append(")");
    sb.append(" returns (").append(String.join("; ", outputs.stream().map(VarDecl::toString).toList())).append(")\n");
    for (VarDecl var : locals)
      sb.append("  var ").append(var).append('\n');
    for (VarDecl var : memories)
      sb.append("  mem ").append(var).append('\n');
    for (Equation eq : equations)
      sb.append("  ").append(eq).append('\n');
    for (Expr assertion : assertions)
      sb.append("  assert ").append(assertion).append('\n');
    return sb.toString();
  }

  public static List<String> names(List<VarDecl> vars) { return vars.stream().map(VarDecl::name).toList(); }
}
