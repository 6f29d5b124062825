package syncc.machine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Statements of the reset and step procedures of a {@link Machine}.
 */
public interface Instruction {

  /** Values evaluated by this instruction itself (for a branch: only the guard). */
  List<Value> values();

  /** Returns a copy with every directly evaluated value rewritten. Branch bodies are rewritten as well. */
  Instruction mapValues(UnaryOperator<Value> mapper);

  /** Step variables written by this instruction itself (not inside branch bodies). */
  default List<String> definedLocals() { return List.of(); }

  public static record Assign(String var, Value value) implements Instruction {
    @Override
    public List<Value> values() { return List.of(value); }
    @Override
    public Instruction mapValues(UnaryOperator<Value> mapper) { return new Assign(var, mapper.apply(value)); }
    @Override
    public List<String> definedLocals() { return List.of(var); }
    @Override
    public String toString() { return var + " := " + value; }
  }

  public static record StateAssign(String memory, Value value) implements Instruction {
    @Override
    public List<Value> values() { return List.of(value); }
    @Override
    public Instruction mapValues(UnaryOperator<Value> mapper) { return new StateAssign(memory, mapper.apply(value)); }
    @Override
    public String toString() { return "self." + memory + " := " + value; }
  }

  /** Executes {@code onTrue} if the guard holds, {@code onFalse} otherwise. */
  public static record Branch(Value guard, List<Instruction> onTrue, List<Instruction> onFalse) implements Instruction {
    public Branch {
      onTrue = List.copyOf(onTrue);
      onFalse = List.copyOf(onFalse);
    }
    @Override
    public List<Value> values() { return List.of(guard); }
    @Override
    public Instruction mapValues(UnaryOperator<Value> mapper) {
      return new Branch(mapper.apply(guard), mapAll(onTrue, mapper), mapAll(onFalse, mapper));
    }
    @Override
    public String toString() { return "if " + guard + " { " + onTrue.size() + " } else { " + onFalse.size() + " }"; }
  }

  /** Runs one step of a sub-instance and stores its outputs. */
  public static record StepCall(String instance, List<Value> args, List<String> outputs) implements Instruction {
    public StepCall {
      args = List.copyOf(args);
      outputs = List.copyOf(outputs);
    }
    @Override
    public List<Value> values() { return args; }
    @Override
    public Instruction mapValues(UnaryOperator<Value> mapper) { return new StepCall(instance, args.stream().map(mapper).toList(), outputs); }
    @Override
    public List<String> definedLocals() { return outputs; }
    @Override
    public String toString() {
      return "(" + String.join(", ", outputs) + ") := " + instance + ".step(" + args.stream().map(Value::toString).collect(Collectors.joining(", ")) + ")";
    }
  }

  public static record ResetCall(String instance) implements Instruction {
    @Override
    public List<Value> values() { return List.of(); }
    @Override
    public Instruction mapValues(UnaryOperator<Value> mapper) { return this; }
    @Override
    public String toString() { return instance + ".reset()"; }
  }

  public static List<Instruction> mapAll(List<Instruction> instrs, UnaryOperator<Value> mapper) {
    return instrs.stream().map(instr -> instr.mapValues(mapper)).toList();
  }

  /** Every instruction of the sequence in execution order, branch bodies flattened in (true list before false list). */
  public static List<Instruction> flatten(List<Instruction> instrs) {
    ArrayList<Instruction> ret = new ArrayList<>();
    flattenInto(instrs, ret);
    return ret;
  }
  private static void flattenInto(List<Instruction> instrs, List<Instruction> out) {
    for (Instruction instr : instrs) {
      out.add(instr);
      if (instr instanceof Branch) {
        flattenInto(((Branch)instr).onTrue(), out);
        flattenInto(((Branch)instr).onFalse(), out);
      }
    }
  }

  /** Step variables written by the sequence, branch bodies included. */
  public static Set<String> writtenLocals(List<Instruction> instrs) {
    HashSet<String> ret = new HashSet<>();
    for (Instruction instr : flatten(instrs))
      ret.addAll(instr.definedLocals());
    return ret;
  }

  /** Memory cells written by the sequence, branch bodies included. */
  public static Set<String> writtenMemories(List<Instruction> instrs) {
    HashSet<String> ret = new HashSet<>();
    for (Instruction instr : flatten(instrs)) {
      if (instr instanceof StateAssign)
        ret.add(((StateAssign)instr).memory());
    }
    return ret;
  }

  /** Whether executing the sequence may change the result of evaluating {@code value}. */
  public static boolean writesAnyOperand(List<Instruction> instrs, Value value) {
    Set<String> locals = writtenLocals(instrs);
    if (Value.localReads(value).stream().anyMatch(locals::contains))
      return true;
    Set<String> cells = writtenMemories(instrs);
    return Value.stateReads(value).stream().anyMatch(cells::contains);
  }

  /**
   * Joins adjacent branches on the same guard, recursively. Two branches are only joined if the first one does not
   * write a variable its guard reads.
   */
  public static List<Instruction> joinAdjacentBranches(List<Instruction> instrs) {
    ArrayList<Instruction> ret = new ArrayList<>();
    for (Instruction instr : instrs) {
      if (instr instanceof Branch && !ret.isEmpty() && ret.get(ret.size() - 1) instanceof Branch) {
        Branch prev = (Branch)ret.get(ret.size() - 1);
        Branch cur = (Branch)instr;
        if (prev.guard().equals(cur.guard()) && !writesAnyOperand(List.of(prev), prev.guard())) {
          ArrayList<Instruction> onTrue = new ArrayList<>(prev.onTrue());
          onTrue.addAll(cur.onTrue());
          ArrayList<Instruction> onFalse = new ArrayList<>(prev.onFalse());
          onFalse.addAll(cur.onFalse());
          ret.set(ret.size() - 1, new Branch(prev.guard(), onTrue, onFalse));
          continue;
        }
      }
      ret.add(instr);
    }
    for (int i = 0; i < ret.size(); ++i) {
      if (ret.get(i) instanceof Branch) {
        Branch branch = (Branch)ret.get(i);
        ret.set(i, new Branch(branch.guard(), joinAdjacentBranches(branch.onTrue()), joinAdjacentBranches(branch.onFalse())));
      }
    }
    return ret;
  }

  /** Pretty prints an instruction sequence, one instruction per line. */
  public static void print(List<Instruction> instrs, String indent, StringBuilder sb) {
    for (Instruction instr : instrs) {
      if (instr instanceof Branch) {
        Branch branch = (Branch)instr;
        sb.append(indent).append("if ").append(branch.guard()).append(" {\n");
        print(branch.onTrue(), indent + "  ", sb);
        if (!branch.onFalse().isEmpty()) {
          sb.append(indent).append("} else {\n");
          print(branch.onFalse(), indent + "  ", sb);
        }
        sb.append(indent).append("}\n");
      } else
        sb.append(indent).append(instr).append('\n');
    }
  }
}
