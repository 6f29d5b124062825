package syncc.machine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import syncc.frontend.Operator;

/**
 * Pure expressions of machine instructions. Implementations are records: equality is structural.
 */
public interface Value {

  List<Value> children();

  /** Rebuilds this value with the given children (same count and order as {@link #children()}). */
  Value withChildren(List<Value> newChildren);

  /** Whether this value is a leaf (literal or reference). */
  default boolean isAtomic() { return children().isEmpty() && !(this instanceof Apply); }

  public static record Literal(Object value) implements Value {
    @Override
    public List<Value> children() { return List.of(); }
    @Override
    public Value withChildren(List<Value> newChildren) { return this; }
    @Override
    public String toString() { return String.valueOf(value); }
  }

  /** Input, output or local variable of the step procedure. */
  public static record LocalRef(String name) implements Value {
    @Override
    public List<Value> children() { return List.of(); }
    @Override
    public Value withChildren(List<Value> newChildren) { return this; }
    @Override
    public String toString() { return name; }
  }

  /** Memory cell of the machine. */
  public static record StateRef(String name) implements Value {
    @Override
    public List<Value> children() { return List.of(); }
    @Override
    public Value withChildren(List<Value> newChildren) { return this; }
    @Override
    public String toString() { return "self." + name; }
  }

  /** Global constant, replaced by its literal during constant unfolding. */
  public static record ConstRef(String name) implements Value {
    @Override
    public List<Value> children() { return List.of(); }
    @Override
    public Value withChildren(List<Value> newChildren) { return this; }
    @Override
    public String toString() { return name; }
  }

  public static record Apply(Operator op, List<Value> args) implements Value {
    public Apply {
      args = List.copyOf(args);
    }
    @Override
    public List<Value> children() { return args; }
    @Override
    public Value withChildren(List<Value> newChildren) { return new Apply(op, newChildren); }
    @Override
    public String toString() {
      if (op.arity == 1)
        return "(" + op.symbol + " " + args.get(0) + ")";
      return "(" + args.stream().map(Value::toString).collect(Collectors.joining(" " + op.symbol + " ")) + ")";
    }
  }

  /** Strict conditional: all operands are evaluated. */
  public static record Cond(Value cond, Value thenValue, Value elseValue) implements Value {
    @Override
    public List<Value> children() { return List.of(cond, thenValue, elseValue); }
    @Override
    public Value withChildren(List<Value> newChildren) { return new Cond(newChildren.get(0), newChildren.get(1), newChildren.get(2)); }
    @Override
    public String toString() { return "(if " + cond + " then " + thenValue + " else " + elseValue + ")"; }
  }

  /**
   * Rewrites a value top-down: where {@code replacement} returns non-null, that result is used as is; otherwise the
   * children are rewritten.
   */
  public static Value rewrite(Value value, Function<Value, Value> replacement) {
    Value replaced = replacement.apply(value);
    if (replaced != null)
      return replaced;
    List<Value> children = value.children();
    if (children.isEmpty())
      return value;
    ArrayList<Value> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (Value child : children) {
      Value newChild = rewrite(child, replacement);
      changed |= newChild != child;
      newChildren.add(newChild);
    }
    return changed ? value.withChildren(newChildren) : value;
  }

  /** Names of the step variables read by the value, with duplicates. */
  public static List<String> localReads(Value value) {
    ArrayList<String> ret = new ArrayList<>();
    collect(value, ret, LocalRef.class);
    return ret;
  }

  /** Names of the memory cells read by the value, with duplicates. */
  public static List<String> stateReads(Value value) {
    ArrayList<String> ret = new ArrayList<>();
    collect(value, ret, StateRef.class);
    return ret;
  }

  private static void collect(Value value, List<String> out, Class<?> refClass) {
    if (refClass.isInstance(value))
      out.add(value instanceof LocalRef ? ((LocalRef)value).name() : ((StateRef)value).name());
    for (Value child : value.children())
      collect(child, out, refClass);
  }
}
