package syncc.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Right-hand side expressions of equations, as delivered by the (normalizing) front end.
 * All implementations are records, so equality is structural.
 */
public interface Expr {

  /** Direct sub-expressions, left to right. */
  List<Expr> children();

  /** Appends the variables this expression itself reads (not those of its children) to {@code out}. */
  default void collectOwnReads(List<String> out) {}

  /** Returns a copy where every variable read (including sampling clocks) is renamed. */
  Expr renameVars(UnaryOperator<String> renaming);

  /** All variable reads of the expression tree, left to right, with duplicates. */
  default List<String> reads() {
    ArrayList<String> ret = new ArrayList<>();
    collectReads(this, ret);
    return ret;
  }

  /** Whether this expression or one of its sub-expressions satisfies the predicate. */
  default boolean anyMatch(Predicate<Expr> pred) {
    if (pred.test(this))
      return true;
    return children().stream().anyMatch(child -> child.anyMatch(pred));
  }

  /** Visits this expression and all its sub-expressions, parents first. */
  default void forEachSubExpr(Consumer<Expr> visitor) {
    visitor.accept(this);
    for (Expr child : children())
      child.forEachSubExpr(visitor);
  }

  /**
   * Rewrites an expression whose variable reads all occur under {@code pre} into the expression that computes its
   * value for the next instant, i.e. {@code pre c + 1} becomes {@code c + 1}.
   * @param isVariable tells node variables from global constants
   * @return empty if a variable (or a sampling clock) is read in the current instant
   */
  public static Optional<Expr> advance(Expr expr, Predicate<String> isVariable) {
    if (expr instanceof Pre)
      return Optional.of(((Pre)expr).operand());
    if (expr instanceof Const)
      return Optional.of(expr);
    if (expr instanceof Var)
      return isVariable.test(((Var)expr).name()) ? Optional.empty() : Optional.of(expr);
    if (expr instanceof Apply) {
      ArrayList<Expr> args = new ArrayList<>();
      for (Expr arg : ((Apply)expr).args()) {
        Optional<Expr> advanced = advance(arg, isVariable);
        if (advanced.isEmpty())
          return Optional.empty();
        args.add(advanced.get());
      }
      return Optional.of(new Apply(((Apply)expr).op(), args));
    }
    if (expr instanceof Ite) {
      Ite ite = (Ite)expr;
      Optional<Expr> cond = advance(ite.cond(), isVariable);
      Optional<Expr> thenExpr = advance(ite.thenExpr(), isVariable);
      Optional<Expr> elseExpr = advance(ite.elseExpr(), isVariable);
      if (cond.isEmpty() || thenExpr.isEmpty() || elseExpr.isEmpty())
        return Optional.empty();
      return Optional.of(new Ite(cond.get(), thenExpr.get(), elseExpr.get()));
    }
    return Optional.empty();
  }

  private static void collectReads(Expr expr, List<String> out) {
    expr.collectOwnReads(out);
    for (Expr child : expr.children())
      collectReads(child, out);
  }

  public static record Const(Object value) implements Expr {
    public Const {
      Type.ofLiteral(value); // validates
    }
    @Override
    public List<Expr> children() { return List.of(); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) { return this; }
    @Override
    public String toString() { return String.valueOf(value); }
  }

  /** Reads a variable of the node, or a global constant when no such variable exists. */
  public static record Var(String name) implements Expr {
    @Override
    public List<Expr> children() { return List.of(); }
    @Override
    public void collectOwnReads(List<String> out) { out.add(name); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) { return new Var(renaming.apply(name)); }
    @Override
    public String toString() { return name; }
  }

  public static record Apply(Operator op, List<Expr> args) implements Expr {
    public Apply {
      args = List.copyOf(args);
      if (args.size() != op.arity)
        throw new IllegalArgumentException("Wrong operand count for " + op.name());
    }
    @Override
    public List<Expr> children() { return args; }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) {
      return new Apply(op, args.stream().map(arg -> arg.renameVars(renaming)).toList());
    }
    @Override
    public String toString() {
      if (op.arity == 1)
        return "(" + op.symbol + " " + args.get(0) + ")";
      return "(" + args.get(0) + " " + op.symbol + " " + args.get(1) + ")";
    }
  }

  public static record Ite(Expr cond, Expr thenExpr, Expr elseExpr) implements Expr {
    @Override
    public List<Expr> children() { return List.of(cond, thenExpr, elseExpr); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) {
      return new Ite(cond.renameVars(renaming), thenExpr.renameVars(renaming), elseExpr.renameVars(renaming));
    }
    @Override
    public String toString() { return "(if " + cond + " then " + thenExpr + " else " + elseExpr + ")"; }
  }

  /** Value of the operand at the previous activation; the type default before that. */
  public static record Pre(Expr operand) implements Expr {
    @Override
    public List<Expr> children() { return List.of(operand); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) { return new Pre(operand.renameVars(renaming)); }
    @Override
    public String toString() { return "(pre " + operand + ")"; }
  }

  /** Initialized delay, {@code init -> pre next}. */
  public static record Fby(Expr init, Expr next) implements Expr {
    @Override
    public List<Expr> children() { return List.of(init, next); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) { return new Fby(init.renameVars(renaming), next.renameVars(renaming)); }
    @Override
    public String toString() { return "(" + init + " fby " + next + ")"; }
  }

  /** {@code first} at the first activation of the equation, {@code rest} afterwards. */
  public static record Arrow(Expr first, Expr rest) implements Expr {
    @Override
    public List<Expr> children() { return List.of(first, rest); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) { return new Arrow(first.renameVars(renaming), rest.renameVars(renaming)); }
    @Override
    public String toString() { return "(" + first + " -> " + rest + ")"; }
  }

  public static record When(Expr operand, String clock, boolean polarity) implements Expr {
    @Override
    public List<Expr> children() { return List.of(operand); }
    @Override
    public void collectOwnReads(List<String> out) { out.add(clock); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) {
      return new When(operand.renameVars(renaming), renaming.apply(clock), polarity);
    }
    @Override
    public String toString() { return "(" + operand + (polarity ? " when " : " when not ") + clock + ")"; }
  }

  public static record Merge(String clock, Expr onTrue, Expr onFalse) implements Expr {
    @Override
    public List<Expr> children() { return List.of(onTrue, onFalse); }
    @Override
    public void collectOwnReads(List<String> out) { out.add(clock); }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) {
      return new Merge(renaming.apply(clock), onTrue.renameVars(renaming), onFalse.renameVars(renaming));
    }
    @Override
    public String toString() { return "merge " + clock + " (true -> " + onTrue + ") (false -> " + onFalse + ")"; }
  }

  /** Sub-node call; only valid as the whole right-hand side of an equation. */
  public static record Call(String node, List<Expr> args) implements Expr {
    public Call {
      args = List.copyOf(args);
    }
    @Override
    public List<Expr> children() { return args; }
    @Override
    public Expr renameVars(UnaryOperator<String> renaming) {
      return new Call(node, args.stream().map(arg -> arg.renameVars(renaming)).toList());
    }
    @Override
    public String toString() { return node + "(" + args.stream().map(Expr::toString).collect(Collectors.joining(", ")) + ")"; }
  }
}
