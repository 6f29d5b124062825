package syncc.frontend;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Built-in pure operators of the dataflow language, with their evaluation semantics on literal values
 * (Long for int, Double for real, Boolean for bool).
 */
public enum Operator {
  NEG("-", 1),
  NOT("not", 1),
  ADD("+", 2),
  SUB("-", 2),
  MUL("*", 2),
  DIV("/", 2),
  MOD("mod", 2),
  AND("and", 2),
  OR("or", 2),
  XOR("xor", 2),
  IMPL("=>", 2),
  EQ("=", 2),
  NEQ("<>", 2),
  LT("<", 2),
  LE("<=", 2),
  GT(">", 2),
  GE(">=", 2);

  public final String symbol;
  public final int arity;

  private Operator(String symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public static Optional<Operator> fromSymbol(String symbol, int arity) {
    return Stream.of(Operator.values()).filter(op -> op.symbol.equals(symbol) && op.arity == arity).findAny();
  }

  /** Whether the result of this operator is a boolean, regardless of the operand types. */
  public boolean isPredicate() {
    switch (this) {
    case NOT:
    case AND:
    case OR:
    case XOR:
    case IMPL:
    case EQ:
    case NEQ:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }

  /**
   * Evaluates the operator.
   * @param args literal operands, {@link #arity} of them
   * @return the literal result
   * @throws ArithmeticException on integer division by zero
   * @throws IllegalArgumentException if the operands do not fit the operator
   */
  public Object apply(List<Object> args) {
    if (args.size() != arity)
      throw new IllegalArgumentException(String.format("Operator %s expects %d operands, got %d", name(), arity, args.size()));
    Object a = args.get(0);
    Object b = arity > 1 ? args.get(1) : null;
    switch (this) {
    case NEG:
      if (a instanceof Long)
        return -(Long)a;
      return -asDouble(a);
    case NOT:
      return !asBool(a);
    case AND:
      return asBool(a) && asBool(b);
    case OR:
      return asBool(a) || asBool(b);
    case XOR:
      return asBool(a) ^ asBool(b);
    case IMPL:
      return !asBool(a) || asBool(b);
    case EQ:
      return compare(a, b) == 0;
    case NEQ:
      return compare(a, b) != 0;
    case LT:
      return compare(a, b) < 0;
    case LE:
      return compare(a, b) <= 0;
    case GT:
      return compare(a, b) > 0;
    case GE:
      return compare(a, b) >= 0;
    default:
      break;
    }
    if (a instanceof Long && b instanceof Long) {
      long x = (Long)a, y = (Long)b;
      switch (this) {
      case ADD:
        return x + y;
      case SUB:
        return x - y;
      case MUL:
        return x * y;
      case DIV:
        return x / y;
      case MOD:
        return x % y;
      default:
        break;
      }
    } else {
      double x = asDouble(a), y = asDouble(b);
      switch (this) {
      case ADD:
        return x + y;
      case SUB:
        return x - y;
      case MUL:
        return x * y;
      case DIV:
        return x / y;
      case MOD:
        return x % y;
      default:
        break;
      }
    }
    throw new IllegalArgumentException("Unsupported operands for " + name() + ": " + args);
  }

  private static boolean asBool(Object value) {
    if (!(value instanceof Boolean))
      throw new IllegalArgumentException("Expected a bool operand, got " + value);
    return (Boolean)value;
  }
  private static double asDouble(Object value) {
    if (value instanceof Long)
      return ((Long)value).doubleValue();
    if (value instanceof Double)
      return (Double)value;
    throw new IllegalArgumentException("Expected a numeric operand, got " + value);
  }
  private static int compare(Object a, Object b) {
    if (a instanceof Boolean && b instanceof Boolean)
      return Boolean.compare((Boolean)a, (Boolean)b);
    if (a instanceof Long && b instanceof Long)
      return Long.compare((Long)a, (Long)b);
    return Double.compare(asDouble(a), asDouble(b));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
