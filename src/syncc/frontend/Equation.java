package syncc.frontend;

import java.util.List;

/** {@code lhs = rhs}; several left-hand variables only for node calls. */
public record Equation(List<String> lhs, Expr rhs) {
  public Equation {
    lhs = List.copyOf(lhs);
    if (lhs.isEmpty())
      throw new IllegalArgumentException("Equation without left-hand side");
  }
  public Equation(String lhs, Expr rhs) { this(List.of(lhs), rhs); }

  @Override
  public String toString() {
    return (lhs.size() == 1 ? lhs.get(0) : "(" + String.join(", ", lhs) + ")") + " = " + rhs;
  }
}
