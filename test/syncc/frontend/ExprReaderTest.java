package syncc.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import syncc.error.ProgramFormatException;

class ExprReaderTest {

  private static Expr var(String name) { return new Expr.Var(name); }
  private static Expr lit(long value) { return new Expr.Const(value); }

  @Test
  void testPrecedence() throws ProgramFormatException {
    Assertions.assertEquals(new Expr.Apply(Operator.ADD, List.of(var("a"), new Expr.Apply(Operator.MUL, List.of(var("b"), var("c"))))),
                            ExprReader.readExpr("a + b * c"));
    Assertions.assertEquals(new Expr.Apply(Operator.SUB, List.of(new Expr.Apply(Operator.SUB, List.of(var("a"), var("b"))), var("c"))),
                            ExprReader.readExpr("a - b - c"));
    Assertions.assertEquals(new Expr.Apply(Operator.OR, List.of(new Expr.Apply(Operator.LT, List.of(var("a"), var("b"))),
                                                                new Expr.Apply(Operator.NOT, List.of(var("d"))))),
                            ExprReader.readExpr("a < b or not d"));
  }

  @Test
  void testDelays() throws ProgramFormatException {
    Assertions.assertEquals(new Expr.Arrow(lit(0), new Expr.Pre(new Expr.Apply(Operator.ADD, List.of(var("c"), lit(1))))),
                            ExprReader.readExpr("0 -> pre (c + 1)"));
    Assertions.assertEquals(new Expr.Fby(lit(0), new Expr.Apply(Operator.ADD, List.of(var("c"), lit(1)))), ExprReader.readExpr("0 fby c + 1"));
    // right associative
    Assertions.assertEquals(new Expr.Arrow(lit(1), new Expr.Arrow(lit(2), var("x"))), ExprReader.readExpr("1 -> 2 -> x"));
  }

  @Test
  void testClocks() throws ProgramFormatException {
    Assertions.assertEquals(new Expr.When(var("x"), "c", false), ExprReader.readExpr("x when not c"));
    Assertions.assertEquals(new Expr.Merge("c", var("a"), new Expr.When(lit(0), "c", false)),
                            ExprReader.readExpr("merge c (true -> a) (false -> 0 when not c)"));
    Assertions.assertEquals(new Expr.Ite(var("c"), lit(1), lit(-2)), ExprReader.readExpr("if c then 1 else -2"));
  }

  @Test
  void testLiterals() throws ProgramFormatException {
    Assertions.assertEquals(lit(-3), ExprReader.readExpr("-3"));
    Assertions.assertEquals(new Expr.Const(2.5), ExprReader.readExpr("2.5"));
    Assertions.assertEquals(new Expr.Const(true), ExprReader.readExpr("true"));
    Assertions.assertEquals(new Expr.Apply(Operator.NEG, List.of(var("x"))), ExprReader.readExpr("-x"));
  }

  @Test
  void testEquations() throws ProgramFormatException {
    Equation call = ExprReader.readEquation("(a, b) = f(x, 1)");
    Assertions.assertEquals(List.of("a", "b"), call.lhs());
    Assertions.assertEquals(new Expr.Call("f", List.of(var("x"), lit(1))), call.rhs());

    Equation simple = ExprReader.readEquation("y = x");
    Assertions.assertEquals(new Equation("y", var("x")), simple);
  }

  @ParameterizedTest
  @ValueSource(strings = {"a +", "a $ b", "(a", "merge c (true -> a)", "if c then 1", "99999999999999999999"})
  void testMalformedExpression(String text) {
    Assertions.assertThrows(ProgramFormatException.class, () -> ExprReader.readExpr(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"x = ", "= x", "(a, b = f(x)", "1 = x"})
  void testMalformedEquation(String text) {
    Assertions.assertThrows(ProgramFormatException.class, () -> ExprReader.readEquation(text));
  }
}
