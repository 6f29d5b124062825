package syncc.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import syncc.error.ProgramFormatException;

/**
 * Reads the textual equations of the program interchange format.
 * <p>
 * Precedence, lowest first: {@code -> fby} (right associative), {@code =>}, {@code or xor}, {@code and}, comparisons,
 * {@code not}, {@code + -}, {@code * / mod}, {@code when}, unary {@code - pre}.
 */
public class ExprReader {
  private static final Set<String> KEYWORDS =
      Set.of("not", "and", "or", "xor", "mod", "pre", "fby", "when", "merge", "if", "then", "else", "true", "false");
  private static final List<String> SYMBOLS = List.of("->", "=>", "<>", "<=", ">=", "<", ">", "=", "+", "-", "*", "/", "(", ")", ",");

  private enum TokenKind { IDENT, KEYWORD, INT, REAL, SYMBOL, EOF }
  private static record Token(TokenKind kind, String text, int pos) {}

  private final String source;
  private final List<Token> tokens;
  private int cur = 0;

  private ExprReader(String source) throws ProgramFormatException {
    this.source = source;
    this.tokens = tokenize(source);
  }

  /** Reads a single expression. */
  public static Expr readExpr(String text) throws ProgramFormatException {
    ExprReader reader = new ExprReader(text);
    Expr ret = reader.expr();
    reader.expect(TokenKind.EOF, null);
    return ret;
  }

  /** Reads an equation {@code x = e} or {@code (x, y) = N(a, b)}. */
  public static Equation readEquation(String text) throws ProgramFormatException {
    ExprReader reader = new ExprReader(text);
    ArrayList<String> lhs = new ArrayList<>();
    boolean parens = reader.accept(TokenKind.SYMBOL, "(");
    lhs.add(reader.expect(TokenKind.IDENT, null).text);
    while (reader.accept(TokenKind.SYMBOL, ","))
      lhs.add(reader.expect(TokenKind.IDENT, null).text);
    if (parens)
      reader.expect(TokenKind.SYMBOL, ")");
    reader.expect(TokenKind.SYMBOL, "=");
    Expr rhs = reader.expr();
    reader.expect(TokenKind.EOF, null);
    return new Equation(lhs, rhs);
  }

  private static List<Token> tokenize(String text) throws ProgramFormatException {
    ArrayList<Token> ret = new ArrayList<>();
    int i = 0;
    outer:
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_'))
          i++;
        String word = text.substring(start, i);
        ret.add(new Token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENT, word, start));
        continue;
      }
      if (Character.isDigit(c)) {
        int start = i;
        while (i < text.length() && Character.isDigit(text.charAt(i)))
          i++;
        boolean real = false;
        if (i + 1 < text.length() && text.charAt(i) == '.' && Character.isDigit(text.charAt(i + 1))) {
          real = true;
          i++;
          while (i < text.length() && Character.isDigit(text.charAt(i)))
            i++;
        }
        ret.add(new Token(real ? TokenKind.REAL : TokenKind.INT, text.substring(start, i), start));
        continue;
      }
      for (String symbol : SYMBOLS) {
        if (text.startsWith(symbol, i)) {
          ret.add(new Token(TokenKind.SYMBOL, symbol, i));
          i += symbol.length();
          continue outer;
        }
      }
      throw new ProgramFormatException(String.format("Unexpected character '%c' at position %d in '%s'", c, i, text));
    }
    ret.add(new Token(TokenKind.EOF, "", text.length()));
    return ret;
  }

  private Token peek() { return tokens.get(cur); }
  private boolean check(TokenKind kind, String text) {
    Token tok = peek();
    return tok.kind == kind && (text == null || tok.text.equals(text));
  }
  private boolean accept(TokenKind kind, String text) {
    if (!check(kind, text))
      return false;
    cur++;
    return true;
  }
  private Token expect(TokenKind kind, String text) throws ProgramFormatException {
    Token tok = peek();
    if (!check(kind, text))
      throw error("expected " + (text != null ? "'" + text + "'" : kind.name().toLowerCase()) +
                  (tok.kind == TokenKind.EOF ? " but reached the end" : " but found '" + tok.text + "'"));
    cur++;
    return tok;
  }
  private ProgramFormatException error(String message) {
    return new ProgramFormatException(String.format("Syntax error at position %d in '%s': %s", peek().pos, source, message));
  }

  private Expr expr() throws ProgramFormatException {
    Expr left = implExpr();
    if (accept(TokenKind.SYMBOL, "->"))
      return new Expr.Arrow(left, expr());
    if (accept(TokenKind.KEYWORD, "fby"))
      return new Expr.Fby(left, expr());
    return left;
  }

  private Expr implExpr() throws ProgramFormatException {
    Expr left = orExpr();
    if (accept(TokenKind.SYMBOL, "=>"))
      return new Expr.Apply(Operator.IMPL, List.of(left, implExpr()));
    return left;
  }

  private Expr orExpr() throws ProgramFormatException {
    Expr left = andExpr();
    while (true) {
      if (accept(TokenKind.KEYWORD, "or"))
        left = new Expr.Apply(Operator.OR, List.of(left, andExpr()));
      else if (accept(TokenKind.KEYWORD, "xor"))
        left = new Expr.Apply(Operator.XOR, List.of(left, andExpr()));
      else
        return left;
    }
  }

  private Expr andExpr() throws ProgramFormatException {
    Expr left = cmpExpr();
    while (accept(TokenKind.KEYWORD, "and"))
      left = new Expr.Apply(Operator.AND, List.of(left, cmpExpr()));
    return left;
  }

  private Expr cmpExpr() throws ProgramFormatException {
    Expr left = notExpr();
    for (String symbol : List.of("=", "<>", "<=", ">=", "<", ">")) {
      if (accept(TokenKind.SYMBOL, symbol))
        return new Expr.Apply(Operator.fromSymbol(symbol, 2).orElseThrow(), List.of(left, notExpr()));
    }
    return left;
  }

  private Expr notExpr() throws ProgramFormatException {
    if (accept(TokenKind.KEYWORD, "not"))
      return new Expr.Apply(Operator.NOT, List.of(notExpr()));
    return addExpr();
  }

  private Expr addExpr() throws ProgramFormatException {
    Expr left = mulExpr();
    while (true) {
      if (accept(TokenKind.SYMBOL, "+"))
        left = new Expr.Apply(Operator.ADD, List.of(left, mulExpr()));
      else if (accept(TokenKind.SYMBOL, "-"))
        left = new Expr.Apply(Operator.SUB, List.of(left, mulExpr()));
      else
        return left;
    }
  }

  private Expr mulExpr() throws ProgramFormatException {
    Expr left = whenExpr();
    while (true) {
      if (accept(TokenKind.SYMBOL, "*"))
        left = new Expr.Apply(Operator.MUL, List.of(left, whenExpr()));
      else if (accept(TokenKind.SYMBOL, "/"))
        left = new Expr.Apply(Operator.DIV, List.of(left, whenExpr()));
      else if (accept(TokenKind.KEYWORD, "mod"))
        left = new Expr.Apply(Operator.MOD, List.of(left, whenExpr()));
      else
        return left;
    }
  }

  private Expr whenExpr() throws ProgramFormatException {
    Expr left = unary();
    while (accept(TokenKind.KEYWORD, "when")) {
      boolean polarity = !accept(TokenKind.KEYWORD, "not");
      left = new Expr.When(left, expect(TokenKind.IDENT, null).text, polarity);
    }
    return left;
  }

  private Expr unary() throws ProgramFormatException {
    if (accept(TokenKind.SYMBOL, "-")) {
      Expr operand = unary();
      if (operand instanceof Expr.Const) {
        Object value = ((Expr.Const)operand).value();
        if (!(value instanceof Boolean))
          return new Expr.Const(Operator.NEG.apply(List.of(value)));
      }
      return new Expr.Apply(Operator.NEG, List.of(operand));
    }
    if (accept(TokenKind.KEYWORD, "pre"))
      return new Expr.Pre(unary());
    return primary();
  }

  private Expr primary() throws ProgramFormatException {
    Token tok = peek();
    switch (tok.kind) {
    case INT:
      cur++;
      try {
        return new Expr.Const(Long.valueOf(tok.text));
      } catch (NumberFormatException e) {
        throw new ProgramFormatException("Integer literal out of range: " + tok.text, e);
      }
    case REAL:
      cur++;
      return new Expr.Const(Double.valueOf(tok.text));
    case IDENT:
      cur++;
      if (accept(TokenKind.SYMBOL, "(")) {
        ArrayList<Expr> args = new ArrayList<>();
        if (!accept(TokenKind.SYMBOL, ")")) {
          args.add(expr());
          while (accept(TokenKind.SYMBOL, ","))
            args.add(expr());
          expect(TokenKind.SYMBOL, ")");
        }
        return new Expr.Call(tok.text, args);
      }
      return new Expr.Var(tok.text);
    case SYMBOL:
      if (tok.text.equals("(")) {
        cur++;
        Expr inner = expr();
        expect(TokenKind.SYMBOL, ")");
        return inner;
      }
      break;
    case KEYWORD:
      if (accept(TokenKind.KEYWORD, "true"))
        return new Expr.Const(Boolean.TRUE);
      if (accept(TokenKind.KEYWORD, "false"))
        return new Expr.Const(Boolean.FALSE);
      if (accept(TokenKind.KEYWORD, "if")) {
        Expr cond = expr();
        expect(TokenKind.KEYWORD, "then");
        Expr thenExpr = expr();
        expect(TokenKind.KEYWORD, "else");
        return new Expr.Ite(cond, thenExpr, expr());
      }
      if (accept(TokenKind.KEYWORD, "merge")) {
        String clock = expect(TokenKind.IDENT, null).text;
        expect(TokenKind.SYMBOL, "(");
        expect(TokenKind.KEYWORD, "true");
        expect(TokenKind.SYMBOL, "->");
        Expr onTrue = expr();
        expect(TokenKind.SYMBOL, ")");
        expect(TokenKind.SYMBOL, "(");
        expect(TokenKind.KEYWORD, "false");
        expect(TokenKind.SYMBOL, "->");
        Expr onFalse = expr();
        expect(TokenKind.SYMBOL, ")");
        return new Expr.Merge(clock, onTrue, onFalse);
      }
      break;
    default:
      break;
    }
    throw error(tok.kind == TokenKind.EOF ? "unexpected end of expression" : "unexpected '" + tok.text + "'");
  }
}
