package syncc.drc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.CompilerException;
import syncc.error.ProgramFormatException;
import syncc.error.StatelessNodeException;
import syncc.error.UnresolvedCallException;
import syncc.error.UnsupportedConstructException;
import syncc.frontend.ConstDecl;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.frontend.VarDecl;

/**
 * Design rule checks on a program before scheduling. Each violation is logged; {@link #checkAll()} then raises the
 * first one.
 */
public class ProgramChecks {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Program program;
  /** Imported nodes, mapped to their stateless flag */
  private final Map<String, Boolean> importedNodes;
  private final Set<String> importedConstants;
  private final HashSet<String> constants = new HashSet<>();
  private final HashMap<String, Node> nodes = new HashMap<>();

  private CompilerException firstError = null;
  private int errorCount = 0;

  public ProgramChecks(Program program, Map<String, Boolean> importedNodes, Set<String> importedConstants) {
    this.program = program;
    this.importedNodes = importedNodes;
    this.importedConstants = importedConstants;
    program.getConstants().forEach(decl -> constants.add(decl.name()));
    constants.addAll(importedConstants);
    program.getNodes().forEach(node -> nodes.putIfAbsent(node.getName(), node));
  }

  public boolean hasFatalError() { return firstError != null; }
  public int getErrorCount() { return errorCount; }

  private void report(CompilerException error) {
    logger.fatal(error.getMessage());
    errorCount++;
    if (firstError == null)
      firstError = error;
  }

  /** Runs all checks. */
  public void checkAll() throws CompilerException {
    checkUniqueNames();
    for (Node node : program.getNodes()) {
      checkDefinitions(node);
      checkUndeclared(node);
      checkStateless(node);
    }
    if (firstError != null)
      throw firstError;
  }

  /** Constants and nodes, own and imported, share one name space. */
  public void checkUniqueNames() {
    HashSet<String> seen = new HashSet<>();
    for (String name : importedNodes.keySet())
      seen.add(name);
    for (String name : importedConstants) {
      if (!seen.add(name))
        report(new ProgramFormatException(String.format("Module %s: %s is imported twice", program.getModuleName(), name)));
    }
    for (ConstDecl decl : program.getConstants()) {
      if (!seen.add(decl.name()))
        report(new ProgramFormatException(String.format("Module %s: constant %s is already declared", program.getModuleName(), decl.name())));
    }
    for (Node node : program.getNodes()) {
      if (!seen.add(node.getName()))
        report(new ProgramFormatException(String.format("Module %s: node %s is already declared", program.getModuleName(), node.getName())));
      for (VarDecl var : node.getAllVariables()) {
        if (constants.contains(var.name()))
          logger.warn("Variable {} of node {} hides the constant of the same name", var.name(), node.getName());
      }
    }
  }

  /** Every non-input variable is defined by exactly one equation; inputs are not defined at all. */
  public void checkDefinitions(Node node) {
    HashMap<String, Integer> definitions = new HashMap<>();
    for (Equation eq : node.getEquations()) {
      for (String var : eq.lhs()) {
        definitions.merge(var, 1, Integer::sum);
        var decl = node.lookupVariable(var);
        if (decl.isEmpty())
          report(new UnsupportedConstructException(node.getName(), eq.toString(), "undeclared variable " + var + " is defined"));
        else if (decl.get().isInput())
          report(new ProgramFormatException(String.format("Node %s defines its input %s", node.getName(), var)));
      }
    }
    for (VarDecl var : node.getAllVariables()) {
      if (var.isInput())
        continue;
      int count = definitions.getOrDefault(var.name(), 0);
      if (count == 0)
        report(new ProgramFormatException(String.format("Node %s does not define %s %s", node.getName(), var.role(), var.name())));
      else if (count > 1)
        report(new ProgramFormatException(String.format("Node %s defines %s %d times", node.getName(), var.name(), count)));
    }
  }

  /** Reads of names that are neither variables nor constants, and calls to unknown nodes. */
  public void checkUndeclared(Node node) {
    for (Equation eq : node.getEquations())
      checkExpr(node, eq.rhs(), eq.toString());
    for (Expr assertion : node.getAssertions())
      checkExpr(node, assertion, "assert " + assertion);
    for (VarDecl var : node.getAllVariables()) {
      for (String clockVar : var.clock().variables()) {
        if (!node.hasVariable(clockVar))
          report(new UnsupportedConstructException(node.getName(), var.toString(), "clock of " + var.name() + " samples undeclared " + clockVar));
      }
    }
  }

  private void checkExpr(Node node, Expr expr, String context) {
    for (String read : expr.reads()) {
      if (!node.hasVariable(read) && !constants.contains(read))
        report(new UnsupportedConstructException(node.getName(), context, "undeclared variable " + read));
    }
    expr.forEachSubExpr(sub -> {
      if (sub instanceof Expr.Call) {
        String callee = ((Expr.Call)sub).node();
        if (!nodes.containsKey(callee) && !importedNodes.containsKey(callee))
          report(new UnresolvedCallException(node.getName(), callee));
      }
    });
  }

  /** A node declared as a function has no memories or arrows and calls only functions. */
  public void checkStateless(Node node) {
    if (!node.isStateless())
      return;
    if (!node.getMemories().isEmpty())
      report(new StatelessNodeException(node.getName(), "declares memories " + String.join(", ", Node.names(node.getMemories()))));
    List<Expr> exprs = new ArrayList<>(node.getAssertions());
    node.getEquations().forEach(eq -> exprs.add(eq.rhs()));
    for (Expr expr : exprs) {
      expr.forEachSubExpr(sub -> {
        if (sub instanceof Expr.Arrow || sub instanceof Expr.Pre || sub instanceof Expr.Fby)
          report(new StatelessNodeException(node.getName(), "uses the stateful operator in " + sub));
        else if (sub instanceof Expr.Call && !isStatelessCallee(((Expr.Call)sub).node()))
          report(new StatelessNodeException(node.getName(), "calls the stateful node " + ((Expr.Call)sub).node()));
      });
    }
  }

  private boolean isStatelessCallee(String callee) {
    Node local = nodes.get(callee);
    if (local != null)
      return local.isStateless();
    return importedNodes.getOrDefault(callee, true);
  }
}
