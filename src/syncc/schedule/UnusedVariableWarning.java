package syncc.schedule;

import syncc.frontend.VarDecl;

/** Non-fatal diagnostic: an input or memory of a node is never read. */
public record UnusedVariableWarning(String node, String variable, VarDecl.Role role) {
  @Override
  public String toString() {
    return String.format("Warning: %s %s of node %s is never read", role, variable, node);
  }
}
