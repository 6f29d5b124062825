package syncc.error;

import java.util.List;

public class CausalityCycleException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String scope;
  private final List<String> names;

  /**
   * @param scope the node whose equations form the cycle, or the module for recursive node calls
   * @param names the variables (or nodes) on the cycle, in declaration order
   */
  public CausalityCycleException(String scope, List<String> names) {
    super(ErrorKind.CAUSALITY_CYCLE, String.format("Causality error in %s: cyclic dependency between {%s}", scope, String.join(", ", names)));
    this.scope = scope;
    this.names = List.copyOf(names);
  }

  public String getScope() { return scope; }
  public List<String> getNames() { return names; }
}
