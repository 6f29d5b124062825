package syncc.error;

public class StatelessNodeException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String node;

  public StatelessNodeException(String node, String reason) {
    super(ErrorKind.STATELESS_VIOLATION, String.format("Node %s is declared as a function but %s", node, reason));
    this.node = node;
  }

  public String getNode() { return node; }
}
