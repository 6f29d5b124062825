package syncc.error;

public class UnsupportedConstructException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String node;
  private final String construct;

  /**
   * @param node the node containing the construct
   * @param construct textual form of the offending equation or expression
   * @param reason what is wrong with it
   */
  public UnsupportedConstructException(String node, String construct, String reason) {
    super(ErrorKind.UNSUPPORTED_CONSTRUCT, String.format("Internal error in node %s: %s (in '%s')", node, reason, construct));
    this.node = node;
    this.construct = construct;
  }

  public String getNode() { return node; }
  public String getConstruct() { return construct; }
}
