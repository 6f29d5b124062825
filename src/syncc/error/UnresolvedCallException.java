package syncc.error;

public class UnresolvedCallException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String caller;
  private final String callee;

  public UnresolvedCallException(String caller, String callee) {
    super(ErrorKind.UNRESOLVED_CALL, String.format("Internal error: node %s calls %s, which has no machine", caller, callee));
    this.caller = caller;
    this.callee = callee;
  }

  public String getCaller() { return caller; }
  public String getCallee() { return callee; }
}
