package syncc.error;

/**
 * Base class of all fatal errors of a compilation unit. Every subclass carries a fixed {@link ErrorKind}, so the
 * driver can report the failure without inspecting the concrete type.
 */
public abstract class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  protected CompilerException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }
  protected CompilerException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() { return kind; }

  /** Whether the error indicates a bug in an upstream phase rather than in the user's program. */
  public boolean isInternal() { return kind == ErrorKind.UNRESOLVED_CALL || kind == ErrorKind.UNSUPPORTED_CONSTRUCT; }
}
