package syncc.error;

public class HeaderDependencyMismatchException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String module;

  public HeaderDependencyMismatchException(String module, String message) {
    super(ErrorKind.HEADER_DEPENDENCY_MISMATCH, String.format("Dependency %s cannot be used: %s", module, message));
    this.module = module;
  }

  public String getModule() { return module; }
}
