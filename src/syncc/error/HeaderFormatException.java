package syncc.error;

public class HeaderFormatException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String artifact;

  public HeaderFormatException(String artifact, String message) {
    super(ErrorKind.HEADER_FORMAT, String.format("Invalid compiled header %s: %s", artifact, message));
    this.artifact = artifact;
  }
  public HeaderFormatException(String artifact, String message, Throwable cause) {
    super(ErrorKind.HEADER_FORMAT, String.format("Invalid compiled header %s: %s", artifact, message), cause);
    this.artifact = artifact;
  }

  public String getArtifact() { return artifact; }
}
