package syncc.error;

public class ProgramFormatException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public ProgramFormatException(String message) { super(ErrorKind.PROGRAM_FORMAT, message); }
  public ProgramFormatException(String message, Throwable cause) { super(ErrorKind.PROGRAM_FORMAT, message, cause); }
}
