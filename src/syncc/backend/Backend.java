package syncc.backend;

import java.io.IOException;

/**
 * A code emitter. Emitters are registered with the driver for one {@link BackendKind} and must not modify the result
 * they are given.
 */
public interface Backend {
  BackendKind getKind();

  void emit(CompilationResult result) throws IOException;
}
