package syncc.header;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.HeaderDependencyMismatchException;
import syncc.error.HeaderFormatException;
import syncc.error.InterfaceCompatibilityException;
import syncc.error.ProgramFormatException;

/**
 * Decides what happens to the compiled header of the module being compiled.
 * <ul>
 * <li>no header: it is extracted from the source and written</li>
 * <li>header extracted from source: rewritten if its content marker differs from the current interface</li>
 * <li>header compiled from an interface file: never rewritten; the computed interface is checked against it</li>
 * </ul>
 */
public class HeaderPolicy {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum Action {
    WRITTEN,
    REGENERATED,
    KEPT,
    CHECKED
  }

  private final String compilerVersion;

  public HeaderPolicy(String compilerVersion) { this.compilerVersion = compilerVersion; }

  /**
   * Applies the policy to the header at {@code headerFile}.
   * @param computed interface computed from the source module
   */
  public Action apply(Path headerFile, ModuleInterface computed)
      throws HeaderFormatException, HeaderDependencyMismatchException, InterfaceCompatibilityException, IOException {
    if (!Files.exists(headerFile)) {
      HeaderIO.write(CompiledHeader.create(computed, CompiledHeader.Provenance.FROM_SOURCE, compilerVersion), headerFile);
      return Action.WRITTEN;
    }
    CompiledHeader existing = HeaderIO.read(headerFile);
    if (!existing.isFromInterface()) {
      if (existing.getContentMarker().equals(CompiledHeader.contentMarker(computed)) && compilerVersion.equals(existing.getCompilerVersion())) {
        logger.debug("Compiled header {} is up to date", headerFile);
        return Action.KEPT;
      }
      HeaderIO.write(CompiledHeader.create(computed, CompiledHeader.Provenance.FROM_SOURCE, compilerVersion), headerFile);
      return Action.REGENERATED;
    }
    logger.info(".. loading compiled header file {}", headerFile);
    HeaderChecker.checkDependency(existing, computed.getModule(), compilerVersion, false);
    HeaderChecker.checkCompatibility(existing.getContents(), computed);
    return Action.CHECKED;
  }

  /**
   * Compiles an interface file into a compiled header marked as derived from an interface.
   * @return the written header
   */
  public CompiledHeader compileInterface(Path interfaceFile, Path headerFile) throws ProgramFormatException, IOException {
    ModuleInterface moduleInterface = HeaderIO.readInterface(interfaceFile);
    CompiledHeader header = CompiledHeader.create(moduleInterface, CompiledHeader.Provenance.FROM_INTERFACE, compilerVersion);
    HeaderIO.write(header, headerFile);
    return header;
  }
}
