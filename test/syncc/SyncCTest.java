package syncc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import syncc.backend.Backend;
import syncc.backend.BackendKind;
import syncc.backend.CompilationResult;
import syncc.error.CausalityCycleException;
import syncc.error.CompilerException;
import syncc.error.HeaderDependencyMismatchException;
import syncc.error.InterfaceCompatibilityException;
import syncc.error.ProgramFormatException;
import syncc.frontend.Node;
import syncc.header.CompiledHeader;
import syncc.header.HeaderIO;
import syncc.header.ModuleInterface;
import syncc.machine.Machine;
import syncc.ui.SyncCConfig;

class SyncCTest {

  static final String LIB_INTERFACE = """
      !ModuleInterface
      module: lib
      constants:
      - !ConstSignature {name: STEP, type: int, value: '2'}
      nodes:
      - !NodeSignature
        name: scale
        stateless: true
        inputs:
        - !PortSignature {name: a, type: int, clock: base}
        outputs:
        - !PortSignature {name: b, type: int, clock: base}
      """;

  static final String LIB_SOURCE = """
      module: lib
      constants: [{name: STEP, type: int, value: 2}]
      nodes:
        - node: scale
          stateless: true
          inputs:  [{name: a, type: int}]
          outputs: [{name: b, type: int}]
          equations: ["b = a * STEP"]
      """;

  static final String MAIN = """
      module: main
      imports: [lib]
      nodes:
        - node: counter
          inputs:  [{name: x, type: int}]
          outputs: [{name: o, type: int}]
          locals:  [{name: t, type: int}, {name: k, type: int}]
          memories: [{name: c, type: int}]
          equations: ["c = 0 fby (c + t)", "t = x + k", "k = STEP * 3", "o = scale(c)"]
      """;

  static SyncCConfig config(Path dest, int level) {
    SyncCConfig ret = new SyncCConfig();
    ret.dest_dir = dest.toString();
    ret.optimization_level = level;
    return ret;
  }

  static Path write(Path dir, String fileName, String content) throws IOException {
    Path ret = dir.resolve(fileName);
    Files.writeString(ret, content, StandardCharsets.UTF_8);
    return ret;
  }

  @Test
  void testCompileWithInterfaceDependency(@TempDir Path dir) throws CompilerException, IOException {
    SyncC compiler = new SyncC(config(dir, 2), BackendKind.IMPERATIVE);
    ArrayList<CompilationResult> emitted = new ArrayList<>();
    compiler.registerBackend(new Backend() {
      @Override
      public BackendKind getKind() {
        return BackendKind.IMPERATIVE;
      }
      @Override
      public void emit(CompilationResult result) {
        emitted.add(result);
      }
    });

    Assertions.assertTrue(compiler.compileFile(write(dir, "lib.dfi", LIB_INTERFACE)).isEmpty());
    Assertions.assertTrue(HeaderIO.read(dir.resolve("lib.dfic")).isFromInterface());

    CompilationResult result = compiler.compileFile(write(dir, "main.dfm", MAIN)).orElseThrow();
    Assertions.assertEquals(List.of(result), emitted);
    Assertions.assertEquals("main", result.moduleName());
    Assertions.assertEquals(List.of("counter"), result.machines().stream().map(Machine::getName).toList());
    Assertions.assertEquals(List.of("scale"), result.importedMachines().stream().map(Machine::getName).toList());
    Assertions.assertTrue(result.warnings().isEmpty());

    // k is folded to a literal and unfolded at level 2
    Machine counter = result.machines().get(0);
    Assertions.assertEquals(List.of("t"), Node.names(counter.getLocals()));

    CompiledHeader header = HeaderIO.read(dir.resolve("main.dfic"));
    Assertions.assertFalse(header.isFromInterface());
    Assertions.assertEquals(SyncC.VERSION, header.getCompilerVersion());
    Assertions.assertTrue(header.getContents().findNode("counter").isPresent());
  }

  @Test
  void testVerificationIsNotOptimized(@TempDir Path dir) throws CompilerException, IOException {
    write(dir, "lib.dfi", LIB_INTERFACE);
    Path main = write(dir, "main.dfm", MAIN);
    Path horn = Files.createDirectory(dir.resolve("horn"));
    Path plain = Files.createDirectory(dir.resolve("plain"));
    new SyncC(config(horn, 4), BackendKind.VERIFICATION).compileInterface(dir.resolve("lib.dfi"));
    new SyncC(config(plain, 0), BackendKind.DATAFLOW_ROUNDTRIP).compileInterface(dir.resolve("lib.dfi"));

    CompilationResult verification = new SyncC(config(horn, 4), BackendKind.VERIFICATION).compileFile(main).orElseThrow();
    CompilationResult unoptimized = new SyncC(config(plain, 0), BackendKind.DATAFLOW_ROUNDTRIP).compileFile(main).orElseThrow();
    Assertions.assertEquals(unoptimized.machines(), verification.machines());
    Assertions.assertEquals(List.of("t", "k"), Node.names(verification.machines().get(0).getLocals()));
    // only the imperative backend maintains compiled headers
    Assertions.assertFalse(Files.exists(horn.resolve("main.dfic")));
    Assertions.assertFalse(Files.exists(plain.resolve("main.dfic")));
  }

  @Test
  void testDependencies(@TempDir Path dir) throws CompilerException, IOException {
    Path main = write(dir, "main.dfm", MAIN);
    HeaderDependencyMismatchException missing =
        Assertions.assertThrows(HeaderDependencyMismatchException.class, () -> new SyncC(config(dir, 2), BackendKind.IMPERATIVE).compileFile(main));
    Assertions.assertEquals("lib", missing.getModule());

    // a header extracted from source is accepted unless interface-derived headers are required
    Path libDir = Files.createDirectory(dir.resolve("lib"));
    new SyncC(config(libDir, 2), BackendKind.IMPERATIVE).compileFile(write(dir, "lib.dfm", LIB_SOURCE));
    Assertions.assertFalse(HeaderIO.read(libDir.resolve("lib.dfic")).isFromInterface());
    SyncCConfig withInclude = config(dir, 2);
    withInclude.include_dirs.add(libDir.toString());
    Assertions.assertTrue(new SyncC(withInclude, BackendKind.IMPERATIVE).compileFile(main).isPresent());

    withInclude.require_interface_dependencies = true;
    Assertions.assertThrows(HeaderDependencyMismatchException.class, () -> new SyncC(withInclude, BackendKind.IMPERATIVE).compileFile(main));
  }

  @Test
  void testClashingImports(@TempDir Path dir) throws CompilerException, IOException {
    // both libraries export a node named scale
    SyncC compiler = new SyncC(config(dir, 2), BackendKind.IMPERATIVE);
    compiler.compileFile(write(dir, "lib.dfi", LIB_INTERFACE));
    compiler.compileFile(write(dir, "other.dfi", LIB_INTERFACE.replace("module: lib", "module: other").replace("STEP", "DELTA")));
    Path main = write(dir, "main.dfm", MAIN.replace("imports: [lib]", "imports: [lib, other]"));
    ProgramFormatException e = Assertions.assertThrows(ProgramFormatException.class, () -> compiler.compileFile(main));
    Assertions.assertTrue(e.getMessage().contains("scale"), e.getMessage());
    Assertions.assertFalse(Files.exists(dir.resolve("main.dfic")));
  }

  @Test
  void testGenerateInterface(@TempDir Path dir) throws CompilerException, IOException {
    SyncCConfig config = config(dir, 2);
    config.generate_interface = true;
    Path lib = write(dir, "lib.dfm", LIB_SOURCE);
    Assertions.assertTrue(new SyncC(config, BackendKind.IMPERATIVE).compileFile(lib).isEmpty());
    ModuleInterface written = HeaderIO.readInterface(dir.resolve("lib.dfi"));
    Assertions.assertTrue(written.findNode("scale").orElseThrow().isStateless());
    Assertions.assertFalse(Files.exists(dir.resolve("lib.dfic")));
  }

  @Test
  void testHeaderMismatch(@TempDir Path dir) throws CompilerException, IOException {
    // the declared interface says scale is stateless, the source below says otherwise
    SyncC compiler = new SyncC(config(dir, 2), BackendKind.IMPERATIVE);
    compiler.compileFile(write(dir, "lib.dfi", LIB_INTERFACE));
    Path lib = write(dir, "lib.dfm", LIB_SOURCE.replace("stateless: true", "stateless: false"));
    InterfaceCompatibilityException e = Assertions.assertThrows(InterfaceCompatibilityException.class, () -> compiler.compileFile(lib));
    Assertions.assertEquals("scale", e.getNode());
  }

  @Test
  void testCausalityError(@TempDir Path dir) throws IOException {
    Path cyclic = write(dir, "cyc.dfm", """
        module: cyc
        nodes:
          - node: f
            inputs:  [{name: x, type: int}]
            outputs: [{name: o, type: int}]
            locals:  [{name: a, type: int}, {name: b, type: int}]
            equations: ["a = b + x", "b = a - 1", "o = a"]
        """);
    CausalityCycleException e =
        Assertions.assertThrows(CausalityCycleException.class, () -> new SyncC(config(dir, 2), BackendKind.IMPERATIVE).compileFile(cyclic));
    Assertions.assertEquals("f", e.getScope());
    Assertions.assertEquals(List.of("a", "b"), e.getNames());
    Assertions.assertFalse(e.isInternal());
  }
}
