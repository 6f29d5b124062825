package syncc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.backend.Backend;
import syncc.backend.BackendKind;
import syncc.backend.CompilationResult;
import syncc.drc.ProgramChecks;
import syncc.error.CompilerException;
import syncc.error.HeaderDependencyMismatchException;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.frontend.ProgramReader;
import syncc.header.CompiledHeader;
import syncc.header.HeaderChecker;
import syncc.header.HeaderIO;
import syncc.header.HeaderPolicy;
import syncc.header.ModuleInterface;
import syncc.machine.Machine;
import syncc.machine.MachineTranslator;
import syncc.optimize.MachineOptimizer;
import syncc.schedule.NodeSchedule;
import syncc.schedule.NodeSorter;
import syncc.schedule.Scheduler;
import syncc.ui.SyncCConfig;

/**
 * Compilation driver: runs the phases for one unit at a time and hands the result to the registered backends.
 */
public class SyncC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String VERSION = "0.3.0";
  public static final String SOURCE_EXTENSION = ".dfm";

  private final SyncCConfig config;
  private final BackendKind backend;
  private final EnumMap<BackendKind, List<Backend>> backends = new EnumMap<>(BackendKind.class);

  public SyncC(SyncCConfig config, BackendKind backend) {
    this.config = config;
    this.backend = backend;
  }

  public void registerBackend(Backend emitter) { backends.computeIfAbsent(emitter.getKind(), kind -> new ArrayList<>()).add(emitter); }

  public Path getDestination() { return Path.of(config.dest_dir); }

  /**
   * Compiles a source module ({@code .dfm}) or an interface file ({@code .dfi}).
   * @return the compilation result; empty if only an interface or a compiled header was produced
   */
  public Optional<CompilationResult> compileFile(Path file) throws CompilerException, IOException {
    String fileName = file.getFileName().toString();
    if (fileName.endsWith(HeaderIO.INTERFACE_EXTENSION)) {
      compileInterface(file);
      return Optional.empty();
    }
    Program program = ProgramReader.read(file);
    if (config.generate_interface) {
      Path dir = file.toAbsolutePath().getParent();
      writeInterface(program, HeaderIO.interfacePath(dir, program.getModuleName()));
      return Optional.empty();
    }
    return Optional.of(compile(program));
  }

  /** Compiles an interface file into a compiled header in the destination directory. */
  public CompiledHeader compileInterface(Path interfaceFile) throws CompilerException, IOException {
    String fileName = interfaceFile.getFileName().toString();
    String module = fileName.substring(0, fileName.length() - HeaderIO.INTERFACE_EXTENSION.length());
    CompiledHeader header = new HeaderPolicy(VERSION).compileInterface(interfaceFile, HeaderIO.headerPath(getDestination(), module));
    logger.info(".. done !");
    return header;
  }

  /** Checks a program like a compilation would, then writes its computed interface. */
  public ModuleInterface writeInterface(Program program, Path interfaceFile) throws CompilerException, IOException {
    CompilationContext ctx = new CompilationContext(config, backend);
    Program sorted = analyze(ctx, program);
    ModuleInterface computed = ModuleInterface.extract(sorted);
    HeaderIO.writeInterface(computed, interfaceFile);
    logger.info(".. done !");
    return computed;
  }

  /** Loads the dependencies of a program, sorts its nodes and runs the design rule checks. */
  private Program analyze(CompilationContext ctx, Program program) throws CompilerException, IOException {
    for (String module : program.getImports())
      ctx.addImport(module, loadDependency(module));
    ctx.addConstants(program);

    Program sorted = NodeSorter.sort(program);
    LinkedHashMap<String, Boolean> importedStateless = new LinkedHashMap<>();
    ctx.getImportedNodes().forEach((name, sig) -> importedStateless.put(name, sig.isStateless()));
    LinkedHashSet<String> importedConstants = new LinkedHashSet<>();
    ctx.getHeaders().values().forEach(header -> header.getContents().getConstants().forEach(decl -> importedConstants.add(decl.getName())));
    new ProgramChecks(sorted, importedStateless, importedConstants).checkAll();
    HeaderChecker.checkCallSites(sorted, ctx.getImportedNodes());
    return sorted;
  }

  /** Finds, reads and checks the compiled header of an imported module. */
  private CompiledHeader loadDependency(String module) throws CompilerException, IOException {
    ArrayList<Path> searchPath = new ArrayList<>();
    searchPath.add(getDestination());
    config.include_dirs.forEach(dir -> searchPath.add(Path.of(dir)));
    for (Path dir : searchPath) {
      Path headerFile = HeaderIO.headerPath(dir, module);
      if (Files.exists(headerFile)) {
        logger.info(".. loading compiled header file {}", headerFile);
        CompiledHeader header = HeaderIO.read(headerFile);
        HeaderChecker.checkDependency(header, module, VERSION, config.require_interface_dependencies);
        return header;
      }
    }
    throw new HeaderDependencyMismatchException(module, "no compiled header found in " + searchPath);
  }

  /** Runs the whole pipeline on a program. */
  public CompilationResult compile(Program program) throws CompilerException, IOException {
    logger.info(".. compiling module {}", program.getModuleName());
    CompilationContext ctx = new CompilationContext(config, backend);
    Program sorted = analyze(ctx, program);

    if (backend.usesHeaders()) {
      Path headerFile = HeaderIO.headerPath(getDestination(), sorted.getModuleName());
      HeaderPolicy.Action action = new HeaderPolicy(VERSION).apply(headerFile, ModuleInterface.extract(sorted));
      logger.debug("Compiled header {}: {}", headerFile, action);
    }

    logger.info(".. scheduling");
    ArrayList<Node> scheduledNodes = new ArrayList<>();
    for (Node node : sorted.getNodes()) {
      NodeSchedule schedule = Scheduler.schedule(node);
      ctx.addSchedule(schedule);
      scheduledNodes.add(schedule.getNode());
      logger.debug(schedule);
      logger.debug(schedule.fanInTableToString());
    }
    Program scheduled = sorted.withNodes(scheduledNodes);
    logger.trace("Scheduled program:\n{}", scheduled);

    logger.info(".. machines generation");
    MachineTranslator translator = new MachineTranslator(ctx.getSchedules(), ctx.importedMachines(), ctx.getMachines());
    translator.translateAll(scheduledNodes.stream().map(Node::getName).toList());
    ctx.getMachines().all().forEach(machine -> logger.debug("{}", machine));

    if (backend.allowsOptimization() && config.optimization_level >= 2) {
      logger.info(".. machines optimization (level {})", config.optimization_level);
      new MachineOptimizer(config.optimization_level, ctx.getConstants()).optimizeAll(ctx.getMachines());
    }

    ArrayList<Machine> machines = new ArrayList<>();
    ArrayList<Machine> imported = new ArrayList<>();
    for (Machine machine : ctx.getMachines().all())
      (machine.isInterfaceOnly() ? imported : machines).add(machine);
    CompilationResult result =
        new CompilationResult(sorted.getModuleName(), getDestination(), scheduled, ctx.getSchedules(), machines, imported, ctx.getWarnings());

    List<Backend> emitters = backends.getOrDefault(backend, List.of());
    if (emitters.isEmpty())
      logger.info("No {} emitter registered, machines of {} are not written", backend, sorted.getModuleName());
    for (Backend emitter : emitters)
      emitter.emit(result);
    logger.info(".. done !");
    return result;
  }
}
