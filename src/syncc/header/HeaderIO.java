package syncc.header;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import syncc.error.HeaderFormatException;
import syncc.error.ProgramFormatException;

/**
 * YAML persistence of interface files ({@code !ModuleInterface}) and compiled headers ({@code !CompiledHeader}).
 */
public class HeaderIO {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String INTERFACE_EXTENSION = ".dfi";
  public static final String HEADER_EXTENSION = ".dfic";

  private static final Class<?>[] beanClasses = {CompiledHeader.class, ModuleInterface.class, NodeSignature.class, PortSignature.class, ConstSignature.class};

  private static Yaml createYaml() {
    Constructor yamlConstructor = new Constructor(new LoaderOptions());
    DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    Representer representer = new Representer(dumperOptions);
    for (Class<?> beanClass : beanClasses) {
      yamlConstructor.addTypeDescription(new TypeDescription(beanClass, "!" + beanClass.getSimpleName()));
      representer.addClassTag(beanClass, new Tag("!" + beanClass.getSimpleName()));
    }
    return new Yaml(yamlConstructor, representer, dumperOptions);
  }

  public static Path headerPath(Path dir, String module) { return dir.resolve(module + HEADER_EXTENSION); }
  public static Path interfacePath(Path dir, String module) { return dir.resolve(module + INTERFACE_EXTENSION); }

  public static String toYaml(Object bean) { return createYaml().dump(bean); }

  public static void write(CompiledHeader header, Path file) throws IOException {
    logger.info(".. generating compiled header file {}", file);
    writeBean(header, file);
  }

  public static void writeInterface(ModuleInterface moduleInterface, Path file) throws IOException {
    logger.info(".. generating interface file {}", file);
    writeBean(moduleInterface, file);
  }

  private static void writeBean(Object bean, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null)
      Files.createDirectories(parent);
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      createYaml().dump(bean, writer);
    }
  }

  /**
   * Reads a compiled header and validates its format marker and structure.
   * @throws HeaderFormatException if the file is not a compiled header of the supported format
   */
  public static CompiledHeader read(Path file) throws HeaderFormatException, IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return read(in, file.toString());
    }
  }

  public static CompiledHeader read(InputStream in, String artifact) throws HeaderFormatException {
    Object parsed;
    try {
      parsed = createYaml().load(in);
    } catch (YAMLException e) {
      throw new HeaderFormatException(artifact, "corrupt content (" + e.getMessage() + ")", e);
    }
    if (!(parsed instanceof CompiledHeader))
      throw new HeaderFormatException(artifact, "not a compiled header");
    CompiledHeader header = (CompiledHeader)parsed;
    if (!CompiledHeader.FORMAT_VERSION.equals(header.getFormatVersion()))
      throw new HeaderFormatException(artifact, String.format("unknown format marker '%s', expected '%s'", header.getFormatVersion(),
                                                              CompiledHeader.FORMAT_VERSION));
    if (header.provenanceValue().isEmpty())
      throw new HeaderFormatException(artifact, "unknown provenance '" + header.getProvenance() + "'");
    if (header.getContents() == null)
      throw new HeaderFormatException(artifact, "no contents");
    if (isBlank(header.getCompilerVersion()))
      throw new HeaderFormatException(artifact, "no compiler version");
    if (isBlank(header.getContentMarker()))
      throw new HeaderFormatException(artifact, "no content marker");
    if (isBlank(header.getContents().getModule()))
      throw new HeaderFormatException(artifact, "no module name");
    try {
      validate(header.getContents());
    } catch (ProgramFormatException e) {
      throw new HeaderFormatException(artifact, e.getMessage(), e);
    }
    if (!header.getContentMarker().equals(CompiledHeader.contentMarker(header.getContents())))
      throw new HeaderFormatException(artifact, "content marker does not match the contents");
    return header;
  }

  private static boolean isBlank(String value) { return value == null || value.isBlank(); }

  /**
   * Reads an interface file.
   * @throws ProgramFormatException if the file is not a well-formed interface
   */
  public static ModuleInterface readInterface(Path file) throws ProgramFormatException, IOException {
    Object parsed;
    try (InputStream in = Files.newInputStream(file)) {
      parsed = createYaml().load(in);
    } catch (YAMLException e) {
      throw new ProgramFormatException(String.format("Interface file %s cannot be parsed: %s", file, e.getMessage()), e);
    }
    if (!(parsed instanceof ModuleInterface))
      throw new ProgramFormatException(String.format("Interface file %s does not contain a !ModuleInterface document", file));
    ModuleInterface ret = (ModuleInterface)parsed;
    validate(ret);
    return ret;
  }

  /** Checks that every type, clock and constant value parses, and that no name is declared twice. */
  static void validate(ModuleInterface moduleInterface) throws ProgramFormatException {
    if (moduleInterface.getNodes() == null || moduleInterface.getConstants() == null)
      throw new ProgramFormatException("Interface of module " + moduleInterface.getModule() + " lacks its node or constant list");
    HashSet<String> names = new HashSet<>();
    try {
      for (ConstSignature decl : moduleInterface.getConstants()) {
        decl.asConstDecl();
        if (!names.add(decl.getName()))
          throw new ProgramFormatException(String.format("Module %s declares %s twice", moduleInterface.getModule(), decl.getName()));
      }
      for (NodeSignature node : moduleInterface.getNodes()) {
        if (!names.add(node.getName()))
          throw new ProgramFormatException(String.format("Module %s declares %s twice", moduleInterface.getModule(), node.getName()));
        HashSet<String> ports = new HashSet<>();
        for (var decl : node.inputDecls()) {
          if (!ports.add(decl.name()))
            throw new ProgramFormatException(String.format("Node %s declares variable %s twice", node.getName(), decl.name()));
        }
        for (var decl : node.outputDecls()) {
          if (!ports.add(decl.name()))
            throw new ProgramFormatException(String.format("Node %s declares variable %s twice", node.getName(), decl.name()));
        }
      }
    } catch (IllegalArgumentException e) {
      throw new ProgramFormatException("Invalid interface of module " + moduleInterface.getModule() + ": " + e.getMessage(), e);
    }
  }
}
