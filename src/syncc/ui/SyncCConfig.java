package syncc.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import syncc.error.ProgramFormatException;

/**
 * Data-Class to hold tool options.
 */
public class SyncCConfig {

  /** Directory for compiled headers and emitted code */
  public String dest_dir = ".";
  /** Directories searched for the compiled headers of imported modules, after {@link #dest_dir} */
  public List<String> include_dirs = new ArrayList<>();

  /** 0/1: no machine optimization, 2: constant unfolding, 3: + fusion and slot reuse, 4: + CSE */
  public int optimization_level = 2;
  /** Backend name: C, horn or lustre */
  public String output = "C";

  /** Only write the computed interface file of the source and stop */
  public boolean generate_interface = false;
  /** Reject imported headers that were extracted from source instead of compiled from an interface file */
  public boolean require_interface_dependencies = false;

  /**
   * Reads a configuration file; keys are the field names.
   */
  public static SyncCConfig load(Path file) throws ProgramFormatException, IOException {
    Yaml yaml = new Yaml(new Constructor(SyncCConfig.class, new LoaderOptions()));
    try (InputStream in = Files.newInputStream(file)) {
      SyncCConfig ret = yaml.load(in);
      if (ret == null)
        return new SyncCConfig();
      // explicit nulls fall back to the defaults
      SyncCConfig defaults = new SyncCConfig();
      if (ret.include_dirs == null)
        ret.include_dirs = defaults.include_dirs;
      if (ret.dest_dir == null)
        ret.dest_dir = defaults.dest_dir;
      if (ret.output == null)
        ret.output = defaults.output;
      return ret;
    } catch (YAMLException e) {
      throw new ProgramFormatException(String.format("Configuration %s cannot be read: %s", file, e.getMessage()), e);
    }
  }
}
