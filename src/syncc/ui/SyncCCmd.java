package syncc.ui;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import syncc.SyncC;
import syncc.backend.BackendKind;
import syncc.error.CompilerException;

public class SyncCCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();
  static {
    options.addOption(Option.builder("d")
                          .longOpt("dest")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory for compiled headers and generated files (default: current directory)")
                          .build());
    options.addOption(Option.builder("I")
                          .longOpt("include")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory searched for compiled headers of imported modules; may be repeated")
                          .build());
    options.addOption(Option.builder("O")
                          .longOpt("optimize")
                          .argName("level")
                          .hasArg()
                          .required(false)
                          .desc("Optimization level 0-4 (default 2)")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("backend")
                          .hasArg()
                          .required(false)
                          .desc("Backend, one of C, horn, lustre (default C)")
                          .build());
    options.addOption(Option.builder().longOpt("interface").required(false).desc("Only write the interface file of the source module").build());
    options.addOption(Option.builder()
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options; command line options take precedence")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp() {
    helper.printHelp("synccmd [options] <file.dfm | file.dfi>... - compile dataflow modules to machines", options);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());

    System.exit(run(args));
  }

  /**
   * Parses the arguments and compiles every listed file in order, stopping at the first failure.
   * @return the process exit status
   */
  public static int run(String[] args) {
    logger = LogManager.getLogger();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    SyncCConfig config = new SyncCConfig();
    BackendKind backend;
    List<String> files;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp();
        return 0;
      }

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("config"))
        config = SyncCConfig.load(Path.of(line.getOptionValue("config")));
      if (line.hasOption("d"))
        config.dest_dir = line.getOptionValue("d");
      if (line.hasOption("I"))
        config.include_dirs.addAll(List.of(line.getOptionValues("I")));
      if (line.hasOption("O")) {
        try {
          config.optimization_level = Integer.parseInt(line.getOptionValue("O"));
        } catch (NumberFormatException e) {
          throw new ParseException("Optimization level must be a number: " + line.getOptionValue("O"));
        }
      }
      if (line.hasOption("o"))
        config.output = line.getOptionValue("o");
      if (line.hasOption("interface"))
        config.generate_interface = true;

      String outputName = config.output;
      Optional<BackendKind> backend_opt = BackendKind.fromSerialName(outputName);
      if (backend_opt.isEmpty())
        throw new ParseException("Unknown backend '" + outputName + "', expected one of C, horn, lustre");
      backend = backend_opt.get();
      files = line.getArgList();
      if (files.isEmpty())
        throw new ParseException("No input file");
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp();
      return 1;
    } catch (CompilerException | IOException e) {
      logger.fatal(e.getMessage());
      return 1;
    }

    //////////   invoke the compiler for each unit   //////////
    SyncC compiler = new SyncC(config, backend);
    for (String file : files) {
      try {
        compiler.compileFile(Path.of(file));
      } catch (CompilerException e) {
        logger.fatal("{} error: {}", e.getKind(), e.getMessage());
        if (e.isInternal())
          logger.debug("Internal error details", e);
        return 1;
      } catch (IOException e) {
        logger.fatal("Cannot process {}: {}", file, e.getMessage());
        return 1;
      }
    }
    return 0;
  }
}
