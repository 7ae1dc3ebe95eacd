package svtopo.ui;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import svtopo.SVTopo;
import svtopo.parse.SVParseException;
import svtopo.parse.SyntaxTreeReader;
import svtopo.tree.SyntaxTree;
import svtopo.util.TopologyWriter;

public class SVTopoCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  static final String REPORT_INSTANCES = "instances";
  static final String REPORT_TOPOLOGY = "topology";

  // options for cmdline parser
  static Options options = new Options();
  static {
    options.addOption(Option.builder("t")
                          .longOpt("tree")
                          .argName("tree.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML dump of the SystemVerilog syntax tree to analyze")
                          .build());
    options.addOption(Option.builder("r")
                          .longOpt("report")
                          .argName("kind")
                          .hasArg()
                          .required(false)
                          .desc("Report to generate, one of: " + REPORT_INSTANCES + ", " + REPORT_TOPOLOGY + " (default)")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("out")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the report to; standard output if not set")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(PrintStream out) {
    PrintWriter writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    helper.printHelp(writer, helper.getWidth(), "svtopo - extract modules, instances and connections from a SystemVerilog syntax tree",
                     null, options, helper.getLeftPadding(), helper.getDescPadding(), null, true);
    writer.flush();
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the report
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs the tool.
   * @return the exit code: 0 on success, 1 if the tree or the report file failed, -1 on invalid arguments
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String treeFile = "";
    String report = REPORT_TOPOLOGY;
    String outFile = null;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(out);
        return -1;
      }

      treeFile = line.getOptionValue("t");
      if (line.hasOption("r"))
        report = line.getOptionValue("r");
      if (!report.equals(REPORT_INSTANCES) && !report.equals(REPORT_TOPOLOGY)) {
        err.println("Unknown report kind: " + report);
        printHelp(err);
        return -1;
      }
      outFile = line.getOptionValue("o");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      err.println(exp.getMessage());
      printHelp(err);
      return -1;
    }

    //////////   read the tree   //////////
    SyntaxTree tree;
    try {
      tree = new SyntaxTreeReader().read(Paths.get(treeFile));
    } catch (SVParseException e) {
      logger.error("Cannot read the syntax tree: {}", e.getMessage());
      return 1;
    }
    logger.info("Read {} syntax node(s) from {}", tree.getNodes().size(), treeFile);

    //////////   extract and write the report   //////////
    TopologyWriter topologyWriter = new TopologyWriter();
    try (Writer writer = openOutput(outFile, out)) {
      if (report.equals(REPORT_INSTANCES))
        topologyWriter.WriteInstanceMap(SVTopo.getModuleInstanceMap(tree), writer);
      else
        topologyWriter.WriteTopology(SVTopo.getCircuitTopology(tree), writer);
    } catch (IOException e) {
      logger.error("Cannot write the {} report to {}: {}", report, outFile == null ? "stdout" : outFile, e.getMessage());
      return 1;
    }
    if (outFile != null)
      logger.info("Wrote {} report to {}", report, outFile);
    return 0;
  }

  private static Writer openOutput(String outFile, PrintStream out) throws IOException {
    if (outFile == null) {
      // Do not close the caller's stream along with the writer.
      return new OutputStreamWriter(out, StandardCharsets.UTF_8) {
        @Override
        public void close() throws IOException {
          flush();
        }
      };
    }
    Path outPath = Paths.get(outFile);
    if (outPath.getParent() != null)
      Files.createDirectories(outPath.getParent());
    return Files.newBufferedWriter(outPath, StandardCharsets.UTF_8);
  }
}
