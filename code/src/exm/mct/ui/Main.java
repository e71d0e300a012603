/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.mct.ui;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.mct.common.Logging;
import exm.mct.common.Settings;
import exm.mct.common.exceptions.InvalidOptionException;
import exm.mct.common.exceptions.MCTFatal;
import exm.mct.frontend.tree.Program;
import exm.mct.frontend.tree.TreeInspector;
import exm.mct.frontend.tree.TreeJson;

/**
 * Command line interface to the MCT translator.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String AST_JSON_FLAG = "j";
  private static final String TREE_FLAG = "t";
  private static final String STATS_FLAG = "s";
  private static final String TOKENS_FLAG = "k";
  private static final String CHECK_FLAG = "c";

  private static final String INPUT_EXT = ".c";
  private static final String OUTPUT_EXT = ".py";

  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {
    Args mctArgs = processArgs(args);

    Settings settings = null;
    try {
      settings = Settings.load();
      if (mctArgs.checkOnly) {
        settings = settings.with(Settings.OUTPUT_MODE, Settings.OUTPUT_NONE);
      }
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_SETTINGS.code());
    }

    Logger logger = null;
    try {
      logger = setupLogging(settings);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_SETTINGS.code());
    } catch (IOException ex) {
      System.err.println("Error opening log file: " + ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
    }

    String source = readInputFile(mctArgs);
    MCTCompiler mct = new MCTCompiler(logger, settings);
    File finalOutput = selectOutputFile(mctArgs);

    try {
      if (mctArgs.printTokens) {
        mct.printTokens(mctArgs.inputFilename, source, System.out);
      }

      Program program;
      if (mct.generatesOutput()) {
        // Use intermediate file so we don't create invalid output in case
        // of translation errors
        File tmpOutput = setupTmpOutput();
        OutputStream outStream = openForOutput(tmpOutput);
        try {
          program = mct.translate(mctArgs.inputFilename, source, outStream);
        } finally {
          IOUtils.closeQuietly(outStream);
        }
        copyToOutput(tmpOutput, finalOutput);
      } else {
        program = mct.translate(mctArgs.inputFilename, source, null);
      }

      reportProgram(mctArgs, program);
      cleanupFiles(true, mctArgs);
    } catch (MCTFatal ex) {
      // Cleanup output file if present
      cleanupFiles(false, mctArgs);
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  static Options initOptions() {
    Options opts = new Options();

    Option json = new Option(AST_JSON_FLAG, "ast-json", true,
                             "Write syntax tree as JSON to file");
    json.setArgName("file");
    opts.addOption(json);

    opts.addOption(TREE_FLAG, "tree", false, "Print syntax tree");
    opts.addOption(STATS_FLAG, "stats", false,
                   "Print node counts and function summary");
    opts.addOption(TOKENS_FLAG, "tokens", false, "Print token stream");
    opts.addOption(CHECK_FLAG, "check", false,
                   "Check program only, do not generate Python");
    return opts;
  }

  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
                         "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    return new Args(input, output, cmd.getOptionValue(AST_JSON_FLAG),
                    cmd.hasOption(TREE_FLAG), cmd.hasOption(STATS_FLAG),
                    cmd.hasOption(TOKENS_FLAG), cmd.hasOption(CHECK_FLAG));
  }

  private static Logger setupLogging(Settings settings)
      throws InvalidOptionException, IOException {
    String logfile = settings.get(Settings.LOG_FILE);
    boolean trace = settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("mct [options] <input> [<output>]", opts);
  }

  private static String readInputFile(Args args) {
    File input = new File(args.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      System.err.println("Error while reading input file: " +
                         ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  /**
   * Output defaults to the input file with a .py extension
   */
  static File selectOutputFile(Args args) {
    String outputFilename;
    if (args.outputFilename != null) {
      outputFilename = args.outputFilename;
    } else {
      String infile = args.inputFilename;
      String prefix;
      if (infile.endsWith(INPUT_EXT)) {
        prefix = infile.substring(0, infile.length() - INPUT_EXT.length());
      } else {
        prefix = infile;
      }
      outputFilename = prefix + OUTPUT_EXT;
    }
    return new File(outputFilename);
  }

  private static void reportProgram(Args args, Program program) {
    if (args.printTree) {
      System.out.print(TreeInspector.printTree(program));
    }
    if (args.printStats) {
      System.out.print(TreeInspector.stats(program));
    }
    if (args.jsonFilename != null) {
      try {
        FileUtils.writeStringToFile(new File(args.jsonFilename),
                        TreeJson.toJson(program), StandardCharsets.UTF_8);
      } catch (IOException e) {
        System.err.println("Error writing syntax tree to " +
                           args.jsonFilename + ": " + e.getMessage());
        throw new MCTFatal(ExitCode.ERROR_IO.code());
      }
    }
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("mct-out", OUTPUT_EXT);
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      throw new MCTFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static OutputStream openForOutput(File outfile) {
    try {
      FileOutputStream stream = new FileOutputStream(outfile);
      return new BufferedOutputStream(stream);
    } catch (FileNotFoundException e) {
      System.err.println("Unexpected error opening " +
                         outfile.getAbsolutePath() + " for output: " +
                         e.getMessage());
      throw new MCTFatal(ExitCode.ERROR_IO.code());
    }
  }

  /**
   * Copy input file to output file.  In event of failure, throw a fatal error
   * @param inputFile
   * @param output
   */
  private static void copyToOutput(File inputFile, File output) {
    // Use output stream since it interacts better with non-seekable
    // devices such as /dev/stdout
    try (PrintStream outStream = new PrintStream(new FileOutputStream(output))) {
      FileUtils.copyFile(inputFile, outStream);
    } catch (IOException e) {
      System.err.println("Error copying output to " + output + ": " +
                         e.getMessage());
      throw new MCTFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void cleanupFiles(boolean success, Args mctArgs) {
    if (!success && mctArgs.outputFilename != null) {
      File outFile = new File(mctArgs.outputFilename);
      if (outFile.exists()) {
        outFile.delete();
      }
    }
    for (File temp: temporaries) {
      if (temp.exists()) {
        temp.delete();
      }
    }
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final String jsonFilename;
    public final boolean printTree;
    public final boolean printStats;
    public final boolean printTokens;
    public final boolean checkOnly;

    public Args(String inputFilename, String outputFilename,
                String jsonFilename, boolean printTree, boolean printStats,
                boolean printTokens, boolean checkOnly) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.jsonFilename = jsonFilename;
      this.printTree = printTree;
      this.printStats = printStats;
      this.printTokens = printTokens;
      this.checkOnly = checkOnly;
    }
  }
}
