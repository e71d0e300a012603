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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.mct.ast.SourceToken;
import exm.mct.ast.TokenSequence;
import exm.mct.common.Diagnostic;
import exm.mct.common.Logging;
import exm.mct.common.Settings;
import exm.mct.common.exceptions.InvalidOptionException;
import exm.mct.common.exceptions.LexicalError;
import exm.mct.common.exceptions.MCTFatal;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SemanticError;
import exm.mct.common.exceptions.UserException;
import exm.mct.common.util.Misc;
import exm.mct.frontend.ParsedModule;
import exm.mct.frontend.SemanticAnalyzer;
import exm.mct.frontend.TreeBuilder;
import exm.mct.frontend.tree.Program;
import exm.mct.pybackend.PythonGenerator;

/**
 * This is the main entry point to the translator
 */
public class MCTCompiler {

  private final Logger logger;
  private final Settings settings;

  public MCTCompiler(Logger logger, Settings settings) {
    this.logger = logger;
    this.settings = settings;
  }

  public MCTCompiler() {
    this(Logging.getMCTLogger(), Settings.defaults());
  }

  public CompileResult compile(String source) {
    return compile(null, source);
  }

  /**
   * Lex, parse and check a Mini-C program.  User errors are returned as
   * diagnostics: the first lexical or syntax error stops compilation,
   * while semantic errors are all reported together.
   * @param fileName name used in positions, may be null
   * @param source program text
   */
  public CompileResult compile(String fileName, String source) {
    logger.debug("MCT front end starting: " + Misc.timestamp());
    String text = Misc.normaliseNewlines(source);

    Program program;
    try {
      ParsedModule parsed = ParsedModule.parse(fileName, text);
      program = new TreeBuilder(logger, fileName).build(parsed);
    } catch (UserException e) {
      logger.debug("Parsing failed: " + e.getMessage());
      return CompileResult.failed(
          Collections.singletonList(Diagnostic.fromException(e)));
    }

    SemanticAnalyzer analyzer = new SemanticAnalyzer(logger, fileName);
    List<SemanticError> errors = analyzer.analyze(program);
    if (!errors.isEmpty()) {
      List<Diagnostic> diagnostics = new ArrayList<Diagnostic>(errors.size());
      for (SemanticError e: errors) {
        diagnostics.add(Diagnostic.fromException(e));
      }
      return CompileResult.failed(diagnostics);
    }
    logger.debug("MCT front end done: " + Misc.timestamp());
    return CompileResult.succeeded(program);
  }

  /**
   * Generate Python for a program that compiled successfully
   */
  public String generate(Program program) {
    return pythonGenerator().generate(program);
  }

  private PythonGenerator pythonGenerator() {
    try {
      return new PythonGenerator(logger,
                      settings.getInt(Settings.CODEGEN_INDENT_WIDTH),
                      settings.getBoolean(Settings.CODEGEN_HEADER),
                      settings.getBoolean(Settings.CODEGEN_MAIN_GUARD));
    } catch (InvalidOptionException e) {
      // Settings are validated when loaded
      throw new MCTRuntimeError("Invalid code generation settings", e);
    }
  }

  /**
   * @return true if Python output should be generated
   */
  public boolean generatesOutput() {
    return settings.get(Settings.OUTPUT_MODE).equalsIgnoreCase(
                                               Settings.OUTPUT_PYTHON);
  }

  /**
   * Translate a Mini-C file to Python on the output stream, reporting
   * errors on stderr.
   * @param inputFile file name used in messages
   * @param source program text
   * @param output where Python goes, ignored if output is switched off.
   *        Closed on return, whether or not translation succeeded.
   * @return checked program
   * @throws MCTFatal with exit code if translation failed
   */
  public Program translate(String inputFile, String source,
                           OutputStream output) {
    try {
      logger.info("MCT starting: " + Misc.timestamp());
      CompileResult result = compile(inputFile, source);
      if (!result.isSuccess()) {
        reportErrors(result.getDiagnostics());
        throw new MCTFatal(ExitCode.ERROR_USER.code());
      }

      Program program = result.getProgram();
      if (generatesOutput()) {
        String code = generate(program);
        try {
          output.write(code.getBytes(StandardCharsets.UTF_8));
          output.close();
        } catch (IOException e) {
          System.err.println("I/O error while writing to output");
          System.err.println(e.getMessage());
          throw new MCTFatal(ExitCode.ERROR_IO.code());
        }
      }
      logger.debug("MCT done: " + Misc.timestamp());
      return program;
    }
    catch (MCTFatal e) {
      // Rethrow
      throw e;
    }
    catch (Throwable e) {
      reportInternalError(logger, e);
      throw new MCTFatal(ExitCode.ERROR_INTERNAL.code());
    }
    finally {
      // Already closed on success
      IOUtils.closeQuietly(output);
    }
  }

  /**
   * Print the token stream of a program, one token per line
   * @throws MCTFatal if the program has a lexical error
   */
  public void printTokens(String inputFile, String source, PrintStream out) {
    try {
      List<SourceToken> tokens = new TokenSequence(inputFile,
                            Misc.normaliseNewlines(source)).toList();
      for (SourceToken tok: tokens) {
        out.println(tok);
      }
    } catch (LexicalError e) {
      reportErrors(Collections.singletonList(Diagnostic.fromException(e)));
      throw new MCTFatal(ExitCode.ERROR_USER.code());
    }
  }

  private void reportErrors(List<Diagnostic> diagnostics) {
    System.err.println("mct error:");
    for (Diagnostic d: diagnostics) {
      System.err.println(d);
    }
    logger.debug(diagnostics.size() + " errors reported");
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    System.err.println("MCT INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
    if (logger.isDebugEnabled()) {
      logger.debug("Internal error: " + Misc.stackTrace(e));
    }
  }
}
