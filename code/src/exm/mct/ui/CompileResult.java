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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.mct.common.Diagnostic;
import exm.mct.frontend.tree.Program;

/**
 * Outcome of compiling one source text: either the checked program, or
 * at least one diagnostic and no program.
 */
public class CompileResult {
  private final Program program;
  private final List<Diagnostic> diagnostics;

  private CompileResult(Program program, List<Diagnostic> diagnostics) {
    this.program = program;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public static CompileResult succeeded(Program program) {
    return new CompileResult(program, ImmutableList.<Diagnostic>of());
  }

  public static CompileResult failed(List<Diagnostic> diagnostics) {
    if (diagnostics.isEmpty()) {
      throw new IllegalArgumentException("Failed result needs diagnostics");
    }
    return new CompileResult(null, diagnostics);
  }

  public boolean isSuccess() {
    return diagnostics.isEmpty();
  }

  /**
   * @return the checked tree, or null if compilation failed
   */
  public Program getProgram() {
    return program;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "success";
    }
    StringBuilder sb = new StringBuilder();
    for (Diagnostic d: diagnostics) {
      sb.append(d.toString());
      sb.append('\n');
    }
    return sb.toString();
  }
}
