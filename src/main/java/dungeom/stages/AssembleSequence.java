/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dungeom.stages;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import dungeom.assembly.AssemblyOptions;
import dungeom.assembly.AssemblyResult;
import dungeom.assembly.EulerianAssembler;
import dungeom.assembly.NoEulerianTrailException;
import dungeom.sequences.InvalidSequenceException;
import dungeom.sequences.SequenceValidator;

/**
 * Break a DNA sequence into kmers and reassemble it by finding an Eulerian
 * trail through the de Bruijn graph of the kmers.
 *
 * The assembled sequence is printed followed by a line saying whether it is
 * identical to the input, e.g.
 *
 *   java dungeom.stages.AssembleSequence --sequence=ATGGGTCA --K=2
 */
public class AssembleSequence extends Stage {
  private static final Logger sLogger =
      Logger.getLogger(AssembleSequence.class);

  private PrintStream out = System.out;

  // Result of the last successful run.
  private AssemblyResult result;

  @Override
  protected Map<String, ParameterDefinition> createParameterDefinitions() {
    HashMap<String, ParameterDefinition> defs =
        new HashMap<String, ParameterDefinition>();

    defs.putAll(super.createParameterDefinitions());

    ParameterDefinition sequence = new ParameterDefinition(
        "sequence", "The DNA sequence to decompose and reassemble. At most " +
        SequenceValidator.MAX_SEQUENCE_LENGTH + " bp.", String.class, null);

    ParameterDefinition seed = new ParameterDefinition(
        "seed", "Seed for shuffling the edges. If not set the shuffle " +
        "differs on every run.", Long.class, null);

    ParameterDefinition maxAttempts = new ParameterDefinition(
        "max_attempts", "How many times to reshuffle and walk the graph " +
        "before giving up.", Integer.class,
        AssemblyOptions.DEFAULT_MAX_ATTEMPTS);

    ParameterDefinition timeout = new ParameterDefinition(
        "timeout_ms", "Give up after this many milliseconds. 0 means no " +
        "limit.", Long.class, 0L);

    ParameterDefinition printGraph = new ParameterDefinition(
        "print_graph", "Print the nodes, edges, frequencies and the tour.",
        Boolean.class, false);

    for (ParameterDefinition def : new ParameterDefinition[] {
             sequence, seed, maxAttempts, timeout, printGraph,
             DungeomParameters.getK()}) {
      defs.put(def.getName(), def);
    }
    return Collections.unmodifiableMap(defs);
  }

  @Override
  protected List<String> getRequiredParameters() {
    List<String> required = super.getRequiredParameters();
    required.remove("seed");
    return required;
  }

  @Override
  public List<InvalidParameter> validateParameters() {
    List<InvalidParameter> invalid = super.validateParameters();

    String sequence = (String) stage_options.get("sequence");
    int K = (Integer) stage_options.get("K");
    try {
      SequenceValidator.validateSequence(sequence);
      try {
        SequenceValidator.validateKMerSize(K, sequence.length());
      } catch (InvalidSequenceException e) {
        invalid.add(new InvalidParameter("K", e.getMessage()));
      }
    } catch (InvalidSequenceException e) {
      invalid.add(new InvalidParameter("sequence", e.getMessage()));
    }

    int maxAttempts = (Integer) stage_options.get("max_attempts");
    if (maxAttempts < 1) {
      invalid.add(new InvalidParameter(
          "max_attempts", "max_attempts must be at least 1."));
    }

    long timeout = (Long) stage_options.get("timeout_ms");
    if (timeout < 0) {
      invalid.add(new InvalidParameter(
          "timeout_ms", "timeout_ms can't be negative."));
    }
    return invalid;
  }

  /**
   * Where to print the assembly. Defaults to stdout.
   */
  public void setOutput(PrintStream out) {
    this.out = out;
  }

  /**
   * The result of the last successful run or null.
   */
  public AssemblyResult getResult() {
    return result;
  }

  @Override
  protected boolean stageMain() {
    String sequence = (String) stage_options.get("sequence");
    int K = (Integer) stage_options.get("K");

    AssemblyOptions options = new AssemblyOptions()
        .setMaxAttempts((Integer) stage_options.get("max_attempts"))
        .setTimeoutMillis((Long) stage_options.get("timeout_ms"));
    Long seed = (Long) stage_options.get("seed");
    if (seed != null) {
      options.setSeed(seed);
    }

    EulerianAssembler assembler = new EulerianAssembler(options);
    try {
      result = assembler.assemble(sequence, K);
    } catch (NoEulerianTrailException e) {
      sLogger.error("Assembly failed after " + e.getAttempts() +
                    " attempt(s).", e);
      return false;
    }

    if ((Boolean) stage_options.get("print_graph")) {
      out.println(result.formatDiagnostics());
    }

    // We print this rather than using a logger because we don't
    // want the logger preamble.
    out.println(result.getAssembled());
    out.println("Assembled sequence: " + result.getVerdict().getDescription());
    out.flush();
    return true;
  }

  public static void main(String[] args) throws Exception {
    AssembleSequence stage = new AssembleSequence();
    int res = stage.run(args);
    System.exit(res);
  }
}
