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
package dungeom.assembly;

import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import dungeom.Timer;
import dungeom.graph.DeBruijnGraph;
import dungeom.graph.DeBruijnGraphBuilder;
import dungeom.graph.EdgeFrequencies;
import dungeom.graph.EdgeShuffler;
import dungeom.graph.EulerianTourFinder;
import dungeom.graph.KMerEdge;
import dungeom.graph.TraversalAttempt;
import dungeom.sequences.SequenceValidator;

/**
 * Reassembles a sequence from its kmers.
 *
 * Each attempt rebuilds the de Bruijn graph, shuffles the edges (keeping
 * the first one in place), computes the occurrence counts and walks the
 * graph once. If the walk didn't consume every edge the whole attempt is
 * thrown away and we try again with a new shuffle. Since every attempt
 * starts from the same node and uses the same edges, a graph without an
 * Eulerian trail from that node never succeeds; the number of attempts and
 * optionally the wall clock time are therefore bounded and
 * NoEulerianTrailException is thrown once the budget is used up.
 */
public class EulerianAssembler {
  private static final Logger sLogger =
      Logger.getLogger(EulerianAssembler.class);

  private final AssemblyOptions options;
  private final DeBruijnGraphBuilder graphBuilder;
  private final EulerianTourFinder tourFinder;

  /**
   * The options are read on every call to assemble so later changes to
   * them, e.g. a new seed, apply to the next assembly.
   */
  public EulerianAssembler(AssemblyOptions options) {
    this.options = options;
    this.graphBuilder = new DeBruijnGraphBuilder();
    this.tourFinder = new EulerianTourFinder();
  }

  public EulerianAssembler() {
    this(new AssemblyOptions());
  }

  /**
   * Assemble the sequence.
   *
   * @param sequence: The DNA sequence. Lower case letters are accepted.
   * @param K: Length of the kmers.
   * @return The result of the first attempt which consumed every edge.
   * @throws dungeom.sequences.InvalidSequenceException if the inputs
   *   are invalid.
   * @throws NoEulerianTrailException if the retry budget is exhausted.
   */
  public AssemblyResult assemble(String sequence, int K) {
    String normalized = SequenceValidator.validate(sequence, K);

    EdgeShuffler shuffler = new EdgeShuffler(options.getRandom());
    Timer timer = new Timer("assembly");
    timer.start();
    int attempt = 0;
    try {
      while (attempt < options.getMaxAttempts()) {
        if (deadlineExceeded(timer)) {
          throw exhausted(normalized, K, attempt, true);
        }
        ++attempt;

        DeBruijnGraph graph = graphBuilder.build(normalized, K);
        List<KMerEdge> shuffled = shuffler.shuffle(graph.getEdges());
        Map<String, Integer> frequencies =
            EdgeFrequencies.compute(shuffled, graph.getNodes());
        String start = options.getStartSelector().selectStart(
            shuffled, graph.getNodes());

        TraversalAttempt traversal =
            tourFinder.findTour(shuffled, start, frequencies);

        if (options.getCompletionCheck().isComplete(traversal)) {
          String assembled =
              SequenceReconstructor.toSuperstring(traversal.getTour());
          Verdict verdict = Verifier.verify(assembled, normalized);
          sLogger.info(String.format(
              "Assembled %d bp with K=%d after %d attempt(s): %s",
              assembled.length(), K, attempt, verdict.getDescription()));
          return new AssemblyResult(
              normalized, graph, shuffled, frequencies, traversal.getTour(),
              assembled, verdict, attempt);
        }

        sLogger.info(String.format(
            "Attempt %d left %d of %d edges unused. Reshuffling.",
            attempt, traversal.getRemainingEdges(),
            traversal.getTotalEdges()));
      }
    } finally {
      timer.stop();
      if (sLogger.isDebugEnabled()) {
        sLogger.debug(timer.toString());
      }
    }
    throw exhausted(normalized, K, attempt, false);
  }

  private boolean deadlineExceeded(Timer timer) {
    return options.getTimeoutMillis() > 0
        && timer.elapsedMillis() >= options.getTimeoutMillis();
  }

  private NoEulerianTrailException exhausted(
      String sequence, int K, int attempts, boolean deadline) {
    String reason = deadline ?
        "the deadline of " + options.getTimeoutMillis() + " ms passed" :
        "the limit of " + options.getMaxAttempts() + " attempts was reached";
    String message = String.format(
        "No Eulerian trail found for a %d bp sequence with K=%d; %s after " +
        "%d attempt(s).", sequence.length(), K, reason, attempts);
    sLogger.error(message);
    return new NoEulerianTrailException(message, attempts, deadline);
  }
}
