package dungeom.assembly;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import dungeom.graph.DeBruijnGraphBuilder;
import dungeom.graph.EdgeFrequencies;
import dungeom.graph.KMerEdge;
import dungeom.graph.StartSelector;
import dungeom.sequences.InvalidSequenceException;

public class TestEulerianAssembler {
  private Map<KMerEdge, Integer> countEdges(List<KMerEdge> edges) {
    HashMap<KMerEdge, Integer> counts = new HashMap<KMerEdge, Integer>();
    for (KMerEdge edge : edges) {
      Integer count = counts.get(edge);
      counts.put(edge, count == null ? 1 : count + 1);
    }
    return counts;
  }

  private AssemblyResult assemble(String sequence, int K, long seed) {
    AssemblyOptions options = new AssemblyOptions().setSeed(seed);
    return new EulerianAssembler(options).assemble(sequence, K);
  }

  @Test
  public void testUniqueTrail() {
    String sequence = "ATCGATCCCTGA";
    for (long seed = 0; seed < 50; ++seed) {
      AssemblyResult result = assemble(sequence, 3, seed);
      assertEquals(sequence, result.getAssembled());
      assertEquals(Verdict.IDENTICAL, result.getVerdict());
      assertEquals(1, result.getAttempts());
      assertEquals(9, result.getGraph().numEdges());
      assertEquals(9, result.getGraph().numNodes());
      assertEquals(10, result.getTour().size());
      assertSame(
          result.getGraph().getEdges().get(0),
          result.getShuffledEdges().get(0));
    }
  }

  @Test
  public void testSelfLoops() {
    for (long seed = 0; seed < 10; ++seed) {
      AssemblyResult result = assemble("AAAA", 2, seed);
      assertEquals("AAAA", result.getAssembled());
      assertTrue(result.isIdentical());
      assertEquals(4, (int) result.getFrequencies().get("AA"));
    }
  }

  @Test
  public void testLargestK() {
    AssemblyResult result = assemble("GATTACA", 6, 1);
    assertEquals(2, result.getTour().size());
    assertEquals("GATTACA", result.getAssembled());
  }

  @Test
  public void testLowerCaseInput() {
    AssemblyResult result = assemble("gattaca", 3, 1);
    assertEquals("GATTACA", result.getOriginal());
    assertEquals("GATTACA", result.getAssembled());
    assertTrue(result.isIdentical());
  }

  /**
   * A generator whose nextInt always returns the same draw, clamped to the
   * bound. Collections.shuffle swaps index i - 1 with nextInt(i) so the
   * resulting order is fixed.
   */
  private static class FixedDrawRandom extends Random {
    private static final long serialVersionUID = 1L;
    private final int draw;

    FixedDrawRandom(int draw) {
      this.draw = draw;
    }

    @Override
    public int nextInt(int bound) {
      return Math.min(draw, bound - 1);
    }
  }

  private void assertValidReconstruction(AssemblyResult result, int K) {
    String assembled = result.getAssembled();
    assertEquals(result.getOriginal().length(), assembled.length());
    // Every reconstruction decomposes into the same edges.
    assertEquals(
        countEdges(result.getGraph().getEdges()),
        countEdges(new DeBruijnGraphBuilder().build(assembled, K)
            .getEdges()));
  }

  @Test
  public void testAmbiguousReconstruction() {
    // The loops A->C->A and A->G->A can be walked in either order.
    String sequence = "TACAGA";
    {
      // Always drawing the last index leaves the edges in sequence order.
      AssemblyOptions options =
          new AssemblyOptions().setRandom(new FixedDrawRandom(100));
      AssemblyResult result =
          new EulerianAssembler(options).assemble(sequence, 1);
      assertValidReconstruction(result, 1);
      assertEquals("TACAGA", result.getAssembled());
      assertEquals(Verdict.IDENTICAL, result.getVerdict());
    }
    {
      // Always drawing index 0 moves A->G ahead of A->C.
      AssemblyOptions options =
          new AssemblyOptions().setRandom(new FixedDrawRandom(0));
      AssemblyResult result =
          new EulerianAssembler(options).assemble(sequence, 1);
      assertValidReconstruction(result, 1);
      assertEquals("TAGACA", result.getAssembled());
      assertEquals(Verdict.NOT_IDENTICAL, result.getVerdict());
      assertEquals(1, result.getAttempts());
    }
  }

  @Test
  public void testAmbiguousReconstructionOverSeeds() {
    String sequence = "TACAGA";
    int identical = 0;
    int different = 0;
    for (long seed = 0; seed < 1000; ++seed) {
      AssemblyResult result = assemble(sequence, 1, seed);
      assertValidReconstruction(result, 1);
      if (result.isIdentical()) {
        ++identical;
      } else {
        assertEquals("TAGACA", result.getAssembled());
        ++different;
      }
    }
    assertTrue(identical > 0);
    assertTrue(different > 0);
  }

  @Test
  public void testOptionsChangedAfterConstruction() {
    AssemblyOptions options =
        new AssemblyOptions().setRandom(new FixedDrawRandom(100));
    EulerianAssembler assembler = new EulerianAssembler(options);
    assertEquals("TACAGA", assembler.assemble("TACAGA", 1).getAssembled());

    // The new source of randomness applies to the next assembly.
    options.setRandom(new FixedDrawRandom(0));
    assertEquals("TAGACA", assembler.assemble("TACAGA", 1).getAssembled());

    options.setMaxAttempts(1).setStartSelector(new LastKMerStart());
    try {
      assembler.assemble("GATTACA", 3);
      fail("Expected no Eulerian trail from the last kmer.");
    } catch (NoEulerianTrailException e) {
      assertEquals(1, e.getAttempts());
    }
  }

  @Test
  public void testRandomSequences() {
    Random generator = new Random(11);
    char[] letters = {'A', 'C', 'G', 'T'};
    for (int trial = 0; trial < 100; ++trial) {
      int length = 2 + generator.nextInt(100);
      StringBuilder builder = new StringBuilder();
      for (int i = 0; i < length; ++i) {
        builder.append(letters[generator.nextInt(letters.length)]);
      }
      String sequence = builder.toString();
      int K = 1 + generator.nextInt(length - 1);

      AssemblyResult result = assemble(sequence, K, trial);
      assertEquals(sequence.length(), result.getAssembled().length());
      assertEquals(result.getGraph().numEdges() + 1, result.getTour().size());
      assertEquals(
          countEdges(result.getGraph().getEdges()),
          countEdges(new DeBruijnGraphBuilder().build(
              result.getAssembled(), K).getEdges()));
      assertEquals(
          2 * result.getGraph().numEdges(),
          EdgeFrequencies.sum(result.getFrequencies()));
    }
  }

  // Starts the walk at the node which has no outgoing edges.
  private static class LastKMerStart implements StartSelector {
    @Override
    public String selectStart(List<KMerEdge> shuffledEdges, Set<String> nodes) {
      for (String node : nodes) {
        boolean hasOutgoing = false;
        for (KMerEdge edge : shuffledEdges) {
          if (edge.source.equals(node)) {
            hasOutgoing = true;
            break;
          }
        }
        if (!hasOutgoing) {
          return node;
        }
      }
      throw new IllegalStateException("Every node has an outgoing edge.");
    }
  }

  @Test
  public void testRetriesAreBounded() {
    AssemblyOptions options = new AssemblyOptions()
        .setSeed(3)
        .setMaxAttempts(7)
        .setStartSelector(new LastKMerStart());
    try {
      new EulerianAssembler(options).assemble("ATCGATCCCTGA", 3);
      fail("Expected the retry budget to run out.");
    } catch (NoEulerianTrailException e) {
      assertEquals(7, e.getAttempts());
      assertFalse(e.isDeadlineExceeded());
      assertNotNull(e.getMessage());
    }
  }

  @Test
  public void testDeadline() {
    AssemblyOptions options = new AssemblyOptions()
        .setSeed(3)
        .setMaxAttempts(Integer.MAX_VALUE)
        .setTimeoutMillis(50)
        .setStartSelector(new LastKMerStart());
    try {
      new EulerianAssembler(options).assemble("ATCGATCCCTGA", 3);
      fail("Expected the deadline to pass.");
    } catch (NoEulerianTrailException e) {
      assertTrue(e.isDeadlineExceeded());
      assertTrue(e.getAttempts() > 0);
    }
  }

  @Test
  public void testInvalidInput() {
    String[][] cases = {{"ACGT", "4"}, {"ACGT", "0"}, {"ACNT", "2"}};
    for (String[] input : cases) {
      try {
        new EulerianAssembler().assemble(input[0], Integer.parseInt(input[1]));
        fail("Expected input to be rejected: " + input[0] + " " + input[1]);
      } catch (InvalidSequenceException e) {
        // Expected.
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidMaxAttempts() {
    new AssemblyOptions().setMaxAttempts(0);
  }

  @Test
  public void testDiagnostics() {
    AssemblyResult result = assemble("ACGTA", 2, 0);
    String text = result.formatDiagnostics();
    assertTrue(text.contains("Nodes: AC, CG, GT, TA"));
    assertTrue(text.contains("Edges: (AC, CG), (CG, GT), (GT, TA)"));
    assertTrue(text.contains("Frequencies: AC=1, CG=2, GT=2, TA=1"));
    assertTrue(text.contains("Tour: AC -> CG -> GT -> TA"));
    assertTrue(text.contains("Attempts: 1"));
  }
}
