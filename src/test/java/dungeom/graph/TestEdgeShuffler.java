package dungeom.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.Test;

public class TestEdgeShuffler {
  private Map<KMerEdge, Integer> countEdges(List<KMerEdge> edges) {
    HashMap<KMerEdge, Integer> counts = new HashMap<KMerEdge, Integer>();
    for (KMerEdge edge : edges) {
      Integer count = counts.get(edge);
      counts.put(edge, count == null ? 1 : count + 1);
    }
    return counts;
  }

  @Test
  public void testFirstEdgeIsPinned() {
    DeBruijnGraph graph =
        new DeBruijnGraphBuilder().build("ATCGATCCCTGAAGCT", 3);
    List<KMerEdge> edges = graph.getEdges();

    for (long seed = 0; seed < 100; ++seed) {
      EdgeShuffler shuffler = new EdgeShuffler(new Random(seed));
      List<KMerEdge> shuffled = shuffler.shuffle(edges);

      assertEquals(edges.size(), shuffled.size());
      assertSame(edges.get(0), shuffled.get(0));
      assertEquals(countEdges(edges), countEdges(shuffled));
    }
  }

  @Test
  public void testInputIsNotModified() {
    List<KMerEdge> edges =
        new DeBruijnGraphBuilder().build("GATTACAGATTACA", 2).getEdges();
    ArrayList<KMerEdge> copy = new ArrayList<KMerEdge>(edges);
    new EdgeShuffler(new Random(3)).shuffle(copy);
    assertEquals(edges, copy);
  }

  @Test
  public void testSameSeedSameOrder() {
    List<KMerEdge> edges =
        new DeBruijnGraphBuilder().build("GATTACAGATTACA", 2).getEdges();
    List<KMerEdge> first = new EdgeShuffler(new Random(42)).shuffle(edges);
    List<KMerEdge> second = new EdgeShuffler(new Random(42)).shuffle(edges);
    assertEquals(first, second);
  }

  @Test
  public void testShortLists() {
    EdgeShuffler shuffler = new EdgeShuffler(new Random(1));
    assertTrue(shuffler.shuffle(new ArrayList<KMerEdge>()).isEmpty());

    ArrayList<KMerEdge> single = new ArrayList<KMerEdge>();
    single.add(new KMerEdge("AC", "CG"));
    List<KMerEdge> shuffled = shuffler.shuffle(single);
    assertEquals(1, shuffled.size());
    assertSame(single.get(0), shuffled.get(0));
  }
}
