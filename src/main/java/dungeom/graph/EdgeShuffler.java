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
package dungeom.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Randomizes the order of the edges except for the first one.
 *
 * The first edge produced by DeBruijnGraphBuilder starts at the first kmer
 * of the sequence. Keeping it at index 0 pins the start of the assembly,
 * i.e. we assume the true start of the sequence is known. Only the order in
 * which the remaining edges are explored is random.
 */
public class EdgeShuffler {
  private final Random random;

  /**
   * @param random: Source of randomness. Pass a seeded generator to get
   *   reproducible shuffles.
   */
  public EdgeShuffler(Random random) {
    this.random = random;
  }

  /**
   * Return a shuffled copy of the edges. The input list isn't modified.
   *
   * The element at index 0 of the result is the same object as the element
   * at index 0 of the input.
   */
  public List<KMerEdge> shuffle(List<KMerEdge> edges) {
    ArrayList<KMerEdge> shuffled = new ArrayList<KMerEdge>(edges.size());
    if (edges.isEmpty()) {
      return shuffled;
    }
    KMerEdge pinned = edges.get(0);
    shuffled.addAll(edges.subList(1, edges.size()));
    Collections.shuffle(shuffled, random);
    shuffled.add(0, pinned);
    return shuffled;
  }
}
