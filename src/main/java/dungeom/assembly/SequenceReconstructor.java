package dungeom.assembly;

import java.util.List;

/**
 * Merges the nodes of a tour into a single sequence.
 */
public class SequenceReconstructor {
  private SequenceReconstructor() {
  }

  /**
   * Consecutive kmers in a tour overlap by K - 1 letters, so the sequence is
   * the first kmer followed by the last letter of every other kmer.
   *
   * @param tour: The kmers in the order they were visited.
   * @return The superstring.
   */
  public static String toSuperstring(List<String> tour) {
    if (tour.isEmpty()) {
      throw new IllegalArgumentException(
          "Can't build a sequence from an empty tour.");
    }
    String first = tour.get(0);
    StringBuilder builder = new StringBuilder(first.length() + tour.size());
    builder.append(first);
    for (int i = 1; i < tour.size(); ++i) {
      String kmer = tour.get(i);
      builder.append(kmer.charAt(kmer.length() - 1));
    }
    return builder.toString();
  }
}
