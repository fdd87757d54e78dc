package dungeom.graph;

/**
 * An immutable directed edge between two kmers.
 *
 * The last K - 1 letters of the source equal the first K - 1 letters of the
 * destination. Equality is structural so the edge list of a graph may hold
 * several edges which are equal but are distinct objects.
 */
public final class KMerEdge {
  public final String source;
  public final String dest;

  public KMerEdge(String source, String dest) {
    this.source = source;
    this.dest = dest;
  }

  /**
   * Returns true if the edge starts and ends at the same kmer.
   */
  public boolean isSelfLoop() {
    return source.equals(dest);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof KMerEdge)) {
      return false;
    }
    KMerEdge other = (KMerEdge) o;
    return source.equals(other.source) && dest.equals(other.dest);
  }

  @Override
  public int hashCode() {
    return 31 * source.hashCode() + dest.hashCode();
  }

  /**
   * A convenience method for displaying the value as a string.
   */
  @Override
  public String toString() {
    return "(" + source + ", " + dest + ")";
  }
}
