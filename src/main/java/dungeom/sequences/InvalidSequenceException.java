package dungeom.sequences;

/**
 * Thrown when a sequence or kmer size can't be used to build a graph.
 */
public class InvalidSequenceException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidSequenceException(String message) {
    super(message);
  }
}
