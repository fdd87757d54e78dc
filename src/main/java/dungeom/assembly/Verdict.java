package dungeom.assembly;

/**
 * Whether the assembled sequence equals the input.
 *
 * NOT_IDENTICAL doesn't mean the tour was wrong. When kmers repeat the graph
 * can have several Eulerian trails and each of them spells a valid
 * reconstruction.
 */
public enum Verdict {
  IDENTICAL("identical"),
  NOT_IDENTICAL("not identical");

  private final String description;

  Verdict(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
