package dungeom.assembly;

/**
 * Compares the assembly to the original sequence.
 */
public class Verifier {
  private Verifier() {
  }

  public static Verdict verify(String assembled, String original) {
    return assembled.equals(original) ? Verdict.IDENTICAL
        : Verdict.NOT_IDENTICAL;
  }
}
