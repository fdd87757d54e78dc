package dungeom.sequences;

/**
 * The 4 DNA bases {"A", "C", "G", "T"}.
 *
 * Letters are stored upper case. Lookups are case insensitive so that
 * sequences typed by hand can be checked before they are normalized.
 */
public final class DNAAlphabet {
  private static final char[] LETTERS = {'A', 'C', 'G', 'T'};

  private DNAAlphabet() {
  }

  /**
   * Returns true if letter is one of A, C, G or T in either case.
   */
  public static boolean isValid(char letter) {
    char upper = Character.toUpperCase(letter);
    for (char valid : LETTERS) {
      if (valid == upper) {
        return true;
      }
    }
    return false;
  }

  public static int size() {
    return LETTERS.length;
  }
}
