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
package dungeom.sequences;

import java.util.Locale;

/**
 * Checks the sequence and kmer size supplied by the user.
 *
 * A sequence is valid if it is non empty, no longer than
 * MAX_SEQUENCE_LENGTH and only contains the letters of the DNAAlphabet.
 * Case is ignored; use normalize to get the upper case form which the graph
 * is built from.
 */
public class SequenceValidator {
  // Longest sequence in bp that we accept.
  public static final int MAX_SEQUENCE_LENGTH = 1000;

  private SequenceValidator() {
  }

  /**
   * Return the upper case form of the sequence.
   */
  public static String normalize(String sequence) {
    return sequence.toUpperCase(Locale.ROOT);
  }

  /**
   * Check the sequence.
   *
   * @param sequence: The raw sequence; may be lower case.
   * @throws InvalidSequenceException if the sequence is empty, too long
   *   or contains a letter which isn't a DNA base.
   */
  public static void validateSequence(String sequence) {
    if (sequence == null || sequence.isEmpty()) {
      throw new InvalidSequenceException("The sequence is empty.");
    }
    if (sequence.length() > MAX_SEQUENCE_LENGTH) {
      throw new InvalidSequenceException(String.format(
          "The sequence has length %d but at most %d bp are allowed.",
          sequence.length(), MAX_SEQUENCE_LENGTH));
    }
    for (int pos = 0; pos < sequence.length(); ++pos) {
      char letter = sequence.charAt(pos);
      if (!DNAAlphabet.isValid(letter)) {
        throw new InvalidSequenceException(String.format(
            "Non-standard nucleotide '%c' at position %d.", letter, pos));
      }
    }
  }

  /**
   * Check the kmer size against the length of the sequence.
   *
   * @throws InvalidSequenceException unless 0 < K < length.
   */
  public static void validateKMerSize(int K, int length) {
    if (K <= 0) {
      throw new InvalidSequenceException(
          K + " is an invalid positive integer value for the kmer size.");
    }
    if (K >= length) {
      throw new InvalidSequenceException(String.format(
          "The kmer size (%d) should be smaller than the sequence length (%d).",
          K, length));
    }
  }

  /**
   * Validate both inputs and return the normalized sequence.
   */
  public static String validate(String sequence, int K) {
    validateSequence(sequence);
    validateKMerSize(K, sequence.length());
    return normalize(sequence);
  }
}
