package com.cario.scholar.app.service.matching;

/**
 * Matching-blocks similarity between two strings, in [0, 1].
 *
 * <p>Finds the longest common substring, recurses on the pieces to its left and right, and scores
 * {@code 2 * matched / (len(a) + len(b))}. Identical strings score 1, disjoint strings 0. Two empty
 * strings score 1.
 */
public final class SimilarityRatio {

  private SimilarityRatio() {}

  public static double ratio(String a, String b) {
    if (a == null || b == null) {
      return 0.0;
    }
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    if (a.equals(b)) {
      return 1.0;
    }
    int matched = matchedChars(a, 0, a.length(), b, 0, b.length());
    return 2.0 * matched / total;
  }

  private static int matchedChars(String a, int aLo, int aHi, String b, int bLo, int bHi) {
    if (aLo >= aHi || bLo >= bHi) {
      return 0;
    }
    int[] block = longestCommon(a, aLo, aHi, b, bLo, bHi);
    int i = block[0];
    int j = block[1];
    int size = block[2];
    if (size == 0) {
      return 0;
    }
    return size
        + matchedChars(a, aLo, i, b, bLo, j)
        + matchedChars(a, i + size, aHi, b, j + size, bHi);
  }

  // {startA, startB, length}; earliest block in a wins ties, then earliest in b
  private static int[] longestCommon(String a, int aLo, int aHi, String b, int bLo, int bHi) {
    int bestI = aLo;
    int bestJ = bLo;
    int bestSize = 0;
    int width = bHi - bLo;
    int[] prev = new int[width + 1];
    int[] curr = new int[width + 1];
    for (int i = aLo; i < aHi; i++) {
      for (int j = bLo; j < bHi; j++) {
        int k = j - bLo + 1;
        if (a.charAt(i) == b.charAt(j)) {
          curr[k] = prev[k - 1] + 1;
          if (curr[k] > bestSize) {
            bestSize = curr[k];
            bestI = i - bestSize + 1;
            bestJ = j - bestSize + 1;
          }
        } else {
          curr[k] = 0;
        }
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return new int[] {bestI, bestJ, bestSize};
  }
}
