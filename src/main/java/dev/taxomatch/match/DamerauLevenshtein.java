package dev.taxomatch.match;

/**
 * Damerau-Levenshtein edit distance in its optimal-string-alignment form: insertions, deletions,
 * substitutions and transpositions of adjacent characters each cost one edit, and no substring is
 * edited more than once.
 */
public final class DamerauLevenshtein {

  private DamerauLevenshtein() {
    // static utility
  }

  /**
   * Edit distance between two strings.
   *
   * @param a first string
   * @param b second string
   * @return the minimum number of edits turning {@code a} into {@code b}
   */
  public static int distance(String a, String b) {
    int n = a.length();
    int m = b.length();
    if (n == 0) {
      return m;
    }
    if (m == 0) {
      return n;
    }

    int[][] d = new int[n + 1][m + 1];
    for (int i = 0; i <= n; i++) {
      d[i][0] = i;
    }
    for (int j = 0; j <= m; j++) {
      d[0][j] = j;
    }

    for (int i = 1; i <= n; i++) {
      for (int j = 1; j <= m; j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
        if (i > 1
            && j > 1
            && a.charAt(i - 1) == b.charAt(j - 2)
            && a.charAt(i - 2) == b.charAt(j - 1)) {
          d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
        }
      }
    }
    return d[n][m];
  }

  /**
   * Similarity ratio {@code 1 - distance / max(length)}, in [0, 1]. Two empty strings are
   * identical.
   */
  public static double similarity(String a, String b) {
    int maxLength = Math.max(a.length(), b.length());
    if (maxLength == 0) {
      return 1.0;
    }
    return 1.0 - (double) distance(a, b) / maxLength;
  }
}
