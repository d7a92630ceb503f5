package dev.taxomatch.match;

/**
 * Longest run of consecutive characters shared by two strings, and the same run as a fraction of
 * the longer string.
 */
public final class LongestCommonSubstring {

  private LongestCommonSubstring() {
    // static utility
  }

  /**
   * Length of the longest common substring.
   *
   * @param a first string
   * @param b second string
   * @return the number of characters in the longest shared run, 0 when none is shared
   */
  public static int length(String a, String b) {
    int n = a.length();
    int m = b.length();
    int longest = 0;
    int[] previous = new int[m + 1];
    int[] current = new int[m + 1];
    for (int i = 1; i <= n; i++) {
      for (int j = 1; j <= m; j++) {
        if (a.charAt(i - 1) == b.charAt(j - 1)) {
          current[j] = previous[j - 1] + 1;
          longest = Math.max(longest, current[j]);
        } else {
          current[j] = 0;
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return longest;
  }

  /**
   * Ratio {@code length / max(length(a), length(b))}, in [0, 1]. Two empty strings are identical.
   */
  public static double similarity(String a, String b) {
    int maxLength = Math.max(a.length(), b.length());
    if (maxLength == 0) {
      return 1.0;
    }
    return (double) length(a, b) / maxLength;
  }
}
