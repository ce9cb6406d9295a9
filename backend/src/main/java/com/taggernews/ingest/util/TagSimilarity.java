package com.taggernews.ingest.util;

import java.util.Locale;

/**
 * Normalized edit-distance similarity between tag names, in [0, 1]. Case and surrounding
 * whitespace are ignored.
 */
public final class TagSimilarity {

  private TagSimilarity() {}

  public static double ratio(String left, String right) {
    String a = normalize(left);
    String b = normalize(right);
    int longest = Math.max(a.length(), b.length());
    if (longest == 0) {
      return 1.0;
    }
    return 1.0 - ((double) levenshtein(a, b) / longest);
  }

  public static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }
}
