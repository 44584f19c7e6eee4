package com.example.helpdesk.qabot.util;

import java.util.List;
import java.util.function.ToIntFunction;

public final class RankSelectionUtils {
  private RankSelectionUtils() {}

  /**
   * Top-n selection that keeps ties at the cutoff: every item scoring at least as much as the
   * item at rank {@code topN} (1-indexed) is returned, so the result may be longer than topN.
   *
   * @param sorted items sorted by descending score
   */
  public static <T> List<T> topNWithTies(List<T> sorted, int topN, ToIntFunction<? super T> score) {
    if (topN < 1) {
      throw new IllegalArgumentException("topN must be positive");
    }
    if (sorted.size() <= topN) {
      return List.copyOf(sorted);
    }
    int minScore = score.applyAsInt(sorted.get(topN - 1));
    return sorted.stream()
        .filter(item -> score.applyAsInt(item) >= minScore)
        .toList();
  }

  /**
   * Whether the first item leads the runner-up by at least {@code gapThreshold}.
   *
   * @param sorted items sorted by descending score
   */
  public static <T> boolean hasDominantLead(List<T> sorted, int gapThreshold, ToIntFunction<? super T> score) {
    if (sorted.size() < 2) {
      return false;
    }
    return score.applyAsInt(sorted.get(0)) - score.applyAsInt(sorted.get(1)) >= gapThreshold;
  }
}
