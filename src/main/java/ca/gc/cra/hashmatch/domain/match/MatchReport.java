package ca.gc.cra.hashmatch.domain.match;

import java.util.List;
import java.util.Objects;

/**
 * Final, deterministically ordered set of matches produced by the collector.
 *
 * @param totalMatches number of entries in {@code matches}
 * @param matches matches ordered by worker identity, then original candidate text
 * @since 0.1.0
 */
public record MatchReport(int totalMatches, List<MatchResult> matches) {

  /**
   * Freezes the match list and checks that the total agrees with it.
   *
   * @throws IllegalArgumentException if {@code totalMatches} differs from {@code matches.size()}
   */
  public MatchReport {
    matches = List.copyOf(Objects.requireNonNull(matches, "matches"));
    if (totalMatches != matches.size()) {
      throw new IllegalArgumentException(
          "totalMatches " + totalMatches + " does not match " + matches.size() + " entries");
    }
  }

  /**
   * Builds a report whose total is derived from the list.
   *
   * @param matches ordered matches
   * @return report
   */
  public static MatchReport of(List<MatchResult> matches) {
    return new MatchReport(matches.size(), matches);
  }

  /**
   * Returns an empty report.
   *
   * @return report with no matches
   */
  public static MatchReport empty() {
    return new MatchReport(0, List.of());
  }
}
