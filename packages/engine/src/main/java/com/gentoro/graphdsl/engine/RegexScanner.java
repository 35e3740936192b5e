package com.gentoro.graphdsl.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Leftmost-earliest multi-pattern scanner behind the {@code scan} statement.
 *
 * <p>At each step every pattern is searched in the unconsumed suffix of the subject. The match
 * with the smallest start wins; ties go to the pattern declared first. {@code ^} anchors at the
 * cursor and look-behind cannot see consumed text. After a zero-length match the cursor advances
 * by one code point.
 */
public final class RegexScanner {

  /** Receives each winning match. */
  @FunctionalInterface
  public interface MatchHandler {
    /**
     * @param armIndex index of the pattern that matched
     * @param groups group 0 (the whole match) followed by every capturing group; groups that did
     *     not participate are empty strings
     */
    void onMatch(int armIndex, List<String> groups);
  }

  private RegexScanner() {}

  public static void scan(String subject, List<Pattern> patterns, MatchHandler handler) {
    List<Matcher> matchers = new ArrayList<>(patterns.size());
    for (Pattern pattern : patterns) {
      matchers.add(pattern.matcher(subject));
    }
    int length = subject.length();
    int cursor = 0;
    while (cursor <= length) {
      int winner = -1;
      int winnerStart = Integer.MAX_VALUE;
      for (int arm = 0; arm < matchers.size(); arm++) {
        Matcher matcher = matchers.get(arm);
        matcher.region(cursor, length);
        if (matcher.find() && matcher.start() < winnerStart) {
          winner = arm;
          winnerStart = matcher.start();
        }
      }
      if (winner < 0) {
        return;
      }
      Matcher matcher = matchers.get(winner);
      List<String> groups = new ArrayList<>(matcher.groupCount() + 1);
      for (int g = 0; g <= matcher.groupCount(); g++) {
        String group = matcher.group(g);
        groups.add(group == null ? "" : group);
      }
      int start = matcher.start();
      int end = matcher.end();
      handler.onMatch(winner, groups);
      if (end > start) {
        cursor = end;
      } else if (end < length) {
        cursor = end + Character.charCount(subject.codePointAt(end));
      } else {
        cursor = length + 1;
      }
    }
  }
}
