package io.lacuna.fst;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Token-wise operations over words, i.e. space-delimited sequences of symbols. The empty string is the empty word.
 *
 * @author ztellman
 */
public final class Words {

  public static final String EMPTY = "";

  private Words() {
  }

  /**
   * @return the symbols of {@code word}, split on whitespace
   */
  public static List<String> tokens(String word) {
    String trimmed = word.trim();
    if (trimmed.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(Arrays.asList(trimmed.split("\\s+")));
  }

  public static String join(List<String> tokens) {
    return String.join(" ", tokens);
  }

  /**
   * @return {@code word} with its whitespace normalized to single spaces
   */
  public static String normalize(String word) {
    return join(tokens(word));
  }

  public static int length(String word) {
    return tokens(word).size();
  }

  public static String concat(String a, String b) {
    if (a.isEmpty()) {
      return b;
    } else if (b.isEmpty()) {
      return a;
    }
    return a + " " + b;
  }

  /**
   * @return true if every symbol of {@code prefix} matches the leading symbols of {@code word}
   */
  public static boolean isPrefix(String prefix, String word) {
    List<String> p = tokens(prefix);
    List<String> w = tokens(word);
    return p.size() <= w.size() && w.subList(0, p.size()).equals(p);
  }

  public static String lcp(String a, String b) {
    List<String> x = tokens(a);
    List<String> y = tokens(b);
    int n = 0;
    while (n < x.size() && n < y.size() && x.get(n).equals(y.get(n))) {
      n++;
    }
    return join(x.subList(0, n));
  }

  /**
   * @return the longest common prefix of all {@code words}, or the empty word if there are none
   */
  public static String lcp(Iterable<String> words) {
    String acc = null;
    for (String w : words) {
      acc = acc == null ? normalize(w) : lcp(acc, w);
      if (acc.isEmpty()) {
        break;
      }
    }
    return acc == null ? EMPTY : acc;
  }

  /**
   * @return {@code word} with {@code prefix} removed from its front
   * @throws IllegalArgumentException if {@code prefix} is not a prefix of {@code word}
   */
  public static String removePrefix(String word, String prefix) {
    if (!isPrefix(prefix, word)) {
      throw new IllegalArgumentException("'" + prefix + "' is not a prefix of '" + word + "'");
    }
    List<String> w = tokens(word);
    return join(w.subList(tokens(prefix).size(), w.size()));
  }
}
