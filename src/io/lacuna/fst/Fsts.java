package io.lacuna.fst;

import java.util.List;

/**
 * Builders for simple acceptors.
 *
 * @author ztellman
 */
public final class Fsts {

  private Fsts() {
  }

  /**
   * @param word a space-delimited word of {@code n} symbols
   * @return the acceptor of exactly {@code word}, a chain of states {@code 0..n} with initial state {@code 0} and
   * final state {@code n}
   */
  public static Fst<Integer> linearAcceptor(String word) {
    List<String> tokens = Words.tokens(word);

    FstBuilder<Integer> builder = new FstBuilder<Integer>()
            .addState(0)
            .setInitial(0);
    for (int i = 0; i < tokens.size(); i++) {
      builder.addState(i + 1).addTransition(i, tokens.get(i), i + 1);
    }

    return builder.setFinal(tokens.size()).build();
  }

  /**
   * @return an acceptor of every word over the input alphabet of {@code config} of length {@code 0..maxLen},
   * framed by the begin and end markers
   */
  public static Fst<Integer> trellis(int maxLen, FstConfig config) {
    if (maxLen < 0) {
      throw new IllegalArgumentException("maximum length must be non-negative: " + maxLen);
    }
    if (config.sigma().isEmpty()) {
      throw new IllegalArgumentException("trellis requires a non-empty input alphabet");
    }

    String begin = config.beginMarker();
    String end = config.endMarker();
    int last = maxLen + 1;
    int accept = maxLen + 2;

    FstBuilder<Integer> builder = new FstBuilder<>();
    for (int q = 0; q <= accept; q++) {
      builder.addState(q);
    }
    builder.setInitial(0)
            .setFinal(accept)
            .addTransition(0, begin, 1)
            .addTransition(last, end, accept);

    for (int i = 0; i < maxLen; i++) {
      int q = i + 1;
      for (String x : config.sigma()) {
        builder.addTransition(q, x, q + 1);
      }
      builder.addTransition(q, end, accept);
    }

    return builder.build();
  }
}
