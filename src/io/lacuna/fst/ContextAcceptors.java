package io.lacuna.fst;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds acceptors whose states remember a bounded window of the symbols read so far.
 * <p>
 * Each state is labeled by its window. In a left context acceptor the window holds the last {@code k} symbols of
 * the tier which have been read, padded on the left by the begin marker and epsilons. A right context acceptor is the
 * mirror image, whose window holds the next {@code k} tier symbols still to be read. Symbols of the input alphabet
 * outside the tier are read by self-loops, and leave the window unchanged.
 *
 * @author ztellman
 */
public class ContextAcceptors {

  private final FstConfig config;

  public ContextAcceptors(FstConfig config) {
    this.config = config;
  }

  public Fst<List<String>> leftContext(int k) {
    return leftContext(k, config.sigma());
  }

  /**
   * @param k the window size
   * @param tier the symbols which enter the window, a subset of the input alphabet
   * @return the trimmed left context acceptor, whose only final state is labeled by the end marker
   */
  public Fst<List<String>> leftContext(int k, Collection<String> tier) {
    SortedSet<String> t = validate(k, tier);

    List<String> initial = window(config.boundary());
    List<String> accept = window(config.endMarker());
    List<String> peninitial = lastK(k, padding(k, config.beginMarker(), false));

    FstBuilder<List<String>> builder = new FstBuilder<List<String>>()
            .addStates(initial, accept, peninitial)
            .setInitial(initial)
            .setFinal(accept)
            .addTransition(initial, config.beginMarker(), peninitial);

    LinearList<List<String>> interior = new LinearList<>();
    ISet<List<String>> seen = LinearSet.of(peninitial);
    LinearList<List<String>> queue = LinearList.of(peninitial);
    while (queue.size() > 0) {
      List<String> h = queue.popFirst();
      interior.addLast(h);
      for (String y : t) {
        List<String> next = lastK(k, append(h, y));
        if (!seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
          builder.addState(next);
        }
        builder.addTransition(h, y, next);
      }
    }

    for (List<String> h : interior) {
      builder.addTransition(h, config.endMarker(), accept);
    }
    selfLoops(builder, interior, t);

    return builder.build().trim();
  }

  public Fst<List<String>> rightContext(int k) {
    return rightContext(k, config.sigma());
  }

  /**
   * @param k the window size
   * @param tier the symbols which enter the window, a subset of the input alphabet
   * @return the trimmed right context acceptor, whose only initial state is labeled by the begin marker
   */
  public Fst<List<String>> rightContext(int k, Collection<String> tier) {
    SortedSet<String> t = validate(k, tier);

    List<String> initial = window(config.beginMarker());
    List<String> accept = window(config.boundary());
    List<String> penultimate = firstK(k, padding(k, config.endMarker(), true));

    FstBuilder<List<String>> builder = new FstBuilder<List<String>>()
            .addStates(initial, accept, penultimate)
            .setInitial(initial)
            .setFinal(accept)
            .addTransition(penultimate, config.endMarker(), accept);

    // built backward, from the end of the word
    LinearList<List<String>> interior = new LinearList<>();
    ISet<List<String>> seen = LinearSet.of(penultimate);
    LinearList<List<String>> queue = LinearList.of(penultimate);
    while (queue.size() > 0) {
      List<String> h = queue.popFirst();
      interior.addLast(h);
      for (String y : t) {
        List<String> prev = firstK(k, prepend(y, h));
        if (!seen.contains(prev)) {
          seen.add(prev);
          queue.addLast(prev);
          builder.addState(prev);
        }
        builder.addTransition(prev, y, h);
      }
    }

    for (List<String> h : interior) {
      builder.addTransition(initial, config.beginMarker(), h);
    }
    selfLoops(builder, interior, t);

    return builder.build().trim();
  }

  ///

  private SortedSet<String> validate(int k, Collection<String> tier) {
    if (k < 0) {
      throw new IllegalArgumentException("window size must be non-negative: " + k);
    }
    if (config.sigma().isEmpty()) {
      throw new IllegalArgumentException("context acceptors require a non-empty input alphabet");
    }
    SortedSet<String> t = new TreeSet<>(tier);
    if (!config.sigma().containsAll(t)) {
      t.removeAll(config.sigma());
      throw new IllegalArgumentException("tier symbols " + t + " are not in the input alphabet");
    }
    return t;
  }

  private void selfLoops(FstBuilder<List<String>> builder, Iterable<List<String>> states, SortedSet<String> tier) {
    for (String x : config.sigma()) {
      if (tier.contains(x)) {
        continue;
      }
      for (List<String> h : states) {
        builder.addTransition(h, x, h);
      }
    }
  }

  /**
   * @return {@code marker} with {@code k - 1} epsilons after it if {@code leading}, or before it otherwise
   */
  private List<String> padding(int k, String marker, boolean leading) {
    List<String> l = new ArrayList<>(Collections.nCopies(Math.max(0, k - 1), config.epsilon()));
    if (leading) {
      l.add(0, marker);
    } else {
      l.add(marker);
    }
    return l;
  }

  private static List<String> window(String... symbols) {
    List<String> l = new ArrayList<>();
    Collections.addAll(l, symbols);
    return Collections.unmodifiableList(l);
  }

  private static List<String> lastK(int k, List<String> l) {
    return Collections.unmodifiableList(new ArrayList<>(l.subList(Math.max(0, l.size() - k), l.size())));
  }

  private static List<String> firstK(int k, List<String> l) {
    return Collections.unmodifiableList(new ArrayList<>(l.subList(0, Math.min(k, l.size()))));
  }

  private static List<String> append(List<String> l, String x) {
    List<String> r = new ArrayList<>(l);
    r.add(x);
    return r;
  }

  private static List<String> prepend(String x, List<String> l) {
    List<String> r = new ArrayList<>(l.size() + 1);
    r.add(x);
    r.addAll(l);
    return r;
  }
}
