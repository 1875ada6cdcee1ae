package io.lacuna.fst.ostia;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.fst.Fst;
import io.lacuna.fst.FstConfig;
import io.lacuna.fst.Transition;
import io.lacuna.fst.Utils;
import io.lacuna.fst.Words;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Infers an onward subsequential transducer from a sample of input/output pairs, by the state-merging algorithm
 * OSTIA.
 * <p>
 * Learning starts from the onward prefix tree of the sample, whose initial state is the only red state. The blue
 * states are the successors of red states which are not red themselves. The shallowest blue state, with ties broken
 * by label, is merged into the first red state which accepts it, or else becomes red. Every merge attempt works on
 * a new version of the automaton, so a refused merge leaves the current version untouched.
 *
 * @author ztellman
 */
public class Ostia {

  private static final Logger LOGGER = LoggerFactory.getLogger(Ostia.class);

  private static final Comparator<String> BLUE_ORDER = Comparator
          .<String>comparingInt(Words::length)
          .thenComparing(Comparator.<String>naturalOrder());

  private final FstConfig config;

  public Ostia(FstConfig config) {
    this.config = config;
  }

  /**
   * @return a subsequential transducer which agrees with every pair in {@code sample}
   * @throws IllegalArgumentException if the sample is empty, or uses symbols outside the alphabets of the
   * configuration when those are given
   */
  public SubsequentialTransducer learn(Sample sample) {
    validate(sample);

    Fst<String> tree = PrefixTrees.onward(PrefixTrees.prefixTree(sample));
    Fst<String> fst = tree;

    LinearList<String> red = LinearList.of(PrefixTrees.ROOT);
    int merges = 0;

    for (IList<String> blue = blue(fst, red); blue.size() > 0; blue = blue(fst, red)) {
      String q = blue.first();

      @Nullable Fst<String> merged = null;
      for (String p : red) {
        MergeResult result = merge(fst, p, q);
        if (result.isSuccess()) {
          LOGGER.debug("merged '{}' into '{}'", q, p);
          merged = result.fst();
          break;
        }
        LOGGER.debug("cannot merge '{}' into '{}': {}", q, p, result.reason().orElse("unknown"));
      }

      if (merged == null) {
        LOGGER.debug("promoted '{}' to red", q);
        red.addLast(q);
      } else {
        fst = merged.withoutState(q);
        merges++;
      }
    }

    fst = fst.trim();
    LOGGER.info("learned transducer with {} states and {} transitions from {} examples ({} tree states, {} merges)",
            fst.stateCount(), fst.transitionCount(), sample.size(), tree.stateCount(), merges);

    return new SubsequentialTransducer(fst);
  }

  /**
   * Redirects every transition into {@code blue} to {@code red}, and then folds the subtree under {@code blue} into
   * {@code red}.
   *
   * @return the merged automaton, or why the two states cannot be merged; {@code fst} itself is never changed
   */
  public static MergeResult merge(Fst<String> fst, String red, String blue) {
    return fold(fst.redirect(blue, red), red, blue);
  }

  ///

  private static MergeResult fold(Fst<String> fst, String q1, String q2) {
    if (q1.equals(q2)) {
      return MergeResult.success(fst);
    }

    Optional<String> o1 = fst.finalOutput(q1);
    Optional<String> o2 = fst.finalOutput(q2);
    if (o2.isPresent()) {
      if (!o1.isPresent()) {
        fst = fst.withFinal(q1, o2.get());
      } else if (!o1.get().equals(o2.get())) {
        return MergeResult.failure("'" + q1 + "' and '" + q2 + "' have final outputs '"
                + o1.get() + "' and '" + o2.get() + "'");
      }
    }

    for (String a : inputs(fst, q2)) {
      Transition<String> t2 = fst.transition(q2, a).orElseThrow(IllegalStateException::new);
      Optional<Transition<String>> t1 = fst.transition(q1, a);

      if (!t1.isPresent()) {
        fst = fst.withTransition(q1, a, t2.output(), t2.dest());
        continue;
      }

      if (!Words.isPrefix(t1.get().output(), t2.output())) {
        return MergeResult.failure("output '" + t1.get().output() + "' on '" + a + "' from '" + q1
                + "' is not a prefix of output '" + t2.output() + "' from '" + q2 + "'");
      }

      fst = pushback(fst, q1, q2, a);
      MergeResult result = fold(fst, t1.get().dest(), t2.dest());
      if (!result.isSuccess()) {
        return result;
      }
      fst = result.fst();
    }

    return MergeResult.success(fst);
  }

  /**
   * Cuts the output of {@code q2} on {@code a} down to the output of {@code q1} on {@code a}, which must be a prefix
   * of it, and pushes the rest onto the transitions and final output of its destination. The destination of
   * {@code q1} may be shared with other paths, so its outputs are never touched.
   */
  private static Fst<String> pushback(Fst<String> fst, String q1, String q2, String a) {
    Transition<String> t1 = fst.transition(q1, a).orElseThrow(IllegalStateException::new);
    Transition<String> t2 = fst.transition(q2, a).orElseThrow(IllegalStateException::new);

    String u = t1.output();
    fst = fst.withOutput(t2, u);
    return prepend(fst, t2.dest(), Words.removePrefix(t2.output(), u));
  }

  private static Fst<String> prepend(Fst<String> fst, String q, String w) {
    if (w.isEmpty()) {
      return fst;
    }

    for (Transition<String> t : fst.transitions(q)) {
      fst = fst.withOutput(t, Words.concat(w, t.output()));
    }
    Optional<String> output = fst.finalOutput(q);
    if (output.isPresent()) {
      fst = fst.withFinal(q, Words.concat(w, output.get()));
    }
    return fst;
  }

  private static IList<String> inputs(Fst<String> fst, String q) {
    ISet<String> inputs = new LinearSet<>();
    for (Transition<String> t : fst.transitions(q)) {
      inputs.add(t.input());
    }
    return Utils.sorted(inputs, Comparator.naturalOrder());
  }

  private IList<String> blue(Fst<String> fst, IList<String> red) {
    ISet<String> reds = new LinearSet<>();
    red.forEach(reds::add);
    ISet<String> blue = new LinearSet<>();
    for (String p : red) {
      for (Transition<String> t : fst.transitions(p)) {
        String q = t.dest();
        if (!reds.contains(q) && !isEndMarked(q)) {
          blue.add(q);
        }
      }
    }
    return Utils.sorted(blue, BLUE_ORDER);
  }

  private boolean isEndMarked(String label) {
    List<String> tokens = Words.tokens(label);
    return !tokens.isEmpty() && tokens.get(tokens.size() - 1).equals(config.endMarker());
  }

  private void validate(Sample sample) {
    if (sample.isEmpty()) {
      throw new IllegalArgumentException("cannot learn from an empty sample");
    }

    SortedSet<String> sigma = new TreeSet<>(config.sigma());
    sigma.add(config.endMarker());
    if (!config.sigma().isEmpty() && !sigma.containsAll(sample.inputAlphabet())) {
      SortedSet<String> unknown = new TreeSet<>(sample.inputAlphabet());
      unknown.removeAll(sigma);
      throw new IllegalArgumentException("sample inputs use symbols outside the input alphabet: " + unknown);
    }
    if (!config.lambda().isEmpty() && !config.lambda().containsAll(sample.outputAlphabet())) {
      SortedSet<String> unknown = new TreeSet<>(sample.outputAlphabet());
      unknown.removeAll(config.lambda());
      throw new IllegalArgumentException("sample outputs use symbols outside the output alphabet: " + unknown);
    }
  }
}
