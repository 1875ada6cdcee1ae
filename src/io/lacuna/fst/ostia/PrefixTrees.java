package io.lacuna.fst.ostia;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.fst.Fst;
import io.lacuna.fst.Pair;
import io.lacuna.fst.Transition;
import io.lacuna.fst.Utils;
import io.lacuna.fst.Words;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;

/**
 * Builds the tree transducers which OSTIA starts from. States are labeled by the input prefix which leads to them,
 * so the root is labeled by the empty word.
 *
 * @author ztellman
 */
public final class PrefixTrees {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrefixTrees.class);

  public static final String ROOT = Words.EMPTY;

  private static final Comparator<String> DEEPEST_FIRST = Comparator
          .<String>comparingInt(Words::length)
          .reversed()
          .thenComparing(Comparator.<String>naturalOrder());

  private PrefixTrees() {
  }

  /**
   * @return a tree with one state per prefix of an input of {@code sample}, whose transitions all emit the empty
   * word, and whose final states are exactly the inputs of the sample, emitting their paired outputs
   */
  public static Fst<String> prefixTree(Sample sample) {
    Fst<String> fst = Fst.<String>empty().withState(ROOT).withInitial(ROOT);

    for (Sample.Example e : sample) {
      String prefix = ROOT;
      for (String x : Words.tokens(e.input())) {
        String next = Words.concat(prefix, x);
        if (!fst.contains(next)) {
          fst = fst.withState(next).withTransition(prefix, x, Fst.EPSILON, next);
        }
        prefix = next;
      }
      fst = fst.withFinal(prefix, e.output());
    }

    LOGGER.debug("built prefix tree with {} states from {} examples", fst.stateCount(), sample.size());
    return fst;
  }

  /**
   * Makes a tree onward: working up from the leaves, the longest common prefix of each state's known final output and
   * outgoing outputs is removed from them and appended to the output of the state's incoming transition.
   *
   * @param tree a tree transducer, where every state but the initial one has exactly one incoming transition
   * @return the onward tree, which transduces the same function
   */
  public static Fst<String> onward(Fst<String> tree) {
    LinearMap<String, Pair<String, String>> parents = new LinearMap<>();
    for (Transition<String> t : tree.transitions()) {
      if (parents.contains(t.dest())) {
        throw new IllegalArgumentException("not a tree, " + t.dest() + " has more than one incoming transition");
      }
      parents.put(t.dest(), Pair.of(t.src(), t.input()));
    }

    Fst<String> fst = tree;
    for (String q : Utils.sorted(tree.states(), DEEPEST_FIRST)) {
      Pair<String, String> parent = parents.get(q, null);
      if (parent == null) {
        continue;
      }

      IList<Transition<String>> out = fst.transitions(q);
      Optional<String> finalOutput = fst.finalOutput(q);

      LinearList<String> outputs = new LinearList<>();
      finalOutput.ifPresent(outputs::addLast);
      out.forEach(t -> outputs.addLast(t.output()));
      String u = Words.lcp(outputs);
      if (u.isEmpty()) {
        continue;
      }

      for (Transition<String> t : out) {
        fst = fst.withOutput(t, Words.removePrefix(t.output(), u));
      }
      if (finalOutput.isPresent()) {
        fst = fst.withFinal(q, Words.removePrefix(finalOutput.get(), u));
      }

      Transition<String> incoming = fst.transition(parent.first(), parent.second())
              .orElseThrow(IllegalStateException::new);
      fst = fst.withOutput(incoming, Words.concat(incoming.output(), u));
    }

    return fst;
  }
}
