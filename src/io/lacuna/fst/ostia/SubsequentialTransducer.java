package io.lacuna.fst.ostia;

import io.lacuna.fst.Fst;
import io.lacuna.fst.FstConfig;
import io.lacuna.fst.Transition;
import io.lacuna.fst.Words;

import java.util.Optional;

/**
 * A deterministic transducer whose final states emit a final output. Reading an input emits the outputs of the
 * transitions taken, followed by the final output of the state where the input ends.
 *
 * @author ztellman
 */
public final class SubsequentialTransducer {

  private final Fst<String> fst;

  /**
   * @throws IllegalArgumentException if some state has two transitions on the same input
   */
  public SubsequentialTransducer(Fst<String> fst) {
    if (!fst.isSubsequential()) {
      throw new IllegalArgumentException("automaton is not subsequential");
    }
    this.fst = fst;
  }

  public Fst<String> fst() {
    return fst;
  }

  /**
   * @param input a space-delimited word
   * @return the output for {@code input}, or nothing if the input is outside the domain
   * @throws IllegalStateException if the automaton has no initial state
   */
  public Optional<String> transduce(String input) {
    String state = fst.initialState()
            .orElseThrow(() -> new IllegalStateException("transducer has no initial state"));

    String output = Words.EMPTY;
    for (String x : Words.tokens(input)) {
      Optional<Transition<String>> t = fst.transition(state, x);
      if (!t.isPresent()) {
        return Optional.empty();
      }
      output = Words.concat(output, t.get().output());
      state = t.get().dest();
    }

    String prefix = output;
    return fst.finalOutput(state).map(w -> Words.concat(prefix, w));
  }

  /**
   * Replaces final outputs by transitions on the end marker of {@code config}: each final state gets a transition
   * which reads the end marker, emits the final output, and leads to a single new final state. The result has no
   * final outputs, so it can be composed or intersected.
   *
   * @return an automaton whose domain is the domain of this transducer with the end marker appended
   */
  public Fst<String> toEndMarkedFst(FstConfig config) {
    String sink = config.endMarker();
    while (fst.contains(sink)) {
      sink = sink + config.endMarker();
    }

    Fst<String> result = fst.withState(sink);
    for (String q : fst.finalStates()) {
      String output = fst.finalOutput(q).orElse(Fst.EPSILON);
      result = result
              .withoutFinal(q)
              .withTransition(q, config.endMarker(), output, sink);
    }

    return result.withFinal(sink);
  }

  @Override
  public String toString() {
    return fst.toString();
  }
}
