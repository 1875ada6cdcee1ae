package io.lacuna.fst;

/**
 * Accumulates states and transitions, and produces an {@link Fst}. States must be added before they are referenced.
 *
 * @param <Q> the state labels
 * @author ztellman
 */
public class FstBuilder<Q> {

  private Fst<Q> fst;

  public FstBuilder() {
    this(Fst.empty());
  }

  /**
   * @param fst the automaton to extend
   */
  public FstBuilder(Fst<Q> fst) {
    this.fst = fst;
  }

  /**
   * Adds a state; adding a label which is already present has no effect.
   */
  public FstBuilder<Q> addState(Q label) {
    fst = fst.withState(label);
    return this;
  }

  @SafeVarargs
  public final FstBuilder<Q> addStates(Q... labels) {
    for (Q label : labels) {
      addState(label);
    }
    return this;
  }

  public FstBuilder<Q> setInitial(Q label) {
    fst = fst.withInitial(label);
    return this;
  }

  public FstBuilder<Q> setFinal(Q label) {
    fst = fst.withFinal(label);
    return this;
  }

  public FstBuilder<Q> setFinal(Q label, String output) {
    fst = fst.withFinal(label, output);
    return this;
  }

  /**
   * Adds an acceptor transition, whose input and output are both {@code symbol}.
   */
  public FstBuilder<Q> addTransition(Q src, String symbol, Q dest) {
    fst = fst.withTransition(src, symbol, dest);
    return this;
  }

  public FstBuilder<Q> addTransition(Q src, String input, String output, Q dest) {
    fst = fst.withTransition(src, input, output, dest);
    return this;
  }

  public boolean contains(Q label) {
    return fst.contains(label);
  }

  public Fst<Q> build() {
    return fst;
  }
}
