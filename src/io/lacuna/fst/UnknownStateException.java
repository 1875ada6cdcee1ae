package io.lacuna.fst;

/**
 * Thrown when an operation references a state label which the automaton does not contain.
 *
 * @author ztellman
 */
public class UnknownStateException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final transient Object label;

  public UnknownStateException(Object label) {
    super("unknown state: " + label);
    this.label = label;
  }

  public Object label() {
    return label;
  }
}
