package io.lacuna.fst;

import java.util.Objects;

/**
 * A transition between two labeled states. Acceptors use the same symbol for input and output, and the empty string
 * stands for the empty label.
 *
 * @param <Q> the state labels
 * @author ztellman
 */
public final class Transition<Q> {

  private final Q src;
  private final String input;
  private final String output;
  private final Q dest;

  public Transition(Q src, String input, String output, Q dest) {
    this.src = Objects.requireNonNull(src, "src");
    this.input = Objects.requireNonNull(input, "input");
    this.output = Objects.requireNonNull(output, "output");
    this.dest = Objects.requireNonNull(dest, "dest");
  }

  public Q src() {
    return src;
  }

  public String input() {
    return input;
  }

  public String output() {
    return output;
  }

  public Q dest() {
    return dest;
  }

  public boolean isEpsilon() {
    return input.isEmpty() && output.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition<?> t = (Transition<?>) o;
    return src.equals(t.src) && input.equals(t.input) && output.equals(t.output) && dest.equals(t.dest);
  }

  @Override
  public int hashCode() {
    return Objects.hash(src, input, output, dest);
  }

  @Override
  public String toString() {
    return "(" + src + ", " + input + ":" + output + ", " + dest + ")";
  }
}
