package io.lacuna.fst.ostia;

/**
 * Thrown when a sample pairs one input with two different outputs, which no function, and so no subsequential
 * transducer, can realize.
 *
 * @author ztellman
 */
public class InconsistentSampleException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String input;
  private final String first;
  private final String second;

  public InconsistentSampleException(String input, String first, String second) {
    super("input '" + input + "' is paired with both '" + first + "' and '" + second + "'");
    this.input = input;
    this.first = first;
    this.second = second;
  }

  public String input() {
    return input;
  }

  /**
   * @return the output the input was paired with first
   */
  public String firstOutput() {
    return first;
  }

  public String secondOutput() {
    return second;
  }
}
