package io.lacuna.fst.ostia;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.fst.Words;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An ordered training sample of {@code (input, output)} pairs, where both sides are space-delimited words. A sample
 * is a partial function: every input has exactly one output.
 *
 * @author ztellman
 */
public final class Sample implements Iterable<Sample.Example> {

  public static final class Example {
    private final String input;
    private final String output;

    public Example(String input, String output) {
      this.input = Words.normalize(input);
      this.output = Words.normalize(output);
    }

    public String input() {
      return input;
    }

    public String output() {
      return output;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Example)) {
        return false;
      }
      Example e = (Example) o;
      return input.equals(e.input) && output.equals(e.output);
    }

    @Override
    public int hashCode() {
      return Objects.hash(input, output);
    }

    @Override
    public String toString() {
      return input + " -> " + output;
    }
  }

  private final IList<Example> examples;

  private Sample(IList<Example> examples) {
    this.examples = examples;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a sample with one tab-separated {@code input<TAB>output} pair per line. Blank lines and lines starting with
   * {@code #} are skipped; the output may be empty.
   *
   * @throws IllegalArgumentException if a line is malformed, naming the line number
   * @throws InconsistentSampleException if an input is paired with two outputs
   */
  public static Sample read(Reader reader) throws IOException {
    Builder builder = builder();
    BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

    int lineNumber = 0;
    for (String line = in.readLine(); line != null; line = in.readLine()) {
      lineNumber++;
      if (line.trim().isEmpty() || line.trim().startsWith("#")) {
        continue;
      }

      String[] fields = line.split("\t", -1);
      if (fields.length != 2 || fields[0].trim().isEmpty()) {
        throw new IllegalArgumentException("line " + lineNumber + ": expected 'input<TAB>output', got '" + line + "'");
      }
      builder.add(fields[0], fields[1]);
    }

    return builder.build();
  }

  public long size() {
    return examples.size();
  }

  public boolean isEmpty() {
    return examples.size() == 0;
  }

  public IList<Example> examples() {
    return examples;
  }

  @Override
  public Iterator<Example> iterator() {
    return examples.iterator();
  }

  /**
   * @return every symbol of every input, sorted
   */
  public SortedSet<String> inputAlphabet() {
    SortedSet<String> symbols = new TreeSet<>();
    for (Example e : examples) {
      symbols.addAll(Words.tokens(e.input()));
    }
    return Collections.unmodifiableSortedSet(symbols);
  }

  /**
   * @return every symbol of every output, sorted
   */
  public SortedSet<String> outputAlphabet() {
    SortedSet<String> symbols = new TreeSet<>();
    for (Example e : examples) {
      symbols.addAll(Words.tokens(e.output()));
    }
    return Collections.unmodifiableSortedSet(symbols);
  }

  @Override
  public String toString() {
    return "sample" + examples;
  }

  public static final class Builder {
    private final LinearMap<String, Example> examples = new LinearMap<>();

    private Builder() {
    }

    /**
     * Adds a pair; adding a pair which is already present has no effect.
     *
     * @throws InconsistentSampleException if {@code input} was already added with a different output
     */
    public Builder add(String input, String output) {
      Example e = new Example(input, output);
      Example prior = examples.get(e.input(), null);
      if (prior == null) {
        examples.put(e.input(), e);
      } else if (!prior.output().equals(e.output())) {
        throw new InconsistentSampleException(e.input(), prior.output(), e.output());
      }
      return this;
    }

    public Sample build() {
      LinearList<Example> list = new LinearList<>();
      examples.values().forEach(list::addLast);
      return new Sample(list);
    }
  }
}
