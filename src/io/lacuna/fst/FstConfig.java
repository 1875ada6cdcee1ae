package io.lacuna.fst;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The alphabets and reserved symbols shared by the automata of one computation. Instances are immutable and are
 * passed explicitly to every builder which needs them; use {@link #builder()} to create one.
 * <p>
 * Recognized properties, for {@link #fromProperties(Properties)}:
 * <ul>
 *   <li>{@code fst.sigma}: the input alphabet, space-delimited</li>
 *   <li>{@code fst.lambda}: the output alphabet, space-delimited</li>
 *   <li>{@code fst.marker.begin}, {@code fst.marker.end}: the word boundary markers</li>
 *   <li>{@code fst.marker.epsilon}: how the empty label is displayed</li>
 *   <li>{@code fst.marker.unknown}: how an unknown output is displayed</li>
 *   <li>{@code fst.marker.boundary}: the label of the outer boundary state of context acceptors</li>
 * </ul>
 *
 * @author ztellman
 */
public final class FstConfig {

  public static final String DEFAULT_BEGIN = "⋊";
  public static final String DEFAULT_END = "⋉";
  public static final String DEFAULT_EPSILON = "ϵ";
  public static final String DEFAULT_UNKNOWN = "⊥";
  public static final String DEFAULT_BOUNDARY = "λ";

  private final SortedSet<String> sigma;
  private final SortedSet<String> lambda;
  private final String beginMarker;
  private final String endMarker;
  private final String epsilon;
  private final String unknown;
  private final String boundary;

  private FstConfig(Builder builder) {
    this.sigma = Collections.unmodifiableSortedSet(new TreeSet<>(builder.sigma));
    this.lambda = Collections.unmodifiableSortedSet(new TreeSet<>(builder.lambda));
    this.beginMarker = builder.beginMarker;
    this.endMarker = builder.endMarker;
    this.epsilon = builder.epsilon;
    this.unknown = builder.unknown;
    this.boundary = builder.boundary;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return a configuration over {@code sigma}, with the default markers
   */
  public static FstConfig of(String... sigma) {
    return builder().sigma(sigma).build();
  }

  public static FstConfig fromProperties(Properties properties) {
    Builder builder = builder()
            .sigma(Words.tokens(properties.getProperty("fst.sigma", "")))
            .lambda(Words.tokens(properties.getProperty("fst.lambda", "")));
    builder.beginMarker(properties.getProperty("fst.marker.begin", DEFAULT_BEGIN).trim());
    builder.endMarker(properties.getProperty("fst.marker.end", DEFAULT_END).trim());
    builder.epsilon(properties.getProperty("fst.marker.epsilon", DEFAULT_EPSILON).trim());
    builder.unknown(properties.getProperty("fst.marker.unknown", DEFAULT_UNKNOWN).trim());
    builder.boundary(properties.getProperty("fst.marker.boundary", DEFAULT_BOUNDARY).trim());
    return builder.build();
  }

  /**
   * Reads a UTF-8 properties file from the classpath.
   *
   * @throws IOException if the resource is missing or unreadable
   */
  public static FstConfig load(String resource) throws IOException {
    InputStream in = FstConfig.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new IOException("configuration resource not found: " + resource);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      Properties properties = new Properties();
      properties.load(reader);
      return fromProperties(properties);
    }
  }

  /**
   * @return the ordinary input symbols, sorted
   */
  public SortedSet<String> sigma() {
    return sigma;
  }

  /**
   * @return the ordinary output symbols, sorted
   */
  public SortedSet<String> lambda() {
    return lambda;
  }

  public String beginMarker() {
    return beginMarker;
  }

  public String endMarker() {
    return endMarker;
  }

  public String epsilon() {
    return epsilon;
  }

  public String unknown() {
    return unknown;
  }

  public String boundary() {
    return boundary;
  }

  /**
   * @return a builder initialized with this configuration
   */
  public Builder toBuilder() {
    return builder()
            .sigma(sigma)
            .lambda(lambda)
            .beginMarker(beginMarker)
            .endMarker(endMarker)
            .epsilon(epsilon)
            .unknown(unknown)
            .boundary(boundary);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FstConfig)) {
      return false;
    }
    FstConfig c = (FstConfig) o;
    return sigma.equals(c.sigma)
            && lambda.equals(c.lambda)
            && beginMarker.equals(c.beginMarker)
            && endMarker.equals(c.endMarker)
            && epsilon.equals(c.epsilon)
            && unknown.equals(c.unknown)
            && boundary.equals(c.boundary);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sigma, lambda, beginMarker, endMarker, epsilon, unknown, boundary);
  }

  @Override
  public String toString() {
    return "FstConfig[sigma=" + sigma + ", lambda=" + lambda + ", begin=" + beginMarker + ", end=" + endMarker + "]";
  }

  public static final class Builder {
    private final SortedSet<String> sigma = new TreeSet<>();
    private final SortedSet<String> lambda = new TreeSet<>();
    private String beginMarker = DEFAULT_BEGIN;
    private String endMarker = DEFAULT_END;
    private String epsilon = DEFAULT_EPSILON;
    private String unknown = DEFAULT_UNKNOWN;
    private String boundary = DEFAULT_BOUNDARY;

    private Builder() {
    }

    public Builder sigma(String... symbols) {
      for (String s : symbols) {
        sigma.add(symbol(s));
      }
      return this;
    }

    public Builder sigma(Iterable<String> symbols) {
      for (String s : symbols) {
        sigma.add(symbol(s));
      }
      return this;
    }

    public Builder lambda(String... symbols) {
      for (String s : symbols) {
        lambda.add(symbol(s));
      }
      return this;
    }

    public Builder lambda(Iterable<String> symbols) {
      for (String s : symbols) {
        lambda.add(symbol(s));
      }
      return this;
    }

    public Builder beginMarker(String marker) {
      this.beginMarker = symbol(marker);
      return this;
    }

    public Builder endMarker(String marker) {
      this.endMarker = symbol(marker);
      return this;
    }

    public Builder epsilon(String marker) {
      this.epsilon = symbol(marker);
      return this;
    }

    public Builder unknown(String marker) {
      this.unknown = symbol(marker);
      return this;
    }

    public Builder boundary(String marker) {
      this.boundary = symbol(marker);
      return this;
    }

    /**
     * @throws IllegalArgumentException if two reserved symbols coincide, or an alphabet contains a reserved symbol
     */
    public FstConfig build() {
      Set<String> reserved = new HashSet<>();
      for (String marker : new String[]{beginMarker, endMarker, epsilon, unknown, boundary}) {
        if (!reserved.add(marker)) {
          throw new IllegalArgumentException("reserved symbol used twice: " + marker);
        }
      }
      for (String s : sigma) {
        if (reserved.contains(s)) {
          throw new IllegalArgumentException("input alphabet contains reserved symbol " + s);
        }
      }
      for (String s : lambda) {
        if (reserved.contains(s)) {
          throw new IllegalArgumentException("output alphabet contains reserved symbol " + s);
        }
      }
      return new FstConfig(this);
    }

    private static String symbol(String s) {
      Objects.requireNonNull(s, "symbol");
      if (s.isEmpty() || !s.equals(s.trim()) || s.split("\\s+").length != 1) {
        throw new IllegalArgumentException("symbols must be non-empty and free of whitespace: '" + s + "'");
      }
      return s;
    }
  }
}
