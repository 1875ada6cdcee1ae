package io.lacuna.fst;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public final class TestUtils {

  private TestUtils() {
  }

  /**
   * @return the elements of {@code it} as a {@link Set}, so that assertions ignore iteration order
   */
  public static <V> Set<V> set(Iterable<V> it) {
    Set<V> set = new HashSet<>();
    it.forEach(set::add);
    return set;
  }

  @SafeVarargs
  public static <V> Set<V> setOf(V... vs) {
    return new HashSet<>(Arrays.asList(vs));
  }
}
