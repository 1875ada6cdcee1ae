package io.lacuna.fst;

import io.lacuna.bifurcan.*;

import java.util.Comparator;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * @author ztellman
 */
public class Utils {

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <V> LinearList<V> toList(Stream<V> s) {
    LinearList<V> list = new LinearList<>();
    s.forEach(list::addLast);
    return list;
  }

  public static <U, V> LinearSet<V> map(ISet<U> set, Function<U, V> f) {
    if (set == null) {
      return null;
    }
    return toSet(set.stream().map(f));
  }

  /**
   * @return an empty map which is never edited in place, every {@code put} or {@code remove} returns a new version
   */
  static <K, V> IMap<K, V> persistentMap() {
    return new Map<K, V>().forked();
  }

  /**
   * @return an empty set which is never edited in place, every {@code add} or {@code remove} returns a new version
   */
  static <V> ISet<V> persistentSet() {
    return new Set<V>().forked();
  }

  public static <V> LinearList<V> sorted(ISet<V> set, Comparator<? super V> comparator) {
    return toList(set.stream().sorted(comparator));
  }
}
