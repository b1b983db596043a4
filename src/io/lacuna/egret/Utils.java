package io.lacuna.egret;

import io.lacuna.bifurcan.*;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * @author ztellman
 */
public class Utils {

  private Utils() {
  }

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <V> LinearList<V> toList(Iterable<V> vals) {
    LinearList<V> list = new LinearList<>();
    vals.forEach(list::addLast);
    return list;
  }

  public static <K, V> IMap<K, ISet<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, ISet<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearSet::new).add(v));
    return m;
  }

  /**
   * @return true if both sets hold the same elements, regardless of order
   */
  public static <V> boolean sameElements(ISet<V> a, ISet<V> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (V v : a) {
      if (!b.contains(v)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return a hash of the set which agrees with {@link #sameElements(ISet, ISet)}
   */
  public static <V> int unorderedHash(ISet<V> set) {
    int hash = 0;
    for (V v : set) {
      hash += v.hashCode();
    }
    return hash;
  }

  /**
   * @return every unordered pair of distinct elements, each pair appearing once
   */
  public static <V> IList<IList<V>> pairs(IList<V> vals) {
    LinearList<IList<V>> pairs = new LinearList<>();
    for (long i = 0; i < vals.size(); i++) {
      for (long j = i + 1; j < vals.size(); j++) {
        V a = vals.nth(i);
        V b = vals.nth(j);
        if (!a.equals(b)) {
          pairs.addLast(LinearList.of(a, b));
        }
      }
    }
    return pairs;
  }

  /**
   * @return the characters of {@code word}, each as a single-character string
   */
  public static IList<String> symbols(String word) {
    LinearList<String> symbols = new LinearList<>();
    word.codePoints().forEach(c -> symbols.addLast(new String(Character.toChars(c))));
    return symbols;
  }
}
