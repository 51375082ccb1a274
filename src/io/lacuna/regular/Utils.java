package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

public class Utils {

  public static <U, V> LinearSet<V> map(Iterable<U> set, Function<U, V> f) {
    if (set == null) {
      return null;
    }
    LinearSet<V> result = new LinearSet<>();
    set.forEach(x -> result.add(f.apply(x)));
    return result;
  }

  public static <V> LinearSet<V> union(LinearSet<V> accumulator, Iterable<V> vals) {
    vals.forEach(accumulator::add);
    return accumulator;
  }

  public static <V> boolean containsAny(ISet<V> set, Iterable<V> vals) {
    for (V v : vals) {
      if (set.contains(v)) {
        return true;
      }
    }
    return false;
  }

  public static <V extends Comparable<V>> List<V> sorted(Iterable<V> vals) {
    List<V> l = new ArrayList<>();
    vals.forEach(l::add);
    Collections.sort(l);
    return l;
  }

  // appends primes to `base` until it no longer collides
  public static String fresh(String base, Predicate<String> taken) {
    String label = base;
    while (taken.test(label)) {
      label = label + "'";
    }
    return label;
  }

  public static StateId freshState(String base, ISet<StateId> states) {
    return StateId.of(fresh(base, label -> states.contains(StateId.of(label))));
  }
}
